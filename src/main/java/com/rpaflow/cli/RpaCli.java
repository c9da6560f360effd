package com.rpaflow.cli;

import com.rpaflow.core.CoreConstants;
import com.rpaflow.core.execution.ExecutionEngine;
import com.rpaflow.core.execution.ExecutionEvent;
import com.rpaflow.core.execution.ExecutionEventJson;
import com.rpaflow.core.execution.ExecutionResult;
import com.rpaflow.core.execution.StopControl;
import com.rpaflow.core.ir.CompileError;
import com.rpaflow.core.ir.CompileException;
import com.rpaflow.core.ir.IrCompiler;
import com.rpaflow.core.ir.IrProgram;
import com.rpaflow.core.log.LogActivity;
import com.rpaflow.core.log.LogEntry;
import com.rpaflow.core.log.LogLevel;
import com.rpaflow.core.model.Project;
import com.rpaflow.core.model.ProjectLoader;
import com.rpaflow.debug.Debug;
import com.rpaflow.script.ExpressionEngine;
import com.rpaflow.script.parser.ExpressionException;
import com.rpaflow.script.parser.Value;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Runs a project file from the command line.
 *
 * Usage:
 *   java com.rpaflow.cli.RpaCli project.json [--verbose] [--json] [--var NAME=VALUE]... [--max-depth N]
 *
 * Exit codes: 0 completed, 1 load/compile/run failure, 2 usage error.
 */
public final class RpaCli {

    private static final String TAG = "rpa.cli";
    private static final String USAGE =
            "Usage: RpaCli <project.json> [--verbose] [--json] [--var NAME=VALUE]... [--max-depth N]";

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static final class Options {
        Path project;
        boolean verbose;
        boolean json;
        int maxDepth = CoreConstants.MAX_CALL_STACK_DEPTH;
        final Map<String, Value> vars = new LinkedHashMap<>();
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        Options opt;
        try {
            opt = parseArgs(args);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return 2;
        }
        if (opt.verbose) Debug.useSysOut();

        if (!Files.isRegularFile(opt.project)) {
            err.println("Project file not found: " + opt.project);
            return 1;
        }

        Project project;
        try {
            project = new ProjectLoader().load(opt.project);
        } catch (IOException | IllegalArgumentException e) {
            err.println("Failed to load project: " + e.getMessage());
            return 1;
        }

        IrProgram program;
        try {
            program = new IrCompiler().compile(project);
        } catch (CompileException e) {
            err.println("Compilation failed:");
            for (CompileError ce : e.getErrors()) err.println("  " + ce);
            return 1;
        }
        if (opt.verbose) {
            out.println("Compiled " + program.size() + " instructions:");
            out.print(program.dump());
        }

        ExecutionEngine engine = new ExecutionEngine(project, program, new StopControl());
        engine.setMaxCallDepth(opt.maxDepth);
        for (Map.Entry<String, Value> v : opt.vars.entrySet()) engine.setGlobal(v.getKey(), v.getValue());

        ExecutionEventJson json = new ExecutionEventJson();
        engine.setEventListener(event -> {
            if (opt.json) {
                if (event.getKind() != ExecutionEvent.Kind.STATE_SNAPSHOT || opt.verbose) {
                    out.println(json.toJsonString(event));
                }
            } else if (event instanceof ExecutionEvent.Log) {
                LogEntry entry = ((ExecutionEvent.Log) event).entry;
                if (shouldPrint(entry, opt.verbose)) {
                    (entry.getLevel() == LogLevel.ERROR ? err : out).println(entry.format());
                }
            }
        });

        ExecutionResult result = engine.run();
        Debug.get().d(TAG, "result " + result);

        if (!opt.json) {
            if (opt.verbose) {
                out.println("Global variables:");
                Map<String, Value> sorted = new TreeMap<>(engine.getGlobals().toValueMap());
                for (Map.Entry<String, Value> e : sorted.entrySet()) {
                    out.println("  " + e.getKey() + " = " + e.getValue() + " (" + e.getValue().typeName() + ")");
                }
            }
            out.println("Execution " + result.getStatus().name().toLowerCase() + " after " + result.getSteps()
                    + " steps" + (result.getMessage() == null ? "" : ": " + result.getMessage()));
        }
        return result.isErrored() ? 1 : 0;
    }

    /** User Log output, warnings and errors always; engine progress only with --verbose. */
    static boolean shouldPrint(LogEntry entry, boolean verbose) {
        if (CoreConstants.EXECUTION_COMPLETE_MARKER.equals(entry.getMessage())) return false;
        if (verbose) return true;
        return entry.getActivity() == LogActivity.LOG
                || entry.getLevel() == LogLevel.WARNING
                || entry.getLevel() == LogLevel.ERROR;
    }

    static Options parseArgs(String[] args) {
        Options opt = new Options();
        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            switch (a) {
                case "--verbose":
                    opt.verbose = true;
                    break;
                case "--json":
                    opt.json = true;
                    break;
                case "--var": {
                    if (i + 1 >= args.length) throw new IllegalArgumentException("--var needs NAME=VALUE");
                    String kv = args[++i];
                    int eq = kv.indexOf('=');
                    if (eq <= 0) throw new IllegalArgumentException("Bad --var: " + kv);
                    opt.vars.put(kv.substring(0, eq), parseValue(kv.substring(eq + 1)));
                    break;
                }
                case "--max-depth": {
                    if (i + 1 >= args.length) throw new IllegalArgumentException("--max-depth needs a number");
                    try {
                        opt.maxDepth = Integer.parseInt(args[++i]);
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException("Bad --max-depth: " + args[i]);
                    }
                    if (opt.maxDepth < 1) throw new IllegalArgumentException("--max-depth must be at least 1");
                    break;
                }
                default:
                    if (a.startsWith("--")) throw new IllegalArgumentException("Unknown option: " + a);
                    if (opt.project != null) throw new IllegalArgumentException("Only one project file allowed");
                    opt.project = Path.of(a);
            }
        }
        if (opt.project == null) throw new IllegalArgumentException("Missing project file");
        return opt;
    }

    /** Expression value when it evaluates without variables, otherwise the raw text. */
    static Value parseValue(String raw) {
        try {
            return ExpressionEngine.evaluate(raw, Collections.<String, Value>emptyMap());
        } catch (ExpressionException e) {
            return Value.string(raw);
        }
    }

    private RpaCli() {}
}
