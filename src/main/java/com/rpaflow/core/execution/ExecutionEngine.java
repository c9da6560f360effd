package com.rpaflow.core.execution;

import com.rpaflow.core.CoreConstants;
import com.rpaflow.core.ir.Instruction;
import com.rpaflow.core.ir.IrProgram;
import com.rpaflow.core.log.LogActivity;
import com.rpaflow.core.log.LogEntry;
import com.rpaflow.core.log.LogLevel;
import com.rpaflow.core.log.LogOutput;
import com.rpaflow.core.model.Project;
import com.rpaflow.core.model.Scenario;
import com.rpaflow.core.model.ScenarioParameter;
import com.rpaflow.core.model.VariablesBinding;
import com.rpaflow.core.variables.VariableScope;
import com.rpaflow.core.variables.Variables;
import com.rpaflow.debug.Debug;
import com.rpaflow.script.ExpressionEngine;
import com.rpaflow.script.parser.Expr;
import com.rpaflow.script.parser.ExpressionException;
import com.rpaflow.script.parser.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Single-threaded interpreter for an {@link IrProgram}.
 *
 * One engine instance serves exactly one run. State: the instruction pointer, the Global store,
 * a stack of call frames (each with its own local store) and a stack of error handlers.
 * Cancellation is observed before every instruction and inside Delay.
 *
 * {@link #run()} never throws: every outcome is an {@link ExecutionResult} and a terminal event.
 */
public final class ExecutionEngine {

    private static final String TAG = "rpa.vm";

    private final Project project;
    private final IrProgram program;
    private final StopControl stop;
    private final Variables globals;

    private int maxCallDepth = CoreConstants.MAX_CALL_STACK_DEPTH;
    private long snapshotIntervalMillis = CoreConstants.SNAPSHOT_INTERVAL_MS;
    private PowershellRunner powershellRunner = new ProcessPowershellRunner();
    private LogOutput logOutput;
    private Consumer<ExecutionEvent> eventListener = e -> { };

    private final List<CallFrame> frames = new ArrayList<>();
    private final List<ErrorHandlerEntry> handlers = new ArrayList<>();
    private final Map<Integer, Integer> whileIterations = new HashMap<>();
    private int ip;
    private long steps;
    private long startNanos;
    private long lastSnapshotNanos;
    private String currentNodeId;
    private boolean started;

    public ExecutionEngine(Project project, IrProgram program, StopControl stop) {
        this.project = project;
        this.program = program;
        this.stop = stop == null ? new StopControl() : stop;
        this.globals = new Variables(project.getVariables());
        this.logOutput = project.getExecutionLog();
    }

    // -------------------------
    // Configuration
    // -------------------------

    public void setMaxCallDepth(int maxCallDepth) {
        this.maxCallDepth = Math.max(1, maxCallDepth);
    }

    public void setSnapshotIntervalMillis(long millis) {
        this.snapshotIntervalMillis = Math.max(0, millis);
    }

    public void setPowershellRunner(PowershellRunner runner) {
        this.powershellRunner = runner == null ? new ProcessPowershellRunner() : runner;
    }

    /** Receives every log entry; defaults to the project's execution log. Null discards entries. */
    public void setLogOutput(LogOutput output) {
        this.logOutput = output;
    }

    public void setEventListener(Consumer<ExecutionEvent> listener) {
        this.eventListener = listener == null ? e -> { } : listener;
    }

    /** Run-scoped Global store, seeded from the project's declarations. */
    public Variables getGlobals() { return globals; }

    public StopControl getStopControl() { return stop; }

    /** Defines (or overwrites) a Global before the run starts. */
    public void setGlobal(String name, Value value) {
        if (started) throw new IllegalStateException("Engine already started");
        globals.define(name, value, VariableScope.GLOBAL);
    }

    // -------------------------
    // Run loop
    // -------------------------

    public ExecutionResult run() {
        if (started) throw new IllegalStateException("An engine runs only once");
        started = true;
        startNanos = System.nanoTime();
        lastSnapshotNanos = startNanos - Long.MAX_VALUE / 2;

        Scenario main = project.getMainScenario();
        frames.add(new CallFrame(-1, localsFor(main), main.getId(), Collections.emptyList()));
        ip = program.getEntryPoint();
        Debug.get().i(TAG, "run started at " + ip + " (" + program.size() + " instructions)");
        log(LogLevel.INFO, LogActivity.EXECUTION, "Execution started");

        try {
            while (true) {
                if (stop.isStopped()) return finishStopped();
                if (ip < 0 || ip >= program.size()) {
                    return fail("Instruction pointer out of range: " + ip, true);
                }
                snapshot(false);
                Instruction instruction = program.get(ip);
                steps++;
                try {
                    if (execute(instruction)) return finishCompleted();
                } catch (ScenarioStackOverflowException e) {
                    return fail(e.getMessage(), false);
                } catch (ExpressionException | ActivityException e) {
                    if (!routeError(e.getMessage())) return fail(e.getMessage(), true);
                }
            }
        } catch (RuntimeException e) {
            Debug.get().e(TAG, "internal failure at instruction " + ip, e);
            return fail("Internal error: " + e, true);
        }
    }

    /** Executes one instruction; returns true when the run is over. */
    private boolean execute(Instruction instruction) {
        switch (instruction.getOpcode()) {
            case DEBUG_MARKER:
                currentNodeId = ((Instruction.DebugMarker) instruction).nodeId;
                ip++;
                return false;

            case START: {
                String sid = ((Instruction.Start) instruction).scenarioId;
                log(LogLevel.INFO, LogActivity.START, "Starting scenario '" + sid + "'");
                ip++;
                return false;
            }

            case END:
                return executeEnd((Instruction.End) instruction);

            case LOG: {
                Instruction.Log log = (Instruction.Log) instruction;
                log(log.level, LogActivity.LOG, eval(log.message).toString());
                ip++;
                return false;
            }

            case DELAY: {
                long ms = ((Instruction.Delay) instruction).milliseconds;
                log(LogLevel.INFO, LogActivity.DELAY, "Waiting " + ms + " ms");
                stop.sleepInterruptible(ms);
                ip++;
                return false;
            }

            case SET_VAR: {
                Instruction.SetVar sv = (Instruction.SetVar) instruction;
                Value v = eval(sv.expr);
                Variables target = sv.scope == VariableScope.GLOBAL ? globals : frame().locals;
                if (!target.set(sv.var, v)) target.define(sv.var, v, sv.scope);
                log(LogLevel.INFO, LogActivity.SET_VARIABLE, sv.var + " = " + v);
                ip++;
                return false;
            }

            case EVALUATE: {
                Instruction.Evaluate ev = (Instruction.Evaluate) instruction;
                log(LogLevel.INFO, LogActivity.EVALUATE, ev.expr + " => " + eval(ev.expr));
                ip++;
                return false;
            }

            case JUMP:
                ip = ((Instruction.Jump) instruction).getTarget();
                return false;

            case JUMP_IF:
            case JUMP_IF_NOT: {
                Instruction.CondJump cj = (Instruction.CondJump) instruction;
                boolean cond = eval(cj.condition).toBool();
                log(LogLevel.INFO, LogActivity.IF_CONDITION, "Condition is " + cond);
                ip = cond == cj.jumpWhen ? cj.getTarget() : ip + 1;
                return false;
            }

            case LOOP_INIT: {
                Instruction.LoopInit li = (Instruction.LoopInit) instruction;
                Variables locals = frame().locals;
                if (!locals.set(li.index, Value.number(li.start))) {
                    locals.define(li.index, Value.number(li.start), VariableScope.SCENARIO);
                }
                ip++;
                return false;
            }

            case LOOP_LOG: {
                Instruction.LoopLog ll = (Instruction.LoopLog) instruction;
                log(LogLevel.INFO, LogActivity.LOOP,
                        "Loop " + ll.index + " from " + ll.start + " to " + ll.end + " step " + ll.step);
                ip++;
                return false;
            }

            case LOOP_CHECK: {
                Instruction.LoopCheck lc = (Instruction.LoopCheck) instruction;
                if (lc.step == 0) {
                    log(LogLevel.WARNING, LogActivity.LOOP, "Loop step is 0, skipping loop");
                    ip = lc.getEndTarget();
                    return false;
                }
                double current = indexValue(lc.index);
                boolean more = lc.step > 0 ? current <= lc.end : current >= lc.end;
                if (more) {
                    log(LogLevel.DEBUG, LogActivity.LOOP, lc.index + " = " + Value.formatNumber(current));
                    ip = lc.getBodyTarget();
                } else {
                    log(LogLevel.INFO, LogActivity.LOOP, "Loop finished");
                    ip = lc.getEndTarget();
                }
                return false;
            }

            case LOOP_NEXT: {
                Instruction.LoopNext ln = (Instruction.LoopNext) instruction;
                frame().locals.define(ln.index, Value.number(indexValue(ln.index) + ln.step), VariableScope.SCENARIO);
                ip = ln.getCheckTarget();
                return false;
            }

            case LOOP_BREAK:
                log(LogLevel.INFO, LogActivity.BREAK, "Breaking out of loop");
                ip = ((Instruction.LoopBreak) instruction).getEndTarget();
                return false;

            case LOOP_CONTINUE:
                log(LogLevel.INFO, LogActivity.CONTINUE, "Continuing with next iteration");
                ip = ((Instruction.LoopContinue) instruction).getCheckTarget();
                return false;

            case WHILE_CHECK: {
                Instruction.WhileCheck wc = (Instruction.WhileCheck) instruction;
                boolean cond = eval(wc.condition).toBool();
                if (cond) {
                    int n = whileIterations.merge(ip, 1, Integer::sum);
                    log(LogLevel.DEBUG, LogActivity.WHILE, "Iteration " + n);
                    ip = wc.getBodyTarget();
                } else {
                    Integer n = whileIterations.remove(ip);
                    log(LogLevel.INFO, LogActivity.WHILE,
                            "While finished after " + (n == null ? 0 : n) + " iterations");
                    ip = wc.getEndTarget();
                }
                return false;
            }

            case PUSH_ERROR_HANDLER:
                handlers.add(new ErrorHandlerEntry(((Instruction.PushErrorHandler) instruction).getCatchTarget(),
                        frames.size()));
                ip++;
                return false;

            case POP_ERROR_HANDLER:
                if (!handlers.isEmpty()) handlers.remove(handlers.size() - 1);
                ip++;
                return false;

            case CALL_SCENARIO:
                executeCall((Instruction.CallScenario) instruction);
                return false;

            case RUN_POWERSHELL: {
                log(LogLevel.INFO, LogActivity.RUN_POWERSHELL, "Running PowerShell script");
                String output = powershellRunner.run(((Instruction.RunPowershell) instruction).code);
                if (output != null && !output.isEmpty()) log(LogLevel.INFO, LogActivity.RUN_POWERSHELL, output);
                ip++;
                return false;
            }

            default:
                throw new IllegalStateException("Unknown opcode " + instruction.getOpcode());
        }
    }

    private void executeCall(Instruction.CallScenario call) {
        int target = program.startOf(call.scenarioId);
        Scenario callee = project.findScenario(call.scenarioId);
        if (target < 0 || callee == null) {
            throw new ActivityException("Scenario '" + call.scenarioId + "' does not exist");
        }
        if (frames.size() >= maxCallDepth) {
            throw new ScenarioStackOverflowException(maxCallDepth, call.scenarioId);
        }

        Variables locals = localsFor(callee);
        for (VariablesBinding b : call.parameters) {
            if (b.getDirection().copiesIn()) {
                Value v = readSource(b);
                if (v == null) throw ExpressionException.eval("Undefined variable: " + b.getSourceVarName());
                locals.define(b.getTargetVarName(), v, VariableScope.SCENARIO);
            } else if (!locals.contains(b.getTargetVarName())) {
                locals.createVariable(b.getTargetVarName(), VariableScope.SCENARIO);
            }
        }

        log(LogLevel.INFO, LogActivity.CALL_SCENARIO, "Calling scenario '" + callee.getName() + "'");
        frames.add(new CallFrame(ip + 1, locals, callee.getId(), call.parameters));
        ip = target;
    }

    private boolean executeEnd(Instruction.End end) {
        if (frames.size() == 1) {
            log(LogLevel.INFO, LogActivity.END, "Scenario '" + end.scenarioId + "' finished");
            return true;
        }
        CallFrame done = frames.remove(frames.size() - 1);
        CallFrame caller = frame();
        for (VariablesBinding b : done.bindings) {
            if (!b.getDirection().copiesOut()) continue;
            Value v = done.locals.get(b.getTargetVarName());
            writeSource(caller, b, v == null ? Value.undefined() : v);
        }
        // handlers pushed inside the returning scenario can no longer fire
        while (!handlers.isEmpty() && handlers.get(handlers.size() - 1).depth > frames.size()) {
            handlers.remove(handlers.size() - 1);
        }
        log(LogLevel.INFO, LogActivity.END, "Returned from scenario '" + done.scenarioId + "'");
        ip = done.returnAddress;
        return false;
    }

    // -------------------------
    // Error routing
    // -------------------------

    /** Transfers control to the innermost eligible handler; false when there is none. */
    private boolean routeError(String message) {
        setLastError(message);
        int depth = frames.size();
        int found = -1;
        for (int i = handlers.size() - 1; i >= 0; i--) {
            if (handlers.get(i).depth <= depth) {
                found = i;
                break;
            }
        }
        if (found < 0) return false;

        ErrorHandlerEntry handler = handlers.get(found);
        while (handlers.size() > found) handlers.remove(handlers.size() - 1);
        while (frames.size() > handler.depth) frames.remove(frames.size() - 1);
        log(LogLevel.ERROR, LogActivity.TRY_CATCH, "Caught error: " + message);
        ip = handler.catchTarget;
        return true;
    }

    private void setLastError(String message) {
        String name = CoreConstants.ERROR_VARIABLE_NAME;
        if (!globals.set(name, Value.string(message))) {
            globals.define(name, Value.string(message), VariableScope.GLOBAL);
        }
    }

    // -------------------------
    // Termination
    // -------------------------

    private ExecutionResult finishCompleted() {
        log(LogLevel.INFO, LogActivity.EXECUTION, "Execution completed");
        log(LogLevel.DEBUG, LogActivity.SYSTEM, CoreConstants.EXECUTION_COMPLETE_MARKER);
        snapshot(true);
        emit(new ExecutionEvent.Completed(false));
        Debug.get().i(TAG, "run completed after " + steps + " steps");
        return ExecutionResult.completed(steps);
    }

    private ExecutionResult finishStopped() {
        log(LogLevel.WARNING, LogActivity.EXECUTION, CoreConstants.STOPPED_MESSAGE);
        log(LogLevel.DEBUG, LogActivity.SYSTEM, CoreConstants.EXECUTION_COMPLETE_MARKER);
        snapshot(true);
        emit(new ExecutionEvent.Completed(true));
        Debug.get().i(TAG, "run stopped after " + steps + " steps");
        return ExecutionResult.stopped(CoreConstants.STOPPED_MESSAGE, steps);
    }

    /** Stack overflows pass {@code recordError = false} so the Global store is left as it was. */
    private ExecutionResult fail(String message, boolean recordError) {
        if (recordError) setLastError(message);
        log(LogLevel.ERROR, LogActivity.EXECUTION, message);
        log(LogLevel.DEBUG, LogActivity.SYSTEM, CoreConstants.EXECUTION_COMPLETE_MARKER);
        snapshot(true);
        emit(new ExecutionEvent.Error(message));
        Debug.get().w(TAG, "run failed after " + steps + " steps: " + message);
        return ExecutionResult.errored(message, steps);
    }

    // -------------------------
    // Helpers
    // -------------------------

    private CallFrame frame() {
        return frames.get(frames.size() - 1);
    }

    private Variables localsFor(Scenario scenario) {
        Variables locals = new Variables(scenario.getVariables());
        for (ScenarioParameter p : scenario.getParameters()) {
            if (!locals.contains(p.getVarName())) locals.createVariable(p.getVarName(), VariableScope.SCENARIO);
        }
        return locals;
    }

    /** Local store first, then Global. */
    private Value resolve(String name) {
        Value v = frame().locals.get(name);
        return v != null ? v : globals.get(name);
    }

    private Value eval(Expr.ExprInterface expr) {
        return ExpressionEngine.evaluate(expr, this::resolve);
    }

    private double indexValue(String index) {
        Value v = resolve(index);
        if (v == null) throw ExpressionException.eval("Undefined variable: " + index);
        return v.toNumber();
    }

    private Value readSource(VariablesBinding b) {
        if (b.getSourceScope() == VariableScope.GLOBAL) return globals.get(b.getSourceVarName());
        if (b.getSourceScope() == VariableScope.SCENARIO) return frame().locals.get(b.getSourceVarName());
        return resolve(b.getSourceVarName());
    }

    private void writeSource(CallFrame caller, VariablesBinding b, Value v) {
        String name = b.getSourceVarName();
        Variables target;
        if (b.getSourceScope() == VariableScope.GLOBAL) {
            target = globals;
        } else if (b.getSourceScope() == VariableScope.SCENARIO || caller.locals.contains(name)) {
            target = caller.locals;
        } else if (globals.contains(name)) {
            target = globals;
        } else {
            target = caller.locals;
        }
        if (!target.set(name, v)) {
            target.define(name, v, target == globals ? VariableScope.GLOBAL : VariableScope.SCENARIO);
        }
    }

    private void log(LogLevel level, LogActivity activity, String message) {
        LogEntry entry = new LogEntry(timestamp(), currentNodeId, level, activity, message);
        if (logOutput != null) logOutput.log(entry);
        emit(new ExecutionEvent.Log(entry));
    }

    private void snapshot(boolean force) {
        long now = System.nanoTime();
        if (!force && now - lastSnapshotNanos < snapshotIntervalMillis * 1_000_000L) return;
        lastSnapshotNanos = now;
        CallFrame f = frames.isEmpty() ? null : frame();
        emit(new ExecutionEvent.StateSnapshot(timestamp(), f == null ? null : f.scenarioId, globals.toValueMap(),
                f == null ? Collections.emptyMap() : f.locals.toValueMap()));
    }

    private void emit(ExecutionEvent event) {
        eventListener.accept(event);
    }

    /** Elapsed run time as {@code [mm:ss.mmm]}. */
    private String timestamp() {
        return formatElapsed((System.nanoTime() - startNanos) / 1_000_000L);
    }

    static String formatElapsed(long millis) {
        long minutes = millis / 60_000;
        long seconds = (millis / 1000) % 60;
        long ms = millis % 1000;
        return String.format("[%02d:%02d.%03d]", minutes, seconds, ms);
    }
}
