package com.rpaflow.core.execution;

import com.rpaflow.core.CoreConstants;
import com.rpaflow.core.ir.IrCompiler;
import com.rpaflow.core.log.LogActivity;
import com.rpaflow.core.log.LogEntry;
import com.rpaflow.core.log.LogLevel;
import com.rpaflow.core.log.LogStorage;
import com.rpaflow.core.model.Activity;
import com.rpaflow.core.model.BranchType;
import com.rpaflow.core.model.Project;
import com.rpaflow.core.model.ProjectLoader;
import com.rpaflow.core.model.Scenario;
import com.rpaflow.core.model.VariableDirection;
import com.rpaflow.core.model.VariablesBinding;
import com.rpaflow.core.variables.VariableScope;
import com.rpaflow.core.variables.Variables;
import com.rpaflow.script.parser.Value;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static com.rpaflow.core.ScenarioBuilder.project;
import static com.rpaflow.core.ScenarioBuilder.scenario;
import static org.junit.jupiter.api.Assertions.*;

public class ExecutionEngineTest {

    private static final class Run {
        ExecutionEngine engine;
        ExecutionResult result;
        final List<ExecutionEvent> events = new ArrayList<>();
        final LogStorage log = new LogStorage(CoreConstants.MAX_LOG_ENTRIES);

        /** Messages of user Log activities, in order. */
        List<String> logs() {
            List<String> out = new ArrayList<>();
            for (LogEntry e : log.entries()) {
                if (e.getActivity() == LogActivity.LOG) out.add(e.getMessage());
            }
            return out;
        }

        boolean logged(LogActivity activity, String message) {
            for (LogEntry e : log.entries()) {
                if (e.getActivity() == activity && e.getMessage().equals(message)) return true;
            }
            return false;
        }

        Value global(String name) {
            return engine.getGlobals().get(name);
        }
    }

    private static Run run(Project project) {
        return run(project, 0, code -> "");
    }

    private static Run run(Project project, int maxDepth, PowershellRunner powershell) {
        Run r = new Run();
        r.engine = new ExecutionEngine(project, new IrCompiler().compile(project), new StopControl());
        r.engine.setLogOutput(r.log);
        r.engine.setEventListener(r.events::add);
        r.engine.setPowershellRunner(powershell);
        if (maxDepth > 0) r.engine.setMaxCallDepth(maxDepth);
        r.result = r.engine.run();
        return r;
    }

    private static Activity log(String message) {
        return new Activity.Log(LogLevel.INFO, message);
    }

    private static Activity set(String name, String value) {
        return new Activity.SetVariable(name, value, false);
    }

    private static Scenario loopScenario(long start, long end, long step) {
        return scenario("main").withStartEnd()
                .node("loop", new Activity.Loop(start, end, step, "i"))
                .node("body", log("@i"))
                .chain("start", "loop", "end")
                .edge("loop", "body", BranchType.LOOP_BODY)
                .build();
    }

    @Test
    void integral_number_logs_without_decimal() {
        Scenario main = scenario("main").withStartEnd()
                .node("set", set("x", "5"))
                .node("log", log("@x"))
                .chain("start", "set", "log", "end")
                .build();
        Run r = run(project(main));
        assertTrue(r.result.isCompleted(), r.result.toString());
        assertEquals(Collections.singletonList("5"), r.logs());

        int logEvents = 0;
        for (ExecutionEvent e : r.events) {
            if (e instanceof ExecutionEvent.Log && ((ExecutionEvent.Log) e).entry.getActivity() == LogActivity.LOG) {
                logEvents++;
                assertEquals("log", ((ExecutionEvent.Log) e).entry.getNodeId());
            }
        }
        assertEquals(1, logEvents);
    }

    @Test
    void loop_is_inclusive() {
        assertEquals(Arrays.asList("0", "1", "2", "3"), run(project(loopScenario(0, 3, 1))).logs());
    }

    @Test
    void loop_with_excluded_start_runs_zero_times() {
        Run r = run(project(loopScenario(3, 0, 1)));
        assertTrue(r.result.isCompleted());
        assertTrue(r.logs().isEmpty());
    }

    @Test
    void negative_step_descends() {
        assertEquals(Arrays.asList("3", "2", "1", "0"), run(project(loopScenario(3, 0, -1))).logs());
    }

    @Test
    void break_and_continue() {
        Scenario main = scenario("main").withStartEnd()
                .node("loop", new Activity.Loop(1, 5, 1, "i"))
                .node("skip", new Activity.IfCondition("$i == 2"))
                .node("cont", new Activity.Continue())
                .node("stop", new Activity.IfCondition("$i == 4"))
                .node("brk", new Activity.Break())
                .node("body", log("@i"))
                .chain("start", "loop", "end")
                .edge("loop", "skip", BranchType.LOOP_BODY)
                .edge("skip", "cont", BranchType.TRUE_BRANCH)
                .edge("skip", "stop", BranchType.FALSE_BRANCH)
                .edge("stop", "brk", BranchType.TRUE_BRANCH)
                .edge("stop", "body", BranchType.FALSE_BRANCH)
                .build();
        Run r = run(project(main));
        assertTrue(r.result.isCompleted(), r.result.toString());
        assertEquals(Arrays.asList("1", "3"), r.logs());
    }

    @Test
    void while_loop_counts_iterations() {
        Scenario main = scenario("main").withStartEnd()
                .node("init", set("i", "0"))
                .node("while", new Activity.While("$i < 3"))
                .node("inc", set("i", "$i + 1"))
                .node("log", log("@i"))
                .chain("start", "init", "while", "log", "end")
                .edge("while", "inc", BranchType.LOOP_BODY)
                .build();
        Run r = run(project(main));
        assertEquals(Collections.singletonList("3"), r.logs());
        assertTrue(r.logged(LogActivity.WHILE, "While finished after 3 iterations"));
    }

    @Test
    void if_merges_after_either_branch() {
        Scenario main = scenario("main").withStartEnd()
                .node("if", new Activity.IfCondition("$x > 1"))
                .node("big", log("\"big\""))
                .node("small", log("\"small\""))
                .node("after", log("\"after\""))
                .variable("x", Value.number(0))
                .chain("start", "if")
                .edge("if", "big", BranchType.TRUE_BRANCH)
                .edge("if", "small", BranchType.FALSE_BRANCH)
                .edge("if", "after")
                .chain("after", "end")
                .build();
        assertEquals(Arrays.asList("small", "after"), run(project(main)).logs());
    }

    @Test
    void inner_handler_catches_once_and_outer_stays_active() {
        Scenario main = scenario("main").withStartEnd()
                .node("outer", new Activity.TryCatch())
                .node("inner", new Activity.TryCatch())
                .node("bad1", new Activity.Evaluate("1 / 0"))
                .node("innerCatch", log("\"inner\""))
                .node("bad2", new Activity.Evaluate("$nope + 1"))
                .node("outerCatch", log("\"outer\""))
                .chain("start", "outer", "end")
                .edge("outer", "inner", BranchType.TRY_BRANCH)
                .edge("outer", "outerCatch", BranchType.CATCH_BRANCH)
                .edge("inner", "bad1", BranchType.TRY_BRANCH)
                .edge("inner", "innerCatch", BranchType.CATCH_BRANCH)
                .edge("inner", "bad2")
                .build();
        Run r = run(project(main));
        assertTrue(r.result.isCompleted(), r.result.toString());
        assertEquals(Arrays.asList("inner", "outer"), r.logs());
        assertEquals(Value.string("Undefined variable: nope"), r.global(CoreConstants.ERROR_VARIABLE_NAME));
    }

    @Test
    void uncaught_error_ends_the_run() {
        Scenario main = scenario("main").withStartEnd()
                .node("bad", new Activity.IfCondition("1 + 1"))
                .node("never", log("\"never\""))
                .chain("start", "bad")
                .edge("bad", "never", BranchType.TRUE_BRANCH)
                .edge("bad", "end", BranchType.FALSE_BRANCH)
                .chain("never", "end")
                .build();
        Run r = run(project(main));
        assertTrue(r.result.isErrored());
        assertEquals("Expected boolean", r.result.getMessage());
        assertTrue(r.logs().isEmpty());
        assertEquals(Value.string("Expected boolean"), r.global(CoreConstants.ERROR_VARIABLE_NAME));

        ExecutionEvent last = r.events.get(r.events.size() - 1);
        assertTrue(last instanceof ExecutionEvent.Error);
        assertEquals("Expected boolean", ((ExecutionEvent.Error) last).message);
    }

    @Test
    void callee_locals_do_not_leak() {
        Scenario main = scenario("main").withStartEnd()
                .node("set", set("x", "1"))
                .node("call", new Activity.CallScenario("sub", Collections.emptyList()))
                .node("log", log("@x"))
                .chain("start", "set", "call", "log", "end")
                .build();
        Scenario sub = scenario("sub").withStartEnd()
                .node("set", set("x", "99"))
                .node("log", log("@x"))
                .chain("start", "set", "log", "end")
                .build();
        assertEquals(Arrays.asList("99", "1"), run(project(main, sub)).logs());
    }

    @Test
    void in_out_and_out_bindings_copy_back() {
        Scenario main = scenario("main").withStartEnd()
                .node("set", set("x", "5"))
                .node("call", new Activity.CallScenario("calc", Arrays.asList(
                        new VariablesBinding("n", "x", VariableDirection.IN_OUT),
                        new VariablesBinding("r", "result", VariableDirection.OUT))))
                .node("log", log("\"{$x} {$result}\""))
                .chain("start", "set", "call", "log", "end")
                .build();
        Scenario calc = scenario("calc").withStartEnd()
                .param("n", VariableDirection.IN_OUT)
                .param("r", VariableDirection.OUT)
                .node("double", set("n", "$n * 2"))
                .node("answer", set("r", "42"))
                .chain("start", "double", "answer", "end")
                .build();
        Run r = run(project(main, calc));
        assertTrue(r.result.isCompleted(), r.result.toString());
        assertEquals(Collections.singletonList("10 42"), r.logs());
    }

    @Test
    void local_shadows_global() {
        Variables globals = new Variables();
        globals.define("x", Value.string("global"), VariableScope.GLOBAL);
        Scenario main = scenario("main").withStartEnd()
                .node("log", log("@x"))
                .variable("x", Value.string("local"))
                .chain("start", "log", "end")
                .build();
        Run r = run(project(globals, main));
        assertEquals(Collections.singletonList("local"), r.logs());
        assertEquals(Value.string("global"), r.global("x"));
    }

    @Test
    void global_assignment_is_visible_to_callees() {
        Scenario main = scenario("main").withStartEnd()
                .node("set", new Activity.SetVariable("shared", "\"from main\"", true))
                .node("call", new Activity.CallScenario("sub", Collections.emptyList()))
                .chain("start", "set", "call", "end")
                .build();
        Scenario sub = scenario("sub").withStartEnd()
                .node("log", log("@shared"))
                .chain("start", "log", "end")
                .build();
        assertEquals(Collections.singletonList("from main"), run(project(main, sub)).logs());
    }

    @Test
    void runaway_recursion_overflows_without_touching_globals() {
        Variables globals = new Variables();
        globals.define("g", Value.number(1), VariableScope.GLOBAL);
        Scenario main = scenario("main").withStartEnd()
                .node("try", new Activity.TryCatch())
                .node("call", new Activity.CallScenario("rec", Collections.emptyList()))
                .node("caught", log("\"caught\""))
                .chain("start", "try", "end")
                .edge("try", "call", BranchType.TRY_BRANCH)
                .edge("try", "caught", BranchType.CATCH_BRANCH)
                .build();
        Scenario rec = scenario("rec").withStartEnd()
                .node("call", new Activity.CallScenario("rec", Collections.emptyList()))
                .chain("start", "call", "end")
                .build();

        Run r = run(project(globals, main, rec), 10, code -> "");
        assertTrue(r.result.isErrored());
        assertTrue(r.result.getMessage().startsWith("Maximum call depth of 10 exceeded"), r.result.getMessage());
        assertTrue(r.logs().isEmpty());
        assertEquals(1, r.engine.getGlobals().size());
        assertEquals(Value.number(1), r.global("g"));
        assertNull(r.global(CoreConstants.ERROR_VARIABLE_NAME));
    }

    @Test
    void error_branch_catches_activity_failure() {
        Scenario main = scenario("main").withStartEnd()
                .node("ps", new Activity.RunPowershell("exit 1"))
                .node("onError", log("@last_error"))
                .chain("start", "ps", "end")
                .edge("ps", "onError", BranchType.ERROR_BRANCH)
                .build();
        Run r = run(project(main), 0, code -> {
            throw new ActivityException("boom");
        });
        assertTrue(r.result.isCompleted(), r.result.toString());
        assertEquals(Collections.singletonList("boom"), r.logs());
    }

    @Test
    void error_inside_callee_unwinds_to_caller_handler() {
        Scenario main = scenario("main").withStartEnd()
                .node("call", new Activity.CallScenario("sub", Collections.emptyList()))
                .node("onError", log("\"handled\""))
                .node("after", log("\"after\""))
                .chain("start", "call", "after", "end")
                .edge("call", "onError", BranchType.ERROR_BRANCH)
                .build();
        Scenario sub = scenario("sub").withStartEnd()
                .node("bad", new Activity.Evaluate("1 / 0"))
                .chain("start", "bad", "end")
                .build();
        Run r = run(project(main, sub));
        assertTrue(r.result.isCompleted(), r.result.toString());
        assertEquals(Arrays.asList("handled", "after"), r.logs());
    }

    @Test
    void powershell_output_is_logged() {
        Scenario main = scenario("main").withStartEnd()
                .node("ps", new Activity.RunPowershell("Write-Output hi"))
                .chain("start", "ps", "end")
                .build();
        Run r = run(project(main), 0, code -> "ran: " + code);
        assertTrue(r.logged(LogActivity.RUN_POWERSHELL, "ran: Write-Output hi"));
    }

    @Test
    void final_snapshot_carries_variables() {
        Scenario main = scenario("main").withStartEnd()
                .node("set", new Activity.SetVariable("total", "2 + 2", true))
                .node("local", set("y", "\"a\""))
                .chain("start", "set", "local", "end")
                .build();
        Run r = run(project(main));

        ExecutionEvent.StateSnapshot last = null;
        for (ExecutionEvent e : r.events) {
            if (e instanceof ExecutionEvent.StateSnapshot) last = (ExecutionEvent.StateSnapshot) e;
        }
        assertNotNull(last);
        assertEquals(Value.number(4), last.globalVars.get("total"));
        assertEquals(Value.string("a"), last.scenarioVars.get("y"));
        assertTrue(r.events.get(r.events.size() - 1) instanceof ExecutionEvent.Completed);
        assertTrue(r.logged(LogActivity.SYSTEM, CoreConstants.EXECUTION_COMPLETE_MARKER));
    }

    @Test
    void stop_during_long_delay_returns_quickly() throws Exception {
        Scenario main = scenario("main").withStartEnd()
                .node("wait", new Activity.Delay(10_000))
                .node("log", log("\"too late\""))
                .chain("start", "wait", "log", "end")
                .build();
        Project p = project(main);
        ExecutionRunner runner = new ExecutionRunner(
                new ExecutionEngine(p, new IrCompiler().compile(p), new StopControl()));

        long t0 = System.nanoTime();
        runner.start();
        Thread.sleep(150);
        runner.stop();
        ExecutionResult result = runner.awaitResult(2, TimeUnit.SECONDS);
        long elapsedMs = (System.nanoTime() - t0) / 1_000_000L;

        assertNotNull(result, "run did not stop");
        assertTrue(result.isStopped());
        assertEquals(CoreConstants.STOPPED_MESSAGE, result.getMessage());
        assertTrue(elapsedMs < 2_000, "took " + elapsedMs + " ms");
        assertFalse(runner.isRunning());

        boolean sawCompleted = false;
        for (ExecutionEvent e : runner.events()) {
            if (e instanceof ExecutionEvent.Completed) sawCompleted = ((ExecutionEvent.Completed) e).stopped;
            if (e instanceof ExecutionEvent.Log) {
                assertNotEquals("too late", ((ExecutionEvent.Log) e).entry.getMessage());
            }
        }
        assertTrue(sawCompleted);
    }

    @Test
    void engine_runs_only_once() {
        Project p = project(scenario("main").withStartEnd().chain("start", "end").build());
        ExecutionEngine engine = new ExecutionEngine(p, new IrCompiler().compile(p), new StopControl());
        engine.setLogOutput(null);
        assertTrue(engine.run().isCompleted());
        assertThrows(IllegalStateException.class, engine::run);
    }

    @Test
    void counter_project_doubles_the_loop_sum() throws Exception {
        Project p;
        try (InputStream in = getClass().getResourceAsStream("/projects/counter.json")) {
            assertNotNull(in);
            p = new ProjectLoader().load(in);
        }
        Run r = run(p);
        assertTrue(r.result.isCompleted(), r.result.toString());
        assertEquals(Value.number(12), r.global("total"));
        assertEquals(Collections.singletonList("Total is 12"), r.logs());
        assertTrue(r.logged(LogActivity.CALL_SCENARIO, "Calling scenario 'Double'"));
    }

    @Test
    void elapsed_time_format() {
        assertEquals("[00:00.000]", ExecutionEngine.formatElapsed(0));
        assertEquals("[01:02.003]", ExecutionEngine.formatElapsed(62_003));
    }
}
