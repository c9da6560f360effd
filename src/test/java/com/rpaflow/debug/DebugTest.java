package com.rpaflow.debug;

import com.rpaflow.core.execution.ExecutionEngine;
import com.rpaflow.core.execution.ExecutionResult;
import com.rpaflow.core.execution.StopControl;
import com.rpaflow.core.ir.IrCompiler;
import com.rpaflow.core.ir.IrProgram;
import com.rpaflow.core.log.LogLevel;
import com.rpaflow.core.model.Activity;
import com.rpaflow.core.model.Project;
import com.rpaflow.core.model.Scenario;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.rpaflow.core.ScenarioBuilder.project;
import static com.rpaflow.core.ScenarioBuilder.scenario;
import static org.junit.jupiter.api.Assertions.*;

public class DebugTest {

    @AfterEach
    void restore() {
        Debug.get().setSink(null);
        Debug.get().setMinLevel(DebugLevel.TRACE);
    }

    @Test
    void hub_starts_with_a_working_sink() {
        assertNotNull(Debug.get().getSink());
        assertDoesNotThrow(() -> Debug.get().w("test", "nobody is listening"));
    }

    @Test
    void compile_and_run_without_installing_a_sink() {
        Scenario main = scenario("main").withStartEnd()
                .node("log", new Activity.Log(LogLevel.INFO, "\"quiet\""))
                .chain("start", "log", "end")
                .build();
        Project p = project(main);
        IrProgram program = new IrCompiler().compile(p);
        ExecutionEngine engine = new ExecutionEngine(p, program, new StopControl());
        engine.setLogOutput(null);
        ExecutionResult result = engine.run();
        assertTrue(result.isCompleted(), result.toString());
    }

    @Test
    void entries_below_min_level_are_dropped() {
        List<String> seen = new ArrayList<>();
        Debug.get().setSink((level, tag, message, error) -> seen.add(level + " " + tag + " " + message));
        Debug.get().setMinLevel(DebugLevel.WARN);

        Debug.get().d("rpa.vm", "step");
        Debug.get().w("rpa.vm", "slow");
        Debug.get().e("rpa.vm", "boom", new IllegalStateException("x"));

        assertEquals(2, seen.size());
        assertEquals("WARN rpa.vm slow", seen.get(0));
        assertEquals("ERROR rpa.vm boom", seen.get(1));
    }

    @Test
    void null_sink_falls_back_to_noop() {
        Debug.get().setSink(null);
        assertNotNull(Debug.get().getSink());
    }
}
