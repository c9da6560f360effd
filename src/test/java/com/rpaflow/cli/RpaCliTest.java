package com.rpaflow.cli;

import com.rpaflow.script.parser.Value;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class RpaCliTest {

    @TempDir
    Path tmp;

    private final ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();

    private int run(String... args) {
        return RpaCli.run(args,
                new PrintStream(outBytes, true, StandardCharsets.UTF_8),
                new PrintStream(errBytes, true, StandardCharsets.UTF_8));
    }

    private String out() { return outBytes.toString(StandardCharsets.UTF_8); }

    private String err() { return errBytes.toString(StandardCharsets.UTF_8); }

    private Path fixture(String name) throws Exception {
        Path target = tmp.resolve(name);
        try (InputStream in = getClass().getResourceAsStream("/projects/" + name)) {
            assertNotNull(in, name);
            Files.copy(in, target);
        }
        return target;
    }

    @Test
    void missing_argument_is_a_usage_error() {
        assertEquals(2, run());
        assertTrue(err().contains("Missing project file"));
        assertTrue(err().contains("Usage:"));
    }

    @Test
    void unknown_option_is_a_usage_error() {
        assertEquals(2, run("p.json", "--fast"));
        assertTrue(err().contains("Unknown option: --fast"));
    }

    @Test
    void bad_max_depth_is_a_usage_error() {
        assertEquals(2, run("p.json", "--max-depth", "zero"));
        assertEquals(2, run("p.json", "--max-depth", "0"));
    }

    @Test
    void missing_file_fails() {
        assertEquals(1, run(tmp.resolve("absent.json").toString()));
        assertTrue(err().contains("Project file not found"));
    }

    @Test
    void compile_errors_are_listed() throws Exception {
        assertEquals(1, run(fixture("broken.json").toString()));
        assertTrue(err().contains("Compilation failed:"));
        assertTrue(err().contains("E004"), err());
    }

    @Test
    void runs_counter_project() throws Exception {
        assertEquals(0, run(fixture("counter.json").toString()));
        assertTrue(out().contains("LOG: Total is 12"), out());
        assertTrue(out().contains("Execution completed after"), out());
        assertFalse(out().contains("SET VARIABLE"));
    }

    @Test
    void var_overrides_a_global() throws Exception {
        assertEquals(0, run(fixture("counter.json").toString(), "--var", "total=10"));
        assertTrue(out().contains("Total is 32"), out());
    }

    @Test
    void json_mode_prints_one_event_per_line() throws Exception {
        assertEquals(0, run(fixture("counter.json").toString(), "--json"));
        String[] lines = out().trim().split("\\R");
        assertTrue(lines.length > 1);
        for (String line : lines) assertTrue(line.startsWith("{\"type\":"), line);
        assertTrue(lines[lines.length - 1].contains("\"completed\""));
        assertFalse(out().contains("state_snapshot"));
    }

    @Test
    void parse_value_falls_back_to_text() {
        assertEquals(Value.number(42), RpaCli.parseValue("42"));
        assertEquals(Value.bool(true), RpaCli.parseValue("true"));
        assertEquals(Value.string("quoted"), RpaCli.parseValue("\"quoted\""));
        assertEquals(Value.string("plain words"), RpaCli.parseValue("plain words"));
    }
}
