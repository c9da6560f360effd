package com.rpaflow.core.variables;

import com.rpaflow.script.parser.Value;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class VariablesTest {

    @Test
    void set_on_missing_variable_is_a_no_op() {
        Variables vars = new Variables();
        assertFalse(vars.set("x", Value.number(1)));
        assertFalse(vars.contains("x"));
        assertNull(vars.get("x"));
    }

    @Test
    void create_always_resets_to_undefined() {
        Variables vars = new Variables();
        vars.define("x", Value.number(5), VariableScope.SCENARIO);
        assertEquals(Value.number(5), vars.get("x"));

        vars.createVariable("x", VariableScope.SCENARIO);
        assertEquals(Value.undefined(), vars.get("x"));
        assertTrue(vars.set("x", Value.string("again")));
        assertEquals(Value.string("again"), vars.get("x"));
    }

    @Test
    void set_keeps_the_declared_scope() {
        Variables vars = new Variables();
        vars.createVariable("g", VariableScope.GLOBAL);
        vars.set("g", Value.bool(true));
        assertEquals(VariableScope.GLOBAL, vars.getScope("g"));
    }

    @Test
    void copies_are_independent() {
        Variables a = new Variables();
        a.define("x", Value.number(1), VariableScope.SCENARIO);
        Variables b = new Variables(a);
        b.set("x", Value.number(2));
        assertEquals(Value.number(1), a.get("x"));
        assertEquals(Value.number(2), b.get("x"));
    }

    @Test
    void merge_overlays_the_other_store() {
        Variables a = new Variables();
        a.define("x", Value.number(1), VariableScope.GLOBAL);
        a.define("y", Value.number(1), VariableScope.GLOBAL);
        Variables b = new Variables();
        b.define("y", Value.number(2), VariableScope.SCENARIO);

        Variables merged = a.merge(b);
        assertEquals(2, merged.size());
        assertEquals(Value.number(2), merged.get("y"));
        assertEquals(VariableScope.SCENARIO, merged.getScope("y"));
        assertEquals(Value.number(1), a.get("y"));
    }
}
