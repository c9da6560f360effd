package com.rpaflow.script;

import com.rpaflow.script.parser.Expr;
import com.rpaflow.script.parser.ExpressionException;
import com.rpaflow.script.parser.Value;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ExpressionEngineTest {

    private static Value eval(String src) {
        return ExpressionEngine.evaluate(src, new HashMap<>());
    }

    private static Value eval(String src, Map<String, Value> vars) {
        return ExpressionEngine.evaluate(src, vars);
    }

    private static ExpressionException fails(String src, Map<String, Value> vars) {
        return assertThrows(ExpressionException.class, () -> ExpressionEngine.evaluate(src, vars));
    }

    private static ExpressionException fails(String src) {
        return fails(src, new HashMap<>());
    }

    @Test
    void precedence_multiplication_binds_tighter() {
        assertEquals(Value.number(11), eval("3 + 4 * 2"));
        assertEquals(Value.number(14), eval("(3 + 4) * 2"));
        assertEquals(Value.number(1), eval("7 % 3"));
        assertEquals(Value.number(-2), eval("-(1 + 1)"));
    }

    @Test
    void comparison_with_logical_and() {
        Map<String, Value> vars = new HashMap<>();
        vars.put("x", Value.number(7));
        vars.put("y", Value.number(3));
        assertEquals(Value.bool(true), eval("$x > 5 && $y < 10", vars));

        vars.put("x", Value.number(3));
        assertEquals(Value.bool(false), eval("$x > 5 && $y < 10", vars));
    }

    @Test
    void keyword_spellings_match_symbols() {
        assertEquals(Value.bool(true), eval("true AND NOT false"));
        assertEquals(Value.bool(true), eval("false OR true"));
    }

    @Test
    void at_sigil_reads_variables_too() {
        Map<String, Value> vars = new HashMap<>();
        vars.put("count", Value.number(2));
        assertEquals(Value.number(4), eval("@count * 2", vars));
    }

    @Test
    void single_quoted_strings_never_lex() {
        for (String src : new String[] {"'a'", "''", "'hello world'", "1 + 'x'"}) {
            ExpressionException e = fails(src);
            assertEquals(ExpressionException.Kind.LEX, e.getKind(), src);
            assertEquals("Single-quoted strings are not allowed. Use double quotes.", e.getMessage());
        }
    }

    @Test
    void pinned_lex_and_parse_messages() {
        assertEquals("Empty expression", fails("   ").getMessage());
        assertEquals("Unknown identifier: foo", fails("foo + 1").getMessage());
        assertEquals("Invalid operator '=', use '==' for equality", fails("1 = 1").getMessage());
        assertEquals("Invalid operator '&', use '&&' for logical AND", fails("true & false").getMessage());
        assertEquals("Invalid operator '|', use '||' for logical OR", fails("true | false").getMessage());
        assertEquals("Unterminated string", fails("\"abc").getMessage());
        assertEquals("Unexpected end of expression", fails("1 +").getMessage());
    }

    @Test
    void comparisons_do_not_chain() {
        ExpressionException e = fails("1 < 2 < 3");
        assertEquals(ExpressionException.Kind.PARSE, e.getKind());
    }

    @Test
    void evaluation_errors() {
        assertEquals("Division by zero", fails("1 / 0").getMessage());
        assertEquals("Division by zero", fails("5 % 0").getMessage());
        assertEquals("Expected number", fails("\"a\" * 2").getMessage());
        assertEquals("Expected boolean", fails("1 && true").getMessage());
        assertEquals("Type mismatch in '=='", fails("1 == \"1\"").getMessage());
        assertEquals("Type mismatch in '!='", fails("true != 1").getMessage());
        assertEquals("Undefined variable: missing", fails("$missing + 1").getMessage());
        assertEquals("Cannot use + with boolean on left side", fails("true + 1").getMessage());
        assertEquals(ExpressionException.Kind.EVAL, fails("1 / 0").getKind());
    }

    @Test
    void unary_plus_coerces_to_number() {
        assertEquals(Value.number(3), eval("+3"));
        assertEquals(Value.number(1), eval("+true"));
        assertEquals(Value.number(-2), eval("-+2"));
        assertEquals("Expected number", fails("+\"a\"").getMessage());
    }

    @Test
    void undefined_on_left_of_plus_fails() {
        Map<String, Value> vars = new HashMap<>();
        vars.put("u", Value.undefined());
        assertEquals("Cannot use + with undefined", fails("$u + 1", vars).getMessage());
    }

    @Test
    void string_concatenation_renders_numbers_without_decimals() {
        assertEquals(Value.string("n=5"), eval("\"n=\" + 5"));
        assertEquals(Value.string("x2.5"), eval("\"x\" + 2.5"));
        assertEquals(Value.string("ok true"), eval("\"ok \" + true"));
    }

    @Test
    void booleans_coerce_in_arithmetic_on_the_right() {
        assertEquals(Value.number(2), eval("1 + true"));
        assertEquals(Value.bool(true), eval("true > 0"));
    }

    @Test
    void short_circuit_skips_the_right_side() {
        assertEquals(Value.bool(false), eval("false && $nope"));
        assertEquals(Value.bool(true), eval("true || 1 / 0 > 1"));
    }

    @Test
    void interpolated_strings() {
        Map<String, Value> vars = new HashMap<>();
        vars.put("name", Value.string("Ada"));
        vars.put("n", Value.number(3));
        assertEquals(Value.string("Hello Ada, 4 items"), eval("\"Hello {$name}, {$n + 1} items\"", vars));
        assertEquals(Value.string("{literal}"), eval("\"{{literal}}\""));
    }

    @Test
    void interpolation_errors() {
        assertEquals("Unclosed brace in interpolated string", fails("\"a {$x\"").getMessage());
        assertEquals("Empty expression in interpolated string", fails("\"a {  } b\"").getMessage());
        assertEquals("Unmatched closing brace in interpolated string", fails("\"a } b\"").getMessage());
    }

    @Test
    void templates_without_quotes() {
        Map<String, Value> vars = new HashMap<>();
        vars.put("x", Value.number(5));
        Value v = ExpressionEngine.evaluate(ExpressionEngine.parseTemplate("x is {$x}"), ExpressionEngine.mapResolver(vars));
        assertEquals(Value.string("x is 5"), v);
        assertEquals(Value.string("plain text"),
                ExpressionEngine.evaluate(ExpressionEngine.parseTemplate("plain text"), ExpressionEngine.mapResolver(vars)));
    }

    @Test
    void syntax_error_reports_without_throwing() {
        assertNull(ExpressionEngine.syntaxError("$a >= 2"));
        assertEquals("Unknown identifier: abc", ExpressionEngine.syntaxError("abc"));
    }

    @Test
    void parsed_expression_re_evaluates_against_new_state() {
        Map<String, Value> vars = new HashMap<>();
        vars.put("i", Value.number(1));
        Expr.ExprInterface expr = ExpressionEngine.parse("$i * 10");
        assertEquals(Value.number(10), ExpressionEngine.evaluate(expr, ExpressionEngine.mapResolver(vars)));
        vars.put("i", Value.number(2));
        assertEquals(Value.number(20), ExpressionEngine.evaluate(expr, ExpressionEngine.mapResolver(vars)));
    }
}
