package com.rpaflow.script;

import com.rpaflow.script.parser.Evaluator;
import com.rpaflow.script.parser.Expr;
import com.rpaflow.script.parser.ExpressionException;
import com.rpaflow.script.parser.Parser;
import com.rpaflow.script.parser.Value;
import com.rpaflow.script.parser.VariableResolver;

import java.util.Map;

/**
 * Entry point for the workflow expression language.
 *
 * - Types: number (double), boolean, string, undefined
 * - Operators: || && == != > >= < <= + - * / % ! (AND / OR / NOT as word spellings)
 * - Variables: $name or @name, resolved at evaluation time
 * - Strings: double quotes only, {expr} interpolation, {{ and }} as literal braces
 *
 * Every failure surfaces as an {@link ExpressionException} whose kind tells lex, parse or eval apart.
 */
public final class ExpressionEngine {

    private ExpressionEngine() {}

    /** Parses source into an expression tree. Throws LEX or PARSE failures. */
    public static Expr.ExprInterface parse(String source) {
        return Parser.parseExpression(source);
    }

    /** Parses raw text with {expr} holes (no surrounding quotes). */
    public static Expr.ExprInterface parseTemplate(String raw) {
        return Parser.parseTemplate(raw == null ? "" : raw);
    }

    public static Value evaluate(Expr.ExprInterface expr, VariableResolver resolver) {
        return new Evaluator(resolver).eval(expr);
    }

    public static Value evaluate(String source, VariableResolver resolver) {
        return evaluate(parse(source), resolver);
    }

    /** Evaluates against a plain map; names missing from the map are undefined variables. */
    public static Value evaluate(String source, Map<String, Value> variables) {
        return evaluate(parse(source), mapResolver(variables));
    }

    /** Returns null when the source parses, otherwise the parse or lex error message. */
    public static String syntaxError(String source) {
        try {
            parse(source);
            return null;
        } catch (ExpressionException e) {
            return e.getMessage();
        }
    }

    public static VariableResolver mapResolver(Map<String, Value> variables) {
        return name -> {
            Value v = variables.get(name);
            if (v == null) throw ExpressionException.eval("Undefined variable: " + name);
            return v;
        };
    }
}
