package com.rpaflow.script.parser;

/**
 * Failure raised while lexing, parsing or evaluating an expression.
 * The message carries the bare error text; the kind tells which stage failed.
 */
public class ExpressionException extends RuntimeException {

    public enum Kind { LEX, PARSE, EVAL }

    private final Kind kind;

    public ExpressionException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }

    public static ExpressionException lex(String message) { return new ExpressionException(Kind.LEX, message); }
    public static ExpressionException parse(String message) { return new ExpressionException(Kind.PARSE, message); }
    public static ExpressionException eval(String message) { return new ExpressionException(Kind.EVAL, message); }
}
