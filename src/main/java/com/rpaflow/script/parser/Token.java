package com.rpaflow.script.parser;

public class Token {
    final TokenType type;
    public final String lexeme;
    final Object literal;
    public final int position;

    Token(TokenType type, String lexeme, Object literal, int position) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
        this.position = position;
    }

    public TokenType getType() { return type; }

    /** Human readable form used in parser error messages. */
    String describe() {
        switch (type) {
            case EOF: return "end of expression";
            case STRING: return "string \"" + literal + "\"";
            case VARIABLE: return "variable " + lexeme;
            default: return "'" + lexeme + "'";
        }
    }

    @Override
    public String toString() {
        return type + " " + lexeme;
    }
}
