package com.rpaflow.script.parser;

public enum TokenType {
    // Single-character tokens
    LEFT_PAREN, RIGHT_PAREN,
    PLUS, MINUS, STAR, SLASH, PERCENT,

    // Operators
    BANG, BANG_EQUAL,
    EQUAL_EQUAL,
    GREATER, GREATER_EQUAL,
    LESS, LESS_EQUAL,
    AND_AND, OR_OR,

    // Literals
    VARIABLE, STRING, NUMBER,

    // Keywords
    TRUE, FALSE,

    EOF
}
