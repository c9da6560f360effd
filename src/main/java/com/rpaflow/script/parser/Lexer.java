package com.rpaflow.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class Lexer {
    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;

    private static final Map<String, TokenType> keywords;
    static {
        Map<String, TokenType> map = new HashMap<>();
        map.put("true", TokenType.TRUE);
        map.put("false", TokenType.FALSE);
        // Word spellings of the logical operators
        map.put("AND", TokenType.AND_AND);
        map.put("OR", TokenType.OR_OR);
        map.put("NOT", TokenType.BANG);
        keywords = Collections.unmodifiableMap(map);
    }

    public Lexer(String source) {
        this.source = source;
    }

    public List<Token> tokenize() {
        while (!isAtEnd()) {
            start = current;
            scanToken();
        }
        tokens.add(new Token(TokenType.EOF, "", null, current));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(': addToken(TokenType.LEFT_PAREN); break;
            case ')': addToken(TokenType.RIGHT_PAREN); break;
            case '+': addToken(TokenType.PLUS); break;
            case '-': addToken(TokenType.MINUS); break;
            case '*': addToken(TokenType.STAR); break;
            case '/': addToken(TokenType.SLASH); break;
            case '%': addToken(TokenType.PERCENT); break;
            case '!': addToken(match('=') ? TokenType.BANG_EQUAL : TokenType.BANG); break;
            case '=':
                if (match('=')) addToken(TokenType.EQUAL_EQUAL);
                else throw error("Invalid operator '=', use '==' for equality");
                break;
            case '<': addToken(match('=') ? TokenType.LESS_EQUAL : TokenType.LESS); break;
            case '>': addToken(match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER); break;
            case '&':
                if (match('&')) addToken(TokenType.AND_AND);
                else throw error("Invalid operator '&', use '&&' for logical AND");
                break;
            case '|':
                if (match('|')) addToken(TokenType.OR_OR);
                else throw error("Invalid operator '|', use '||' for logical OR");
                break;
            case '$':
            case '@':
                variable(c);
                break;
            case '"':
                string();
                break;
            case '\'':
                throw error("Single-quoted strings are not allowed. Use double quotes.");
            default:
                if (Character.isWhitespace(c)) break;
                if (isDigit(c)) number();
                else if (isAlpha(c)) identifier();
                else throw error("Unexpected character: " + c);
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        TokenType type = keywords.get(text);
        if (type == null) throw error("Unknown identifier: " + text);
        addToken(type);
    }

    private void variable(char sigil) {
        if (!isAlpha(peek())) throw error("Invalid variable name after '" + sigil + "'");
        while (isAlphaNumeric(peek())) advance();
        String name = source.substring(start + 1, current);
        addToken(TokenType.VARIABLE, name);
    }

    private void number() {
        while (isDigit(peek())) advance();
        if (peek() == '.' && isDigit(peekNext())) {
            advance();
            while (isDigit(peek())) advance();
        }
        double value = Double.parseDouble(source.substring(start, current));
        addToken(TokenType.NUMBER, value);
    }

    private void string() {
        while (!isAtEnd() && peek() != '"') advance();
        if (isAtEnd()) throw error("Unterminated string");
        advance();
        String value = source.substring(start + 1, current - 1);
        addToken(TokenType.STRING, value);
    }

    private boolean isAtEnd() { return current >= source.length(); }
    private char advance() { return source.charAt(current++); }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        current++;
        return true;
    }

    private char peek() { return isAtEnd() ? '\0' : source.charAt(current); }
    private char peekNext() { return (current + 1 >= source.length()) ? '\0' : source.charAt(current + 1); }

    private boolean isDigit(char c) { return c >= '0' && c <= '9'; }
    private boolean isAlpha(char c) { return Character.isLetter(c) || c == '_'; }
    private boolean isAlphaNumeric(char c) { return isAlpha(c) || isDigit(c); }

    private void addToken(TokenType type) { addToken(type, null); }
    private void addToken(TokenType type, Object literal) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, literal, start));
    }

    private ExpressionException error(String msg) {
        return ExpressionException.lex(msg);
    }
}
