package com.rpaflow.script.parser;

import java.util.ArrayList;
import java.util.List;

import com.rpaflow.script.parser.Expr.Binary;
import com.rpaflow.script.parser.Expr.Interpolated;
import com.rpaflow.script.parser.Expr.Literal;
import com.rpaflow.script.parser.Expr.Logical;
import com.rpaflow.script.parser.Expr.Segment;
import com.rpaflow.script.parser.Expr.Unary;
import com.rpaflow.script.parser.Expr.Variable;

/**
 * Recursive descent parser for the condition/assignment language.
 *
 * Precedence, lowest first: || , && , one comparison (non-chaining), + - , * / % , unary ! - + , primary.
 */
public class Parser {
    private final List<Token> tokens;
    private int current = 0;

    public Parser(List<Token> tokens) { this.tokens = tokens; }

    /** Parses a full expression; leftover tokens are an error. */
    public Expr.ExprInterface parse() {
        if (isAtEnd()) throw error("Empty expression");
        Expr.ExprInterface expr = or();
        if (!isAtEnd()) throw error("Unexpected token: " + peek().describe());
        return expr;
    }

    /** Lexes and parses source text in one go. */
    public static Expr.ExprInterface parseExpression(String source) {
        if (source == null || source.trim().isEmpty()) throw error("Empty expression");
        return new Parser(new Lexer(source).tokenize()).parse();
    }

    /**
     * Parses raw template text such as {@code Hello {$name}!}. Literal-only text collapses
     * to a string constant.
     */
    public static Expr.ExprInterface parseTemplate(String raw) {
        List<Segment> segments = templateSegments(raw);
        if (segments.size() == 1 && segments.get(0).isLiteral()) {
            return new Literal(Value.string(segments.get(0).literal));
        }
        return new Interpolated(segments);
    }

    private Expr.ExprInterface or() {
        Expr.ExprInterface expr = and();
        while (match(TokenType.OR_OR)) {
            Token op = previous();
            Expr.ExprInterface right = and();
            expr = new Logical(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface and() {
        Expr.ExprInterface expr = comparison();
        while (match(TokenType.AND_AND)) {
            Token op = previous();
            Expr.ExprInterface right = comparison();
            expr = new Logical(expr, op, right);
        }
        return expr;
    }

    // Single level: "a < b < c" leaves "< c" behind and fails as an unexpected token.
    private Expr.ExprInterface comparison() {
        Expr.ExprInterface expr = term();
        if (match(TokenType.EQUAL_EQUAL, TokenType.BANG_EQUAL,
                TokenType.GREATER, TokenType.GREATER_EQUAL, TokenType.LESS, TokenType.LESS_EQUAL)) {
            Token op = previous();
            Expr.ExprInterface right = term();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface term() {
        Expr.ExprInterface expr = factor();
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            Token op = previous();
            Expr.ExprInterface right = factor();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface factor() {
        Expr.ExprInterface expr = unary();
        while (match(TokenType.STAR, TokenType.SLASH, TokenType.PERCENT)) {
            Token op = previous();
            Expr.ExprInterface right = unary();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface unary() {
        if (match(TokenType.BANG, TokenType.MINUS, TokenType.PLUS)) {
            Token op = previous();
            Expr.ExprInterface right = unary();
            return new Unary(op, right);
        }
        return primary();
    }

    private Expr.ExprInterface primary() {
        if (match(TokenType.FALSE)) return new Literal(Value.bool(false));
        if (match(TokenType.TRUE)) return new Literal(Value.bool(true));
        if (match(TokenType.NUMBER)) return new Literal(Value.number((Double) previous().literal));
        if (match(TokenType.STRING)) return stringLiteral((String) previous().literal);
        if (match(TokenType.VARIABLE)) return new Variable((String) previous().literal);

        if (match(TokenType.LEFT_PAREN)) {
            Expr.ExprInterface expr = or();
            consume(TokenType.RIGHT_PAREN, "')'");
            return expr;
        }

        if (isAtEnd()) throw error("Unexpected end of expression");
        throw error("Unexpected token: " + peek().describe());
    }

    private static Expr.ExprInterface stringLiteral(String text) {
        if (text.indexOf('{') < 0 && text.indexOf('}') < 0) {
            return new Literal(Value.string(text));
        }
        return parseTemplate(text);
    }

    private static List<Segment> templateSegments(String raw) {
        List<Segment> segments = new ArrayList<>();
        StringBuilder literal = new StringBuilder();
        int i = 0;
        int n = raw.length();

        while (i < n) {
            char c = raw.charAt(i);
            if (c == '{') {
                if (i + 1 < n && raw.charAt(i + 1) == '{') {
                    literal.append('{');
                    i += 2;
                    continue;
                }
                if (literal.length() > 0) {
                    segments.add(Segment.literal(literal.toString()));
                    literal.setLength(0);
                }
                int exprStart = ++i;
                int depth = 1;
                while (i < n) {
                    char d = raw.charAt(i);
                    if (d == '{') depth++;
                    else if (d == '}' && --depth == 0) break;
                    i++;
                }
                if (depth != 0) throw error("Unclosed brace in interpolated string");
                String inner = raw.substring(exprStart, i).trim();
                if (inner.isEmpty()) throw error("Empty expression in interpolated string");
                segments.add(Segment.expression(parseExpression(inner)));
                i++;
            } else if (c == '}') {
                if (i + 1 < n && raw.charAt(i + 1) == '}') {
                    literal.append('}');
                    i += 2;
                } else {
                    throw error("Unmatched closing brace in interpolated string");
                }
            } else {
                literal.append(c);
                i++;
            }
        }

        if (literal.length() > 0 || segments.isEmpty()) {
            segments.add(Segment.literal(literal.toString()));
        }
        return segments;
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String expected) {
        if (check(type)) return advance();
        throw error("Expected " + expected + ", found " + peek().describe());
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() { return peek().type == TokenType.EOF; }
    private Token peek() { return tokens.get(current); }
    private Token previous() { return tokens.get(current - 1); }

    private static ExpressionException error(String message) {
        return ExpressionException.parse(message);
    }
}
