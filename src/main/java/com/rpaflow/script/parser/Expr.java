package com.rpaflow.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class Expr {

    public interface ExprInterface {
        <R> R accept(ExprVisitor<R> visitor);
    }

    public interface ExprVisitor<R> {
        R visitBinaryExpr(Binary expr);
        R visitUnaryExpr(Unary expr);
        R visitLiteralExpr(Literal expr);
        R visitVariableExpr(Variable expr);
        R visitLogicalExpr(Logical expr);
        R visitInterpolatedExpr(Interpolated expr);
    }

    // -------------------------
    // Expression nodes
    // -------------------------

    /** Arithmetic and comparison operators: + - * / % == != > >= < <= */
    public static final class Binary implements ExprInterface {
        public final ExprInterface left;
        public final Token operator;
        public final ExprInterface right;

        public Binary(ExprInterface left, Token operator, ExprInterface right) {
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBinaryExpr(this);
        }

        @Override
        public String toString() {
            return "(" + operator.type + " " + left + " " + right + ")";
        }
    }

    /** Prefix ! and - (a prefix + is dropped by the parser). */
    public static final class Unary implements ExprInterface {
        public final Token operator;
        public final ExprInterface right;

        public Unary(Token operator, ExprInterface right) {
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitUnaryExpr(this);
        }

        @Override
        public String toString() {
            return "(" + operator.type + " " + right + ")";
        }
    }

    public static final class Literal implements ExprInterface {
        public final Value value;

        public Literal(Value value) {
            this.value = value;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLiteralExpr(this);
        }

        @Override
        public String toString() {
            return value.getType() == Value.Type.STRING ? "\"" + value + "\"" : value.toString();
        }
    }

    public static final class Variable implements ExprInterface {
        public final String name;

        public Variable(String name) {
            this.name = name;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitVariableExpr(this);
        }

        @Override
        public String toString() {
            return "$" + name;
        }
    }

    /** && and || */
    public static final class Logical implements ExprInterface {
        public final ExprInterface left;
        public final Token operator;
        public final ExprInterface right;

        public Logical(ExprInterface left, Token operator, ExprInterface right) {
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLogicalExpr(this);
        }

        @Override
        public String toString() {
            return "(" + operator.type + " " + left + " " + right + ")";
        }
    }

    /** A string template: literal text mixed with embedded expressions. */
    public static final class Interpolated implements ExprInterface {
        public final List<Segment> segments;

        public Interpolated(List<Segment> segments) {
            this.segments = Collections.unmodifiableList(new ArrayList<>(segments));
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitInterpolatedExpr(this);
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder("(TEMPLATE");
            for (Segment s : segments) sb.append(' ').append(s);
            return sb.append(')').toString();
        }
    }

    /** One piece of an interpolated string: either literal text or an expression. */
    public static final class Segment {
        public final String literal;
        public final ExprInterface expr;

        private Segment(String literal, ExprInterface expr) {
            this.literal = literal;
            this.expr = expr;
        }

        public static Segment literal(String text) { return new Segment(text, null); }
        public static Segment expression(ExprInterface expr) { return new Segment(null, expr); }

        public boolean isLiteral() { return expr == null; }

        @Override
        public String toString() {
            return isLiteral() ? "\"" + literal + "\"" : "{" + expr + "}";
        }
    }
}
