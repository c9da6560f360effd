package com.rpaflow.script.parser;

import com.rpaflow.script.parser.Expr.Binary;
import com.rpaflow.script.parser.Expr.ExprVisitor;
import com.rpaflow.script.parser.Expr.Interpolated;
import com.rpaflow.script.parser.Expr.Literal;
import com.rpaflow.script.parser.Expr.Logical;
import com.rpaflow.script.parser.Expr.Segment;
import com.rpaflow.script.parser.Expr.Unary;
import com.rpaflow.script.parser.Expr.Variable;

/**
 * Tree-walking evaluator. Variables are looked up through the supplied resolver on every load,
 * so one parsed expression can be evaluated against changing state.
 */
public class Evaluator implements ExprVisitor<Value> {

    private static final double EPSILON = Math.ulp(1.0);

    private final VariableResolver resolver;

    public Evaluator(VariableResolver resolver) {
        this.resolver = resolver;
    }

    public Value eval(Expr.ExprInterface expr) {
        return expr.accept(this);
    }

    @Override
    public Value visitLiteralExpr(Literal expr) {
        return expr.value;
    }

    @Override
    public Value visitVariableExpr(Variable expr) {
        Value v = resolver.resolve(expr.name);
        if (v == null) throw ExpressionException.eval("Undefined variable: " + expr.name);
        return v;
    }

    @Override
    public Value visitUnaryExpr(Unary expr) {
        Value right = eval(expr.right);
        switch (expr.operator.type) {
            case BANG: return Value.bool(!right.toBool());
            case MINUS: return Value.number(-right.toNumber());
            case PLUS: return Value.number(right.toNumber());
            default: throw ExpressionException.eval("Unknown unary operator: " + expr.operator.lexeme);
        }
    }

    @Override
    public Value visitLogicalExpr(Logical expr) {
        boolean left = eval(expr.left).toBool();
        if (expr.operator.type == TokenType.OR_OR) {
            if (left) return Value.bool(true);
        } else {
            if (!left) return Value.bool(false);
        }
        return Value.bool(eval(expr.right).toBool());
    }

    @Override
    public Value visitBinaryExpr(Binary expr) {
        TokenType op = expr.operator.type;
        if (op == TokenType.PLUS) return add(expr);

        Value left = eval(expr.left);
        Value right = eval(expr.right);

        switch (op) {
            case MINUS: return Value.number(left.toNumber() - right.toNumber());
            case STAR: return Value.number(left.toNumber() * right.toNumber());
            case SLASH: {
                double l = left.toNumber();
                double r = nonZero(right.toNumber());
                return Value.number(l / r);
            }
            case PERCENT: {
                double l = left.toNumber();
                double r = nonZero(right.toNumber());
                return Value.number(l % r);
            }
            case EQUAL_EQUAL:
                requireSameType(left, right, "==");
                return Value.bool(left.equals(right));
            case BANG_EQUAL:
                requireSameType(left, right, "!=");
                return Value.bool(!left.equals(right));
            case GREATER: return Value.bool(left.toNumber() > right.toNumber());
            case GREATER_EQUAL: return Value.bool(left.toNumber() >= right.toNumber());
            case LESS: return Value.bool(left.toNumber() < right.toNumber());
            case LESS_EQUAL: return Value.bool(left.toNumber() <= right.toNumber());
            default:
                throw ExpressionException.eval("Unknown binary operator: " + expr.operator.lexeme);
        }
    }

    @Override
    public Value visitInterpolatedExpr(Interpolated expr) {
        StringBuilder sb = new StringBuilder();
        for (Segment segment : expr.segments) {
            if (segment.isLiteral()) sb.append(segment.literal);
            else sb.append(eval(segment.expr));
        }
        return Value.string(sb.toString());
    }

    private Value add(Binary expr) {
        Value left = eval(expr.left);
        switch (left.getType()) {
            case STRING:
                return Value.string(left.asString() + eval(expr.right));
            case NUMBER:
                return Value.number(left.asNumber() + eval(expr.right).toNumber());
            case BOOL:
                throw ExpressionException.eval("Cannot use + with boolean on left side");
            default:
                throw ExpressionException.eval("Cannot use + with undefined");
        }
    }

    private static double nonZero(double divisor) {
        if (Math.abs(divisor) < EPSILON) throw ExpressionException.eval("Division by zero");
        return divisor;
    }

    private static void requireSameType(Value left, Value right, String op) {
        if (left.getType() != right.getType()) {
            throw ExpressionException.eval("Type mismatch in '" + op + "'");
        }
    }
}
