package com.rpaflow.script.parser;

import java.util.Objects;

public class Value {
    public enum Type { NUMBER, BOOL, STRING, UNDEFINED }

    private static final Value UNDEFINED = new Value(Type.UNDEFINED, null);
    private static final Value TRUE = new Value(Type.BOOL, Boolean.TRUE);
    private static final Value FALSE = new Value(Type.BOOL, Boolean.FALSE);

    public final Type type;
    public final Object value;

    private Value(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static Value number(double d) { return new Value(Type.NUMBER, d); }
    public static Value bool(boolean b) { return b ? TRUE : FALSE; }
    public static Value string(String s) { return new Value(Type.STRING, Objects.requireNonNull(s, "s")); }
    public static Value undefined() { return UNDEFINED; }

    public Type getType() { return type; }

    public boolean isUndefined() { return type == Type.UNDEFINED; }

    public double asNumber() {
        if (type != Type.NUMBER) throw new IllegalStateException("Expected number, got " + type);
        return (double) value;
    }

    public boolean asBool() {
        if (type != Type.BOOL) throw new IllegalStateException("Expected bool, got " + type);
        return (boolean) value;
    }

    public String asString() {
        if (type != Type.STRING) throw new IllegalStateException("Expected string, got " + type);
        return (String) value;
    }

    /** Arithmetic coercion: numbers as-is, booleans as 1/0, everything else fails. */
    public double toNumber() {
        switch (type) {
            case NUMBER: return (double) value;
            case BOOL: return ((boolean) value) ? 1.0 : 0.0;
            default: throw ExpressionException.eval("Expected number");
        }
    }

    /** Logical coercion: only booleans are accepted. */
    public boolean toBool() {
        if (type != Type.BOOL) throw ExpressionException.eval("Expected boolean");
        return (boolean) value;
    }

    /** Lower-case type name for display in variable listings. */
    public String typeName() {
        switch (type) {
            case NUMBER: return "number";
            case BOOL: return "boolean";
            case STRING: return "string";
            default: return "undefined";
        }
    }

    /** Display form: integral numbers omit the decimal point. */
    @Override
    public String toString() {
        switch (type) {
            case NUMBER: return formatNumber((double) value);
            case BOOL: return String.valueOf(value);
            case STRING: return (String) value;
            default: return "undefined";
        }
    }

    public static String formatNumber(double d) {
        if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 1e15) {
            return Long.toString((long) d);
        }
        return Double.toString(d);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Value)) return false;
        Value other = (Value) o;
        if (type != other.type) return false;
        if (type == Type.NUMBER) return ((double) value) == ((double) other.value);
        return Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        if (type == Type.NUMBER) {
            double d = (double) value;
            return Double.hashCode(d == 0.0 ? 0.0 : d);
        }
        return Objects.hash(type, value);
    }
}
