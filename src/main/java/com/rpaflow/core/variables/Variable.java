package com.rpaflow.core.variables;

import com.rpaflow.script.parser.Value;

import java.util.Objects;

public final class Variable {
    private final Value value;
    private final VariableScope scope;

    public Variable(Value value, VariableScope scope) {
        this.value = Objects.requireNonNull(value, "value");
        this.scope = Objects.requireNonNull(scope, "scope");
    }

    public Value getValue() { return value; }
    public VariableScope getScope() { return scope; }

    Variable withValue(Value v) {
        return new Variable(v, scope);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Variable)) return false;
        Variable other = (Variable) o;
        return value.equals(other.value) && scope == other.scope;
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, scope);
    }

    @Override
    public String toString() {
        return value + " (" + scope + ")";
    }
}
