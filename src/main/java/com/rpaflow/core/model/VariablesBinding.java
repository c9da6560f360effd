package com.rpaflow.core.model;

import com.rpaflow.core.variables.VariableScope;

import java.util.Objects;

/**
 * Parameter binding of a CallScenario: {@code sourceVarName} lives in the caller,
 * {@code targetVarName} in the callee.
 */
public final class VariablesBinding {
    private final String targetVarName;
    private final String sourceVarName;
    private final VariableDirection direction;
    private final VariableScope sourceScope;

    public VariablesBinding(String targetVarName, String sourceVarName, VariableDirection direction) {
        this(targetVarName, sourceVarName, direction, null);
    }

    public VariablesBinding(String targetVarName, String sourceVarName, VariableDirection direction,
                            VariableScope sourceScope) {
        this.targetVarName = Objects.requireNonNull(targetVarName, "targetVarName");
        this.sourceVarName = Objects.requireNonNull(sourceVarName, "sourceVarName");
        this.direction = Objects.requireNonNull(direction, "direction");
        this.sourceScope = sourceScope;
    }

    public String getTargetVarName() { return targetVarName; }
    public String getSourceVarName() { return sourceVarName; }
    public VariableDirection getDirection() { return direction; }
    /** Null means "resolve normally" (caller local first, then global). */
    public VariableScope getSourceScope() { return sourceScope; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VariablesBinding)) return false;
        VariablesBinding other = (VariablesBinding) o;
        return targetVarName.equals(other.targetVarName)
                && sourceVarName.equals(other.sourceVarName)
                && direction == other.direction
                && sourceScope == other.sourceScope;
    }

    @Override
    public int hashCode() {
        return Objects.hash(targetVarName, sourceVarName, direction, sourceScope);
    }

    @Override
    public String toString() {
        return sourceVarName + " -" + direction + "-> " + targetVarName;
    }
}
