package com.rpaflow.core.model;

import java.util.Objects;

public final class ScenarioParameter {
    private final String varName;
    private final VariableDirection direction;

    public ScenarioParameter(String varName, VariableDirection direction) {
        this.varName = Objects.requireNonNull(varName, "varName");
        this.direction = Objects.requireNonNull(direction, "direction");
    }

    public String getVarName() { return varName; }
    public VariableDirection getDirection() { return direction; }
}
