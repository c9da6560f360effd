package com.rpaflow.core.variables;

public enum VariableScope {
    GLOBAL,
    SCENARIO
}
