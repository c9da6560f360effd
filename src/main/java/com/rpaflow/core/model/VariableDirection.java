package com.rpaflow.core.model;

public enum VariableDirection {
    IN,
    OUT,
    IN_OUT;

    public boolean copiesIn() { return this == IN || this == IN_OUT; }
    public boolean copiesOut() { return this == OUT || this == IN_OUT; }
}
