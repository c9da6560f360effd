package com.rpaflow.script.parser;

/** Supplies variable values to the evaluator. Implementations throw when the name is unknown. */
@FunctionalInterface
public interface VariableResolver {
    Value resolve(String name);
}
