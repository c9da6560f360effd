package com.rpaflow.core.execution;

/** Scenario call depth exceeded the engine's limit. Always fatal; handlers never see it. */
public class ScenarioStackOverflowException extends RuntimeException {
    private final int depth;

    public ScenarioStackOverflowException(int depth, String scenarioId) {
        super("Maximum call depth of " + depth + " exceeded calling scenario '" + scenarioId + "'");
        this.depth = depth;
    }

    public int getDepth() { return depth; }
}
