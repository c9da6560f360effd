package com.rpaflow.core.validation;

import java.util.Objects;

public final class ValidationIssue {
    private final ErrorCode code;
    private final String scenarioId;
    private final String nodeId;
    private final String message;

    public ValidationIssue(ErrorCode code, String scenarioId, String nodeId, String message) {
        this.code = Objects.requireNonNull(code, "code");
        this.scenarioId = scenarioId;
        this.nodeId = nodeId;
        this.message = message;
    }

    public ErrorCode getCode() { return code; }
    public String getScenarioId() { return scenarioId; }
    /** Offending node, or null for scenario-level issues. */
    public String getNodeId() { return nodeId; }
    public String getMessage() { return message; }

    public boolean isError() { return code.isError(); }
    public boolean isWarning() { return !code.isError(); }

    @Override
    public String toString() {
        return code + (nodeId == null ? "" : " [" + nodeId + "]") + ": " + message;
    }
}
