package com.rpaflow.core.ir;

public final class CompileError {
    private final String scenarioId;
    private final String nodeId;
    private final String code;
    private final String message;

    public CompileError(String scenarioId, String nodeId, String code, String message) {
        this.scenarioId = scenarioId;
        this.nodeId = nodeId;
        this.code = code;
        this.message = message;
    }

    public String getScenarioId() { return scenarioId; }
    /** Offending node, or null for scenario-level errors. */
    public String getNodeId() { return nodeId; }
    public String getCode() { return code; }
    public String getMessage() { return message; }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (code != null) sb.append(code).append(' ');
        sb.append(scenarioId == null ? "?" : scenarioId);
        if (nodeId != null) sb.append('/').append(nodeId);
        return sb.append(": ").append(message).toString();
    }
}
