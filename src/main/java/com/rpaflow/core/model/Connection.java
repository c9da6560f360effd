package com.rpaflow.core.model;

import java.util.Objects;

public final class Connection {
    private final String id;
    private final String fromNode;
    private final String toNode;
    private final BranchType branchType;

    public Connection(String id, String fromNode, String toNode, BranchType branchType) {
        this.id = Objects.requireNonNull(id, "id");
        this.fromNode = Objects.requireNonNull(fromNode, "fromNode");
        this.toNode = Objects.requireNonNull(toNode, "toNode");
        this.branchType = branchType == null ? BranchType.DEFAULT : branchType;
    }

    public String getId() { return id; }
    public String getFromNode() { return fromNode; }
    public String getToNode() { return toNode; }
    public BranchType getBranchType() { return branchType; }

    @Override
    public String toString() {
        return fromNode + " -[" + branchType + "]-> " + toNode;
    }
}
