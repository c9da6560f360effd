package com.rpaflow.core.model;

import com.rpaflow.core.variables.Variables;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** A named, independently callable sub-workflow. */
public final class Scenario {
    private final String id;
    private final String name;
    private final List<Node> nodes;
    private final List<Connection> connections;
    private final List<ScenarioParameter> parameters;
    private final Variables variables;
    private final Map<String, Node> nodesById = new LinkedHashMap<>();

    public Scenario(String id, String name, List<Node> nodes, List<Connection> connections,
                    List<ScenarioParameter> parameters, Variables variables) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = name == null ? id : name;
        this.nodes = Collections.unmodifiableList(new ArrayList<>(nodes));
        this.connections = Collections.unmodifiableList(new ArrayList<>(connections));
        this.parameters = parameters == null
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(parameters));
        this.variables = variables == null ? new Variables() : variables;
        for (Node n : this.nodes) nodesById.putIfAbsent(n.getId(), n);
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public List<Node> getNodes() { return nodes; }
    public List<Connection> getConnections() { return connections; }
    public List<ScenarioParameter> getParameters() { return parameters; }
    /** Declared locals; each invocation starts from a copy. */
    public Variables getVariables() { return variables; }

    public Node getNode(String nodeId) {
        return nodesById.get(nodeId);
    }

    /** First node of the given activity type in declaration order, or null. */
    public Node findFirst(ActivityType type) {
        for (Node n : nodes) {
            if (n.getType() == type) return n;
        }
        return null;
    }

    /** Target of the first connection leaving {@code nodeId} on {@code branch}, or null. */
    public String next(String nodeId, BranchType branch) {
        for (Connection c : connections) {
            if (c.getFromNode().equals(nodeId) && c.getBranchType() == branch) return c.getToNode();
        }
        return null;
    }

    public boolean hasConnection(String nodeId, BranchType branch) {
        return next(nodeId, branch) != null;
    }

    public List<Connection> outgoing(String nodeId) {
        List<Connection> out = new ArrayList<>();
        for (Connection c : connections) {
            if (c.getFromNode().equals(nodeId)) out.add(c);
        }
        return out;
    }

    @Override
    public String toString() {
        return "Scenario(" + name + ", " + nodes.size() + " nodes)";
    }
}
