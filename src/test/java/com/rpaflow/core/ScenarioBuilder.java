package com.rpaflow.core;

import com.rpaflow.core.model.Activity;
import com.rpaflow.core.model.BranchType;
import com.rpaflow.core.model.Connection;
import com.rpaflow.core.model.Node;
import com.rpaflow.core.model.Project;
import com.rpaflow.core.model.Scenario;
import com.rpaflow.core.model.ScenarioParameter;
import com.rpaflow.core.model.VariableDirection;
import com.rpaflow.core.variables.VariableScope;
import com.rpaflow.core.variables.Variables;
import com.rpaflow.script.parser.Value;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/** Builds scenario graphs in tests without going through JSON. */
public final class ScenarioBuilder {
    private final String id;
    private final List<Node> nodes = new ArrayList<>();
    private final List<Connection> connections = new ArrayList<>();
    private final List<ScenarioParameter> parameters = new ArrayList<>();
    private final Variables variables = new Variables();

    private ScenarioBuilder(String id) {
        this.id = id;
    }

    public static ScenarioBuilder scenario(String id) {
        return new ScenarioBuilder(id);
    }

    /** Adds "start" and "end" nodes. */
    public ScenarioBuilder withStartEnd() {
        node("start", new Activity.Start(id));
        node("end", new Activity.End(id));
        return this;
    }

    public ScenarioBuilder node(String nodeId, Activity activity) {
        nodes.add(new Node(nodeId, activity));
        return this;
    }

    public ScenarioBuilder edge(String from, String to) {
        return edge(from, to, BranchType.DEFAULT);
    }

    public ScenarioBuilder edge(String from, String to, BranchType branch) {
        connections.add(new Connection(from + "->" + to + ":" + branch, from, to, branch));
        return this;
    }

    /** Default edges between consecutive ids. */
    public ScenarioBuilder chain(String... ids) {
        for (int i = 0; i + 1 < ids.length; i++) edge(ids[i], ids[i + 1]);
        return this;
    }

    public ScenarioBuilder param(String name, VariableDirection direction) {
        parameters.add(new ScenarioParameter(name, direction));
        return this;
    }

    public ScenarioBuilder variable(String name, Value value) {
        variables.define(name, value, VariableScope.SCENARIO);
        return this;
    }

    public Scenario build() {
        return new Scenario(id, id, nodes, connections, parameters, variables);
    }

    public static Project project(Scenario main, Scenario... others) {
        return new Project("test", main, Arrays.asList(others), new Variables());
    }

    public static Project project(Variables globals, Scenario main, Scenario... others) {
        return new Project("test", main, Arrays.asList(others), globals);
    }
}
