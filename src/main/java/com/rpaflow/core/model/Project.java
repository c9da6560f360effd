package com.rpaflow.core.model;

import com.rpaflow.core.log.LogStorage;
import com.rpaflow.core.variables.Variables;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

public final class Project {
    private final String name;
    private final Scenario mainScenario;
    private final List<Scenario> scenarios;
    private final Variables variables;
    private final LogStorage executionLog = new LogStorage();

    public Project(String name, Scenario mainScenario, List<Scenario> scenarios, Variables variables) {
        this.name = name == null ? "" : name;
        this.mainScenario = Objects.requireNonNull(mainScenario, "mainScenario");
        this.scenarios = scenarios == null
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(scenarios));
        this.variables = variables == null ? new Variables() : variables;
    }

    public String getName() { return name; }
    public Scenario getMainScenario() { return mainScenario; }
    /** Callable scenarios besides the main one, in declared order. */
    public List<Scenario> getScenarios() { return scenarios; }
    /** Global variable declarations; the run's Global store starts from a copy. */
    public Variables getVariables() { return variables; }
    /** Retained history of the most recent run. Not persisted. */
    public LogStorage getExecutionLog() { return executionLog; }

    /** Main scenario first, then the others in declared order. */
    public List<Scenario> allScenarios() {
        List<Scenario> all = new ArrayList<>(scenarios.size() + 1);
        all.add(mainScenario);
        for (Scenario s : scenarios) {
            if (!s.getId().equals(mainScenario.getId())) all.add(s);
        }
        return all;
    }

    public Scenario findScenario(String scenarioId) {
        if (mainScenario.getId().equals(scenarioId)) return mainScenario;
        for (Scenario s : scenarios) {
            if (s.getId().equals(scenarioId)) return s;
        }
        return null;
    }
}
