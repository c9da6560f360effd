package com.rpaflow.core.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Flat, immutable instruction list for a whole project plus per-scenario entry points. */
public final class IrProgram {
    private final List<Instruction> instructions;
    private final int entryPoint;
    private final Map<String, Integer> scenarioStartIndex;
    private final Map<String, Set<String>> scenarioCallGraph;
    private final Set<String> recursiveScenarios;

    public IrProgram(List<Instruction> instructions, int entryPoint, Map<String, Integer> scenarioStartIndex,
                     Map<String, Set<String>> scenarioCallGraph, Set<String> recursiveScenarios) {
        this.instructions = Collections.unmodifiableList(new ArrayList<>(instructions));
        this.entryPoint = entryPoint;
        this.scenarioStartIndex = Collections.unmodifiableMap(new LinkedHashMap<>(scenarioStartIndex));
        this.scenarioCallGraph = Collections.unmodifiableMap(new LinkedHashMap<>(scenarioCallGraph));
        this.recursiveScenarios = Collections.unmodifiableSet(new LinkedHashSet<>(recursiveScenarios));
    }

    public List<Instruction> getInstructions() { return instructions; }
    public int size() { return instructions.size(); }
    public Instruction get(int index) { return instructions.get(index); }
    public int getEntryPoint() { return entryPoint; }
    public Map<String, Integer> getScenarioStartIndex() { return scenarioStartIndex; }
    public Map<String, Set<String>> getScenarioCallGraph() { return scenarioCallGraph; }
    public Set<String> getRecursiveScenarios() { return recursiveScenarios; }

    /** Start index of a scenario, or -1 if it was not compiled. */
    public int startOf(String scenarioId) {
        Integer idx = scenarioStartIndex.get(scenarioId);
        return idx == null ? -1 : idx;
    }

    /** Listing with one "index: instruction" line per instruction. Identical input gives identical text. */
    public String dump() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < instructions.size(); i++) {
            sb.append(String.format("%4d: %s%n", i, instructions.get(i)));
        }
        return sb.toString();
    }
}
