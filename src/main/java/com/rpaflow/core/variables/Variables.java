package com.rpaflow.core.variables;

import com.rpaflow.script.parser.Value;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Name to variable store for one scope (the project globals, or one scenario invocation).
 *
 * Lifecycle rules:
 * - {@link #createVariable} always (re)creates the variable holding Undefined.
 * - {@link #set} only updates an existing variable; setting an unknown name does nothing.
 *
 * Iteration order is unspecified.
 */
public class Variables {

    private final Map<String, Variable> values = new HashMap<>();

    public Variables() {}

    public Variables(Variables other) {
        if (other != null) values.putAll(other.values);
    }

    public void createVariable(String name, VariableScope scope) {
        values.put(name, new Variable(Value.undefined(), scope));
    }

    /** Creates the variable and assigns it in one step. */
    public void define(String name, Value value, VariableScope scope) {
        createVariable(name, scope);
        set(name, value);
    }

    /** Returns false (and changes nothing) when the variable was never created. */
    public boolean set(String name, Value value) {
        Variable existing = values.get(name);
        if (existing == null) return false;
        values.put(name, existing.withValue(value));
        return true;
    }

    /** Value of the variable, or null when it does not exist. */
    public Value get(String name) {
        Variable v = values.get(name);
        return v == null ? null : v.getValue();
    }

    public VariableScope getScope(String name) {
        Variable v = values.get(name);
        return v == null ? null : v.getScope();
    }

    public Variable getVariable(String name) {
        return values.get(name);
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    public void remove(String name) {
        values.remove(name);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(values.keySet());
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public void clear() {
        values.clear();
    }

    /** New store holding this store's variables overlaid with {@code other}'s. */
    public Variables merge(Variables other) {
        Variables merged = new Variables(this);
        if (other != null) merged.values.putAll(other.values);
        return merged;
    }

    /** Plain name to value view, used for snapshots. */
    public Map<String, Value> toValueMap() {
        Map<String, Value> out = new LinkedHashMap<>();
        for (Map.Entry<String, Variable> e : values.entrySet()) {
            out.put(e.getKey(), e.getValue().getValue());
        }
        return out;
    }

    public Map<String, Variable> asMap() {
        return Collections.unmodifiableMap(values);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Variables)) return false;
        return values.equals(((Variables) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
