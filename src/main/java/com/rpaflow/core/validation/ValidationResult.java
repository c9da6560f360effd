package com.rpaflow.core.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public final class ValidationResult {
    private final List<ValidationIssue> errors = new ArrayList<>();
    private final List<ValidationIssue> warnings = new ArrayList<>();
    private final Set<String> reachableNodes = new LinkedHashSet<>();

    void add(ValidationIssue issue) {
        if (issue.isError()) errors.add(issue);
        else warnings.add(issue);
    }

    void addAll(List<ValidationIssue> issues) {
        for (ValidationIssue i : issues) add(i);
    }

    void setReachableNodes(Set<String> nodes) {
        reachableNodes.clear();
        reachableNodes.addAll(nodes);
    }

    public boolean isValid() { return errors.isEmpty(); }

    public List<ValidationIssue> getErrors() { return Collections.unmodifiableList(errors); }
    public List<ValidationIssue> getWarnings() { return Collections.unmodifiableList(warnings); }
    /** Nodes reachable from Start; empty when structural checks failed. */
    public Set<String> getReachableNodes() { return Collections.unmodifiableSet(reachableNodes); }

    public boolean hasCode(ErrorCode code) {
        for (ValidationIssue i : errors) if (i.getCode() == code) return true;
        for (ValidationIssue i : warnings) if (i.getCode() == code) return true;
        return false;
    }
}
