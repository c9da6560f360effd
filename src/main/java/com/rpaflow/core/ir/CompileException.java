package com.rpaflow.core.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Thrown when a project does not compile; carries every error found, not just the first. */
public class CompileException extends RuntimeException {
    private final List<CompileError> errors;

    public CompileException(List<CompileError> errors) {
        super(summary(errors));
        this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
    }

    public List<CompileError> getErrors() { return errors; }

    private static String summary(List<CompileError> errors) {
        if (errors.isEmpty()) return "Compilation failed";
        StringBuilder sb = new StringBuilder("Compilation failed with ").append(errors.size())
                .append(errors.size() == 1 ? " error" : " errors");
        for (CompileError e : errors) sb.append("\n  ").append(e);
        return sb.toString();
    }
}
