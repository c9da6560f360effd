package com.rpaflow.core.execution;

import com.rpaflow.core.log.LogEntry;
import com.rpaflow.script.parser.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Outbound notification from a run: variable snapshots, log entries, and the terminal outcome. */
public abstract class ExecutionEvent {

    public enum Kind { STATE_SNAPSHOT, LOG, COMPLETED, ERROR }

    private final Kind kind;

    protected ExecutionEvent(Kind kind) {
        this.kind = kind;
    }

    public Kind getKind() { return kind; }

    /** True for the last event of a run. */
    public boolean isTerminal() {
        return kind == Kind.COMPLETED || kind == Kind.ERROR;
    }

    public static final class StateSnapshot extends ExecutionEvent {
        public final String timestamp;
        public final String scenarioId;
        public final Map<String, Value> globalVars;
        public final Map<String, Value> scenarioVars;

        public StateSnapshot(String timestamp, String scenarioId, Map<String, Value> globalVars,
                             Map<String, Value> scenarioVars) {
            super(Kind.STATE_SNAPSHOT);
            this.timestamp = timestamp;
            this.scenarioId = scenarioId;
            this.globalVars = Collections.unmodifiableMap(new LinkedHashMap<>(globalVars));
            this.scenarioVars = Collections.unmodifiableMap(new LinkedHashMap<>(scenarioVars));
        }

        @Override
        public String toString() {
            return "StateSnapshot" + timestamp + " global=" + globalVars + " scenario=" + scenarioVars;
        }
    }

    public static final class Log extends ExecutionEvent {
        public final LogEntry entry;

        public Log(LogEntry entry) {
            super(Kind.LOG);
            this.entry = entry;
        }

        @Override
        public String toString() { return "Log " + entry.format(); }
    }

    /** The run finished normally or was stopped. */
    public static final class Completed extends ExecutionEvent {
        public final boolean stopped;

        public Completed(boolean stopped) {
            super(Kind.COMPLETED);
            this.stopped = stopped;
        }

        @Override
        public String toString() { return stopped ? "Completed (stopped)" : "Completed"; }
    }

    public static final class Error extends ExecutionEvent {
        public final String message;

        public Error(String message) {
            super(Kind.ERROR);
            this.message = message;
        }

        @Override
        public String toString() { return "Error " + message; }
    }
}
