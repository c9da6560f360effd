package com.rpaflow.core.log;

import java.util.Objects;

public final class LogEntry {
    private final String timestamp;
    private final String nodeId;
    private final LogLevel level;
    private final LogActivity activity;
    private final String message;

    public LogEntry(String timestamp, String nodeId, LogLevel level, LogActivity activity, String message) {
        this.timestamp = timestamp;
        this.nodeId = nodeId;
        this.level = Objects.requireNonNull(level, "level");
        this.activity = Objects.requireNonNull(activity, "activity");
        this.message = message == null ? "" : message;
    }

    public String getTimestamp() { return timestamp; }
    /** Node being executed when the entry was produced; null outside any node. */
    public String getNodeId() { return nodeId; }
    public LogLevel getLevel() { return level; }
    public LogActivity getActivity() { return activity; }
    public String getMessage() { return message; }

    /** Console form: {@code [00:01.250] [INFO] LOG: hello}. */
    public String format() {
        return timestamp + " [" + level.label() + "] " + activity.label() + ": " + message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LogEntry)) return false;
        LogEntry other = (LogEntry) o;
        return Objects.equals(timestamp, other.timestamp)
                && Objects.equals(nodeId, other.nodeId)
                && level == other.level
                && activity == other.activity
                && message.equals(other.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, nodeId, level, activity, message);
    }

    @Override
    public String toString() {
        return format();
    }
}
