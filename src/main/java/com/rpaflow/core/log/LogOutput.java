package com.rpaflow.core.log;

/** Receiver of run log entries. */
@FunctionalInterface
public interface LogOutput {
    void log(LogEntry entry);
}
