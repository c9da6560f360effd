package com.rpaflow.core.execution;

/** Commands a host sends to a running engine. */
public enum ExecutionCommand {
    STOP
}
