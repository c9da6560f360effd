package com.rpaflow.core;

/** Engine defaults. Hosts override the tunable ones through engine setters. */
public final class CoreConstants {

    /** Maximum number of nested CallScenario frames above the main scenario. */
    public static final int MAX_CALL_STACK_DEPTH = 100;

    public static final long SNAPSHOT_INTERVAL_MS = 100;

    /** Upper bound on how long a Delay sleeps before re-checking the stop flag. */
    public static final long DELAY_POLL_SLICE_MS = 50;

    public static final int DEFAULT_LOG_ENTRIES = 100;
    public static final int MAX_LOG_ENTRIES = 10_000;

    /** Global variable that receives the message of the most recent error. */
    public static final String ERROR_VARIABLE_NAME = "last_error";

    public static final String EXECUTION_COMPLETE_MARKER = "__EXECUTION_COMPLETE__";

    public static final String STOPPED_MESSAGE = "Execution stopped by user";

    private CoreConstants() {}
}
