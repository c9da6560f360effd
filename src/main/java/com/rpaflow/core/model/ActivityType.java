package com.rpaflow.core.model;

public enum ActivityType {
    START,
    END,
    LOG,
    DELAY,
    SET_VARIABLE,
    EVALUATE,
    IF_CONDITION,
    LOOP,
    WHILE,
    CONTINUE,
    BREAK,
    CALL_SCENARIO,
    RUN_POWERSHELL,
    NOTE,
    TRY_CATCH;

    /** Only these may carry an ErrorBranch edge. */
    public boolean canHaveErrorOutput() {
        return this == CALL_SCENARIO || this == RUN_POWERSHELL;
    }
}
