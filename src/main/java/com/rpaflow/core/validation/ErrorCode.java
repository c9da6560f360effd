package com.rpaflow.core.validation;

public enum ErrorCode {
    /** Missing Start node */
    E001(true),
    /** Missing End node */
    E002(true),
    /** Reachable node that never leads to End */
    E003(true),
    /** Connection references a non-existent node */
    E004(true),
    /** Loop with zero step */
    E101(true),
    /** CallScenario references a non-existent scenario */
    E103(true),
    /** Condition does not parse */
    E104(true),
    /** Empty variable or loop index name */
    E201(true),
    /** If without True branch */
    W001(false),
    /** If without False branch */
    W002(false),
    /** TryCatch without Try branch */
    W003(false),
    /** TryCatch without Catch branch */
    W004(false),
    /** Variable possibly used before definition */
    W005(false),
    /** Recursive scenario call chain */
    W006(false),
    /** Loop or While without body */
    W007(false);

    private final boolean error;

    ErrorCode(boolean error) {
        this.error = error;
    }

    public boolean isError() {
        return error;
    }
}
