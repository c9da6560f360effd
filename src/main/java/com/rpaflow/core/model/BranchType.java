package com.rpaflow.core.model;

/** Which control edge a connection represents. */
public enum BranchType {
    DEFAULT,
    TRUE_BRANCH,
    FALSE_BRANCH,
    LOOP_BODY,
    ERROR_BRANCH,
    TRY_BRANCH,
    CATCH_BRANCH
}
