package com.rpaflow.core.execution;

/** An external effect (such as a PowerShell script) failed. Catchable by an active handler. */
public class ActivityException extends RuntimeException {

    public ActivityException(String message) {
        super(message);
    }

    public ActivityException(String message, Throwable cause) {
        super(message, cause);
    }
}
