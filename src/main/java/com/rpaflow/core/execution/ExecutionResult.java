package com.rpaflow.core.execution;

public final class ExecutionResult {

    public enum Status { COMPLETED, STOPPED, ERRORED }

    private final Status status;
    private final String message;
    private final long steps;

    private ExecutionResult(Status status, String message, long steps) {
        this.status = status;
        this.message = message;
        this.steps = steps;
    }

    public static ExecutionResult completed(long steps) { return new ExecutionResult(Status.COMPLETED, null, steps); }
    public static ExecutionResult stopped(String message, long steps) { return new ExecutionResult(Status.STOPPED, message, steps); }
    public static ExecutionResult errored(String message, long steps) { return new ExecutionResult(Status.ERRORED, message, steps); }

    public Status getStatus() { return status; }
    /** Error or stop message; null on completion. */
    public String getMessage() { return message; }
    /** Instructions executed. */
    public long getSteps() { return steps; }

    public boolean isCompleted() { return status == Status.COMPLETED; }
    public boolean isStopped() { return status == Status.STOPPED; }
    public boolean isErrored() { return status == Status.ERRORED; }

    @Override
    public String toString() {
        return status + (message == null ? "" : ": " + message) + " (" + steps + " steps)";
    }
}
