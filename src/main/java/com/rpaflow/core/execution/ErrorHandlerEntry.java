package com.rpaflow.core.execution;

final class ErrorHandlerEntry {
    final int catchTarget;
    /** Call depth when the handler was pushed; it only catches errors at this depth or deeper. */
    final int depth;

    ErrorHandlerEntry(int catchTarget, int depth) {
        this.catchTarget = catchTarget;
        this.depth = depth;
    }
}
