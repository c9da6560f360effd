package com.rpaflow.core.execution;

import com.rpaflow.core.CoreConstants;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Cooperative cancellation shared between a host thread and the run thread.
 * {@link #share()} returns a handle observing the same flag, so the host can keep one and hand
 * another to the engine.
 */
public final class StopControl {

    private static final class State {
        final ReentrantLock lock = new ReentrantLock();
        final Condition wake = lock.newCondition();
        boolean stopped;
    }

    private final State state;
    private final long sliceMillis;

    public StopControl() {
        this(new State(), CoreConstants.DELAY_POLL_SLICE_MS);
    }

    private StopControl(State state, long sliceMillis) {
        this.state = state;
        this.sliceMillis = Math.max(1, sliceMillis);
    }

    public StopControl share() {
        return new StopControl(state, sliceMillis);
    }

    /** Sets the flag and wakes any thread blocked in {@link #sleepInterruptible}. */
    public void requestStop() {
        state.lock.lock();
        try {
            state.stopped = true;
            state.wake.signalAll();
        } finally {
            state.lock.unlock();
        }
    }

    /** Clears the flag so the control can be reused for the next run. */
    public void reset() {
        state.lock.lock();
        try {
            state.stopped = false;
        } finally {
            state.lock.unlock();
        }
    }

    public boolean isStopped() {
        state.lock.lock();
        try {
            return state.stopped;
        } finally {
            state.lock.unlock();
        }
    }

    /**
     * Blocks for up to {@code millis}, waking early on a stop request. Waits in slices so the flag
     * is re-read at least every slice even without a signal.
     *
     * @return true if the run should continue, false if a stop was requested
     */
    public boolean sleepInterruptible(long millis) {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(Math.max(0, millis));
        long slice = TimeUnit.MILLISECONDS.toNanos(sliceMillis);
        state.lock.lock();
        try {
            while (!state.stopped) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) return true;
                state.wake.awaitNanos(Math.min(remaining, slice));
            }
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            state.stopped = true;
            return false;
        } finally {
            state.lock.unlock();
        }
    }
}
