package com.rpaflow.core.execution;

import com.rpaflow.core.ir.IrCompiler;
import com.rpaflow.core.ir.IrProgram;
import com.rpaflow.core.model.Project;
import com.rpaflow.debug.Debug;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Host side of a run: owns the dedicated run thread, forwards commands to the engine and
 * buffers the engine's events for the host to drain.
 */
public final class ExecutionRunner {

    private static final String TAG = "rpa.vm";

    private final ExecutionEngine engine;
    private final StopControl stop;
    private final BlockingQueue<ExecutionEvent> events = new LinkedBlockingQueue<>();
    private final CountDownLatch done = new CountDownLatch(1);
    private volatile ExecutionResult result;
    private Thread thread;

    public ExecutionRunner(ExecutionEngine engine) {
        this.engine = engine;
        this.stop = engine.getStopControl().share();
        engine.setEventListener(events::add);
    }

    /** Compiles the project and starts running it on a new thread. */
    public static ExecutionRunner start(Project project) {
        IrProgram program = new IrCompiler().compile(project);
        ExecutionRunner runner = new ExecutionRunner(new ExecutionEngine(project, program, new StopControl()));
        runner.start();
        return runner;
    }

    public synchronized void start() {
        if (thread != null) throw new IllegalStateException("Runner already started");
        thread = new Thread(() -> {
            try {
                result = engine.run();
            } finally {
                done.countDown();
            }
        }, "rpa-run");
        thread.setDaemon(true);
        thread.start();
        Debug.get().d(TAG, "run thread started");
    }

    public void send(ExecutionCommand command) {
        switch (command) {
            case STOP:
                stop.requestStop();
                break;
            default:
                throw new IllegalArgumentException("Unsupported command " + command);
        }
    }

    public void stop() {
        send(ExecutionCommand.STOP);
    }

    /** Live event queue; the terminal event is Completed or Error. */
    public BlockingQueue<ExecutionEvent> events() {
        return events;
    }

    public ExecutionEvent pollEvent(long timeout, TimeUnit unit) throws InterruptedException {
        return events.poll(timeout, unit);
    }

    public boolean isRunning() {
        return thread != null && done.getCount() > 0;
    }

    public ExecutionResult awaitResult() throws InterruptedException {
        done.await();
        return result;
    }

    /** Null when the run has not finished within the timeout. */
    public ExecutionResult awaitResult(long timeout, TimeUnit unit) throws InterruptedException {
        return done.await(timeout, unit) ? result : null;
    }
}
