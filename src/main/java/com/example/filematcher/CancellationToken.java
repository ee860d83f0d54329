package com.example.filematcher;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation flag shared between a run and the interrupt handler. The run only looks at it
 * between groups, so an operation in progress always finishes or rolls back first.
 */
public final class CancellationToken {
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final AtomicBoolean executing = new AtomicBoolean();
    private final CountDownLatch finished = new CountDownLatch(1);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    void markExecuting() {
        executing.set(true);
    }

    void markFinished() {
        executing.set(false);
        finished.countDown();
    }

    /**
     * Blocks until the run has reached a group boundary and closed its audit log.
     * Returns immediately when nothing is being executed.
     */
    public boolean awaitFinish(Duration timeout) throws InterruptedException {
        if (!executing.get()) {
            return true;
        }
        return finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }
}
