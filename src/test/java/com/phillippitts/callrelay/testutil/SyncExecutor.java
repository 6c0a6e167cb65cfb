package com.phillippitts.callrelay.testutil;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs every task on the calling thread so pipeline hand-offs complete before the
 * triggering call returns. Counts executed tasks and can be switched to reject work,
 * standing in for a saturated pool.
 */
public class SyncExecutor implements Executor {

    private final AtomicInteger executed = new AtomicInteger();
    private volatile boolean rejecting;

    @Override
    public void execute(Runnable command) {
        if (rejecting) {
            throw new RejectedExecutionException("executor saturated");
        }
        executed.incrementAndGet();
        command.run();
    }

    public void rejectAll() {
        this.rejecting = true;
    }

    public int executedCount() {
        return executed.get();
    }
}
