package com.phillippitts.callrelay.util;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs tasks on a shared executor while keeping submission order per key.
 *
 * <p>Each key has a tail future; a new task is chained behind the current tail, so two tasks
 * for the same key never overlap and run in the order they were submitted. Tasks for
 * different keys do not wait for each other. A failing task is logged and does not break
 * the chain.
 *
 * <p>Thread-safe. Tails are dropped once a key's queue drains, so idle keys cost nothing.
 */
public class KeyedSerialExecutor {

    private static final Logger LOG = LogManager.getLogger(KeyedSerialExecutor.class);

    private final Executor delegate;
    private final ConcurrentMap<String, CompletableFuture<Void>> tails = new ConcurrentHashMap<>();

    public KeyedSerialExecutor(Executor delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
    }

    /**
     * Queues {@code task} behind every task previously submitted for {@code key}.
     *
     * @param key ordering key (a call id)
     * @param task work to run
     * @return future completed when the task has run; completed exceptionally if it threw
     *         or could not be scheduled
     */
    public CompletableFuture<Void> submit(String key, Runnable task) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(task, "task must not be null");

        CompletableFuture<Void> done = new CompletableFuture<>();
        CompletableFuture<Void> previous = tails.put(key, done);
        Runnable step = () -> runStep(key, task, done);

        if (previous == null) {
            dispatch(key, step, done);
        } else {
            previous.whenComplete((ignored, error) -> dispatch(key, step, done));
        }
        return done;
    }

    /**
     * @return number of keys with queued or running work
     */
    public int activeKeys() {
        return tails.size();
    }

    private void dispatch(String key, Runnable step, CompletableFuture<Void> done) {
        try {
            delegate.execute(step);
        } catch (RejectedExecutionException e) {
            LOG.warn("Task for key {} rejected by executor", key, e);
            tails.remove(key, done);
            done.completeExceptionally(e);
        }
    }

    private void runStep(String key, Runnable task, CompletableFuture<Void> done) {
        RuntimeException failure = null;
        try {
            task.run();
        } catch (RuntimeException e) {
            LOG.warn("Task for key {} failed: {}", key, e.toString(), e);
            failure = e;
        } finally {
            tails.remove(key, done);
            if (failure == null) {
                done.complete(null);
            } else {
                done.completeExceptionally(failure);
            }
        }
    }
}
