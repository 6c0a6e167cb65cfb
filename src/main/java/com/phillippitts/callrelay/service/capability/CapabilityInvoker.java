package com.phillippitts.callrelay.service.capability;

import com.phillippitts.callrelay.config.properties.CallProperties;
import com.phillippitts.callrelay.exception.CapabilityExceptionBuilder;
import com.phillippitts.callrelay.exception.ExternalCapabilityException;
import com.phillippitts.callrelay.service.metrics.CallRelayMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs external capability calls on the capability pool with a bounded wait.
 *
 * <p>Every invocation becomes its own {@link CompletableFuture}. The calling thread waits at
 * most {@code relay.call.capability-timeout}; on timeout the future is cancelled and an
 * {@link ExternalCapabilityException} with {@code timedOut=true} is thrown. Failures of the
 * capability itself, pool saturation and interruption surface as the same exception type,
 * so callers handle one recoverable failure.
 *
 * <p>Never call this while holding a store or registry lock.
 */
@Component
public class CapabilityInvoker {

    private static final Logger LOG = LogManager.getLogger(CapabilityInvoker.class);

    private final Executor executor;
    private final CallRelayMetrics metrics;
    private final long timeoutMs;

    @Autowired
    public CapabilityInvoker(@Qualifier("capabilityExecutor") Executor executor,
                             CallRelayMetrics metrics,
                             CallProperties properties) {
        this(executor, metrics, properties.getCapabilityTimeout());
    }

    public CapabilityInvoker(Executor executor, CallRelayMetrics metrics, Duration timeout) {
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.timeoutMs = Math.max(1, Objects.requireNonNull(timeout, "timeout must not be null").toMillis());
    }

    /**
     * @param capability capability name, see {@link CapabilityNames}
     * @param callId     call the invocation is made for (log and exception detail only)
     * @param call       the blocking capability call
     * @return the capability's result
     * @throws ExternalCapabilityException on failure, timeout, rejection or interruption
     */
    public <T> T invoke(String capability, String callId, Supplier<T> call) {
        Objects.requireNonNull(call, "call must not be null");
        long t0 = System.nanoTime();

        CompletableFuture<T> future;
        try {
            future = CompletableFuture.supplyAsync(call, executor);
        } catch (RejectedExecutionException e) {
            metrics.incrementCapabilityFailure(capability, "rejected");
            throw CapabilityExceptionBuilder.create("Capability pool saturated")
                    .capability(capability)
                    .callId(callId)
                    .cause(e)
                    .build();
        }

        try {
            T result = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            metrics.incrementCapabilitySuccess(capability);
            return result;
        } catch (TimeoutException e) {
            future.cancel(true);
            metrics.incrementCapabilityFailure(capability, "timeout");
            LOG.warn("Capability {} timed out after {} ms (callId={})", capability, timeoutMs, callId);
            throw CapabilityExceptionBuilder.create("Capability call timed out")
                    .capability(capability)
                    .callId(callId)
                    .timedOut(true)
                    .durationMs(timeoutMs)
                    .build();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            metrics.incrementCapabilityFailure(capability, "interrupted");
            throw CapabilityExceptionBuilder.create("Interrupted while waiting for capability")
                    .capability(capability)
                    .callId(callId)
                    .cause(e)
                    .build();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            metrics.incrementCapabilityFailure(capability, "error");
            if (cause instanceof ExternalCapabilityException ece) {
                throw ece;
            }
            throw CapabilityExceptionBuilder.create("Capability call failed")
                    .capability(capability)
                    .callId(callId)
                    .cause(cause)
                    .durationMs((System.nanoTime() - t0) / 1_000_000L)
                    .metadata("error", cause.getClass().getSimpleName())
                    .build();
        } finally {
            metrics.recordCapabilityLatency(capability, System.nanoTime() - t0);
        }
    }
}
