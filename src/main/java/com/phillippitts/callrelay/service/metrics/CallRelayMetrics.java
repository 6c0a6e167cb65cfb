package com.phillippitts.callrelay.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for the call relay.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>External capability latency and success/failure per capability (transcribe, respond, summarize, notify)</li>
 *   <li>Failed directed sends</li>
 *   <li>Connections evicted for inactivity</li>
 *   <li>Transcription attempts skipped because one was still outstanding</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class CallRelayMetrics {

    private static final String METRIC_PREFIX = "callrelay";

    private final MeterRegistry registry;

    public CallRelayMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records how long one capability invocation took, successful or not.
     *
     * @param capability capability name
     * @param durationNanos duration in nanoseconds
     */
    public void recordCapabilityLatency(String capability, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".capability.latency")
                .description("Time taken by external capability calls")
                .tag("capability", capability)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementCapabilitySuccess(String capability) {
        Counter.builder(METRIC_PREFIX + ".capability.success")
                .description("Number of successful capability calls")
                .tag("capability", capability)
                .register(registry)
                .increment();
    }

    /**
     * @param capability capability name
     * @param reason failure reason (timeout, error, rejected, interrupted)
     */
    public void incrementCapabilityFailure(String capability, String reason) {
        Counter.builder(METRIC_PREFIX + ".capability.failure")
                .description("Number of failed capability calls")
                .tag("capability", capability)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * @param reason unknown, closed or write_error
     */
    public void incrementDeliveryFailure(String reason) {
        Counter.builder(METRIC_PREFIX + ".delivery.failure")
                .description("Number of messages that could not be delivered to a connection")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementEvictions(int count) {
        Counter.builder(METRIC_PREFIX + ".connection.evicted")
                .description("Number of connections closed for inactivity")
                .register(registry)
                .increment(count);
    }

    public void incrementTranscriptionSkipped() {
        Counter.builder(METRIC_PREFIX + ".transcription.skipped")
                .description("Transcription triggers skipped while an attempt was outstanding")
                .register(registry)
                .increment();
    }
}
