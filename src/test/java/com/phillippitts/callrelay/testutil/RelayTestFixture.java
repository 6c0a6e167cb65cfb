package com.phillippitts.callrelay.testutil;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phillippitts.callrelay.config.properties.CallProperties;
import com.phillippitts.callrelay.service.audio.AudioIngestPipeline;
import com.phillippitts.callrelay.service.audio.TranscriptionBatchingPolicy;
import com.phillippitts.callrelay.service.call.CallSessionStore;
import com.phillippitts.callrelay.service.call.event.CallEndedEvent;
import com.phillippitts.callrelay.service.call.event.CallSummarizedEvent;
import com.phillippitts.callrelay.service.call.event.CallUpdatedEvent;
import com.phillippitts.callrelay.service.capability.CapabilityInvoker;
import com.phillippitts.callrelay.service.connection.ConnectionRegistry;
import com.phillippitts.callrelay.service.connection.event.ConnectionClosedEvent;
import com.phillippitts.callrelay.service.metrics.CallRelayMetrics;
import com.phillippitts.callrelay.service.notify.CallChannelNotifier;
import com.phillippitts.callrelay.service.notify.ForwardAllImportancePolicy;
import com.phillippitts.callrelay.service.observer.CallObserverFanout;
import com.phillippitts.callrelay.service.response.TranscriptResponsePipeline;
import com.phillippitts.callrelay.service.routing.MessageRouter;
import com.phillippitts.callrelay.util.KeyedSerialExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Duration;
import java.util.concurrent.Executor;

/**
 * Fully wired relay without a Spring context.
 *
 * <p>Every executor is a {@link SyncExecutor}, so a routed message has produced all of its
 * side effects (transcription, responses, summaries, notifications) by the time the call
 * returns. Events are forwarded to the same listeners Spring would call, in the same order.
 * Capability timeouts are generous because nothing runs asynchronously.
 *
 * <p>{@link #RelayTestFixture(CallProperties, Executor)} puts a real pool under the per-call
 * work queue instead, for tests that need a transcription to still be running while other
 * messages arrive. Capabilities still run on the calling worker.
 */
public final class RelayTestFixture implements AutoCloseable {

    public final MutableClock clock = MutableClock.startingAt("2025-01-01T10:00:00Z");
    public final EventCapturingPublisher publisher = new EventCapturingPublisher();
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    public final CallRelayMetrics metrics = new CallRelayMetrics(meterRegistry);
    public final ObjectMapper objectMapper = Jackson2ObjectMapperBuilder.json().build();
    public final ScriptedAssistant assistant = new ScriptedAssistant();
    public final RecordingChannelNotifier channel = new RecordingChannelNotifier();
    public final ThreadPoolTaskScheduler scheduler;
    public final ConnectionRegistry registry;
    public final CallSessionStore store;
    public final CallObserverFanout fanout;
    public final CapabilityInvoker invoker;
    public final KeyedSerialExecutor callWorkQueue;
    public final TranscriptionBatchingPolicy policy;
    public final TranscriptResponsePipeline responsePipeline;
    public final AudioIngestPipeline audioPipeline;
    public final CallChannelNotifier channelNotifier;
    public final MessageRouter router;

    private final ValidatorFactory validatorFactory;

    public RelayTestFixture() {
        this(CallProperties.defaults());
    }

    public RelayTestFixture(CallProperties properties) {
        this(properties, new SyncExecutor());
    }

    public RelayTestFixture(CallProperties properties, Executor pipeline) {
        SyncExecutor direct = new SyncExecutor();
        scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("test-sched-");
        scheduler.initialize();

        registry = new ConnectionRegistry(objectMapper, publisher, metrics, clock);
        store = new CallSessionStore(properties, publisher, scheduler, clock);
        fanout = new CallObserverFanout(registry, clock);
        invoker = new CapabilityInvoker(direct, metrics, Duration.ofSeconds(5));
        callWorkQueue = new KeyedSerialExecutor(pipeline);
        policy = new TranscriptionBatchingPolicy(properties);
        responsePipeline = new TranscriptResponsePipeline(store, registry, fanout, invoker,
                assistant, assistant, callWorkQueue, publisher, clock);
        audioPipeline = new AudioIngestPipeline(store, policy, invoker, assistant, fanout,
                responsePipeline, callWorkQueue, metrics);
        channelNotifier = new CallChannelNotifier(channel, new ForwardAllImportancePolicy(), invoker, direct);

        validatorFactory = Validation.buildDefaultValidatorFactory();
        Validator validator = validatorFactory.getValidator();
        router = new MessageRouter(registry, store, audioPipeline, fanout, objectMapper, validator);

        publisher.addListener(event -> {
            if (event instanceof CallUpdatedEvent updated) {
                fanout.onCallUpdated(updated);
                channelNotifier.onCallUpdated(updated);
            } else if (event instanceof CallEndedEvent ended) {
                audioPipeline.onCallEnded(ended);
                responsePipeline.onCallEnded(ended);
            } else if (event instanceof CallSummarizedEvent summarized) {
                channelNotifier.onCallSummarized(summarized);
            } else if (event instanceof ConnectionClosedEvent closed) {
                fanout.onConnectionClosed(closed);
            }
        });
    }

    /**
     * Registers a fake transport under {@code connectionId} and returns it.
     */
    public FakeTransportHandle connect(String connectionId) {
        FakeTransportHandle handle = new FakeTransportHandle();
        registry.register(connectionId, handle);
        return handle;
    }

    /**
     * Routes a JSON frame built from single-quoted text ({@code {'type':'ping'}}).
     */
    public void send(String connectionId, String singleQuotedJson) {
        router.route(connectionId, singleQuotedJson.replace('\'', '"'));
    }

    @Override
    public void close() {
        store.shutdown();
        scheduler.shutdown();
        validatorFactory.close();
    }
}
