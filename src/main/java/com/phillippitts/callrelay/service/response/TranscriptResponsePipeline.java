package com.phillippitts.callrelay.service.response;

import com.phillippitts.callrelay.domain.CallContext;
import com.phillippitts.callrelay.domain.CallSession;
import com.phillippitts.callrelay.exception.CallNotFoundException;
import com.phillippitts.callrelay.exception.ExternalCapabilityException;
import com.phillippitts.callrelay.protocol.outbound.CallAiResponseMessage;
import com.phillippitts.callrelay.service.call.CallSessionStore;
import com.phillippitts.callrelay.service.call.event.CallEndedEvent;
import com.phillippitts.callrelay.service.call.event.CallSummarizedEvent;
import com.phillippitts.callrelay.service.capability.AssistantDirective;
import com.phillippitts.callrelay.service.capability.CapabilityInvoker;
import com.phillippitts.callrelay.service.capability.CapabilityNames;
import com.phillippitts.callrelay.service.capability.ResponseCapability;
import com.phillippitts.callrelay.service.capability.SummaryCapability;
import com.phillippitts.callrelay.service.connection.ConnectionRegistry;
import com.phillippitts.callrelay.service.observer.CallObserverFanout;
import com.phillippitts.callrelay.util.KeyedSerialExecutor;
import com.phillippitts.callrelay.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Turns transcript deltas into device instructions and ended calls into summaries.
 *
 * <p>All work for one call runs on {@link KeyedSerialExecutor} keyed by call id: deltas are
 * answered in arrival order and the summary step runs after every delta queued before the
 * call ended. Different calls are processed in parallel.
 *
 * <p>Response handling:
 * <ul>
 *   <li>The reply is parsed with {@link AssistantDirective}; a blank reply is dropped.</li>
 *   <li>The instruction goes to the owning device if it is still connected.</li>
 *   <li>Observers always receive it, connected device or not.</li>
 * </ul>
 *
 * <p>A delta answered after its call has ended is dropped; the device is not told to speak
 * on a call that is over.
 *
 * <p>Capability failures are logged and skip the step. They never change call status.
 */
@Service
public class TranscriptResponsePipeline {

    private static final Logger LOG = LogManager.getLogger(TranscriptResponsePipeline.class);

    private final CallSessionStore store;
    private final ConnectionRegistry registry;
    private final CallObserverFanout fanout;
    private final CapabilityInvoker invoker;
    private final ResponseCapability responder;
    private final SummaryCapability summarizer;
    private final KeyedSerialExecutor callWorkQueue;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    public TranscriptResponsePipeline(CallSessionStore store,
                                      ConnectionRegistry registry,
                                      CallObserverFanout fanout,
                                      CapabilityInvoker invoker,
                                      ResponseCapability responder,
                                      SummaryCapability summarizer,
                                      KeyedSerialExecutor callWorkQueue,
                                      ApplicationEventPublisher publisher,
                                      Clock clock) {
        this.store = Objects.requireNonNull(store);
        this.registry = Objects.requireNonNull(registry);
        this.fanout = Objects.requireNonNull(fanout);
        this.invoker = Objects.requireNonNull(invoker);
        this.responder = Objects.requireNonNull(responder);
        this.summarizer = Objects.requireNonNull(summarizer);
        this.callWorkQueue = Objects.requireNonNull(callWorkQueue);
        this.publisher = Objects.requireNonNull(publisher);
        this.clock = Objects.requireNonNull(clock);
    }

    /**
     * Queues response generation for one delta behind earlier work for the same call.
     *
     * @return future completed when the delta has been handled
     */
    public CompletableFuture<Void> onTranscriptDelta(String callId, String delta) {
        return callWorkQueue.submit(callId, () -> respond(callId, delta));
    }

    @EventListener
    @Order(1)
    public void onCallEnded(CallEndedEvent event) {
        finalizeCall(event.session().callId(), event.generation());
    }

    /**
     * Queues the summary step. Call this once per call; the store guarantees that for the
     * {@link CallEndedEvent} path.
     *
     * @param generation registration number of the ended call
     * @return future completed when finalization has run
     */
    public CompletableFuture<Void> finalizeCall(String callId, long generation) {
        return callWorkQueue.submit(callId, () -> summarize(callId, generation));
    }

    void respond(String callId, String delta) {
        Optional<AssistantDirective> directive;
        CallSession session;
        try {
            session = store.requireCall(callId);
            if (session.status().isTerminal()) {
                LOG.debug("Call {} already ended, response to delta dropped", callId);
                return;
            }
            CallContext context = CallContext.of(session);
            String reply = invoker.invoke(CapabilityNames.RESPOND, callId,
                    () -> responder.generateResponse(delta, context));
            directive = AssistantDirective.parse(reply);
        } catch (ExternalCapabilityException e) {
            LOG.warn("Response skipped for call {}: {}", callId, e.getMessage());
            return;
        } catch (CallNotFoundException e) {
            LOG.debug("Call {} no longer retained, response dropped", callId);
            return;
        }
        if (directive.isEmpty()) {
            LOG.debug("Assistant had nothing to say for call {}", callId);
            return;
        }

        AssistantDirective instruction = directive.get();
        CallAiResponseMessage message = new CallAiResponseMessage(
                callId, instruction.type(), instruction.text(), clock.instant().toString());
        boolean delivered = registry.send(session.deviceId(), message);
        if (!delivered) {
            LOG.info("Device {} of call {} unreachable, {} instruction delivered to observers only",
                    session.deviceId(), callId, instruction.type().wireName());
        } else {
            LOG.info("Call {} instruction {}: '{}'", callId, instruction.type().wireName(),
                    LogSanitizer.preview(instruction.text()));
        }
        fanout.publish(callId, message);
    }

    void summarize(String callId, long generation) {
        CallSession ended;
        String summary;
        try {
            Optional<CallSession> current = store.getCall(callId, generation);
            if (current.isEmpty()) {
                LOG.debug("Call {} expired or was registered again before finalization", callId);
                return;
            }
            ended = current.get();
            String transcript = ended.transcript();
            if (transcript == null || transcript.isBlank()) {
                LOG.info("No transcript available for call {}, skipping summary", callId);
                return;
            }
            LOG.info("Finalizing call {} with transcript length {}", callId, transcript.length());
            CallContext context = CallContext.of(ended);
            summary = invoker.invoke(CapabilityNames.SUMMARIZE, callId,
                    () -> summarizer.summarize(transcript, context));
        } catch (ExternalCapabilityException e) {
            LOG.warn("Summary failed for call {}: {}", callId, e.getMessage());
            return;
        }
        if (summary == null || summary.isBlank()) {
            LOG.info("Summary for call {} came back empty", callId);
            return;
        }
        Optional<CallSession> attached = store.attachSummary(callId, generation, summary.trim());
        if (attached.isEmpty()) {
            return;
        }
        CallSession summarized = attached.get();
        fanout.publishSummary(callId, summarized.summary());
        publisher.publishEvent(new CallSummarizedEvent(summarized));
    }
}
