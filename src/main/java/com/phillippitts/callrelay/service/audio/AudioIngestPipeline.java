package com.phillippitts.callrelay.service.audio;

import com.phillippitts.callrelay.domain.CallContext;
import com.phillippitts.callrelay.exception.CallNotFoundException;
import com.phillippitts.callrelay.exception.ExternalCapabilityException;
import com.phillippitts.callrelay.exception.MalformedMessageException;
import com.phillippitts.callrelay.service.call.AudioWindow;
import com.phillippitts.callrelay.service.call.CallSessionStore;
import com.phillippitts.callrelay.service.call.event.CallEndedEvent;
import com.phillippitts.callrelay.service.capability.CapabilityInvoker;
import com.phillippitts.callrelay.service.capability.CapabilityNames;
import com.phillippitts.callrelay.service.capability.TranscriptionCapability;
import com.phillippitts.callrelay.service.metrics.CallRelayMetrics;
import com.phillippitts.callrelay.service.observer.CallObserverFanout;
import com.phillippitts.callrelay.service.response.TranscriptResponsePipeline;
import com.phillippitts.callrelay.util.KeyedSerialExecutor;
import com.phillippitts.callrelay.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

import java.util.Base64;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;

/**
 * Buffers call audio and turns it into transcript deltas.
 *
 * <p>Flow:
 * <ol>
 *   <li>{@link #ingestAudio(String, byte[])} appends the fragment to the call's buffer and
 *       returns immediately.</li>
 *   <li>When {@link TranscriptionBatchingPolicy} says a batch is due and no attempt is
 *       outstanding, {@link #transcriptionAttempt(String)} is queued on the call's ordered work
 *       queue.</li>
 *   <li>A non-blank delta is appended to the session transcript, published to observers and
 *       handed to {@link TranscriptResponsePipeline} unless the call has ended meanwhile.</li>
 * </ol>
 *
 * <p>When a call ends, audio received since the last batch is transcribed once more and
 * published with {@code isFinal=true}. That flush is queued behind any attempt still running
 * for the call and ahead of the summary step, so the summary sees the whole transcript.
 *
 * <p>Capability failures skip the attempt; the audio stays pending and is retried with the
 * next batch.
 */
@Service
public class AudioIngestPipeline {

    private static final Logger LOG = LogManager.getLogger(AudioIngestPipeline.class);

    private final CallSessionStore store;
    private final TranscriptionBatchingPolicy policy;
    private final CapabilityInvoker invoker;
    private final TranscriptionCapability transcription;
    private final CallObserverFanout fanout;
    private final TranscriptResponsePipeline responsePipeline;
    private final KeyedSerialExecutor callWorkQueue;
    private final CallRelayMetrics metrics;

    public AudioIngestPipeline(CallSessionStore store,
                               TranscriptionBatchingPolicy policy,
                               CapabilityInvoker invoker,
                               TranscriptionCapability transcription,
                               CallObserverFanout fanout,
                               TranscriptResponsePipeline responsePipeline,
                               KeyedSerialExecutor callWorkQueue,
                               CallRelayMetrics metrics) {
        this.store = Objects.requireNonNull(store);
        this.policy = Objects.requireNonNull(policy);
        this.invoker = Objects.requireNonNull(invoker);
        this.transcription = Objects.requireNonNull(transcription);
        this.fanout = Objects.requireNonNull(fanout);
        this.responsePipeline = Objects.requireNonNull(responsePipeline);
        this.callWorkQueue = Objects.requireNonNull(callWorkQueue);
        this.metrics = Objects.requireNonNull(metrics);
    }

    /**
     * Decodes a base64 fragment and ingests it.
     *
     * @throws MalformedMessageException if {@code base64Audio} is not valid base64 or is empty
     * @throws CallNotFoundException     if the call is unknown
     */
    public IngestResult ingestAudio(String callId, String base64Audio) {
        byte[] fragment;
        try {
            fragment = Base64.getDecoder().decode(base64Audio == null ? "" : base64Audio.trim());
        } catch (IllegalArgumentException e) {
            throw new MalformedMessageException("audio is not valid base64", e);
        }
        if (fragment.length == 0) {
            throw new MalformedMessageException("audio must not be empty");
        }
        return ingestAudio(callId, fragment);
    }

    /**
     * Appends one fragment and triggers a transcription attempt if a batch is due.
     *
     * @throws CallNotFoundException if the call is unknown
     * @throws com.phillippitts.callrelay.exception.InvalidTransitionException if the call has ended
     */
    public IngestResult ingestAudio(String callId, byte[] fragment) {
        int count = store.appendAudio(callId, fragment);
        boolean triggered = policy.isDue(count) && triggerTranscription(callId);
        if (count % 100 == 0) {
            LOG.debug("Call {} buffered {} audio fragment(s)", callId, count);
        }
        return new IngestResult(count, triggered);
    }

    /**
     * Transcribes audio received since the last successful attempt and forwards the delta.
     * Does not claim the outstanding slot; callers that need the guard go through
     * {@link TranscriptionBatchingPolicy#tryBegin(String)} first.
     *
     * @return the transcript delta, or empty if there was nothing to transcribe, the result
     *         was blank, or the capability failed
     */
    public Optional<String> transcriptionAttempt(String callId) {
        return transcribePending(callId, false);
    }

    /**
     * Runs the final transcription of an ended call on its work queue, ahead of the summary.
     */
    @EventListener
    @Order(0)
    public void onCallEnded(CallEndedEvent event) {
        String callId = event.session().callId();
        long generation = event.generation();
        callWorkQueue.submit(callId, () -> flushFinal(callId, generation));
    }

    /**
     * Every batch attempt of the call runs on the same ordered queue, so none is in flight here.
     */
    void flushFinal(String callId, long generation) {
        if (!store.isCurrent(callId, generation)) {
            LOG.debug("Call {} was registered again, final transcription dropped", callId);
            return;
        }
        transcribePending(callId, true);
    }

    private boolean triggerTranscription(String callId) {
        if (!policy.tryBegin(callId)) {
            metrics.incrementTranscriptionSkipped();
            LOG.debug("Transcription for call {} skipped, previous attempt outstanding", callId);
            return false;
        }
        CompletableFuture<Void> attempt = callWorkQueue.submit(callId, () -> {
            try {
                transcriptionAttempt(callId);
            } finally {
                policy.complete(callId);
            }
        });
        attempt.whenComplete((ignored, error) -> {
            if (error instanceof RejectedExecutionException) {
                policy.complete(callId);
                LOG.warn("Transcription for call {} rejected by pipeline pool", callId);
            }
        });
        return !attempt.isCompletedExceptionally();
    }

    private Optional<String> transcribePending(String callId, boolean finalSegment) {
        try {
            Optional<AudioWindow> pending = store.pendingAudio(callId);
            if (pending.isEmpty()) {
                return Optional.empty();
            }
            AudioWindow window = pending.get();
            CallContext context = store.contextFor(callId);
            String text = invoker.invoke(CapabilityNames.TRANSCRIBE, callId,
                    () -> transcription.transcribe(window.audio(), context));
            store.markTranscribed(callId, window.toFragment());

            if (text == null || text.isBlank()) {
                LOG.debug("Call {} fragments [{}, {}) produced no text", callId,
                        window.fromFragment(), window.toFragment());
                return Optional.empty();
            }
            String delta = text.trim();
            store.appendTranscript(callId, delta);
            LOG.info("Call {} transcript delta ({} fragment(s), final={}): '{}'", callId,
                    window.fragmentCount(), finalSegment, LogSanitizer.preview(delta));

            fanout.publishTranscript(callId, delta, finalSegment);
            if (!finalSegment && !store.requireCall(callId).status().isTerminal()) {
                responsePipeline.onTranscriptDelta(callId, delta);
            }
            return Optional.of(delta);
        } catch (ExternalCapabilityException e) {
            LOG.warn("Transcription skipped for call {}: {}", callId, e.getMessage());
            return Optional.empty();
        } catch (CallNotFoundException e) {
            LOG.debug("Call {} no longer retained, transcription dropped", callId);
            return Optional.empty();
        }
    }
}
