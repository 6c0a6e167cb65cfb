package com.phillippitts.callrelay.service.call;

import com.phillippitts.callrelay.config.properties.CallProperties;
import com.phillippitts.callrelay.domain.CallContext;
import com.phillippitts.callrelay.domain.CallSession;
import com.phillippitts.callrelay.domain.CallStatus;
import com.phillippitts.callrelay.exception.CallNotFoundException;
import com.phillippitts.callrelay.exception.DuplicateCallException;
import com.phillippitts.callrelay.exception.InvalidTransitionException;
import com.phillippitts.callrelay.service.call.event.CallEndedEvent;
import com.phillippitts.callrelay.service.call.event.CallUpdatedEvent;
import com.phillippitts.callrelay.util.LogSanitizer;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory call sessions and their audio buffers.
 *
 * <p>State machine per call:
 * <pre>
 * RINGING → ANSWERED → IN_PROGRESS → ENDED
 *     └──────────┴───────────┴──────→ ENDED
 * </pre>
 *
 * <p>Every mutation of one call runs under that call's lock; different calls never contend.
 * {@link CallUpdatedEvent} is published while the lock is held so listeners observe
 * transitions in the order they were applied. {@link CallEndedEvent} is published after the
 * lock is released. No external capability is ever invoked from here.
 *
 * <p>At the first {@code ended} transition the store computes the duration, publishes
 * {@link CallEndedEvent} (guarded by a one-shot flag) and schedules the audio buffer for
 * removal after {@code relay.call.audio-retention}. Session metadata lives until the history
 * sweep removes it after {@code relay.call.history-retention}.
 *
 * <p>Each registration gets a new generation number. Work queued for an ended call carries
 * the generation from its {@link CallEndedEvent}, so it cannot touch a later registration
 * that reused the same call id.
 */
@Service
public class CallSessionStore {

    private static final Logger LOG = LogManager.getLogger(CallSessionStore.class);

    private final ConcurrentMap<String, CallRecord> calls = new ConcurrentHashMap<>();
    private final AtomicLong generations = new AtomicLong();
    private final CallProperties properties;
    private final ApplicationEventPublisher publisher;
    private final TaskScheduler scheduler;
    private final Clock clock;

    public CallSessionStore(CallProperties properties,
                            ApplicationEventPublisher publisher,
                            @Qualifier("taskScheduler") TaskScheduler scheduler,
                            Clock clock) {
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Creates a session in {@code ringing}.
     *
     * <p>An ended session still held for history may be replaced by a new registration under
     * the same id; a live one may not.
     *
     * @param deviceId connection id of the owning device
     * @throws DuplicateCallException if a live session with {@code callId} exists
     */
    public CallSession registerCall(String callId, String phoneNumber, String deviceId, boolean incoming) {
        Objects.requireNonNull(callId, "callId must not be null");
        CallRecord fresh = new CallRecord(callId, generations.incrementAndGet(),
                phoneNumber, deviceId, incoming, clock.instant());
        fresh.lock.lock();
        try {
            calls.compute(callId, (id, existing) -> {
                if (existing != null && !existing.isEnded()) {
                    throw new DuplicateCallException(id);
                }
                if (existing != null) {
                    existing.cancelCleanup();
                    LOG.debug("Replacing ended session {} with a new registration", id);
                }
                return fresh;
            });
            CallSession snapshot = fresh.snapshot(false);
            LOG.info("Call registered: callId={}, phone={}, device={}, incoming={}",
                    callId, LogSanitizer.maskPhoneNumber(phoneNumber), deviceId, incoming);
            publisher.publishEvent(new CallUpdatedEvent(snapshot, null));
            return snapshot;
        } finally {
            fresh.lock.unlock();
        }
    }

    /**
     * Applies a status transition.
     *
     * @return snapshot after the transition, transcript omitted
     * @throws CallNotFoundException      if the call is unknown
     * @throws InvalidTransitionException if {@code next} is not a legal successor
     */
    public CallSession updateStatus(String callId, CallStatus next) {
        CallRecord record = require(callId);
        CallSession snapshot;
        CallSession ended = null;
        record.lock.lock();
        try {
            CallStatus previous = record.status;
            if (!previous.canTransitionTo(next)) {
                throw new InvalidTransitionException(callId, previous, next);
            }
            Instant now = clock.instant();
            record.status = next;
            if (next == CallStatus.ANSWERED) {
                record.answeredAt = now;
            } else if (next == CallStatus.ENDED) {
                record.endedAt = now;
                Instant base = record.answeredAt != null ? record.answeredAt : record.startedAt;
                record.durationSeconds = Math.round(Duration.between(base, now).toMillis() / 1000.0);
            }
            snapshot = record.snapshot(false);
            LOG.info("Call {} status {} -> {}", callId, previous.wireName(), next.wireName());
            publisher.publishEvent(new CallUpdatedEvent(snapshot, previous));

            if (next == CallStatus.ENDED && record.finalized.compareAndSet(false, true)) {
                LOG.info("Call {} ended after {}s, finalizing", callId, record.durationSeconds);
                scheduleAudioCleanup(record);
                ended = record.snapshot(true);
            }
        } finally {
            record.lock.unlock();
        }
        if (ended != null) {
            publisher.publishEvent(new CallEndedEvent(ended, record.generation));
        }
        return snapshot;
    }

    /**
     * Appends one audio fragment.
     *
     * @return number of fragments received for the call so far
     * @throws CallNotFoundException      if the call is unknown
     * @throws InvalidTransitionException if the call has already ended
     */
    public int appendAudio(String callId, byte[] fragment) {
        Objects.requireNonNull(fragment, "fragment must not be null");
        CallRecord record = require(callId);
        record.lock.lock();
        try {
            if (record.isEnded()) {
                throw new InvalidTransitionException(callId, record.status,
                        "Call " + callId + " has ended; audio rejected");
            }
            record.audio.add(fragment.clone());
            record.receivedFragments++;
            return record.receivedFragments;
        } finally {
            record.lock.unlock();
        }
    }

    /**
     * Returns buffered audio received after the last transcribed mark, if any.
     */
    public Optional<AudioWindow> pendingAudio(String callId) {
        CallRecord record = require(callId);
        record.lock.lock();
        try {
            int from = record.transcribedFragments;
            int to = record.audio.size();
            if (to <= from) {
                return Optional.empty();
            }
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            for (int i = from; i < to; i++) {
                out.writeBytes(record.audio.get(i));
            }
            return Optional.of(new AudioWindow(from, to, out.toByteArray()));
        } finally {
            record.lock.unlock();
        }
    }

    /**
     * Moves the transcribed mark forward to {@code upTo} (exclusive fragment index).
     * Never moves it backwards.
     */
    public void markTranscribed(String callId, int upTo) {
        CallRecord record = require(callId);
        record.lock.lock();
        try {
            record.transcribedFragments = Math.max(record.transcribedFragments, Math.min(upTo, record.audio.size()));
        } finally {
            record.lock.unlock();
        }
    }

    /**
     * Appends a transcript delta. Deltas are joined with single spaces; blank deltas are ignored.
     *
     * @return accumulated transcript after the append
     */
    public String appendTranscript(String callId, String delta) {
        CallRecord record = require(callId);
        record.lock.lock();
        try {
            if (delta != null && !delta.isBlank()) {
                record.segments.add(delta.trim());
            }
            return record.transcript();
        } finally {
            record.lock.unlock();
        }
    }

    /**
     * Stores the summary produced at finalization.
     *
     * @param generation generation of the call that was summarized, from its {@link CallEndedEvent}
     * @return full snapshot with the summary attached, or empty if the call is gone or has been
     *         registered again since
     */
    public Optional<CallSession> attachSummary(String callId, long generation, String summary) {
        CallRecord record = calls.get(callId);
        if (record == null || record.generation != generation) {
            LOG.debug("Summary for call {} generation {} discarded, session superseded", callId, generation);
            return Optional.empty();
        }
        record.lock.lock();
        try {
            record.summary = summary;
            return Optional.of(record.snapshot(true));
        } finally {
            record.lock.unlock();
        }
    }

    /**
     * @return full snapshot of {@code callId} if it is still the registration numbered
     *         {@code generation}
     */
    public Optional<CallSession> getCall(String callId, long generation) {
        CallRecord record = callId == null ? null : calls.get(callId);
        if (record == null || record.generation != generation) {
            return Optional.empty();
        }
        record.lock.lock();
        try {
            return Optional.of(record.snapshot(true));
        } finally {
            record.lock.unlock();
        }
    }

    public boolean isCurrent(String callId, long generation) {
        CallRecord record = callId == null ? null : calls.get(callId);
        return record != null && record.generation == generation;
    }

    /**
     * @return full snapshot including the transcript, or empty if unknown
     */
    public Optional<CallSession> getCall(String callId) {
        CallRecord record = callId == null ? null : calls.get(callId);
        if (record == null) {
            return Optional.empty();
        }
        record.lock.lock();
        try {
            return Optional.of(record.snapshot(true));
        } finally {
            record.lock.unlock();
        }
    }

    /**
     * @throws CallNotFoundException if the call is unknown
     */
    public CallSession requireCall(String callId) {
        return getCall(callId).orElseThrow(() -> new CallNotFoundException(callId));
    }

    public CallContext contextFor(String callId) {
        return CallContext.of(requireCall(callId));
    }

    /**
     * @return every retained session (ended ones included until the history sweep removes
     *         them), oldest first, transcripts omitted
     */
    public List<CallSession> listActive() {
        List<CallSession> sessions = new ArrayList<>(calls.size());
        for (CallRecord record : calls.values()) {
            record.lock.lock();
            try {
                sessions.add(record.snapshot(false));
            } finally {
                record.lock.unlock();
            }
        }
        sessions.sort(Comparator.comparing(CallSession::startedAt));
        return sessions;
    }

    /**
     * @return copies of the buffered fragments in arrival order (empty once discarded)
     */
    public List<byte[]> audioFragments(String callId) {
        CallRecord record = require(callId);
        record.lock.lock();
        try {
            List<byte[]> copy = new ArrayList<>(record.audio.size());
            for (byte[] fragment : record.audio) {
                copy.add(fragment.clone());
            }
            return copy;
        } finally {
            record.lock.unlock();
        }
    }

    /**
     * Drops the audio buffer of a call. Metadata and transcript are kept.
     */
    public void discardAudio(String callId) {
        CallRecord record = callId == null ? null : calls.get(callId);
        if (record == null) {
            return;
        }
        record.lock.lock();
        try {
            int dropped = record.audio.size();
            record.audio.clear();
            record.transcribedFragments = 0;
            record.cleanup = null;
            LOG.debug("Discarded {} audio fragment(s) of call {}", dropped, callId);
        } finally {
            record.lock.unlock();
        }
    }

    @Scheduled(fixedDelayString = "${relay.call.history-cleanup-interval-ms:60000}",
            initialDelayString = "${relay.call.history-cleanup-interval-ms:60000}")
    public void sweepHistory() {
        expireHistory();
    }

    /**
     * Removes ended sessions whose end lies further back than the history retention.
     *
     * @return number of removed sessions
     */
    public int expireHistory() {
        Instant cutoff = clock.instant().minus(properties.getHistoryRetention());
        int removed = 0;
        for (CallRecord record : calls.values()) {
            Instant endedAt = record.endedAtSnapshot();
            if (endedAt == null || !endedAt.isBefore(cutoff)) {
                continue;
            }
            if (calls.remove(record.callId, record)) {
                record.cancelCleanup();
                removed++;
            }
        }
        if (removed > 0) {
            LOG.info("History sweep removed {} ended call(s), {} retained", removed, calls.size());
        }
        return removed;
    }

    public int size() {
        return calls.size();
    }

    @PreDestroy
    public void shutdown() {
        calls.values().forEach(CallRecord::cancelCleanup);
    }

    private CallRecord require(String callId) {
        CallRecord record = callId == null ? null : calls.get(callId);
        if (record == null) {
            throw new CallNotFoundException(callId);
        }
        return record;
    }

    private void scheduleAudioCleanup(CallRecord record) {
        Instant at = clock.instant().plus(properties.getAudioRetention());
        try {
            record.cleanup = scheduler.schedule(() -> discardAudio(record.callId), at);
        } catch (RuntimeException e) {
            LOG.warn("Could not schedule audio cleanup for call {}, discarding now", record.callId, e);
            record.audio.clear();
        }
    }

    /** Mutable per-call state. Guarded by {@link #lock}. */
    private static final class CallRecord {
        private final ReentrantLock lock = new ReentrantLock();
        private final AtomicBoolean finalized = new AtomicBoolean(false);
        private final String callId;
        private final long generation;
        private final String phoneNumber;
        private final String deviceId;
        private final boolean incoming;
        private final Instant startedAt;
        private final List<String> segments = new ArrayList<>();
        private final List<byte[]> audio = new ArrayList<>();
        private volatile CallStatus status = CallStatus.RINGING;
        private Instant answeredAt;
        private volatile Instant endedAt;
        private Long durationSeconds;
        private String summary;
        private int receivedFragments;
        private int transcribedFragments;
        private volatile ScheduledFuture<?> cleanup;

        private CallRecord(String callId, long generation, String phoneNumber, String deviceId,
                           boolean incoming, Instant startedAt) {
            this.callId = callId;
            this.generation = generation;
            this.phoneNumber = phoneNumber;
            this.deviceId = deviceId;
            this.incoming = incoming;
            this.startedAt = startedAt;
        }

        private boolean isEnded() {
            return status.isTerminal();
        }

        private Instant endedAtSnapshot() {
            return endedAt;
        }

        private String transcript() {
            return String.join(" ", segments);
        }

        private void cancelCleanup() {
            ScheduledFuture<?> pending = cleanup;
            if (pending != null) {
                pending.cancel(false);
            }
        }

        private CallSession snapshot(boolean includeTranscript) {
            return new CallSession(callId, phoneNumber, deviceId, incoming, status, startedAt,
                    answeredAt, endedAt, durationSeconds,
                    includeTranscript ? transcript() : null,
                    summary, receivedFragments);
        }
    }
}
