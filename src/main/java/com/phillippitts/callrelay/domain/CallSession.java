package com.phillippitts.callrelay.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable point-in-time view of a call session.
 *
 * <p>Snapshots are produced by the session store under the call's lock, so every field
 * reflects one consistent state. {@code transcript} is {@code null} in views that omit it
 * (session updates, listings).
 *
 * @param callId           caller-supplied call identifier
 * @param phoneNumber      remote party number
 * @param deviceId         connection id of the owning device (weak reference)
 * @param incoming         {@code true} for incoming calls
 * @param status           current lifecycle status
 * @param startedAt        when the call was registered
 * @param answeredAt       when the call was answered, or {@code null}
 * @param endedAt          when the call ended, or {@code null}
 * @param durationSeconds  computed once at the {@code ended} transition, otherwise {@code null}
 * @param transcript       accumulated transcript, or {@code null} when omitted
 * @param summary          summary text once finalization succeeded, otherwise {@code null}
 * @param audioFragments   number of audio fragments received so far
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CallSession(
        String callId,
        String phoneNumber,
        String deviceId,
        @JsonProperty("isIncoming") boolean incoming,
        CallStatus status,
        Instant startedAt,
        Instant answeredAt,
        Instant endedAt,
        @JsonProperty("duration") Long durationSeconds,
        String transcript,
        String summary,
        int audioFragments
) {

    public CallSession {
        Objects.requireNonNull(callId, "callId must not be null");
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(startedAt, "startedAt must not be null");
    }

    /**
     * Returns a copy of this snapshot without the transcript.
     */
    public CallSession withoutTranscript() {
        if (transcript == null) {
            return this;
        }
        return new CallSession(callId, phoneNumber, deviceId, incoming, status, startedAt,
                answeredAt, endedAt, durationSeconds, null, summary, audioFragments);
    }

    public boolean isEnded() {
        return status.isTerminal();
    }
}
