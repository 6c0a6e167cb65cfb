package com.phillippitts.callrelay.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Lifecycle states of a call session.
 *
 * <p>Transitions are monotonic:
 * <pre>
 * RINGING → ANSWERED → IN_PROGRESS → ENDED
 * RINGING | ANSWERED | IN_PROGRESS → ENDED
 * </pre>
 * {@link #ENDED} is terminal.
 */
public enum CallStatus {
    RINGING("ringing"),
    ANSWERED("answered"),
    IN_PROGRESS("in_progress"),
    ENDED("ended");

    private final String wireName;

    CallStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this == ENDED;
    }

    /**
     * Returns whether {@code next} is a legal successor of this status.
     *
     * <p>Ending is legal from every non-terminal state; all other moves must follow the
     * documented order exactly (no skipping, no repeats, never backwards).
     *
     * @param next requested status
     * @return {@code true} if the transition is allowed
     */
    public boolean canTransitionTo(CallStatus next) {
        if (next == null || isTerminal()) {
            return false;
        }
        if (next == ENDED) {
            return true;
        }
        return next.ordinal() == ordinal() + 1;
    }

    /**
     * Parses the wire representation ({@code ringing}, {@code answered}, {@code in_progress},
     * {@code ended}). Matching is case-insensitive.
     */
    public static Optional<CallStatus> fromWire(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim();
        return Arrays.stream(values())
                .filter(s -> s.wireName.equalsIgnoreCase(normalized))
                .findFirst();
    }
}
