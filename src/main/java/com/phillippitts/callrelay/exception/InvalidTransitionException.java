package com.phillippitts.callrelay.exception;

import com.phillippitts.callrelay.domain.CallStatus;

/**
 * Thrown when a status change is not a legal successor of the call's current status,
 * or when a call that has already ended is asked to accept more audio.
 */
public class InvalidTransitionException extends CallRelayException {

    public static final String CODE = "INVALID_TRANSITION";

    private final String callId;
    private final CallStatus from;
    private final CallStatus to;

    public InvalidTransitionException(String callId, CallStatus from, CallStatus to) {
        super(CODE, "Illegal status change for call " + callId + ": "
                + from.wireName() + " -> " + (to == null ? "null" : to.wireName()));
        this.callId = callId;
        this.from = from;
        this.to = to;
    }

    public InvalidTransitionException(String callId, CallStatus from, String message) {
        super(CODE, message);
        this.callId = callId;
        this.from = from;
        this.to = null;
    }

    public String getCallId() {
        return callId;
    }

    public CallStatus getFrom() {
        return from;
    }

    /**
     * @return requested status, or {@code null} when the rejected operation was not a status change
     */
    public CallStatus getTo() {
        return to;
    }
}
