package com.phillippitts.callrelay.exception;

/**
 * Thrown when a call is registered under an identifier that is already active.
 * The existing session is left untouched.
 */
public class DuplicateCallException extends CallRelayException {

    public static final String CODE = "DUPLICATE_CALL";

    private final String callId;

    public DuplicateCallException(String callId) {
        super(CODE, "Call already registered: " + callId);
        this.callId = callId;
    }

    public String getCallId() {
        return callId;
    }
}
