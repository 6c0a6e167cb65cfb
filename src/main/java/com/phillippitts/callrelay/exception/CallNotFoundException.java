package com.phillippitts.callrelay.exception;

/**
 * Thrown when an operation names a call identifier the session store does not hold.
 */
public class CallNotFoundException extends CallRelayException {

    public static final String CODE = "CALL_NOT_FOUND";

    private final String callId;

    public CallNotFoundException(String callId) {
        super(CODE, "Call not found: " + callId);
        this.callId = callId;
    }

    public String getCallId() {
        return callId;
    }
}
