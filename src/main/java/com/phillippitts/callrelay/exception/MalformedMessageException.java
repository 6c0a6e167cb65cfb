package com.phillippitts.callrelay.exception;

/**
 * Thrown when an inbound message is not valid JSON, lacks required fields, or carries
 * values that cannot be interpreted.
 */
public class MalformedMessageException extends CallRelayException {

    public static final String CODE = "MALFORMED_MESSAGE";

    public MalformedMessageException(String message) {
        super(CODE, message);
    }

    public MalformedMessageException(String message, Throwable cause) {
        super(CODE, message, cause);
    }
}
