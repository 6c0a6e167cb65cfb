package com.phillippitts.callrelay.exception;

/**
 * Thrown when an inbound message names a {@code type} the router has no handler for.
 */
public class UnsupportedMessageTypeException extends CallRelayException {

    public static final String CODE = "UNSUPPORTED_TYPE";

    private final String type;

    public UnsupportedMessageTypeException(String type) {
        super(CODE, "Unsupported message type: " + type);
        this.type = type;
    }

    public String getType() {
        return type;
    }
}
