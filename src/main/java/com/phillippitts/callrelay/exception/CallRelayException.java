package com.phillippitts.callrelay.exception;

/**
 * Base exception for all call-relay application errors.
 *
 * <p>Every subclass carries a stable {@code errorCode} that is sent to WebSocket clients
 * in {@code error} replies and to HTTP clients in {@code ApiError} bodies.
 */
public class CallRelayException extends RuntimeException {

    private final String errorCode;

    public CallRelayException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public CallRelayException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
