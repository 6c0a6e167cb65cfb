package com.phillippitts.callrelay.exception;

/**
 * Thrown when a transport connection is registered under an identifier already in use.
 */
public class DuplicateConnectionException extends CallRelayException {

    public static final String CODE = "DUPLICATE_CONNECTION";

    private final String connectionId;

    public DuplicateConnectionException(String connectionId) {
        super(CODE, "Connection already registered: " + connectionId);
        this.connectionId = connectionId;
    }

    public String getConnectionId() {
        return connectionId;
    }
}
