package com.phillippitts.callrelay.exception;

/**
 * Thrown when a lookup names a connection identifier that is not registered.
 */
public class ConnectionNotFoundException extends CallRelayException {

    public static final String CODE = "CONNECTION_NOT_FOUND";

    private final String connectionId;

    public ConnectionNotFoundException(String connectionId) {
        super(CODE, "Connection not found: " + connectionId);
        this.connectionId = connectionId;
    }

    public String getConnectionId() {
        return connectionId;
    }
}
