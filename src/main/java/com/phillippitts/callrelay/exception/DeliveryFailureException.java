package com.phillippitts.callrelay.exception;

/**
 * Thrown when a message cannot be delivered to a connection (unknown, closed, or the
 * transport write failed).
 *
 * <p>Fan-out and broadcast paths swallow this at the registry boundary; it only reaches
 * a caller for explicit operator commands, where delivery is the whole point.
 */
public class DeliveryFailureException extends CallRelayException {

    public static final String CODE = "DELIVERY_FAILED";

    private final String connectionId;

    public DeliveryFailureException(String connectionId, String reason) {
        super(CODE, "Delivery to " + connectionId + " failed: " + reason);
        this.connectionId = connectionId;
    }

    public DeliveryFailureException(String connectionId, String reason, Throwable cause) {
        super(CODE, "Delivery to " + connectionId + " failed: " + reason, cause);
        this.connectionId = connectionId;
    }

    public String getConnectionId() {
        return connectionId;
    }
}
