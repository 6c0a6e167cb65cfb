package com.phillippitts.callrelay.protocol.outbound;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Welcome message sent right after a connection is accepted.
 */
@JsonPropertyOrder({"type", "message", "connectionId"})
public record InfoMessage(String type, String message, String connectionId) implements OutboundMessage {

    public static final String TYPE = "info";

    public InfoMessage(String message, String connectionId) {
        this(TYPE, message, connectionId);
    }
}
