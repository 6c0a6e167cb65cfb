package com.phillippitts.callrelay.protocol.outbound;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Announcement written to every connection. The type defaults to {@code broadcast} but an
 * operator may choose another one.
 */
@JsonPropertyOrder({"type", "message", "timestamp"})
public record BroadcastMessage(String type, String message, String timestamp) implements OutboundMessage {

    public static final String DEFAULT_TYPE = "broadcast";
}
