package com.phillippitts.callrelay.protocol.outbound;

public record PongMessage(String type) implements OutboundMessage {

    public static final String TYPE = "pong";

    public PongMessage() {
        this(TYPE);
    }
}
