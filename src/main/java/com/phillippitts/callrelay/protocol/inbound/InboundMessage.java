package com.phillippitts.callrelay.protocol.inbound;

/**
 * Marker for typed inbound payloads. The {@code type} discriminator itself is consumed by the
 * router and is not part of the payload records.
 */
public interface InboundMessage {

    /**
     * @return call the message refers to, or {@code null} for connection-level messages
     */
    default String callId() {
        return null;
    }
}
