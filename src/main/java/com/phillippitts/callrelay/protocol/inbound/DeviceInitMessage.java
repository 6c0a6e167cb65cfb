package com.phillippitts.callrelay.protocol.inbound;

import java.util.Map;

/**
 * {@code init}: device handshake. Every field except {@code type} is kept as connection metadata.
 *
 * @param info reported device fields
 */
public record DeviceInitMessage(Map<String, Object> info) implements InboundMessage {

    public DeviceInitMessage {
        info = info == null ? Map.of() : info;
    }
}
