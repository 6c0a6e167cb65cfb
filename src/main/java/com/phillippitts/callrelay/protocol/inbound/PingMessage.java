package com.phillippitts.callrelay.protocol.inbound;

/**
 * {@code ping}: heartbeat, answered with {@code pong}.
 */
public record PingMessage() implements InboundMessage {
}
