package com.phillippitts.callrelay.protocol.outbound;

/**
 * Messages written to connections. Each record serializes its {@code type} first.
 */
public interface OutboundMessage {

    String type();
}
