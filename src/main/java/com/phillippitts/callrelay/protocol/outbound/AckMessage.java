package com.phillippitts.callrelay.protocol.outbound;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Acknowledges a successfully handled request.
 *
 * @param requestType wire type of the handled message
 * @param callId      call the request referred to, omitted for connection-level requests
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"type", "requestType", "callId"})
public record AckMessage(String type, String requestType, String callId) implements OutboundMessage {

    public static final String TYPE = "ack";

    public AckMessage(String requestType, String callId) {
        this(TYPE, requestType, callId);
    }
}
