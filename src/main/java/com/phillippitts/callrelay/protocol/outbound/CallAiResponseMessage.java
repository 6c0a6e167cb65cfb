package com.phillippitts.callrelay.protocol.outbound;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.phillippitts.callrelay.domain.AiResponseType;

/**
 * {@code call_ai_response}: instruction for the owning device, mirrored to observers.
 */
@JsonPropertyOrder({"type", "callId", "responseType", "text", "timestamp"})
public record CallAiResponseMessage(
        String type,
        String callId,
        AiResponseType responseType,
        String text,
        String timestamp
) implements OutboundMessage {

    public static final String TYPE = "call_ai_response";

    public CallAiResponseMessage(String callId, AiResponseType responseType, String text, String timestamp) {
        this(TYPE, callId, responseType, text, timestamp);
    }
}
