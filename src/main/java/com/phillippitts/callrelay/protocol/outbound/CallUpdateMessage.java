package com.phillippitts.callrelay.protocol.outbound;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.phillippitts.callrelay.domain.CallSession;

/**
 * {@code call_update}: session snapshot without the transcript.
 */
@JsonPropertyOrder({"type", "callId", "call"})
public record CallUpdateMessage(String type, String callId, CallSession call) implements OutboundMessage {

    public static final String TYPE = "call_update";

    public CallUpdateMessage(CallSession call) {
        this(TYPE, call.callId(), call.withoutTranscript());
    }
}
