package com.phillippitts.callrelay.protocol.outbound;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"type", "callId", "summary", "timestamp"})
public record CallSummaryMessage(String type, String callId, String summary, String timestamp)
        implements OutboundMessage {

    public static final String TYPE = "call_summary";

    public CallSummaryMessage(String callId, String summary, String timestamp) {
        this(TYPE, callId, summary, timestamp);
    }
}
