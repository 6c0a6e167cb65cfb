package com.phillippitts.callrelay.protocol.outbound;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * {@code call_transcript}: one transcript delta.
 *
 * @param finalSegment {@code true} when no more text will follow for this call
 * @param timestamp    ISO-8601 instant
 */
@JsonPropertyOrder({"type", "callId", "transcript", "isFinal", "timestamp"})
public record CallTranscriptMessage(
        String type,
        String callId,
        String transcript,
        @JsonProperty("isFinal") boolean finalSegment,
        String timestamp
) implements OutboundMessage {

    public static final String TYPE = "call_transcript";

    public CallTranscriptMessage(String callId, String transcript, boolean finalSegment, String timestamp) {
        this(TYPE, callId, transcript, finalSegment, timestamp);
    }
}
