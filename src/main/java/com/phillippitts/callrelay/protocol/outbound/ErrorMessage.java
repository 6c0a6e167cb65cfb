package com.phillippitts.callrelay.protocol.outbound;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Structured error reply to the connection that sent a rejected message.
 *
 * @param code    stable error code (see {@code CallRelayException#getErrorCode()})
 * @param message human-readable description
 * @param callId  call the failed request referred to, if known
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"type", "code", "message", "callId"})
public record ErrorMessage(String type, String code, String message, String callId) implements OutboundMessage {

    public static final String TYPE = "error";
    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    public ErrorMessage(String code, String message, String callId) {
        this(TYPE, code, message, callId);
    }
}
