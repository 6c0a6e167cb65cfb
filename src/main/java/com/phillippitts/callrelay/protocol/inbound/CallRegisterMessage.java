package com.phillippitts.callrelay.protocol.inbound;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

/**
 * {@code call_register}: a device reports a new incoming or outgoing call.
 *
 * @param callId      caller-supplied call identifier
 * @param phoneNumber remote party number
 * @param deviceId    device identifier as reported by the handset (stored as connection metadata)
 * @param incoming    call direction; absent means incoming
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CallRegisterMessage(
        @NotBlank String callId,
        @NotBlank String phoneNumber,
        String deviceId,
        @JsonProperty("isIncoming") Boolean incoming
) implements InboundMessage {

    public boolean isIncomingOrDefault() {
        return incoming == null || incoming;
    }
}
