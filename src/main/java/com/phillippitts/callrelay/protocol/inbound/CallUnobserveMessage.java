package com.phillippitts.callrelay.protocol.inbound;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotBlank;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CallUnobserveMessage(@NotBlank String callId) implements InboundMessage {
}
