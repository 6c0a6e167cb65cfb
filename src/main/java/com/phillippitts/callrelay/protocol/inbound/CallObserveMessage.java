package com.phillippitts.callrelay.protocol.inbound;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotBlank;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CallObserveMessage(@NotBlank String callId) implements InboundMessage {
}
