package com.phillippitts.callrelay.protocol.inbound;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotBlank;

/**
 * {@code call_status}: lifecycle change reported by the owning device.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CallStatusMessage(
        @NotBlank String callId,
        @NotBlank String status
) implements InboundMessage {
}
