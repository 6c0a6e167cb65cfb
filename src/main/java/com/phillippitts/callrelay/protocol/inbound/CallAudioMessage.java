package com.phillippitts.callrelay.protocol.inbound;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotBlank;

/**
 * {@code call_audio}: one base64-encoded audio fragment.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CallAudioMessage(
        @NotBlank String callId,
        @NotBlank String audio
) implements InboundMessage {
}
