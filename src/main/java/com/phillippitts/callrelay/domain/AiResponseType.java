package com.phillippitts.callrelay.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Instruction kinds carried by {@code call_ai_response} messages.
 */
public enum AiResponseType {
    /** Device should speak the text into the call. */
    SPEAK("speak"),
    /** Device should say the text (if any) and hang up. */
    END_CALL("end_call"),
    /** Informational transcription text, nothing to perform. */
    TRANSCRIPTION("transcription");

    private final String wireName;

    AiResponseType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static Optional<AiResponseType> fromWire(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim();
        return Arrays.stream(values())
                .filter(t -> t.wireName.equalsIgnoreCase(normalized))
                .findFirst();
    }
}
