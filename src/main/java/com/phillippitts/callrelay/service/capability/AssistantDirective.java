package com.phillippitts.callrelay.service.capability;

import com.phillippitts.callrelay.domain.AiResponseType;

import java.util.Locale;
import java.util.Optional;

/**
 * Instruction parsed from a free-text assistant reply.
 *
 * <p>Rules:
 * <ul>
 *   <li>blank reply: no instruction</li>
 *   <li>first token {@code END_CALL} (any case, optional trailing {@code :}): {@code end_call}
 *       with the remaining text</li>
 *   <li>anything else: {@code speak} with the trimmed reply</li>
 * </ul>
 *
 * @param type instruction kind
 * @param text text to speak, possibly empty for {@code end_call}
 */
public record AssistantDirective(AiResponseType type, String text) {

    private static final String END_CALL_TOKEN = "END_CALL";

    public static Optional<AssistantDirective> parse(String reply) {
        if (reply == null || reply.isBlank()) {
            return Optional.empty();
        }
        String trimmed = reply.trim();
        String[] parts = trimmed.split("\\s+", 2);
        String head = parts[0];
        if (head.endsWith(":")) {
            head = head.substring(0, head.length() - 1);
        }
        if (END_CALL_TOKEN.equals(head.toUpperCase(Locale.ROOT))) {
            String rest = parts.length > 1 ? parts[1].trim() : "";
            return Optional.of(new AssistantDirective(AiResponseType.END_CALL, rest));
        }
        return Optional.of(new AssistantDirective(AiResponseType.SPEAK, trimmed));
    }
}
