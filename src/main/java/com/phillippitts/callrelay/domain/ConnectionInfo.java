package com.phillippitts.callrelay.domain;

import java.time.Instant;
import java.util.Map;

/**
 * Read-only view of a registered transport connection. The transport itself is never exposed.
 *
 * @param id           connection identifier
 * @param connectedAt  when the transport was accepted
 * @param lastActiveAt last inbound activity
 * @param metadata     device-reported fields (model, app version, ...)
 * @param active       liveness flag
 */
public record ConnectionInfo(
        String id,
        Instant connectedAt,
        Instant lastActiveAt,
        Map<String, Object> metadata,
        boolean active
) {

    public ConnectionInfo {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
