package com.phillippitts.callrelay.service.connection.event;

/**
 * Emitted when a connection leaves the registry, either by transport close or by eviction.
 *
 * @param connectionId removed connection
 * @param evicted      {@code true} if the registry closed it for inactivity
 */
public record ConnectionClosedEvent(String connectionId, boolean evicted) {
}
