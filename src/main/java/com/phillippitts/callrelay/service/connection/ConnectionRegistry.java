package com.phillippitts.callrelay.service.connection;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phillippitts.callrelay.domain.ConnectionInfo;
import com.phillippitts.callrelay.exception.DeliveryFailureException;
import com.phillippitts.callrelay.exception.DuplicateConnectionException;
import com.phillippitts.callrelay.service.connection.event.ConnectionClosedEvent;
import com.phillippitts.callrelay.service.metrics.CallRelayMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Live transport connections keyed by connection id.
 *
 * <p>The registry owns every {@link TransportHandle}. Callers address connections by id only
 * and read them through {@link ConnectionInfo} views, which never expose the handle.
 *
 * <p>Delivery is best-effort: {@link #send(String, Object)} and {@link #broadcast(Object)}
 * report failures through their return values and metrics, never by throwing.
 *
 * <p>Thread-safe. Removal of a connection publishes a {@link ConnectionClosedEvent} so
 * observer sets can be pruned.
 */
@Service
public class ConnectionRegistry {

    private static final Logger LOG = LogManager.getLogger(ConnectionRegistry.class);

    private final ConcurrentMap<String, Connection> connections = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper;
    private final ApplicationEventPublisher publisher;
    private final CallRelayMetrics metrics;
    private final Clock clock;

    public ConnectionRegistry(ObjectMapper objectMapper,
                              ApplicationEventPublisher publisher,
                              CallRelayMetrics metrics,
                              Clock clock) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Adds a connection and starts tracking its liveness.
     *
     * @throws DuplicateConnectionException if {@code id} is already registered
     */
    public ConnectionInfo register(String id, TransportHandle handle) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(handle, "handle must not be null");
        Connection connection = new Connection(id, handle, clock.instant());
        Connection existing = connections.putIfAbsent(id, connection);
        if (existing != null) {
            throw new DuplicateConnectionException(id);
        }
        LOG.info("Connection registered: id={}, live={}", id, connections.size());
        return connection.view();
    }

    /**
     * Removes a connection. Removing an unknown id is a no-op.
     */
    public void unregister(String id) {
        if (id == null) {
            return;
        }
        Connection removed = connections.remove(id);
        if (removed == null) {
            return;
        }
        removed.alive = false;
        LOG.info("Connection unregistered: id={}, live={}", id, connections.size());
        publisher.publishEvent(new ConnectionClosedEvent(id, false));
    }

    /**
     * Refreshes last-active for any inbound activity. Unknown ids are ignored.
     */
    public void touch(String id) {
        Connection connection = id == null ? null : connections.get(id);
        if (connection != null) {
            connection.lastActive = clock.instant();
        }
    }

    /**
     * Merges {@code partial} into the connection's metadata and refreshes last-active.
     * Null values are skipped. Logged no-op when the id is unknown.
     */
    public void updateMetadata(String id, Map<String, ?> partial) {
        Connection connection = id == null ? null : connections.get(id);
        if (connection == null) {
            LOG.debug("Metadata update for unknown connection ignored: id={}", id);
            return;
        }
        if (partial != null) {
            partial.forEach((key, value) -> {
                if (key != null && value != null) {
                    connection.metadata.put(key, value);
                }
            });
        }
        connection.lastActive = clock.instant();
        LOG.debug("Connection metadata updated: id={}, keys={}", id, connection.metadata.keySet());
    }

    /**
     * Serializes {@code message} and writes it to one connection.
     *
     * @return {@code true} if the frame was handed to the transport; {@code false} if the
     *         connection is unknown or closed, the message cannot be serialized, or the write
     *         failed
     */
    public boolean send(String id, Object message) {
        try {
            deliver(id, message);
            return true;
        } catch (DeliveryFailureException e) {
            LOG.debug("Send skipped: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Like {@link #send(String, Object)} but reports the failure as an exception. Used where
     * delivery is the whole point of the request (operator commands).
     *
     * @throws DeliveryFailureException if the message could not be written
     */
    public void sendOrThrow(String id, Object message) {
        deliver(id, message);
    }

    /**
     * Best-effort write to every registered connection. One failing connection does not
     * prevent delivery to the others.
     */
    public BroadcastResult broadcast(Object message) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            LOG.error("Broadcast dropped, message not serializable: {}", message.getClass().getSimpleName(), e);
            return new BroadcastResult(0, connections.size());
        }
        int success = 0;
        int failure = 0;
        for (Connection connection : connections.values()) {
            if (write(connection, payload)) {
                success++;
            } else {
                failure++;
            }
        }
        LOG.debug("Broadcast {}: success={}, failure={}", message.getClass().getSimpleName(), success, failure);
        return new BroadcastResult(success, failure);
    }

    /**
     * @return views of all registered connections, oldest first
     */
    public List<ConnectionInfo> listActive() {
        List<ConnectionInfo> views = new ArrayList<>(connections.size());
        for (Connection connection : connections.values()) {
            views.add(connection.view());
        }
        views.sort(Comparator.comparing(ConnectionInfo::connectedAt));
        return views;
    }

    public Optional<ConnectionInfo> find(String id) {
        Connection connection = id == null ? null : connections.get(id);
        return connection == null ? Optional.empty() : Optional.of(connection.view());
    }

    public boolean isConnected(String id) {
        Connection connection = id == null ? null : connections.get(id);
        return connection != null && connection.alive && connection.handle.isOpen();
    }

    public int size() {
        return connections.size();
    }

    /**
     * Closes and removes every connection whose last activity is older than {@code threshold}.
     *
     * @return number of evicted connections
     */
    public int evictInactive(Duration threshold) {
        Instant cutoff = clock.instant().minus(threshold);
        int evicted = 0;
        for (Connection connection : connections.values()) {
            if (!connection.lastActive.isBefore(cutoff)) {
                continue;
            }
            if (!connections.remove(connection.id, connection)) {
                continue;
            }
            connection.alive = false;
            connection.handle.close();
            evicted++;
            LOG.info("Evicted inactive connection: id={}, lastActive={}", connection.id, connection.lastActive);
            publisher.publishEvent(new ConnectionClosedEvent(connection.id, true));
        }
        if (evicted > 0) {
            metrics.incrementEvictions(evicted);
        }
        return evicted;
    }

    private void deliver(String id, Object message) {
        Connection connection = id == null ? null : connections.get(id);
        if (connection == null) {
            metrics.incrementDeliveryFailure("unknown");
            throw new DeliveryFailureException(String.valueOf(id), "connection not registered");
        }
        String payload;
        try {
            payload = objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            metrics.incrementDeliveryFailure("serialization");
            LOG.error("Message {} for connection {} is not serializable", message.getClass().getSimpleName(), id, e);
            throw new DeliveryFailureException(id, "message not serializable", e);
        }
        if (!connection.alive || !connection.handle.isOpen()) {
            metrics.incrementDeliveryFailure("closed");
            throw new DeliveryFailureException(id, "transport closed");
        }
        try {
            connection.handle.send(payload);
        } catch (IOException | RuntimeException e) {
            metrics.incrementDeliveryFailure("write_error");
            throw new DeliveryFailureException(id, "transport write failed", e);
        }
    }

    private boolean write(Connection connection, String payload) {
        if (!connection.alive || !connection.handle.isOpen()) {
            metrics.incrementDeliveryFailure("closed");
            return false;
        }
        try {
            connection.handle.send(payload);
            return true;
        } catch (IOException | RuntimeException e) {
            metrics.incrementDeliveryFailure("write_error");
            LOG.debug("Broadcast write to {} failed: {}", connection.id, e.toString());
            return false;
        }
    }

    private static final class Connection {
        private final String id;
        private final TransportHandle handle;
        private final Instant connectedAt;
        private final ConcurrentMap<String, Object> metadata = new ConcurrentHashMap<>();
        private volatile Instant lastActive;
        private volatile boolean alive = true;

        private Connection(String id, TransportHandle handle, Instant connectedAt) {
            this.id = id;
            this.handle = handle;
            this.connectedAt = connectedAt;
            this.lastActive = connectedAt;
        }

        private ConnectionInfo view() {
            return new ConnectionInfo(id, connectedAt, lastActive, Map.copyOf(metadata), alive && handle.isOpen());
        }
    }
}
