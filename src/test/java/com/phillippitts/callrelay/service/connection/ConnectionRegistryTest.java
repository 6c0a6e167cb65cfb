package com.phillippitts.callrelay.service.connection;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phillippitts.callrelay.domain.ConnectionInfo;
import com.phillippitts.callrelay.exception.DeliveryFailureException;
import com.phillippitts.callrelay.exception.DuplicateConnectionException;
import com.phillippitts.callrelay.protocol.outbound.InfoMessage;
import com.phillippitts.callrelay.protocol.outbound.PongMessage;
import com.phillippitts.callrelay.service.connection.event.ConnectionClosedEvent;
import com.phillippitts.callrelay.service.metrics.CallRelayMetrics;
import com.phillippitts.callrelay.testutil.EventCapturingPublisher;
import com.phillippitts.callrelay.testutil.FakeTransportHandle;
import com.phillippitts.callrelay.testutil.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConnectionRegistryTest {

    private MutableClock clock;
    private EventCapturingPublisher publisher;
    private SimpleMeterRegistry meterRegistry;
    private ConnectionRegistry registry;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2025-01-01T10:00:00Z");
        publisher = new EventCapturingPublisher();
        meterRegistry = new SimpleMeterRegistry();
        registry = new ConnectionRegistry(new ObjectMapper(), publisher, new CallRelayMetrics(meterRegistry), clock);
    }

    private double deliveryFailures(String reason) {
        return meterRegistry.get("callrelay.delivery.failure").tag("reason", reason).counter().count();
    }

    @Test
    void registerReturnsLiveView() {
        ConnectionInfo info = registry.register("a", new FakeTransportHandle());

        assertThat(info.id()).isEqualTo("a");
        assertThat(info.connectedAt()).isEqualTo(clock.instant());
        assertThat(info.lastActiveAt()).isEqualTo(clock.instant());
        assertThat(info.metadata()).isEmpty();
        assertThat(info.active()).isTrue();
        assertThat(registry.isConnected("a")).isTrue();
    }

    @Test
    void duplicateIdIsRejected() {
        FakeTransportHandle first = new FakeTransportHandle();
        registry.register("a", first);

        assertThatThrownBy(() -> registry.register("a", new FakeTransportHandle()))
                .isInstanceOf(DuplicateConnectionException.class);

        registry.send("a", new PongMessage());
        assertThat(first.frames()).hasSize(1);
    }

    @Test
    void unregisterIsIdempotentAndPublishesOnce() {
        registry.register("a", new FakeTransportHandle());

        registry.unregister("a");
        registry.unregister("a");
        registry.unregister(null);

        assertThat(registry.find("a")).isEmpty();
        List<ConnectionClosedEvent> closed = publisher.eventsOf(ConnectionClosedEvent.class);
        assertThat(closed).singleElement().satisfies(e -> {
            assertThat(e.connectionId()).isEqualTo("a");
            assertThat(e.evicted()).isFalse();
        });
    }

    @Test
    void sendSerializesMessageAsJson() {
        FakeTransportHandle handle = new FakeTransportHandle();
        registry.register("a", handle);

        boolean sent = registry.send("a", new InfoMessage("hello", "a"));

        assertThat(sent).isTrue();
        assertThat(handle.frames()).containsExactly(
                "{\"type\":\"info\",\"message\":\"hello\",\"connectionId\":\"a\"}");
    }

    @Test
    void sendToUnknownConnectionReturnsFalse() {
        assertThat(registry.send("ghost", new PongMessage())).isFalse();
        assertThat(deliveryFailures("unknown")).isEqualTo(1.0);
    }

    @Test
    void sendToClosedTransportReturnsFalse() {
        FakeTransportHandle handle = new FakeTransportHandle();
        registry.register("a", handle);
        handle.drop();

        assertThat(registry.send("a", new PongMessage())).isFalse();
        assertThat(registry.isConnected("a")).isFalse();
        assertThat(deliveryFailures("closed")).isEqualTo(1.0);
    }

    @Test
    void writeFailureReturnsFalse() {
        FakeTransportHandle handle = new FakeTransportHandle();
        registry.register("a", handle);
        handle.failWrites();

        assertThat(registry.send("a", new PongMessage())).isFalse();
        assertThat(deliveryFailures("write_error")).isEqualTo(1.0);
    }

    @Test
    void unserializableMessageReturnsFalseInsteadOfThrowing() {
        FakeTransportHandle handle = new FakeTransportHandle();
        registry.register("a", handle);

        assertThat(registry.send("a", new Object())).isFalse();
        assertThat(handle.frames()).isEmpty();
        assertThat(deliveryFailures("serialization")).isEqualTo(1.0);
    }

    @Test
    void sendOrThrowReportsConnection() {
        assertThatThrownBy(() -> registry.sendOrThrow("ghost", new PongMessage()))
                .isInstanceOf(DeliveryFailureException.class)
                .satisfies(e -> assertThat(((DeliveryFailureException) e).getConnectionId()).isEqualTo("ghost"));
    }

    @Test
    void broadcastCountsSuccessesAndFailures() {
        FakeTransportHandle a = new FakeTransportHandle();
        FakeTransportHandle b = new FakeTransportHandle();
        FakeTransportHandle c = new FakeTransportHandle();
        registry.register("a", a);
        registry.register("b", b);
        registry.register("c", c);
        c.failWrites();

        BroadcastResult result = registry.broadcast(new PongMessage());

        assertThat(result.successCount()).isEqualTo(2);
        assertThat(result.failureCount()).isEqualTo(1);
        assertThat(a.frames()).containsExactly("{\"type\":\"pong\"}");
        assertThat(b.frames()).containsExactly("{\"type\":\"pong\"}");
    }

    @Test
    void metadataMergesAndSkipsNulls() {
        registry.register("a", new FakeTransportHandle());
        Map<String, Object> partial = new HashMap<>();
        partial.put("model", "Pixel");
        partial.put("os", null);

        registry.updateMetadata("a", partial);
        registry.updateMetadata("a", Map.of("appVersion", "2.1"));
        registry.updateMetadata("ghost", Map.of("x", "y"));

        assertThat(registry.find("a").orElseThrow().metadata())
                .containsOnly(Map.entry("model", "Pixel"), Map.entry("appVersion", "2.1"));
    }

    @Test
    void listActiveIsOrderedByConnectTime() {
        registry.register("late", new FakeTransportHandle());
        clock.set(clock.instant().minusSeconds(30));
        registry.register("early", new FakeTransportHandle());

        assertThat(registry.listActive()).extracting(ConnectionInfo::id).containsExactly("early", "late");
        assertThat(registry.size()).isEqualTo(2);
    }

    @Test
    void inactiveConnectionsAreEvictedAndClosed() {
        FakeTransportHandle idle = new FakeTransportHandle();
        FakeTransportHandle busy = new FakeTransportHandle();
        registry.register("idle", idle);
        registry.register("busy", busy);

        clock.advance(Duration.ofMinutes(4));
        registry.touch("busy");
        clock.advance(Duration.ofMinutes(2));

        int evicted = registry.evictInactive(Duration.ofMinutes(5));

        assertThat(evicted).isEqualTo(1);
        assertThat(idle.closeCalls()).isEqualTo(1);
        assertThat(busy.closeCalls()).isZero();
        assertThat(registry.find("idle")).isEmpty();
        assertThat(registry.find("busy")).isPresent();
        assertThat(publisher.eventsOf(ConnectionClosedEvent.class)).singleElement()
                .satisfies(e -> assertThat(e.evicted()).isTrue());
        assertThat(meterRegistry.get("callrelay.connection.evicted").counter().count()).isEqualTo(1.0);
    }

    @Test
    void evictionWithNothingIdleDoesNothing() {
        registry.register("a", new FakeTransportHandle());

        assertThat(registry.evictInactive(Duration.ofMinutes(5))).isZero();
        assertThat(registry.size()).isEqualTo(1);
    }
}
