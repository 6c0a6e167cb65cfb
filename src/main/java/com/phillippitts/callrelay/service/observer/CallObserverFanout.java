package com.phillippitts.callrelay.service.observer;

import com.phillippitts.callrelay.domain.AiResponseType;
import com.phillippitts.callrelay.domain.CallSession;
import com.phillippitts.callrelay.protocol.outbound.CallAiResponseMessage;
import com.phillippitts.callrelay.protocol.outbound.CallSummaryMessage;
import com.phillippitts.callrelay.protocol.outbound.CallTranscriptMessage;
import com.phillippitts.callrelay.protocol.outbound.CallUpdateMessage;
import com.phillippitts.callrelay.protocol.outbound.OutboundMessage;
import com.phillippitts.callrelay.service.call.event.CallUpdatedEvent;
import com.phillippitts.callrelay.service.connection.ConnectionRegistry;
import com.phillippitts.callrelay.service.connection.event.ConnectionClosedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Per-call observer sets and best-effort delivery to them.
 *
 * <p>An observer set is a plain relation {@code callId -> connectionIds}; the connections
 * themselves stay in {@link ConnectionRegistry}. Sets survive the end of a call and are only
 * pruned when a connection leaves the registry.
 *
 * <p>Publishing never throws for delivery problems: unknown or dead connections are skipped.
 */
@Service
public class CallObserverFanout {

    private static final Logger LOG = LogManager.getLogger(CallObserverFanout.class);

    private final ConcurrentMap<String, Set<String>> observers = new ConcurrentHashMap<>();
    private final ConnectionRegistry registry;
    private final Clock clock;

    public CallObserverFanout(ConnectionRegistry registry, Clock clock) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Idempotent.
     *
     * @return {@code true} if the connection was not yet subscribed
     */
    public boolean subscribe(String callId, String connectionId) {
        Objects.requireNonNull(callId, "callId must not be null");
        Objects.requireNonNull(connectionId, "connectionId must not be null");
        boolean[] added = new boolean[1];
        observers.compute(callId, (id, set) -> {
            Set<String> target = set != null ? set : ConcurrentHashMap.newKeySet();
            added[0] = target.add(connectionId);
            return target;
        });
        if (added[0]) {
            LOG.info("Connection {} observing call {}", connectionId, callId);
        }
        return added[0];
    }

    /**
     * Idempotent. Drops the call's set once it becomes empty.
     *
     * @return {@code true} if the connection was subscribed
     */
    public boolean unsubscribe(String callId, String connectionId) {
        if (callId == null || connectionId == null) {
            return false;
        }
        boolean[] removed = new boolean[1];
        observers.computeIfPresent(callId, (id, set) -> {
            removed[0] = set.remove(connectionId);
            return set.isEmpty() ? null : set;
        });
        if (removed[0]) {
            LOG.info("Connection {} stopped observing call {}", connectionId, callId);
        }
        return removed[0];
    }

    /**
     * @return snapshot of the connections subscribed to {@code callId}
     */
    public Set<String> subscribers(String callId) {
        Set<String> set = callId == null ? null : observers.get(callId);
        return set == null ? Set.of() : Set.copyOf(set);
    }

    /**
     * Sends {@code message} to every observer of {@code callId}.
     *
     * @return number of observers the message was delivered to
     */
    public int publish(String callId, OutboundMessage message) {
        Set<String> targets = subscribers(callId);
        if (targets.isEmpty()) {
            return 0;
        }
        int delivered = 0;
        for (String connectionId : targets) {
            if (registry.send(connectionId, message)) {
                delivered++;
            }
        }
        LOG.debug("Published {} for call {} to {}/{} observer(s)",
                message.type(), callId, delivered, targets.size());
        return delivered;
    }

    public int publishSessionUpdate(CallSession session) {
        return publish(session.callId(), new CallUpdateMessage(session));
    }

    public int publishTranscript(String callId, String delta, boolean finalSegment) {
        return publish(callId, new CallTranscriptMessage(callId, delta, finalSegment, now()));
    }

    public int publishAiResponse(String callId, AiResponseType responseType, String text) {
        return publish(callId, new CallAiResponseMessage(callId, responseType, text, now()));
    }

    public int publishSummary(String callId, String summary) {
        return publish(callId, new CallSummaryMessage(callId, summary, now()));
    }

    @EventListener
    public void onCallUpdated(CallUpdatedEvent event) {
        publishSessionUpdate(event.session());
    }

    /**
     * Removes a departed connection from every observer set. Other connections' subscriptions
     * are untouched.
     */
    @EventListener
    public void onConnectionClosed(ConnectionClosedEvent event) {
        String connectionId = event.connectionId();
        int pruned = 0;
        for (String callId : observers.keySet()) {
            if (unsubscribe(callId, connectionId)) {
                pruned++;
            }
        }
        if (pruned > 0) {
            LOG.debug("Pruned connection {} from {} observer set(s)", connectionId, pruned);
        }
    }

    private String now() {
        return clock.instant().toString();
    }
}
