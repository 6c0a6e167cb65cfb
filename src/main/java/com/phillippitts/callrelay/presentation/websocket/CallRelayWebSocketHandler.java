package com.phillippitts.callrelay.presentation.websocket;

import com.phillippitts.callrelay.config.properties.ConnectionProperties;
import com.phillippitts.callrelay.protocol.outbound.InfoMessage;
import com.phillippitts.callrelay.service.connection.ConnectionRegistry;
import com.phillippitts.callrelay.service.routing.MessageRouter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.UUID;

/**
 * Socket endpoint for devices and observers.
 *
 * <p>Each accepted session gets a random UUID connection id, is registered with
 * {@link ConnectionRegistry} and greeted with an {@code info} message carrying that id.
 * Text frames go to {@link MessageRouter} with {@code connectionId} in the ThreadContext.
 * Frames of one session are delivered one at a time by the container, which keeps a
 * device's status and audio messages in arrival order.
 */
@Component
public class CallRelayWebSocketHandler extends TextWebSocketHandler {

    static final String CONNECTION_ID_ATTRIBUTE = "relay.connectionId";

    private static final Logger LOG = LogManager.getLogger(CallRelayWebSocketHandler.class);

    private final ConnectionRegistry registry;
    private final MessageRouter router;
    private final ConnectionProperties properties;

    public CallRelayWebSocketHandler(ConnectionRegistry registry,
                                     MessageRouter router,
                                     ConnectionProperties properties) {
        this.registry = registry;
        this.router = router;
        this.properties = properties;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        String connectionId = UUID.randomUUID().toString();
        session.getAttributes().put(CONNECTION_ID_ATTRIBUTE, connectionId);
        WebSocketSession concurrent = new ConcurrentWebSocketSessionDecorator(
                session, properties.getSendTimeLimitMs(), properties.getSendBufferSizeLimit());
        ThreadContext.put("connectionId", connectionId);
        try {
            registry.register(connectionId, new WebSocketTransportHandle(concurrent));
            registry.send(connectionId, new InfoMessage("Connected to call relay", connectionId));
            LOG.info("Socket session {} accepted from {}", session.getId(), session.getRemoteAddress());
        } finally {
            ThreadContext.remove("connectionId");
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        String connectionId = connectionId(session);
        if (connectionId == null) {
            LOG.warn("Frame on unregistered session {} dropped", session.getId());
            return;
        }
        ThreadContext.put("connectionId", connectionId);
        try {
            router.route(connectionId, message.getPayload());
        } finally {
            ThreadContext.remove("connectionId");
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        LOG.warn("Transport error on connection {}: {}", connectionId(session), exception.toString());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        String connectionId = connectionId(session);
        LOG.info("Connection {} closed: {}", connectionId, status);
        registry.unregister(connectionId);
    }

    private static String connectionId(WebSocketSession session) {
        Object id = session.getAttributes().get(CONNECTION_ID_ATTRIBUTE);
        return id instanceof String s ? s : null;
    }
}
