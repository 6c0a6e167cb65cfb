package com.phillippitts.callrelay.presentation.websocket;

import com.phillippitts.callrelay.service.connection.TransportHandle;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;

/**
 * {@link TransportHandle} over a Spring {@link WebSocketSession}. The session passed in must
 * already be wrapped for concurrent sends.
 */
class WebSocketTransportHandle implements TransportHandle {

    private static final Logger LOG = LogManager.getLogger(WebSocketTransportHandle.class);

    private final WebSocketSession session;

    WebSocketTransportHandle(WebSocketSession session) {
        this.session = session;
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void send(String payload) throws IOException {
        session.sendMessage(new TextMessage(payload));
    }

    @Override
    public void close() {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(CloseStatus.GOING_AWAY.withReason("inactive"));
        } catch (IOException e) {
            LOG.debug("Closing session {} failed: {}", session.getId(), e.toString());
        }
    }
}
