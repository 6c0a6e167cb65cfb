package com.phillippitts.callrelay.config;

import com.phillippitts.callrelay.config.properties.ConnectionProperties;
import com.phillippitts.callrelay.presentation.websocket.CallRelayWebSocketHandler;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * Registers the socket endpoint at {@code relay.connection.path}.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final CallRelayWebSocketHandler handler;
    private final ConnectionProperties properties;

    public WebSocketConfig(CallRelayWebSocketHandler handler, ConnectionProperties properties) {
        this.handler = handler;
        this.properties = properties;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(handler, properties.getPath())
                .setAllowedOriginPatterns(properties.getAllowedOrigins().toArray(String[]::new));
    }
}
