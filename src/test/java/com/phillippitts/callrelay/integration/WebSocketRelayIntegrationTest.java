package com.phillippitts.callrelay.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Drives a device and a dashboard over real WebSocket connections.
 */
@Tag("integration")
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class WebSocketRelayIntegrationTest {

    @LocalServerPort
    private int port;

    @Autowired
    private TestRestTemplate rest;

    @Autowired
    private ObjectMapper objectMapper;

    private Client device;
    private Client dashboard;

    @BeforeEach
    void setUp() throws Exception {
        device = connect();
        dashboard = connect();
    }

    @AfterEach
    void tearDown() throws Exception {
        device.close();
        dashboard.close();
    }

    @Test
    void greetsEveryConnectionWithItsId() throws Exception {
        Client fresh = connect();
        try {
            assertThat(fresh.connectionId).isNotBlank();
            assertThat(fresh.connectionId).isNotEqualTo(device.connectionId);
        } finally {
            fresh.close();
        }
    }

    @Test
    void callLifecycleReachesObserversAndRestApi() throws Exception {
        device.send("{\"type\":\"call_register\",\"callId\":\"it-1\",\"phoneNumber\":\"+15551234567\"}");
        assertThat(device.next().get("type").asText()).isEqualTo("ack");

        dashboard.send("{\"type\":\"call_observe\",\"callId\":\"it-1\"}");
        assertThat(dashboard.next().get("type").asText()).isEqualTo("ack");
        JsonNode snapshot = dashboard.next();
        assertThat(snapshot.get("type").asText()).isEqualTo("call_update");
        assertThat(snapshot.get("call").get("status").asText()).isEqualTo("ringing");

        device.send("{\"type\":\"call_status\",\"callId\":\"it-1\",\"status\":\"answered\"}");
        JsonNode update = dashboard.next();
        assertThat(update.get("call").get("status").asText()).isEqualTo("answered");

        ResponseEntity<Map> call = rest.getForEntity("/api/calls/it-1", Map.class);
        assertThat(call.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(call.getBody()).containsEntry("status", "answered").containsEntry("isIncoming", true);
    }

    @Test
    void operatorCommandIsDeliveredToDevice() throws Exception {
        device.send("{\"type\":\"call_register\",\"callId\":\"it-2\",\"phoneNumber\":\"+15550000000\"}");
        device.next();

        ResponseEntity<Map> accepted = rest.postForEntity("/api/calls/it-2/commands",
                Map.of("command", "end_call", "text", "Goodbye"), Map.class);

        assertThat(accepted.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);
        JsonNode received = device.next();
        assertThat(received.get("type").asText()).isEqualTo("call_ai_response");
        assertThat(received.get("responseType").asText()).isEqualTo("end_call");
        assertThat(received.get("text").asText()).isEqualTo("Goodbye");
    }

    @Test
    void badFramesGetErrorReplies() throws Exception {
        device.send("{\"type\":\"teleport\"}");
        JsonNode error = device.next();

        assertThat(error.get("type").asText()).isEqualTo("error");
        assertThat(error.get("code").asText()).isEqualTo("UNSUPPORTED_TYPE");

        device.send("{\"type\":\"ping\"}");
        assertThat(device.next().get("type").asText()).isEqualTo("pong");
    }

    @Test
    void unknownCallIsNotFoundOverRest() {
        ResponseEntity<Map> response = rest.getForEntity("/api/calls/missing", Map.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getBody()).containsEntry("errorCode", "CALL_NOT_FOUND");
    }

    @Test
    void restViewsReportLiveConnections() {
        ResponseEntity<Map> ping = rest.getForEntity("/ping", Map.class);
        assertThat(ping.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(ping.getBody()).containsEntry("status", "ok");
        assertThat((Integer) ping.getBody().get("connections")).isGreaterThanOrEqualTo(2);

        ResponseEntity<Map> connection = rest.getForEntity("/api/connections/" + device.connectionId, Map.class);
        assertThat(connection.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(connection.getBody()).containsEntry("id", device.connectionId).containsEntry("active", true);

        ResponseEntity<Map> missing = rest.getForEntity("/api/connections/nope", Map.class);
        assertThat(missing.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    }

    @Test
    void deviceCommandAndBroadcastReachSockets() throws Exception {
        ResponseEntity<Map> sent = rest.postForEntity("/api/connections/" + device.connectionId + "/command",
                Map.of("command", "refresh_config", "data", Map.of("level", 2)), Map.class);

        assertThat(sent.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(sent.getBody()).containsEntry("success", true);
        JsonNode command = device.next();
        assertThat(command.get("type").asText()).isEqualTo("command");
        assertThat(command.get("command").asText()).isEqualTo("refresh_config");
        assertThat(command.get("data").get("level").asInt()).isEqualTo(2);

        ResponseEntity<Map> broadcast = rest.postForEntity("/api/connections/broadcast",
                Map.of("message", "maintenance at noon"), Map.class);

        assertThat(broadcast.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat((Integer) broadcast.getBody().get("successCount")).isGreaterThanOrEqualTo(2);
        for (Client client : new Client[]{device, dashboard}) {
            JsonNode announcement = client.next();
            assertThat(announcement.get("type").asText()).isEqualTo("broadcast");
            assertThat(announcement.get("message").asText()).isEqualTo("maintenance at noon");
        }
    }

    @Test
    void deviceCommandForUnknownConnectionIsNotFound() {
        ResponseEntity<Map> response = rest.postForEntity("/api/connections/nope/command",
                Map.of("command", "refresh_config"), Map.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getBody()).containsEntry("errorCode", "CONNECTION_NOT_FOUND");

        ResponseEntity<Map> blank = rest.postForEntity("/api/connections/broadcast", Map.of("type", "notice"), Map.class);
        assertThat(blank.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    }

    private Client connect() throws Exception {
        Client client = new Client(objectMapper);
        client.session = new StandardWebSocketClient()
                .execute(client, "ws://localhost:" + port + "/ws")
                .get(5, TimeUnit.SECONDS);
        JsonNode info = client.next();
        assertThat(info.get("type").asText()).isEqualTo("info");
        client.connectionId = info.get("connectionId").asText();
        return client;
    }

    private static final class Client extends TextWebSocketHandler {

        private final BlockingQueue<String> inbox = new LinkedBlockingQueue<>();
        private final ObjectMapper objectMapper;
        private WebSocketSession session;
        private String connectionId;

        private Client(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
        }

        @Override
        protected void handleTextMessage(WebSocketSession session, TextMessage message) {
            inbox.add(message.getPayload());
        }

        void send(String json) throws Exception {
            session.sendMessage(new TextMessage(json));
        }

        JsonNode next() throws Exception {
            String frame = inbox.poll(5, TimeUnit.SECONDS);
            assertThat(frame).as("frame received within 5s").isNotNull();
            return objectMapper.readTree(frame);
        }

        void close() throws Exception {
            if (session != null && session.isOpen()) {
                session.close();
            }
        }
    }
}
