package com.phillippitts.callrelay.testutil;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phillippitts.callrelay.service.connection.TransportHandle;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory transport that records every frame written to it.
 */
public class FakeTransportHandle implements TransportHandle {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final List<String> frames = new CopyOnWriteArrayList<>();
    private final AtomicInteger closeCalls = new AtomicInteger();
    private volatile boolean open = true;
    private volatile boolean failWrites;

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void send(String payload) throws IOException {
        if (failWrites) {
            throw new IOException("simulated write failure");
        }
        frames.add(payload);
    }

    @Override
    public void close() {
        closeCalls.incrementAndGet();
        open = false;
    }

    /** Makes every subsequent write throw {@link IOException}. */
    public void failWrites() {
        this.failWrites = true;
    }

    /** Simulates the peer going away without the registry noticing. */
    public void drop() {
        this.open = false;
    }

    public int closeCalls() {
        return closeCalls.get();
    }

    public List<String> frames() {
        return List.copyOf(frames);
    }

    public List<JsonNode> messages() {
        List<JsonNode> parsed = new ArrayList<>(frames.size());
        for (String frame : frames) {
            try {
                parsed.add(MAPPER.readTree(frame));
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Frame is not JSON: " + frame, e);
            }
        }
        return parsed;
    }

    public List<JsonNode> messagesOfType(String type) {
        List<JsonNode> matching = new ArrayList<>();
        for (JsonNode node : messages()) {
            if (type.equals(node.path("type").asText())) {
                matching.add(node);
            }
        }
        return matching;
    }

    public JsonNode lastMessage() {
        List<JsonNode> all = messages();
        return all.isEmpty() ? null : all.get(all.size() - 1);
    }

    public void clear() {
        frames.clear();
    }
}
