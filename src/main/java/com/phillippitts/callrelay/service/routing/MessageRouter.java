package com.phillippitts.callrelay.service.routing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phillippitts.callrelay.domain.CallStatus;
import com.phillippitts.callrelay.exception.CallRelayException;
import com.phillippitts.callrelay.exception.MalformedMessageException;
import com.phillippitts.callrelay.exception.UnsupportedMessageTypeException;
import com.phillippitts.callrelay.protocol.inbound.CallAudioMessage;
import com.phillippitts.callrelay.protocol.inbound.CallObserveMessage;
import com.phillippitts.callrelay.protocol.inbound.CallRegisterMessage;
import com.phillippitts.callrelay.protocol.inbound.CallStatusMessage;
import com.phillippitts.callrelay.protocol.inbound.CallUnobserveMessage;
import com.phillippitts.callrelay.protocol.inbound.DeviceInitMessage;
import com.phillippitts.callrelay.protocol.inbound.InboundMessage;
import com.phillippitts.callrelay.protocol.inbound.InboundMessageType;
import com.phillippitts.callrelay.protocol.inbound.PingMessage;
import com.phillippitts.callrelay.protocol.outbound.AckMessage;
import com.phillippitts.callrelay.protocol.outbound.CallUpdateMessage;
import com.phillippitts.callrelay.protocol.outbound.ErrorMessage;
import com.phillippitts.callrelay.protocol.outbound.PongMessage;
import com.phillippitts.callrelay.service.audio.AudioIngestPipeline;
import com.phillippitts.callrelay.service.call.CallSessionStore;
import com.phillippitts.callrelay.service.connection.ConnectionRegistry;
import com.phillippitts.callrelay.service.observer.CallObserverFanout;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Entry point for every inbound socket frame.
 *
 * <p>Steps per frame:
 * <ol>
 *   <li>refresh the sender's last-active timestamp</li>
 *   <li>parse JSON and resolve the {@code type} discriminator</li>
 *   <li>bind the payload record for that type and validate required fields</li>
 *   <li>dispatch to exactly one handler</li>
 * </ol>
 *
 * <p>Any {@link CallRelayException} becomes an {@code error} reply with its code; anything
 * else is logged and answered with {@code INTERNAL_ERROR}. A frame never escapes as an
 * exception, so one bad message cannot take the connection down.
 *
 * <p>Successful requests are acknowledged, except {@code call_audio} (high volume) and
 * {@code ping} (answered with {@code pong}).
 */
@Service
public class MessageRouter {

    private static final Logger LOG = LogManager.getLogger(MessageRouter.class);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ConnectionRegistry registry;
    private final CallSessionStore store;
    private final AudioIngestPipeline audioPipeline;
    private final CallObserverFanout fanout;
    private final ObjectMapper objectMapper;
    private final Validator validator;

    public MessageRouter(ConnectionRegistry registry,
                         CallSessionStore store,
                         AudioIngestPipeline audioPipeline,
                         CallObserverFanout fanout,
                         ObjectMapper objectMapper,
                         Validator validator) {
        this.registry = Objects.requireNonNull(registry);
        this.store = Objects.requireNonNull(store);
        this.audioPipeline = Objects.requireNonNull(audioPipeline);
        this.fanout = Objects.requireNonNull(fanout);
        this.objectMapper = Objects.requireNonNull(objectMapper);
        this.validator = Objects.requireNonNull(validator);
    }

    /**
     * Handles one raw text frame from {@code connectionId}.
     */
    public void route(String connectionId, String raw) {
        registry.touch(connectionId);
        String callId = null;
        String typeName = null;
        try {
            JsonNode node = parse(raw);
            typeName = node.path("type").isTextual() ? node.get("type").asText() : null;
            callId = node.path("callId").isTextual() ? node.get("callId").asText() : null;
            if (callId != null) {
                ThreadContext.put("callId", callId);
            }
            InboundMessageType type = resolveType(typeName);
            InboundMessage message = bind(type, node);
            dispatch(connectionId, type, message);
        } catch (CallRelayException e) {
            LOG.warn("Rejected {} from {}: [{}] {}", typeName, connectionId, e.getErrorCode(), e.getMessage());
            registry.send(connectionId, new ErrorMessage(e.getErrorCode(), e.getMessage(), callId));
        } catch (RuntimeException e) {
            LOG.error("Unexpected failure handling {} from {}", typeName, connectionId, e);
            registry.send(connectionId, new ErrorMessage(ErrorMessage.INTERNAL_ERROR,
                    "Internal error while handling " + (typeName == null ? "message" : typeName), callId));
        } finally {
            ThreadContext.remove("callId");
        }
    }

    private JsonNode parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new MalformedMessageException("Empty message");
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new MalformedMessageException("Message is not valid JSON", e);
        }
        if (node == null || !node.isObject()) {
            throw new MalformedMessageException("Message must be a JSON object");
        }
        return node;
    }

    private static InboundMessageType resolveType(String typeName) {
        if (typeName == null || typeName.isBlank()) {
            throw new MalformedMessageException("Missing required field: type");
        }
        return InboundMessageType.fromWire(typeName)
                .orElseThrow(() -> new UnsupportedMessageTypeException(typeName));
    }

    private InboundMessage bind(InboundMessageType type, JsonNode node) {
        InboundMessage message = switch (type) {
            case PING -> new PingMessage();
            case INIT -> readInit(node);
            default -> readPayload(type, node);
        };
        validate(type, message);
        return message;
    }

    private DeviceInitMessage readInit(JsonNode node) {
        Map<String, Object> info = new LinkedHashMap<>(objectMapper.convertValue(node, MAP_TYPE));
        info.remove("type");
        return new DeviceInitMessage(info);
    }

    private InboundMessage readPayload(InboundMessageType type, JsonNode node) {
        try {
            return objectMapper.treeToValue(node, type.payloadType());
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new MalformedMessageException("Invalid " + type.wireName() + " payload", e);
        }
    }

    private void validate(InboundMessageType type, InboundMessage message) {
        Set<ConstraintViolation<InboundMessage>> violations = validator.validate(message);
        if (violations.isEmpty()) {
            return;
        }
        String detail = violations.stream()
                .map(v -> v.getPropertyPath() + " " + v.getMessage())
                .sorted()
                .collect(Collectors.joining(", "));
        throw new MalformedMessageException("Invalid " + type.wireName() + ": " + detail);
    }

    private void dispatch(String connectionId, InboundMessageType type, InboundMessage message) {
        switch (type) {
            case INIT -> handleInit(connectionId, (DeviceInitMessage) message);
            case PING -> registry.send(connectionId, new PongMessage());
            case CALL_REGISTER -> handleRegister(connectionId, (CallRegisterMessage) message);
            case CALL_STATUS -> handleStatus(connectionId, (CallStatusMessage) message);
            case CALL_AUDIO -> handleAudio((CallAudioMessage) message);
            case CALL_OBSERVE -> handleObserve(connectionId, (CallObserveMessage) message);
            case CALL_UNOBSERVE -> handleUnobserve(connectionId, (CallUnobserveMessage) message);
            default -> throw new UnsupportedMessageTypeException(type.wireName());
        }
    }

    private void handleInit(String connectionId, DeviceInitMessage message) {
        registry.updateMetadata(connectionId, message.info());
        LOG.info("Device {} initialized: {}", connectionId, message.info().keySet());
        ack(connectionId, InboundMessageType.INIT, null);
    }

    private void handleRegister(String connectionId, CallRegisterMessage message) {
        if (message.deviceId() != null && !message.deviceId().isBlank()) {
            registry.updateMetadata(connectionId, Map.of("deviceId", message.deviceId()));
        }
        store.registerCall(message.callId(), message.phoneNumber(), connectionId, message.isIncomingOrDefault());
        ack(connectionId, InboundMessageType.CALL_REGISTER, message.callId());
    }

    private void handleStatus(String connectionId, CallStatusMessage message) {
        CallStatus next = CallStatus.fromWire(message.status())
                .orElseThrow(() -> new MalformedMessageException("Unknown call status: " + message.status()));
        store.updateStatus(message.callId(), next);
        ack(connectionId, InboundMessageType.CALL_STATUS, message.callId());
    }

    private void handleAudio(CallAudioMessage message) {
        audioPipeline.ingestAudio(message.callId(), message.audio());
    }

    private void handleObserve(String connectionId, CallObserveMessage message) {
        fanout.subscribe(message.callId(), connectionId);
        ack(connectionId, InboundMessageType.CALL_OBSERVE, message.callId());
        store.getCall(message.callId())
                .ifPresent(call -> registry.send(connectionId, new CallUpdateMessage(call)));
    }

    private void handleUnobserve(String connectionId, CallUnobserveMessage message) {
        fanout.unsubscribe(message.callId(), connectionId);
        ack(connectionId, InboundMessageType.CALL_UNOBSERVE, message.callId());
    }

    private void ack(String connectionId, InboundMessageType type, String callId) {
        registry.send(connectionId, new AckMessage(type.wireName(), callId));
    }
}
