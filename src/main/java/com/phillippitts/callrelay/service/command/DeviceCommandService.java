package com.phillippitts.callrelay.service.command;

import com.fasterxml.jackson.databind.JsonNode;
import com.phillippitts.callrelay.exception.ConnectionNotFoundException;
import com.phillippitts.callrelay.exception.DeliveryFailureException;
import com.phillippitts.callrelay.protocol.outbound.BroadcastMessage;
import com.phillippitts.callrelay.protocol.outbound.DeviceCommandMessage;
import com.phillippitts.callrelay.service.connection.BroadcastResult;
import com.phillippitts.callrelay.service.connection.ConnectionRegistry;
import com.phillippitts.callrelay.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Objects;

/**
 * Operator messages that target connections directly instead of a call.
 */
@Service
public class DeviceCommandService {

    private static final Logger LOG = LogManager.getLogger(DeviceCommandService.class);

    private final ConnectionRegistry registry;
    private final Clock clock;

    public DeviceCommandService(ConnectionRegistry registry, Clock clock) {
        this.registry = Objects.requireNonNull(registry);
        this.clock = Objects.requireNonNull(clock);
    }

    /**
     * @throws ConnectionNotFoundException if {@code connectionId} is not registered
     * @throws DeliveryFailureException    if the transport is closed or the write fails
     */
    public DeviceCommandMessage sendDeviceCommand(String connectionId, String command, JsonNode data) {
        Objects.requireNonNull(command, "command must not be null");
        if (registry.find(connectionId).isEmpty()) {
            throw new ConnectionNotFoundException(connectionId);
        }
        DeviceCommandMessage message = new DeviceCommandMessage(command, data);
        registry.sendOrThrow(connectionId, message);
        LOG.info("Command {} sent to device {}", command, connectionId);
        return message;
    }

    /**
     * Writes an announcement to every registered connection.
     *
     * @param type message type, {@link BroadcastMessage#DEFAULT_TYPE} when blank
     */
    public BroadcastResult broadcast(String type, String text) {
        Objects.requireNonNull(text, "text must not be null");
        String resolved = type == null || type.isBlank() ? BroadcastMessage.DEFAULT_TYPE : type;
        BroadcastResult result = registry.broadcast(
                new BroadcastMessage(resolved, text, clock.instant().toString()));
        LOG.info("Broadcast {} '{}': delivered={}, failed={}", resolved, LogSanitizer.preview(text),
                result.successCount(), result.failureCount());
        return result;
    }
}
