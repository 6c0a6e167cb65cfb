package com.phillippitts.callrelay.presentation.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.phillippitts.callrelay.domain.ConnectionInfo;
import com.phillippitts.callrelay.exception.ConnectionNotFoundException;
import com.phillippitts.callrelay.protocol.outbound.DeviceCommandMessage;
import com.phillippitts.callrelay.service.command.DeviceCommandService;
import com.phillippitts.callrelay.service.connection.BroadcastResult;
import com.phillippitts.callrelay.service.connection.ConnectionRegistry;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Connection views and operator messages addressed to devices.
 *
 * <ul>
 *   <li>{@code GET /api/connections} - registered connections</li>
 *   <li>{@code GET /api/connections/{connectionId}} - one connection</li>
 *   <li>{@code POST /api/connections/{connectionId}/command} - {@code {type:"command"}} to one device</li>
 *   <li>{@code POST /api/connections/broadcast} - one message to every connection</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/connections")
class ConnectionController {

    private final ConnectionRegistry registry;
    private final DeviceCommandService commandService;

    ConnectionController(ConnectionRegistry registry, DeviceCommandService commandService) {
        this.registry = registry;
        this.commandService = commandService;
    }

    @GetMapping
    List<ConnectionInfo> list() {
        return registry.listActive();
    }

    @GetMapping("/{connectionId}")
    ConnectionInfo get(@PathVariable String connectionId) {
        return registry.find(connectionId)
                .orElseThrow(() -> new ConnectionNotFoundException(connectionId));
    }

    @PostMapping("/{connectionId}/command")
    CommandResponse command(@PathVariable String connectionId, @Valid @RequestBody DeviceCommandRequest request) {
        DeviceCommandMessage sent = commandService.sendDeviceCommand(connectionId, request.command(), request.data());
        return new CommandResponse(true, "Command " + sent.command() + " sent to device " + connectionId);
    }

    @PostMapping("/broadcast")
    BroadcastResult broadcast(@Valid @RequestBody BroadcastRequest request) {
        return commandService.broadcast(request.type(), request.message());
    }

    record DeviceCommandRequest(@NotBlank String command, JsonNode data) {}

    record BroadcastRequest(@NotBlank String message, String type) {}

    record CommandResponse(boolean success, String message) {}
}
