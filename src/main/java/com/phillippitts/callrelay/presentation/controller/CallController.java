package com.phillippitts.callrelay.presentation.controller;

import com.phillippitts.callrelay.domain.AiResponseType;
import com.phillippitts.callrelay.domain.CallSession;
import com.phillippitts.callrelay.exception.MalformedMessageException;
import com.phillippitts.callrelay.protocol.outbound.CallAiResponseMessage;
import com.phillippitts.callrelay.service.call.CallSessionStore;
import com.phillippitts.callrelay.service.command.CallCommand;
import com.phillippitts.callrelay.service.command.CallCommandService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Read-only call views and operator commands.
 *
 * <ul>
 *   <li>{@code GET /api/calls} - retained sessions, transcripts omitted</li>
 *   <li>{@code GET /api/calls/{callId}} - one session with its transcript</li>
 *   <li>{@code POST /api/calls/{callId}/commands} - send {@code speak}/{@code end_call}/{@code transcription}
 *       to the owning device</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/calls")
class CallController {

    private final CallSessionStore store;
    private final CallCommandService commandService;

    CallController(CallSessionStore store, CallCommandService commandService) {
        this.store = store;
        this.commandService = commandService;
    }

    @GetMapping
    List<CallSession> list() {
        return store.listActive();
    }

    @GetMapping("/{callId}")
    CallSession get(@PathVariable String callId) {
        return store.requireCall(callId);
    }

    @PostMapping("/{callId}/commands")
    ResponseEntity<CallAiResponseMessage> command(@PathVariable String callId,
                                                  @Valid @RequestBody CommandRequest request) {
        AiResponseType type = AiResponseType.fromWire(request.command())
                .orElseThrow(() -> new MalformedMessageException("Unknown command: " + request.command()));
        CallAiResponseMessage sent = commandService.sendCallCommand(callId, new CallCommand(type, request.text()));
        return ResponseEntity.accepted().body(sent);
    }

    /**
     * @param command {@code speak}, {@code end_call} or {@code transcription}
     * @param text    text for the device, optional
     */
    record CommandRequest(@NotBlank String command, String text) {}
}
