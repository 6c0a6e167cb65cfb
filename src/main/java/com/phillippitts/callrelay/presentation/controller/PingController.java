package com.phillippitts.callrelay.presentation.controller;

import com.phillippitts.callrelay.service.call.CallSessionStore;
import com.phillippitts.callrelay.service.connection.ConnectionRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;

/**
 * Liveness probe reporting how many connections and calls the relay currently holds.
 */
@RestController
class PingController {

    private static final Logger log = LogManager.getLogger(PingController.class);

    private final ConnectionRegistry registry;
    private final CallSessionStore store;

    PingController(ConnectionRegistry registry, CallSessionStore store) {
        this.registry = registry;
        this.store = store;
    }

    @GetMapping("/ping")
    ResponseEntity<Map<String, Object>> ping() {
        log.debug("Ping received");
        return ResponseEntity.ok(Map.of(
                "status", "ok",
                "connections", registry.size(),
                "calls", store.size(),
                "timestamp", Instant.now().toString()
        ));
    }
}
