package com.phillippitts.callrelay.service.connection;

import com.phillippitts.callrelay.config.properties.ConnectionProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic sweep closing connections that stayed silent past the inactivity threshold.
 */
@Component
public class ConnectionEvictionTask {

    private static final Logger LOG = LogManager.getLogger(ConnectionEvictionTask.class);

    private final ConnectionRegistry registry;
    private final ConnectionProperties properties;

    public ConnectionEvictionTask(ConnectionRegistry registry, ConnectionProperties properties) {
        this.registry = registry;
        this.properties = properties;
    }

    @Scheduled(fixedDelayString = "${relay.connection.eviction-interval-ms:60000}",
            initialDelayString = "${relay.connection.eviction-interval-ms:60000}")
    public void evictInactive() {
        int evicted = registry.evictInactive(properties.getInactivityThreshold());
        if (evicted > 0) {
            LOG.info("Inactivity sweep closed {} connection(s), {} remain", evicted, registry.size());
        }
    }
}
