package com.phillippitts.callrelay.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;

/**
 * Typed properties for the WebSocket transport and connection liveness.
 */
@Validated
@ConfigurationProperties(prefix = "relay.connection")
public class ConnectionProperties {

    @NotBlank
    private final String path;

    private final List<String> allowedOrigins;

    /**
     * Connections silent for longer than this are closed by the eviction sweep.
     */
    @NotNull
    private final Duration inactivityThreshold;

    @Min(1000)
    private final int sendTimeLimitMs;

    @Min(1024)
    private final int sendBufferSizeLimit;

    @ConstructorBinding
    public ConnectionProperties(String path,
                                List<String> allowedOrigins,
                                Duration inactivityThreshold,
                                Integer sendTimeLimitMs,
                                Integer sendBufferSizeLimit) {
        this.path = path == null ? "/ws" : path;
        this.allowedOrigins = allowedOrigins == null || allowedOrigins.isEmpty()
                ? List.of("*")
                : List.copyOf(allowedOrigins);
        this.inactivityThreshold = inactivityThreshold == null ? Duration.ofMinutes(30) : inactivityThreshold;
        this.sendTimeLimitMs = sendTimeLimitMs == null ? 10_000 : sendTimeLimitMs;
        this.sendBufferSizeLimit = sendBufferSizeLimit == null ? 512 * 1024 : sendBufferSizeLimit;
    }

    public String getPath() {
        return path;
    }

    public List<String> getAllowedOrigins() {
        return allowedOrigins;
    }

    public Duration getInactivityThreshold() {
        return inactivityThreshold;
    }

    public int getSendTimeLimitMs() {
        return sendTimeLimitMs;
    }

    public int getSendBufferSizeLimit() {
        return sendBufferSizeLimit;
    }
}
