package com.phillippitts.callrelay.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link ExternalCapabilityException} with consistent contextual detail.
 *
 * <p><b>Usage:</b>
 * <pre>
 * throw CapabilityExceptionBuilder.create("Capability call timed out")
 *         .capability("transcribe")
 *         .callId(callId)
 *         .timedOut(true)
 *         .durationMs(15000)
 *         .build();
 * </pre>
 *
 * <p>Message format:
 * <pre>
 * {message} (capability={name}, callId={id}, durationMs={ms}, {key}={value}, ...)
 * </pre>
 */
public final class CapabilityExceptionBuilder {

    private final String message;
    private String capability;
    private String callId;
    private Throwable cause;
    private boolean timedOut;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private CapabilityExceptionBuilder(String message) {
        this.message = message;
    }

    public static CapabilityExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new CapabilityExceptionBuilder(message);
    }

    public CapabilityExceptionBuilder capability(String capability) {
        this.capability = capability;
        return this;
    }

    public CapabilityExceptionBuilder callId(String callId) {
        this.callId = callId;
        return this;
    }

    public CapabilityExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public CapabilityExceptionBuilder timedOut(boolean timedOut) {
        this.timedOut = timedOut;
        return this;
    }

    public CapabilityExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a detail pair to the message. Null keys or values are ignored.
     */
    public CapabilityExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    public ExternalCapabilityException build() {
        String name = capability != null ? capability : "unknown";
        String detailed = buildDetailedMessage(name);
        if (cause != null) {
            return new ExternalCapabilityException(detailed, name, timedOut, cause);
        }
        return new ExternalCapabilityException(detailed, name, timedOut);
    }

    private String buildDetailedMessage(String name) {
        StringBuilder sb = new StringBuilder(message);
        sb.append(" (capability=").append(name);
        if (callId != null) {
            sb.append(", callId=").append(callId);
        }
        if (durationMs != null) {
            sb.append(", durationMs=").append(durationMs);
        }
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            sb.append(", ").append(entry.getKey()).append('=').append(entry.getValue());
        }
        sb.append(')');
        return sb.toString();
    }
}
