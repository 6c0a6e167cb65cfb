package com.phillippitts.callrelay.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Typed properties for call session handling.
 */
@Validated
@ConfigurationProperties(prefix = "relay.call")
public class CallProperties {

    /**
     * Transcription is attempted on every Nth audio fragment of a call.
     */
    @Min(1)
    private final int transcriptionBatchSize;

    /**
     * How long buffered audio is kept after a call ends.
     */
    @NotNull
    private final Duration audioRetention;

    /**
     * How long ended session metadata stays in memory.
     */
    @NotNull
    private final Duration historyRetention;

    /**
     * Upper bound for every transcription, response and summary call.
     */
    @NotNull
    private final Duration capabilityTimeout;

    @ConstructorBinding
    public CallProperties(Integer transcriptionBatchSize,
                          Duration audioRetention,
                          Duration historyRetention,
                          Duration capabilityTimeout) {
        this.transcriptionBatchSize = transcriptionBatchSize == null ? 20 : transcriptionBatchSize;
        this.audioRetention = audioRetention == null ? Duration.ofSeconds(60) : audioRetention;
        this.historyRetention = historyRetention == null ? Duration.ofMinutes(30) : historyRetention;
        this.capabilityTimeout = capabilityTimeout == null ? Duration.ofSeconds(15) : capabilityTimeout;
    }

    /**
     * Defaults for tests and manual wiring.
     */
    public static CallProperties defaults() {
        return new CallProperties(null, null, null, null);
    }

    public int getTranscriptionBatchSize() {
        return transcriptionBatchSize;
    }

    public Duration getAudioRetention() {
        return audioRetention;
    }

    public Duration getHistoryRetention() {
        return historyRetention;
    }

    public Duration getCapabilityTimeout() {
        return capabilityTimeout;
    }
}
