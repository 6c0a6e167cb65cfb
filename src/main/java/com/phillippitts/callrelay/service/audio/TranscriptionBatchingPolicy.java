package com.phillippitts.callrelay.service.audio;

import com.phillippitts.callrelay.config.properties.CallProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Decides when buffered audio is sent for transcription.
 *
 * <p>A transcription is due on every Nth fragment of a call ({@code relay.call.transcription-batch-size},
 * default 20). The first fragment and everything between two multiples of N are only buffered.
 * At most one attempt per call may be outstanding; a trigger arriving while one is in flight
 * is skipped, not queued.
 */
@Component
public class TranscriptionBatchingPolicy {

    private final int batchSize;
    private final Set<String> outstanding = ConcurrentHashMap.newKeySet();

    @Autowired
    public TranscriptionBatchingPolicy(CallProperties properties) {
        this(properties.getTranscriptionBatchSize());
    }

    public TranscriptionBatchingPolicy(int batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1, got " + batchSize);
        }
        this.batchSize = batchSize;
    }

    /**
     * @param fragmentCount fragments received for the call, including the one just appended
     */
    public boolean isDue(int fragmentCount) {
        return fragmentCount > 0 && fragmentCount % batchSize == 0;
    }

    /**
     * Claims the call's single transcription slot.
     *
     * @return {@code false} if an attempt for {@code callId} is already outstanding
     */
    public boolean tryBegin(String callId) {
        return outstanding.add(callId);
    }

    /**
     * Releases the slot claimed by {@link #tryBegin(String)}.
     */
    public void complete(String callId) {
        outstanding.remove(callId);
    }

    public boolean isOutstanding(String callId) {
        return outstanding.contains(callId);
    }

    public int getBatchSize() {
        return batchSize;
    }
}
