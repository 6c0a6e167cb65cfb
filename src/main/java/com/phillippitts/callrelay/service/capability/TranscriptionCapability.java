package com.phillippitts.callrelay.service.capability;

import com.phillippitts.callrelay.domain.CallContext;

/**
 * External speech-to-text service.
 *
 * <p>Implementations may block and may fail; callers go through {@link CapabilityInvoker},
 * which bounds every call with a timeout.
 */
public interface TranscriptionCapability {

    /**
     * @param audio   concatenated audio fragments in arrival order
     * @param context call the audio belongs to
     * @return recognized text, possibly empty
     */
    String transcribe(byte[] audio, CallContext context);
}
