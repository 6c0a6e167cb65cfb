package com.phillippitts.callrelay.service.capability;

import com.phillippitts.callrelay.domain.CallContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Fallback used when no assistant backend is configured. Produces empty text for every
 * request, which the pipelines treat as "nothing to do".
 */
public class DisabledCallAssistant implements TranscriptionCapability, ResponseCapability, SummaryCapability {

    private static final Logger LOG = LogManager.getLogger(DisabledCallAssistant.class);

    @Override
    public String transcribe(byte[] audio, CallContext context) {
        LOG.debug("No transcription backend configured; {} byte(s) of call {} left untranscribed",
                audio.length, context.callId());
        return "";
    }

    @Override
    public String generateResponse(String transcriptDelta, CallContext context) {
        return "";
    }

    @Override
    public String summarize(String fullTranscript, CallContext context) {
        return "";
    }
}
