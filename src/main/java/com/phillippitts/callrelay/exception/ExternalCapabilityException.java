package com.phillippitts.callrelay.exception;

/**
 * Thrown when an external capability (transcription, response or summary generation)
 * fails or exceeds its time budget.
 *
 * <p>Recoverable: callers skip the enrichment step for this attempt and carry on.
 */
public class ExternalCapabilityException extends CallRelayException {

    public static final String CODE = "CAPABILITY_FAILURE";

    private final String capability;
    private final boolean timedOut;

    public ExternalCapabilityException(String message, String capability, boolean timedOut) {
        super(CODE, message);
        this.capability = capability;
        this.timedOut = timedOut;
    }

    public ExternalCapabilityException(String message, String capability, boolean timedOut, Throwable cause) {
        super(CODE, message, cause);
        this.capability = capability;
        this.timedOut = timedOut;
    }

    public String getCapability() {
        return capability;
    }

    public boolean isTimedOut() {
        return timedOut;
    }
}
