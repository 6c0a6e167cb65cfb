package com.phillippitts.callrelay.service.capability;

/**
 * Capability names used in metrics tags, logs and exception details.
 */
public final class CapabilityNames {

    public static final String TRANSCRIBE = "transcribe";
    public static final String RESPOND = "respond";
    public static final String SUMMARIZE = "summarize";
    public static final String NOTIFY = "notify";

    private CapabilityNames() {}
}
