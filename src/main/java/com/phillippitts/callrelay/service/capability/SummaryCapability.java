package com.phillippitts.callrelay.service.capability;

import com.phillippitts.callrelay.domain.CallContext;

public interface SummaryCapability {

    /**
     * @param fullTranscript complete transcript of an ended call
     * @param context        call facts, {@code inProgress} is {@code false}
     */
    String summarize(String fullTranscript, CallContext context);
}
