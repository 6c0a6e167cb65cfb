package com.phillippitts.callrelay.service.call.event;

import com.phillippitts.callrelay.domain.CallSession;

/**
 * Emitted after a summary has been stored on an ended call.
 */
public record CallSummarizedEvent(CallSession session) {
}
