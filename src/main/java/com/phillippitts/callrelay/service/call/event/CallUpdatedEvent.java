package com.phillippitts.callrelay.service.call.event;

import com.phillippitts.callrelay.domain.CallSession;
import com.phillippitts.callrelay.domain.CallStatus;

/**
 * Emitted for every accepted registration or status transition.
 *
 * @param session        snapshot after the change, transcript omitted
 * @param previousStatus status before the change, {@code null} for a new registration
 */
public record CallUpdatedEvent(CallSession session, CallStatus previousStatus) {

    public boolean isRegistration() {
        return previousStatus == null;
    }
}
