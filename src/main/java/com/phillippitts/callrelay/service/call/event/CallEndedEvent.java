package com.phillippitts.callrelay.service.call.event;

import com.phillippitts.callrelay.domain.CallSession;

/**
 * Emitted exactly once per call, when it first reaches {@code ended}.
 *
 * @param session    full snapshot including the accumulated transcript
 * @param generation registration number of the ended call, see
 *                   {@link com.phillippitts.callrelay.service.call.CallSessionStore#isCurrent(String, long)}
 */
public record CallEndedEvent(CallSession session, long generation) {
}
