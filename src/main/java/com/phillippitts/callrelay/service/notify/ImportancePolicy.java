package com.phillippitts.callrelay.service.notify;

import com.phillippitts.callrelay.domain.CallSession;

/**
 * Decides whether a call event is worth a chat-channel notification.
 *
 * <p>Replace the default bean to filter by caller, duration, summary content or an external
 * scoring service. Implementations must be fast and must not throw; they run on the thread
 * that applied the call change.
 */
@FunctionalInterface
public interface ImportancePolicy {

    boolean shouldForward(ChannelNotificationKind kind, CallSession session);
}
