package com.phillippitts.callrelay.service.notify;

import com.phillippitts.callrelay.domain.CallSession;

/**
 * Default policy: every call event is forwarded.
 */
public class ForwardAllImportancePolicy implements ImportancePolicy {

    @Override
    public boolean shouldForward(ChannelNotificationKind kind, CallSession session) {
        return true;
    }
}
