package com.phillippitts.callrelay.service.capability;

/**
 * Best-effort notification to an external chat channel. Failures never affect call state.
 */
public interface ChannelNotifier {

    void notifyChannel(String message);
}
