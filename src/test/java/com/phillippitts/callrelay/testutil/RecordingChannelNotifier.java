package com.phillippitts.callrelay.testutil;

import com.phillippitts.callrelay.service.capability.ChannelNotifier;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Channel notifier that keeps every message; can be switched to fail.
 */
public class RecordingChannelNotifier implements ChannelNotifier {

    private final List<String> messages = new CopyOnWriteArrayList<>();
    private volatile boolean failing;

    @Override
    public void notifyChannel(String message) {
        if (failing) {
            throw new IllegalStateException("channel unavailable");
        }
        messages.add(message);
    }

    public void fail() {
        this.failing = true;
    }

    public List<String> messages() {
        return List.copyOf(messages);
    }
}
