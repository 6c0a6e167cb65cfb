package com.phillippitts.callrelay.service.notify;

/**
 * Call events that may be forwarded to the chat channel.
 */
public enum ChannelNotificationKind {
    REGISTERED,
    ANSWERED,
    ENDED,
    SUMMARY
}
