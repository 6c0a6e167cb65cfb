package com.phillippitts.callrelay.service.capability;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Default {@link ChannelNotifier}: writes notifications to the log.
 */
public class LoggingChannelNotifier implements ChannelNotifier {

    private static final Logger LOG = LogManager.getLogger(LoggingChannelNotifier.class);

    @Override
    public void notifyChannel(String message) {
        LOG.info("[channel] {}", message);
    }
}
