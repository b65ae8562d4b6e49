package com.watchdog.agent;

import com.watchdog.core.notify.Notifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes notifications to the log. Used when no chat bot is configured.
 */
public class LogNotifier implements Notifier {

    private static final Logger LOG = LoggerFactory.getLogger(LogNotifier.class);

    @Override
    public void send(String message) {
        LOG.info("Notification:\n{}", message);
    }
}
