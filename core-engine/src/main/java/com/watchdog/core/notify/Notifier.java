package com.watchdog.core.notify;

/**
 * Outbound message transport, e.g. a chat bot.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface Notifier {

    /**
     * Deliver one pre-formatted message.
     *
     * @param message message text
     * @throws NotificationException if delivery failed
     */
    void send(String message) throws NotificationException;
}
