package com.watchdog.core.notify;

/**
 * Thrown by a {@link Notifier} when a message could not be delivered.
 */
public class NotificationException extends Exception {

    private final int statusCode;

    public NotificationException(String message) {
        this(message, -1, null);
    }

    public NotificationException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public NotificationException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * @return the transport's status code, or {@code -1} when there was none
     */
    public int getStatusCode() {
        return statusCode;
    }
}
