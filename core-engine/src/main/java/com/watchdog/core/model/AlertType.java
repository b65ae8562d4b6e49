package com.watchdog.core.model;

/**
 * Kinds of alerts the monitor can emit.
 */
public enum AlertType {
    SERVICE_DOWN,
    SERVICE_STILL_DOWN,
    SERVICE_RECOVERED,
    SERVICE_FLAPPING,
    PERFORMANCE_DEGRADATION,
    RESOURCE_WARNING,
    SSL_EXPIRING
}
