package com.watchdog.core.model;

import java.util.Locale;

/**
 * Groups of checks that share one schedule.
 *
 * <p>
 * Each category runs on its own timer. Only {@link #ENDPOINTS} feeds response
 * times into the anomaly detector.
 * </p>
 *
 * @since 1.0.0
 */
public enum CheckCategory {

    /** Containers, managed processes and OS services. */
    SERVICES(false),

    /** HTTP endpoints. */
    ENDPOINTS(true),

    /** Disk, RAM and CPU usage. */
    RESOURCES(false),

    /** TLS certificate expiry. */
    SSL(false);

    private final boolean tracksLatency;

    CheckCategory(boolean tracksLatency) {
        this.tracksLatency = tracksLatency;
    }

    /**
     * @return {@code true} if successful results of this category carry a
     *         response time that should be baselined
     */
    public boolean tracksLatency() {
        return tracksLatency;
    }

    /**
     * @return lowercase name used in logs and configuration
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
