package com.watchdog.core.config;

import com.watchdog.core.model.CheckCategory;

import java.time.Duration;
import java.util.List;

/**
 * How often each check category runs, plus the state auto-save cadence.
 * All values are in seconds.
 */
public class IntervalSettings {

    private long servicesSeconds = 60;
    private long endpointsSeconds = 300;
    private long resourcesSeconds = 300;
    private long sslSeconds = 86_400;
    private long stateSaveSeconds = 60;

    /**
     * @param category check category
     * @return the period between two runs of that category
     */
    public Duration intervalFor(CheckCategory category) {
        return switch (category) {
            case SERVICES -> Duration.ofSeconds(servicesSeconds);
            case ENDPOINTS -> Duration.ofSeconds(endpointsSeconds);
            case RESOURCES -> Duration.ofSeconds(resourcesSeconds);
            case SSL -> Duration.ofSeconds(sslSeconds);
        };
    }

    public Duration stateSaveInterval() {
        return Duration.ofSeconds(stateSaveSeconds);
    }

    void collectErrors(List<String> errors) {
        requirePositive(errors, "intervals.servicesSeconds", servicesSeconds);
        requirePositive(errors, "intervals.endpointsSeconds", endpointsSeconds);
        requirePositive(errors, "intervals.resourcesSeconds", resourcesSeconds);
        requirePositive(errors, "intervals.sslSeconds", sslSeconds);
        requirePositive(errors, "intervals.stateSaveSeconds", stateSaveSeconds);
    }

    private static void requirePositive(List<String> errors, String name, long value) {
        if (value <= 0) {
            errors.add(name + " must be > 0, got: " + value);
        }
    }

    public long getServicesSeconds() {
        return servicesSeconds;
    }

    public void setServicesSeconds(long servicesSeconds) {
        this.servicesSeconds = servicesSeconds;
    }

    public long getEndpointsSeconds() {
        return endpointsSeconds;
    }

    public void setEndpointsSeconds(long endpointsSeconds) {
        this.endpointsSeconds = endpointsSeconds;
    }

    public long getResourcesSeconds() {
        return resourcesSeconds;
    }

    public void setResourcesSeconds(long resourcesSeconds) {
        this.resourcesSeconds = resourcesSeconds;
    }

    public long getSslSeconds() {
        return sslSeconds;
    }

    public void setSslSeconds(long sslSeconds) {
        this.sslSeconds = sslSeconds;
    }

    public long getStateSaveSeconds() {
        return stateSaveSeconds;
    }

    public void setStateSaveSeconds(long stateSaveSeconds) {
        this.stateSaveSeconds = stateSaveSeconds;
    }
}
