package com.watchdog.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Observed health polarity recorded in a {@link Transition}.
 */
public enum HealthState {
    @JsonProperty("healthy")
    HEALTHY,
    @JsonProperty("unhealthy")
    UNHEALTHY
}
