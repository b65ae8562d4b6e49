package com.watchdog.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Summary of a closed failure, returned when a service recovers.
 *
 * @since 1.0.0
 */
public final class RecoveryInfo {

    private final Duration downtime;
    private final int failuresSeen;
    private final Instant firstSeen;

    public RecoveryInfo(Duration downtime, int failuresSeen, Instant firstSeen) {
        this.downtime = Objects.requireNonNull(downtime, "downtime must not be null");
        this.failuresSeen = failuresSeen;
        this.firstSeen = firstSeen;
    }

    /**
     * @return time between the first observed failure and the recovery
     */
    public Duration getDowntime() {
        return downtime;
    }

    public int getFailuresSeen() {
        return failuresSeen;
    }

    public Instant getFirstSeen() {
        return firstSeen;
    }

    @Override
    public String toString() {
        return "RecoveryInfo{" +
                "downtime=" + downtime +
                ", failuresSeen=" + failuresSeen +
                ", firstSeen=" + firstSeen +
                '}';
    }
}
