package com.watchdog.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Open failure for one service.
 *
 * <p>
 * Exists from the first observed failure until recovery. Mutable so the state
 * engine can update it in place; callers outside the engine only ever see
 * copies.
 * </p>
 *
 * @since 1.0.0
 */
public class FailureRecord {

    private Instant firstSeen;
    private Instant lastAlertSent;
    private String error;
    private int consecutiveFailures;

    /** No-arg constructor required by Jackson. */
    public FailureRecord() {
    }

    public FailureRecord(Instant firstSeen, Instant lastAlertSent, String error, int consecutiveFailures) {
        this.firstSeen = firstSeen;
        this.lastAlertSent = lastAlertSent;
        this.error = error;
        this.consecutiveFailures = consecutiveFailures;
    }

    /**
     * @return a detached copy of this record
     */
    public FailureRecord copy() {
        return new FailureRecord(firstSeen, lastAlertSent, error, consecutiveFailures);
    }

    public Instant getFirstSeen() {
        return firstSeen;
    }

    public void setFirstSeen(Instant firstSeen) {
        this.firstSeen = firstSeen;
    }

    public Instant getLastAlertSent() {
        return lastAlertSent;
    }

    public void setLastAlertSent(Instant lastAlertSent) {
        this.lastAlertSent = lastAlertSent;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    public void setConsecutiveFailures(int consecutiveFailures) {
        this.consecutiveFailures = consecutiveFailures;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof FailureRecord that))
            return false;
        return consecutiveFailures == that.consecutiveFailures
                && Objects.equals(firstSeen, that.firstSeen)
                && Objects.equals(lastAlertSent, that.lastAlertSent)
                && Objects.equals(error, that.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(firstSeen, lastAlertSent, error, consecutiveFailures);
    }

    @Override
    public String toString() {
        return "FailureRecord{" +
                "firstSeen=" + firstSeen +
                ", lastAlertSent=" + lastAlertSent +
                ", error='" + error + '\'' +
                ", consecutiveFailures=" + consecutiveFailures +
                '}';
    }
}
