package com.watchdog.core.state;

import java.time.Instant;

/**
 * Counts exposed by {@link StateEngine#getStats()}.
 */
public final class StateStats {

    private final int activeFailures;
    private final int acknowledged;
    private final int trackedTransitions;
    private final int flapping;
    private final int sslCertificates;
    private final Instant lastSaved;

    StateStats(int activeFailures, int acknowledged, int trackedTransitions, int flapping,
            int sslCertificates, Instant lastSaved) {
        this.activeFailures = activeFailures;
        this.acknowledged = acknowledged;
        this.trackedTransitions = trackedTransitions;
        this.flapping = flapping;
        this.sslCertificates = sslCertificates;
        this.lastSaved = lastSaved;
    }

    public int getActiveFailures() {
        return activeFailures;
    }

    public int getAcknowledged() {
        return acknowledged;
    }

    /**
     * @return number of ids with a non-empty transition log
     */
    public int getTrackedTransitions() {
        return trackedTransitions;
    }

    /**
     * @return number of ids currently flapping
     */
    public int getFlapping() {
        return flapping;
    }

    public int getSslCertificates() {
        return sslCertificates;
    }

    /**
     * @return time of the last successful save, {@code null} before the first
     */
    public Instant getLastSaved() {
        return lastSaved;
    }

    @Override
    public String toString() {
        return "StateStats{" +
                "activeFailures=" + activeFailures +
                ", acknowledged=" + acknowledged +
                ", flapping=" + flapping +
                ", sslCertificates=" + sslCertificates +
                ", lastSaved=" + lastSaved +
                '}';
    }
}
