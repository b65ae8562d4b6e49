package com.watchdog.core.config;

import com.watchdog.core.state.StateEngine;

import java.time.Duration;
import java.util.List;

/**
 * Alerting behaviour: re-alert cooldown, flap detection, recovery
 * notifications and outbound delivery pacing.
 *
 * @since 1.0.0
 */
public class AlertSettings {

    /** Minimum minutes between two alerts for the same open failure. */
    private long cooldownMinutes = 30;

    /** Send a notification when a failing service recovers. */
    private boolean recoveryNotify = true;

    /** Transitions inside the window that make a service flapping. */
    private int flappingThreshold = 3;

    /** Trailing window for flap detection. */
    private long flappingWindowMinutes = 10;

    /** Minimum gap between two outbound messages (30 per second). */
    private long minSendIntervalMillis = 33;

    public Duration cooldown() {
        return Duration.ofMinutes(cooldownMinutes);
    }

    public Duration flappingWindow() {
        return Duration.ofMinutes(flappingWindowMinutes);
    }

    public Duration minSendInterval() {
        return Duration.ofMillis(minSendIntervalMillis);
    }

    void collectErrors(List<String> errors) {
        if (cooldownMinutes < 0) {
            errors.add("alerts.cooldownMinutes must be >= 0, got: " + cooldownMinutes);
        }
        // one transition is any first failure; the log holds at most MAX_TRANSITIONS
        if (flappingThreshold < 2 || flappingThreshold > StateEngine.MAX_TRANSITIONS) {
            errors.add("alerts.flappingThreshold must be in [2, " + StateEngine.MAX_TRANSITIONS
                    + "], got: " + flappingThreshold);
        }
        if (flappingWindowMinutes <= 0) {
            errors.add("alerts.flappingWindowMinutes must be > 0, got: " + flappingWindowMinutes);
        }
        if (minSendIntervalMillis < 0) {
            errors.add("alerts.minSendIntervalMillis must be >= 0, got: " + minSendIntervalMillis);
        }
    }

    public long getCooldownMinutes() {
        return cooldownMinutes;
    }

    public void setCooldownMinutes(long cooldownMinutes) {
        this.cooldownMinutes = cooldownMinutes;
    }

    public boolean isRecoveryNotify() {
        return recoveryNotify;
    }

    public void setRecoveryNotify(boolean recoveryNotify) {
        this.recoveryNotify = recoveryNotify;
    }

    public int getFlappingThreshold() {
        return flappingThreshold;
    }

    public void setFlappingThreshold(int flappingThreshold) {
        this.flappingThreshold = flappingThreshold;
    }

    public long getFlappingWindowMinutes() {
        return flappingWindowMinutes;
    }

    public void setFlappingWindowMinutes(long flappingWindowMinutes) {
        this.flappingWindowMinutes = flappingWindowMinutes;
    }

    public long getMinSendIntervalMillis() {
        return minSendIntervalMillis;
    }

    public void setMinSendIntervalMillis(long minSendIntervalMillis) {
        this.minSendIntervalMillis = minSendIntervalMillis;
    }
}
