package com.watchdog.core.model;

/**
 * Outcome of recording a failure against the state engine.
 *
 * @since 1.0.0
 */
public enum AlertAction {

    /** No failure was open for the service; alert immediately. */
    FIRST_FAILURE,

    /** The failure is still open and the cooldown has elapsed; re-alert. */
    ONGOING_FAILURE,

    /** The failure is still open and inside the cooldown; stay quiet. */
    SUPPRESSED;

    /**
     * @return {@code true} if this action warrants a down alert
     */
    public boolean shouldAlert() {
        return this != SUPPRESSED;
    }
}
