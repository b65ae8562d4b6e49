package com.watchdog.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A flip of observed health, used only for flap detection.
 */
public class Transition {

    private Instant time;
    private HealthState state;

    /** No-arg constructor required by Jackson. */
    public Transition() {
    }

    public Transition(Instant time, HealthState state) {
        this.time = time;
        this.state = state;
    }

    public Instant getTime() {
        return time;
    }

    public void setTime(Instant time) {
        this.time = time;
    }

    public HealthState getState() {
        return state;
    }

    public void setState(HealthState state) {
        this.state = state;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Transition that))
            return false;
        return Objects.equals(time, that.time) && state == that.state;
    }

    @Override
    public int hashCode() {
        return Objects.hash(time, state);
    }

    @Override
    public String toString() {
        return "Transition{time=" + time + ", state=" + state + '}';
    }
}
