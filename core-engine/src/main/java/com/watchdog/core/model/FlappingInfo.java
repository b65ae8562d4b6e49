package com.watchdog.core.model;

import java.util.List;

/**
 * Point-in-time view of a service's flap window.
 */
public final class FlappingInfo {

    private final boolean flapping;
    private final int transitionCount;
    private final List<Transition> transitions;

    public FlappingInfo(boolean flapping, int transitionCount, List<Transition> transitions) {
        this.flapping = flapping;
        this.transitionCount = transitionCount;
        this.transitions = List.copyOf(transitions);
    }

    public boolean isFlapping() {
        return flapping;
    }

    /**
     * @return number of transitions inside the trailing window
     */
    public int getTransitionCount() {
        return transitionCount;
    }

    /**
     * @return the in-window transitions, oldest first
     */
    public List<Transition> getTransitions() {
        return transitions;
    }

    @Override
    public String toString() {
        return "FlappingInfo{flapping=" + flapping + ", transitionCount=" + transitionCount + '}';
    }
}
