package com.watchdog.core.state;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.watchdog.core.model.FailureRecord;
import com.watchdog.core.model.Transition;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.Set;

/**
 * On-disk form of the {@link StateEngine}: open failures, transition logs,
 * acknowledged ids and the certificate expiry cache.
 *
 * <p>
 * A missing collection reads as empty so older files stay loadable.
 * </p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PersistedState {

    private Map<String, FailureRecord> failures = new LinkedHashMap<>();

    @JsonAlias("flapping")
    private Map<String, List<Transition>> transitions = new LinkedHashMap<>();

    private Set<String> acknowledged = new TreeSet<>();
    private Map<String, Instant> sslExpiry = new LinkedHashMap<>();
    private Instant lastSaved;

    public Map<String, FailureRecord> getFailures() {
        return failures;
    }

    public void setFailures(Map<String, FailureRecord> failures) {
        this.failures = failures != null ? failures : new LinkedHashMap<>();
    }

    public Map<String, List<Transition>> getTransitions() {
        return transitions;
    }

    public void setTransitions(Map<String, List<Transition>> transitions) {
        this.transitions = transitions != null ? transitions : new LinkedHashMap<>();
    }

    public Set<String> getAcknowledged() {
        return acknowledged;
    }

    public void setAcknowledged(Set<String> acknowledged) {
        this.acknowledged = acknowledged != null ? new TreeSet<>(acknowledged) : new TreeSet<>();
    }

    public Map<String, Instant> getSslExpiry() {
        return sslExpiry;
    }

    public void setSslExpiry(Map<String, Instant> sslExpiry) {
        this.sslExpiry = sslExpiry != null ? sslExpiry : new LinkedHashMap<>();
    }

    public Instant getLastSaved() {
        return lastSaved;
    }

    public void setLastSaved(Instant lastSaved) {
        this.lastSaved = lastSaved;
    }

    static List<Transition> copyOf(List<Transition> transitions) {
        return transitions != null ? new ArrayList<>(transitions) : new ArrayList<>();
    }
}
