package com.watchdog.core.check;

import com.watchdog.core.model.MonitoredTarget;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Maps a target type ({@code docker}, {@code http}, {@code ssl}, ...) to the
 * {@link Checker} that probes it.
 */
public final class CheckerRegistry {

    private final Map<String, Checker> checkers;

    private CheckerRegistry(Map<String, Checker> checkers) {
        this.checkers = Collections.unmodifiableMap(new LinkedHashMap<>(checkers));
    }

    /**
     * @param target target to probe
     * @return the checker registered for the target's type
     */
    public Optional<Checker> forTarget(MonitoredTarget target) {
        return Optional.ofNullable(checkers.get(target.getType()));
    }

    public Set<String> types() {
        return checkers.keySet();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link CheckerRegistry} instances.
     */
    public static class Builder {
        private final Map<String, Checker> checkers = new LinkedHashMap<>();

        public Builder register(String type, Checker checker) {
            Objects.requireNonNull(type, "type must not be null");
            Objects.requireNonNull(checker, "checker must not be null");
            if (checkers.putIfAbsent(type, checker) != null) {
                throw new IllegalArgumentException("Duplicate checker for type: " + type);
            }
            return this;
        }

        public CheckerRegistry build() {
            return new CheckerRegistry(checkers);
        }
    }
}
