package com.watchdog.agent.probe;

import com.watchdog.core.check.Checker;
import com.watchdog.core.config.ThresholdSettings;
import com.watchdog.core.model.CheckResult;
import com.watchdog.core.model.MonitoredTarget;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Compares host resource usage against its configured threshold.
 *
 * <p>
 * Readings are cached per resource for {@link #CACHE_TTL}, so a burst of
 * checks samples the host once. A reading at or above the threshold is
 * unhealthy. Metadata carries {@code usage} and {@code threshold} as whole
 * percentages.
 * </p>
 *
 * @since 1.0.0
 */
public class ResourceChecker implements Checker {

    public static final String TYPE = MonitoredTarget.TYPE_RESOURCE;

    static final Duration CACHE_TTL = Duration.ofSeconds(60);

    private final ResourceSampler sampler;
    private final ThresholdSettings thresholds;
    private final Clock clock;
    private final Map<String, Reading> cache = new ConcurrentHashMap<>();

    public ResourceChecker(ResourceSampler sampler, ThresholdSettings thresholds) {
        this(sampler, thresholds, Clock.systemUTC());
    }

    public ResourceChecker(ResourceSampler sampler, ThresholdSettings thresholds, Clock clock) {
        this.sampler = Objects.requireNonNull(sampler, "sampler must not be null");
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public CheckResult check(MonitoredTarget target) throws IOException {
        String resource = target.getName();
        double threshold = thresholds.forResource(resource);
        long usage = Math.round(sample(resource));
        long limit = Math.round(threshold);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("usage", usage);
        metadata.put("threshold", limit);

        if (usage >= threshold) {
            String label = Character.toUpperCase(resource.charAt(0)) + resource.substring(1);
            return CheckResult.of(false, label + " usage at " + usage + "% (threshold: " + limit + "%)", metadata);
        }
        return CheckResult.of(true, null, metadata);
    }

    private double sample(String resource) throws IOException {
        Instant now = clock.instant();
        Reading cached = cache.get(resource);
        if (cached != null && Duration.between(cached.takenAt, now).compareTo(CACHE_TTL) < 0) {
            return cached.value;
        }
        double value = sampler.usagePercent(resource);
        cache.put(resource, new Reading(value, now));
        return value;
    }

    private static final class Reading {
        private final double value;
        private final Instant takenAt;

        private Reading(double value, Instant takenAt) {
            this.value = value;
            this.takenAt = takenAt;
        }
    }
}
