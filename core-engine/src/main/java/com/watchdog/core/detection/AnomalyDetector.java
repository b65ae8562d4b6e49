package com.watchdog.core.detection;

import com.watchdog.core.config.AnomalySettings;
import com.watchdog.core.model.AnomalyResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Response-time anomaly detector based on a rolling median.
 *
 * <p>
 * Keeps one {@link RingBuffer} of the last {@code sampleSize} latencies per
 * service. A sample is anomalous when it exceeds
 * {@code median × multiplier}. The median is used as the baseline because a
 * single outlier must not drag the reference that later samples are judged
 * against.
 * </p>
 *
 * <h3>Warm-up</h3>
 * <p>
 * No verdict is given until at least {@value #MIN_SAMPLES} samples have been
 * {@link #record(String, double) recorded}. {@link #check(String, double)}
 * never records the sample it judges.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Buffers live in a concurrent map and every access to one buffer is
 * synchronized on that buffer, so overlapping checks for the same service do
 * not race.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyDetector.class);

    /** Minimum recorded samples before a baseline is trusted. */
    public static final int MIN_SAMPLES = 5;

    private final boolean enabled;
    private final double multiplier;
    private final int sampleSize;

    private final Map<String, RingBuffer> buffers = new ConcurrentHashMap<>();

    /**
     * @param settings anomaly configuration; must not be {@code null}
     */
    public AnomalyDetector(AnomalySettings settings) {
        this(Objects.requireNonNull(settings, "AnomalySettings must not be null").isEnabled(),
                settings.getMultiplier(), settings.getSampleSize());
    }

    /**
     * @param enabled    whether detection runs at all
     * @param multiplier factor applied to the median to obtain the threshold
     * @param sampleSize capacity of each per-service buffer
     * @throws IllegalArgumentException if {@code multiplier} or
     *                                  {@code sampleSize} are not positive
     */
    public AnomalyDetector(boolean enabled, double multiplier, int sampleSize) {
        if (multiplier <= 0) {
            throw new IllegalArgumentException("multiplier must be > 0, got: " + multiplier);
        }
        if (sampleSize <= 0) {
            throw new IllegalArgumentException("sampleSize must be > 0, got: " + sampleSize);
        }
        this.enabled = enabled;
        this.multiplier = multiplier;
        this.sampleSize = sampleSize;
    }

    // ---------------------------------------------------------------
    // Recording and checking
    // ---------------------------------------------------------------

    /**
     * Add a latency sample to the service's history. No-op when detection is
     * disabled.
     *
     * @param serviceId    service key
     * @param sampleMillis observed latency
     */
    public void record(String serviceId, double sampleMillis) {
        if (!enabled) {
            return;
        }
        RingBuffer buffer = buffers.computeIfAbsent(serviceId, id -> new RingBuffer(sampleSize));
        synchronized (buffer) {
            buffer.push(sampleMillis);
        }
    }

    /**
     * Judge a latency sample against the service's recorded history.
     *
     * @param serviceId    service key
     * @param sampleMillis latency to judge
     * @return the verdict; never {@code null}
     */
    public AnomalyResult check(String serviceId, double sampleMillis) {
        if (!enabled) {
            return AnomalyResult.disabled(sampleMillis);
        }

        RingBuffer buffer = buffers.get(serviceId);
        if (buffer == null) {
            return AnomalyResult.insufficientSamples(sampleMillis, 0, MIN_SAMPLES);
        }

        int samples;
        double median;
        double mean;
        synchronized (buffer) {
            samples = buffer.count();
            median = buffer.median();
            mean = buffer.mean();
        }

        if (samples < MIN_SAMPLES) {
            return AnomalyResult.insufficientSamples(sampleMillis, samples, MIN_SAMPLES);
        }

        double threshold = median * multiplier;
        boolean anomaly = sampleMillis > threshold;
        AnomalyResult result = AnomalyResult.evaluated(
                anomaly, sampleMillis, median, mean, threshold, multiplier, samples);

        if (anomaly) {
            LOG.warn("Anomaly detected for {}: current={}ms median={}ms threshold={}ms ({}x)",
                    serviceId, sampleMillis, median, threshold,
                    String.format("%.1f", result.getDeviation()));
        }
        return result;
    }

    // ---------------------------------------------------------------
    // Introspection
    // ---------------------------------------------------------------

    /**
     * @param serviceId service key
     * @return latency summary, or empty if nothing was recorded
     */
    public Optional<LatencyStats> getStats(String serviceId) {
        RingBuffer buffer = buffers.get(serviceId);
        if (buffer == null) {
            return Optional.empty();
        }
        synchronized (buffer) {
            return buffer.count() == 0 ? Optional.empty() : Optional.of(new LatencyStats(buffer));
        }
    }

    public List<String> getTrackedServices() {
        return new ArrayList<>(buffers.keySet());
    }

    public void clearHistory(String serviceId) {
        buffers.remove(serviceId);
        LOG.debug("Cleared anomaly history for {}", serviceId);
    }

    /**
     * @return detector settings plus per-service statistics, suitable for JSON
     *         rendering
     */
    public Map<String, Object> getSummary() {
        Map<String, Object> services = new LinkedHashMap<>();
        for (String serviceId : getTrackedServices()) {
            getStats(serviceId).ifPresent(stats -> services.put(serviceId, stats));
        }

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("enabled", enabled);
        summary.put("multiplier", multiplier);
        summary.put("sampleSize", sampleSize);
        summary.put("trackedServices", services.size());
        summary.put("services", services);
        return summary;
    }

    public boolean isEnabled() {
        return enabled;
    }

    // ---------------------------------------------------------------
    // Snapshot (restart continuity)
    // ---------------------------------------------------------------

    /**
     * @return every tracked buffer keyed by service id
     */
    public Map<String, BufferSnapshot> exportSnapshot() {
        Map<String, BufferSnapshot> snapshot = new LinkedHashMap<>();
        buffers.forEach((serviceId, buffer) -> {
            synchronized (buffer) {
                snapshot.put(serviceId, buffer.toSnapshot());
            }
        });
        return snapshot;
    }

    /**
     * Restore buffers from a snapshot. Entries that cannot be rebuilt are
     * skipped with a warning.
     *
     * @param snapshot buffers keyed by service id; {@code null} is ignored
     * @return number of buffers restored
     */
    public int importSnapshot(Map<String, BufferSnapshot> snapshot) {
        if (snapshot == null) {
            return 0;
        }
        int restored = 0;
        for (Map.Entry<String, BufferSnapshot> entry : snapshot.entrySet()) {
            try {
                buffers.put(entry.getKey(), RingBuffer.fromSnapshot(entry.getValue()));
                restored++;
            } catch (RuntimeException e) {
                LOG.warn("Skipping anomaly history for {}: {}", entry.getKey(), e.getMessage());
            }
        }
        LOG.info("Anomaly detector state restored for {} service(s)", restored);
        return restored;
    }
}
