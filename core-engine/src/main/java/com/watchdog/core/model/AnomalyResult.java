package com.watchdog.core.model;

import java.util.Optional;

/**
 * Verdict of an anomaly check for one latency sample.
 *
 * <p>
 * When no verdict could be reached (detection disabled, not enough history)
 * {@link #isAnomaly()} is {@code false} and {@link #getReason()} says why.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnomalyResult {

    public static final String REASON_DISABLED = "detection disabled";
    public static final String REASON_INSUFFICIENT_SAMPLES = "insufficient samples";

    private final boolean anomaly;
    private final String reason;
    private final double sample;
    private final double median;
    private final double mean;
    private final double threshold;
    private final double multiplier;
    private final double deviation;
    private final int samples;
    private final int samplesNeeded;

    private AnomalyResult(boolean anomaly, String reason, double sample, double median, double mean,
            double threshold, double multiplier, double deviation, int samples, int samplesNeeded) {
        this.anomaly = anomaly;
        this.reason = reason;
        this.sample = sample;
        this.median = median;
        this.mean = mean;
        this.threshold = threshold;
        this.multiplier = multiplier;
        this.deviation = deviation;
        this.samples = samples;
        this.samplesNeeded = samplesNeeded;
    }

    public static AnomalyResult disabled(double sample) {
        return new AnomalyResult(false, REASON_DISABLED, sample, 0, 0, 0, 0, 0, 0, 0);
    }

    public static AnomalyResult insufficientSamples(double sample, int samples, int samplesNeeded) {
        return new AnomalyResult(false, REASON_INSUFFICIENT_SAMPLES, sample, 0, 0, 0, 0, 0,
                samples, samplesNeeded);
    }

    public static AnomalyResult evaluated(boolean anomaly, double sample, double median, double mean,
            double threshold, double multiplier, int samples) {
        double deviation = median > 0 ? sample / median : 0;
        return new AnomalyResult(anomaly, null, sample, median, mean, threshold, multiplier,
                deviation, samples, 0);
    }

    public boolean isAnomaly() {
        return anomaly;
    }

    public Optional<String> getReason() {
        return Optional.ofNullable(reason);
    }

    /**
     * @return the latency sample that was judged, in milliseconds
     */
    public double getSample() {
        return sample;
    }

    /**
     * @return baseline median of the recorded history
     */
    public double getMedian() {
        return median;
    }

    public double getMean() {
        return mean;
    }

    public double getThreshold() {
        return threshold;
    }

    public double getMultiplier() {
        return multiplier;
    }

    /**
     * @return {@code sample / median}; 0 when no baseline exists
     */
    public double getDeviation() {
        return deviation;
    }

    public int getSamples() {
        return samples;
    }

    public int getSamplesNeeded() {
        return samplesNeeded;
    }

    @Override
    public String toString() {
        return "AnomalyResult{" +
                "anomaly=" + anomaly +
                ", reason='" + reason + '\'' +
                ", sample=" + sample +
                ", median=" + median +
                ", threshold=" + threshold +
                ", deviation=" + deviation +
                ", samples=" + samples +
                '}';
    }
}
