package com.watchdog.core.detection;

import java.util.Arrays;

/**
 * Summary of the latency history recorded for one service.
 */
public final class LatencyStats {

    private final int samples;
    private final double median;
    private final double mean;
    private final double min;
    private final double max;
    private final double[] values;

    LatencyStats(RingBuffer buffer) {
        this.samples = buffer.count();
        this.median = buffer.median();
        this.mean = buffer.mean();
        this.min = buffer.min();
        this.max = buffer.max();
        this.values = buffer.values();
    }

    public int getSamples() {
        return samples;
    }

    public double getMedian() {
        return median;
    }

    public double getMean() {
        return mean;
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    public double[] getValues() {
        return values.clone();
    }

    @Override
    public String toString() {
        return "LatencyStats{" +
                "samples=" + samples +
                ", median=" + median +
                ", mean=" + mean +
                ", min=" + min +
                ", max=" + max +
                ", values=" + Arrays.toString(values) +
                '}';
    }
}
