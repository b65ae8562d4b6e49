package com.watchdog.core.config;

import com.watchdog.core.detection.AnomalyDetector;

import java.util.List;

/**
 * Latency anomaly detection settings.
 */
public class AnomalySettings {

    private boolean enabled = true;

    /** Alert when a sample exceeds {@code multiplier × median}. */
    private double multiplier = 3.0;

    /** Samples kept per service for the median. */
    private int sampleSize = 20;

    void collectErrors(List<String> errors) {
        if (multiplier <= 1) {
            errors.add("anomaly.multiplier must be > 1, got: " + multiplier);
        }
        if (sampleSize < AnomalyDetector.MIN_SAMPLES) {
            errors.add("anomaly.sampleSize must be >= " + AnomalyDetector.MIN_SAMPLES
                    + ", got: " + sampleSize);
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public double getMultiplier() {
        return multiplier;
    }

    public void setMultiplier(double multiplier) {
        this.multiplier = multiplier;
    }

    public int getSampleSize() {
        return sampleSize;
    }

    public void setSampleSize(int sampleSize) {
        this.sampleSize = sampleSize;
    }
}
