/**
 * Latency baselining and anomaly detection.
 *
 * <p>
 * {@link com.watchdog.core.detection.RingBuffer} holds the rolling window;
 * {@link com.watchdog.core.detection.AnomalyDetector} keeps one window per
 * service and flags samples above {@code median × multiplier}.
 * </p>
 *
 * @since 1.0.0
 */
package com.watchdog.core.detection;
