package com.watchdog.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of a single probe run.
 *
 * <p>
 * A target that is down is a normal, unhealthy result, not an exception.
 * {@code metadata} carries probe-specific details such as an HTTP status code,
 * a resource usage percentage or a certificate expiry date.
 * </p>
 *
 * @since 1.0.0
 */
public final class CheckResult {

    private final boolean healthy;
    private final Long responseTimeMillis;
    private final String error;
    private final Map<String, Object> metadata;

    private CheckResult(boolean healthy, Long responseTimeMillis, String error,
            Map<String, Object> metadata) {
        this.healthy = healthy;
        this.responseTimeMillis = responseTimeMillis;
        this.error = error;
        this.metadata = metadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
                : Collections.emptyMap();
    }

    public static CheckResult healthy(long responseTimeMillis) {
        return new CheckResult(true, responseTimeMillis, null, null);
    }

    public static CheckResult healthy(long responseTimeMillis, Map<String, Object> metadata) {
        return new CheckResult(true, responseTimeMillis, null, metadata);
    }

    public static CheckResult unhealthy(long responseTimeMillis, String error) {
        return new CheckResult(false, responseTimeMillis, error, null);
    }

    public static CheckResult unhealthy(long responseTimeMillis, String error,
            Map<String, Object> metadata) {
        return new CheckResult(false, responseTimeMillis, error, metadata);
    }

    /**
     * Result without a timing, for probes where duration is meaningless.
     *
     * @param healthy  health verdict
     * @param error    error message, {@code null} when healthy
     * @param metadata extra details; may be {@code null}
     * @return a new result
     */
    public static CheckResult of(boolean healthy, String error, Map<String, Object> metadata) {
        return new CheckResult(healthy, null, error, metadata);
    }

    public boolean isHealthy() {
        return healthy;
    }

    public Optional<Long> getResponseTimeMillis() {
        return Optional.ofNullable(responseTimeMillis);
    }

    public String getError() {
        return error;
    }

    /**
     * @return unmodifiable metadata map, never {@code null}
     */
    public Map<String, Object> getMetadata() {
        return metadata;
    }

    /**
     * @param key metadata key
     * @return the value, or empty if absent
     */
    public Optional<Object> getMetadataValue(String key) {
        return Optional.ofNullable(metadata.get(key));
    }

    @Override
    public String toString() {
        return "CheckResult{" +
                "healthy=" + healthy +
                ", responseTimeMillis=" + responseTimeMillis +
                ", error='" + error + '\'' +
                ", metadata=" + metadata +
                '}';
    }
}
