package com.watchdog.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Alert decided by the monitor for a single check result.
 *
 * <p>
 * Carries the data the message formatter needs for its {@link AlertType}:
 * the check result for down, resource and certificate alerts, the recovery
 * summary, the flap window or the anomaly verdict.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code type}, {@code target} and {@code timestamp}
 * are required; omitting any of them throws a {@link NullPointerException} at
 * build time.
 * </p>
 *
 * @since 1.0.0
 */
public class Alert {

    private final AlertType type;
    private final MonitoredTarget target;
    private final Instant timestamp;
    private final String details;
    private final CheckResult checkResult;
    private final RecoveryInfo recovery;
    private final FlappingInfo flapping;
    private final AnomalyResult anomaly;

    private Alert(Builder builder) {
        this.type = Objects.requireNonNull(builder.type, "type must not be null");
        this.target = Objects.requireNonNull(builder.target, "target must not be null");
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        this.details = builder.details;
        this.checkResult = builder.checkResult;
        this.recovery = builder.recovery;
        this.flapping = builder.flapping;
        this.anomaly = builder.anomaly;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Alert} instances.
     */
    public static class Builder {
        private AlertType type;
        private MonitoredTarget target;
        private Instant timestamp;
        private String details;
        private CheckResult checkResult;
        private RecoveryInfo recovery;
        private FlappingInfo flapping;
        private AnomalyResult anomaly;

        public Builder type(AlertType type) {
            this.type = type;
            return this;
        }

        public Builder target(MonitoredTarget target) {
            this.target = target;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder details(String details) {
            this.details = details;
            return this;
        }

        public Builder checkResult(CheckResult checkResult) {
            this.checkResult = checkResult;
            return this;
        }

        public Builder recovery(RecoveryInfo recovery) {
            this.recovery = recovery;
            return this;
        }

        public Builder flapping(FlappingInfo flapping) {
            this.flapping = flapping;
            return this;
        }

        public Builder anomaly(AnomalyResult anomaly) {
            this.anomaly = anomaly;
            return this;
        }

        public Alert build() {
            return new Alert(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public AlertType getType() {
        return type;
    }

    public MonitoredTarget getTarget() {
        return target;
    }

    /**
     * @return shorthand for {@code getTarget().getId()}
     */
    public String getServiceId() {
        return target.getId();
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getDetails() {
        return details;
    }

    public CheckResult getCheckResult() {
        return checkResult;
    }

    public RecoveryInfo getRecovery() {
        return recovery;
    }

    public FlappingInfo getFlapping() {
        return flapping;
    }

    public AnomalyResult getAnomaly() {
        return anomaly;
    }

    @Override
    public String toString() {
        return "Alert{" +
                "type=" + type +
                ", serviceId='" + getServiceId() + '\'' +
                ", timestamp=" + timestamp +
                ", details='" + details + '\'' +
                '}';
    }
}
