package com.watchdog.core.monitor;

import com.watchdog.core.config.AlertSettings;
import com.watchdog.core.detection.AnomalyDetector;
import com.watchdog.core.model.Alert;
import com.watchdog.core.model.AlertAction;
import com.watchdog.core.model.AlertType;
import com.watchdog.core.model.AnomalyResult;
import com.watchdog.core.model.CheckCategory;
import com.watchdog.core.model.CheckResult;
import com.watchdog.core.model.HealthState;
import com.watchdog.core.model.MonitoredTarget;
import com.watchdog.core.model.RecoveryInfo;
import com.watchdog.core.notify.MessageFormatter;
import com.watchdog.core.notify.NotificationDispatcher;
import com.watchdog.core.state.StateEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Turns one {@link CheckResult} into state engine calls and at most one
 * up/down alert, plus an independent performance alert.
 *
 * <h3>Decision Order</h3>
 * <ol>
 * <li>If the observed health differs from the last observation, record a
 * transition.</li>
 * <li>Unhealthy: record the failure. A flapping target gets a flapping alert
 * <em>instead of</em> a down alert; otherwise first and ongoing failures
 * alert and suppressed ones do not.</li>
 * <li>Healthy after a failure: record the recovery and send a recovery alert
 * when enabled. Flap history is cleared only when the outage lasted at least
 * the flap window. Clearing it on every recovery would erase the transitions
 * of a target that toggles faster than the window, and it would never be
 * reported as flapping.</li>
 * <li>Healthy with a response time on a latency-tracked category: feed the
 * anomaly detector and alert on a slowdown.</li>
 * </ol>
 *
 * <p>
 * Acknowledged targets go through the same bookkeeping, but nothing is
 * dispatched for them. Results for one target id are handled one at a time
 * even when two timers overlap.
 * </p>
 *
 * @since 1.0.0
 */
public class CheckResultHandler {

    private static final Logger LOG = LoggerFactory.getLogger(CheckResultHandler.class);

    /** Certificate metadata key carrying the expiry {@link Instant}. */
    public static final String META_VALID_TO = "validTo";

    private final StateEngine state;
    private final AnomalyDetector anomalyDetector;
    private final NotificationDispatcher dispatcher;
    private final MessageFormatter formatter;
    private final AlertSettings settings;
    private final Clock clock;

    private final ConcurrentMap<String, Object> targetLocks = new ConcurrentHashMap<>();

    public CheckResultHandler(StateEngine state, AnomalyDetector anomalyDetector,
            NotificationDispatcher dispatcher, MessageFormatter formatter,
            AlertSettings settings, Clock clock) {
        this.state = Objects.requireNonNull(state, "state must not be null");
        this.anomalyDetector = Objects.requireNonNull(anomalyDetector, "anomalyDetector must not be null");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.formatter = Objects.requireNonNull(formatter, "formatter must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Apply one check result.
     *
     * @param target the probed target
     * @param result what the probe observed
     * @return the alerts that were dispatched, in order; empty for an
     *         acknowledged target
     */
    public List<Alert> handle(MonitoredTarget target, CheckResult result) {
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(result, "result must not be null");

        Object lock = targetLocks.computeIfAbsent(target.getId(), k -> new Object());
        synchronized (lock) {
            // the mute decision uses the acknowledgement seen when handling began
            boolean muted = state.isAcknowledged(target.getId());
            List<Alert> alerts = decide(target, result);

            if (alerts.isEmpty()) {
                return Collections.emptyList();
            }
            if (muted) {
                LOG.info("{} is acknowledged, not sending {} alert(s)", target.getId(), alerts.size());
                return Collections.emptyList();
            }
            for (Alert alert : alerts) {
                dispatcher.enqueue(formatter.format(alert));
            }
            return alerts;
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private List<Alert> decide(MonitoredTarget target, CheckResult result) {
        String id = target.getId();
        List<Alert> alerts = new ArrayList<>();
        refreshCertificateExpiry(target, result);

        boolean wasHealthy = state.getFailure(id).isEmpty();
        boolean healthy = result.isHealthy();
        if (wasHealthy != healthy) {
            state.recordStateChange(id, healthy ? HealthState.HEALTHY : HealthState.UNHEALTHY);
        }

        if (!healthy) {
            AlertAction action = state.recordFailure(id, result.getError());
            if (state.isFlapping(id)) {
                LOG.warn("Flapping detected for {}", id);
                alerts.add(baseAlert(AlertType.SERVICE_FLAPPING, target)
                        .flapping(state.getFlappingInfo(id))
                        .checkResult(result)
                        .build());
            } else if (action.shouldAlert()) {
                LOG.error("Failure for {} ({}): {}", id, action, result.getError());
                alerts.add(baseAlert(failureType(target, action), target)
                        .checkResult(result)
                        .details(result.getError())
                        .build());
            } else {
                LOG.debug("Failure for {} suppressed by cooldown", id);
            }
        } else if (!wasHealthy) {
            Optional<RecoveryInfo> recovery = state.recordRecovery(id);
            recovery.ifPresent(info -> {
                LOG.info("{} recovered after {}", id, MessageFormatter.formatDuration(info.getDowntime()));
                if (info.getDowntime().compareTo(state.getFlappingWindow()) >= 0) {
                    state.clearFlappingHistory(id);
                }
                if (settings.isRecoveryNotify()) {
                    alerts.add(baseAlert(AlertType.SERVICE_RECOVERED, target)
                            .recovery(info)
                            .checkResult(result)
                            .build());
                }
            });
        }

        if (healthy && target.getCategory().tracksLatency()) {
            result.getResponseTimeMillis().ifPresent(millis -> {
                anomalyDetector.record(id, millis);
                AnomalyResult anomaly = anomalyDetector.check(id, millis);
                if (anomaly.isAnomaly()) {
                    alerts.add(baseAlert(AlertType.PERFORMANCE_DEGRADATION, target)
                            .anomaly(anomaly)
                            .checkResult(result)
                            .build());
                }
            });
        }
        return alerts;
    }

    private void refreshCertificateExpiry(MonitoredTarget target, CheckResult result) {
        if (target.getCategory() != CheckCategory.SSL) {
            return;
        }
        result.getMetadataValue(META_VALID_TO)
                .filter(Instant.class::isInstance)
                .map(Instant.class::cast)
                .ifPresent(validTo -> state.updateSslExpiry(target.getId(), validTo));
    }

    private static AlertType failureType(MonitoredTarget target, AlertAction action) {
        return switch (target.getCategory()) {
            case SSL -> AlertType.SSL_EXPIRING;
            case RESOURCES -> AlertType.RESOURCE_WARNING;
            default -> action == AlertAction.FIRST_FAILURE
                    ? AlertType.SERVICE_DOWN
                    : AlertType.SERVICE_STILL_DOWN;
        };
    }

    private Alert.Builder baseAlert(AlertType type, MonitoredTarget target) {
        return Alert.builder().type(type).target(target).timestamp(clock.instant());
    }
}
