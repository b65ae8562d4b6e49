package com.watchdog.core.monitor;

import com.watchdog.core.MutableClock;
import com.watchdog.core.config.AlertSettings;
import com.watchdog.core.detection.AnomalyDetector;
import com.watchdog.core.model.Alert;
import com.watchdog.core.model.AlertAction;
import com.watchdog.core.model.AlertType;
import com.watchdog.core.model.CheckResult;
import com.watchdog.core.model.MonitoredTarget;
import com.watchdog.core.notify.MessageFormatter;
import com.watchdog.core.notify.NotificationDispatcher;
import com.watchdog.core.state.StateEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link CheckResultHandler}.
 */
class CheckResultHandlerTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    private final MonitoredTarget redis = MonitoredTarget.service("docker", "redis", false);
    private final MonitoredTarget api = MonitoredTarget.endpoint("https://api.example.com/health", 200);

    private MutableClock clock;
    private AlertSettings settings;
    private StateEngine state;
    private AnomalyDetector anomalyDetector;
    private NotificationDispatcher dispatcher;
    private CheckResultHandler handler;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        settings = new AlertSettings();
        state = new StateEngine(null, settings, clock);
        anomalyDetector = new AnomalyDetector(true, 3.0, 20);
        // never started: messages stay queued so the test can count them
        dispatcher = new NotificationDispatcher(message -> {
        }, Duration.ZERO);
        handler = new CheckResultHandler(state, anomalyDetector, dispatcher,
                new MessageFormatter(settings.flappingWindow()), settings, clock);
    }

    @Test
    @DisplayName("Fail at t0, t5, t31 and recover at t32 should alert down, still down and recovered")
    void cooldownScenario() {
        assertThat(types(handler.handle(redis, down()))).containsExactly(AlertType.SERVICE_DOWN);

        clock.advanceMinutes(5);
        assertThat(handler.handle(redis, down())).isEmpty();

        clock.advanceMinutes(26);
        assertThat(types(handler.handle(redis, down()))).containsExactly(AlertType.SERVICE_STILL_DOWN);

        clock.advanceMinutes(1);
        List<Alert> recovered = handler.handle(redis, CheckResult.healthy(12));

        assertThat(types(recovered)).containsExactly(AlertType.SERVICE_RECOVERED);
        assertThat(recovered.get(0).getRecovery().getDowntime()).isEqualTo(Duration.ofMinutes(32));
        assertThat(recovered.get(0).getRecovery().getFailuresSeen()).isEqualTo(3);
        assertThat(state.getFailure(redis.getId())).isEmpty();
        assertThat(state.getFlappingInfo(redis.getId()).getTransitionCount()).isZero();
        assertThat(dispatcher.queueSize()).isEqualTo(3);
    }

    @Test
    @DisplayName("Healthy, down, healthy, down within eight minutes should send a flapping alert instead of a down alert")
    void flappingScenario() {
        assertThat(handler.handle(redis, CheckResult.healthy(10))).isEmpty();
        clock.advanceMinutes(2);
        assertThat(types(handler.handle(redis, down()))).containsExactly(AlertType.SERVICE_DOWN);
        clock.advanceMinutes(2);
        assertThat(types(handler.handle(redis, CheckResult.healthy(10))))
                .containsExactly(AlertType.SERVICE_RECOVERED);
        clock.advanceMinutes(4);

        List<Alert> alerts = handler.handle(redis, down());

        assertThat(types(alerts)).containsExactly(AlertType.SERVICE_FLAPPING);
        assertThat(alerts.get(0).getFlapping().getTransitionCount()).isEqualTo(3);
        assertThat(state.getFailure(redis.getId())).isPresent();
    }

    @Test
    @DisplayName("Steady failures should not count as flapping")
    void steadyFailureShouldNotFlap() {
        for (int i = 0; i < 5; i++) {
            handler.handle(redis, down());
            clock.advanceMinutes(1);
        }

        assertThat(state.isFlapping(redis.getId())).isFalse();
        assertThat(state.getFlappingInfo(redis.getId()).getTransitionCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Acknowledged targets should be tracked but never notified")
    void acknowledgedTargetShouldNotNotify() {
        state.acknowledge(redis.getId());

        assertThat(handler.handle(redis, down())).isEmpty();
        clock.advanceMinutes(1);
        assertThat(handler.handle(redis, CheckResult.healthy(5))).isEmpty();
        clock.advanceMinutes(1);
        assertThat(handler.handle(redis, down())).isEmpty();

        assertThat(state.getFailure(redis.getId())).isPresent();
        assertThat(dispatcher.queueSize()).isZero();
    }

    @Test
    @DisplayName("An acknowledgement arriving mid-decision should not drop the alert already being decided")
    void acknowledgementDuringDecisionShouldApplyFromNextCheck() {
        StateEngine acknowledgingState = new StateEngine(null, settings, clock) {
            @Override
            public AlertAction recordFailure(String id, String error) {
                AlertAction action = super.recordFailure(id, error);
                acknowledge(id);
                return action;
            }
        };
        CheckResultHandler racingHandler = new CheckResultHandler(acknowledgingState, anomalyDetector,
                dispatcher, new MessageFormatter(settings.flappingWindow()), settings, clock);

        assertThat(types(racingHandler.handle(redis, down()))).containsExactly(AlertType.SERVICE_DOWN);
        assertThat(dispatcher.queueSize()).isEqualTo(1);

        clock.advanceMinutes(31);
        assertThat(racingHandler.handle(redis, down())).isEmpty();
        assertThat(dispatcher.queueSize()).isEqualTo(1);
    }

    @Test
    @DisplayName("Recovery should be silent when recovery notifications are off")
    void recoveryNotifyDisabled() {
        settings.setRecoveryNotify(false);
        handler.handle(redis, down());
        clock.advanceMinutes(1);

        assertThat(handler.handle(redis, CheckResult.healthy(5))).isEmpty();
        assertThat(state.getFailure(redis.getId())).isEmpty();
    }

    @Test
    @DisplayName("A healthy but slow endpoint should raise only a performance alert")
    void slowEndpointShouldRaiseAnomaly() {
        for (int i = 0; i < 10; i++) {
            assertThat(handler.handle(api, CheckResult.healthy(100))).isEmpty();
        }

        List<Alert> alerts = handler.handle(api, CheckResult.healthy(400));

        assertThat(types(alerts)).containsExactly(AlertType.PERFORMANCE_DEGRADATION);
        assertThat(alerts.get(0).getAnomaly().getMedian()).isEqualTo(100.0);
        assertThat(state.getFailure(api.getId())).isEmpty();
    }

    @Test
    @DisplayName("Latency of service checks should not feed the anomaly detector")
    void serviceLatencyShouldNotBeTracked() {
        handler.handle(redis, CheckResult.healthy(100));

        assertThat(anomalyDetector.getTrackedServices()).isEmpty();
    }

    @Test
    @DisplayName("Failing resource and certificate checks should use their own alert kinds")
    void resourceAndCertificateAlertKinds() {
        MonitoredTarget disk = MonitoredTarget.resource("disk");
        MonitoredTarget cert = MonitoredTarget.certificate("https://x.io");
        Instant validTo = T0.plus(Duration.ofDays(5));

        List<Alert> diskAlerts = handler.handle(disk,
                CheckResult.of(false, "Disk usage 91%", Map.of("usage", 91.0, "threshold", 85)));
        List<Alert> certAlerts = handler.handle(cert, CheckResult.of(false, "expires in 5 days",
                Map.of("daysRemaining", 5L, CheckResultHandler.META_VALID_TO, validTo)));

        assertThat(types(diskAlerts)).containsExactly(AlertType.RESOURCE_WARNING);
        assertThat(types(certAlerts)).containsExactly(AlertType.SSL_EXPIRING);
        assertThat(state.getSslExpiry(cert.getId())).contains(validTo);
    }

    @Test
    @DisplayName("A healthy certificate check should refresh the expiry cache")
    void healthyCertificateShouldRefreshCache() {
        MonitoredTarget cert = MonitoredTarget.certificate("https://x.io");
        Instant validTo = T0.plus(Duration.ofDays(90));

        handler.handle(cert, CheckResult.of(true, null, Map.of(CheckResultHandler.META_VALID_TO, validTo)));

        assertThat(state.getAllSslExpiry()).containsEntry(cert.getId(), validTo);
    }

    private static CheckResult down() {
        return CheckResult.unhealthy(15, "Container exited");
    }

    private static List<AlertType> types(List<Alert> alerts) {
        return alerts.stream().map(Alert::getType).toList();
    }
}
