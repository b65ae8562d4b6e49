package com.watchdog.core.notify;

import com.watchdog.core.config.ServiceDefinition;
import com.watchdog.core.config.WatchdogConfig;
import com.watchdog.core.model.Alert;
import com.watchdog.core.model.AlertType;
import com.watchdog.core.model.AnomalyResult;
import com.watchdog.core.model.CheckResult;
import com.watchdog.core.model.FlappingInfo;
import com.watchdog.core.model.MonitoredTarget;
import com.watchdog.core.model.RecoveryInfo;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link MessageFormatter}.
 */
class MessageFormatterTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    private final MessageFormatter formatter = new MessageFormatter(Duration.ofMinutes(10));
    private final MonitoredTarget redis = MonitoredTarget.service("docker", "redis", false);

    @Test
    @DisplayName("Should render a first failure with error and status")
    void shouldFormatServiceDown() {
        String message = formatter.format(alert(AlertType.SERVICE_DOWN, redis)
                .checkResult(CheckResult.unhealthy(10, "Container exited", Map.of("status", "exited")))
                .build());

        assertThat(message)
                .startsWith("🔴 SERVICE DOWN")
                .contains("Service: redis")
                .contains("Type: docker")
                .contains("Error: Container exited")
                .contains("Status: exited");
    }

    @Test
    @DisplayName("Should render an ongoing failure with its own title")
    void shouldFormatStillDown() {
        String message = formatter.format(alert(AlertType.SERVICE_STILL_DOWN, redis)
                .checkResult(CheckResult.unhealthy(10, "Container exited"))
                .build());

        assertThat(message).startsWith("⚠️ SERVICE STILL DOWN");
    }

    @Test
    @DisplayName("Should render recovery with downtime and failure count")
    void shouldFormatRecovery() {
        String message = formatter.format(alert(AlertType.SERVICE_RECOVERED, redis)
                .recovery(new RecoveryInfo(Duration.ofMinutes(32), 3, NOW))
                .build());

        assertThat(message)
                .startsWith("🟢 SERVICE RECOVERED")
                .contains("Downtime: 32m 0s")
                .contains("Failures: 3");
    }

    @Test
    @DisplayName("Should render flapping with the transition count and window")
    void shouldFormatFlapping() {
        String message = formatter.format(alert(AlertType.SERVICE_FLAPPING, redis)
                .flapping(new FlappingInfo(true, 4, List.of()))
                .build());

        assertThat(message)
                .startsWith("⚡ SERVICE FLAPPING")
                .contains("Changes: 4 in last 10 minutes");
    }

    @Test
    @DisplayName("Should render a performance alert with current, normal and slowdown")
    void shouldFormatAnomaly() {
        MonitoredTarget api = MonitoredTarget.endpoint("https://api.example.com", 200);
        String message = formatter.format(alert(AlertType.PERFORMANCE_DEGRADATION, api)
                .anomaly(AnomalyResult.evaluated(true, 400, 100, 130, 300, 3.0, 10))
                .build());

        assertThat(message)
                .startsWith("⚠️ PERFORMANCE DEGRADATION")
                .contains("Endpoint: https://api.example.com")
                .contains("Current: 400ms")
                .contains("Normal: 100ms")
                .contains("Slowdown: 4.0x slower");
    }

    @Test
    @DisplayName("Should mark resource usage at 95% or above as critical")
    void shouldFormatResourceWarning() {
        MonitoredTarget disk = MonitoredTarget.resource("disk");

        String warning = formatter.format(alert(AlertType.RESOURCE_WARNING, disk)
                .checkResult(CheckResult.of(false, "high", Map.of("usage", 88, "threshold", 85)))
                .build());
        String critical = formatter.format(alert(AlertType.RESOURCE_WARNING, disk)
                .checkResult(CheckResult.of(false, "high", Map.of("usage", 97, "threshold", 85)))
                .build());

        assertThat(warning).startsWith("⚠️ DISK WARNING").contains("DISK usage: 88%").contains("Threshold: 85%");
        assertThat(critical).startsWith("🔴 DISK WARNING");
    }

    @Test
    @DisplayName("Should render certificate expiry with days and date")
    void shouldFormatSslWarning() {
        MonitoredTarget cert = MonitoredTarget.certificate("https://x.io");
        String message = formatter.format(alert(AlertType.SSL_EXPIRING, cert)
                .checkResult(CheckResult.of(false, "expiring",
                        Map.of("daysRemaining", 5L, "validTo", Instant.parse("2024-03-06T00:00:00Z"))))
                .build());

        assertThat(message)
                .startsWith("🔴 SSL CERTIFICATE EXPIRING")
                .contains("Domain: https://x.io")
                .contains("Days remaining: 5")
                .contains("Expires: 2024-03-06");
    }

    @Test
    @DisplayName("Should count configured services in the startup message")
    void shouldFormatStartup() {
        WatchdogConfig config = new WatchdogConfig();
        config.getServices().setDocker(List.of(new ServiceDefinition("redis", false),
                new ServiceDefinition("postgres", true)));
        config.getServices().setSystemd(List.of(new ServiceDefinition("nginx", false)));

        String message = formatter.formatStartup(config, "http://localhost:3100");

        assertThat(message)
                .startsWith("🐕 WATCHDOG STARTED")
                .contains("Monitoring 3 services")
                .contains("• Docker: 2")
                .contains("• Systemd: 1")
                .contains("Dashboard: http://localhost:3100");
        assertThat(formatter.formatStartup(config, null)).doesNotContain("Dashboard");
        assertThat(formatter.formatShutdown()).startsWith("🐕 WATCHDOG STOPPED");
    }

    @Test
    @DisplayName("Should render durations with their two largest units")
    void shouldFormatDurations() {
        assertThat(MessageFormatter.formatDuration(Duration.ofSeconds(30))).isEqualTo("30s");
        assertThat(MessageFormatter.formatDuration(Duration.ofSeconds(150))).isEqualTo("2m 30s");
        assertThat(MessageFormatter.formatDuration(Duration.ofHours(2))).isEqualTo("2h 0m");
        assertThat(MessageFormatter.formatDuration(Duration.ofMillis(90_000_000))).isEqualTo("1d 1h");
        assertThat(MessageFormatter.formatDuration(Duration.ofSeconds(-5))).isEqualTo("0s");
    }

    private static Alert.Builder alert(AlertType type, MonitoredTarget target) {
        return Alert.builder().type(type).target(target).timestamp(NOW);
    }
}
