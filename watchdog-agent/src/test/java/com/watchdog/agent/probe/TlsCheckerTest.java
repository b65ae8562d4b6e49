package com.watchdog.agent.probe;

import com.watchdog.core.config.ThresholdSettings;
import com.watchdog.core.model.CheckResult;
import com.watchdog.core.model.MonitoredTarget;
import com.watchdog.core.monitor.CheckResultHandler;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link TlsChecker} expiry evaluation.
 */
class TlsCheckerTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    @Test
    @DisplayName("Certificate well inside its validity should be healthy")
    void validCertificate() {
        Instant validTo = NOW.plus(Duration.ofDays(90));

        CheckResult result = TlsChecker.evaluate(validTo, NOW, 14);

        assertThat(result.isHealthy()).isTrue();
        assertThat(result.getMetadata())
                .containsEntry(CheckResultHandler.META_VALID_TO, validTo)
                .containsEntry("daysRemaining", 90L);
    }

    @Test
    @DisplayName("Certificate inside the warning window should be unhealthy")
    void expiringSoon() {
        CheckResult result = TlsChecker.evaluate(NOW.plus(Duration.ofDays(10).plusHours(5)), NOW, 14);

        assertThat(result.isHealthy()).isFalse();
        assertThat(result.getError()).isEqualTo("Certificate expires in 10 days (threshold: 14 days)");
        assertThat(result.getMetadata()).containsEntry("daysRemaining", 10L);
    }

    @Test
    @DisplayName("Certificate exactly at the threshold should be unhealthy")
    void atThreshold() {
        assertThat(TlsChecker.evaluate(NOW.plus(Duration.ofDays(14)), NOW, 14).isHealthy()).isFalse();
    }

    @Test
    @DisplayName("Expired certificate should be flagged expired")
    void expired() {
        CheckResult result = TlsChecker.evaluate(NOW.minus(Duration.ofDays(3)), NOW, 14);

        assertThat(result.isHealthy()).isFalse();
        assertThat(result.getError()).isEqualTo("Certificate expired 3 days ago");
        assertThat(result.getMetadata()).containsEntry("expired", true);
    }

    @Test
    @DisplayName("URL without a host should be unhealthy without a handshake")
    void invalidUrl() {
        TlsChecker checker = new TlsChecker(new ThresholdSettings(), Duration.ofSeconds(1), Clock.systemUTC());

        CheckResult result = checker.check(MonitoredTarget.certificate("not a url"));

        assertThat(result.isHealthy()).isFalse();
        assertThat(result.getError()).startsWith("Invalid URL");
    }
}
