package com.watchdog.core.notify;

import com.watchdog.core.config.ServicesConfig;
import com.watchdog.core.config.WatchdogConfig;
import com.watchdog.core.model.Alert;
import com.watchdog.core.model.AnomalyResult;
import com.watchdog.core.model.CheckResult;
import com.watchdog.core.model.FlappingInfo;
import com.watchdog.core.model.MonitoredTarget;
import com.watchdog.core.model.RecoveryInfo;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Renders {@link Alert}s and lifecycle events as plain-text chat messages.
 *
 * <p>
 * Messages start with an emoji and an upper-case title line, followed by a
 * blank line and {@code Key: value} detail lines.
 * </p>
 *
 * @since 1.0.0
 */
public class MessageFormatter {

    /** Resource usage at or above this is shown as critical. */
    static final double CRITICAL_USAGE_PERCENT = 95.0;

    /** Certificates closer than this to expiry are shown as critical. */
    static final long CRITICAL_SSL_DAYS = 7;

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd", Locale.ROOT)
            .withZone(ZoneOffset.UTC);

    private final Duration flappingWindow;

    /**
     * @param flappingWindow window quoted in flapping messages
     */
    public MessageFormatter(Duration flappingWindow) {
        this.flappingWindow = Objects.requireNonNull(flappingWindow, "flappingWindow must not be null");
    }

    /**
     * @param alert alert to render
     * @return the message text
     */
    public String format(Alert alert) {
        return switch (alert.getType()) {
            case SERVICE_DOWN -> formatDown(alert.getTarget(), alert.getCheckResult(), true);
            case SERVICE_STILL_DOWN -> formatDown(alert.getTarget(), alert.getCheckResult(), false);
            case SERVICE_RECOVERED -> formatRecovered(alert.getTarget(), alert.getRecovery());
            case SERVICE_FLAPPING -> formatFlapping(alert.getTarget(), alert.getFlapping());
            case PERFORMANCE_DEGRADATION -> formatAnomaly(alert.getTarget(), alert.getAnomaly());
            case RESOURCE_WARNING -> formatResource(alert.getTarget(), alert.getCheckResult());
            case SSL_EXPIRING -> formatSsl(alert.getTarget(), alert.getCheckResult());
        };
    }

    // ---------------------------------------------------------------
    // Alert kinds
    // ---------------------------------------------------------------

    private String formatDown(MonitoredTarget target, CheckResult result, boolean first) {
        StringBuilder sb = new StringBuilder();
        sb.append(first ? "🔴 SERVICE DOWN" : "⚠️ SERVICE STILL DOWN").append("\n\n");
        sb.append("Service: ").append(target.getName()).append('\n');
        sb.append("Type: ").append(target.getType()).append('\n');
        if (result != null) {
            sb.append("Error: ").append(Optional.ofNullable(result.getError()).orElse("unknown")).append('\n');
            result.getMetadataValue("status").ifPresent(s -> sb.append("Status: ").append(s).append('\n'));
            result.getMetadataValue("restarts").ifPresent(r -> sb.append("Restarts: ").append(r).append('\n'));
        }
        return sb.toString();
    }

    private String formatRecovered(MonitoredTarget target, RecoveryInfo recovery) {
        StringBuilder sb = new StringBuilder("🟢 SERVICE RECOVERED\n\n");
        sb.append("Service: ").append(target.getName()).append('\n');
        sb.append("Type: ").append(target.getType()).append('\n');
        if (recovery != null) {
            sb.append("Downtime: ").append(formatDuration(recovery.getDowntime())).append('\n');
            sb.append("Failures: ").append(recovery.getFailuresSeen()).append('\n');
        }
        return sb.toString();
    }

    private String formatFlapping(MonitoredTarget target, FlappingInfo flapping) {
        int changes = flapping != null ? flapping.getTransitionCount() : 0;
        return "⚡ SERVICE FLAPPING\n\n"
                + "Service: " + target.getName() + '\n'
                + "Type: " + target.getType() + '\n'
                + "Changes: " + changes + " in last " + flappingWindow.toMinutes() + " minutes\n\n"
                + "Service is unstable.";
    }

    private String formatAnomaly(MonitoredTarget target, AnomalyResult anomaly) {
        StringBuilder sb = new StringBuilder("⚠️ PERFORMANCE DEGRADATION\n\n");
        sb.append("Endpoint: ").append(target.getUrl() != null ? target.getUrl() : target.getName()).append('\n');
        if (anomaly != null) {
            sb.append("Current: ").append(Math.round(anomaly.getSample())).append("ms\n");
            sb.append("Normal: ").append(Math.round(anomaly.getMedian())).append("ms\n");
            sb.append("Slowdown: ").append(String.format(Locale.ROOT, "%.1f", anomaly.getDeviation()))
                    .append("x slower\n");
        }
        return sb.toString();
    }

    private String formatResource(MonitoredTarget target, CheckResult result) {
        String name = target.getName().toUpperCase(Locale.ROOT);
        Object usage = metadata(result, "usage");
        boolean critical = usage instanceof Number n && n.doubleValue() >= CRITICAL_USAGE_PERCENT;

        return (critical ? "🔴 " : "⚠️ ") + name + " WARNING\n\n"
                + name + " usage: " + usage + "%\n"
                + "Threshold: " + metadata(result, "threshold") + "%\n";
    }

    private String formatSsl(MonitoredTarget target, CheckResult result) {
        Object days = metadata(result, "daysRemaining");
        boolean critical = days instanceof Number n && n.longValue() < CRITICAL_SSL_DAYS;
        Object validTo = metadata(result, "validTo");
        String expires = validTo instanceof Instant instant ? DATE.format(instant) : String.valueOf(validTo);

        StringBuilder sb = new StringBuilder();
        sb.append(critical ? "🔴 " : "⚠️ ").append("SSL CERTIFICATE EXPIRING\n\n");
        sb.append("Domain: ").append(target.getUrl() != null ? target.getUrl() : target.getName()).append('\n');
        if (days != null) {
            sb.append("Days remaining: ").append(days).append('\n');
            sb.append("Expires: ").append(expires).append("\n\n");
            sb.append("Action required: Renew certificate");
        } else {
            sb.append("Error: ").append(result != null ? result.getError() : "unknown").append('\n');
        }
        return sb.toString();
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    /**
     * @param config       active configuration
     * @param dashboardUrl status server URL, or {@code null} when disabled
     * @return the startup announcement
     */
    public String formatStartup(WatchdogConfig config, String dashboardUrl) {
        ServicesConfig services = config.getServices();
        int docker = services.getDocker().size();
        int pm2 = services.getPm2().size();
        int systemd = services.getSystemd().size();
        int endpoints = services.getEndpoints().size();

        StringBuilder sb = new StringBuilder("🐕 WATCHDOG STARTED\n\n");
        sb.append("Monitoring ").append(docker + pm2 + systemd + endpoints).append(" services:\n");
        sb.append("• Docker: ").append(docker).append('\n');
        sb.append("• PM2: ").append(pm2).append('\n');
        sb.append("• Systemd: ").append(systemd).append('\n');
        sb.append("• Endpoints: ").append(endpoints).append('\n');
        if (dashboardUrl != null) {
            sb.append("\nDashboard: ").append(dashboardUrl);
        }
        return sb.toString();
    }

    public String formatShutdown() {
        return "🐕 WATCHDOG STOPPED\n\nMonitoring has been stopped.";
    }

    /**
     * Render a duration with its two most significant units, e.g.
     * {@code 1d 2h}, {@code 3h 4m}, {@code 5m 6s} or {@code 7s}.
     *
     * @param duration duration to render; negative values render as {@code 0s}
     * @return the compact form
     */
    public static String formatDuration(Duration duration) {
        long seconds = Math.max(0, duration.getSeconds());
        long minutes = seconds / 60;
        long hours = minutes / 60;
        long days = hours / 24;

        if (days > 0) {
            return days + "d " + (hours % 24) + "h";
        }
        if (hours > 0) {
            return hours + "h " + (minutes % 60) + "m";
        }
        if (minutes > 0) {
            return minutes + "m " + (seconds % 60) + "s";
        }
        return seconds + "s";
    }

    private static Object metadata(CheckResult result, String key) {
        return result == null ? null : result.getMetadataValue(key).orElse(null);
    }
}
