package com.watchdog.core.config;

import com.watchdog.core.model.MonitoredTarget;

import java.util.ArrayList;
import java.util.List;

/**
 * Top-level POJO for the {@code watchdog.yml} configuration.
 *
 * <p>
 * Every section is optional; an empty file yields a fully usable
 * configuration with the built-in defaults.
 * </p>
 *
 * <pre>
 * intervals:
 *   servicesSeconds: 60
 * alerts:
 *   cooldownMinutes: 30
 *   flappingThreshold: 3
 * anomaly:
 *   multiplier: 3.0
 * services:
 *   docker:
 *     - name: redis
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading to check every section.
 * </p>
 *
 * @since 1.0.0
 */
public class WatchdogConfig {

    private IntervalSettings intervals = new IntervalSettings();
    private ThresholdSettings thresholds = new ThresholdSettings();
    private AlertSettings alerts = new AlertSettings();
    private AnomalySettings anomaly = new AnomalySettings();
    private ProbeSettings probes = new ProbeSettings();
    private ServicesConfig services = new ServicesConfig();

    /**
     * Validate every section, collecting all problems into one exception.
     *
     * @throws IllegalStateException if one or more values are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        intervals.collectErrors(errors);
        thresholds.collectErrors(errors);
        alerts.collectErrors(errors);
        anomaly.collectErrors(errors);
        probes.collectErrors(errors);
        services.collectErrors(errors);

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Watchdog configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    /**
     * Expand the configured services into monitored targets. HTTPS endpoints
     * produce both an endpoint target and a certificate target.
     *
     * @return targets in configuration order
     */
    public List<MonitoredTarget> targets() {
        List<MonitoredTarget> targets = new ArrayList<>();
        services.getDocker().forEach(d -> targets.add(
                MonitoredTarget.service("docker", d.getName(), d.isHasHealthCheck())));
        services.getPm2().forEach(p -> targets.add(
                MonitoredTarget.service("pm2", p.getName(), p.isHasHealthCheck())));
        services.getSystemd().forEach(s -> targets.add(
                MonitoredTarget.service("systemd", s.getName(), s.isHasHealthCheck())));
        for (EndpointDefinition endpoint : services.getEndpoints()) {
            targets.add(MonitoredTarget.endpoint(endpoint.getUrl(), endpoint.getExpectedStatus()));
            if (endpoint.isHttps()) {
                targets.add(MonitoredTarget.certificate(endpoint.getUrl()));
            }
        }
        services.getResources().forEach(r -> targets.add(MonitoredTarget.resource(r)));
        return targets;
    }

    public IntervalSettings getIntervals() {
        return intervals;
    }

    public void setIntervals(IntervalSettings intervals) {
        this.intervals = intervals != null ? intervals : new IntervalSettings();
    }

    public ThresholdSettings getThresholds() {
        return thresholds;
    }

    public void setThresholds(ThresholdSettings thresholds) {
        this.thresholds = thresholds != null ? thresholds : new ThresholdSettings();
    }

    public AlertSettings getAlerts() {
        return alerts;
    }

    public void setAlerts(AlertSettings alerts) {
        this.alerts = alerts != null ? alerts : new AlertSettings();
    }

    public AnomalySettings getAnomaly() {
        return anomaly;
    }

    public void setAnomaly(AnomalySettings anomaly) {
        this.anomaly = anomaly != null ? anomaly : new AnomalySettings();
    }

    public ProbeSettings getProbes() {
        return probes;
    }

    public void setProbes(ProbeSettings probes) {
        this.probes = probes != null ? probes : new ProbeSettings();
    }

    public ServicesConfig getServices() {
        return services;
    }

    public void setServices(ServicesConfig services) {
        this.services = services != null ? services : new ServicesConfig();
    }

    @Override
    public String toString() {
        return "WatchdogConfig{" +
                "docker=" + services.getDocker().size() +
                ", pm2=" + services.getPm2().size() +
                ", systemd=" + services.getSystemd().size() +
                ", endpoints=" + services.getEndpoints().size() +
                ", resources=" + services.getResources() +
                '}';
    }
}
