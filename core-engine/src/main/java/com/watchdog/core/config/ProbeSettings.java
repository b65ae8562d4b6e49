package com.watchdog.core.config;

import java.time.Duration;
import java.util.List;

/**
 * Timeouts and options shared by the probes.
 */
public class ProbeSettings {

    private long httpTimeoutMillis = 5_000;
    private boolean followRedirects = true;
    private long tlsTimeoutMillis = 10_000;
    private long commandTimeoutMillis = 10_000;

    public Duration httpTimeout() {
        return Duration.ofMillis(httpTimeoutMillis);
    }

    public Duration tlsTimeout() {
        return Duration.ofMillis(tlsTimeoutMillis);
    }

    public Duration commandTimeout() {
        return Duration.ofMillis(commandTimeoutMillis);
    }

    void collectErrors(List<String> errors) {
        if (httpTimeoutMillis <= 0) {
            errors.add("probes.httpTimeoutMillis must be > 0, got: " + httpTimeoutMillis);
        }
        if (tlsTimeoutMillis <= 0) {
            errors.add("probes.tlsTimeoutMillis must be > 0, got: " + tlsTimeoutMillis);
        }
        if (commandTimeoutMillis <= 0) {
            errors.add("probes.commandTimeoutMillis must be > 0, got: " + commandTimeoutMillis);
        }
    }

    public long getHttpTimeoutMillis() {
        return httpTimeoutMillis;
    }

    public void setHttpTimeoutMillis(long httpTimeoutMillis) {
        this.httpTimeoutMillis = httpTimeoutMillis;
    }

    public boolean isFollowRedirects() {
        return followRedirects;
    }

    public void setFollowRedirects(boolean followRedirects) {
        this.followRedirects = followRedirects;
    }

    public long getTlsTimeoutMillis() {
        return tlsTimeoutMillis;
    }

    public void setTlsTimeoutMillis(long tlsTimeoutMillis) {
        this.tlsTimeoutMillis = tlsTimeoutMillis;
    }

    public long getCommandTimeoutMillis() {
        return commandTimeoutMillis;
    }

    public void setCommandTimeoutMillis(long commandTimeoutMillis) {
        this.commandTimeoutMillis = commandTimeoutMillis;
    }
}
