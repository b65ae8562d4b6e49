package com.watchdog.agent.probe;

import com.watchdog.core.check.Checker;
import com.watchdog.core.config.ProbeSettings;
import com.watchdog.core.model.CheckResult;
import com.watchdog.core.model.MonitoredTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.UnknownHostException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.channels.UnresolvedAddressException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Probes an HTTP(S) endpoint with a GET request.
 *
 * <p>
 * The endpoint is healthy when it answers with its expected status or any
 * 2xx status. Network failures are reported as unhealthy results with a short
 * human-readable error; response times feed latency anomaly detection.
 * </p>
 *
 * @since 1.0.0
 */
public class HttpChecker implements Checker {

    private static final Logger LOG = LoggerFactory.getLogger(HttpChecker.class);

    private static final String USER_AGENT = "Watchdog/1.0";

    private final HttpClient client;
    private final Duration timeout;

    public HttpChecker(ProbeSettings probes) {
        this(HttpClient.newBuilder()
                        .connectTimeout(probes.httpTimeout())
                        .followRedirects(probes.isFollowRedirects()
                                ? HttpClient.Redirect.NORMAL
                                : HttpClient.Redirect.NEVER)
                        .build(),
                probes.httpTimeout());
    }

    HttpChecker(HttpClient client, Duration timeout) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
    }

    @Override
    public CheckResult check(MonitoredTarget target) throws InterruptedException {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(URI.create(target.getUrl()))
                    .timeout(timeout)
                    .header("User-Agent", USER_AGENT)
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            return CheckResult.unhealthy(0, "Invalid URL: " + target.getUrl());
        }

        long start = System.nanoTime();
        try {
            HttpResponse<Void> response = client.send(request, HttpResponse.BodyHandlers.discarding());
            long elapsed = Elapsed.millisSince(start);
            int status = response.statusCode();

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("status", status);
            if (status == target.getExpectedStatus() || (status >= 200 && status < 300)) {
                return CheckResult.healthy(elapsed, metadata);
            }
            metadata.put("expectedStatus", target.getExpectedStatus());
            return CheckResult.unhealthy(elapsed, "Unexpected status: " + status, metadata);
        } catch (IOException e) {
            long elapsed = Elapsed.millisSince(start);
            LOG.debug("Request to {} failed", target.getUrl(), e);
            return CheckResult.unhealthy(elapsed, describe(e));
        }
    }

    String describe(IOException e) {
        if (e instanceof HttpTimeoutException) {
            return "Request timeout after " + timeout.toMillis() + "ms";
        }
        if (hasCause(e, UnknownHostException.class) || hasCause(e, UnresolvedAddressException.class)) {
            return "Domain not found";
        }
        if (hasCause(e, ConnectException.class)) {
            return "Connection refused";
        }
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private static boolean hasCause(Throwable t, Class<? extends Throwable> type) {
        for (Throwable cause = t; cause != null; cause = cause.getCause()) {
            if (type.isInstance(cause)) {
                return true;
            }
        }
        return false;
    }
}
