package com.watchdog.agent.probe;

import com.watchdog.core.check.Checker;
import com.watchdog.core.config.ProbeSettings;
import com.watchdog.core.config.ThresholdSettings;
import com.watchdog.core.model.CheckResult;
import com.watchdog.core.model.MonitoredTarget;
import com.watchdog.core.monitor.CheckResultHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SNIHostName;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLParameters;
import javax.net.ssl.SSLSocket;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.security.GeneralSecurityException;
import java.security.cert.Certificate;
import java.security.cert.X509Certificate;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Reads the expiry date of a server's TLS certificate.
 *
 * <h3>Trust</h3>
 * <p>
 * The handshake accepts any certificate chain: the goal is to read the
 * expiry date, including from certificates that would fail validation.
 * No application data is exchanged.
 * </p>
 *
 * <h3>Verdict</h3>
 * <p>
 * Unhealthy when the certificate has expired or expires within
 * {@link ThresholdSettings#getSslDays()} days. The expiry instant is always
 * returned under {@link CheckResultHandler#META_VALID_TO} so the state
 * engine's certificate cache stays current.
 * </p>
 *
 * @since 1.0.0
 */
public class TlsChecker implements Checker {

    private static final Logger LOG = LoggerFactory.getLogger(TlsChecker.class);

    private static final int DEFAULT_PORT = 443;
    private static final Pattern IP_LITERAL = Pattern.compile("[0-9.]+|\\[?[0-9a-fA-F:]+]?");
    private static final long SECONDS_PER_DAY = Duration.ofDays(1).getSeconds();

    private final ThresholdSettings thresholds;
    private final Duration timeout;
    private final Clock clock;

    public TlsChecker(ThresholdSettings thresholds, ProbeSettings probes) {
        this(thresholds, probes.tlsTimeout(), Clock.systemUTC());
    }

    TlsChecker(ThresholdSettings thresholds, Duration timeout, Clock clock) {
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public CheckResult check(MonitoredTarget target) {
        URI uri;
        try {
            uri = URI.create(target.getUrl());
        } catch (IllegalArgumentException e) {
            return CheckResult.of(false, "Invalid URL: " + target.getUrl(), null);
        }
        if (uri.getHost() == null) {
            return CheckResult.of(false, "Invalid URL: " + target.getUrl(), null);
        }
        int port = uri.getPort() > 0 ? uri.getPort() : DEFAULT_PORT;

        X509Certificate certificate;
        try {
            certificate = fetchCertificate(uri.getHost(), port);
        } catch (IOException | GeneralSecurityException e) {
            LOG.debug("TLS handshake with {}:{} failed", uri.getHost(), port, e);
            return CheckResult.of(false, "Could not retrieve certificate: " + e.getMessage(), null);
        }
        return evaluate(certificate.getNotAfter().toInstant(), clock.instant(), thresholds.getSslDays());
    }

    /**
     * Turn a certificate expiry into a check result.
     *
     * @param validTo       certificate {@code notAfter}
     * @param now           current instant
     * @param thresholdDays warning window in days
     * @return the verdict, carrying {@code validTo}, {@code daysRemaining}
     *         and {@code threshold} metadata
     */
    static CheckResult evaluate(Instant validTo, Instant now, int thresholdDays) {
        long daysRemaining = Math.floorDiv(Duration.between(now, validTo).getSeconds(), SECONDS_PER_DAY);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(CheckResultHandler.META_VALID_TO, validTo);
        metadata.put("daysRemaining", daysRemaining);
        metadata.put("threshold", thresholdDays);

        if (!validTo.isAfter(now)) {
            metadata.put("expired", true);
            return CheckResult.of(false, "Certificate expired " + Math.abs(daysRemaining) + " days ago", metadata);
        }
        if (daysRemaining <= thresholdDays) {
            return CheckResult.of(false, "Certificate expires in " + daysRemaining
                    + " days (threshold: " + thresholdDays + " days)", metadata);
        }
        return CheckResult.of(true, null, metadata);
    }

    private X509Certificate fetchCertificate(String host, int port) throws IOException, GeneralSecurityException {
        SSLContext context = SSLContext.getInstance("TLS");
        context.init(null, new TrustManager[]{new AcceptAllTrustManager()}, null);

        try (SSLSocket socket = (SSLSocket) context.getSocketFactory().createSocket()) {
            int millis = (int) timeout.toMillis();
            socket.connect(new InetSocketAddress(host, port), millis);
            socket.setSoTimeout(millis);

            if (!IP_LITERAL.matcher(host).matches()) {
                SSLParameters parameters = socket.getSSLParameters();
                parameters.setServerNames(List.of(new SNIHostName(host)));
                socket.setSSLParameters(parameters);
            }
            socket.startHandshake();

            Certificate[] chain = socket.getSession().getPeerCertificates();
            if (chain.length == 0 || !(chain[0] instanceof X509Certificate)) {
                throw new IOException("No X.509 certificate presented by " + host);
            }
            return (X509Certificate) chain[0];
        }
    }

    private static final class AcceptAllTrustManager implements X509TrustManager {

        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType) {
            // not used for client sockets
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType) {
            // expiry is evaluated separately
        }

        @Override
        public X509Certificate[] getAcceptedIssuers() {
            return new X509Certificate[0];
        }
    }
}
