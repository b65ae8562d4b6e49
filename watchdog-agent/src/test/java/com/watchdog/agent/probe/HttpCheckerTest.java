package com.watchdog.agent.probe;

import com.watchdog.core.model.CheckResult;
import com.watchdog.core.model.MonitoredTarget;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link HttpChecker} against a local mock server.
 */
class HttpCheckerTest {

    private MockWebServer server;
    private HttpChecker checker;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        checker = new HttpChecker(HttpClient.newBuilder()
                        .version(HttpClient.Version.HTTP_1_1)
                        .connectTimeout(Duration.ofSeconds(2))
                        .build(),
                Duration.ofMillis(500));
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    private MonitoredTarget endpoint(int expectedStatus) {
        return MonitoredTarget.endpoint(server.url("/health").toString(), expectedStatus);
    }

    @Test
    @DisplayName("2xx response should be healthy with a response time")
    void okResponse() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("ok"));

        CheckResult result = checker.check(endpoint(200));

        assertThat(result.isHealthy()).isTrue();
        assertThat(result.getResponseTimeMillis()).isPresent();
        assertThat(result.getMetadata()).containsEntry("status", 200);

        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("GET");
        assertThat(request.getPath()).isEqualTo("/health");
    }

    @Test
    @DisplayName("Expected non-2xx status should be healthy")
    void expectedNonSuccessStatus() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(401));

        assertThat(checker.check(endpoint(401)).isHealthy()).isTrue();
    }

    @Test
    @DisplayName("Unexpected status should be unhealthy")
    void unexpectedStatus() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(503));

        CheckResult result = checker.check(endpoint(200));

        assertThat(result.isHealthy()).isFalse();
        assertThat(result.getError()).isEqualTo("Unexpected status: 503");
        assertThat(result.getMetadata())
                .containsEntry("status", 503)
                .containsEntry("expectedStatus", 200);
    }

    @Test
    @DisplayName("Slow response should time out")
    void timeout() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setHeadersDelay(3, TimeUnit.SECONDS));

        CheckResult result = checker.check(endpoint(200));

        assertThat(result.isHealthy()).isFalse();
        assertThat(result.getError()).isEqualTo("Request timeout after 500ms");
    }

    @Test
    @DisplayName("Closed port should be reported as connection refused")
    void connectionRefused() throws Exception {
        MonitoredTarget target = endpoint(200);
        server.shutdown();

        CheckResult result = checker.check(target);

        assertThat(result.isHealthy()).isFalse();
        assertThat(result.getError()).isEqualTo("Connection refused");
    }
}
