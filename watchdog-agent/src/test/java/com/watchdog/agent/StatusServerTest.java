package com.watchdog.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.watchdog.core.check.CheckerRegistry;
import com.watchdog.core.config.AlertSettings;
import com.watchdog.core.detection.AnomalyDetector;
import com.watchdog.core.monitor.CheckResultHandler;
import com.watchdog.core.monitor.MonitorScheduler;
import com.watchdog.core.notify.MessageFormatter;
import com.watchdog.core.notify.NotificationDispatcher;
import com.watchdog.core.state.StateEngine;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link StatusServer} on an ephemeral port.
 */
class StatusServerTest {

    private final HttpClient client = HttpClient.newHttpClient();
    private final ObjectMapper mapper = new ObjectMapper();

    private StateEngine state;
    private MonitorScheduler scheduler;
    private StatusServer server;

    @BeforeEach
    void setUp() {
        AlertSettings alerts = new AlertSettings();
        state = new StateEngine(null, alerts);
        AnomalyDetector anomalyDetector = new AnomalyDetector(true, 3.0, 20);
        NotificationDispatcher dispatcher = new NotificationDispatcher(message -> {
        }, Duration.ZERO);
        CheckResultHandler handler = new CheckResultHandler(state, anomalyDetector, dispatcher,
                new MessageFormatter(alerts.flappingWindow()), alerts, Clock.systemUTC());
        scheduler = MonitorScheduler.builder()
                .checkers(CheckerRegistry.builder().build())
                .handler(handler)
                .state(state)
                .anomalyDetector(anomalyDetector)
                .build();
        server = new StatusServer(scheduler, state);
        server.start(0);
    }

    @AfterEach
    void tearDown() {
        server.stop();
        scheduler.shutdown();
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(URI.create("http://localhost:" + server.getPort() + path))
                .GET()
                .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    @DisplayName("Health endpoint should answer UP")
    void health() throws Exception {
        assertThat(server.isRunning()).isTrue();

        HttpResponse<String> response = get("/health");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.body()).isEqualTo("{\"status\":\"UP\"}");
    }

    @Test
    @DisplayName("Status endpoint should expose failures and acknowledgements")
    void status() throws Exception {
        state.recordFailure("docker:redis", "Container state: exited");
        state.acknowledge("docker:redis");
        state.updateSslExpiry("ssl:https://example.com", Instant.parse("2030-01-01T00:00:00Z"));

        HttpResponse<String> response = get("/api/status");

        assertThat(response.statusCode()).isEqualTo(200);
        JsonNode body = mapper.readTree(response.body());
        assertThat(body.path("status").asText()).isEqualTo("UP");
        assertThat(body.path("failures").path("docker:redis").path("error").asText())
                .isEqualTo("Container state: exited");
        assertThat(body.path("acknowledged").get(0).asText()).isEqualTo("docker:redis");
        assertThat(body.path("sslExpiry").path("ssl:https://example.com").asText())
                .startsWith("2030-01-01");
        assertThat(body.path("monitor").path("state").path("activeFailures").asInt()).isEqualTo(1);
    }

    @Test
    @DisplayName("Non-GET status request should be rejected")
    void methodNotAllowed() throws Exception {
        HttpRequest request = HttpRequest.newBuilder(
                        URI.create("http://localhost:" + server.getPort() + "/api/status"))
                .POST(HttpRequest.BodyPublishers.noBody())
                .build();

        assertThat(client.send(request, HttpResponse.BodyHandlers.ofString()).statusCode()).isEqualTo(405);
    }

    @Test
    @DisplayName("Invalid port should be rejected")
    void invalidPort() {
        assertThatThrownBy(() -> new StatusServer(scheduler, state).start(-1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Stopped server should report no port")
    void stopped() {
        server.stop();

        assertThat(server.isRunning()).isFalse();
        assertThat(server.getPort()).isEqualTo(-1);
    }
}
