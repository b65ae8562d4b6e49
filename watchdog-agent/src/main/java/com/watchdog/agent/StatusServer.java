package com.watchdog.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import com.watchdog.core.monitor.MonitorScheduler;
import com.watchdog.core.state.JsonFileStore;
import com.watchdog.core.state.StateEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Read-only HTTP endpoints for probes and dashboards.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code GET /health} returns {@code 200 OK} with body
 * {@code {"status":"UP"}}</li>
 * <li>{@code GET /readiness} same; container readiness probe target</li>
 * <li>{@code GET /api/status} monitor statistics, open failures,
 * acknowledged ids and certificate expiry dates as JSON</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class StatusServer {

    private static final Logger LOG = LoggerFactory.getLogger(StatusServer.class);
    private static final byte[] HEALTH_RESPONSE = "{\"status\":\"UP\"}".getBytes(StandardCharsets.UTF_8);

    private final MonitorScheduler monitor;
    private final StateEngine state;
    private final ObjectMapper mapper = JsonFileStore.mapper();

    private HttpServer server;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public StatusServer(MonitorScheduler monitor, StateEngine state) {
        this.monitor = Objects.requireNonNull(monitor, "monitor must not be null");
        this.state = Objects.requireNonNull(state, "state must not be null");
    }

    /**
     * Start the server on the given port.
     *
     * @param port TCP port to bind to; {@code 0} picks a free port
     * @throws IllegalArgumentException if port is out of range
     */
    public void start(int port) {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException(
                    "Status port must be in range [0, 65535], got: " + port);
        }
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            server.createContext("/health", StatusServer::handleHealthCheck);
            server.createContext("/readiness", StatusServer::handleHealthCheck);
            server.createContext("/api/status", this::handleStatus);

            server.setExecutor(Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "status-server");
                t.setDaemon(true);
                return t;
            }));

            server.start();
            running.set(true);
            LOG.info("Status server started on port {}", getPort());
        } catch (IOException e) {
            LOG.error("Failed to start status server on port {}: {}", port, e.getMessage(), e);
        }
    }

    /**
     * Stop the server gracefully.
     */
    public void stop() {
        if (server != null && running.compareAndSet(true, false)) {
            server.stop(0);
            LOG.info("Status server stopped");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * @return the bound port, or {@code -1} when not running
     */
    public int getPort() {
        return server != null && running.get() ? server.getAddress().getPort() : -1;
    }

    // ---------------------------------------------------------------
    // Handlers
    // ---------------------------------------------------------------

    private static void handleHealthCheck(HttpExchange exchange) throws IOException {
        respond(exchange, 200, HEALTH_RESPONSE);
    }

    private void handleStatus(HttpExchange exchange) throws IOException {
        if (!"GET".equals(exchange.getRequestMethod())) {
            respond(exchange, 405, "{\"error\":\"method not allowed\"}".getBytes(StandardCharsets.UTF_8));
            return;
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "UP");
        body.put("monitor", monitor.getStats());
        body.put("failures", state.getAllFailures());
        body.put("acknowledged", state.getAcknowledged());
        body.put("sslExpiry", state.getAllSslExpiry());
        respond(exchange, 200, mapper.writeValueAsBytes(body));
    }

    private static void respond(HttpExchange exchange, int status, byte[] body) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }
}
