package com.watchdog.agent.probe;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.watchdog.core.check.Checker;
import com.watchdog.core.model.CheckResult;
import com.watchdog.core.model.MonitoredTarget;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Checks a PM2-managed process by parsing {@code pm2 jlist}.
 *
 * <h3>Crash loops</h3>
 * <p>
 * PM2 restarts crashed processes immediately, so a process can report
 * {@code online} while failing continuously. A process with more than
 * {@value #CRASH_LOOP_RESTARTS} restarts and less than five minutes of uptime
 * is reported unhealthy with {@code flapping=true} in its metadata.
 * </p>
 *
 * @since 1.0.0
 */
public class Pm2Checker implements Checker {

    public static final String TYPE = "pm2";

    static final int CRASH_LOOP_RESTARTS = 10;
    static final Duration CRASH_LOOP_UPTIME = Duration.ofMinutes(5);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final CommandRunner runner;
    private final Clock clock;

    public Pm2Checker(CommandRunner runner) {
        this(runner, Clock.systemUTC());
    }

    public Pm2Checker(CommandRunner runner, Clock clock) {
        this.runner = Objects.requireNonNull(runner, "runner must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public CheckResult check(MonitoredTarget target) throws CommandExecutionException {
        long start = System.nanoTime();
        CommandOutput output = runner.run("pm2", List.of("jlist"));
        if (!output.isSuccess()) {
            throw new CommandExecutionException("pm2 jlist exited with " + output.getExitCode()
                    + ": " + output.getStderr());
        }

        JsonNode process = findProcess(output.getStdout(), target.getName());
        long elapsed = Elapsed.millisSince(start);
        if (process == null) {
            return CheckResult.unhealthy(elapsed, "Process not found in PM2");
        }

        JsonNode env = process.path("pm2_env");
        String status = env.path("status").asText("unknown");
        int restarts = env.path("restart_time").asInt(0);
        long uptimeSeconds = 0;
        if (env.hasNonNull("pm_uptime")) {
            uptimeSeconds = Math.max(0, (clock.millis() - env.get("pm_uptime").asLong()) / 1000);
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("status", status);
        metadata.put("restarts", restarts);
        metadata.put("uptime", uptimeSeconds);

        if (!"online".equals(status)) {
            return CheckResult.unhealthy(elapsed, "Process status: " + status, metadata);
        }
        if (restarts > CRASH_LOOP_RESTARTS && uptimeSeconds < CRASH_LOOP_UPTIME.getSeconds()) {
            metadata.put("flapping", true);
            return CheckResult.unhealthy(elapsed, "Process restarting frequently ("
                    + restarts + " restarts, uptime: " + uptimeSeconds + "s)", metadata);
        }

        JsonNode monit = process.path("monit");
        if (monit.has("memory")) {
            metadata.put("memory", monit.get("memory").asLong());
        }
        if (monit.has("cpu")) {
            metadata.put("cpu", monit.get("cpu").asDouble());
        }
        return CheckResult.healthy(elapsed, metadata);
    }

    private static JsonNode findProcess(String json, String name) throws CommandExecutionException {
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new CommandExecutionException("Unparseable pm2 jlist output", e);
        }
        if (root == null || !root.isArray()) {
            throw new CommandExecutionException("pm2 jlist did not return a JSON array");
        }
        for (JsonNode process : root) {
            if (name.equals(process.path("name").asText(null))) {
                return process;
            }
        }
        return null;
    }
}
