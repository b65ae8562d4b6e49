package com.watchdog.agent.probe;

import com.watchdog.core.check.Checker;
import com.watchdog.core.model.CheckResult;
import com.watchdog.core.model.MonitoredTarget;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Checks a Docker container through {@code docker inspect}.
 *
 * <p>
 * A container with its own health check is healthy only when Docker reports
 * it {@code healthy}. Otherwise the container must be {@code running}.
 * </p>
 *
 * @since 1.0.0
 */
public class DockerChecker implements Checker {

    public static final String TYPE = "docker";

    static final String NO_HEALTHCHECK = "no-healthcheck";

    private final CommandRunner runner;

    public DockerChecker(CommandRunner runner) {
        this.runner = Objects.requireNonNull(runner, "runner must not be null");
    }

    @Override
    public CheckResult check(MonitoredTarget target) throws CommandExecutionException {
        long start = System.nanoTime();
        CommandOutput state = inspect(target.getName(), "{{.State.Status}}");
        if (!state.isSuccess()) {
            return CheckResult.unhealthy(Elapsed.millisSince(start), "Container not found or not running");
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("state", state.getStdout());

        if (target.hasHealthCheck()) {
            CommandOutput health = inspect(target.getName(), "{{.State.Health.Status}}");
            String status = health.getStdout();
            if (!health.isSuccess() || status.isEmpty() || "<no value>".equals(status)) {
                status = NO_HEALTHCHECK;
            }
            metadata.put("healthStatus", status);
            long elapsed = Elapsed.millisSince(start);
            return "healthy".equals(status)
                    ? CheckResult.healthy(elapsed, metadata)
                    : CheckResult.unhealthy(elapsed, "Container health: " + status, metadata);
        }

        long elapsed = Elapsed.millisSince(start);
        return "running".equals(state.getStdout())
                ? CheckResult.healthy(elapsed, metadata)
                : CheckResult.unhealthy(elapsed, "Container state: " + state.getStdout(), metadata);
    }

    private CommandOutput inspect(String container, String format) throws CommandExecutionException {
        return runner.run("docker", List.of("inspect", "--format", format, container));
    }
}
