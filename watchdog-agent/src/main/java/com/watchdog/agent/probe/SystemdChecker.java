package com.watchdog.agent.probe;

import com.watchdog.core.check.Checker;
import com.watchdog.core.model.CheckResult;
import com.watchdog.core.model.MonitoredTarget;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Checks a systemd unit with {@code systemctl is-active}.
 */
public class SystemdChecker implements Checker {

    public static final String TYPE = "systemd";

    private final CommandRunner runner;

    public SystemdChecker(CommandRunner runner) {
        this.runner = Objects.requireNonNull(runner, "runner must not be null");
    }

    @Override
    public CheckResult check(MonitoredTarget target) throws CommandExecutionException {
        long start = System.nanoTime();
        CommandOutput output = runner.run("systemctl", List.of("is-active", target.getName()));
        long elapsed = Elapsed.millisSince(start);

        if (output.isSuccess()) {
            return CheckResult.healthy(elapsed, Map.of("status", "active"));
        }
        String status = output.getStdout().isEmpty() ? "inactive" : output.getStdout();
        return CheckResult.unhealthy(elapsed, "Service not active: " + status, Map.of("status", status));
    }
}
