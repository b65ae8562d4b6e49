package com.watchdog.agent.probe;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ProcessCommandRunner} argument validation.
 */
class ProcessCommandRunnerTest {

    @Test
    @DisplayName("Allowed command with plain arguments should build an argv")
    void buildsArgv() throws Exception {
        List<String> argv = ProcessCommandRunner.buildCommandLine("docker",
                List.of("inspect", "--format", "{{.State.Status}}", "redis"));

        assertThat(argv).containsExactly("docker", "inspect", "--format", "{{.State.Status}}", "redis");
    }

    @Test
    @DisplayName("Command outside the whitelist should be rejected")
    void rejectsUnknownCommand() {
        assertThatThrownBy(() -> new ProcessCommandRunner(Duration.ofSeconds(1)).run("rm", List.of("-rf", "/")))
                .isInstanceOf(CommandExecutionException.class)
                .hasMessageContaining("not allowed");
    }

    @Test
    @DisplayName("Arguments with shell metacharacters should be rejected")
    void rejectsUnsafeArguments() {
        for (String arg : List.of("nginx; reboot", "a && b", "x | y", "`id`", "$(id)")) {
            assertThatThrownBy(() -> ProcessCommandRunner.buildCommandLine("systemctl", List.of("is-active", arg)))
                    .as(arg)
                    .isInstanceOf(CommandExecutionException.class)
                    .hasMessageContaining("unsafe");
        }
    }

    @Test
    @DisplayName("Non-positive timeout should be rejected")
    void rejectsBadTimeout() {
        assertThatThrownBy(() -> new ProcessCommandRunner(Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
