package com.watchdog.core.check;

import com.watchdog.core.model.CheckResult;
import com.watchdog.core.model.MonitoredTarget;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link CheckerRegistry}.
 */
class CheckerRegistryTest {

    private final Checker healthy = target -> CheckResult.healthy(1);

    @Test
    @DisplayName("Lookup should dispatch on target type")
    void dispatchesOnType() {
        CheckerRegistry registry = CheckerRegistry.builder()
                .register("docker", healthy)
                .register(MonitoredTarget.TYPE_HTTP, healthy)
                .build();

        assertThat(registry.forTarget(MonitoredTarget.service("docker", "redis", false))).containsSame(healthy);
        assertThat(registry.forTarget(MonitoredTarget.service("pm2", "api", false))).isEmpty();
        assertThat(registry.types()).containsExactly("docker", "http");
    }

    @Test
    @DisplayName("Registering a type twice should fail")
    void rejectsDuplicates() {
        CheckerRegistry.Builder builder = CheckerRegistry.builder().register("docker", healthy);

        assertThatThrownBy(() -> builder.register("docker", healthy))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("docker");
    }

    @Test
    @DisplayName("Registry types should be read-only")
    void readOnly() {
        CheckerRegistry registry = CheckerRegistry.builder().register("docker", healthy).build();

        assertThatThrownBy(() -> registry.types().add("pm2"))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
