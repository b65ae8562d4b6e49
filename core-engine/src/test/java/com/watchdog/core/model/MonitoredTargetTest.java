package com.watchdog.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link MonitoredTarget} and {@link CheckResult}.
 */
class MonitoredTargetTest {

    @Test
    @DisplayName("Id should be type and name joined by a colon")
    void ids() {
        assertThat(MonitoredTarget.service("docker", "redis", false).getId()).isEqualTo("docker:redis");
        assertThat(MonitoredTarget.endpoint("https://a.example/health", 200).getId())
                .isEqualTo("http:https://a.example/health");
        assertThat(MonitoredTarget.certificate("https://a.example").getId()).isEqualTo("ssl:https://a.example");
        assertThat(MonitoredTarget.resource("disk").getId()).isEqualTo("resource:disk");
    }

    @Test
    @DisplayName("Factories should assign the matching category")
    void categories() {
        assertThat(MonitoredTarget.service("pm2", "api", false).getCategory()).isEqualTo(CheckCategory.SERVICES);
        assertThat(MonitoredTarget.endpoint("http://x", 204).getCategory()).isEqualTo(CheckCategory.ENDPOINTS);
        assertThat(MonitoredTarget.certificate("https://x").getCategory()).isEqualTo(CheckCategory.SSL);
        assertThat(MonitoredTarget.resource("cpu").getCategory()).isEqualTo(CheckCategory.RESOURCES);
        assertThat(CheckCategory.ENDPOINTS.tracksLatency()).isTrue();
        assertThat(CheckCategory.SERVICES.tracksLatency()).isFalse();
    }

    @Test
    @DisplayName("Builder should require category, type and name")
    void builderRequiresFields() {
        assertThatThrownBy(() -> MonitoredTarget.builder().type("docker").name("redis").build())
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("category");
    }

    @Test
    @DisplayName("Check result metadata should be an immutable copy")
    void resultMetadataIsCopied() {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("status", 503);
        CheckResult result = CheckResult.unhealthy(12, "Unexpected status: 503", metadata);
        metadata.put("status", 200);

        assertThat(result.getMetadataValue("status")).contains(503);
        assertThat(result.getResponseTimeMillis()).contains(12L);
        assertThatThrownBy(() -> result.getMetadata().put("x", 1))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThat(CheckResult.of(true, null, null).getResponseTimeMillis()).isEmpty();
    }
}
