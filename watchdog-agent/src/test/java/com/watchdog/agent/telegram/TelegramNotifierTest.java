package com.watchdog.agent.telegram;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.watchdog.core.notify.NotificationException;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link TelegramNotifier} against a mock Bot API.
 */
class TelegramNotifierTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private MockWebServer server;
    private TelegramNotifier notifier;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        notifier = new TelegramNotifier(server.url("/").toString(), "123:abc", "-1001");
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    @DisplayName("send should post chat id and text as JSON")
    void sendMessage() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"ok\":true,\"result\":{}}"));

        notifier.send("🔴 SERVICE DOWN\n\nService: redis");

        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getPath()).isEqualTo("/bot123:abc/sendMessage");
        assertThat(request.getHeader("Content-Type")).startsWith("application/json");
        JsonNode body = mapper.readTree(request.getBody().readUtf8());
        assertThat(body.path("chat_id").asText()).isEqualTo("-1001");
        assertThat(body.path("text").asText()).isEqualTo("🔴 SERVICE DOWN\n\nService: redis");
    }

    @Test
    @DisplayName("Non-2xx response should raise NotificationException with the status code")
    void apiError() {
        server.enqueue(new MockResponse().setResponseCode(429)
                .setBody("{\"ok\":false,\"description\":\"Too Many Requests: retry after 3\"}"));

        assertThatThrownBy(() -> notifier.send("hello"))
                .isInstanceOf(NotificationException.class)
                .hasMessageContaining("Too Many Requests")
                .satisfies(e -> assertThat(((NotificationException) e).getStatusCode()).isEqualTo(429));
    }

    @Test
    @DisplayName("Unreachable API should raise NotificationException")
    void unreachable() throws Exception {
        server.shutdown();

        assertThatThrownBy(() -> notifier.send("hello"))
                .isInstanceOf(NotificationException.class)
                .hasMessageContaining("request failed");
    }

    @Test
    @DisplayName("getUpdates should pass the offset and return the result array")
    void getUpdates() throws Exception {
        server.enqueue(new MockResponse().setBody(
                "{\"ok\":true,\"result\":[{\"update_id\":7,\"message\":{\"text\":\"/status\"}}]}"));

        JsonNode updates = notifier.getUpdates(7);

        assertThat(updates.isArray()).isTrue();
        assertThat(updates.get(0).path("update_id").asLong()).isEqualTo(7);
        assertThat(server.takeRequest().getPath()).contains("/bot123:abc/getUpdates").contains("offset=7");
    }
}
