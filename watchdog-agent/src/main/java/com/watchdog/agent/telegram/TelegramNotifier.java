package com.watchdog.agent.telegram;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.watchdog.core.notify.NotificationException;
import com.watchdog.core.notify.Notifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;

/**
 * Telegram Bot API transport.
 *
 * <h3>Delivery</h3>
 * <p>
 * {@link #send(String)} posts one plain-text message to the configured chat.
 * Any non-2xx answer or network error becomes a {@link NotificationException};
 * retrying is left to the caller.
 * </p>
 *
 * <h3>Commands</h3>
 * <p>
 * {@link #getUpdates(long)} fetches pending bot updates for
 * {@link TelegramCommandPoller}.
 * </p>
 *
 * @since 1.0.0
 */
public class TelegramNotifier implements Notifier {

    private static final Logger LOG = LoggerFactory.getLogger(TelegramNotifier.class);

    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(15);

    private final HttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();
    private final String botUrl;
    private final String chatId;

    /**
     * @param apiUrl Bot API base URL, e.g. {@code https://api.telegram.org}
     * @param token  bot token
     * @param chatId chat that receives alerts and may issue commands
     */
    public TelegramNotifier(String apiUrl, String token, String chatId) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(), apiUrl, token, chatId);
    }

    TelegramNotifier(HttpClient httpClient, String apiUrl, String token, String chatId) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
        Objects.requireNonNull(apiUrl, "apiUrl must not be null");
        Objects.requireNonNull(token, "token must not be null");
        this.chatId = Objects.requireNonNull(chatId, "chatId must not be null");
        String base = apiUrl.endsWith("/") ? apiUrl.substring(0, apiUrl.length() - 1) : apiUrl;
        this.botUrl = base + "/bot" + token;
    }

    @Override
    public void send(String message) throws NotificationException {
        ObjectNode body = mapper.createObjectNode();
        body.put("chat_id", chatId);
        body.put("text", message);
        body.put("disable_web_page_preview", true);

        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(URI.create(botUrl + "/sendMessage"))
                    .timeout(REQUEST_TIMEOUT)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body)))
                    .build();
        } catch (JsonProcessingException e) {
            throw new NotificationException("Failed to serialize message", e);
        }

        HttpResponse<String> response = execute(request);
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new NotificationException("Telegram API returned HTTP " + response.statusCode()
                    + ": " + describe(response.body()), response.statusCode(), null);
        }
        LOG.debug("Message delivered to chat {}", chatId);
    }

    /**
     * Fetch bot updates newer than {@code offset}.
     *
     * @param offset first update id to return
     * @return the {@code result} array of the response
     * @throws NotificationException on transport or API errors
     */
    public JsonNode getUpdates(long offset) throws NotificationException {
        HttpRequest request = HttpRequest.newBuilder(
                        URI.create(botUrl + "/getUpdates?timeout=0&allowed_updates=%5B%22message%22%5D&offset=" + offset))
                .timeout(REQUEST_TIMEOUT)
                .GET()
                .build();

        HttpResponse<String> response = execute(request);
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new NotificationException("Telegram getUpdates returned HTTP " + response.statusCode(),
                    response.statusCode(), null);
        }
        try {
            JsonNode root = mapper.readTree(response.body());
            if (!root.path("ok").asBoolean(false)) {
                throw new NotificationException("Telegram getUpdates failed: " + describe(response.body()));
            }
            return root.path("result");
        } catch (JsonProcessingException e) {
            throw new NotificationException("Unparseable getUpdates response", e);
        }
    }

    public String getChatId() {
        return chatId;
    }

    private HttpResponse<String> execute(HttpRequest request) throws NotificationException {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new NotificationException("Telegram request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NotificationException("Interrupted during Telegram request", e);
        }
    }

    private String describe(String body) {
        try {
            JsonNode node = mapper.readTree(body);
            if (node.hasNonNull("description")) {
                return node.get("description").asText();
            }
        } catch (JsonProcessingException e) {
            LOG.trace("Non-JSON Telegram error body", e);
        }
        return body;
    }
}
