package com.watchdog.agent.telegram;

import com.fasterxml.jackson.databind.JsonNode;
import com.watchdog.core.monitor.CommandHandler;
import com.watchdog.core.notify.NotificationDispatcher;
import com.watchdog.core.notify.NotificationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Polls the bot for chat commands and queues the replies.
 *
 * <p>
 * Only messages from the configured chat are answered. Replies go through
 * the {@link NotificationDispatcher} so they share the alert rate limit.
 * A failed poll is logged and retried on the next tick.
 * </p>
 *
 * @since 1.0.0
 */
public class TelegramCommandPoller implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(TelegramCommandPoller.class);

    private final TelegramNotifier telegram;
    private final CommandHandler commands;
    private final NotificationDispatcher dispatcher;
    private final Duration interval;

    private ScheduledExecutorService scheduler;
    private long offset;

    public TelegramCommandPoller(TelegramNotifier telegram, CommandHandler commands,
            NotificationDispatcher dispatcher, Duration interval) {
        this.telegram = Objects.requireNonNull(telegram, "telegram must not be null");
        this.commands = Objects.requireNonNull(commands, "commands must not be null");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.interval = Objects.requireNonNull(interval, "interval must not be null");
    }

    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "watchdog-telegram-poller");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleWithFixedDelay(this::safePoll, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
        LOG.info("Telegram command polling started (every {}s)", interval.getSeconds());
    }

    @Override
    public synchronized void close() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
            LOG.info("Telegram command polling stopped");
        }
    }

    private void safePoll() {
        try {
            pollOnce();
        } catch (NotificationException e) {
            LOG.warn("Telegram poll failed: {}", e.getMessage());
        } catch (RuntimeException e) {
            LOG.error("Unexpected error while polling Telegram", e);
        }
    }

    /**
     * Fetch pending updates once and answer any commands.
     *
     * @return number of replies queued
     * @throws NotificationException if the updates could not be fetched
     */
    synchronized int pollOnce() throws NotificationException {
        int replies = 0;
        for (JsonNode update : telegram.getUpdates(offset)) {
            offset = Math.max(offset, update.path("update_id").asLong() + 1);

            JsonNode message = update.path("message");
            String chat = message.path("chat").path("id").asText("");
            if (!telegram.getChatId().equals(chat)) {
                LOG.debug("Ignoring update {} from chat '{}'", update.path("update_id").asLong(), chat);
                continue;
            }
            Optional<String> reply = commands.handle(message.path("text").asText(""));
            if (reply.isPresent() && dispatcher.enqueue(reply.get())) {
                replies++;
            }
        }
        return replies;
    }

    long getOffset() {
        return offset;
    }
}
