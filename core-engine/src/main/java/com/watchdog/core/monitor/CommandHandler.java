package com.watchdog.core.monitor;

import com.watchdog.core.model.FailureRecord;
import com.watchdog.core.notify.MessageFormatter;
import com.watchdog.core.state.StateEngine;
import com.watchdog.core.state.StateStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Operator chat commands. Acknowledgements go through the same
 * {@link StateEngine} API the monitor uses.
 *
 * <ul>
 * <li>{@code /status}: open failures and muted ids</li>
 * <li>{@code /ack <id>}: mute notifications for an id</li>
 * <li>{@code /unack <id>}: unmute</li>
 * <li>{@code /help}: command list</li>
 * </ul>
 */
public class CommandHandler {

    private static final Logger LOG = LoggerFactory.getLogger(CommandHandler.class);

    static final String HELP = "🐕 Watchdog commands\n\n"
            + "/status - current failures and muted services\n"
            + "/ack <id> - mute alerts for a service, e.g. /ack docker:redis\n"
            + "/unack <id> - unmute a service\n"
            + "/help - this message";

    private final StateEngine state;
    private final Clock clock;

    public CommandHandler(StateEngine state, Clock clock) {
        this.state = Objects.requireNonNull(state, "state must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * @param text raw message text
     * @return the reply, or empty when the text is not a command
     */
    public Optional<String> handle(String text) {
        if (text == null || !text.startsWith("/")) {
            return Optional.empty();
        }
        String[] parts = text.trim().split("\\s+", 2);
        String command = parts[0].toLowerCase(Locale.ROOT);
        int at = command.indexOf('@');
        if (at > 0) {
            command = command.substring(0, at);
        }
        String argument = parts.length > 1 ? parts[1].trim() : "";

        LOG.info("Received command {} {}", command, argument);
        return Optional.of(switch (command) {
            case "/status" -> status();
            case "/ack" -> acknowledge(argument);
            case "/unack" -> unacknowledge(argument);
            case "/help", "/start" -> HELP;
            default -> "Unknown command " + command + ". Try /help";
        });
    }

    private String status() {
        Map<String, FailureRecord> failures = state.getAllFailures();
        Set<String> muted = state.getAcknowledged();
        StateStats stats = state.getStats();

        StringBuilder sb = new StringBuilder("🐕 WATCHDOG STATUS\n\n");
        if (failures.isEmpty()) {
            sb.append("All services healthy\n");
        } else {
            sb.append("Failing: ").append(failures.size()).append('\n');
            failures.forEach((id, record) -> {
                Duration down = Duration.between(record.getFirstSeen(), clock.instant());
                sb.append("• ").append(id)
                        .append(" (").append(MessageFormatter.formatDuration(down)).append(")")
                        .append(muted.contains(id) ? " [muted]" : "")
                        .append('\n');
            });
        }
        if (stats.getFlapping() > 0) {
            sb.append("Flapping: ").append(stats.getFlapping()).append('\n');
        }
        if (!muted.isEmpty()) {
            sb.append("Muted: ").append(String.join(", ", muted)).append('\n');
        }
        return sb.toString();
    }

    private String acknowledge(String id) {
        if (id.isEmpty()) {
            return "Usage: /ack <id>, e.g. /ack docker:redis";
        }
        return state.acknowledge(id)
                ? "🔕 " + id + " acknowledged. Alerts muted until /unack " + id
                : id + " is already acknowledged";
    }

    private String unacknowledge(String id) {
        if (id.isEmpty()) {
            return "Usage: /unack <id>";
        }
        return state.unacknowledge(id)
                ? "🔔 " + id + " unmuted"
                : id + " was not acknowledged";
    }
}
