package com.watchdog.agent;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Typed, immutable process settings for the watchdog agent.
 *
 * <p>
 * These are the deployment knobs (file locations, bot credentials, ports)
 * that come from environment variables with defaults. Monitoring behaviour
 * lives in {@code watchdog.yml}, loaded by
 * {@link com.watchdog.core.config.ConfigLoader}.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder} for
 * tests. The builder validates inputs at {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class AgentConfig {

    // ---------------------------------------------------------------
    // Files
    // ---------------------------------------------------------------
    private final Path statePath;
    private final Path anomalyPath;

    // ---------------------------------------------------------------
    // Telegram
    // ---------------------------------------------------------------
    private final String telegramToken;
    private final String telegramChatId;
    private final String telegramApiUrl;
    private final int commandPollSeconds;

    // ---------------------------------------------------------------
    // Status server
    // ---------------------------------------------------------------
    private final boolean statusEnabled;
    private final int statusPort;

    // ---------------------------------------------------------------
    // Execution
    // ---------------------------------------------------------------
    private final int workerThreads;

    private AgentConfig(Builder b) {
        this.statePath = b.statePath;
        this.anomalyPath = b.anomalyPath;
        this.telegramToken = b.telegramToken;
        this.telegramChatId = b.telegramChatId;
        this.telegramApiUrl = b.telegramApiUrl;
        this.commandPollSeconds = b.commandPollSeconds;
        this.statusEnabled = b.statusEnabled;
        this.statusPort = b.statusPort;
        this.workerThreads = b.workerThreads;
    }

    // ---------------------------------------------------------------
    // Factory, resolved from environment
    // ---------------------------------------------------------------

    /**
     * @return configuration resolved from the process environment
     * @throws IllegalStateException    if a numeric variable cannot be parsed
     * @throws IllegalArgumentException if a value is out of range
     */
    public static AgentConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    static AgentConfig fromEnvironment(Map<String, String> env) {
        try {
            return new Builder()
                    .statePath(Path.of(env(env, "WATCHDOG_STATE_PATH", "./state.json")))
                    .anomalyPath(Path.of(env(env, "WATCHDOG_ANOMALY_PATH", "./anomaly-state.json")))
                    .telegramToken(env(env, "TELEGRAM_BOT_TOKEN", ""))
                    .telegramChatId(env(env, "TELEGRAM_CHAT_ID", ""))
                    .telegramApiUrl(env(env, "TELEGRAM_API_URL", "https://api.telegram.org"))
                    .commandPollSeconds(Integer.parseInt(env(env, "COMMAND_POLL_SECONDS", "5")))
                    .statusEnabled(Boolean.parseBoolean(env(env, "STATUS_ENABLED", "true")))
                    .statusPort(Integer.parseInt(env(env, "STATUS_PORT", "3100")))
                    .workerThreads(Integer.parseInt(env(env, "WORKER_THREADS", "8")))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    /**
     * @return {@code true} if both a bot token and a chat id are set
     */
    public boolean telegramEnabled() {
        return !telegramToken.isBlank() && !telegramChatId.isBlank();
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public Path getStatePath() {
        return statePath;
    }

    public Path getAnomalyPath() {
        return anomalyPath;
    }

    public String getTelegramToken() {
        return telegramToken;
    }

    public String getTelegramChatId() {
        return telegramChatId;
    }

    public String getTelegramApiUrl() {
        return telegramApiUrl;
    }

    public int getCommandPollSeconds() {
        return commandPollSeconds;
    }

    public boolean isStatusEnabled() {
        return statusEnabled;
    }

    public int getStatusPort() {
        return statusPort;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link AgentConfig}.
     *
     * <p>
     * {@link #build()} checks that the status port is in [0, 65535] (0 picks
     * a free port), that thread and poll counts are positive, and that a bot
     * token comes with a chat id.
     * </p>
     */
    public static class Builder {
        private Path statePath = Path.of("./state.json");
        private Path anomalyPath = Path.of("./anomaly-state.json");
        private String telegramToken = "";
        private String telegramChatId = "";
        private String telegramApiUrl = "https://api.telegram.org";
        private int commandPollSeconds = 5;
        private boolean statusEnabled = true;
        private int statusPort = 3100;
        private int workerThreads = 8;

        public Builder statePath(Path v) {
            this.statePath = v;
            return this;
        }

        public Builder anomalyPath(Path v) {
            this.anomalyPath = v;
            return this;
        }

        public Builder telegramToken(String v) {
            this.telegramToken = v;
            return this;
        }

        public Builder telegramChatId(String v) {
            this.telegramChatId = v;
            return this;
        }

        public Builder telegramApiUrl(String v) {
            this.telegramApiUrl = v;
            return this;
        }

        public Builder commandPollSeconds(int v) {
            this.commandPollSeconds = v;
            return this;
        }

        public Builder statusEnabled(boolean v) {
            this.statusEnabled = v;
            return this;
        }

        public Builder statusPort(int v) {
            this.statusPort = v;
            return this;
        }

        public Builder workerThreads(int v) {
            this.workerThreads = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link AgentConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public AgentConfig build() {
            Objects.requireNonNull(statePath, "statePath required");
            Objects.requireNonNull(anomalyPath, "anomalyPath required");
            Objects.requireNonNull(telegramToken, "telegramToken required");
            Objects.requireNonNull(telegramChatId, "telegramChatId required");
            requireNonBlank(telegramApiUrl, "telegramApiUrl");

            if (!telegramToken.isBlank() && telegramChatId.isBlank()) {
                throw new IllegalArgumentException("TELEGRAM_CHAT_ID is required when a bot token is set");
            }
            if (commandPollSeconds < 1) {
                throw new IllegalArgumentException(
                        "commandPollSeconds must be >= 1, got: " + commandPollSeconds);
            }
            if (workerThreads < 1) {
                throw new IllegalArgumentException("workerThreads must be >= 1, got: " + workerThreads);
            }
            if (statusPort < 0 || statusPort > 65_535) {
                throw new IllegalArgumentException(
                        "statusPort must be in [0, 65535], got: " + statusPort);
            }

            return new AgentConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(Map<String, String> env, String name, String defaultValue) {
        String value = env.get(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    @Override
    public String toString() {
        return "AgentConfig{" +
                "statePath=" + statePath +
                ", anomalyPath=" + anomalyPath +
                ", telegram=" + (telegramEnabled() ? "enabled" : "disabled") +
                ", statusEnabled=" + statusEnabled +
                ", statusPort=" + statusPort +
                ", workerThreads=" + workerThreads +
                '}';
    }
}
