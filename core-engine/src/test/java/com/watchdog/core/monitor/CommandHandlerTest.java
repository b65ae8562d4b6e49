package com.watchdog.core.monitor;

import com.watchdog.core.MutableClock;
import com.watchdog.core.config.AlertSettings;
import com.watchdog.core.state.StateEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link CommandHandler}.
 */
class CommandHandlerTest {

    private MutableClock clock;
    private StateEngine state;
    private CommandHandler commands;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-03-01T10:00:00Z"));
        state = new StateEngine(null, new AlertSettings(), clock);
        commands = new CommandHandler(state, clock);
    }

    @Test
    @DisplayName("/ack and /unack should toggle acknowledgement in the state engine")
    void shouldAcknowledgeAndUnacknowledge() {
        assertThat(commands.handle("/ack docker:redis")).hasValueSatisfying(reply ->
                assertThat(reply).contains("docker:redis acknowledged"));
        assertThat(state.isAcknowledged("docker:redis")).isTrue();
        assertThat(commands.handle("/ack docker:redis")).contains("docker:redis is already acknowledged");

        assertThat(commands.handle("/unack docker:redis")).hasValueSatisfying(reply ->
                assertThat(reply).contains("unmuted"));
        assertThat(state.isAcknowledged("docker:redis")).isFalse();
    }

    @Test
    @DisplayName("/status should list failing and muted services")
    void statusShouldListFailures() {
        state.recordFailure("docker:redis", "exited");
        state.acknowledge("docker:redis");
        clock.advanceMinutes(5);

        String reply = commands.handle("/status").orElseThrow();

        assertThat(reply)
                .contains("Failing: 1")
                .contains("docker:redis (5m 0s) [muted]")
                .contains("Muted: docker:redis");
    }

    @Test
    @DisplayName("/status should report all healthy when nothing fails")
    void statusShouldReportHealthy() {
        assertThat(commands.handle("/status")).hasValueSatisfying(reply ->
                assertThat(reply).contains("All services healthy"));
    }

    @Test
    @DisplayName("Should strip a bot-name suffix and ignore case")
    void shouldNormaliseCommand() {
        assertThat(commands.handle("/HELP@watchdog_bot")).contains(CommandHandler.HELP);
    }

    @Test
    @DisplayName("Should explain usage when the id is missing")
    void shouldExplainUsage() {
        assertThat(commands.handle("/ack")).hasValueSatisfying(reply -> assertThat(reply).startsWith("Usage"));
        assertThat(state.getAcknowledged()).isEmpty();
    }

    @Test
    @DisplayName("Should ignore plain text and answer unknown commands")
    void shouldHandleNonCommands() {
        assertThat(commands.handle("hello")).isEmpty();
        assertThat(commands.handle(null)).isEmpty();
        assertThat(commands.handle("/reboot")).hasValueSatisfying(reply ->
                assertThat(reply).contains("Unknown command /reboot"));
    }
}
