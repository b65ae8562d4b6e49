package com.watchdog.agent.probe;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;

/**
 * {@link CommandRunner} backed by {@link ProcessBuilder}.
 *
 * <h3>Safety</h3>
 * <p>
 * Only executables on {@link #ALLOWED_COMMANDS} may run, and arguments
 * containing shell metacharacters are rejected before anything starts.
 * Commands are never passed through a shell.
 * </p>
 *
 * <h3>Timeout</h3>
 * <p>
 * A command still running after the configured timeout is killed and
 * reported as a {@link CommandExecutionException}.
 * </p>
 *
 * @since 1.0.0
 */
public class ProcessCommandRunner implements CommandRunner {

    private static final Logger LOG = LoggerFactory.getLogger(ProcessCommandRunner.class);

    /** Executables a probe may invoke. */
    public static final Set<String> ALLOWED_COMMANDS = Set.of("docker", "pm2", "systemctl");

    private static final Pattern UNSAFE = Pattern.compile("[;&|`$()<>\\n]");

    private final Duration timeout;

    /**
     * @param timeout maximum run time per command; must be positive
     */
    public ProcessCommandRunner(Duration timeout) {
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive, got: " + timeout);
        }
    }

    @Override
    public CommandOutput run(String command, List<String> args) throws CommandExecutionException {
        List<String> argv = buildCommandLine(command, args);
        LOG.debug("Executing: {}", String.join(" ", argv));

        Process process;
        try {
            process = new ProcessBuilder(argv).start();
        } catch (IOException e) {
            throw new CommandExecutionException("Failed to start " + command + ": " + e.getMessage(), e);
        }

        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> read(process.getInputStream()));
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> read(process.getErrorStream()));
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new CommandExecutionException(
                        command + " timed out after " + timeout.toMillis() + "ms");
            }
            return new CommandOutput(process.exitValue(),
                    stdout.get(timeout.toMillis(), TimeUnit.MILLISECONDS),
                    stderr.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new CommandExecutionException(command + " interrupted", e);
        } catch (ExecutionException | TimeoutException e) {
            throw new CommandExecutionException("Failed to read output of " + command, e);
        }
    }

    /**
     * Validate and assemble the argument vector.
     *
     * @throws CommandExecutionException if the command or an argument is
     *                                   rejected
     */
    static List<String> buildCommandLine(String command, List<String> args) throws CommandExecutionException {
        if (!ALLOWED_COMMANDS.contains(command)) {
            throw new CommandExecutionException("Command not allowed: " + command);
        }
        List<String> argv = new ArrayList<>(args.size() + 1);
        argv.add(command);
        for (String arg : args) {
            if (arg == null || UNSAFE.matcher(arg).find()) {
                throw new CommandExecutionException("Potentially unsafe argument: " + arg);
            }
            argv.add(arg);
        }
        return argv;
    }

    private static String read(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
