package com.watchdog.agent.probe;

import java.util.List;

/**
 * Runs an external command without a shell.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface CommandRunner {

    /**
     * Run {@code command} with {@code args} and wait for it to exit.
     * A non-zero exit code is a normal outcome, reported in the result.
     *
     * @param command executable name
     * @param args    arguments, passed verbatim
     * @return exit code and captured output
     * @throws CommandExecutionException if the command is not allowed, cannot
     *                                   start, or exceeds its timeout
     */
    CommandOutput run(String command, List<String> args) throws CommandExecutionException;
}
