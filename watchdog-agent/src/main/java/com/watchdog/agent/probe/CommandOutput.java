package com.watchdog.agent.probe;

/**
 * Exit code and trimmed output of a finished command.
 */
public final class CommandOutput {

    private final int exitCode;
    private final String stdout;
    private final String stderr;

    public CommandOutput(int exitCode, String stdout, String stderr) {
        this.exitCode = exitCode;
        this.stdout = stdout == null ? "" : stdout.trim();
        this.stderr = stderr == null ? "" : stderr.trim();
    }

    public static CommandOutput success(String stdout) {
        return new CommandOutput(0, stdout, "");
    }

    public boolean isSuccess() {
        return exitCode == 0;
    }

    public int getExitCode() {
        return exitCode;
    }

    public String getStdout() {
        return stdout;
    }

    public String getStderr() {
        return stderr;
    }

    @Override
    public String toString() {
        return "CommandOutput{exitCode=" + exitCode + ", stdout='" + stdout + "', stderr='" + stderr + "'}";
    }
}
