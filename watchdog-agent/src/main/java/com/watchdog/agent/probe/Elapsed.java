package com.watchdog.agent.probe;

/**
 * Wall-clock timing for checks, measured with {@link System#nanoTime()}.
 */
final class Elapsed {

    private Elapsed() {
    }

    /**
     * @param startNanos value of {@link System#nanoTime()} taken before the check
     * @return whole milliseconds elapsed since {@code startNanos}
     */
    static long millisSince(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
