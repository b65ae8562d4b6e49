package com.watchdog.core.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Paced, asynchronous delivery of alert messages.
 *
 * <p>
 * {@link #enqueue(String)} appends to an unbounded FIFO queue and returns
 * immediately. A single daemon thread drains the queue in order, waiting at
 * least {@code minInterval} between the starts of two sends so the transport
 * never sees more than its rate limit.
 * </p>
 *
 * <h3>Failure Policy</h3>
 * <p>
 * A {@link NotificationException} (or any runtime error) from the
 * {@link Notifier} is logged and the message is dropped. There is no retry
 * queue: a late alert is worth less than the next one.
 * </p>
 *
 * @since 1.0.0
 */
public class NotificationDispatcher implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(NotificationDispatcher.class);

    private static final long POLL_MILLIS = 200;

    private final Notifier notifier;
    private final long minIntervalNanos;
    private final BlockingQueue<String> queue = new LinkedBlockingQueue<>();
    private final AtomicLong sent = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    private volatile boolean accepting = true;
    private volatile boolean running;
    private Thread drainThread;
    private long lastSendNanos;
    private boolean hasSent;

    /**
     * @param notifier    message transport; must not be {@code null}
     * @param minInterval minimum gap between two sends; must not be negative
     */
    public NotificationDispatcher(Notifier notifier, Duration minInterval) {
        this.notifier = Objects.requireNonNull(notifier, "notifier must not be null");
        Objects.requireNonNull(minInterval, "minInterval must not be null");
        if (minInterval.isNegative()) {
            throw new IllegalArgumentException("minInterval must not be negative, got: " + minInterval);
        }
        this.minIntervalNanos = minInterval.toNanos();
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    /**
     * Start the drain thread. Messages enqueued before this call are kept and
     * delivered once it runs.
     */
    public synchronized void start() {
        if (drainThread != null) {
            return;
        }
        running = true;
        drainThread = new Thread(this::drainLoop, "watchdog-notifier");
        drainThread.setDaemon(true);
        drainThread.start();
        LOG.info("Notification dispatcher started (min interval {}ms)",
                TimeUnit.NANOSECONDS.toMillis(minIntervalNanos));
    }

    /**
     * Stop accepting messages, deliver what is queued within {@code timeout},
     * then stop the drain thread. Anything still queued after that is logged
     * and discarded.
     *
     * @param timeout how long to wait for the queue to drain
     */
    public synchronized void close(Duration timeout) {
        accepting = false;
        running = false;
        if (drainThread != null) {
            try {
                drainThread.join(Math.max(1, timeout.toMillis()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (drainThread.isAlive()) {
                drainThread.interrupt();
            }
            drainThread = null;
        }
        List<String> leftover = new ArrayList<>();
        queue.drainTo(leftover);
        if (!leftover.isEmpty()) {
            LOG.warn("Discarding {} undelivered notification(s) on shutdown", leftover.size());
        }
        LOG.info("Notification dispatcher stopped: sent={}, failed={}", sent.get(), failed.get());
    }

    @Override
    public void close() {
        close(Duration.ofSeconds(10));
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Queue a message for delivery.
     *
     * @param message formatted message text
     * @return {@code false} if the dispatcher is closed and the message was
     *         not queued
     */
    public boolean enqueue(String message) {
        Objects.requireNonNull(message, "message must not be null");
        if (!accepting) {
            LOG.warn("Dispatcher closed, dropping message: {}", abbreviate(message));
            return false;
        }
        queue.add(message);
        return true;
    }

    public int queueSize() {
        return queue.size();
    }

    public long getSentCount() {
        return sent.get();
    }

    public long getFailedCount() {
        return failed.get();
    }

    // ---------------------------------------------------------------
    // Drain loop
    // ---------------------------------------------------------------

    private void drainLoop() {
        try {
            while (running || !queue.isEmpty()) {
                String message = queue.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
                if (message == null) {
                    continue;
                }
                pace();
                deliver(message);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.debug("Notification drain loop interrupted");
        }
    }

    private void pace() throws InterruptedException {
        if (!hasSent) {
            return;
        }
        long waitNanos = lastSendNanos + minIntervalNanos - System.nanoTime();
        if (waitNanos > 0) {
            TimeUnit.NANOSECONDS.sleep(waitNanos);
        }
    }

    private void deliver(String message) {
        lastSendNanos = System.nanoTime();
        hasSent = true;
        try {
            notifier.send(message);
            sent.incrementAndGet();
        } catch (NotificationException e) {
            failed.incrementAndGet();
            LOG.error("Failed to deliver notification (status {}), dropping: {}",
                    e.getStatusCode(), e.getMessage());
        } catch (RuntimeException e) {
            failed.incrementAndGet();
            LOG.error("Notifier threw unexpectedly, dropping message", e);
        }
    }

    private static String abbreviate(String message) {
        String firstLine = message.lines().findFirst().orElse("");
        return firstLine.length() > 80 ? firstLine.substring(0, 80) + "..." : firstLine;
    }
}
