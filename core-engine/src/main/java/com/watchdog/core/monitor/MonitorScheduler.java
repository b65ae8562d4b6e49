package com.watchdog.core.monitor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.watchdog.core.check.Checker;
import com.watchdog.core.check.CheckerRegistry;
import com.watchdog.core.config.IntervalSettings;
import com.watchdog.core.detection.AnomalyDetector;
import com.watchdog.core.detection.BufferSnapshot;
import com.watchdog.core.model.CheckCategory;
import com.watchdog.core.model.CheckResult;
import com.watchdog.core.model.MonitoredTarget;
import com.watchdog.core.state.JsonFileStore;
import com.watchdog.core.state.StateEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owns the periodic timers and fans each category's checks out to a worker
 * pool.
 *
 * <h3>Scheduling</h3>
 * <p>
 * Every {@link CheckCategory} gets its own fixed-rate timer with the period
 * from {@link IntervalSettings}. Within one firing all targets of that
 * category are checked concurrently, and the cycle ends once every check has
 * returned or failed.
 * </p>
 *
 * <h3>Error Handling</h3>
 * <p>
 * A checker that throws, or a target without a registered checker, is logged
 * and produces no sample this cycle. Nothing is recorded as a failure and
 * the next tick simply tries again. A timer body never lets an exception
 * escape, since that would cancel the timer.
 * </p>
 *
 * <h3>Lifecycle</h3>
 * <p>
 * {@link #start()} restores anomaly history, starts state auto-save, arms the
 * timers and runs a warm-up pass over every category. {@link #shutdown()}
 * stops the timers and flushes both the state file and the anomaly snapshot.
 * </p>
 *
 * @since 1.0.0
 */
public class MonitorScheduler implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(MonitorScheduler.class);

    private final CheckerRegistry checkers;
    private final CheckResultHandler handler;
    private final StateEngine state;
    private final AnomalyDetector anomalyDetector;
    private final IntervalSettings intervals;
    private final Path anomalyPath;

    private final ExecutorService workers;
    private final ScheduledExecutorService timers;
    private final Map<CheckCategory, ScheduledFuture<?>> jobs =
            Collections.synchronizedMap(new EnumMap<>(CheckCategory.class));

    private final AtomicLong cyclesRun = new AtomicLong();
    private final AtomicLong checksRun = new AtomicLong();
    private final AtomicLong checkErrors = new AtomicLong();
    private final Object anomalySaveLock = new Object();

    private volatile List<MonitoredTarget> targets;
    private volatile boolean running;
    private ScheduledFuture<?> anomalySaver;

    private MonitorScheduler(Builder builder) {
        this.checkers = Objects.requireNonNull(builder.checkers, "checkers must not be null");
        this.handler = Objects.requireNonNull(builder.handler, "handler must not be null");
        this.state = Objects.requireNonNull(builder.state, "state must not be null");
        this.anomalyDetector = Objects.requireNonNull(builder.anomalyDetector, "anomalyDetector must not be null");
        this.intervals = Objects.requireNonNull(builder.intervals, "intervals must not be null");
        this.targets = List.copyOf(Objects.requireNonNull(builder.targets, "targets must not be null"));
        this.anomalyPath = builder.anomalyPath;
        if (builder.workerThreads <= 0) {
            throw new IllegalArgumentException("workerThreads must be > 0, got: " + builder.workerThreads);
        }
        this.workers = Executors.newFixedThreadPool(builder.workerThreads, daemonThreads("watchdog-check"));
        this.timers = Executors.newScheduledThreadPool(CheckCategory.values().length + 1,
                daemonThreads("watchdog-timer"));
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    /**
     * Arm all timers and run one warm-up pass. Calling it twice is a no-op.
     */
    public void start() {
        if (arm()) {
            runAllOnce();
            LOG.info("Monitor started with {} scheduled job(s)", jobs.size());
        }
    }

    private synchronized boolean arm() {
        if (running) {
            LOG.warn("Monitor already running");
            return false;
        }
        running = true;
        LOG.info("Starting monitor for {} target(s)", targets.size());

        loadAnomalySnapshot();
        long saveMillis = intervals.stateSaveInterval().toMillis();
        state.startAutoSave(intervals.stateSaveInterval());
        if (anomalyPath != null) {
            anomalySaver = timers.scheduleAtFixedRate(this::saveAnomalySnapshotQuietly,
                    saveMillis, saveMillis, TimeUnit.MILLISECONDS);
        }

        for (CheckCategory category : CheckCategory.values()) {
            long periodMillis = intervals.intervalFor(category).toMillis();
            jobs.put(category, timers.scheduleAtFixedRate(() -> runScheduled(category),
                    periodMillis, periodMillis, TimeUnit.MILLISECONDS));
            LOG.info("Scheduled {} checks every {}s", category.label(), periodMillis / 1000);
        }
        return true;
    }

    /**
     * Cancel all timers. In-flight cycles finish on their own.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        LOG.info("Stopping monitor...");
        jobs.values().forEach(job -> job.cancel(false));
        jobs.clear();
        if (anomalySaver != null) {
            anomalySaver.cancel(false);
            anomalySaver = null;
        }
        running = false;
        LOG.info("Monitor stopped");
    }

    /**
     * Stop, release the thread pools and flush all persistent state.
     */
    public synchronized void shutdown() {
        LOG.info("Monitor shutting down...");
        stop();
        timers.shutdownNow();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
            // a periodic anomaly save may still be writing
            if (!timers.awaitTermination(10, TimeUnit.SECONDS)) {
                LOG.warn("Monitor timers did not stop within 10s");
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        saveAnomalySnapshotQuietly();
        state.shutdown();
    }

    @Override
    public void close() {
        shutdown();
    }

    // ---------------------------------------------------------------
    // Check cycles
    // ---------------------------------------------------------------

    /**
     * Run every category once, concurrently, and wait for all of them.
     * Independent of the timers; used for the startup warm-up.
     */
    public void runAllOnce() {
        LOG.info("Running initial health checks...");
        List<CompletableFuture<Integer>> cycles = new ArrayList<>();
        for (CheckCategory category : CheckCategory.values()) {
            cycles.add(CompletableFuture.supplyAsync(() -> runCategory(category), timers));
        }
        CompletableFuture.allOf(cycles.toArray(new CompletableFuture[0])).join();
        LOG.info("Initial health checks complete");
    }

    /**
     * Check every target in {@code category} concurrently and wait for all
     * of them.
     *
     * @param category category to run
     * @return number of targets that produced a result
     */
    public int runCategory(CheckCategory category) {
        List<MonitoredTarget> batch = new ArrayList<>();
        for (MonitoredTarget target : targets) {
            if (target.getCategory() == category) {
                batch.add(target);
            }
        }
        if (batch.isEmpty()) {
            return 0;
        }

        LOG.debug("Checking {} {} target(s)", batch.size(), category.label());
        List<CompletableFuture<Boolean>> checks = new ArrayList<>(batch.size());
        for (MonitoredTarget target : batch) {
            checks.add(CompletableFuture.supplyAsync(() -> checkTarget(target), workers));
        }
        CompletableFuture.allOf(checks.toArray(new CompletableFuture[0])).join();

        int completed = 0;
        for (CompletableFuture<Boolean> check : checks) {
            if (check.join()) {
                completed++;
            }
        }
        cyclesRun.incrementAndGet();
        LOG.debug("{} check complete: {}/{} produced a result", category.label(), completed, batch.size());
        return completed;
    }

    private void runScheduled(CheckCategory category) {
        try {
            runCategory(category);
        } catch (RuntimeException e) {
            LOG.error("{} check cycle failed", category.label(), e);
        }
    }

    private boolean checkTarget(MonitoredTarget target) {
        Optional<Checker> checker = checkers.forTarget(target);
        if (checker.isEmpty()) {
            LOG.warn("No checker registered for type '{}', skipping {}", target.getType(), target.getId());
            return false;
        }
        checksRun.incrementAndGet();
        try {
            CheckResult result = checker.get().check(target);
            if (result == null) {
                LOG.warn("Checker for {} returned no result", target.getId());
                return false;
            }
            handler.handle(target, result);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Check for {} interrupted", target.getId());
            return false;
        } catch (Exception e) {
            checkErrors.incrementAndGet();
            LOG.error("Check failed for {}: {}", target.getId(), e.getMessage(), e);
            return false;
        }
    }

    // ---------------------------------------------------------------
    // Targets and stats
    // ---------------------------------------------------------------

    /**
     * Replace the monitored targets. Takes effect from the next cycle.
     */
    public void updateTargets(List<MonitoredTarget> newTargets) {
        this.targets = List.copyOf(Objects.requireNonNull(newTargets, "targets must not be null"));
        LOG.info("Monitoring {} target(s)", targets.size());
    }

    public List<MonitoredTarget> getTargets() {
        return targets;
    }

    public boolean isRunning() {
        return running;
    }

    public MonitorStats getStats() {
        return new MonitorStats(running, jobs.size(), targets.size(), cyclesRun.get(), checksRun.get(),
                checkErrors.get(), state.getStats(), anomalyDetector.getSummary());
    }

    // ---------------------------------------------------------------
    // Anomaly snapshot
    // ---------------------------------------------------------------

    private void loadAnomalySnapshot() {
        if (anomalyPath == null) {
            return;
        }
        Optional<JsonNode> document;
        try {
            document = JsonFileStore.read(anomalyPath, JsonNode.class);
        } catch (IOException e) {
            LOG.warn("Anomaly history {} is unreadable, starting fresh: {}", anomalyPath, e.getMessage());
            return;
        }
        if (document.isEmpty() || !document.get().isObject()) {
            return;
        }

        Map<String, BufferSnapshot> snapshot = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = document.get().fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            try {
                snapshot.put(field.getKey(),
                        JsonFileStore.mapper().treeToValue(field.getValue(), BufferSnapshot.class));
            } catch (JsonProcessingException | IllegalArgumentException e) {
                LOG.warn("Skipping anomaly history for {}: {}", field.getKey(), e.getMessage());
            }
        }
        anomalyDetector.importSnapshot(snapshot);
    }

    private void saveAnomalySnapshotQuietly() {
        if (anomalyPath == null) {
            return;
        }
        synchronized (anomalySaveLock) {
            try {
                JsonFileStore.write(anomalyPath, anomalyDetector.exportSnapshot());
            } catch (IOException e) {
                LOG.error("Failed to save anomaly history to {}", anomalyPath, e);
            }
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link MonitorScheduler}. All collaborators except
     * {@code anomalyPath} are required.
     */
    public static class Builder {
        private CheckerRegistry checkers;
        private CheckResultHandler handler;
        private StateEngine state;
        private AnomalyDetector anomalyDetector;
        private IntervalSettings intervals = new IntervalSettings();
        private List<MonitoredTarget> targets = List.of();
        private Path anomalyPath;
        private int workerThreads = 8;

        public Builder checkers(CheckerRegistry checkers) {
            this.checkers = checkers;
            return this;
        }

        public Builder handler(CheckResultHandler handler) {
            this.handler = handler;
            return this;
        }

        public Builder state(StateEngine state) {
            this.state = state;
            return this;
        }

        public Builder anomalyDetector(AnomalyDetector anomalyDetector) {
            this.anomalyDetector = anomalyDetector;
            return this;
        }

        public Builder intervals(IntervalSettings intervals) {
            this.intervals = intervals;
            return this;
        }

        public Builder targets(List<MonitoredTarget> targets) {
            this.targets = targets;
            return this;
        }

        /** File for the anomaly history snapshot; {@code null} disables it. */
        public Builder anomalyPath(Path anomalyPath) {
            this.anomalyPath = anomalyPath;
            return this;
        }

        public Builder workerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
            return this;
        }

        public MonitorScheduler build() {
            return new MonitorScheduler(this);
        }
    }
}
