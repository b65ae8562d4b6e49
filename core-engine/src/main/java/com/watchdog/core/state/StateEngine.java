package com.watchdog.core.state;

import com.watchdog.core.config.AlertSettings;
import com.watchdog.core.model.AlertAction;
import com.watchdog.core.model.FailureRecord;
import com.watchdog.core.model.FlappingInfo;
import com.watchdog.core.model.HealthState;
import com.watchdog.core.model.RecoveryInfo;
import com.watchdog.core.model.Transition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Failure, recovery, flap and cooldown bookkeeping for every monitored id,
 * persisted across restarts.
 *
 * <h3>States</h3>
 * <ul>
 * <li><b>Healthy</b>: no {@link FailureRecord} for the id.</li>
 * <li><b>Failing</b>: a record exists from the first failure until
 * recovery.</li>
 * <li><b>Flapping</b>: at least {@code flappingThreshold} transitions inside
 * the trailing {@code flappingWindow}.</li>
 * <li><b>Acknowledged</b>: orthogonal; the monitor still records everything
 * but sends nothing.</li>
 * </ul>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * All four collections sit behind one {@link ReentrantLock}. Every public
 * operation takes the lock for its full read-modify-write, and
 * {@link #save()} serializes a snapshot taken under the same lock. Callers
 * only ever receive copies.
 * </p>
 *
 * <h3>Persistence</h3>
 * <p>
 * The constructor loads the state file best-effort: a missing or unreadable
 * file starts empty. {@link #startAutoSave(Duration)} saves periodically and
 * {@link #shutdown()} flushes once more. A failed save is logged and retried
 * on the next tick.
 * </p>
 *
 * @since 1.0.0
 */
public class StateEngine implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(StateEngine.class);

    /** Transitions kept per id. */
    public static final int MAX_TRANSITIONS = 10;

    private static final long SAVER_STOP_TIMEOUT_SECONDS = 5;

    private final Path statePath;
    private final AlertSettings settings;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final ReentrantLock saveLock = new ReentrantLock();
    private final Map<String, FailureRecord> failures = new HashMap<>();
    private final Map<String, List<Transition>> transitions = new HashMap<>();
    private final Set<String> acknowledged = new HashSet<>();
    private final Map<String, Instant> sslExpiry = new HashMap<>();
    private Instant lastSaved;

    private ScheduledExecutorService autoSaver;

    /**
     * Create an engine and load any existing state from {@code statePath}.
     *
     * @param statePath state file; {@code null} keeps everything in memory
     * @param settings  cooldown and flap parameters; must not be {@code null}
     * @param clock     time source; must not be {@code null}
     */
    public StateEngine(Path statePath, AlertSettings settings, Clock clock) {
        this.statePath = statePath;
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        load();
    }

    public StateEngine(Path statePath, AlertSettings settings) {
        this(statePath, settings, Clock.systemUTC());
    }

    // ---------------------------------------------------------------
    // Failure / recovery
    // ---------------------------------------------------------------

    /**
     * Record a failed check.
     *
     * @param id    service id
     * @param error latest error message
     * @return {@link AlertAction#FIRST_FAILURE} for a new failure,
     *         {@link AlertAction#ONGOING_FAILURE} when the cooldown since the
     *         last alert has elapsed, {@link AlertAction#SUPPRESSED} otherwise
     */
    public AlertAction recordFailure(String id, String error) {
        Objects.requireNonNull(id, "id must not be null");
        return withLock(() -> {
            Instant now = clock.instant();
            FailureRecord record = failures.get(id);
            if (record == null) {
                failures.put(id, new FailureRecord(now, now, error, 1));
                return AlertAction.FIRST_FAILURE;
            }
            record.setConsecutiveFailures(record.getConsecutiveFailures() + 1);
            record.setError(error);

            Duration sinceLastAlert = Duration.between(record.getLastAlertSent(), now);
            if (sinceLastAlert.compareTo(settings.cooldown()) >= 0) {
                record.setLastAlertSent(now);
                return AlertAction.ONGOING_FAILURE;
            }
            return AlertAction.SUPPRESSED;
        });
    }

    /**
     * Close the open failure for {@code id}.
     *
     * @param id service id
     * @return the downtime summary, or empty if the id was not failing
     */
    public Optional<RecoveryInfo> recordRecovery(String id) {
        Objects.requireNonNull(id, "id must not be null");
        return withLock(() -> {
            FailureRecord record = failures.remove(id);
            if (record == null) {
                return Optional.<RecoveryInfo>empty();
            }
            Duration downtime = Duration.between(record.getFirstSeen(), clock.instant());
            return Optional.of(new RecoveryInfo(downtime, record.getConsecutiveFailures(), record.getFirstSeen()));
        });
    }

    /**
     * @param id service id
     * @return a copy of the open failure, or empty when healthy
     */
    public Optional<FailureRecord> getFailure(String id) {
        return withLock(() -> Optional.ofNullable(failures.get(id)).map(FailureRecord::copy));
    }

    /**
     * @return copies of every open failure keyed by id
     */
    public Map<String, FailureRecord> getAllFailures() {
        return withLock(() -> {
            Map<String, FailureRecord> copy = new LinkedHashMap<>();
            failures.forEach((id, record) -> copy.put(id, record.copy()));
            return copy;
        });
    }

    // ---------------------------------------------------------------
    // Flap detection
    // ---------------------------------------------------------------

    /**
     * Append a health transition. Call only when the observed health differs
     * from the previous observation.
     *
     * @param id       service id
     * @param newState the health just observed
     * @return whether the id is flapping after this transition
     */
    public boolean recordStateChange(String id, HealthState newState) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(newState, "newState must not be null");
        return withLock(() -> {
            List<Transition> log = transitions.computeIfAbsent(id, k -> new ArrayList<>());
            log.add(new Transition(clock.instant(), newState));
            while (log.size() > MAX_TRANSITIONS) {
                log.remove(0);
            }
            return inWindow(log).size() >= settings.getFlappingThreshold();
        });
    }

    public boolean isFlapping(String id) {
        return getFlappingInfo(id).isFlapping();
    }

    /**
     * @param id service id
     * @return the in-window transitions and the flap verdict
     */
    public FlappingInfo getFlappingInfo(String id) {
        return withLock(() -> {
            List<Transition> recent = inWindow(transitions.getOrDefault(id, Collections.emptyList()));
            return new FlappingInfo(recent.size() >= settings.getFlappingThreshold(), recent.size(), recent);
        });
    }

    public void clearFlappingHistory(String id) {
        runLocked(() -> transitions.remove(id));
    }

    public Duration getFlappingWindow() {
        return settings.flappingWindow();
    }

    private List<Transition> inWindow(List<Transition> log) {
        Instant now = clock.instant();
        Duration window = settings.flappingWindow();
        List<Transition> recent = new ArrayList<>();
        for (Transition t : log) {
            if (Duration.between(t.getTime(), now).compareTo(window) < 0) {
                recent.add(new Transition(t.getTime(), t.getState()));
            }
        }
        return recent;
    }

    // ---------------------------------------------------------------
    // Acknowledgement
    // ---------------------------------------------------------------

    /**
     * Mute notifications for {@code id}.
     *
     * @return {@code true} if the id was not already acknowledged
     */
    public boolean acknowledge(String id) {
        Objects.requireNonNull(id, "id must not be null");
        return withLock(() -> acknowledged.add(id));
    }

    /**
     * @return {@code true} if the id was acknowledged
     */
    public boolean unacknowledge(String id) {
        return withLock(() -> acknowledged.remove(id));
    }

    public boolean isAcknowledged(String id) {
        return withLock(() -> acknowledged.contains(id));
    }

    /**
     * @return acknowledged ids in natural order
     */
    public Set<String> getAcknowledged() {
        return withLock(() -> new TreeSet<>(acknowledged));
    }

    // ---------------------------------------------------------------
    // Certificate expiry cache
    // ---------------------------------------------------------------

    public void updateSslExpiry(String id, Instant validTo) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(validTo, "validTo must not be null");
        runLocked(() -> sslExpiry.put(id, validTo));
    }

    public Optional<Instant> getSslExpiry(String id) {
        return withLock(() -> Optional.ofNullable(sslExpiry.get(id)));
    }

    public Map<String, Instant> getAllSslExpiry() {
        return withLock(() -> new LinkedHashMap<>(sslExpiry));
    }

    // ---------------------------------------------------------------
    // Stats
    // ---------------------------------------------------------------

    public StateStats getStats() {
        return withLock(() -> {
            int flapping = 0;
            int tracked = 0;
            for (List<Transition> log : transitions.values()) {
                if (log.isEmpty()) {
                    continue;
                }
                tracked++;
                if (inWindow(log).size() >= settings.getFlappingThreshold()) {
                    flapping++;
                }
            }
            return new StateStats(failures.size(), acknowledged.size(), tracked, flapping,
                    sslExpiry.size(), lastSaved);
        });
    }

    // ---------------------------------------------------------------
    // Persistence
    // ---------------------------------------------------------------

    /**
     * Write the current state to disk. Failures are logged, not thrown.
     *
     * @return {@code true} if the file was written
     */
    public boolean save() {
        if (statePath == null) {
            return false;
        }
        saveLock.lock();
        try {
            PersistedState snapshot = withLock(this::snapshot);
            JsonFileStore.write(statePath, snapshot);
            runLocked(() -> lastSaved = snapshot.getLastSaved());
            LOG.debug("Saved state: {} failure(s), {} acknowledged", snapshot.getFailures().size(),
                    snapshot.getAcknowledged().size());
            return true;
        } catch (IOException e) {
            LOG.error("Failed to save state to {}, will retry on next save", statePath, e);
            return false;
        } finally {
            saveLock.unlock();
        }
    }

    /**
     * Replace in-memory state with the contents of the state file. A missing
     * or corrupt file leaves the engine empty.
     *
     * @return {@code true} if a file was read
     */
    public boolean load() {
        if (statePath == null) {
            return false;
        }
        Optional<PersistedState> loaded;
        try {
            loaded = JsonFileStore.read(statePath, PersistedState.class);
        } catch (IOException e) {
            LOG.warn("State file {} is unreadable, starting fresh: {}", statePath, e.getMessage());
            runLocked(this::clearAll);
            return false;
        }
        if (loaded.isEmpty()) {
            LOG.info("No state file at {}, starting fresh", statePath);
            return false;
        }
        PersistedState state = loaded.get();
        runLocked(() -> {
            clearAll();
            state.getFailures().forEach((id, record) -> {
                if (record != null && record.getFirstSeen() != null && record.getLastAlertSent() != null) {
                    FailureRecord copy = record.copy();
                    copy.setConsecutiveFailures(Math.max(1, copy.getConsecutiveFailures()));
                    failures.put(id, copy);
                } else {
                    LOG.warn("Skipping incomplete failure record for {}", id);
                }
            });
            state.getTransitions().forEach((id, log) -> {
                List<Transition> valid = new ArrayList<>();
                for (Transition t : PersistedState.copyOf(log)) {
                    if (t != null && t.getTime() != null && t.getState() != null) {
                        valid.add(t);
                    }
                }
                if (valid.size() > MAX_TRANSITIONS) {
                    valid = new ArrayList<>(valid.subList(valid.size() - MAX_TRANSITIONS, valid.size()));
                }
                if (!valid.isEmpty()) {
                    transitions.put(id, valid);
                }
            });
            acknowledged.addAll(state.getAcknowledged());
            state.getSslExpiry().forEach((id, expiry) -> {
                if (expiry != null) {
                    sslExpiry.put(id, expiry);
                }
            });
            lastSaved = state.getLastSaved();
        });
        LOG.info("Loaded state from {}: {} failure(s), {} acknowledged, last saved {}",
                statePath, state.getFailures().size(), state.getAcknowledged().size(), state.getLastSaved());
        return true;
    }

    /**
     * Save every {@code interval} on a daemon thread until {@link #shutdown()}.
     */
    public synchronized void startAutoSave(Duration interval) {
        Objects.requireNonNull(interval, "interval must not be null");
        if (autoSaver != null) {
            return;
        }
        autoSaver = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "watchdog-state-saver");
            t.setDaemon(true);
            return t;
        });
        long millis = interval.toMillis();
        autoSaver.scheduleAtFixedRate(this::save, millis, millis, TimeUnit.MILLISECONDS);
        LOG.info("State auto-save every {}s to {}", interval.toSeconds(), statePath);
    }

    /**
     * Stop auto-save and flush state one last time.
     */
    public synchronized void shutdown() {
        if (autoSaver != null) {
            autoSaver.shutdown();
            try {
                if (!autoSaver.awaitTermination(SAVER_STOP_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                    LOG.warn("State auto-save did not stop within {}s", SAVER_STOP_TIMEOUT_SECONDS);
                    autoSaver.shutdownNow();
                }
            } catch (InterruptedException e) {
                autoSaver.shutdownNow();
                Thread.currentThread().interrupt();
            }
            autoSaver = null;
        }
        save();
    }

    @Override
    public void close() {
        shutdown();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private PersistedState snapshot() {
        PersistedState state = new PersistedState();
        Map<String, FailureRecord> failureCopy = new LinkedHashMap<>();
        failures.forEach((id, record) -> failureCopy.put(id, record.copy()));
        state.setFailures(failureCopy);
        Map<String, List<Transition>> transitionCopy = new LinkedHashMap<>();
        transitions.forEach((id, log) -> transitionCopy.put(id, new ArrayList<>(log)));
        state.setTransitions(transitionCopy);
        state.setAcknowledged(acknowledged);
        state.setSslExpiry(new LinkedHashMap<>(sslExpiry));
        state.setLastSaved(clock.instant());
        return state;
    }

    private void clearAll() {
        failures.clear();
        transitions.clear();
        acknowledged.clear();
        sslExpiry.clear();
        lastSaved = null;
    }

    private <T> T withLock(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private void runLocked(Runnable action) {
        lock.lock();
        try {
            action.run();
        } finally {
            lock.unlock();
        }
    }
}
