package com.watchdog.core.monitor;

import com.watchdog.core.state.StateStats;

import java.util.Map;

/**
 * Point-in-time view of the scheduler, the state engine and the anomaly
 * detector.
 */
public final class MonitorStats {

    private final boolean running;
    private final int activeJobs;
    private final int targets;
    private final long cyclesRun;
    private final long checksRun;
    private final long checkErrors;
    private final StateStats state;
    private final Map<String, Object> anomalies;

    MonitorStats(boolean running, int activeJobs, int targets, long cyclesRun, long checksRun,
            long checkErrors, StateStats state, Map<String, Object> anomalies) {
        this.running = running;
        this.activeJobs = activeJobs;
        this.targets = targets;
        this.cyclesRun = cyclesRun;
        this.checksRun = checksRun;
        this.checkErrors = checkErrors;
        this.state = state;
        this.anomalies = Map.copyOf(anomalies);
    }

    public boolean isRunning() {
        return running;
    }

    public int getActiveJobs() {
        return activeJobs;
    }

    public int getTargets() {
        return targets;
    }

    public long getCyclesRun() {
        return cyclesRun;
    }

    public long getChecksRun() {
        return checksRun;
    }

    /**
     * @return checks whose probe threw instead of returning a result
     */
    public long getCheckErrors() {
        return checkErrors;
    }

    public StateStats getState() {
        return state;
    }

    public Map<String, Object> getAnomalies() {
        return anomalies;
    }

    @Override
    public String toString() {
        return "MonitorStats{" +
                "running=" + running +
                ", activeJobs=" + activeJobs +
                ", targets=" + targets +
                ", cyclesRun=" + cyclesRun +
                ", checksRun=" + checksRun +
                ", checkErrors=" + checkErrors +
                ", state=" + state +
                '}';
    }
}
