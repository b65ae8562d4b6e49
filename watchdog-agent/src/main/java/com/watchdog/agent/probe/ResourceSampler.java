package com.watchdog.agent.probe;

import java.io.IOException;

/**
 * Source of host resource usage readings.
 */
@FunctionalInterface
public interface ResourceSampler {

    /**
     * @param resource {@code disk}, {@code ram} or {@code cpu}
     * @return current usage in percent, 0 to 100
     * @throws IOException if the reading is unavailable
     */
    double usagePercent(String resource) throws IOException;
}
