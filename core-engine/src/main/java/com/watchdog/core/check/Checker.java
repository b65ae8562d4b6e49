package com.watchdog.core.check;

import com.watchdog.core.model.CheckResult;
import com.watchdog.core.model.MonitoredTarget;

/**
 * Probe for one kind of target.
 *
 * <h3>Contract</h3>
 * <ul>
 * <li>A target that is down is an unhealthy {@link CheckResult}, never an
 * exception.</li>
 * <li>Implementations enforce their own timeout; the monitor waits for every
 * checker in a cycle to return.</li>
 * <li>An exception means the probe itself could not run. The monitor logs it
 * and records nothing for that target this cycle.</li>
 * </ul>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface Checker {

    /**
     * @param target the target to probe
     * @return the observed health; never {@code null}
     * @throws Exception if the probe could not be executed
     */
    CheckResult check(MonitoredTarget target) throws Exception;
}
