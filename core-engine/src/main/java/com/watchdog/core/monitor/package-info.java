/**
 * The monitoring loop: per-category timers in
 * {@link com.watchdog.core.monitor.MonitorScheduler}, result handling in
 * {@link com.watchdog.core.monitor.CheckResultHandler} and operator commands.
 */
package com.watchdog.core.monitor;
