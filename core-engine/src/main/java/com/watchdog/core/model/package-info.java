/**
 * Domain model shared by the state engine, the scheduler and the notifier.
 *
 * <ul>
 * <li>{@link com.watchdog.core.model.MonitoredTarget}: what is checked</li>
 * <li>{@link com.watchdog.core.model.CheckResult}: what a probe observed</li>
 * <li>{@link com.watchdog.core.model.FailureRecord} and
 * {@link com.watchdog.core.model.Transition}: persisted health state</li>
 * <li>{@link com.watchdog.core.model.Alert}: what the monitor decided to
 * say</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.watchdog.core.model;
