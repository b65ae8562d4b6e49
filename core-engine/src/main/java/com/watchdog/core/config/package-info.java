/**
 * YAML configuration for the watchdog.
 *
 * <p>
 * {@link com.watchdog.core.config.ConfigLoader} binds {@code watchdog.yml}
 * onto {@link com.watchdog.core.config.WatchdogConfig}. Every section has
 * defaults, so the monitor runs with no file at all.
 * </p>
 */
package com.watchdog.core.config;
