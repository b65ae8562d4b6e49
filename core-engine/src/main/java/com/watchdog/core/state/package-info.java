/**
 * Durable failure, flap and acknowledgement state.
 *
 * <p>
 * {@link com.watchdog.core.state.StateEngine} is the single owner of that
 * state; {@link com.watchdog.core.state.JsonFileStore} handles the JSON file
 * on disk.
 * </p>
 */
package com.watchdog.core.state;
