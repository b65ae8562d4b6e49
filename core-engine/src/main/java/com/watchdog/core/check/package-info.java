/**
 * The probe contract consumed by the monitor.
 */
package com.watchdog.core.check;
