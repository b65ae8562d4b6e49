/**
 * Alert delivery: message rendering, the {@link com.watchdog.core.notify.Notifier}
 * transport contract and the rate-limited
 * {@link com.watchdog.core.notify.NotificationDispatcher}.
 */
package com.watchdog.core.notify;
