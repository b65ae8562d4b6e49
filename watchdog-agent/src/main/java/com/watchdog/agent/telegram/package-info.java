/**
 * Telegram Bot API transport and command polling.
 */
package com.watchdog.agent.telegram;
