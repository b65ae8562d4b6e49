/**
 * Agent entry point, deployment configuration and the status endpoint.
 */
package com.watchdog.agent;
