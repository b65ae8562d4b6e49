/**
 * Concrete health probes: containers, process managers, system units, HTTP
 * endpoints, TLS certificates and host resources.
 */
package com.watchdog.agent.probe;
