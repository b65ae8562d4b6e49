package com.watchdog.core.config;

/**
 * A container, PM2 process or systemd unit to watch.
 */
public class ServiceDefinition {

    private String name;
    private boolean hasHealthCheck;

    public ServiceDefinition() {
    }

    public ServiceDefinition(String name, boolean hasHealthCheck) {
        this.name = name;
        this.hasHealthCheck = hasHealthCheck;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public boolean isHasHealthCheck() {
        return hasHealthCheck;
    }

    public void setHasHealthCheck(boolean hasHealthCheck) {
        this.hasHealthCheck = hasHealthCheck;
    }

    @Override
    public String toString() {
        return "ServiceDefinition{name='" + name + "', hasHealthCheck=" + hasHealthCheck + '}';
    }
}
