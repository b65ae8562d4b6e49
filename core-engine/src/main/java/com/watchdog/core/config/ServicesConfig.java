package com.watchdog.core.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Everything the monitor watches, grouped by probe type.
 *
 * <pre>
 * services:
 *   docker:
 *     - name: redis
 *       hasHealthCheck: true
 *   pm2:
 *     - name: api
 *   systemd:
 *     - name: nginx
 *   endpoints:
 *     - url: https://example.com/health
 *       expectedStatus: 200
 *   resources: [disk, ram, cpu]
 * </pre>
 */
public class ServicesConfig {

    static final Set<String> KNOWN_RESOURCES = Set.of("disk", "ram", "cpu");

    private List<ServiceDefinition> docker = new ArrayList<>();
    private List<ServiceDefinition> pm2 = new ArrayList<>();
    private List<ServiceDefinition> systemd = new ArrayList<>();
    private List<EndpointDefinition> endpoints = new ArrayList<>();
    private List<String> resources = new ArrayList<>(List.of("disk", "ram", "cpu"));

    void collectErrors(List<String> errors) {
        checkNames(errors, "docker", docker);
        checkNames(errors, "pm2", pm2);
        checkNames(errors, "systemd", systemd);
        for (int i = 0; i < endpoints.size(); i++) {
            EndpointDefinition endpoint = endpoints.get(i);
            String url = endpoint == null ? null : endpoint.getUrl();
            if (url == null || !(url.startsWith("http://") || url.startsWith("https://"))) {
                errors.add("services.endpoints[" + i + "] requires an http(s) 'url', got: " + url);
            } else if (endpoint.getExpectedStatus() < 100 || endpoint.getExpectedStatus() > 599) {
                errors.add("services.endpoints[" + i + "] 'expectedStatus' must be a valid HTTP status, got: "
                        + endpoint.getExpectedStatus());
            }
        }
        for (String resource : resources) {
            if (!KNOWN_RESOURCES.contains(resource)) {
                errors.add("services.resources contains unknown resource '" + resource
                        + "'. Supported: disk, ram, cpu");
            }
        }
    }

    private static void checkNames(List<String> errors, String type, List<ServiceDefinition> defs) {
        for (int i = 0; i < defs.size(); i++) {
            ServiceDefinition def = defs.get(i);
            if (def == null || def.getName() == null || def.getName().isBlank()) {
                errors.add("services." + type + "[" + i + "] requires 'name'");
            }
        }
    }

    public List<ServiceDefinition> getDocker() {
        return docker;
    }

    public void setDocker(List<ServiceDefinition> docker) {
        this.docker = docker != null ? new ArrayList<>(docker) : new ArrayList<>();
    }

    public List<ServiceDefinition> getPm2() {
        return pm2;
    }

    public void setPm2(List<ServiceDefinition> pm2) {
        this.pm2 = pm2 != null ? new ArrayList<>(pm2) : new ArrayList<>();
    }

    public List<ServiceDefinition> getSystemd() {
        return systemd;
    }

    public void setSystemd(List<ServiceDefinition> systemd) {
        this.systemd = systemd != null ? new ArrayList<>(systemd) : new ArrayList<>();
    }

    public List<EndpointDefinition> getEndpoints() {
        return endpoints;
    }

    public void setEndpoints(List<EndpointDefinition> endpoints) {
        this.endpoints = endpoints != null ? new ArrayList<>(endpoints) : new ArrayList<>();
    }

    public List<String> getResources() {
        return resources;
    }

    public void setResources(List<String> resources) {
        this.resources = resources != null ? new ArrayList<>(resources) : new ArrayList<>();
    }
}
