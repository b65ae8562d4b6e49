package com.watchdog.core.model;

import java.util.Objects;

/**
 * A single thing the monitor checks: a container, a managed process, an OS
 * service, an HTTP endpoint, a TLS certificate or a system resource.
 *
 * <p>
 * The {@link #getId() id} is the stable join key used by the state engine,
 * the anomaly detector and every alert. It is derived as
 * {@code <type>:<name>}, e.g. {@code docker:redis}, {@code http:https://x.io}
 * or {@code resource:disk}.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}; {@code category}, {@code type} and {@code name}
 * are required.
 * </p>
 *
 * @since 1.0.0
 */
public final class MonitoredTarget {

    public static final String TYPE_HTTP = "http";
    public static final String TYPE_SSL = "ssl";
    public static final String TYPE_RESOURCE = "resource";

    private final String id;
    private final CheckCategory category;
    private final String type;
    private final String name;
    private final String url;
    private final int expectedStatus;
    private final boolean hasHealthCheck;

    private MonitoredTarget(Builder builder) {
        this.category = Objects.requireNonNull(builder.category, "category must not be null");
        this.type = Objects.requireNonNull(builder.type, "type must not be null");
        this.name = Objects.requireNonNull(builder.name, "name must not be null");
        this.url = builder.url;
        this.expectedStatus = builder.expectedStatus;
        this.hasHealthCheck = builder.hasHealthCheck;
        this.id = type + ":" + name;
    }

    // ---------------------------------------------------------------
    // Factories
    // ---------------------------------------------------------------

    /**
     * @param type           checker type, e.g. {@code docker}, {@code pm2},
     *                       {@code systemd}
     * @param name           container, process or unit name
     * @param hasHealthCheck whether the service exposes its own health status
     * @return a target in {@link CheckCategory#SERVICES}
     */
    public static MonitoredTarget service(String type, String name, boolean hasHealthCheck) {
        return builder()
                .category(CheckCategory.SERVICES)
                .type(type)
                .name(name)
                .hasHealthCheck(hasHealthCheck)
                .build();
    }

    /**
     * @param url            endpoint URL, also used as the target name
     * @param expectedStatus expected HTTP status code
     * @return a target in {@link CheckCategory#ENDPOINTS}
     */
    public static MonitoredTarget endpoint(String url, int expectedStatus) {
        return builder()
                .category(CheckCategory.ENDPOINTS)
                .type(TYPE_HTTP)
                .name(url)
                .url(url)
                .expectedStatus(expectedStatus)
                .build();
    }

    /**
     * @param url HTTPS URL whose certificate is checked
     * @return a target in {@link CheckCategory#SSL}
     */
    public static MonitoredTarget certificate(String url) {
        return builder()
                .category(CheckCategory.SSL)
                .type(TYPE_SSL)
                .name(url)
                .url(url)
                .build();
    }

    /**
     * @param resource {@code disk}, {@code ram} or {@code cpu}
     * @return a target in {@link CheckCategory#RESOURCES}
     */
    public static MonitoredTarget resource(String resource) {
        return builder()
                .category(CheckCategory.RESOURCES)
                .type(TYPE_RESOURCE)
                .name(resource)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link MonitoredTarget} instances.
     */
    public static class Builder {
        private CheckCategory category;
        private String type;
        private String name;
        private String url;
        private int expectedStatus = 200;
        private boolean hasHealthCheck;

        public Builder category(CheckCategory category) {
            this.category = category;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder url(String url) {
            this.url = url;
            return this;
        }

        public Builder expectedStatus(int expectedStatus) {
            this.expectedStatus = expectedStatus;
            return this;
        }

        public Builder hasHealthCheck(boolean hasHealthCheck) {
            this.hasHealthCheck = hasHealthCheck;
            return this;
        }

        public MonitoredTarget build() {
            return new MonitoredTarget(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public CheckCategory getCategory() {
        return category;
    }

    public String getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    /**
     * @return the URL for endpoint and certificate targets, {@code null}
     *         otherwise
     */
    public String getUrl() {
        return url;
    }

    public int getExpectedStatus() {
        return expectedStatus;
    }

    public boolean hasHealthCheck() {
        return hasHealthCheck;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MonitoredTarget that))
            return false;
        return id.equals(that.id) && category == that.category;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, category);
    }

    @Override
    public String toString() {
        return "MonitoredTarget{" +
                "id='" + id + '\'' +
                ", category=" + category +
                '}';
    }
}
