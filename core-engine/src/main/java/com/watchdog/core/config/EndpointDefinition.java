package com.watchdog.core.config;

/**
 * An HTTP endpoint to watch. HTTPS endpoints also get a certificate check.
 */
public class EndpointDefinition {

    private String url;
    private int expectedStatus = 200;

    public EndpointDefinition() {
    }

    public EndpointDefinition(String url, int expectedStatus) {
        this.url = url;
        this.expectedStatus = expectedStatus;
    }

    public boolean isHttps() {
        return url != null && url.startsWith("https://");
    }

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    public int getExpectedStatus() {
        return expectedStatus;
    }

    public void setExpectedStatus(int expectedStatus) {
        this.expectedStatus = expectedStatus;
    }

    @Override
    public String toString() {
        return "EndpointDefinition{url='" + url + "', expectedStatus=" + expectedStatus + '}';
    }
}
