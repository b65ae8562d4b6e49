package com.watchdog.core.config;

import java.util.List;

/**
 * Resource usage limits (percent) and the certificate expiry warning window
 * (days).
 */
public class ThresholdSettings {

    private double disk = 85;
    private double ram = 90;
    private double cpu = 95;
    private int sslDays = 14;

    /**
     * @param resource {@code disk}, {@code ram} or {@code cpu}
     * @return the usage percentage at or above which the resource is unhealthy
     * @throws IllegalArgumentException for an unknown resource name
     */
    public double forResource(String resource) {
        return switch (resource) {
            case "disk" -> disk;
            case "ram" -> ram;
            case "cpu" -> cpu;
            default -> throw new IllegalArgumentException("Unknown resource: '" + resource
                    + "'. Supported: disk, ram, cpu");
        };
    }

    void collectErrors(List<String> errors) {
        requirePercent(errors, "thresholds.disk", disk);
        requirePercent(errors, "thresholds.ram", ram);
        requirePercent(errors, "thresholds.cpu", cpu);
        if (sslDays < 0) {
            errors.add("thresholds.sslDays must be >= 0, got: " + sslDays);
        }
    }

    private static void requirePercent(List<String> errors, String name, double value) {
        if (value <= 0 || value > 100) {
            errors.add(name + " must be in (0, 100], got: " + value);
        }
    }

    public double getDisk() {
        return disk;
    }

    public void setDisk(double disk) {
        this.disk = disk;
    }

    public double getRam() {
        return ram;
    }

    public void setRam(double ram) {
        this.ram = ram;
    }

    public double getCpu() {
        return cpu;
    }

    public void setCpu(double cpu) {
        this.cpu = cpu;
    }

    public int getSslDays() {
        return sslDays;
    }

    public void setSslDays(int sslDays) {
        this.sslDays = sslDays;
    }
}
