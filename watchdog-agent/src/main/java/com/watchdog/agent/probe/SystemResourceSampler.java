package com.watchdog.agent.probe;

import com.sun.management.OperatingSystemMXBean;

import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.nio.file.FileStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Reads resource usage from the local host.
 *
 * <p>
 * Disk usage is measured on the file store holding {@code root}. Memory usage
 * prefers {@code MemAvailable} from {@code /proc/meminfo} so page cache is not
 * counted as used, and falls back to the platform MXBean elsewhere.
 * </p>
 */
public class SystemResourceSampler implements ResourceSampler {

    private static final Path MEMINFO = Path.of("/proc/meminfo");

    private final Path root;
    private final OperatingSystemMXBean os;

    public SystemResourceSampler() {
        this(Path.of("/"));
    }

    public SystemResourceSampler(Path root) {
        this.root = Objects.requireNonNull(root, "root must not be null");
        this.os = ManagementFactory.getPlatformMXBean(OperatingSystemMXBean.class);
    }

    @Override
    public double usagePercent(String resource) throws IOException {
        return switch (resource) {
            case "disk" -> diskUsage();
            case "ram" -> memoryUsage();
            case "cpu" -> cpuUsage();
            default -> throw new IllegalArgumentException("Unknown resource: " + resource);
        };
    }

    private double diskUsage() throws IOException {
        FileStore store = Files.getFileStore(root);
        long total = store.getTotalSpace();
        if (total <= 0) {
            throw new IOException("File store for " + root + " reports no capacity");
        }
        return percent(total - store.getUnallocatedSpace(), total);
    }

    private double memoryUsage() throws IOException {
        if (Files.isReadable(MEMINFO)) {
            return parseMeminfo(Files.readAllLines(MEMINFO));
        }
        long total = os.getTotalMemorySize();
        if (total <= 0) {
            throw new IOException("Total memory size unavailable");
        }
        return percent(total - os.getFreeMemorySize(), total);
    }

    private double cpuUsage() throws IOException {
        double load = os.getCpuLoad();
        if (load < 0) {
            throw new IOException("CPU load unavailable");
        }
        return load * 100.0;
    }

    /**
     * @param lines contents of {@code /proc/meminfo}
     * @return used memory percent, treating {@code MemAvailable} as free
     * @throws IOException if {@code MemTotal} or {@code MemAvailable} is missing
     */
    static double parseMeminfo(List<String> lines) throws IOException {
        long total = -1;
        long available = -1;
        for (String line : lines) {
            if (line.startsWith("MemTotal:")) {
                total = kilobytes(line);
            } else if (line.startsWith("MemAvailable:")) {
                available = kilobytes(line);
            }
        }
        if (total <= 0 || available < 0) {
            throw new IOException("MemTotal/MemAvailable missing from meminfo");
        }
        return percent(total - available, total);
    }

    private static long kilobytes(String line) throws IOException {
        String[] parts = line.trim().split("\\s+");
        try {
            return Long.parseLong(parts[1]);
        } catch (ArrayIndexOutOfBoundsException | NumberFormatException e) {
            throw new IOException("Malformed meminfo line: " + line, e);
        }
    }

    private static double percent(long used, long total) {
        return used * 100.0 / total;
    }
}
