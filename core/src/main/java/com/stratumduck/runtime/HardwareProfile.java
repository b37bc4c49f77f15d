package com.stratumduck.runtime;

import java.lang.management.ManagementFactory;
import com.sun.management.OperatingSystemMXBean;
import java.util.Objects;

/**
 * Detects hardware capabilities used to size the DuckDB backend.
 *
 * <p>The sampling passes are executed entirely inside DuckDB, so the only
 * knobs that matter are how many worker threads DuckDB may use for its
 * parallel scans, window functions and joins, and how much memory it may
 * take before spilling to disk.
 *
 * <p>Example usage:
 * <pre>
 *   HardwareProfile profile = HardwareProfile.detect();
 *   int threads = profile.recommendedThreadCount();
 *   String memLimit = profile.recommendedMemoryLimit();
 * </pre>
 *
 * @see DuckDBRuntime
 */
public class HardwareProfile {

    private final int cpuCores;
    private final long totalMemoryBytes;
    private final String architecture;

    /**
     * Creates a hardware profile.
     *
     * @param cpuCores the number of CPU cores
     * @param totalMemory the total physical memory in bytes
     * @param arch the CPU architecture string
     */
    HardwareProfile(int cpuCores, long totalMemory, String arch) {
        this.cpuCores = cpuCores;
        this.totalMemoryBytes = totalMemory;
        this.architecture = Objects.requireNonNull(arch, "arch must not be null");
    }

    /**
     * Detects the hardware profile of the current system.
     *
     * @return the detected hardware profile
     */
    public static HardwareProfile detect() {
        int cores = Runtime.getRuntime().availableProcessors();

        long memory;
        try {
            OperatingSystemMXBean osBean = ManagementFactory.getPlatformMXBean(
                OperatingSystemMXBean.class);
            memory = osBean.getTotalMemorySize();
        } catch (Exception e) {
            // Fallback to max heap if physical memory detection fails
            memory = Runtime.getRuntime().maxMemory() * 4; // Estimate
        }

        String arch = System.getProperty("os.arch", "unknown").toLowerCase();

        return new HardwareProfile(cores, memory, arch);
    }

    /**
     * Returns the recommended thread count for DuckDB (all available cores,
     * at least 1).
     *
     * @return the recommended thread count
     */
    public int recommendedThreadCount() {
        return Math.max(1, cpuCores);
    }

    /**
     * Returns the recommended memory limit for DuckDB.
     *
     * <p>DuckDB recommends 4GB per thread; the limit is capped at 80% of the
     * physical memory.
     *
     * @return the memory limit string (e.g., "8GB", "512MB")
     */
    public String recommendedMemoryLimit() {
        long limitBytes = Math.min((totalMemoryBytes * 4) / 5,
            recommendedThreadCount() * 4L * 1024 * 1024 * 1024);
        return formatBytes(limitBytes);
    }

    static String formatBytes(long bytes) {
        if (bytes >= 1024L * 1024 * 1024) {
            return (bytes / (1024L * 1024 * 1024)) + "GB";
        } else if (bytes >= 1024L * 1024) {
            return (bytes / (1024L * 1024)) + "MB";
        } else if (bytes >= 1024) {
            return (bytes / 1024) + "KB";
        } else {
            return bytes + "B";
        }
    }

    /**
     * Returns the number of CPU cores.
     *
     * @return the CPU core count
     */
    public int cpuCores() {
        return cpuCores;
    }

    @Override
    public String toString() {
        return String.format(
            "HardwareProfile(cores=%d, memory=%s, arch=%s)",
            cpuCores,
            formatBytes(totalMemoryBytes),
            architecture
        );
    }
}
