package com.stratumduck.runtime;

import com.stratumduck.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Hardware Profile Tests")
class HardwareProfileTest {

    private static final long GB = 1024L * 1024 * 1024;

    @Test
    void testDetect() {
        HardwareProfile profile = HardwareProfile.detect();
        assertTrue(profile.cpuCores() > 0);
        assertTrue(profile.recommendedThreadCount() >= 1);
        assertNotNull(profile.recommendedMemoryLimit());
    }

    @Test
    void testMemoryLimitCappedPerThread() {
        // 2 threads at 4GB each, well under 80% of 64GB
        assertEquals("8GB", new HardwareProfile(2, 64 * GB, "amd64").recommendedMemoryLimit());
    }

    @Test
    void testMemoryLimitCappedByPhysicalMemory() {
        // 80% of 5GB
        assertEquals("4GB", new HardwareProfile(16, 5 * GB, "aarch64").recommendedMemoryLimit());
    }

    @Test
    void testThreadCountAtLeastOne() {
        assertEquals(1, new HardwareProfile(0, GB, "x86").recommendedThreadCount());
    }

    @Test
    void testFormatBytes() {
        assertEquals("512B", HardwareProfile.formatBytes(512));
        assertEquals("2KB", HardwareProfile.formatBytes(2048));
        assertEquals("3MB", HardwareProfile.formatBytes(3L * 1024 * 1024));
        assertEquals("5GB", HardwareProfile.formatBytes(5 * GB));
    }
}
