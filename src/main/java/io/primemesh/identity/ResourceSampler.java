package io.primemesh.identity;

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.time.Instant;

/**
 * Reads host CPU and memory load through the platform operating-system MXBean.
 * Values the JVM cannot report come back as 0.
 */
public final class ResourceSampler {
    private final OperatingSystemMXBean os;

    public ResourceSampler() {
        this(ManagementFactory.getOperatingSystemMXBean());
    }

    ResourceSampler(OperatingSystemMXBean os) {
        this.os = os;
    }

    public ResourceSample sample() {
        double cpu = 0.0;
        double memory = 0.0;
        if (os instanceof com.sun.management.OperatingSystemMXBean) {
            com.sun.management.OperatingSystemMXBean ext = (com.sun.management.OperatingSystemMXBean) os;
            double load = ext.getCpuLoad();
            cpu = load < 0 ? 0.0 : load * 100.0;
            long total = ext.getTotalMemorySize();
            long free = ext.getFreeMemorySize();
            if (total > 0) {
                memory = (total - free) * 100.0 / total;
            }
        } else {
            double loadAverage = os.getSystemLoadAverage();
            int processors = Math.max(1, os.getAvailableProcessors());
            cpu = loadAverage < 0 ? 0.0 : Math.min(100.0, loadAverage * 100.0 / processors);
        }
        return new ResourceSample(round(cpu), round(memory), Instant.now());
    }

    private static double round(double value) {
        return Math.round(value * 10.0) / 10.0;
    }
}
