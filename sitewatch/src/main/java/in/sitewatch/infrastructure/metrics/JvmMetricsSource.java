package in.sitewatch.infrastructure.metrics;

import in.sitewatch.application.port.output.MetricsSource;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryUsage;

/**
 * Metrics source backed by the local JVM.
 *
 * Answers {@code memory.usage} (heap used, percent of max), {@code threads.count}
 * and {@code cpu.load} (system load average). Any other metric has no data.
 * The time window is ignored; values are instantaneous.
 */
public final class JvmMetricsSource implements MetricsSource {

    @Override
    public Object sample(String metric, int timeWindowMinutes) {
        return switch (metric) {
            case "memory.usage" -> heapUsedPercent();
            case "threads.count" -> ManagementFactory.getThreadMXBean().getThreadCount();
            case "cpu.load" -> loadAverage();
            default -> null;
        };
    }

    private static Double heapUsedPercent() {
        MemoryUsage heap = ManagementFactory.getMemoryMXBean().getHeapMemoryUsage();
        long max = heap.getMax() > 0 ? heap.getMax() : heap.getCommitted();
        if (max <= 0) {
            return null;
        }
        return 100.0 * heap.getUsed() / max;
    }

    private static Double loadAverage() {
        double load = ManagementFactory.getOperatingSystemMXBean().getSystemLoadAverage();
        return load < 0 ? null : load;
    }
}
