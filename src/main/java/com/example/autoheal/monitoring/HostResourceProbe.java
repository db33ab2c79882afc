package com.example.autoheal.monitoring;

import com.example.autoheal.alert.DetectedIssue;
import com.example.autoheal.config.AutohealProperties;
import com.example.autoheal.domain.Issue;
import com.example.autoheal.trend.TrendDetector;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.File;
import java.lang.management.ManagementFactory;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Disk and memory usage of the host running the engine. Feeds the trend
 * detector and reports high_disk, disk_full and high_memory.
 */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "autoheal.health", name = "host-enabled", havingValue = "true", matchIfMissing = true)
public class HostResourceProbe implements HealthProbe {

    static final String NAME = "host";

    private final AutohealProperties properties;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<DetectedIssue> probe() {
        AutohealProperties.HealthConfig config = properties.getHealth();
        return evaluate(config, diskUsagePercent(config.getDiskPath()), memoryUsagePercent());
    }

    @Override
    public List<ProbeSample> collectSamples() {
        AutohealProperties.HealthConfig config = properties.getHealth();
        List<ProbeSample> samples = new ArrayList<>();
        double disk = diskUsagePercent(config.getDiskPath());
        if (disk >= 0) samples.add(new ProbeSample(config.getHostName(), TrendDetector.DISK_USAGE, disk));
        double memory = memoryUsagePercent();
        if (memory >= 0) samples.add(new ProbeSample(config.getHostName(), TrendDetector.MEMORY_USAGE, memory));
        return samples;
    }

    static List<DetectedIssue> evaluate(AutohealProperties.HealthConfig config, double diskPercent, double memoryPercent) {
        List<DetectedIssue> issues = new ArrayList<>();
        String host = config.getHostName();
        if (diskPercent >= config.getDiskCriticalPercent()) {
            issues.add(new DetectedIssue(NAME, host, "disk_full", Issue.Severity.CRITICAL,
                    String.format("Disk usage on %s is critical: %.1f%%", host, diskPercent),
                    Map.of("disk_percent", diskPercent, "path", config.getDiskPath()),
                    "Free space immediately: clean logs, prune images, expand the volume"));
        } else if (diskPercent >= config.getDiskWarnPercent()) {
            issues.add(new DetectedIssue(NAME, host, "high_disk", Issue.Severity.WARNING,
                    String.format("Disk usage on %s is high: %.1f%%", host, diskPercent),
                    Map.of("disk_percent", diskPercent, "path", config.getDiskPath()),
                    "Clean up old logs and temporary files"));
        }
        if (memoryPercent >= config.getMemoryWarnPercent()) {
            issues.add(new DetectedIssue(NAME, host, "high_memory", Issue.Severity.WARNING,
                    String.format("Memory usage on %s is high: %.1f%%", host, memoryPercent),
                    Map.of("memory_percent", memoryPercent),
                    "Check for memory leaks or raise the memory limit"));
        }
        return issues;
    }

    // -1 when unknown
    private static double diskUsagePercent(String path) {
        File root = new File(path);
        long total = root.getTotalSpace();
        if (total <= 0) return -1;
        return (total - root.getUsableSpace()) * 100.0 / total;
    }

    private static double memoryUsagePercent() {
        if (ManagementFactory.getOperatingSystemMXBean() instanceof com.sun.management.OperatingSystemMXBean os) {
            long total = os.getTotalMemorySize();
            if (total <= 0) return -1;
            return (total - os.getFreeMemorySize()) * 100.0 / total;
        }
        return -1;
    }
}
