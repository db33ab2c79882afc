package com.example.autoheal.alert;

import java.util.Locale;
import java.util.Map;

/**
 * Maps upstream alert names onto normalized issue types and the fix text
 * shown to operators.
 */
public final class AlertCatalog {

    public record Entry(String issueType, String suggestedFix) {
    }

    private static final Map<String, Entry> ENTRIES = Map.ofEntries(
            Map.entry("ContainerDown", new Entry("container_stopped",
                    "Restart the container and check its logs for the exit reason")),
            Map.entry("ContainerUnhealthy", new Entry("container_unhealthy",
                    "Restart the container; inspect the failing health check")),
            Map.entry("ServiceDown", new Entry("service_stopped",
                    "Restart the service and check its journal for errors")),
            Map.entry("HighCPU", new Entry("high_cpu",
                    "Identify the busiest processes and consider scaling out")),
            Map.entry("HighMemory", new Entry("high_memory",
                    "Check for memory leaks or raise the memory limit")),
            Map.entry("HighDiskUsage", new Entry("high_disk",
                    "Clean up old logs and temporary files")),
            Map.entry("DiskFull", new Entry("disk_full",
                    "Free space immediately: clean logs, prune images, expand the volume")),
            Map.entry("HighLatency", new Entry("high_latency",
                    "Check downstream dependencies and connection pools")),
            Map.entry("HostDown", new Entry("host_down",
                    "Verify network reachability and power state of the host")),
            Map.entry("DockerDaemonDown", new Entry("daemon_unhealthy",
                    "Restart the docker daemon and check its logs")),
            Map.entry("HighLogVolume", new Entry("log_volume",
                    "Rotate logs and lower the log level of the noisy service"))
    );

    private AlertCatalog() {
    }

    public static Entry lookup(String alertName) {
        Entry entry = ENTRIES.get(alertName);
        if (entry != null) return entry;
        return new Entry("alert_" + snakeCase(alertName), "Investigate " + alertName + " alert");
    }

    static String snakeCase(String name) {
        if (name == null || name.isBlank()) return "unknown";
        return name.trim()
                .replaceAll("([a-z0-9])([A-Z])", "$1_$2")
                .replaceAll("[^A-Za-z0-9]+", "_")
                .toLowerCase(Locale.ROOT);
    }
}
