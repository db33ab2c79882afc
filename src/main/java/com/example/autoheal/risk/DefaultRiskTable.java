package com.example.autoheal.risk;

import com.example.autoheal.domain.Issue.RiskLevel;

import java.util.Map;

/**
 * Static risk defaults per issue type, used whenever the oracle cannot answer.
 * Unknown types are MEDIUM so a missing entry never bypasses approval.
 */
public final class DefaultRiskTable {

    private static final Map<String, RiskLevel> DEFAULTS = Map.ofEntries(
            Map.entry("container_stopped", RiskLevel.LOW),
            Map.entry("container_unhealthy", RiskLevel.LOW),
            Map.entry("high_cpu", RiskLevel.LOW),
            Map.entry("high_disk", RiskLevel.LOW),
            Map.entry("log_volume", RiskLevel.LOW),
            Map.entry("high_memory", RiskLevel.MEDIUM),
            Map.entry("service_stopped", RiskLevel.MEDIUM),
            Map.entry("high_latency", RiskLevel.MEDIUM),
            Map.entry("disk_full", RiskLevel.HIGH),
            Map.entry("daemon_unhealthy", RiskLevel.HIGH),
            Map.entry("host_down", RiskLevel.HIGH),
            Map.entry("monitoring_error", RiskLevel.HIGH)
    );

    private DefaultRiskTable() {
    }

    public static RiskLevel defaultFor(String issueType) {
        if (issueType == null) return RiskLevel.MEDIUM;
        if (issueType.startsWith("predicted_")) return RiskLevel.MEDIUM;
        return DEFAULTS.getOrDefault(issueType, RiskLevel.MEDIUM);
    }
}
