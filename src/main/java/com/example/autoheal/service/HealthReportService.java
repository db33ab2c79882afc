package com.example.autoheal.service;

import com.example.autoheal.alert.AlertManager;
import com.example.autoheal.approval.ApprovalWorkflow;
import com.example.autoheal.domain.Issue;
import com.example.autoheal.remediation.OutcomeTracker;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time summary of issues, approvals and remediation outcomes.
 */
@Service
@RequiredArgsConstructor
public class HealthReportService {

    private static final int RECENT_RESOLUTIONS = 5;

    private final AlertManager alertManager;
    private final ApprovalWorkflow approvalWorkflow;
    private final OutcomeTracker outcomeTracker;
    private final Clock clock;

    public Map<String, Object> buildHealthReport() {
        Instant now = clock.instant();
        Instant dayAgo = now.minus(Duration.ofHours(24));
        List<Issue> resolved = alertManager.getResolvedHistory();

        Map<String, Object> report = new LinkedHashMap<>();
        report.put("generated_at", now.toString());
        report.put("issues", alertManager.getStats());
        report.put("resolved_last_24h", resolved.stream()
                .filter(i -> i.getResolvedAt() != null && i.getResolvedAt().isAfter(dayAgo))
                .count());
        report.put("pending_approvals", approvalWorkflow.getPending().size());
        report.put("recent_resolutions", resolved.stream()
                .limit(RECENT_RESOLUTIONS)
                .map(i -> {
                    Map<String, Object> entry = new LinkedHashMap<>();
                    entry.put("id", i.shortId());
                    entry.put("name", i.getName());
                    entry.put("component", i.getComponent());
                    entry.put("resolution", i.getResolution());
                    entry.put("resolved_at", i.getResolvedAt() != null ? i.getResolvedAt().toString() : null);
                    return entry;
                })
                .toList());
        report.put("remediation", outcomeTracker.getStats());
        return report;
    }
}
