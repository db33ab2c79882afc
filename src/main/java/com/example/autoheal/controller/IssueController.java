package com.example.autoheal.controller;

import com.example.autoheal.alert.AlertManager;
import com.example.autoheal.config.AutohealProperties;
import com.example.autoheal.domain.Issue;
import com.example.autoheal.domain.RemediationAction;
import com.example.autoheal.remediation.OutcomeTracker;
import com.example.autoheal.remediation.RemediationEngine;
import com.example.autoheal.service.HealthReportService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Operator commands on issues.
 */
@RestController
@RequestMapping("/api/issues")
@RequiredArgsConstructor
public class IssueController {

    private static final int MAX_HISTORY = 500;

    private final AlertManager alertManager;
    private final RemediationEngine remediationEngine;
    private final OutcomeTracker outcomeTracker;
    private final HealthReportService healthReportService;
    private final AutohealProperties properties;

    @GetMapping("/active")
    public ResponseEntity<List<Issue>> getActiveIssues() {
        return ResponseEntity.ok(alertManager.getActiveIssues());
    }

    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> getStats() {
        return ResponseEntity.ok(alertManager.getStats());
    }

    @GetMapping("/history")
    public ResponseEntity<List<Issue>> getHistory(@RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(alertManager.getResolvedHistory().stream().limit(Math.max(0, Math.min(limit, MAX_HISTORY))).toList());
    }

    @GetMapping("/report")
    public ResponseEntity<Map<String, Object>> getHealthReport() {
        return ResponseEntity.ok(healthReportService.buildHealthReport());
    }

    @GetMapping("/{id}")
    public ResponseEntity<Issue> getIssue(@PathVariable String id) {
        return alertManager.getIssue(id)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/{id}/actions")
    public ResponseEntity<List<RemediationAction>> getActions(@PathVariable String id) {
        return alertManager.getIssue(id)
                .map(issue -> ResponseEntity.ok(outcomeTracker.getActionsForIssue(issue.getFingerprint())))
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * Acknowledge a firing issue. 404 when unknown or not FIRING.
     */
    @PostMapping("/{id}/acknowledge")
    public ResponseEntity<Issue> acknowledge(@PathVariable String id,
                                             @RequestBody(required = false) Map<String, Object> body) {
        String actor = body != null ? (String) body.getOrDefault("actor", "operator") : "operator";
        return alertManager.acknowledge(id, actor)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/{id}/silence")
    public ResponseEntity<Issue> silence(@PathVariable String id,
                                         @RequestBody(required = false) Map<String, Object> body) {
        int minutes = properties.getAlerts().getDefaultSilenceMinutes();
        if (body != null && body.get("minutes") instanceof Number n) {
            minutes = n.intValue();
        }
        if (minutes <= 0) {
            return ResponseEntity.badRequest().build();
        }
        return alertManager.silence(id, minutes)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/{id}/resolve")
    public ResponseEntity<Issue> resolve(@PathVariable String id,
                                         @RequestBody(required = false) Map<String, Object> body) {
        String resolution = body != null ? (String) body.getOrDefault("resolution", "Resolved by operator")
                : "Resolved by operator";
        return alertManager.resolve(id, resolution)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * Run the remediation pipeline again for an open issue. Returns 202; the
     * outcome shows up in the action history.
     */
    @PostMapping("/{id}/remediate")
    public ResponseEntity<Map<String, Object>> remediate(@PathVariable String id,
                                                         @RequestBody(required = false) Map<String, Object> body) {
        String actor = body != null ? (String) body.getOrDefault("actor", "operator") : "operator";
        return remediationEngine.retry(id, actor)
                .map(future -> ResponseEntity.accepted().<Map<String, Object>>body(Map.of("status", "dispatched", "id", id)))
                .orElse(ResponseEntity.notFound().build());
    }
}
