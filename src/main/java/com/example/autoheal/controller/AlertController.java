package com.example.autoheal.controller;

import com.example.autoheal.alert.AlertManager;
import com.example.autoheal.alert.AlertmanagerWebhook;
import com.example.autoheal.alert.DetectedIssue;
import com.example.autoheal.domain.Issue;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Alert intake: Alertmanager webhooks and directly reported issues.
 */
@RestController
@RequestMapping("/api/alerts")
@RequiredArgsConstructor
public class AlertController {

    private final AlertManager alertManager;

    @PostMapping("/webhook")
    public ResponseEntity<Map<String, Object>> receiveWebhook(@RequestBody AlertmanagerWebhook webhook) {
        int received = webhook.getAlerts() != null ? webhook.getAlerts().size() : 0;
        List<Issue> issues = alertManager.ingestWebhook(webhook);
        return ResponseEntity.ok(Map.of(
                "received", received,
                "accepted", issues.size(),
                "issues", issues.stream().map(Issue::shortId).toList()
        ));
    }

    /**
     * Report an issue directly. {@code component} and {@code issueType} are required
     * strings; optional fields must be strings when present. 400 otherwise.
     */
    @PostMapping("/issues")
    public ResponseEntity<Issue> reportIssue(@RequestBody Map<String, Object> body) {
        Object rawMetrics = body.get("metrics");
        if (!allStrings(body, "component", "issueType", "severity", "description", "suggestedFix")
                || (rawMetrics != null && !(rawMetrics instanceof Map<?, ?>))) {
            return ResponseEntity.badRequest().build();
        }
        String component = (String) body.get("component");
        String issueType = (String) body.get("issueType");
        if (isBlank(component) || isBlank(issueType)) {
            return ResponseEntity.badRequest().build();
        }
        String description = (String) body.get("description");
        @SuppressWarnings("unchecked")
        Map<String, Object> metrics = rawMetrics != null ? (Map<String, Object>) rawMetrics : Map.of();
        DetectedIssue detected = new DetectedIssue(
                "api",
                component,
                issueType,
                Issue.Severity.fromLabel((String) body.get("severity")),
                isBlank(description) ? issueType + " on " + component : description,
                metrics,
                (String) body.get("suggestedFix"));
        return ResponseEntity.ok(alertManager.report(detected));
    }

    private static boolean allStrings(Map<String, Object> body, String... keys) {
        for (String key : keys) {
            Object value = body.get(key);
            if (value != null && !(value instanceof String)) return false;
        }
        return true;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
