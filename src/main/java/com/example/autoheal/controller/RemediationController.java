package com.example.autoheal.controller;

import com.example.autoheal.domain.RemediationAction;
import com.example.autoheal.remediation.Outcome;
import com.example.autoheal.remediation.OutcomeTracker;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/remediation")
@RequiredArgsConstructor
public class RemediationController {

    private final OutcomeTracker outcomeTracker;

    @GetMapping("/actions")
    public ResponseEntity<List<RemediationAction>> getRecentActions(@RequestParam(defaultValue = "10") int limit) {
        return ResponseEntity.ok(outcomeTracker.getRecentActions(limit));
    }

    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> getStats() {
        return ResponseEntity.ok(outcomeTracker.getStats());
    }

    @GetMapping("/outcomes")
    public ResponseEntity<List<Outcome>> getOutcomes(@RequestParam(defaultValue = "20") int limit) {
        return ResponseEntity.ok(outcomeTracker.getRecentOutcomes(limit));
    }
}
