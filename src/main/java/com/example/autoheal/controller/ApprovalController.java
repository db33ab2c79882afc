package com.example.autoheal.controller;

import com.example.autoheal.approval.ApprovalWorkflow;
import com.example.autoheal.domain.ApprovalRequest;
import com.example.autoheal.remediation.ApprovalOutcome;
import com.example.autoheal.remediation.RemediationEngine;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Approval Workflow REST API Controller.
 */
@RestController
@RequestMapping("/api/approvals")
@RequiredArgsConstructor
public class ApprovalController {

    private final ApprovalWorkflow approvalWorkflow;
    private final RemediationEngine remediationEngine;

    @GetMapping("/pending")
    public ResponseEntity<List<ApprovalRequest>> getPending() {
        return ResponseEntity.ok(approvalWorkflow.getPending());
    }

    /**
     * Approve or reject. 404 when nothing is pending under the id, 410 when the
     * request expired. An approved action runs in the background.
     */
    @PostMapping("/{id}/respond")
    public ResponseEntity<Map<String, Object>> respond(@PathVariable String id,
                                                       @RequestBody Map<String, Object> body) {
        boolean approved = Boolean.TRUE.equals(body.get("approved"));
        String respondedBy = (String) body.getOrDefault("respondedBy", "user");
        ApprovalOutcome outcome = remediationEngine.resolveApproval(id, approved, respondedBy);
        Map<String, Object> response = Map.of("id", id, "decision", outcome.decision().getReason());
        return switch (outcome.decision()) {
            case APPROVED -> ResponseEntity.accepted().body(response);
            case REJECTED -> ResponseEntity.ok(response);
            case EXPIRED -> ResponseEntity.status(HttpStatus.GONE).body(response);
            case NOT_FOUND -> ResponseEntity.status(HttpStatus.NOT_FOUND).body(response);
        };
    }
}
