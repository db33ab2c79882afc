package com.example.autoheal.remediation;

import com.example.autoheal.approval.ApprovalDecision;

import java.util.concurrent.CompletableFuture;

/**
 * @param execution completes with the gate decision of the approved run; already
 *                  completed with null when nothing was dispatched
 */
public record ApprovalOutcome(ApprovalDecision decision, CompletableFuture<GateDecision> execution) {
}
