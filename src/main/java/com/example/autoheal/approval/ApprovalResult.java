package com.example.autoheal.approval;

import com.example.autoheal.domain.ApprovalRequest;

/**
 * @param request the resolved request; null for NOT_FOUND
 */
public record ApprovalResult(ApprovalDecision decision, ApprovalRequest request) {
}
