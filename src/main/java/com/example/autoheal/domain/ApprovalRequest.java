package com.example.autoheal.domain;

import com.example.autoheal.remediation.RemediationPlan;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A pending request for human sign-off. Held in memory; resolved by exactly
 * one of approve, reject or expire.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApprovalRequest {

    /** Equal to the issue fingerprint; addressable by any unambiguous prefix */
    private String approvalId;

    private String issueFingerprint;

    private Issue issue;

    private RemediationPlan plan;

    private Instant requestedAt;

    private Instant expiresAt;

    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    public String shortId() {
        return approvalId == null || approvalId.length() <= 8 ? approvalId : approvalId.substring(0, 8);
    }
}
