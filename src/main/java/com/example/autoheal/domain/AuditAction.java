package com.example.autoheal.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * Every decision the engine or an operator makes leaves one of these in the audit trail.
 */
public enum AuditAction {
    ISSUE_CREATED,
    ISSUE_RESOLVED,
    ISSUE_ACKNOWLEDGED,
    ISSUE_SILENCED,
    GATE_SKIPPED,
    APPROVAL_REQUESTED,
    APPROVAL_GRANTED,
    APPROVAL_DENIED,
    APPROVAL_EXPIRED,
    ACTION_SUCCEEDED,
    ACTION_FAILED;

    public static Optional<AuditAction> parse(String value) {
        if (value == null || value.isBlank()) return Optional.empty();
        try {
            return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
