package com.example.autoheal.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One audit trail row. Rows are never updated.
 */
@Entity
@Table(name = "audit_logs", indexes = {
        @Index(name = "idx_audit_action_time", columnList = "action, recorded_at"),
        @Index(name = "idx_audit_subject", columnList = "subject"),
        @Index(name = "idx_audit_actor", columnList = "actor")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditLog {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private AuditAction action;

    /** "system", "gate", "approval-workflow" or the operator who acted */
    @Column(nullable = false)
    private String actor;

    /** Issue fingerprint or remediation target */
    private String subject;

    /** Stable reason string for gate skips and expiries, e.g. cooldown */
    @Column(length = 64)
    private String reason;

    @Builder.Default
    private boolean success = true;

    /** Remaining context as JSON */
    @Column(length = 8192)
    private String details;

    @Column(name = "recorded_at", nullable = false)
    private Instant recordedAt;
}
