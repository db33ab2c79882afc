package com.example.autoheal.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Locale;

/**
 * One remediation attempt. Retries create new rows, so the history doubles as
 * the source of truth for cooldown and rate-limit checks.
 */
@Entity
@Table(name = "remediation_actions", indexes = {
        @Index(name = "idx_action_target_type", columnList = "target, action_type, executed_at"),
        @Index(name = "idx_action_executed_at", columnList = "executed_at"),
        @Index(name = "idx_action_issue", columnList = "issue_fingerprint")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RemediationAction {

    @Id
    @Column(name = "action_id")
    private String actionId;

    @Column(name = "issue_fingerprint")
    private String issueFingerprint;

    /** Opaque cooldown scope, e.g. container:nginx */
    @Column(nullable = false)
    private String target;

    @Enumerated(EnumType.STRING)
    @Column(name = "action_type", nullable = false)
    private RemediationType actionType;

    @Column(length = 1024)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private ActionStatus status = ActionStatus.PENDING;

    @Column(name = "cooldown_minutes")
    private int cooldownMinutes;

    @Column(name = "auto_approved")
    private boolean autoApproved;

    @Column(name = "approved_by")
    private String approvedBy;

    /** Stable reason string for skips: cooldown, rate_limit */
    private String reason;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    /** Set when the action is dispatched; in-flight actions count toward cooldown */
    @Column(name = "executed_at")
    private Instant executedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(length = 4096)
    private String result;

    @Column(length = 2048)
    private String error;

    public enum ActionStatus {
        PENDING, IN_PROGRESS, SUCCESS, FAILED, SKIPPED
    }

    public enum RemediationType {
        SERVICE_RESTART(15),
        CONTAINER_RESTART(10),
        DISK_CLEANUP(60),
        LOG_ROTATION(30),
        RESOURCE_SCALE(30),
        CUSTOM(15);

        private final int defaultCooldownMinutes;

        RemediationType(int defaultCooldownMinutes) {
            this.defaultCooldownMinutes = defaultCooldownMinutes;
        }

        public int getDefaultCooldownMinutes() {
            return defaultCooldownMinutes;
        }

        /** Wire value, e.g. service_restart */
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }

        /** Configuration key, e.g. service-restart */
        public String configKey() {
            return value().replace('_', '-');
        }
    }

    public boolean isTerminal() {
        return status == ActionStatus.SUCCESS || status == ActionStatus.FAILED || status == ActionStatus.SKIPPED;
    }

    /**
     * Record the single execution outcome. Terminal actions are immutable.
     */
    public void complete(boolean success, String message, Instant at) {
        if (isTerminal()) {
            throw new IllegalStateException("Action " + actionId + " already " + status);
        }
        this.status = success ? ActionStatus.SUCCESS : ActionStatus.FAILED;
        this.completedAt = at;
        if (success) {
            this.result = message;
        } else {
            this.error = message;
        }
    }
}
