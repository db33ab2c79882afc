package com.example.autoheal.approval;

import com.example.autoheal.config.AutohealProperties;
import com.example.autoheal.domain.ApprovalRequest;
import com.example.autoheal.domain.AuditAction;
import com.example.autoheal.domain.Issue;
import com.example.autoheal.notification.NotificationChannel;
import com.example.autoheal.remediation.RemediationPlan;
import com.example.autoheal.service.AuditService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * Holds remediation plans waiting for a human. Each request is resolved at
 * most once: the pending entry is removed before the decision is acted on,
 * so a repeated approval is always NOT_FOUND.
 *
 * <p>Expiry is checked at resolve time; the sweep only keeps the pending set bounded.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ApprovalWorkflow {

    private final NotificationChannel notificationChannel;
    private final AutohealProperties properties;
    private final Clock clock;
    private final AuditService auditService;

    private final Map<String, ApprovalRequest> pending = new LinkedHashMap<>();

    public ApprovalRequest request(Issue issue, RemediationPlan plan) {
        return request(issue, plan, null);
    }

    /**
     * Create a request, or return the one already pending for this issue.
     *
     * @param ttl null for the configured default; capped at the configured maximum
     */
    public ApprovalRequest request(Issue issue, RemediationPlan plan, Duration ttl) {
        if (ttl != null && (ttl.isZero() || ttl.isNegative())) {
            throw new IllegalArgumentException("Approval ttl must be positive: " + ttl);
        }
        AutohealProperties.ApprovalConfig config = properties.getApproval();
        Duration max = Duration.ofMinutes(config.getMaxTtlMinutes());
        Duration effective = ttl != null ? ttl : Duration.ofMinutes(config.getDefaultTtlMinutes());
        if (effective.compareTo(max) > 0) {
            effective = max;
        }

        Instant now = clock.instant();
        ApprovalRequest created;
        synchronized (this) {
            ApprovalRequest existing = pending.get(issue.getFingerprint());
            if (existing != null && !existing.isExpired(now)) {
                log.debug("Approval already pending for {}", issue.shortId());
                return existing;
            }
            created = ApprovalRequest.builder()
                    .approvalId(issue.getFingerprint())
                    .issueFingerprint(issue.getFingerprint())
                    .issue(issue)
                    .plan(plan)
                    .requestedAt(now)
                    .expiresAt(now.plus(effective))
                    .build();
            pending.put(created.getApprovalId(), created);
        }

        log.info("Approval requested for {}: {} (expires {})", created.shortId(), plan.description(), created.getExpiresAt());
        auditService.record("approval-workflow", AuditAction.APPROVAL_REQUESTED, issue.getFingerprint(), Map.of(
                "action", plan.type().value(), "target", plan.target(),
                "risk", String.valueOf(issue.getRiskLevel()), "expires_at", created.getExpiresAt().toString()));
        try {
            notificationChannel.requestApproval(issue, created.getApprovalId());
        } catch (Exception e) {
            log.error("Failed to send approval request for {}: {}", created.shortId(), e.getMessage());
        }
        return created;
    }

    /**
     * Resolve by exact id, else by prefix. The caller runs the approved plan; this
     * class never executes anything.
     */
    public ApprovalResult resolve(String idOrPrefix, boolean approved, String actor) {
        ApprovalRequest request;
        synchronized (this) {
            request = find(idOrPrefix);
            if (request != null) {
                pending.remove(request.getApprovalId());
            }
        }
        if (request == null) {
            log.info("No pending approval matches '{}'", idOrPrefix);
            return new ApprovalResult(ApprovalDecision.NOT_FOUND, null);
        }

        if (request.isExpired(clock.instant())) {
            log.info("Approval {} expired at {}", request.shortId(), request.getExpiresAt());
            auditService.record(actor, AuditAction.APPROVAL_EXPIRED, request.getIssueFingerprint(),
                    Map.of("expired_at", request.getExpiresAt().toString()), false);
            return new ApprovalResult(ApprovalDecision.EXPIRED, request);
        }

        if (approved) {
            log.info("Approval {} granted by {}", request.shortId(), actor);
            auditService.record(actor, AuditAction.APPROVAL_GRANTED, request.getIssueFingerprint(),
                    Map.of("action", request.getPlan().type().value(), "target", request.getPlan().target()));
            return new ApprovalResult(ApprovalDecision.APPROVED, request);
        }

        log.info("Approval {} rejected by {}", request.shortId(), actor);
        auditService.record(actor, AuditAction.APPROVAL_DENIED, request.getIssueFingerprint(),
                Map.of("action", request.getPlan().type().value(), "target", request.getPlan().target()));
        sendQuietly(String.format(":no_entry: Remediation rejected by %s: %s (%s). Issue stays open.",
                actor, request.getPlan().description(), request.shortId()));
        return new ApprovalResult(ApprovalDecision.REJECTED, request);
    }

    /**
     * Drop the pending request for an issue, e.g. when it resolved on its own.
     */
    public synchronized boolean withdraw(String fingerprint) {
        return pending.remove(fingerprint) != null;
    }

    public synchronized List<ApprovalRequest> getPending() {
        return new ArrayList<>(pending.values());
    }

    public synchronized Optional<ApprovalRequest> getPending(String idOrPrefix) {
        return Optional.ofNullable(find(idOrPrefix));
    }

    @Scheduled(fixedDelayString = "#{${autoheal.approval.sweep-interval-seconds:60} * 1000}")
    public void sweepExpired() {
        Instant now = clock.instant();
        List<ApprovalRequest> expired = new ArrayList<>();
        synchronized (this) {
            Iterator<ApprovalRequest> it = pending.values().iterator();
            while (it.hasNext()) {
                ApprovalRequest request = it.next();
                if (request.isExpired(now)) {
                    it.remove();
                    expired.add(request);
                }
            }
        }
        for (ApprovalRequest request : expired) {
            log.info("Approval {} expired without a decision", request.shortId());
            auditService.record("approval-workflow", AuditAction.APPROVAL_EXPIRED, request.getIssueFingerprint(),
                    Map.of("expired_at", request.getExpiresAt().toString()), false);
            sendQuietly(String.format(":hourglass: Approval %s expired: %s was not run",
                    request.shortId(), request.getPlan().description()));
        }
    }

    // caller holds the monitor
    private ApprovalRequest find(String idOrPrefix) {
        if (idOrPrefix == null || idOrPrefix.isBlank()) return null;
        ApprovalRequest exact = pending.get(idOrPrefix);
        if (exact != null) return exact;
        for (ApprovalRequest request : pending.values()) {
            if (request.getApprovalId().startsWith(idOrPrefix)) return request;
        }
        return null;
    }

    private void sendQuietly(String text) {
        try {
            notificationChannel.notify(text);
        } catch (Exception e) {
            log.error("Failed to send notification: {}", e.getMessage());
        }
    }
}
