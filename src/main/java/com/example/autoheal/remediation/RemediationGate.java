package com.example.autoheal.remediation;

import com.example.autoheal.config.AutohealProperties;
import com.example.autoheal.domain.Issue;
import com.example.autoheal.domain.RemediationAction;
import com.example.autoheal.repository.RemediationActionRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Decides whether a planned action may run now.
 *
 * <p>Order of checks: approval requirement, per (target, type) cooldown, global
 * rate limit over the trailing hour. Cooldown and rate limit are read from the
 * durable action history, so a restart does not reset them.
 *
 * <p>{@link #admit} is the only entry point that records anything. The check and
 * the IN_PROGRESS record happen under one monitor, so a second evaluator sees
 * the first action as executed and is held off by the cooldown.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RemediationGate {

    private static final Duration RATE_WINDOW = Duration.ofMinutes(60);

    private final RemediationActionRepository actionRepository;
    private final AutohealProperties properties;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    public record Admission(GateDecision decision, RemediationAction action) {
    }

    /**
     * Pure evaluation, records nothing.
     */
    public GateDecision evaluate(Issue issue, RemediationPlan plan, boolean autoApprove) {
        AutohealProperties.RemediationConfig config = properties.getRemediation();
        boolean lowRisk = issue.getRiskLevel() == Issue.RiskLevel.LOW;
        if ((!lowRisk || config.isRequireApproval()) && !autoApprove) {
            return GateDecision.needsApproval();
        }

        Instant now = clock.instant();
        int cooldown = config.cooldownFor(plan.type());
        Instant cooldownStart = now.minus(Duration.ofMinutes(cooldown));
        if (actionRepository.existsByTargetAndActionTypeAndExecutedAtAfter(plan.target(), plan.type(), cooldownStart)) {
            return GateDecision.skipped(GateDecision.REASON_COOLDOWN);
        }

        long recent = actionRepository.countByExecutedAtAfter(now.minus(RATE_WINDOW));
        if (recent >= config.getMaxActionsPerHour()) {
            return GateDecision.skipped(GateDecision.REASON_RATE_LIMIT);
        }
        return GateDecision.autoExecute();
    }

    /**
     * Evaluate and record. AUTO_EXECUTE yields an IN_PROGRESS action stamped with
     * executedAt; a skip yields a SKIPPED action that never counts toward limits;
     * NEEDS_APPROVAL records nothing.
     */
    public synchronized Admission admit(Issue issue, RemediationPlan plan, boolean autoApprove, String approvedBy) {
        GateDecision decision = evaluate(issue, plan, autoApprove);
        meterRegistry.counter("autoheal.gate.decisions",
                "verdict", decision.verdict().name(), "reason", decision.reason()).increment();

        if (decision.verdict() == GateDecision.Verdict.NEEDS_APPROVAL) {
            log.info("{} on {} needs approval (risk {})", plan.type().value(), plan.target(), issue.getRiskLevel());
            return new Admission(decision, null);
        }

        Instant now = clock.instant();
        RemediationAction action = RemediationAction.builder()
                .actionId("act-" + UUID.randomUUID())
                .issueFingerprint(issue.getFingerprint())
                .target(plan.target())
                .actionType(plan.type())
                .description(plan.description())
                .cooldownMinutes(properties.getRemediation().cooldownFor(plan.type()))
                .autoApproved(!autoApprove)
                .approvedBy(autoApprove ? approvedBy : null)
                .createdAt(now)
                .build();

        if (decision.isSkipped()) {
            action.setStatus(RemediationAction.ActionStatus.SKIPPED);
            action.setReason(decision.reason());
            action.setCompletedAt(now);
            log.warn("Skipped {} on {}: {}", plan.type().value(), plan.target(), decision.reason());
        } else {
            action.setStatus(RemediationAction.ActionStatus.IN_PROGRESS);
            action.setExecutedAt(now);
            log.info("Admitted {} on {} ({})", plan.type().value(), plan.target(), action.getActionId());
        }
        return new Admission(decision, actionRepository.save(action));
    }
}
