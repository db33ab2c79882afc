package com.example.autoheal.remediation;

import com.example.autoheal.alert.AlertManager;
import com.example.autoheal.alert.IssueListener;
import com.example.autoheal.approval.ApprovalDecision;
import com.example.autoheal.approval.ApprovalResult;
import com.example.autoheal.approval.ApprovalWorkflow;
import com.example.autoheal.domain.ApprovalRequest;
import com.example.autoheal.domain.AuditAction;
import com.example.autoheal.domain.Issue;
import com.example.autoheal.domain.RemediationAction;
import com.example.autoheal.notification.NotificationChannel;
import com.example.autoheal.risk.RiskClassifier;
import com.example.autoheal.service.AuditService;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Drives a new issue through classify, plan, gate and then either execution,
 * an approval request or a recorded skip. Everything runs on the remediation
 * pool so ingestion and approval callers never wait on an action.
 */
@Slf4j
@Service
public class RemediationEngine implements IssueListener {

    private final AlertManager alertManager;
    private final RiskClassifier riskClassifier;
    private final RemediationPlanner planner;
    private final RemediationGate gate;
    private final ActionExecutor actionExecutor;
    private final ApprovalWorkflow approvalWorkflow;
    private final OutcomeTracker outcomeTracker;
    private final NotificationChannel notificationChannel;
    private final AuditService auditService;
    private final Executor remediationExecutor;

    public RemediationEngine(AlertManager alertManager,
                             RiskClassifier riskClassifier,
                             RemediationPlanner planner,
                             RemediationGate gate,
                             ActionExecutor actionExecutor,
                             ApprovalWorkflow approvalWorkflow,
                             OutcomeTracker outcomeTracker,
                             NotificationChannel notificationChannel,
                             AuditService auditService,
                             @Qualifier("remediationExecutor") Executor remediationExecutor) {
        this.alertManager = alertManager;
        this.riskClassifier = riskClassifier;
        this.planner = planner;
        this.gate = gate;
        this.actionExecutor = actionExecutor;
        this.approvalWorkflow = approvalWorkflow;
        this.outcomeTracker = outcomeTracker;
        this.notificationChannel = notificationChannel;
        this.auditService = auditService;
        this.remediationExecutor = remediationExecutor;
    }

    @PostConstruct
    void register() {
        alertManager.addListener(this);
    }

    @Override
    public void onIssueCreated(Issue issue) {
        process(issue).whenComplete((decision, error) -> {
            if (error != null) {
                log.error("Remediation pipeline failed for {}: {}", issue.shortId(), error.getMessage());
            }
        });
    }

    @Override
    public void onIssueResolved(Issue issue) {
        if (approvalWorkflow.withdraw(issue.getFingerprint())) {
            log.info("Withdrew pending approval for resolved issue {}", issue.shortId());
        }
        outcomeTracker.record(issue, null);
    }

    /**
     * Hands the issue to the remediation pool. A full pool skips the issue as
     * overloaded; an operator can retry it later.
     */
    public CompletableFuture<GateDecision> process(Issue issue) {
        try {
            return CompletableFuture.supplyAsync(() -> handle(issue), remediationExecutor);
        } catch (RejectedExecutionException e) {
            log.warn("Remediation pool saturated, skipping {} ({})", issue.shortId(), issue.getIssueType());
            auditService.record("engine", AuditAction.GATE_SKIPPED, issue.getFingerprint(),
                    Map.of("reason", GateDecision.REASON_OVERLOADED, "issue_type", issue.getIssueType()));
            return CompletableFuture.completedFuture(GateDecision.skipped(GateDecision.REASON_OVERLOADED));
        }
    }

    /**
     * Operator-triggered retry: a fresh pass through the gate, so cooldown and
     * rate limit still apply.
     */
    public Optional<CompletableFuture<GateDecision>> retry(String idOrPrefix, String actor) {
        return alertManager.getIssue(idOrPrefix).map(issue -> {
            log.info("Retry of {} requested by {}", issue.shortId(), actor);
            return process(issue);
        });
    }

    /**
     * Resolve a pending approval. An approved plan is dispatched asynchronously and
     * passes the gate again with approval already granted.
     */
    public ApprovalOutcome resolveApproval(String idOrPrefix, boolean approved, String actor) {
        ApprovalResult result = approvalWorkflow.resolve(idOrPrefix, approved, actor);
        if (result.decision() != ApprovalDecision.APPROVED) {
            return new ApprovalOutcome(result.decision(), CompletableFuture.completedFuture(null));
        }
        ApprovalRequest request = result.request();
        CompletableFuture<GateDecision> execution;
        try {
            execution = CompletableFuture.supplyAsync(() -> executeApproved(request, actor), remediationExecutor);
        } catch (RejectedExecutionException e) {
            Issue issue = request.getIssue();
            log.warn("Remediation pool saturated, approved plan for {} not dispatched", issue.shortId());
            auditService.record(actor, AuditAction.GATE_SKIPPED, issue.getFingerprint(),
                    Map.of("reason", GateDecision.REASON_OVERLOADED, "approved", true));
            sendQuietly(String.format(":hourglass: Approved fix for %s on %s was not started, the engine is busy. "
                    + "Retry it from /api/issues/%s/remediate", issue.getName(), issue.getComponent(), issue.shortId()));
            execution = CompletableFuture.completedFuture(GateDecision.skipped(GateDecision.REASON_OVERLOADED));
        }
        return new ApprovalOutcome(ApprovalDecision.APPROVED, execution);
    }

    GateDecision handle(Issue issue) {
        riskClassifier.classify(issue);

        Optional<RemediationPlan> planned = planner.plan(issue);
        if (planned.isEmpty()) {
            log.info("No automated remediation for {} ({})", issue.shortId(), issue.getIssueType());
            auditService.record("gate", AuditAction.GATE_SKIPPED, issue.getFingerprint(),
                    Map.of("reason", GateDecision.REASON_NO_REMEDIATION, "issue_type", issue.getIssueType()));
            outcomeTracker.record(issue, null);
            sendQuietly(String.format(":mag: %s on %s needs manual attention (risk %s). Suggested fix: %s",
                    issue.getName(), issue.getComponent(), issue.getRiskLevel(), issue.getSuggestedFix()));
            return GateDecision.skipped(GateDecision.REASON_NO_REMEDIATION);
        }

        RemediationPlan plan = planned.get();
        RemediationGate.Admission admission = gate.admit(issue, plan, false, null);
        switch (admission.decision().verdict()) {
            case AUTO_EXECUTE -> runAdmitted(issue, admission.action());
            case NEEDS_APPROVAL -> approvalWorkflow.request(issue, plan);
            case SKIPPED -> recordSkip(issue, plan, admission);
        }
        return admission.decision();
    }

    private GateDecision executeApproved(ApprovalRequest request, String actor) {
        Optional<Issue> live = alertManager.getIssue(request.getIssueFingerprint());
        if (live.isEmpty()) {
            log.info("Issue {} resolved before its approved action ran", request.shortId());
            return GateDecision.skipped(GateDecision.REASON_ISSUE_RESOLVED);
        }
        Issue issue = live.get();
        RemediationGate.Admission admission = gate.admit(issue, request.getPlan(), true, actor);
        if (admission.decision().verdict() == GateDecision.Verdict.AUTO_EXECUTE) {
            runAdmitted(issue, admission.action());
        } else {
            recordSkip(issue, request.getPlan(), admission);
        }
        return admission.decision();
    }

    private void runAdmitted(Issue issue, RemediationAction action) {
        RemediationAction done = actionExecutor.execute(action, issue);
        boolean success = done.getStatus() == RemediationAction.ActionStatus.SUCCESS;
        if (success) {
            alertManager.resolve(issue.getFingerprint(), "Auto-remediated: " + done.getDescription());
        }
        outcomeTracker.record(issue, done);

        auditService.record(done.getApprovedBy() != null ? done.getApprovedBy() : "system",
                success ? AuditAction.ACTION_SUCCEEDED : AuditAction.ACTION_FAILED, done.getTarget(), Map.of(
                        "action_id", done.getActionId(),
                        "action", done.getActionType().value(),
                        "issue", issue.getFingerprint(),
                        "message", success ? nullToEmpty(done.getResult()) : nullToEmpty(done.getError())),
                success);

        if (success) {
            sendQuietly(String.format(":white_check_mark: Remediated %s on %s: %s",
                    issue.getName(), issue.getComponent(), done.getDescription()));
        } else {
            sendQuietly(String.format(":x: Remediation failed for %s on %s: %s. Issue stays open.",
                    issue.getName(), issue.getComponent(), done.getError()));
        }
    }

    private void recordSkip(Issue issue, RemediationPlan plan, RemediationGate.Admission admission) {
        String reason = admission.decision().reason();
        auditService.record("gate", AuditAction.GATE_SKIPPED, issue.getFingerprint(),
                Map.of("reason", reason, "action", plan.type().value(), "target", plan.target()));
        outcomeTracker.record(issue, admission.action());
        sendQuietly(String.format(":double_vertical_bar: Skipped %s for %s: %s",
                plan.description(), issue.getName(), reason));
    }

    private void sendQuietly(String text) {
        try {
            notificationChannel.notify(text);
        } catch (Exception e) {
            log.error("Failed to send notification: {}", e.getMessage());
        }
    }

    private static String nullToEmpty(String s) {
        return s != null ? s : "";
    }
}
