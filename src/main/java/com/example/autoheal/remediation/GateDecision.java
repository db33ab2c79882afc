package com.example.autoheal.remediation;

/**
 * Outcome of the remediation gate. Skips and approval requests carry a stable
 * reason string so every automated decision stays attributable.
 */
public record GateDecision(Verdict verdict, String reason) {

    public static final String REASON_ELIGIBLE = "eligible";
    public static final String REASON_COOLDOWN = "cooldown";
    public static final String REASON_RATE_LIMIT = "rate_limit";
    public static final String REASON_APPROVAL_REQUIRED = "approval_required";
    public static final String REASON_NO_REMEDIATION = "no_remediation";
    public static final String REASON_ISSUE_RESOLVED = "issue_resolved";
    public static final String REASON_OVERLOADED = "overloaded";

    public enum Verdict {
        AUTO_EXECUTE, NEEDS_APPROVAL, SKIPPED
    }

    public static GateDecision autoExecute() {
        return new GateDecision(Verdict.AUTO_EXECUTE, REASON_ELIGIBLE);
    }

    public static GateDecision needsApproval() {
        return new GateDecision(Verdict.NEEDS_APPROVAL, REASON_APPROVAL_REQUIRED);
    }

    public static GateDecision skipped(String reason) {
        return new GateDecision(Verdict.SKIPPED, reason);
    }

    public boolean isSkipped() {
        return verdict == Verdict.SKIPPED;
    }
}
