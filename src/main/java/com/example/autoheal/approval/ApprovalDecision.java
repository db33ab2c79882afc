package com.example.autoheal.approval;

public enum ApprovalDecision {
    APPROVED("approved"),
    REJECTED("rejected"),
    EXPIRED("expired"),
    NOT_FOUND("not_found");

    private final String reason;

    ApprovalDecision(String reason) {
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
