package com.example.autoheal.remediation;

import com.example.autoheal.domain.Issue;
import com.example.autoheal.domain.RemediationAction;

import java.time.Instant;

/**
 * One issue occurrence as seen by the outcome history, with the last action taken on it (if any).
 */
public record Outcome(String fingerprint,
                      String component,
                      String issueType,
                      Issue.Severity severity,
                      Instant startedAt,
                      Instant resolvedAt,
                      boolean resolved,
                      String actionId,
                      RemediationAction.RemediationType actionType,
                      RemediationAction.ActionStatus actionStatus,
                      Instant recordedAt) {
}
