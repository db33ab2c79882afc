package com.example.autoheal.remediation;

import com.example.autoheal.domain.RemediationAction.RemediationType;

/**
 * What would be done for an issue, before the gate has decided whether it may be done.
 *
 * @param target cooldown scope, e.g. {@code container:nginx}
 */
public record RemediationPlan(RemediationType type, String target, String description) {
}
