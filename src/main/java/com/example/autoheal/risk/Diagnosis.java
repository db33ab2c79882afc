package com.example.autoheal.risk;

/**
 * Untrusted oracle output. Any field may be null; riskLevel is raw text and
 * must be validated before use.
 */
public record Diagnosis(String rootCause, String remediation, String riskLevel, String reasoning) {
}
