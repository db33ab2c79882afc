package com.example.autoheal.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * The dedup and lifecycle unit. At most one open Issue exists per fingerprint;
 * repeat sightings update it in place.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Issue {

    private String fingerprint;

    /** alertmanager, api, predictive or the name of the health probe that reported it */
    private String source;

    /** Alert name as reported upstream (alertname label for external alerts) */
    private String name;

    /** Normalized type used for risk defaults and remediation planning, e.g. container_stopped */
    private String issueType;

    private String component;

    private Status status;

    private Severity severity;

    /** Absent until classified */
    private RiskLevel riskLevel;

    private String description;

    private String suggestedFix;

    private String resolution;

    @Builder.Default
    private Map<String, String> labels = new HashMap<>();

    @Builder.Default
    private Map<String, String> annotations = new HashMap<>();

    @Builder.Default
    private Map<String, Object> metrics = new HashMap<>();

    private Instant startedAt;

    private Instant updatedAt;

    private Instant resolvedAt;

    private Instant acknowledgedAt;

    private String acknowledgedBy;

    private Instant silencedUntil;

    @Builder.Default
    private int occurrences = 1;

    public enum Status {
        FIRING, ACKNOWLEDGED, SILENCED, RESOLVED
    }

    public enum Severity {
        CRITICAL, WARNING, INFO;

        public static Severity fromLabel(String label) {
            if (label == null) return INFO;
            return switch (label.trim().toLowerCase(Locale.ROOT)) {
                case "critical", "page", "error" -> CRITICAL;
                case "warning", "warn" -> WARNING;
                default -> INFO;
            };
        }
    }

    public enum RiskLevel {
        LOW, MEDIUM, HIGH;

        /**
         * Strict parse of an untrusted risk string. Only low, medium and high are accepted.
         */
        public static Optional<RiskLevel> parse(String value) {
            if (value == null) return Optional.empty();
            return switch (value.trim().toLowerCase(Locale.ROOT)) {
                case "low" -> Optional.of(LOW);
                case "medium" -> Optional.of(MEDIUM);
                case "high" -> Optional.of(HIGH);
                default -> Optional.empty();
            };
        }
    }

    public boolean isOpen() {
        return status != Status.RESOLVED;
    }

    /** User-facing short id (first 8 chars of the fingerprint) */
    public String shortId() {
        return fingerprint == null || fingerprint.length() <= 8 ? fingerprint : fingerprint.substring(0, 8);
    }

    public boolean isSilencedAt(Instant now) {
        return status == Status.SILENCED && silencedUntil != null && now.isBefore(silencedUntil);
    }
}
