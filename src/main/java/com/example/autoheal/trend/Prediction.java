package com.example.autoheal.trend;

import com.example.autoheal.domain.Issue;

import java.time.Instant;
import java.util.Locale;
import java.util.Map;

public record Prediction(Type type,
                         String component,
                         Instant predictedTime,
                         double hoursUntil,
                         Confidence confidence,
                         Issue.Severity severity,
                         String description,
                         String recommendation,
                         Map<String, Object> supportingData,
                         Instant createdAt) {

    public enum Type {
        DISK_FULL, MEMORY_EXHAUSTION, SERVICE_FAILURE;

        /** Issue type used when a forecast is turned into an issue */
        public String issueType() {
            return "predicted_" + name().toLowerCase(Locale.ROOT);
        }
    }

    public enum Confidence {
        LOW, MEDIUM, HIGH
    }

    /** Worth telling a human about: at least MEDIUM confidence and WARNING severity */
    public boolean isActionable() {
        return confidence != Confidence.LOW && severity != Issue.Severity.INFO;
    }
}
