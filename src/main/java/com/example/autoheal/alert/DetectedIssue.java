package com.example.autoheal.alert;

import com.example.autoheal.domain.Issue;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * A locally detected condition, reported by a health probe or the predictive sweep.
 */
public record DetectedIssue(String source,
                            String component,
                            String issueType,
                            Issue.Severity severity,
                            String description,
                            Map<String, Object> metrics,
                            String suggestedFix) {

    public DetectedIssue {
        metrics = metrics != null ? Collections.unmodifiableMap(new HashMap<>(metrics)) : Map.of();
    }

    public String fingerprint() {
        return Fingerprints.local(source, component, issueType);
    }
}
