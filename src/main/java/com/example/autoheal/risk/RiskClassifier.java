package com.example.autoheal.risk;

import com.example.autoheal.config.AutohealProperties;
import com.example.autoheal.domain.Issue;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Assigns a risk tier to an issue. The oracle is asked first with a bounded
 * timeout; on timeout, failure or an empty answer the static table decides.
 * A saturated diagnosis pool counts as a failure. An unrecognized risk string
 * from the oracle is MEDIUM, never LOW.
 */
@Slf4j
@Service
public class RiskClassifier {

    static final String SOURCE_ORACLE = "oracle";
    static final String SOURCE_STATIC = "static_table";

    private final DiagnosisOracle oracle;
    private final AutohealProperties properties;
    private final Executor diagnosisExecutor;
    private final MeterRegistry meterRegistry;

    public RiskClassifier(DiagnosisOracle oracle,
                          AutohealProperties properties,
                          @Qualifier("diagnosisExecutor") Executor diagnosisExecutor,
                          MeterRegistry meterRegistry) {
        this.oracle = oracle;
        this.properties = properties;
        this.diagnosisExecutor = diagnosisExecutor;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Classify and stamp the result onto the issue.
     */
    public Classification classify(Issue issue) {
        Classification classification = diagnose(issue)
                .map(d -> fromDiagnosis(issue, d))
                .orElseGet(() -> fromTable(issue));

        issue.setRiskLevel(classification.riskLevel());
        issue.setSuggestedFix(classification.suggestedFix());
        classification.metadata().forEach((k, v) -> issue.getMetrics().put(k, v));

        meterRegistry.counter("autoheal.classifications",
                "risk", classification.riskLevel().name(),
                "source", String.valueOf(classification.metadata().get("risk_source"))).increment();
        log.info("Issue {} ({}) classified as {} via {}", issue.shortId(), issue.getIssueType(),
                classification.riskLevel(), classification.metadata().get("risk_source"));
        return classification;
    }

    private Optional<Diagnosis> diagnose(Issue issue) {
        if (!properties.getDiagnosis().isEnabled() || !oracle.isAvailable()) {
            return Optional.empty();
        }
        CompletableFuture<Diagnosis> call;
        try {
            call = CompletableFuture.supplyAsync(() -> oracle.diagnose(issue), diagnosisExecutor);
        } catch (RejectedExecutionException e) {
            log.warn("Diagnosis pool saturated, using static risk table for {}", issue.shortId());
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(call.get(properties.getDiagnosis().getTimeoutSeconds(), TimeUnit.SECONDS));
        } catch (TimeoutException e) {
            call.cancel(true);
            log.warn("Diagnosis of {} timed out after {}s, using static risk table",
                    issue.shortId(), properties.getDiagnosis().getTimeoutSeconds());
        } catch (ExecutionException e) {
            log.error("Diagnosis of {} failed: {}", issue.shortId(),
                    e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Diagnosis of {} interrupted", issue.shortId());
        }
        return Optional.empty();
    }

    private Classification fromDiagnosis(Issue issue, Diagnosis diagnosis) {
        Issue.RiskLevel risk;
        if (isBlank(diagnosis.riskLevel())) {
            risk = DefaultRiskTable.defaultFor(issue.getIssueType());
        } else {
            risk = Issue.RiskLevel.parse(diagnosis.riskLevel()).orElseGet(() -> {
                log.warn("Oracle returned unrecognized risk '{}' for {}, treating as MEDIUM",
                        diagnosis.riskLevel(), issue.shortId());
                return Issue.RiskLevel.MEDIUM;
            });
        }
        String fix = !isBlank(diagnosis.remediation()) ? diagnosis.remediation() : fallbackFix(issue);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("root_cause", !isBlank(diagnosis.rootCause()) ? diagnosis.rootCause() : "Unknown");
        metadata.put("reasoning", diagnosis.reasoning() != null ? diagnosis.reasoning() : "");
        metadata.put("risk_source", SOURCE_ORACLE);
        return new Classification(risk, fix, metadata);
    }

    private Classification fromTable(Issue issue) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("risk_source", SOURCE_STATIC);
        return new Classification(DefaultRiskTable.defaultFor(issue.getIssueType()), fallbackFix(issue), metadata);
    }

    private static String fallbackFix(Issue issue) {
        return !isBlank(issue.getSuggestedFix()) ? issue.getSuggestedFix() : "Investigate " + issue.getName();
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
