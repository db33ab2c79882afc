package com.example.autoheal.trend;

import com.example.autoheal.alert.AlertManager;
import com.example.autoheal.alert.DetectedIssue;
import com.example.autoheal.config.AutohealProperties;
import com.example.autoheal.domain.Issue;
import com.example.autoheal.notification.NotificationChannel;
import com.example.autoheal.remediation.OutcomeTracker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Periodic forecasting sweep. Keeps the latest predictions, tells humans about
 * the actionable ones and, when enabled, turns them into issues that resolve
 * themselves once the forecast clears.
 */
@Slf4j
@Service
public class PredictiveAnalysisService {

    static final String SOURCE = "predictive";

    private final TrendDetector trendDetector;
    private final OutcomeTracker outcomeTracker;
    private final AlertManager alertManager;
    private final NotificationChannel notificationChannel;
    private final AutohealProperties properties;
    private final Clock clock;

    private volatile List<Prediction> latest = List.of();
    private volatile Instant lastAnalysisAt;

    public PredictiveAnalysisService(TrendDetector trendDetector,
                                     OutcomeTracker outcomeTracker,
                                     AlertManager alertManager,
                                     NotificationChannel notificationChannel,
                                     AutohealProperties properties,
                                     Clock clock) {
        this.trendDetector = trendDetector;
        this.outcomeTracker = outcomeTracker;
        this.alertManager = alertManager;
        this.notificationChannel = notificationChannel;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "#{${autoheal.prediction.interval-minutes:60} * 60 * 1000}",
            initialDelayString = "#{${autoheal.prediction.interval-minutes:60} * 60 * 1000}")
    public void scheduledAnalysis() {
        if (!properties.getPrediction().isEnabled()) {
            return;
        }
        try {
            analyze();
        } catch (Exception e) {
            log.error("Predictive analysis failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Run one sweep now. Also used by the REST API.
     */
    public List<Prediction> analyze() {
        Map<String, List<Instant>> failures = new HashMap<>();
        for (String component : outcomeTracker.components()) {
            failures.put(component, outcomeTracker.failureTimes(component));
        }
        List<Prediction> predictions = trendDetector.analyzeAll(failures);
        latest = List.copyOf(predictions);
        lastAnalysisAt = clock.instant();
        log.info("Predictive analysis produced {} predictions", predictions.size());

        List<Prediction> actionable = predictions.stream().filter(Prediction::isActionable).toList();
        for (Prediction p : actionable) {
            try {
                notificationChannel.notify(String.format(":crystal_ball: %s predicted on %s in %.1fh (%s confidence): %s. %s",
                        p.type(), p.component(), p.hoursUntil(), p.confidence(), p.description(), p.recommendation()));
            } catch (Exception e) {
                log.error("Failed to send prediction notice: {}", e.getMessage());
            }
        }

        if (properties.getPrediction().isSpawnIssues()) {
            syncPredictedIssues(actionable);
        }
        return predictions;
    }

    public void recordSample(String component, String metric, double value, Instant timestamp) {
        trendDetector.addSample(component, metric, value, timestamp);
    }

    public List<Prediction> getLatestPredictions() {
        return latest;
    }

    public Map<String, Object> generateReport() {
        List<Prediction> predictions = latest;
        Map<String, Object> report = new LinkedHashMap<>();
        report.put("generated_at", clock.instant().toString());
        report.put("last_analysis_at", lastAnalysisAt != null ? lastAnalysisAt.toString() : null);
        report.put("total_predictions", predictions.size());
        report.put("by_type", predictions.stream()
                .collect(Collectors.groupingBy(p -> p.type().name(), TreeMap::new, Collectors.counting())));
        report.put("critical", predictions.stream()
                .filter(p -> p.severity() == Issue.Severity.CRITICAL)
                .sorted(Comparator.comparingDouble(Prediction::hoursUntil))
                .toList());
        report.put("series_tracked", trendDetector.seriesKeys().size());
        return report;
    }

    private void syncPredictedIssues(List<Prediction> actionable) {
        Set<String> current = new HashSet<>();
        for (Prediction p : actionable) {
            Map<String, Object> metrics = new LinkedHashMap<>(p.supportingData());
            metrics.put("hours_until", Math.round(p.hoursUntil() * 10) / 10.0);
            metrics.put("confidence", p.confidence().name());
            metrics.put("predicted_time", p.predictedTime().toString());
            DetectedIssue detected = new DetectedIssue(SOURCE, p.component(), p.type().issueType(),
                    p.severity(), p.description(), metrics, p.recommendation());
            current.add(detected.fingerprint());
            alertManager.report(detected);
        }
        for (Issue issue : alertManager.getActiveBySource(SOURCE)) {
            if (!current.contains(issue.getFingerprint())) {
                alertManager.resolve(issue.getFingerprint(), "Forecast cleared");
            }
        }
    }
}
