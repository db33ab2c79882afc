package com.example.autoheal.monitoring;

import com.example.autoheal.alert.AlertManager;
import com.example.autoheal.alert.DetectedIssue;
import com.example.autoheal.config.AutohealProperties;
import com.example.autoheal.domain.Issue;
import com.example.autoheal.trend.TrendDetector;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Polls every {@link HealthProbe} on a schedule, reports what they find and
 * resolves their issues once the condition is gone.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HealthSweepService {

    static final String MONITORING_ERROR = "monitoring_error";

    private final List<HealthProbe> probes;
    private final AlertManager alertManager;
    private final TrendDetector trendDetector;
    private final AutohealProperties properties;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    public record SweepResult(int probes, int issuesReported, int issuesResolved, int probeFailures) {
    }

    @Scheduled(fixedDelayString = "#{${autoheal.health.interval-seconds:60} * 1000}", initialDelay = 30_000)
    public void scheduledSweep() {
        if (!properties.getHealth().isEnabled()) return;
        try {
            sweep();
        } catch (Exception e) {
            log.error("Health sweep failed: {}", e.getMessage());
        }
    }

    public SweepResult sweep() {
        int reported = 0;
        int resolved = 0;
        int failures = 0;
        Instant now = clock.instant();

        for (HealthProbe probe : probes) {
            try {
                for (ProbeSample sample : probe.collectSamples()) {
                    trendDetector.addSample(sample.component(), sample.metric(), sample.value(), now);
                }
            } catch (Exception e) {
                log.error("Sample collection failed for probe {}: {}", probe.name(), e.getMessage());
            }

            List<DetectedIssue> found;
            try {
                found = probe.probe();
            } catch (Exception e) {
                failures++;
                log.error("Health probe {} failed: {}", probe.name(), e.getMessage());
                meterRegistry.counter("autoheal.health.probe_failures", "probe", probe.name()).increment();
                alertManager.report(new DetectedIssue(probe.name(), probe.name(), MONITORING_ERROR,
                        Issue.Severity.CRITICAL, "Health probe " + probe.name() + " failed: " + e.getMessage(),
                        Map.of("probe", probe.name()), "Check the monitoring probe and its access to the host"));
                reported++;
                continue;
            }

            Set<String> seen = new HashSet<>();
            for (DetectedIssue detected : found) {
                alertManager.report(detected);
                seen.add(detected.fingerprint());
                reported++;
            }
            for (Issue issue : alertManager.getActiveBySource(probe.name())) {
                if (!seen.contains(issue.getFingerprint())) {
                    alertManager.resolve(issue.getFingerprint(), "Condition cleared");
                    resolved++;
                }
            }
        }
        log.debug("Health sweep: {} probes, {} issues reported, {} resolved, {} probe failures",
                probes.size(), reported, resolved, failures);
        return new SweepResult(probes.size(), reported, resolved, failures);
    }
}
