package com.example.autoheal.monitoring;

import com.example.autoheal.alert.AlertManager;
import com.example.autoheal.alert.DetectedIssue;
import com.example.autoheal.config.AutohealProperties;
import com.example.autoheal.domain.Issue;
import com.example.autoheal.service.AuditService;
import com.example.autoheal.support.MutableClock;
import com.example.autoheal.trend.TrendDetector;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class HealthSweepServiceTest {

    private MutableClock clock;
    private AutohealProperties properties;
    private AlertManager alertManager;
    private TrendDetector trendDetector;
    private StubProbe docker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        properties = new AutohealProperties();
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        alertManager = new AlertManager(properties, clock, registry, mock(AuditService.class));
        trendDetector = new TrendDetector(properties, clock);
        docker = new StubProbe("docker");
    }

    @Test
    void reportedIssuesAreResolvedWhenConditionClears() {
        HealthSweepService sweep = service(List.of(docker));
        docker.issues.add(stopped("nginx"));
        docker.issues.add(stopped("redis"));

        HealthSweepService.SweepResult first = sweep.sweep();
        assertThat(first.issuesReported()).isEqualTo(2);
        assertThat(alertManager.getActiveBySource("docker")).hasSize(2);

        docker.issues.remove(1);
        HealthSweepService.SweepResult second = sweep.sweep();

        assertThat(second.issuesResolved()).isEqualTo(1);
        assertThat(alertManager.getActiveBySource("docker"))
                .extracting(Issue::getComponent)
                .containsExactly("nginx");
        assertThat(alertManager.getResolvedHistory().get(0).getResolution()).isEqualTo("Condition cleared");
    }

    @Test
    void repeatedSightingsDoNotDuplicate() {
        HealthSweepService sweep = service(List.of(docker));
        docker.issues.add(stopped("nginx"));

        sweep.sweep();
        sweep.sweep();

        assertThat(alertManager.getActiveIssues()).hasSize(1);
        assertThat(alertManager.getActiveIssues().get(0).getOccurrences()).isEqualTo(2);
    }

    @Test
    void failingProbeIsReportedAndOthersStillRun() {
        StubProbe broken = new StubProbe("broken");
        broken.failure = new IllegalStateException("permission denied");
        docker.issues.add(stopped("nginx"));

        HealthSweepService.SweepResult result = service(List.of(broken, docker)).sweep();

        assertThat(result.probeFailures()).isEqualTo(1);
        assertThat(alertManager.getActiveBySource("docker")).hasSize(1);
        Issue error = alertManager.getActiveBySource("broken").get(0);
        assertThat(error.getIssueType()).isEqualTo("monitoring_error");
        assertThat(error.getSeverity()).isEqualTo(Issue.Severity.CRITICAL);
    }

    @Test
    void samplesFeedTrendDetector() {
        docker.samples.add(new ProbeSample("localhost", TrendDetector.DISK_USAGE, 71.5));

        service(List.of(docker)).sweep();

        assertThat(trendDetector.samples("localhost", TrendDetector.DISK_USAGE)).hasSize(1);
    }

    @Test
    void noProbesIsANoOp() {
        assertThat(service(List.of()).sweep()).isEqualTo(new HealthSweepService.SweepResult(0, 0, 0, 0));
    }

    private HealthSweepService service(List<HealthProbe> probes) {
        return new HealthSweepService(probes, alertManager, trendDetector, properties, clock, new SimpleMeterRegistry());
    }

    private static DetectedIssue stopped(String container) {
        return new DetectedIssue("docker", container, "container_stopped", Issue.Severity.WARNING,
                "Container " + container + " exited", Map.of("container", container), "Restart it");
    }

    private static class StubProbe implements HealthProbe {

        private final String name;
        private final List<DetectedIssue> issues = new ArrayList<>();
        private final List<ProbeSample> samples = new ArrayList<>();
        private Exception failure;

        StubProbe(String name) {
            this.name = name;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public List<DetectedIssue> probe() throws Exception {
            if (failure != null) throw failure;
            return new ArrayList<>(issues);
        }

        @Override
        public List<ProbeSample> collectSamples() {
            return samples;
        }
    }
}
