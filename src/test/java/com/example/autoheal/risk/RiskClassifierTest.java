package com.example.autoheal.risk;

import com.example.autoheal.config.AutohealProperties;
import com.example.autoheal.domain.Issue;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class RiskClassifierTest {

    private DiagnosisOracle oracle;
    private AutohealProperties properties;
    private ExecutorService executor;
    private RiskClassifier classifier;

    @BeforeEach
    void setUp() {
        oracle = mock(DiagnosisOracle.class);
        properties = new AutohealProperties();
        properties.getDiagnosis().setEnabled(true);
        properties.getDiagnosis().setTimeoutSeconds(1);
        executor = Executors.newCachedThreadPool();
        classifier = new RiskClassifier(oracle, properties, executor, new SimpleMeterRegistry());
        when(oracle.isAvailable()).thenReturn(true);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void oracleFailureFallsBackToStaticTable() {
        when(oracle.diagnose(any())).thenThrow(new DiagnosisException("connection refused"));
        Issue issue = issue("high_memory");

        Classification result = classifier.classify(issue);

        assertThat(result.riskLevel()).isEqualTo(Issue.RiskLevel.MEDIUM);
        assertThat(issue.getRiskLevel()).isEqualTo(Issue.RiskLevel.MEDIUM);
        assertThat(issue.getMetrics()).containsEntry("risk_source", "static_table");
    }

    @Test
    void unrecognizedRiskIsMediumNotLow() {
        when(oracle.diagnose(any())).thenReturn(new Diagnosis("disk", "clean up", "critical", "looks bad"));

        Classification result = classifier.classify(issue("high_disk"));

        assertThat(result.riskLevel()).isEqualTo(Issue.RiskLevel.MEDIUM);
        assertThat(result.metadata()).containsEntry("risk_source", "oracle");
    }

    @Test
    void oracleRiskIsParsedLeniently() {
        when(oracle.diagnose(any())).thenReturn(new Diagnosis("stopped", "restart it", " Low ", "safe"));
        Issue issue = issue("service_stopped");

        Classification result = classifier.classify(issue);

        assertThat(result.riskLevel()).isEqualTo(Issue.RiskLevel.LOW);
        assertThat(issue.getSuggestedFix()).isEqualTo("restart it");
        assertThat(issue.getMetrics())
                .containsEntry("root_cause", "stopped")
                .containsEntry("reasoning", "safe")
                .containsEntry("risk_source", "oracle");
    }

    @Test
    void blankOracleRiskUsesTableDefault() {
        when(oracle.diagnose(any())).thenReturn(new Diagnosis("full", null, null, null));

        Classification result = classifier.classify(issue("disk_full"));

        assertThat(result.riskLevel()).isEqualTo(Issue.RiskLevel.HIGH);
        assertThat(result.suggestedFix()).isEqualTo("Free disk space");
    }

    @Test
    void slowOracleTimesOut() {
        when(oracle.diagnose(any())).thenAnswer(invocation -> {
            Thread.sleep(5_000);
            return new Diagnosis("late", "late", "low", "late");
        });

        long started = System.nanoTime();
        Classification result = classifier.classify(issue("high_memory"));
        long elapsedMillis = (System.nanoTime() - started) / 1_000_000;

        assertThat(result.riskLevel()).isEqualTo(Issue.RiskLevel.MEDIUM);
        assertThat(result.metadata()).containsEntry("risk_source", "static_table");
        assertThat(elapsedMillis).isLessThan(4_000);
    }

    @Test
    void unavailableOracleIsNotCalled() {
        when(oracle.isAvailable()).thenReturn(false);

        Classification result = classifier.classify(issue("container_stopped"));

        assertThat(result.riskLevel()).isEqualTo(Issue.RiskLevel.LOW);
        verify(oracle, never()).diagnose(any());
    }

    @Test
    void disabledDiagnosisSkipsOracle() {
        properties.getDiagnosis().setEnabled(false);

        classifier.classify(issue("container_stopped"));

        verify(oracle, never()).diagnose(any());
    }

    @Test
    void unknownIssueTypeIsMedium() {
        when(oracle.isAvailable()).thenReturn(false);

        assertThat(classifier.classify(issue("something_new")).riskLevel()).isEqualTo(Issue.RiskLevel.MEDIUM);
        assertThat(classifier.classify(issue("predicted_disk_full")).riskLevel()).isEqualTo(Issue.RiskLevel.MEDIUM);
    }

    @Test
    void saturatedPoolFallsBackWithoutCallingOracleOnCaller() throws Exception {
        ThreadPoolExecutor saturated = new ThreadPoolExecutor(1, 1, 0, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(1), new ThreadPoolExecutor.AbortPolicy());
        CountDownLatch release = new CountDownLatch(1);
        try {
            saturated.execute(() -> awaitQuietly(release));
            saturated.execute(() -> awaitQuietly(release));
            when(oracle.diagnose(any())).thenReturn(new Diagnosis("mem", "restart", "low", "late"));
            RiskClassifier busy = new RiskClassifier(oracle, properties, saturated, new SimpleMeterRegistry());
            Issue issue = issue("high_memory");

            Classification result = busy.classify(issue);

            assertThat(result.riskLevel()).isEqualTo(Issue.RiskLevel.MEDIUM);
            assertThat(issue.getMetrics()).containsEntry("risk_source", "static_table");
            verify(oracle, never()).diagnose(any());
        } finally {
            release.countDown();
            saturated.shutdownNow();
        }
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(10, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static Issue issue(String type) {
        return Issue.builder()
                .fingerprint("f00dfeed" + type)
                .source("api")
                .name(type)
                .issueType(type)
                .component("web-1")
                .status(Issue.Status.FIRING)
                .severity(Issue.Severity.WARNING)
                .description(type + " on web-1")
                .suggestedFix("Free disk space")
                .startedAt(Instant.parse("2024-05-01T10:00:00Z"))
                .build();
    }
}
