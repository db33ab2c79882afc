package com.example.autoheal.alert;

import com.example.autoheal.config.AutohealProperties;
import com.example.autoheal.domain.Issue;
import com.example.autoheal.service.AuditService;
import com.example.autoheal.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class AlertManagerTest {

    private MutableClock clock;
    private AlertManager alertManager;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        alertManager = new AlertManager(new AutohealProperties(), clock, new SimpleMeterRegistry(),
                mock(AuditService.class));
    }

    @Test
    void repeatedFiringUpdatesOneIssueAndResolveMovesItToHistory() {
        Issue first = alertManager.ingest(alert("ContainerDown", "nginx", "warning", "firing"));
        Issue second = alertManager.ingest(alert("ContainerDown", "nginx", "warning", "firing"));

        assertSame(first, second);
        assertEquals(2, second.getOccurrences());
        assertEquals(1, alertManager.getActiveIssues().size());

        Issue resolved = alertManager.ingest(alert("ContainerDown", "nginx", "warning", "resolved"));

        assertEquals(first.getFingerprint(), resolved.getFingerprint());
        assertEquals(Issue.Status.RESOLVED, resolved.getStatus());
        assertNotNull(resolved.getResolvedAt());
        assertTrue(alertManager.getActiveIssues().isEmpty());
        assertEquals(1, alertManager.getResolvedHistory().size());
    }

    @Test
    void newIssueIsTypedFromAlertName() {
        Issue issue = alertManager.ingest(alert("ContainerDown", "nginx", "warning", "firing"));

        assertEquals(Issue.Status.FIRING, issue.getStatus());
        assertEquals(Issue.Severity.WARNING, issue.getSeverity());
        assertEquals("container_stopped", issue.getIssueType());
        assertEquals("nginx", issue.getComponent());
        assertEquals(Fingerprints.external("ContainerDown", "nginx"), issue.getFingerprint());
        assertNull(issue.getRiskLevel());
    }

    @Test
    void acknowledgmentDoesNotSurviveResolveAndRefire() {
        Issue issue = alertManager.ingest(alert("HighCPU", "web-1", "warning", "firing"));
        assertTrue(alertManager.acknowledge(issue.getFingerprint(), "alice").isPresent());
        assertEquals(Issue.Status.ACKNOWLEDGED, issue.getStatus());

        alertManager.ingest(alert("HighCPU", "web-1", "warning", "resolved"));
        Issue refired = alertManager.ingest(alert("HighCPU", "web-1", "warning", "firing"));

        assertEquals(Issue.Status.FIRING, refired.getStatus());
        assertNull(refired.getAcknowledgedBy());
        assertNull(refired.getAcknowledgedAt());
    }

    @Test
    void acknowledgeOnlyFromFiring() {
        Issue issue = alertManager.ingest(alert("HighCPU", "web-1", "warning", "firing"));

        assertTrue(alertManager.acknowledge(issue.getFingerprint(), "alice").isPresent());
        assertTrue(alertManager.acknowledge(issue.getFingerprint(), "bob").isEmpty());
        assertEquals("alice", issue.getAcknowledgedBy());
        assertTrue(alertManager.acknowledge("does-not-exist", "bob").isEmpty());
    }

    @Test
    void shortIdPrefixFindsIssue() {
        Issue issue = alertManager.ingest(alert("HighMemory", "db-1", "critical", "firing"));

        assertEquals(8, issue.shortId().length());
        assertEquals(issue, alertManager.getIssue(issue.shortId()).orElseThrow());
        assertTrue(alertManager.acknowledge(issue.shortId(), "alice").isPresent());
    }

    @Test
    void listenerFailureDoesNotAbortBatch() {
        List<String> seen = new ArrayList<>();
        alertManager.addListener(issue -> {
            throw new IllegalStateException("boom");
        });
        alertManager.addListener(issue -> seen.add(issue.getComponent()));

        List<AlertPayload> batch = List.of(
                alert("ContainerDown", "nginx", "warning", "firing"),
                AlertPayload.builder().status("firing").labels(Map.of("severity", "warning")).build(),
                alert("ServiceDown", "api", "critical", "firing"));

        List<Issue> issues = alertManager.ingestBatch(batch);

        assertEquals(2, issues.size());
        assertEquals(List.of("nginx", "api"), seen);
    }

    @Test
    void malformedAlertIsRejected() {
        AlertPayload noLabels = AlertPayload.builder().status("firing").labels(null).build();
        assertThrows(IngestionException.class, () -> alertManager.ingest(noLabels));
        assertTrue(alertManager.getActiveIssues().isEmpty());
    }

    @Test
    void resolutionOfUnknownFingerprintStoresNothing() {
        Issue issue = alertManager.ingest(alert("HostDown", "edge-7", "critical", "resolved"));

        assertEquals(Issue.Status.RESOLVED, issue.getStatus());
        assertTrue(alertManager.getActiveIssues().isEmpty());
        assertTrue(alertManager.getResolvedHistory().isEmpty());
    }

    @Test
    void lapsedSilenceFiresAgainOnNextSighting() {
        Issue issue = alertManager.ingest(alert("HighLatency", "gateway", "warning", "firing"));
        alertManager.silence(issue.shortId(), 10);
        assertEquals(Issue.Status.SILENCED, issue.getStatus());

        clock.advance(Duration.ofMinutes(5));
        alertManager.ingest(alert("HighLatency", "gateway", "warning", "firing"));
        assertEquals(Issue.Status.SILENCED, issue.getStatus());

        clock.advance(Duration.ofMinutes(6));
        alertManager.ingest(alert("HighLatency", "gateway", "warning", "firing"));
        assertEquals(Issue.Status.FIRING, issue.getStatus());
        assertNull(issue.getSilencedUntil());
    }

    @Test
    void webhookAlertsInheritGroupStatus() {
        Issue issue = alertManager.ingest(alert("DiskFull", "db-01", "critical", "firing"));

        AlertmanagerWebhook webhook = new AlertmanagerWebhook();
        webhook.setStatus("resolved");
        webhook.setAlerts(List.of(alert("DiskFull", "db-01", "critical", null)));
        alertManager.ingestWebhook(webhook);

        assertEquals(Issue.Status.RESOLVED, issue.getStatus());
    }

    @Test
    void upstreamFingerprintWins() {
        AlertPayload payload = alert("HighCPU", "web-1", "warning", "firing");
        payload.setFingerprint("abc123def456");

        Issue issue = alertManager.ingest(payload);

        assertEquals("abc123def456", issue.getFingerprint());
    }

    @Test
    void reportedIssueUsesLocalFingerprint() {
        DetectedIssue detected = new DetectedIssue("host", "localhost", "high_disk", Issue.Severity.WARNING,
                "Disk at 88%", Map.of("disk_percent", 88.0), "Clean up");

        Issue issue = alertManager.report(detected);
        Issue again = alertManager.report(detected);

        assertSame(issue, again);
        assertEquals(Fingerprints.local("host", "localhost", "high_disk"), issue.getFingerprint());
        assertEquals(1, alertManager.getActiveBySource("host").size());
    }

    @Test
    void statsCountByStatusAndSeverity() {
        Issue a = alertManager.ingest(alert("HighCPU", "web-1", "warning", "firing"));
        alertManager.ingest(alert("HighCPU", "web-2", "warning", "firing"));
        alertManager.ingest(alert("DiskFull", "db-01", "critical", "firing"));
        alertManager.acknowledge(a.getFingerprint(), "alice");

        Map<String, Object> stats = alertManager.getStats();

        assertEquals(3, stats.get("total_active"));
        @SuppressWarnings("unchecked")
        Map<String, Long> byStatus = (Map<String, Long>) stats.get("by_status");
        @SuppressWarnings("unchecked")
        Map<String, Long> bySeverity = (Map<String, Long>) stats.get("by_severity");
        assertEquals(2L, byStatus.get("firing"));
        assertEquals(1L, byStatus.get("acknowledged"));
        assertEquals(2L, bySeverity.get("warning"));
        assertEquals(1L, bySeverity.get("critical"));
    }

    @Test
    void activeIssuesSortedBySeverity() {
        alertManager.ingest(alert("HighCPU", "web-1", "warning", "firing"));
        alertManager.ingest(alert("DiskFull", "db-01", "critical", "firing"));

        List<Issue> active = alertManager.getActiveIssues();

        assertEquals(Issue.Severity.CRITICAL, active.get(0).getSeverity());
    }

    @Test
    void concurrentFiringOfOneAlertCreatesOneIssue() throws Exception {
        AtomicInteger created = new AtomicInteger();
        alertManager.addListener(issue -> created.incrementAndGet());
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Issue>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return alertManager.ingest(alert("ServiceDown", "api", "critical", "firing"));
                }));
            }
            start.countDown();

            Set<Issue> distinct = Collections.newSetFromMap(new IdentityHashMap<>());
            for (Future<Issue> result : results) {
                distinct.add(result.get(10, TimeUnit.SECONDS));
            }

            assertEquals(1, distinct.size());
            assertEquals(1, created.get());
            assertEquals(1, alertManager.getActiveIssues().size());
            assertEquals(threads, alertManager.getActiveIssues().get(0).getOccurrences());
        } finally {
            pool.shutdownNow();
        }
    }

    private static AlertPayload alert(String name, String instance, String severity, String status) {
        Map<String, String> labels = new HashMap<>();
        labels.put("alertname", name);
        labels.put("instance", instance);
        labels.put("severity", severity);
        Map<String, String> annotations = new HashMap<>();
        annotations.put("summary", name + " on " + instance);
        return AlertPayload.builder()
                .status(status)
                .labels(labels)
                .annotations(annotations)
                .build();
    }
}
