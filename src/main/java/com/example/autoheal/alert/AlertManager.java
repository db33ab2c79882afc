package com.example.autoheal.alert;

import com.example.autoheal.config.AutohealProperties;
import com.example.autoheal.domain.AuditAction;
import com.example.autoheal.domain.Issue;
import com.example.autoheal.service.AuditService;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Deduplicates incoming alerts and locally detected issues into one open
 * {@link Issue} per fingerprint and owns the issue lifecycle.
 *
 * All mutations happen under a single lock. Listener callbacks run after the
 * lock is released.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AlertManager {

    private static final int MAX_RESOLVED_HISTORY = 1000;

    private final AutohealProperties properties;
    private final Clock clock;
    private final MeterRegistry meterRegistry;
    private final AuditService auditService;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Issue> activeIssues = new LinkedHashMap<>();
    private final Deque<Issue> resolvedHistory = new ArrayDeque<>();
    private final List<IssueListener> listeners = new CopyOnWriteArrayList<>();

    public void addListener(IssueListener listener) {
        listeners.add(listener);
    }

    public void removeListener(IssueListener listener) {
        listeners.remove(listener);
    }

    /**
     * Ingest an Alertmanager webhook. Alerts without their own status inherit the group status.
     */
    public List<Issue> ingestWebhook(AlertmanagerWebhook webhook) {
        if (webhook == null || webhook.getAlerts() == null) return List.of();
        for (AlertPayload alert : webhook.getAlerts()) {
            if (alert != null && (alert.getStatus() == null || alert.getStatus().isBlank())) {
                alert.setStatus(webhook.getStatus());
            }
        }
        return ingestBatch(webhook.getAlerts());
    }

    /**
     * Ingest a batch of alerts. A malformed alert is logged and skipped.
     */
    public List<Issue> ingestBatch(List<AlertPayload> alerts) {
        List<Issue> issues = new ArrayList<>();
        for (AlertPayload alert : alerts) {
            try {
                issues.add(ingest(alert));
            } catch (IngestionException e) {
                log.warn("Skipping malformed alert: {}", e.getMessage());
                meterRegistry.counter("autoheal.alerts.rejected").increment();
            }
        }
        return issues;
    }

    /**
     * Ingest a single alert.
     *
     * @throws IngestionException if the alert has no labels or no alertname
     */
    public Issue ingest(AlertPayload alert) {
        if (alert == null || alert.getLabels() == null || alert.getLabels().isEmpty()) {
            throw new IngestionException("alert has no labels");
        }
        Map<String, String> labels = alert.getLabels();
        String alertName = labels.get("alertname");
        if (alertName == null || alertName.isBlank()) {
            throw new IngestionException("alert has no alertname label");
        }
        Map<String, String> annotations = alert.getAnnotations() != null ? alert.getAnnotations() : Map.of();

        String instance = labels.getOrDefault("instance", "");
        String fingerprint = alert.getFingerprint() != null && !alert.getFingerprint().isBlank()
                ? alert.getFingerprint()
                : Fingerprints.external(alertName, instance);
        AlertCatalog.Entry entry = AlertCatalog.lookup(alertName);
        String description = firstNonBlank(annotations.get("description"), annotations.get("summary"), alertName);

        meterRegistry.counter("autoheal.alerts.ingested", "status", alert.isResolved() ? "resolved" : "firing")
                .increment();

        Instant now = clock.instant();
        if (alert.isResolved()) {
            Issue resolved;
            lock.lock();
            try {
                Issue existing = activeIssues.get(fingerprint);
                if (existing == null) {
                    log.debug("Resolution for unknown fingerprint {}", shortId(fingerprint));
                    return Issue.builder()
                            .fingerprint(fingerprint)
                            .source("alertmanager")
                            .name(alertName)
                            .issueType(entry.issueType())
                            .component(componentOf(labels))
                            .status(Issue.Status.RESOLVED)
                            .severity(Issue.Severity.fromLabel(labels.get("severity")))
                            .description(description)
                            .labels(new HashMap<>(labels))
                            .annotations(new HashMap<>(annotations))
                            .startedAt(alert.getStartsAt() != null ? alert.getStartsAt() : now)
                            .updatedAt(now)
                            .resolvedAt(alert.getEndsAt() != null ? alert.getEndsAt() : now)
                            .resolution("Resolved upstream")
                            .build();
                }
                existing.setDescription(description);
                existing.getLabels().putAll(labels);
                existing.getAnnotations().putAll(annotations);
                resolved = markResolved(existing, "Resolved upstream", now);
            } finally {
                lock.unlock();
            }
            fireResolved(resolved);
            return resolved;
        }

        Issue created;
        lock.lock();
        try {
            Issue existing = activeIssues.get(fingerprint);
            if (existing != null) {
                existing.setDescription(description);
                existing.getLabels().putAll(labels);
                existing.getAnnotations().putAll(annotations);
                touch(existing, now);
                return existing;
            }
            created = Issue.builder()
                    .fingerprint(fingerprint)
                    .source("alertmanager")
                    .name(alertName)
                    .issueType(entry.issueType())
                    .component(componentOf(labels))
                    .status(Issue.Status.FIRING)
                    .severity(Issue.Severity.fromLabel(labels.get("severity")))
                    .description(description)
                    .suggestedFix(entry.suggestedFix())
                    .labels(new HashMap<>(labels))
                    .annotations(new HashMap<>(annotations))
                    .startedAt(alert.getStartsAt() != null ? alert.getStartsAt() : now)
                    .updatedAt(now)
                    .build();
            activeIssues.put(fingerprint, created);
        } finally {
            lock.unlock();
        }
        fireCreated(created);
        return created;
    }

    /**
     * Report a locally detected issue. Repeat reports update the open issue in place.
     */
    public Issue report(DetectedIssue detected) {
        String fingerprint = detected.fingerprint();
        Instant now = clock.instant();
        Issue created;
        lock.lock();
        try {
            Issue existing = activeIssues.get(fingerprint);
            if (existing != null) {
                existing.setDescription(detected.description());
                existing.getMetrics().putAll(detected.metrics());
                touch(existing, now);
                return existing;
            }
            created = Issue.builder()
                    .fingerprint(fingerprint)
                    .source(detected.source())
                    .name(detected.issueType())
                    .issueType(detected.issueType())
                    .component(detected.component())
                    .status(Issue.Status.FIRING)
                    .severity(detected.severity() != null ? detected.severity() : Issue.Severity.WARNING)
                    .description(detected.description())
                    .suggestedFix(detected.suggestedFix())
                    .metrics(new HashMap<>(detected.metrics()))
                    .startedAt(now)
                    .updatedAt(now)
                    .build();
            activeIssues.put(fingerprint, created);
        } finally {
            lock.unlock();
        }
        fireCreated(created);
        return created;
    }

    /**
     * Resolve an open issue, e.g. after a successful remediation or when a local condition clears.
     */
    public Optional<Issue> resolve(String idOrPrefix, String resolution) {
        Issue resolved;
        lock.lock();
        try {
            Issue issue = find(idOrPrefix);
            if (issue == null) return Optional.empty();
            resolved = markResolved(issue, resolution, clock.instant());
        } finally {
            lock.unlock();
        }
        fireResolved(resolved);
        return Optional.of(resolved);
    }

    /**
     * Acknowledge a firing issue. Empty if the issue is unknown or not FIRING.
     */
    public Optional<Issue> acknowledge(String idOrPrefix, String actor) {
        lock.lock();
        try {
            Issue issue = find(idOrPrefix);
            if (issue == null || issue.getStatus() != Issue.Status.FIRING) return Optional.empty();
            Instant now = clock.instant();
            issue.setStatus(Issue.Status.ACKNOWLEDGED);
            issue.setAcknowledgedAt(now);
            issue.setAcknowledgedBy(actor);
            issue.setUpdatedAt(now);
            log.info("Issue {} acknowledged by {}", issue.shortId(), actor);
            auditService.record(actor, AuditAction.ISSUE_ACKNOWLEDGED, issue.getFingerprint(), Map.of("name", issue.getName()));
            return Optional.of(issue);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Silence an open issue. The underlying condition is not touched.
     */
    public Optional<Issue> silence(String idOrPrefix, int minutes) {
        if (minutes <= 0) {
            throw new IllegalArgumentException("Silence duration must be positive: " + minutes);
        }
        lock.lock();
        try {
            Issue issue = find(idOrPrefix);
            if (issue == null) return Optional.empty();
            Instant now = clock.instant();
            issue.setStatus(Issue.Status.SILENCED);
            issue.setSilencedUntil(now.plus(Duration.ofMinutes(minutes)));
            issue.setUpdatedAt(now);
            log.info("Issue {} silenced for {} minutes", issue.shortId(), minutes);
            auditService.record("operator", AuditAction.ISSUE_SILENCED, issue.getFingerprint(), Map.of("minutes", minutes));
            return Optional.of(issue);
        } finally {
            lock.unlock();
        }
    }

    public Optional<Issue> getIssue(String idOrPrefix) {
        lock.lock();
        try {
            return Optional.ofNullable(find(idOrPrefix));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Active issues, most severe first, then oldest first.
     */
    public List<Issue> getActiveIssues() {
        List<Issue> issues;
        lock.lock();
        try {
            issues = new ArrayList<>(activeIssues.values());
        } finally {
            lock.unlock();
        }
        issues.sort(Comparator.comparing(Issue::getSeverity)
                .thenComparing(Issue::getStartedAt, Comparator.nullsLast(Comparator.naturalOrder())));
        return issues;
    }

    /** Resolved issues, newest first */
    public List<Issue> getResolvedHistory() {
        lock.lock();
        try {
            return new ArrayList<>(resolvedHistory);
        } finally {
            lock.unlock();
        }
    }

    /** Issues from the given source that are still open */
    public List<Issue> getActiveBySource(String source) {
        return getActiveIssues().stream()
                .filter(i -> source.equals(i.getSource()))
                .toList();
    }

    /**
     * Counts by status and severity over active issues. Read only.
     */
    public Map<String, Object> getStats() {
        Map<String, Long> byStatus = new LinkedHashMap<>();
        Map<String, Long> bySeverity = new LinkedHashMap<>();
        for (Issue.Status s : Issue.Status.values()) {
            if (s != Issue.Status.RESOLVED) byStatus.put(s.name().toLowerCase(Locale.ROOT), 0L);
        }
        for (Issue.Severity s : Issue.Severity.values()) {
            bySeverity.put(s.name().toLowerCase(Locale.ROOT), 0L);
        }
        int total;
        int resolvedRecent;
        lock.lock();
        try {
            for (Issue issue : activeIssues.values()) {
                byStatus.merge(issue.getStatus().name().toLowerCase(Locale.ROOT), 1L, Long::sum);
                bySeverity.merge(issue.getSeverity().name().toLowerCase(Locale.ROOT), 1L, Long::sum);
            }
            total = activeIssues.size();
            Instant dayAgo = clock.instant().minus(Duration.ofHours(24));
            resolvedRecent = (int) resolvedHistory.stream()
                    .filter(i -> i.getResolvedAt() != null && i.getResolvedAt().isAfter(dayAgo))
                    .count();
        } finally {
            lock.unlock();
        }
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("total_active", total);
        stats.put("by_status", byStatus);
        stats.put("by_severity", bySeverity);
        stats.put("resolved_recent", resolvedRecent);
        return stats;
    }

    @Scheduled(fixedDelay = 600_000)
    public void cleanupResolvedHistory() {
        Instant cutoff = clock.instant().minus(Duration.ofHours(properties.getAlerts().getResolvedRetentionHours()));
        int removed = 0;
        lock.lock();
        try {
            Iterator<Issue> it = resolvedHistory.iterator();
            while (it.hasNext()) {
                Issue issue = it.next();
                if (issue.getResolvedAt() != null && issue.getResolvedAt().isBefore(cutoff)) {
                    it.remove();
                    removed++;
                }
            }
        } finally {
            lock.unlock();
        }
        if (removed > 0) {
            log.debug("Dropped {} resolved issues from history", removed);
        }
    }

    // caller holds the lock
    private Issue find(String idOrPrefix) {
        if (idOrPrefix == null || idOrPrefix.isBlank()) return null;
        Issue exact = activeIssues.get(idOrPrefix);
        if (exact != null) return exact;
        Issue first = null;
        int matches = 0;
        for (Issue issue : activeIssues.values()) {
            if (issue.getFingerprint().startsWith(idOrPrefix)) {
                if (first == null) first = issue;
                matches++;
            }
        }
        if (matches > 1) {
            log.warn("Prefix '{}' matches {} issues, using the first one ({})", idOrPrefix, matches, first.shortId());
        }
        return first;
    }

    // caller holds the lock
    private void touch(Issue issue, Instant now) {
        issue.setOccurrences(issue.getOccurrences() + 1);
        issue.setUpdatedAt(now);
        if (issue.getStatus() == Issue.Status.SILENCED && !issue.isSilencedAt(now)) {
            issue.setStatus(Issue.Status.FIRING);
            issue.setSilencedUntil(null);
            log.info("Silence on issue {} lapsed, back to FIRING", issue.shortId());
        }
    }

    // caller holds the lock
    private Issue markResolved(Issue issue, String resolution, Instant now) {
        issue.setStatus(Issue.Status.RESOLVED);
        issue.setResolvedAt(now);
        issue.setUpdatedAt(now);
        issue.setResolution(resolution);
        issue.setAcknowledgedAt(null);
        issue.setAcknowledgedBy(null);
        issue.setSilencedUntil(null);
        activeIssues.remove(issue.getFingerprint());
        resolvedHistory.addFirst(issue);
        while (resolvedHistory.size() > MAX_RESOLVED_HISTORY) {
            resolvedHistory.removeLast();
        }
        return issue;
    }

    private void fireCreated(Issue issue) {
        log.info("New issue {} [{}] {} on {}", issue.shortId(), issue.getSeverity(), issue.getName(), issue.getComponent());
        auditService.record("system", AuditAction.ISSUE_CREATED, issue.getFingerprint(),
                Map.of("name", issue.getName(), "source", issue.getSource(), "severity", issue.getSeverity().name()));
        for (IssueListener listener : listeners) {
            try {
                listener.onIssueCreated(issue);
            } catch (Exception e) {
                log.error("Issue listener failed for {}: {}", issue.shortId(), e.getMessage());
            }
        }
    }

    private void fireResolved(Issue issue) {
        log.info("Issue {} resolved: {}", issue.shortId(), issue.getResolution());
        auditService.record("system", AuditAction.ISSUE_RESOLVED, issue.getFingerprint(),
                Map.of("resolution", issue.getResolution() != null ? issue.getResolution() : ""));
        for (IssueListener listener : listeners) {
            try {
                listener.onIssueResolved(issue);
            } catch (Exception e) {
                log.error("Issue listener failed on resolve of {}: {}", issue.shortId(), e.getMessage());
            }
        }
    }

    private static String componentOf(Map<String, String> labels) {
        return firstNonBlank(labels.get("instance"), labels.get("service"), labels.get("job"), "unknown");
    }

    private static String firstNonBlank(String... values) {
        for (String v : values) {
            if (v != null && !v.isBlank()) return v;
        }
        return null;
    }

    private static String shortId(String fingerprint) {
        return fingerprint.length() <= 8 ? fingerprint : fingerprint.substring(0, 8);
    }
}
