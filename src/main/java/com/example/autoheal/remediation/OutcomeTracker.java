package com.example.autoheal.remediation;

import com.example.autoheal.config.AutohealProperties;
import com.example.autoheal.domain.Issue;
import com.example.autoheal.domain.RemediationAction;
import com.example.autoheal.repository.RemediationActionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * Keeps the bounded history of issue outcomes and answers statistics over
 * the durable action history. The failure times per component feed the
 * recurring-failure forecast.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OutcomeTracker {

    private static final int MAX_OUTCOMES = 5000;

    private final RemediationActionRepository actionRepository;
    private final AutohealProperties properties;
    private final Clock clock;

    // keyed by fingerprint + start time so one occurrence is one entry
    private final Map<String, Outcome> outcomes = new LinkedHashMap<>();

    public void record(Issue issue, RemediationAction action) {
        Instant now = clock.instant();
        Outcome outcome = new Outcome(
                issue.getFingerprint(),
                issue.getComponent(),
                issue.getIssueType(),
                issue.getSeverity(),
                issue.getStartedAt() != null ? issue.getStartedAt() : now,
                issue.getResolvedAt(),
                issue.getStatus() == Issue.Status.RESOLVED,
                action != null ? action.getActionId() : null,
                action != null ? action.getActionType() : null,
                action != null ? action.getStatus() : null,
                now);
        synchronized (outcomes) {
            String key = issue.getFingerprint() + "@" + outcome.startedAt();
            Outcome previous = outcomes.remove(key);
            if (previous != null && action == null && previous.actionId() != null) {
                // keep the action of an earlier record when only the resolution changed
                outcome = new Outcome(outcome.fingerprint(), outcome.component(), outcome.issueType(),
                        outcome.severity(), outcome.startedAt(), outcome.resolvedAt(), outcome.resolved(),
                        previous.actionId(), previous.actionType(), previous.actionStatus(), now);
            }
            outcomes.put(key, outcome);
            prune(now);
        }
        log.debug("Recorded outcome for {} (resolved: {})", issue.shortId(), outcome.resolved());
    }

    /** Start times of recorded issues on a component, oldest first */
    public List<Instant> failureTimes(String component) {
        synchronized (outcomes) {
            return outcomes.values().stream()
                    .filter(o -> Objects.equals(component, o.component()))
                    .map(Outcome::startedAt)
                    .sorted()
                    .toList();
        }
    }

    public Set<String> components() {
        synchronized (outcomes) {
            Set<String> components = new TreeSet<>();
            outcomes.values().forEach(o -> {
                if (o.component() != null) components.add(o.component());
            });
            return components;
        }
    }

    /** Most recent first */
    public List<Outcome> getRecentOutcomes(int limit) {
        synchronized (outcomes) {
            List<Outcome> list = new ArrayList<>(outcomes.values());
            Collections.reverse(list);
            return list.subList(0, Math.max(0, Math.min(limit, list.size())));
        }
    }

    public List<RemediationAction> getRecentActions(int limit) {
        return actionRepository.findRecent(PageRequest.of(0, Math.max(1, limit)));
    }

    public List<RemediationAction> getActionsForIssue(String fingerprint) {
        return actionRepository.findByIssueFingerprintOrderByCreatedAtDesc(fingerprint);
    }

    public Map<String, Object> getStats() {
        long successful = actionRepository.countByStatus(RemediationAction.ActionStatus.SUCCESS);
        long failed = actionRepository.countByStatus(RemediationAction.ActionStatus.FAILED);
        long skipped = actionRepository.countByStatus(RemediationAction.ActionStatus.SKIPPED);
        long inProgress = actionRepository.countByStatus(RemediationAction.ActionStatus.IN_PROGRESS);
        long total = actionRepository.count();
        long finished = successful + failed;

        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("total", total);
        stats.put("successful", successful);
        stats.put("failed", failed);
        stats.put("skipped", skipped);
        stats.put("in_progress", inProgress);
        stats.put("success_rate", finished > 0 ? Math.round(successful * 10000.0 / finished) / 100.0 : 0.0);
        stats.put("auto_remediation_enabled", !properties.getRemediation().isRequireApproval());
        return stats;
    }

    @Scheduled(fixedDelay = 3_600_000, initialDelay = 60_000)
    public void purgeHistory() {
        Instant cutoff = clock.instant().minus(Duration.ofHours(properties.getRemediation().getHistoryRetentionHours()));
        int deleted = actionRepository.deleteByCreatedAtBefore(cutoff);
        synchronized (outcomes) {
            prune(clock.instant());
        }
        if (deleted > 0) {
            log.info("Purged {} remediation actions older than {}", deleted, cutoff);
        }
    }

    // caller holds the outcomes monitor
    private void prune(Instant now) {
        Instant cutoff = now.minus(Duration.ofHours(properties.getRemediation().getHistoryRetentionHours()));
        outcomes.values().removeIf(o -> o.recordedAt().isBefore(cutoff));
        Iterator<String> it = outcomes.keySet().iterator();
        while (outcomes.size() > MAX_OUTCOMES && it.hasNext()) {
            it.next();
            it.remove();
        }
    }
}
