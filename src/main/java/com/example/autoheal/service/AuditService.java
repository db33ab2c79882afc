package com.example.autoheal.service;

import com.example.autoheal.domain.AuditAction;
import com.example.autoheal.domain.AuditLog;
import com.example.autoheal.repository.AuditLogRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * Append-only audit trail for lifecycle transitions, gate decisions and
 * approvals. A failed write is logged and never reaches the caller.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuditService {

    private final AuditLogRepository auditLogRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Async("backgroundExecutor")
    public void record(String actor, AuditAction action, String subject, Map<String, Object> details) {
        record(actor, action, subject, details, true);
    }

    /**
     * A {@code reason} entry in the details is lifted into its own column.
     */
    @Async("backgroundExecutor")
    public void record(String actor, AuditAction action, String subject, Map<String, Object> details, boolean success) {
        try {
            Map<String, Object> rest = details != null ? new LinkedHashMap<>(details) : new LinkedHashMap<>();
            Object reason = rest.remove("reason");
            auditLogRepository.save(AuditLog.builder()
                    .action(action)
                    .actor(actor)
                    .subject(subject)
                    .reason(reason != null ? reason.toString() : null)
                    .success(success)
                    .details(rest.isEmpty() ? null : objectMapper.writeValueAsString(rest))
                    .recordedAt(clock.instant())
                    .build());
            log.debug("Audit {} by {} on {}", action, actor, subject);
        } catch (Exception e) {
            log.error("Failed to write audit entry {} for {}: {}", action, subject, e.getMessage());
        }
    }

    public List<AuditLog> getRecent(int limit) {
        return auditLogRepository.findByOrderByRecordedAtDesc(PageRequest.of(0, Math.max(1, limit)));
    }

    public List<AuditLog> search(String actor, AuditAction action, String subject, int limit) {
        return auditLogRepository.search(actor, action, subject, PageRequest.of(0, Math.max(1, limit)));
    }

    public List<AuditLog> getForSubject(String subject) {
        return auditLogRepository.findBySubjectOrderByRecordedAtDesc(subject);
    }

    /** Entry counts per action over the trailing window, zero-filled */
    public Map<String, Long> summary(Duration window) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (AuditAction action : AuditAction.values()) {
            counts.put(action.name(), 0L);
        }
        Instant since = clock.instant().minus(window);
        for (Object[] row : auditLogRepository.countByActionSince(since)) {
            counts.put(((AuditAction) row[0]).name(), ((Number) row[1]).longValue());
        }
        return counts;
    }
}
