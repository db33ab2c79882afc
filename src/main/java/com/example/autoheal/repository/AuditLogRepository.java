package com.example.autoheal.repository;

import com.example.autoheal.domain.AuditAction;
import com.example.autoheal.domain.AuditLog;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface AuditLogRepository extends JpaRepository<AuditLog, String> {

    List<AuditLog> findBySubjectOrderByRecordedAtDesc(String subject);

    List<AuditLog> findByOrderByRecordedAtDesc(Pageable pageable);

    @Query("SELECT a FROM AuditLog a WHERE " +
           "(:actor IS NULL OR a.actor = :actor) AND " +
           "(:action IS NULL OR a.action = :action) AND " +
           "(:subject IS NULL OR a.subject = :subject) " +
           "ORDER BY a.recordedAt DESC")
    List<AuditLog> search(String actor, AuditAction action, String subject, Pageable pageable);

    @Query("SELECT a.action, COUNT(a) FROM AuditLog a WHERE a.recordedAt >= :since GROUP BY a.action")
    List<Object[]> countByActionSince(Instant since);
}
