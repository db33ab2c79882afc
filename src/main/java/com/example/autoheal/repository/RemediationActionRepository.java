package com.example.autoheal.repository;

import com.example.autoheal.domain.RemediationAction;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface RemediationActionRepository extends JpaRepository<RemediationAction, String> {

    /** Cooldown probe; skipped rows never carry executedAt so they are not counted */
    boolean existsByTargetAndActionTypeAndExecutedAtAfter(String target,
                                                          RemediationAction.RemediationType actionType,
                                                          Instant since);

    /** Rate-limit probe over the sliding window */
    long countByExecutedAtAfter(Instant since);

    Optional<RemediationAction> findFirstByTargetAndActionTypeAndExecutedAtIsNotNullOrderByExecutedAtDesc(
            String target, RemediationAction.RemediationType actionType);

    @Query("SELECT a FROM RemediationAction a ORDER BY a.createdAt DESC")
    List<RemediationAction> findRecent(Pageable pageable);

    long countByStatus(RemediationAction.ActionStatus status);

    List<RemediationAction> findByIssueFingerprintOrderByCreatedAtDesc(String issueFingerprint);

    @Transactional
    @Modifying
    @Query("DELETE FROM RemediationAction a WHERE a.createdAt < :cutoff")
    int deleteByCreatedAtBefore(Instant cutoff);
}
