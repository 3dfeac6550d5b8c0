package com.example.automation.domain.repository;

import com.example.automation.domain.entity.TaskExecutionRecord;
import com.example.automation.domain.enums.ExecutionStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for TaskExecutionRecord entity.
 * Also the source of truth for rule cooldowns and per-user trigger caps.
 */
@Repository
public interface TaskExecutionRecordRepository extends JpaRepository<TaskExecutionRecord, UUID> {

    Page<TaskExecutionRecord> findByTaskIdOrderByStartTimeDesc(UUID taskId, Pageable pageable);

    Page<TaskExecutionRecord> findByRuleIdOrderByStartTimeDesc(UUID ruleId, Pageable pageable);

    List<TaskExecutionRecord> findByTaskIdOrderByStartTimeAsc(UUID taskId);

    long countByTaskId(UUID taskId);

    /**
     * Number of times this user has fired the rule
     */
    long countByRuleIdAndTriggerUserIdAndStatusIn(UUID ruleId, String triggerUserId, Collection<ExecutionStatus> statuses);

    /**
     * Most recent fire of the rule for this user
     */
    Optional<TaskExecutionRecord> findFirstByRuleIdAndTriggerUserIdAndStatusInOrderByStartTimeDesc(
            UUID ruleId, String triggerUserId, Collection<ExecutionStatus> statuses);

    /**
     * Records left RUNNING by a worker that never came back
     */
    @Query("""
            SELECT r FROM TaskExecutionRecord r
            WHERE r.status = com.example.automation.domain.enums.ExecutionStatus.RUNNING
              AND r.endTime IS NULL
              AND r.startTime < :threshold
            """)
    List<TaskExecutionRecord> findStaleRunning(@Param("threshold") Instant threshold);

    @Transactional
    @Modifying
    @Query("""
            DELETE FROM TaskExecutionRecord r
            WHERE r.endTime IS NOT NULL
              AND r.endTime < :cutoff
            """)
    int deleteClosedBefore(@Param("cutoff") Instant cutoff);

    long countByStatus(ExecutionStatus status);
}
