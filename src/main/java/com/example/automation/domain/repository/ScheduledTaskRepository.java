package com.example.automation.domain.repository;

import com.example.automation.domain.entity.ScheduledTask;
import com.example.automation.domain.enums.TriggerType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Repository for ScheduledTask entity.
 * <p>
 * Every write issued by the scheduler is a targeted conditional update rather than a
 * full entity save, so two workers touching the same row never overwrite each other's
 * next_execution. Each such update also bumps {@code version} so that administrative
 * saves of a stale copy fail with an optimistic lock error.
 */
@Repository
public interface ScheduledTaskRepository extends JpaRepository<ScheduledTask, UUID> {

    /**
     * Active tasks whose next_execution has passed, oldest first.
     */
    @Query("""
            SELECT t FROM ScheduledTask t
            WHERE t.active = true
              AND t.nextExecution IS NOT NULL
              AND t.nextExecution <= :now
            ORDER BY t.nextExecution ASC
            """)
    List<ScheduledTask> findDueTasks(@Param("now") Instant now, Pageable pageable);

    /**
     * Active tasks with an outstanding "run now" request.
     */
    @Query("""
            SELECT t FROM ScheduledTask t
            WHERE t.active = true
              AND t.manualRunRequestedAt IS NOT NULL
            ORDER BY t.manualRunRequestedAt ASC
            """)
    List<ScheduledTask> findManualRunRequests(Pageable pageable);

    /**
     * Lease a due instant: move next_execution from the value the caller observed to
     * its successor and take the next execution count slot in the same statement.
     * Returns 1 for the single winning worker and 0 for everyone else, including any
     * worker that arrives after max_executions has been used up.
     * For the last fire the caller passes a null successor with {@code stillActive = false}
     * so the same update also deactivates the task.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE ScheduledTask t
            SET t.nextExecution = :newNext,
                t.active = :stillActive,
                t.executionCount = t.executionCount + 1,
                t.version = t.version + 1,
                t.updatedAt = :now
            WHERE t.id = :taskId
              AND t.active = true
              AND t.nextExecution = :expectedNext
              AND (t.maxExecutions IS NULL OR t.executionCount < t.maxExecutions)
            """)
    int claimDueExecution(
            @Param("taskId") UUID taskId,
            @Param("expectedNext") Instant expectedNext,
            @Param("newNext") Instant newNext,
            @Param("stillActive") boolean stillActive,
            @Param("now") Instant now);

    /**
     * Push a due instant back without counting it as a fire.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE ScheduledTask t
            SET t.nextExecution = :retryAt,
                t.version = t.version + 1,
                t.updatedAt = :now
            WHERE t.id = :taskId
              AND t.active = true
              AND t.nextExecution = :expectedNext
            """)
    int postponeDue(
            @Param("taskId") UUID taskId,
            @Param("expectedNext") Instant expectedNext,
            @Param("retryAt") Instant retryAt,
            @Param("now") Instant now);

    /**
     * Lease a manual run by clearing the request marker the caller observed. A manual run
     * counts toward max_executions, so the count slot is taken here as well.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE ScheduledTask t
            SET t.manualRunRequestedAt = NULL,
                t.executionCount = t.executionCount + 1,
                t.version = t.version + 1,
                t.updatedAt = :now
            WHERE t.id = :taskId
              AND t.active = true
              AND t.manualRunRequestedAt = :expectedRequestedAt
              AND (t.maxExecutions IS NULL OR t.executionCount < t.maxExecutions)
            """)
    int claimManualRun(
            @Param("taskId") UUID taskId,
            @Param("expectedRequestedAt") Instant expectedRequestedAt,
            @Param("now") Instant now);

    /**
     * Lease one fire of an event-triggered task by taking the next execution count slot.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE ScheduledTask t
            SET t.executionCount = t.executionCount + 1,
                t.version = t.version + 1,
                t.updatedAt = :now
            WHERE t.id = :taskId
              AND t.active = true
              AND t.executionCount = :expectedCount
              AND (t.maxExecutions IS NULL OR t.executionCount < t.maxExecutions)
            """)
    int claimEventFire(
            @Param("taskId") UUID taskId,
            @Param("expectedCount") int expectedCount,
            @Param("now") Instant now);

    /**
     * A fire whose conditions did not hold has already used up its slot at claim time.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE ScheduledTask t
            SET t.lastExecution = :executedAt,
                t.version = t.version + 1,
                t.updatedAt = :now
            WHERE t.id = :taskId
            """)
    int recordSkipped(
            @Param("taskId") UUID taskId,
            @Param("executedAt") Instant executedAt,
            @Param("now") Instant now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE ScheduledTask t
            SET t.lastExecution = :executedAt,
                t.errorCount = 0,
                t.lastError = NULL,
                t.version = t.version + 1,
                t.updatedAt = :now
            WHERE t.id = :taskId
            """)
    int recordSuccess(
            @Param("taskId") UUID taskId,
            @Param("executedAt") Instant executedAt,
            @Param("now") Instant now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE ScheduledTask t
            SET t.lastExecution = :executedAt,
                t.errorCount = t.errorCount + 1,
                t.lastError = :lastError,
                t.version = t.version + 1,
                t.updatedAt = :now
            WHERE t.id = :taskId
            """)
    int recordFailure(
            @Param("taskId") UUID taskId,
            @Param("executedAt") Instant executedAt,
            @Param("lastError") String lastError,
            @Param("now") Instant now);

    /**
     * Configuration problems are made visible through last_error without counting toward self-disable.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE ScheduledTask t
            SET t.lastExecution = :executedAt,
                t.lastError = :lastError,
                t.version = t.version + 1,
                t.updatedAt = :now
            WHERE t.id = :taskId
            """)
    int recordConfigurationError(
            @Param("taskId") UUID taskId,
            @Param("executedAt") Instant executedAt,
            @Param("lastError") String lastError,
            @Param("now") Instant now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE ScheduledTask t
            SET t.lastError = :lastError,
                t.version = t.version + 1,
                t.updatedAt = :now
            WHERE t.id = :taskId
            """)
    int updateLastError(@Param("taskId") UUID taskId, @Param("lastError") String lastError, @Param("now") Instant now);

    /**
     * Move a task to its terminal state.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE ScheduledTask t
            SET t.active = false,
                t.nextExecution = NULL,
                t.manualRunRequestedAt = NULL,
                t.version = t.version + 1,
                t.updatedAt = :now
            WHERE t.id = :taskId
              AND t.active = true
            """)
    int deactivate(@Param("taskId") UUID taskId, @Param("now") Instant now);

    @Query("""
            SELECT t FROM ScheduledTask t
            WHERE t.tenantId = :tenantId
              AND t.active = true
              AND t.triggerType = :triggerType
              AND t.eventTrigger = :eventName
            """)
    List<ScheduledTask> findActiveEventTasks(
            @Param("tenantId") String tenantId,
            @Param("triggerType") TriggerType triggerType,
            @Param("eventName") String eventName);

    Page<ScheduledTask> findByTenantId(String tenantId, Pageable pageable);

    Page<ScheduledTask> findByTenantIdAndActive(String tenantId, boolean active, Pageable pageable);

    long countByActiveTrue();

    @Query("""
            SELECT COUNT(t) FROM ScheduledTask t
            WHERE t.active = true
              AND t.nextExecution IS NOT NULL
              AND t.nextExecution <= :now
            """)
    long countOverdue(@Param("now") Instant now);
}
