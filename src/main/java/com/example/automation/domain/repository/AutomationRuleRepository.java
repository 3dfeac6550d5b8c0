package com.example.automation.domain.repository;

import com.example.automation.domain.entity.AutomationRule;
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
 * Repository for AutomationRule entity.
 * Counter updates are atomic increments because several events for the same rule may finish concurrently.
 */
@Repository
public interface AutomationRuleRepository extends JpaRepository<AutomationRule, UUID> {

    /**
     * Active rules listening to this event (or to every event through the custom trigger),
     * highest priority first with id as the tie breaker.
     */
    @Query("""
            SELECT r FROM AutomationRule r
            WHERE r.tenantId = :tenantId
              AND r.active = true
              AND (r.triggerEvent = :eventName OR r.triggerEvent = 'custom')
            ORDER BY r.priority DESC, r.id ASC
            """)
    List<AutomationRule> findActiveRulesForEvent(@Param("tenantId") String tenantId, @Param("eventName") String eventName);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE AutomationRule r
            SET r.executionCount = r.executionCount + 1,
                r.successCount = r.successCount + 1,
                r.consecutiveFailures = 0,
                r.lastError = NULL,
                r.lastExecution = :executedAt,
                r.version = r.version + 1,
                r.updatedAt = :now
            WHERE r.id = :ruleId
            """)
    int recordSuccess(@Param("ruleId") UUID ruleId, @Param("executedAt") Instant executedAt, @Param("now") Instant now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE AutomationRule r
            SET r.executionCount = r.executionCount + 1,
                r.errorCount = r.errorCount + 1,
                r.consecutiveFailures = r.consecutiveFailures + 1,
                r.lastError = :lastError,
                r.lastExecution = :executedAt,
                r.version = r.version + 1,
                r.updatedAt = :now
            WHERE r.id = :ruleId
            """)
    int recordFailure(@Param("ruleId") UUID ruleId, @Param("executedAt") Instant executedAt,
                      @Param("lastError") String lastError, @Param("now") Instant now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE AutomationRule r
            SET r.executionCount = r.executionCount + 1,
                r.errorCount = r.errorCount + 1,
                r.lastError = :lastError,
                r.lastExecution = :executedAt,
                r.version = r.version + 1,
                r.updatedAt = :now
            WHERE r.id = :ruleId
            """)
    int recordConfigurationError(@Param("ruleId") UUID ruleId, @Param("executedAt") Instant executedAt,
                                 @Param("lastError") String lastError, @Param("now") Instant now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE AutomationRule r
            SET r.active = false,
                r.version = r.version + 1,
                r.updatedAt = :now
            WHERE r.id = :ruleId
              AND r.active = true
            """)
    int deactivate(@Param("ruleId") UUID ruleId, @Param("now") Instant now);

    Page<AutomationRule> findByTenantId(String tenantId, Pageable pageable);

    long countByActiveTrue();
}
