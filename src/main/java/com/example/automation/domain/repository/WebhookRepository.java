package com.example.automation.domain.repository;

import com.example.automation.domain.entity.Webhook;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.UUID;

@Repository
public interface WebhookRepository extends JpaRepository<Webhook, UUID> {

    Page<Webhook> findByTenantId(String tenantId, Pageable pageable);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE Webhook w
            SET w.successCount = w.successCount + 1,
                w.lastTriggered = :at,
                w.lastSuccess = :at
            WHERE w.id = :webhookId
            """)
    int recordSuccess(@Param("webhookId") UUID webhookId, @Param("at") Instant at);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE Webhook w
            SET w.failureCount = w.failureCount + 1,
                w.lastTriggered = :at,
                w.lastFailure = :at,
                w.lastError = :error
            WHERE w.id = :webhookId
            """)
    int recordFailure(@Param("webhookId") UUID webhookId, @Param("at") Instant at, @Param("error") String error);
}
