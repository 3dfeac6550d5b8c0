package com.example.automation.domain.repository;

import com.example.automation.domain.entity.WebhookDelivery;
import com.example.automation.domain.enums.DeliveryStatus;
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
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for WebhookDelivery entity.
 * <p>
 * Result writes are guarded by {@code status = PENDING} and the caller's lease, so a
 * delivery cancelled while its request was in flight stays cancelled.
 */
@Repository
public interface WebhookDeliveryRepository extends JpaRepository<WebhookDelivery, UUID> {

    Optional<WebhookDelivery> findByDeliveryId(String deliveryId);

    @Query("""
            SELECT d FROM WebhookDelivery d
            WHERE d.status = com.example.automation.domain.enums.DeliveryStatus.PENDING
              AND ((d.nextRetryAt IS NULL AND d.scheduledAt <= :now) OR d.nextRetryAt <= :now)
              AND (d.leaseUntil IS NULL OR d.leaseUntil < :now)
            ORDER BY d.scheduledAt ASC
            """)
    List<WebhookDelivery> findDueDeliveries(@Param("now") Instant now, Pageable pageable);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE WebhookDelivery d
            SET d.leaseOwner = :owner,
                d.leaseUntil = :leaseUntil,
                d.updatedAt = :now
            WHERE d.id = :id
              AND d.status = com.example.automation.domain.enums.DeliveryStatus.PENDING
              AND d.attemptNumber = :expectedAttempt
              AND (d.leaseUntil IS NULL OR d.leaseUntil < :now)
            """)
    int claim(
            @Param("id") UUID id,
            @Param("expectedAttempt") int expectedAttempt,
            @Param("owner") String owner,
            @Param("leaseUntil") Instant leaseUntil,
            @Param("now") Instant now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE WebhookDelivery d
            SET d.status = com.example.automation.domain.enums.DeliveryStatus.DELIVERED,
                d.deliveredAt = :now,
                d.lastAttemptAt = :now,
                d.attemptNumber = :attempt,
                d.nextRetryAt = NULL,
                d.responseStatus = :responseStatus,
                d.responseBody = :responseBody,
                d.responseTimeMs = :responseTimeMs,
                d.errorMessage = NULL,
                d.leaseOwner = NULL,
                d.leaseUntil = NULL,
                d.updatedAt = :now
            WHERE d.id = :id
              AND d.leaseOwner = :owner
              AND d.status = com.example.automation.domain.enums.DeliveryStatus.PENDING
            """)
    int markDelivered(
            @Param("id") UUID id,
            @Param("owner") String owner,
            @Param("attempt") int attempt,
            @Param("responseStatus") Integer responseStatus,
            @Param("responseBody") String responseBody,
            @Param("responseTimeMs") Long responseTimeMs,
            @Param("now") Instant now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE WebhookDelivery d
            SET d.attemptNumber = :attempt,
                d.lastAttemptAt = :now,
                d.nextRetryAt = :nextRetryAt,
                d.responseStatus = :responseStatus,
                d.responseBody = :responseBody,
                d.responseTimeMs = :responseTimeMs,
                d.errorMessage = :error,
                d.leaseOwner = NULL,
                d.leaseUntil = NULL,
                d.updatedAt = :now
            WHERE d.id = :id
              AND d.leaseOwner = :owner
              AND d.status = com.example.automation.domain.enums.DeliveryStatus.PENDING
            """)
    int markRetry(
            @Param("id") UUID id,
            @Param("owner") String owner,
            @Param("attempt") int attempt,
            @Param("nextRetryAt") Instant nextRetryAt,
            @Param("responseStatus") Integer responseStatus,
            @Param("responseBody") String responseBody,
            @Param("responseTimeMs") Long responseTimeMs,
            @Param("error") String error,
            @Param("now") Instant now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE WebhookDelivery d
            SET d.status = com.example.automation.domain.enums.DeliveryStatus.FAILED,
                d.attemptNumber = :attempt,
                d.lastAttemptAt = :now,
                d.nextRetryAt = NULL,
                d.responseStatus = :responseStatus,
                d.responseBody = :responseBody,
                d.responseTimeMs = :responseTimeMs,
                d.errorMessage = :error,
                d.leaseOwner = NULL,
                d.leaseUntil = NULL,
                d.updatedAt = :now
            WHERE d.id = :id
              AND d.leaseOwner = :owner
              AND d.status = com.example.automation.domain.enums.DeliveryStatus.PENDING
            """)
    int markFailed(
            @Param("id") UUID id,
            @Param("owner") String owner,
            @Param("attempt") int attempt,
            @Param("responseStatus") Integer responseStatus,
            @Param("responseBody") String responseBody,
            @Param("responseTimeMs") Long responseTimeMs,
            @Param("error") String error,
            @Param("now") Instant now);

    /**
     * Hand a claimed delivery back without spending an attempt (send rate exhausted).
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE WebhookDelivery d
            SET d.nextRetryAt = :nextRetryAt,
                d.leaseOwner = NULL,
                d.leaseUntil = NULL,
                d.updatedAt = :now
            WHERE d.id = :id
              AND d.leaseOwner = :owner
              AND d.status = com.example.automation.domain.enums.DeliveryStatus.PENDING
            """)
    int release(
            @Param("id") UUID id,
            @Param("owner") String owner,
            @Param("nextRetryAt") Instant nextRetryAt,
            @Param("now") Instant now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE WebhookDelivery d
            SET d.status = com.example.automation.domain.enums.DeliveryStatus.CANCELLED,
                d.nextRetryAt = NULL,
                d.updatedAt = :now
            WHERE d.id = :id
              AND d.status = com.example.automation.domain.enums.DeliveryStatus.PENDING
            """)
    int cancel(@Param("id") UUID id, @Param("now") Instant now);

    Page<WebhookDelivery> findByWebhookIdOrderByCreatedAtDesc(UUID webhookId, Pageable pageable);

    long countByStatus(DeliveryStatus status);

    @Transactional
    @Modifying
    @Query("""
            DELETE FROM WebhookDelivery d
            WHERE d.status <> com.example.automation.domain.enums.DeliveryStatus.PENDING
              AND d.updatedAt < :cutoff
            """)
    int deleteTerminalBefore(@Param("cutoff") Instant cutoff);
}
