package com.example.automation.domain.entity;

import com.example.automation.domain.enums.DeliveryStatus;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * One attempt-tracked outbound delivery.
 * <p>
 * attemptNumber counts attempts already made and never exceeds maxAttempts.
 * deliveredAt is set only together with DELIVERED. DELIVERED and CANCELLED rows are final.
 */
@Entity
@Table(name = "webhook_deliveries",
        uniqueConstraints = @UniqueConstraint(name = "uk_delivery_delivery_id", columnNames = "delivery_id"),
        indexes = {
                @Index(name = "idx_delivery_due", columnList = "status, next_retry_at, scheduled_at"),
                @Index(name = "idx_delivery_webhook", columnList = "webhook_id, created_at")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class WebhookDelivery {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "webhook_id", nullable = false)
    private UUID webhookId;

    @Column(name = "tenant_id", nullable = false, length = 64)
    private String tenantId;

    /**
     * Idempotency key, caller supplied or generated
     */
    @Column(name = "delivery_id", nullable = false, length = 100, updatable = false)
    private String deliveryId;

    @Column(name = "event_type", nullable = false, length = 100)
    private String eventType;

    /**
     * Body exactly as sent
     */
    @Column(name = "payload", nullable = false, columnDefinition = "TEXT")
    private String payload;

    @Column(name = "target_url", nullable = false, length = 2048)
    private String targetUrl;

    @Column(name = "http_method", nullable = false, length = 10)
    @Builder.Default
    private String httpMethod = "POST";

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "headers", columnDefinition = "jsonb")
    @Builder.Default
    private Map<String, String> headers = new HashMap<>();

    @Column(name = "attempt_number", nullable = false)
    @Builder.Default
    private int attemptNumber = 0;

    @Column(name = "max_attempts", nullable = false)
    private int maxAttempts;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    @Builder.Default
    private DeliveryStatus status = DeliveryStatus.PENDING;

    @Column(name = "response_status")
    private Integer responseStatus;

    @Column(name = "response_body", columnDefinition = "TEXT")
    private String responseBody;

    @Column(name = "response_time_ms")
    private Long responseTimeMs;

    @Column(name = "scheduled_at", nullable = false)
    private Instant scheduledAt;

    @Column(name = "delivered_at")
    private Instant deliveredAt;

    @Column(name = "next_retry_at")
    private Instant nextRetryAt;

    @Column(name = "last_attempt_at")
    private Instant lastAttemptAt;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "lease_owner", length = 200)
    private String leaseOwner;

    @Column(name = "lease_until")
    private Instant leaseUntil;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        var now = Instant.now();
        this.createdAt = now;
        this.updatedAt = now;
        if (this.headers == null) {
            this.headers = new HashMap<>();
        }
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }

    /**
     * When this delivery is next eligible for a claim
     */
    public Instant getDueAt() {
        return nextRetryAt != null ? nextRetryAt : scheduledAt;
    }
}
