package com.example.automation.domain.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Registered webhook endpoint. Outbound deliveries post to {@code url}; inbound
 * receipts addressed to this id are verified with {@code secretToken}.
 */
@Entity
@Table(name = "webhooks", indexes = {
        @Index(name = "idx_webhook_tenant", columnList = "tenant_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Webhook {

    public static final String ALL_EVENTS = "*";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "tenant_id", nullable = false, length = 64)
    private String tenantId;

    @Column(name = "integration_id")
    private UUID integrationId;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "webhook_url", length = 2048)
    private String url;

    @Column(name = "secret_token", length = 255)
    private String secretToken;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "events", columnDefinition = "jsonb")
    @Builder.Default
    private List<String> events = new ArrayList<>(List.of(ALL_EVENTS));

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private boolean active = true;

    @Column(name = "rate_limit_per_minute")
    private Integer rateLimitPerMinute;

    @Column(name = "max_payload_size")
    private Integer maxPayloadSize;

    @Column(name = "timeout_seconds")
    private Integer timeoutSeconds;

    @Column(name = "retry_attempts")
    private Integer retryAttempts;

    @Column(name = "success_count", nullable = false)
    @Builder.Default
    private int successCount = 0;

    @Column(name = "failure_count", nullable = false)
    @Builder.Default
    private int failureCount = 0;

    @Column(name = "last_triggered")
    private Instant lastTriggered;

    @Column(name = "last_success")
    private Instant lastSuccess;

    @Column(name = "last_failure")
    private Instant lastFailure;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    @Version
    @Column(name = "version")
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        var now = Instant.now();
        this.createdAt = now;
        this.updatedAt = now;
        if (this.events == null || this.events.isEmpty()) {
            this.events = new ArrayList<>(List.of(ALL_EVENTS));
        }
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }

    public boolean isSubscribedTo(String eventType) {
        if (events == null || events.isEmpty()) {
            return true;
        }
        return events.contains(ALL_EVENTS) || (eventType != null && events.contains(eventType));
    }

    public boolean hasSecret() {
        return secretToken != null && !secretToken.isBlank();
    }
}
