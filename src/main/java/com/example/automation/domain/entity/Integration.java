package com.example.automation.domain.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Tenant-scoped external data source polled by the integration sync loop.
 */
@Entity
@Table(name = "integrations", indexes = {
        @Index(name = "idx_integration_due", columnList = "is_active, next_sync"),
        @Index(name = "idx_integration_tenant", columnList = "tenant_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Integration {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "tenant_id", nullable = false, length = 64)
    private String tenantId;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    /**
     * Key of the provider implementation, e.g. http_feed
     */
    @Column(name = "provider", nullable = false, length = 50)
    private String provider;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "config", columnDefinition = "jsonb")
    @Builder.Default
    private Map<String, Object> config = new HashMap<>();

    /**
     * Opaque reference handed to the credential resolver
     */
    @Column(name = "credentials_ref", length = 200)
    private String credentialsRef;

    @Column(name = "target_channel_id", length = 64)
    private String targetChannelId;

    @Column(name = "message_template", columnDefinition = "TEXT")
    private String messageTemplate;

    /**
     * Name of the event emitted for each new item
     */
    @Column(name = "event_name", length = 100)
    private String eventName;

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private boolean active = true;

    @Column(name = "sync_frequency", nullable = false)
    @Builder.Default
    private int syncFrequencySeconds = 300;

    @Column(name = "requests_per_hour")
    private Integer requestsPerHour;

    @Column(name = "burst")
    private Integer burst;

    @Column(name = "last_sync")
    private Instant lastSync;

    @Column(name = "next_sync")
    private Instant nextSync;

    @Column(name = "sync_count", nullable = false)
    @Builder.Default
    private int syncCount = 0;

    @Column(name = "error_count", nullable = false)
    @Builder.Default
    private int errorCount = 0;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    /**
     * Provider cursor plus remembered item ids from the last successful sync
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "sync_state", columnDefinition = "jsonb")
    @Builder.Default
    private Map<String, Object> syncState = new HashMap<>();

    @Version
    @Column(name = "version")
    private Long version;

    @Column(name = "created_by", length = 100)
    private String createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        var now = Instant.now();
        this.createdAt = now;
        this.updatedAt = now;
        if (this.config == null) {
            this.config = new HashMap<>();
        }
        if (this.syncState == null) {
            this.syncState = new HashMap<>();
        }
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }

    public String getEffectiveEventName() {
        return eventName != null && !eventName.isBlank() ? eventName : "integration." + provider + ".item";
    }
}
