package com.example.automation.domain.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Tenant-scoped rule reacting to a named platform event.
 * <p>
 * Higher priority runs first. Cooldown and per-user caps are derived from the rule's
 * execution records, never from counters on this row.
 */
@Entity
@Table(name = "automation_rules", indexes = {
        @Index(name = "idx_rule_tenant_event", columnList = "tenant_id, trigger_event, is_active"),
        @Index(name = "idx_rule_priority", columnList = "priority DESC")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AutomationRule {

    public static final String CUSTOM_EVENT = "custom";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "tenant_id", nullable = false, length = 64)
    private String tenantId;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "description", length = 500)
    private String description;

    @Column(name = "trigger_event", nullable = false, length = 100)
    private String triggerEvent;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "trigger_conditions", columnDefinition = "jsonb")
    @Builder.Default
    private List<Map<String, Object>> conditions = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "actions", columnDefinition = "jsonb")
    @Builder.Default
    private List<Map<String, Object>> actions = new ArrayList<>();

    @Column(name = "cooldown_seconds", nullable = false)
    @Builder.Default
    private int cooldownSeconds = 0;

    @Column(name = "max_triggers_per_user")
    private Integer maxTriggersPerUser;

    @Column(name = "priority", nullable = false)
    @Builder.Default
    private int priority = 0;

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private boolean active = true;

    @Column(name = "execution_count", nullable = false)
    @Builder.Default
    private int executionCount = 0;

    @Column(name = "success_count", nullable = false)
    @Builder.Default
    private int successCount = 0;

    @Column(name = "error_count", nullable = false)
    @Builder.Default
    private int errorCount = 0;

    @Column(name = "consecutive_failures", nullable = false)
    @Builder.Default
    private int consecutiveFailures = 0;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    @Column(name = "last_execution")
    private Instant lastExecution;

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
        if (this.conditions == null) {
            this.conditions = new ArrayList<>();
        }
        if (this.actions == null) {
            this.actions = new ArrayList<>();
        }
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }
}
