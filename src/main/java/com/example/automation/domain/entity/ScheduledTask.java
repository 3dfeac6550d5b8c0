package com.example.automation.domain.entity;

import com.example.automation.domain.enums.TaskType;
import com.example.automation.domain.enums.TriggerType;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A unit of recurring or one-shot work owned by a tenant.
 * <p>
 * next_execution is null exactly when the task is terminal (inactive, exhausted or
 * disabled by errors), except for event-triggered tasks which never carry a clock instant.
 * The scheduler only ever moves next_execution with a conditional update guarded by
 * its current value, see {@code ScheduledTaskRepository#claimDueExecution}.
 */
@Entity
@Table(name = "scheduled_tasks", indexes = {
        @Index(name = "idx_task_active_next_execution", columnList = "is_active, next_execution"),
        @Index(name = "idx_task_tenant", columnList = "tenant_id"),
        @Index(name = "idx_task_event_trigger", columnList = "tenant_id, event_trigger"),
        @Index(name = "idx_task_manual_run", columnList = "manual_run_requested_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ScheduledTask {

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

    @Enumerated(EnumType.STRING)
    @Column(name = "task_type", nullable = false, length = 30)
    @Builder.Default
    private TaskType taskType = TaskType.CUSTOM;

    @Enumerated(EnumType.STRING)
    @Column(name = "trigger_type", nullable = false, length = 20)
    private TriggerType triggerType;

    @Column(name = "cron_expression", length = 100)
    private String cronExpression;

    @Column(name = "interval_seconds")
    private Long intervalSeconds;

    /**
     * Fire instant for ONCE tasks; optional first fire for INTERVAL tasks
     */
    @Column(name = "scheduled_time")
    private Instant scheduledTime;

    @Column(name = "event_trigger", length = 100)
    private String eventTrigger;

    @Column(name = "timezone", nullable = false, length = 64)
    @Builder.Default
    private String timezone = "UTC";

    @Column(name = "target_channel_id", length = 64)
    private String targetChannelId;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "target_role_ids", columnDefinition = "jsonb")
    @Builder.Default
    private List<String> targetRoleIds = new ArrayList<>();

    /**
     * Tagged condition definitions, decoded at execution time
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "conditions", columnDefinition = "jsonb")
    @Builder.Default
    private List<Map<String, Object>> conditions = new ArrayList<>();

    /**
     * Tagged action definitions, decoded at execution time
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "actions", columnDefinition = "jsonb")
    @Builder.Default
    private List<Map<String, Object>> actions = new ArrayList<>();

    /**
     * Local dates (yyyy-MM-dd, task timezone) on which no fire happens
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "exception_dates", columnDefinition = "jsonb")
    @Builder.Default
    private List<String> exceptionDates = new ArrayList<>();

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private boolean active = true;

    @Column(name = "execution_count", nullable = false)
    @Builder.Default
    private int executionCount = 0;

    @Column(name = "max_executions")
    private Integer maxExecutions;

    /**
     * Consecutive failed runs; reset by a successful run
     */
    @Column(name = "error_count", nullable = false)
    @Builder.Default
    private int errorCount = 0;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    @Column(name = "next_execution")
    private Instant nextExecution;

    @Column(name = "last_execution")
    private Instant lastExecution;

    @Column(name = "manual_run_requested_at")
    private Instant manualRunRequestedAt;

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
        if (this.timezone == null) {
            this.timezone = "UTC";
        }
        if (this.conditions == null) {
            this.conditions = new ArrayList<>();
        }
        if (this.actions == null) {
            this.actions = new ArrayList<>();
        }
        if (this.exceptionDates == null) {
            this.exceptionDates = new ArrayList<>();
        }
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }

    public ZoneId getZoneId() {
        return ZoneId.of(timezone != null ? timezone : "UTC");
    }

    /**
     * True once the configured number of fires has happened
     */
    public boolean isExhausted() {
        return maxExecutions != null && executionCount >= maxExecutions;
    }
}
