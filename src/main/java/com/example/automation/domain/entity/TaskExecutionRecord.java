package com.example.automation.domain.entity;

import com.example.automation.domain.enums.ExecutionStatus;
import com.example.automation.domain.enums.ExecutionType;
import com.example.automation.domain.model.ActionResult;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Append-only audit row for one run of a task or a rule.
 * Exactly one of taskId / ruleId is set. Once endTime is set the row is closed.
 */
@Entity
@Table(name = "task_execution_history", indexes = {
        @Index(name = "idx_exec_task", columnList = "task_id, start_time"),
        @Index(name = "idx_exec_rule_user", columnList = "rule_id, trigger_user_id, start_time"),
        @Index(name = "idx_exec_status_start", columnList = "status, start_time")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TaskExecutionRecord {

    public static final String NOTE_AUTO_DISABLED = "AUTO_DISABLED";
    public static final String NOTE_CONDITIONS_NOT_MET = "CONDITIONS_NOT_MET";
    public static final String NOTE_WORKER_LOST = "WORKER_LOST";
    public static final String NOTE_CONFIGURATION_ERROR = "CONFIGURATION_ERROR";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "task_id")
    private UUID taskId;

    @Column(name = "rule_id")
    private UUID ruleId;

    @Column(name = "tenant_id", nullable = false, length = 64)
    private String tenantId;

    @Enumerated(EnumType.STRING)
    @Column(name = "execution_type", nullable = false, length = 30)
    private ExecutionType executionType;

    /**
     * "schedule", "manual" or the name of the triggering event
     */
    @Column(name = "trigger_source", length = 100)
    private String triggerSource;

    @Column(name = "trigger_user_id", length = 64)
    private String triggerUserId;

    /**
     * The claimed next_execution value, for scheduled runs
     */
    @Column(name = "scheduled_for")
    private Instant scheduledFor;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private ExecutionStatus status;

    @Column(name = "start_time", nullable = false)
    private Instant startTime;

    @Column(name = "end_time")
    private Instant endTime;

    @Column(name = "duration_ms")
    private Long durationMs;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "actions_performed", columnDefinition = "jsonb")
    @Builder.Default
    private List<ActionResult> actionResults = new ArrayList<>();

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "notes", length = 200)
    private String notes;

    @Column(name = "executor_instance", length = 100)
    private String executorInstance;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "metadata", columnDefinition = "jsonb")
    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        this.createdAt = Instant.now();
        if (this.actionResults == null) {
            this.actionResults = new ArrayList<>();
        }
    }

    public boolean isClosed() {
        return endTime != null;
    }

    /**
     * Set the terminal status and end time. A closed record cannot be closed again.
     */
    public void close(ExecutionStatus finalStatus, Instant end, String error) {
        if (isClosed()) {
            throw new IllegalStateException("Execution record " + id + " is already closed");
        }
        if (!finalStatus.isTerminal()) {
            throw new IllegalArgumentException("Cannot close execution record with status " + finalStatus);
        }
        this.status = finalStatus;
        this.endTime = end;
        this.errorMessage = error;
        if (startTime != null) {
            this.durationMs = end.toEpochMilli() - startTime.toEpochMilli();
        }
    }
}
