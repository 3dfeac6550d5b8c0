package com.example.automation.domain.entity;

import com.example.automation.domain.enums.PatternType;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Calendar masks attached to a cron-kind task. The task fires on the union of its
 * cron expression and all of its active patterns.
 */
@Entity
@Table(name = "recurring_schedules", indexes = {
        @Index(name = "idx_pattern_task", columnList = "task_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RecurringSchedulePattern {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "task_id", nullable = false)
    private UUID taskId;

    @Column(name = "tenant_id", nullable = false, length = 64)
    private String tenantId;

    @Enumerated(EnumType.STRING)
    @Column(name = "pattern_type", nullable = false, length = 20)
    private PatternType patternType;

    /**
     * ISO days of week, Monday = 1
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "days_of_week", columnDefinition = "jsonb")
    @Builder.Default
    private List<Integer> daysOfWeek = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "days_of_month", columnDefinition = "jsonb")
    @Builder.Default
    private List<Integer> daysOfMonth = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "months", columnDefinition = "jsonb")
    @Builder.Default
    private List<Integer> months = new ArrayList<>();

    /**
     * Local wall-clock times, HH:mm
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "time_slots", columnDefinition = "jsonb")
    @Builder.Default
    private List<String> timeSlots = new ArrayList<>();

    /**
     * Local dates, yyyy-MM-dd
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "exception_dates", columnDefinition = "jsonb")
    @Builder.Default
    private List<String> exceptionDates = new ArrayList<>();

    @Column(name = "timezone", nullable = false, length = 64)
    @Builder.Default
    private String timezone = "UTC";

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private boolean active = true;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        this.createdAt = Instant.now();
    }

    public ZoneId getZoneId() {
        return ZoneId.of(timezone != null ? timezone : "UTC");
    }
}
