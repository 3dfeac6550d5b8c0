package com.example.automation.dto;

import com.example.automation.domain.enums.TaskType;
import com.example.automation.domain.enums.TriggerType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Request DTO for creating a scheduled task
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateTaskRequest {

    @NotBlank(message = "Tenant ID is required")
    @Size(max = 64)
    private String tenantId;

    @NotBlank(message = "Name is required")
    @Size(max = 100)
    private String name;

    @Size(max = 500)
    private String description;

    private TaskType taskType;

    @NotNull(message = "Trigger type is required")
    private TriggerType triggerType;

    /**
     * Five or six field cron expression (CRON tasks)
     */
    private String cronExpression;

    /**
     * Seconds between fires (INTERVAL tasks)
     */
    @Min(1)
    private Long intervalSeconds;

    /**
     * Fire instant for ONCE tasks, optional first fire for INTERVAL tasks
     */
    private Instant scheduledTime;

    /**
     * Event name (EVENT tasks)
     */
    private String eventTrigger;

    /**
     * IANA zone id (default: UTC)
     */
    private String timezone;

    private String targetChannelId;

    private List<String> targetRoleIds;

    private List<Map<String, Object>> conditions;

    @NotEmpty(message = "At least one action is required")
    private List<Map<String, Object>> actions;

    /**
     * Dates (yyyy-MM-dd, task timezone) on which the task never fires
     */
    private List<String> exceptionDates;

    @Min(1)
    private Integer maxExecutions;

    /**
     * Recurring patterns, combined with the cron expression (CRON tasks)
     */
    @Valid
    private List<SchedulePatternRequest> patterns;

    private String createdBy;
}
