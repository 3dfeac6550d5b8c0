package com.example.automation.dto;

import com.example.automation.domain.enums.TaskType;
import com.example.automation.domain.enums.TriggerType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Response DTO for scheduled task data
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskResponse {

    private UUID id;
    private String tenantId;
    private String name;
    private String description;
    private TaskType taskType;
    private TriggerType triggerType;
    private String cronExpression;
    private Long intervalSeconds;
    private Instant scheduledTime;
    private String eventTrigger;
    private String timezone;
    private String targetChannelId;
    private List<String> targetRoleIds;
    private List<Map<String, Object>> conditions;
    private List<Map<String, Object>> actions;
    private List<String> exceptionDates;
    private boolean active;
    private int executionCount;
    private Integer maxExecutions;
    private int errorCount;
    private String lastError;
    private Instant nextExecution;
    private Instant lastExecution;
    private Instant manualRunRequestedAt;
    private String createdBy;
    private Instant createdAt;
    private Instant updatedAt;

    /**
     * Populated on detail requests
     */
    private List<SchedulePatternResponse> patterns;
}
