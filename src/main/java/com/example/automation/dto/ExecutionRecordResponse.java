package com.example.automation.dto;

import com.example.automation.domain.enums.ExecutionStatus;
import com.example.automation.domain.enums.ExecutionType;
import com.example.automation.domain.model.ActionResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Response DTO for one task or rule run
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionRecordResponse {

    private UUID id;
    private UUID taskId;
    private UUID ruleId;
    private String tenantId;
    private ExecutionType executionType;
    private String triggerSource;
    private String triggerUserId;
    private Instant scheduledFor;
    private ExecutionStatus status;
    private Instant startTime;
    private Instant endTime;
    private Long durationMs;
    private List<ActionResult> actionResults;
    private String errorMessage;
    private String notes;
    private String executorInstance;
    private Map<String, Object> metadata;
}
