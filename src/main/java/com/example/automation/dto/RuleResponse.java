package com.example.automation.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RuleResponse {

    private UUID id;
    private String tenantId;
    private String name;
    private String description;
    private String triggerEvent;
    private List<Map<String, Object>> conditions;
    private List<Map<String, Object>> actions;
    private int cooldownSeconds;
    private Integer maxTriggersPerUser;
    private int priority;
    private boolean active;
    private int executionCount;
    private int successCount;
    private int errorCount;
    private int consecutiveFailures;
    private String lastError;
    private Instant lastExecution;
    private String createdBy;
    private Instant createdAt;
    private Instant updatedAt;
}
