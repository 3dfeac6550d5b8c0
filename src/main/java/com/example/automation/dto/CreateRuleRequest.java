package com.example.automation.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Request DTO for creating an automation rule
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateRuleRequest {

    @NotBlank(message = "Tenant ID is required")
    @Size(max = 64)
    private String tenantId;

    @NotBlank(message = "Name is required")
    @Size(max = 100)
    private String name;

    @Size(max = 500)
    private String description;

    /**
     * Event name, or "custom" to receive every event of the tenant
     */
    @NotBlank(message = "Trigger event is required")
    @Size(max = 100)
    private String triggerEvent;

    private List<Map<String, Object>> conditions;

    @NotEmpty(message = "At least one action is required")
    private List<Map<String, Object>> actions;

    @Min(0)
    private Integer cooldownSeconds;

    @Min(1)
    private Integer maxTriggersPerUser;

    /**
     * Higher runs first
     */
    private Integer priority;

    private String createdBy;
}
