package com.example.automation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * An event pushed by the chat platform
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlatformEventRequest {

    @NotBlank(message = "Tenant ID is required")
    @Size(max = 64)
    private String tenantId;

    @NotBlank(message = "Event name is required")
    @Size(max = 100)
    private String eventName;

    private String userId;

    private String channelId;

    private Map<String, Object> payload;
}
