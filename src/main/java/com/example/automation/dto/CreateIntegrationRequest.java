package com.example.automation.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Request DTO for configuring an external integration
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateIntegrationRequest {

    @NotBlank(message = "Tenant ID is required")
    @Size(max = 64)
    private String tenantId;

    @NotBlank(message = "Name is required")
    @Size(max = 100)
    private String name;

    /**
     * Provider key, e.g. http_feed
     */
    @NotBlank(message = "Provider is required")
    private String provider;

    private Map<String, Object> config;

    /**
     * Reference resolved to a secret at sync time; the secret itself is never stored
     */
    @Size(max = 200)
    private String credentialsRef;

    private String targetChannelId;

    private String messageTemplate;

    private String eventName;

    @Min(10)
    private Integer syncFrequencySeconds;

    @Min(1)
    private Integer requestsPerHour;

    @Min(1)
    private Integer burst;

    private String createdBy;
}
