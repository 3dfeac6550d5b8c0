package com.example.automation.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.UUID;

/**
 * Request DTO for registering a webhook. The URL is required for outbound use only.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateWebhookRequest {

    @NotBlank(message = "Tenant ID is required")
    @Size(max = 64)
    private String tenantId;

    private UUID integrationId;

    @NotBlank(message = "Name is required")
    @Size(max = 100)
    private String name;

    @Pattern(regexp = "https?://.+", message = "URL must be http or https")
    @Size(max = 500)
    private String url;

    private String secretToken;

    /**
     * Subscribed event types, "*" for all (default)
     */
    private List<String> events;

    @Min(1)
    private Integer rateLimitPerMinute;

    @Min(1)
    private Integer maxPayloadSize;

    @Min(1)
    @Max(120)
    private Integer timeoutSeconds;

    @Min(1)
    @Max(10)
    private Integer retryAttempts;
}
