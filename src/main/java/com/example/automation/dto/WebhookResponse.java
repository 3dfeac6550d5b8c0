package com.example.automation.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Webhook data. The secret is never returned.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebhookResponse {

    private UUID id;
    private String tenantId;
    private UUID integrationId;
    private String name;
    private String url;
    private boolean signed;
    private List<String> events;
    private boolean active;
    private Integer rateLimitPerMinute;
    private Integer maxPayloadSize;
    private Integer timeoutSeconds;
    private Integer retryAttempts;
    private int successCount;
    private int failureCount;
    private Instant lastTriggered;
    private Instant lastSuccess;
    private Instant lastFailure;
    private String lastError;
    private Instant createdAt;
    private Instant updatedAt;
}
