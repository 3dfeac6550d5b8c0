package com.example.automation.dto;

import com.example.automation.domain.enums.DeliveryStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeliveryResponse {

    private UUID id;
    private UUID webhookId;
    private String tenantId;
    private String deliveryId;
    private String eventType;
    private String payload;
    private String targetUrl;
    private String httpMethod;
    private int attemptNumber;
    private int maxAttempts;
    private DeliveryStatus status;
    private Integer responseStatus;
    private String responseBody;
    private Long responseTimeMs;
    private Instant scheduledAt;
    private Instant deliveredAt;
    private Instant nextRetryAt;
    private Instant lastAttemptAt;
    private String errorMessage;
    private Instant createdAt;
}
