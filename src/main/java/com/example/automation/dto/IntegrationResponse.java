package com.example.automation.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IntegrationResponse {

    private UUID id;
    private String tenantId;
    private String name;
    private String provider;
    private Map<String, Object> config;
    private String credentialsRef;
    private String targetChannelId;
    private String messageTemplate;
    private String effectiveEventName;
    private boolean active;
    private int syncFrequencySeconds;
    private Integer requestsPerHour;
    private Integer burst;
    private Instant lastSync;
    private Instant nextSync;
    private int syncCount;
    private int errorCount;
    private String lastError;
    private String createdBy;
    private Instant createdAt;
    private Instant updatedAt;
}
