package com.example.automation.config;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "automation.integrations")
public class IntegrationSyncProperties {

    @Min(100)
    private long pollIntervalMs = 10000;

    @Min(1)
    private int batchSize = 20;

    /**
     * next_sync is pushed this far ahead while a worker holds the integration
     */
    @Min(1)
    private int leaseSeconds = 300;

    @Min(1)
    private long maxBackoffSeconds = 21600;

    @Min(1)
    private int maxConsecutiveFailures = 5;

    @Min(1)
    private int defaultRequestsPerHour = 60;

    @Min(1)
    private int defaultBurst = 5;

    /**
     * Number of external item ids remembered per integration for diffing
     */
    @Min(1)
    private int seenItemMemory = 500;
}
