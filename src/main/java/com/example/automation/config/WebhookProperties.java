package com.example.automation.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for outbound deliveries and inbound receipts.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "automation.webhooks")
public class WebhookProperties {

    @Min(100)
    private long pollIntervalMs = 2000;

    @Min(1)
    private int batchSize = 50;

    @Min(1)
    private int workerPoolSize = 8;

    /**
     * Time a send may spend after claiming, on top of the HTTP timeout, before the lease runs out
     */
    public static final int LEASE_HEADROOM_SECONDS = 10;

    /**
     * How long a claimed delivery stays owned by one worker
     */
    @Min(LEASE_HEADROOM_SECONDS + 1)
    private int leaseSeconds = 120;

    @Min(1)
    private long baseBackoffSeconds = 30;

    @Min(1)
    private long maxBackoffSeconds = 3600;

    /**
     * Global cap for stored payloads; a webhook may only lower it
     */
    @Min(1)
    private int maxPayloadBytes = 1_048_576;

    @Min(1)
    private int defaultMaxAttempts = 3;

    @Min(1)
    private int defaultTimeoutSeconds = 30;

    @Min(1)
    private int defaultRateLimitPerMinute = 60;

    @Min(0)
    private int responseBodyMaxChars = 2000;

    @NotBlank
    private String signatureHeader = "X-Webhook-Signature";

    /**
     * Longest HTTP timeout a send may use. Always shorter than the lease.
     */
    public int getMaxSendTimeoutSeconds() {
        return leaseSeconds - LEASE_HEADROOM_SECONDS;
    }
}
