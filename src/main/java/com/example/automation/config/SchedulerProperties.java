package com.example.automation.config;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the scheduler loop.
 * Loaded from application.yml.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "automation.scheduler")
public class SchedulerProperties {

    /**
     * Polling interval in milliseconds for checking due tasks
     */
    @Min(100)
    private long pollIntervalMs = 5000;

    /**
     * Maximum number of due tasks to fetch per poll cycle
     */
    @Min(1)
    private int batchSize = 100;

    /**
     * Number of scheduler worker threads
     */
    @Min(1)
    private int workerPoolSize = 8;

    /**
     * Consecutive failed runs after which a task disables itself
     */
    @Min(1)
    private int maxConsecutiveFailures = 3;

    /**
     * How far next_execution is pushed when the trigger itself cannot be evaluated
     */
    @Min(1)
    private int configurationErrorBackoffMinutes = 60;

    /**
     * RUNNING execution records older than this are treated as abandoned
     */
    @Min(1)
    private int staleRecordThresholdMinutes = 60;

    /**
     * Terminal execution history older than this is purged
     */
    @Min(1)
    private int historyRetentionDays = 90;

    /**
     * How many days ahead recurring patterns are searched for a matching slot
     */
    @Min(1)
    private int patternHorizonDays = 1830;
}
