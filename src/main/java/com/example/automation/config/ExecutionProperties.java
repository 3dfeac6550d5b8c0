package com.example.automation.config;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Settings shared by every action list run.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "automation.execution")
public class ExecutionProperties {

    /**
     * Upper bound on a single dispatcher call
     */
    @Min(1)
    private int actionTimeoutSeconds = 15;

    /**
     * Threads used to run dispatcher calls under a timeout
     */
    @Min(1)
    private int dispatchPoolSize = 16;
}
