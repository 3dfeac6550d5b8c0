package com.example.automation.config;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "automation.rules")
public class RuleEngineProperties {

    /**
     * Consecutive failed runs after which a rule disables itself
     */
    @Min(1)
    private int maxConsecutiveFailures = 3;
}
