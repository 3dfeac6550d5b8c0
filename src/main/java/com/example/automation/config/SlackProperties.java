package com.example.automation.config;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Operator alerts for auto-disabled tasks, rules and integrations and for
 * permanently failed webhook deliveries.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "slack")
public class SlackProperties {

    /**
     * Incoming-webhook URL. Alerts are skipped while it is blank.
     */
    private String webhookUrl;

    @NotBlank
    private String channel = "#automation-alerts";

    private boolean enabled = false;

    /**
     * Prefix for the links to the affected task, rule or webhook in the admin dashboard
     */
    @NotBlank
    private String dashboardBaseUrl = "http://localhost:8080";
}
