package com.example.automation.config;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Location of the platform gateway that performs chat-side actions
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "external-services.platform-gateway")
public class PlatformGatewayProperties {
    @NotBlank
    private String baseUrl;
    private int timeoutSeconds = 10;
}
