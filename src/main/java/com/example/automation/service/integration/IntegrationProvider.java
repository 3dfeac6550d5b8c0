package com.example.automation.service.integration;

import com.example.automation.domain.entity.Integration;

import java.util.List;
import java.util.Map;

/**
 * Interface for pulling items from one kind of external service.
 * <p>
 * Each implementation should:
 * 1. Return its registry key from {@link #getProviderKey()}
 * 2. Fetch the current item list in {@link #fetch}, newest or oldest first as the service returns it
 * 3. Throw ExternalServiceException on remote failures and ConfigurationException on bad settings
 */
public interface IntegrationProvider {

    /**
     * Key stored in {@code Integration.provider}
     */
    String getProviderKey();

    List<ExternalItem> fetch(Integration integration, CredentialHandle credentials);

    /**
     * Check provider settings when an integration is created.
     *
     * @throws com.example.automation.exception.ConfigurationException if a setting is missing or invalid
     */
    default void validate(Map<String, Object> config) {
    }
}
