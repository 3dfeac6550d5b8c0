package com.example.automation.service.integration;

import com.example.automation.exception.ConfigurationException;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Registry for integration providers.
 * <p>
 * Discovers every IntegrationProvider bean and looks them up by provider key.
 */
@Slf4j
@Component
public class IntegrationProviderRegistry {

    private final Map<String, IntegrationProvider> providers = new HashMap<>();
    private final List<IntegrationProvider> providerBeans;

    public IntegrationProviderRegistry(List<IntegrationProvider> providerBeans) {
        this.providerBeans = providerBeans;
    }

    @PostConstruct
    public void initialize() {
        for (var provider : providerBeans) {
            var key = provider.getProviderKey();
            if (providers.containsKey(key)) {
                log.warn("Duplicate integration provider for {}: {} will override {}",
                        key, provider.getClass().getSimpleName(), providers.get(key).getClass().getSimpleName());
            }
            providers.put(key, provider);
            log.info("Registered integration provider {}: {}", key, provider.getClass().getSimpleName());
        }
    }

    public Optional<IntegrationProvider> getProvider(String key) {
        return Optional.ofNullable(providers.get(key));
    }

    /**
     * @throws ConfigurationException if no provider is registered under the key
     */
    public IntegrationProvider getProviderOrThrow(String key) {
        return getProvider(key).orElseThrow(() -> new ConfigurationException("No integration provider registered for: " + key));
    }

    public Set<String> getRegisteredKeys() {
        return providers.keySet();
    }
}
