package com.example.automation.service;

import com.example.automation.domain.entity.Integration;
import com.example.automation.domain.repository.IntegrationRepository;
import com.example.automation.dto.CreateIntegrationRequest;
import com.example.automation.dto.IntegrationResponse;
import com.example.automation.exception.InvalidStateException;
import com.example.automation.exception.ResourceNotFoundException;
import com.example.automation.mapper.AutomationMapper;
import com.example.automation.service.integration.IntegrationProviderRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.HashMap;
import java.util.UUID;

/**
 * Service for managing external integrations.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IntegrationManagementService {

    private final IntegrationRepository integrationRepository;
    private final IntegrationProviderRegistry providerRegistry;
    private final AutomationMapper mapper;
    private final Clock clock;

    /**
     * Create an integration. The first sync is due immediately.
     *
     * @throws com.example.automation.exception.ConfigurationException for an unknown provider or invalid provider settings
     */
    @Transactional
    public IntegrationResponse createIntegration(CreateIntegrationRequest request) {
        var config = request.getConfig() != null ? new HashMap<>(request.getConfig()) : new HashMap<String, Object>();
        providerRegistry.getProviderOrThrow(request.getProvider()).validate(config);

        var integration = Integration.builder()
                .tenantId(request.getTenantId())
                .name(request.getName())
                .provider(request.getProvider())
                .config(config)
                .credentialsRef(request.getCredentialsRef())
                .targetChannelId(request.getTargetChannelId())
                .messageTemplate(request.getMessageTemplate())
                .eventName(request.getEventName())
                .syncFrequencySeconds(request.getSyncFrequencySeconds() != null ? request.getSyncFrequencySeconds() : 300)
                .requestsPerHour(request.getRequestsPerHour())
                .burst(request.getBurst())
                .nextSync(now())
                .createdBy(request.getCreatedBy())
                .build();

        integration = integrationRepository.save(integration);
        log.info("Created {} integration {} '{}' for tenant {}", integration.getProvider(), integration.getId(),
                integration.getName(), integration.getTenantId());
        return mapper.toIntegrationResponse(integration);
    }

    @Transactional(readOnly = true)
    public IntegrationResponse getIntegration(UUID integrationId) {
        return mapper.toIntegrationResponse(findIntegration(integrationId));
    }

    @Transactional(readOnly = true)
    public Page<IntegrationResponse> listIntegrations(String tenantId, Pageable pageable) {
        return integrationRepository.findByTenantId(tenantId, pageable).map(mapper::toIntegrationResponse);
    }

    /**
     * Re-enable an integration. Clears the error streak and makes it due now.
     */
    @Transactional
    public IntegrationResponse activateIntegration(UUID integrationId) {
        var integration = findIntegration(integrationId);
        if (!integration.isActive()) {
            providerRegistry.getProviderOrThrow(integration.getProvider()).validate(integration.getConfig());
            integration.setActive(true);
            integration.setErrorCount(0);
            integration.setLastError(null);
            integration.setNextSync(now());
            integration = integrationRepository.save(integration);
            log.info("Activated integration {}", integrationId);
        }
        return mapper.toIntegrationResponse(integration);
    }

    @Transactional
    public IntegrationResponse deactivateIntegration(UUID integrationId) {
        var integration = findIntegration(integrationId);
        if (integration.isActive()) {
            integration.setActive(false);
            integration.setNextSync(null);
            integration = integrationRepository.save(integration);
            log.info("Deactivated integration {}", integrationId);
        }
        return mapper.toIntegrationResponse(integration);
    }

    /**
     * Make the integration due now. A sync already in progress finishes first.
     */
    @Transactional
    public IntegrationResponse requestSync(UUID integrationId) {
        var integration = findIntegration(integrationId);
        if (!integration.isActive()) {
            throw new InvalidStateException(integrationId.toString(), "inactive", "sync");
        }
        integration.setNextSync(now());
        integration = integrationRepository.save(integration);
        log.info("Sync requested for integration {}", integrationId);
        return mapper.toIntegrationResponse(integration);
    }

    private Integration findIntegration(UUID integrationId) {
        return integrationRepository.findById(integrationId).orElseThrow(() -> new ResourceNotFoundException("Integration", integrationId));
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }
}
