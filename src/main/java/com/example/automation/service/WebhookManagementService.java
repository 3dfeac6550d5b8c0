package com.example.automation.service;

import com.example.automation.config.WebhookProperties;
import com.example.automation.domain.entity.Webhook;
import com.example.automation.domain.repository.WebhookRepository;
import com.example.automation.dto.CreateWebhookRequest;
import com.example.automation.dto.DeliveryResponse;
import com.example.automation.dto.EnqueueDeliveryRequest;
import com.example.automation.dto.WebhookResponse;
import com.example.automation.exception.ConfigurationException;
import com.example.automation.exception.ResourceNotFoundException;
import com.example.automation.mapper.AutomationMapper;
import com.example.automation.service.webhook.WebhookDeliveryService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Service for webhook registration and the delivery administration surface.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WebhookManagementService {

    private final WebhookRepository webhookRepository;
    private final WebhookDeliveryService deliveryService;
    private final AutomationMapper mapper;
    private final ObjectMapper objectMapper;
    private final WebhookProperties webhookProperties;

    // === Webhooks ===

    @Transactional
    public WebhookResponse registerWebhook(CreateWebhookRequest request) {
        var maxTimeout = webhookProperties.getMaxSendTimeoutSeconds();
        if (request.getTimeoutSeconds() != null && request.getTimeoutSeconds() > maxTimeout) {
            throw new ConfigurationException("timeoutSeconds must be at most " + maxTimeout
                    + " so a send finishes inside the " + webhookProperties.getLeaseSeconds() + "s delivery lease");
        }

        var webhook = Webhook.builder()
                .tenantId(request.getTenantId())
                .integrationId(request.getIntegrationId())
                .name(request.getName())
                .url(request.getUrl())
                .secretToken(request.getSecretToken())
                .events(request.getEvents() != null && !request.getEvents().isEmpty()
                        ? new ArrayList<>(request.getEvents())
                        : new ArrayList<>(List.of(Webhook.ALL_EVENTS)))
                .rateLimitPerMinute(request.getRateLimitPerMinute())
                .maxPayloadSize(request.getMaxPayloadSize())
                .timeoutSeconds(request.getTimeoutSeconds())
                .retryAttempts(request.getRetryAttempts())
                .build();

        webhook = webhookRepository.save(webhook);
        log.info("Registered webhook {} '{}' for tenant {}", webhook.getId(), webhook.getName(), webhook.getTenantId());
        return mapper.toWebhookResponse(webhook);
    }

    @Transactional(readOnly = true)
    public WebhookResponse getWebhook(UUID webhookId) {
        return mapper.toWebhookResponse(findWebhook(webhookId));
    }

    @Transactional(readOnly = true)
    public Page<WebhookResponse> listWebhooks(String tenantId, Pageable pageable) {
        return webhookRepository.findByTenantId(tenantId, pageable).map(mapper::toWebhookResponse);
    }

    @Transactional
    public WebhookResponse setActive(UUID webhookId, boolean active) {
        var webhook = findWebhook(webhookId);
        if (webhook.isActive() != active) {
            webhook.setActive(active);
            webhook = webhookRepository.save(webhook);
            log.info("Webhook {} {}", webhookId, active ? "activated" : "deactivated");
        }
        return mapper.toWebhookResponse(webhook);
    }

    // === Deliveries ===

    public DeliveryResponse enqueue(UUID webhookId, EnqueueDeliveryRequest request) {
        var webhook = findWebhook(webhookId);
        String payload;
        try {
            payload = objectMapper.writeValueAsString(request.getPayload());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Payload cannot be serialized: " + e.getOriginalMessage(), e);
        }
        var delivery = deliveryService.enqueue(webhook.getTenantId(), webhookId, request.getEventType(), payload, request.getDeliveryId());
        return mapper.toDeliveryResponse(delivery);
    }

    @Transactional(readOnly = true)
    public Page<DeliveryResponse> listDeliveries(UUID webhookId, Pageable pageable) {
        findWebhook(webhookId);
        return deliveryService.listDeliveries(webhookId, pageable).map(mapper::toDeliveryResponse);
    }

    public DeliveryResponse getDelivery(UUID deliveryId) {
        return mapper.toDeliveryResponse(deliveryService.getDelivery(deliveryId));
    }

    public DeliveryResponse cancelDelivery(UUID deliveryId) {
        return mapper.toDeliveryResponse(deliveryService.cancel(deliveryId));
    }

    public DeliveryResponse redeliver(UUID deliveryId) {
        return mapper.toDeliveryResponse(deliveryService.redeliver(deliveryId));
    }

    private Webhook findWebhook(UUID webhookId) {
        return webhookRepository.findById(webhookId).orElseThrow(() -> new ResourceNotFoundException("Webhook", webhookId));
    }
}
