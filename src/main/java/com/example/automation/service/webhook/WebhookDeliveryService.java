package com.example.automation.service.webhook;

import com.example.automation.config.WebhookProperties;
import com.example.automation.domain.entity.Webhook;
import com.example.automation.domain.entity.WebhookDelivery;
import com.example.automation.domain.enums.DeliveryStatus;
import com.example.automation.domain.repository.WebhookDeliveryRepository;
import com.example.automation.domain.repository.WebhookRepository;
import com.example.automation.exception.InvalidStateException;
import com.example.automation.exception.PayloadTooLargeException;
import com.example.automation.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.HashMap;
import java.util.UUID;

/**
 * Creates and manages outbound deliveries. Sending is done by {@link WebhookDeliveryWorker}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WebhookDeliveryService {

    private final WebhookRepository webhookRepository;
    private final WebhookDeliveryRepository deliveryRepository;
    private final WebhookProperties properties;
    private final Clock clock;

    /**
     * Queue a delivery. Enqueuing again with a delivery id that already exists for the
     * same webhook returns the existing delivery instead of creating a second one.
     *
     * @param deliveryId idempotency key, or null to generate one
     */
    public WebhookDelivery enqueue(String tenantId, UUID webhookId, String eventType, String payload, String deliveryId) {
        var webhook = webhookRepository.findById(webhookId)
                .filter(w -> w.getTenantId().equals(tenantId))
                .orElseThrow(() -> new ResourceNotFoundException("Webhook", webhookId));

        if (deliveryId != null) {
            var existing = deliveryRepository.findByDeliveryId(deliveryId);
            if (existing.isPresent()) {
                return sameWebhookOrConflict(existing.get(), webhookId);
            }
        }

        validateForSend(webhook, eventType, payload);

        var now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        var delivery = WebhookDelivery.builder()
                .webhookId(webhook.getId())
                .tenantId(webhook.getTenantId())
                .deliveryId(deliveryId != null ? deliveryId : UUID.randomUUID().toString())
                .eventType(eventType)
                .payload(payload)
                .targetUrl(webhook.getUrl())
                .headers(new HashMap<>())
                .maxAttempts(webhook.getRetryAttempts() != null ? webhook.getRetryAttempts() : properties.getDefaultMaxAttempts())
                .status(DeliveryStatus.PENDING)
                .scheduledAt(now)
                .build();

        try {
            delivery = deliveryRepository.saveAndFlush(delivery);
        } catch (DataIntegrityViolationException e) {
            // lost an insert race on the same delivery id
            var existing = deliveryRepository.findByDeliveryId(delivery.getDeliveryId())
                    .orElseThrow(() -> e);
            return sameWebhookOrConflict(existing, webhookId);
        }

        log.info("Enqueued delivery {} ({}) for webhook {}", delivery.getDeliveryId(), eventType, webhookId);
        return delivery;
    }

    /**
     * Cancel a pending delivery. A delivery already being sent keeps running but its
     * result is discarded and it stays cancelled.
     */
    @Transactional
    public WebhookDelivery cancel(UUID id) {
        var delivery = getDelivery(id);
        if (deliveryRepository.cancel(id, clock.instant()) == 0) {
            throw new InvalidStateException(id.toString(), delivery.getStatus().name(), "cancel");
        }
        log.info("Cancelled delivery {}", delivery.getDeliveryId());
        return getDelivery(id);
    }

    /**
     * Queue a fresh delivery carrying the stored payload of a finished one.
     */
    public WebhookDelivery redeliver(UUID id) {
        var original = getDelivery(id);
        if (original.getStatus() == DeliveryStatus.PENDING) {
            throw new InvalidStateException(id.toString(), original.getStatus().name(), "redeliver");
        }
        log.info("Redelivering {} as a new delivery", original.getDeliveryId());
        return enqueue(original.getTenantId(), original.getWebhookId(), original.getEventType(), original.getPayload(), null);
    }

    @Transactional(readOnly = true)
    public WebhookDelivery getDelivery(UUID id) {
        return deliveryRepository.findById(id).orElseThrow(() -> new ResourceNotFoundException("WebhookDelivery", id));
    }

    @Transactional(readOnly = true)
    public Page<WebhookDelivery> listDeliveries(UUID webhookId, Pageable pageable) {
        return deliveryRepository.findByWebhookIdOrderByCreatedAtDesc(webhookId, pageable);
    }

    private void validateForSend(Webhook webhook, String eventType, String payload) {
        var id = webhook.getId().toString();
        if (!webhook.isActive()) {
            throw new InvalidStateException("webhook " + id, "inactive", "enqueue a delivery for");
        }
        if (webhook.getUrl() == null || webhook.getUrl().isBlank()) {
            throw new InvalidStateException("webhook " + id, "without an outbound url", "enqueue a delivery for");
        }
        if (!webhook.isSubscribedTo(eventType)) {
            throw new InvalidStateException("webhook " + id, "not subscribed to " + eventType, "enqueue a delivery for");
        }
        var limit = effectivePayloadLimit(webhook);
        var size = payload.getBytes(StandardCharsets.UTF_8).length;
        if (size > limit) {
            throw new PayloadTooLargeException(size, limit);
        }
    }

    int effectivePayloadLimit(Webhook webhook) {
        var global = properties.getMaxPayloadBytes();
        return webhook.getMaxPayloadSize() != null ? Math.min(global, webhook.getMaxPayloadSize()) : global;
    }

    private WebhookDelivery sameWebhookOrConflict(WebhookDelivery existing, UUID webhookId) {
        if (!existing.getWebhookId().equals(webhookId)) {
            throw new InvalidStateException("delivery " + existing.getDeliveryId(), "owned by another webhook", "enqueue");
        }
        log.debug("Delivery {} already exists, returning it", existing.getDeliveryId());
        return existing;
    }
}
