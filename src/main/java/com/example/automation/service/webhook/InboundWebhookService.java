package com.example.automation.service.webhook;

import com.example.automation.config.MetricsConfig;
import com.example.automation.config.WebhookProperties;
import com.example.automation.domain.entity.InboundWebhookReceipt;
import com.example.automation.domain.entity.Webhook;
import com.example.automation.domain.model.PlatformEvent;
import com.example.automation.domain.repository.InboundWebhookReceiptRepository;
import com.example.automation.domain.repository.WebhookRepository;
import com.example.automation.exception.InvalidStateException;
import com.example.automation.exception.PayloadTooLargeException;
import com.example.automation.exception.RateLimitExceededException;
import com.example.automation.exception.ResourceNotFoundException;
import com.example.automation.exception.WebhookSignatureException;
import com.example.automation.service.ratelimit.TokenBucketRateLimiter;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Receives webhooks pushed by third parties and turns them into platform events.
 * <p>
 * Checks run in a fixed order: the webhook must exist and be active, the body must fit,
 * the per-webhook rate must allow it, the signature must match, the event type must be
 * subscribed, and the provider event id must not have been seen before.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InboundWebhookService {

    static final String DEFAULT_EVENT_TYPE = "webhook.received";
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final WebhookRepository webhookRepository;
    private final InboundWebhookReceiptRepository receiptRepository;
    private final TokenBucketRateLimiter rateLimiter;
    private final ApplicationEventPublisher eventPublisher;
    private final WebhookProperties properties;
    private final MetricsConfig metricsConfig;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * @param signature       signature header value, may be null
     * @param eventType       event type header value, may be null
     * @param providerEventId provider delivery id header value, may be null
     */
    public InboundResult receive(UUID webhookId, byte[] body, String signature, String eventType, String providerEventId) {
        var webhook = webhookRepository.findById(webhookId)
                .orElseThrow(() -> new ResourceNotFoundException("Webhook", webhookId));
        if (!webhook.isActive()) {
            throw new InvalidStateException("webhook " + webhookId, "inactive", "receive on");
        }

        var limit = webhook.getMaxPayloadSize() != null
                ? Math.min(webhook.getMaxPayloadSize(), properties.getMaxPayloadBytes())
                : properties.getMaxPayloadBytes();
        if (body.length > limit) {
            metricsConfig.recordInboundWebhook("too_large");
            throw new PayloadTooLargeException(body.length, limit);
        }

        var perMinute = webhook.getRateLimitPerMinute() != null ? webhook.getRateLimitPerMinute() : properties.getDefaultRateLimitPerMinute();
        var decision = rateLimiter.tryAcquire("inbound:" + webhookId, perMinute, perMinute / 60.0);
        if (!decision.isAllowed()) {
            metricsConfig.recordInboundWebhook("rate_limited");
            throw new RateLimitExceededException("Too many requests for webhook " + webhookId, decision.getWaitMs());
        }

        verifySignature(webhook, body, signature);

        var payload = parseBody(body);
        var type = resolveEventType(eventType, payload);
        if (!webhook.isSubscribedTo(type)) {
            log.debug("Webhook {} is not subscribed to {}, ignoring", webhookId, type);
            metricsConfig.recordInboundWebhook("ignored");
            return InboundResult.IGNORED;
        }

        var payloadHash = WebhookSignatures.sha256Hex(body);
        var dedupKey = providerEventId != null && !providerEventId.isBlank() ? providerEventId : "sha256:" + payloadHash;
        if (!recordReceipt(webhook, dedupKey, type, payloadHash)) {
            log.info("Duplicate inbound webhook {} for {}, dropped", dedupKey, webhookId);
            metricsConfig.recordInboundWebhook("duplicate");
            return InboundResult.DUPLICATE;
        }

        var event = PlatformEvent.builder()
                .tenantId(webhook.getTenantId())
                .eventName(type)
                .userId(stringOrNull(payload.get("userId")))
                .channelId(stringOrNull(payload.get("channelId")))
                .payload(payload)
                .occurredAt(clock.instant())
                .source(PlatformEvent.SOURCE_WEBHOOK)
                .build();
        eventPublisher.publishEvent(event);

        log.info("Inbound webhook {} accepted for {} as event {}", dedupKey, webhookId, type);
        metricsConfig.recordInboundWebhook("accepted");
        return InboundResult.ACCEPTED;
    }

    /**
     * A webhook without a secret accepts unsigned requests. Once a secret is set every
     * request must carry a matching signature.
     */
    private void verifySignature(Webhook webhook, byte[] body, String signature) {
        if (!webhook.hasSecret()) {
            return;
        }
        if (!WebhookSignatures.verify(webhook.getSecretToken(), body, signature)) {
            metricsConfig.recordInboundWebhook("bad_signature");
            log.warn("Rejected inbound webhook for {}: {}", webhook.getId(), signature == null ? "missing signature" : "signature mismatch");
            throw new WebhookSignatureException("Invalid webhook signature");
        }
    }

    private boolean recordReceipt(Webhook webhook, String dedupKey, String eventType, String payloadHash) {
        if (receiptRepository.existsByWebhookIdAndProviderEventId(webhook.getId(), dedupKey)) {
            return false;
        }
        try {
            receiptRepository.saveAndFlush(InboundWebhookReceipt.builder()
                    .webhookId(webhook.getId())
                    .providerEventId(dedupKey)
                    .tenantId(webhook.getTenantId())
                    .eventType(eventType)
                    .payloadHash(payloadHash)
                    .receivedAt(clock.instant())
                    .build());
            return true;
        } catch (DataIntegrityViolationException e) {
            // concurrent receipt of the same event won the insert
            return false;
        }
    }

    private Map<String, Object> parseBody(byte[] body) {
        if (body.length == 0) {
            return new HashMap<>();
        }
        try {
            var parsed = objectMapper.readValue(body, MAP_TYPE);
            return parsed != null ? parsed : new HashMap<>();
        } catch (JsonProcessingException e) {
            var wrapped = new HashMap<String, Object>();
            wrapped.put("body", new String(body, StandardCharsets.UTF_8));
            return wrapped;
        } catch (IOException e) {
            throw new IllegalArgumentException("Unreadable webhook body", e);
        }
    }

    private static String resolveEventType(String header, Map<String, Object> payload) {
        if (header != null && !header.isBlank()) {
            return header.trim();
        }
        for (var key : new String[]{"event", "type", "eventType"}) {
            if (payload.get(key) instanceof String value && !value.isBlank()) {
                return value;
            }
        }
        return DEFAULT_EVENT_TYPE;
    }

    private static String stringOrNull(Object value) {
        return value != null ? String.valueOf(value) : null;
    }
}
