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
import com.example.automation.exception.WebhookSignatureException;
import com.example.automation.service.ratelimit.RateLimitDecision;
import com.example.automation.service.ratelimit.TokenBucketRateLimiter;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("InboundWebhookService Tests")
class InboundWebhookServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-05T05:05:05Z");
    private static final byte[] BODY = "{\"event\":\"push\",\"userId\":\"u-9\",\"ref\":\"main\"}".getBytes(StandardCharsets.UTF_8);

    @Mock
    private WebhookRepository webhookRepository;

    @Mock
    private InboundWebhookReceiptRepository receiptRepository;

    @Mock
    private TokenBucketRateLimiter rateLimiter;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    @Mock
    private MetricsConfig metricsConfig;

    @Captor
    private ArgumentCaptor<PlatformEvent> eventCaptor;

    @Captor
    private ArgumentCaptor<InboundWebhookReceipt> receiptCaptor;

    private WebhookProperties properties;
    private InboundWebhookService inboundWebhookService;
    private Webhook webhook;

    @BeforeEach
    void setUp() {
        properties = new WebhookProperties();
        inboundWebhookService = new InboundWebhookService(webhookRepository, receiptRepository, rateLimiter, eventPublisher,
                properties, metricsConfig, new ObjectMapper(), Clock.fixed(NOW, ZoneOffset.UTC));

        webhook = Webhook.builder()
                .id(UUID.randomUUID())
                .tenantId("guild-1")
                .name("github")
                .secretToken("topsecret")
                .build();

        lenient().when(webhookRepository.findById(webhook.getId())).thenReturn(Optional.of(webhook));
        lenient().when(rateLimiter.tryAcquire(anyString(), anyDouble(), anyDouble())).thenReturn(RateLimitDecision.allow());
    }

    private String signature(byte[] body) {
        return WebhookSignatures.sign("topsecret", body);
    }

    @Nested
    @DisplayName("Accepting Tests")
    class AcceptingTests {

        @Test
        @DisplayName("Should publish a platform event for a signed request")
        void shouldAcceptSignedRequest() {
            // When
            var result = inboundWebhookService.receive(webhook.getId(), BODY, signature(BODY), null, "gh-1");

            // Then
            assertThat(result).isEqualTo(InboundResult.ACCEPTED);
            verify(eventPublisher).publishEvent(eventCaptor.capture());
            var event = eventCaptor.getValue();
            assertThat(event.getTenantId()).isEqualTo("guild-1");
            assertThat(event.getEventName()).isEqualTo("push");
            assertThat(event.getUserId()).isEqualTo("u-9");
            assertThat(event.getSource()).isEqualTo(PlatformEvent.SOURCE_WEBHOOK);
            assertThat(event.getPayload()).containsEntry("ref", "main");

            verify(receiptRepository).saveAndFlush(receiptCaptor.capture());
            assertThat(receiptCaptor.getValue().getProviderEventId()).isEqualTo("gh-1");
        }

        @Test
        @DisplayName("Should prefer the event type header over the body")
        void shouldUseEventTypeHeader() {
            inboundWebhookService.receive(webhook.getId(), BODY, signature(BODY), "pull_request", "gh-2");

            verify(eventPublisher).publishEvent(eventCaptor.capture());
            assertThat(eventCaptor.getValue().getEventName()).isEqualTo("pull_request");
        }

        @Test
        @DisplayName("Should accept an unsigned request when no secret is configured")
        void shouldAcceptUnsignedWithoutSecret() {
            webhook.setSecretToken(null);

            assertThat(inboundWebhookService.receive(webhook.getId(), BODY, null, null, "gh-3")).isEqualTo(InboundResult.ACCEPTED);
        }

        @Test
        @DisplayName("Should wrap a body that is not JSON")
        void shouldWrapNonJsonBody() {
            // Given
            webhook.setSecretToken(null);
            var body = "plain text".getBytes(StandardCharsets.UTF_8);

            // When
            inboundWebhookService.receive(webhook.getId(), body, null, "ping", null);

            // Then
            verify(eventPublisher).publishEvent(eventCaptor.capture());
            assertThat(eventCaptor.getValue().getPayload()).containsEntry("body", "plain text");
        }
    }

    @Nested
    @DisplayName("Deduplication Tests")
    class DeduplicationTests {

        @Test
        @DisplayName("Should drop a provider event id seen before")
        void shouldDropDuplicateProviderId() {
            // Given
            when(receiptRepository.existsByWebhookIdAndProviderEventId(webhook.getId(), "gh-1")).thenReturn(true);

            // When
            var result = inboundWebhookService.receive(webhook.getId(), BODY, signature(BODY), null, "gh-1");

            // Then
            assertThat(result).isEqualTo(InboundResult.DUPLICATE);
            verifyNoInteractions(eventPublisher);
        }

        @Test
        @DisplayName("Should key on the body hash when no provider id is sent")
        void shouldUseBodyHashWithoutProviderId() {
            // When
            inboundWebhookService.receive(webhook.getId(), BODY, signature(BODY), null, null);

            // Then
            verify(receiptRepository).existsByWebhookIdAndProviderEventId(webhook.getId(), "sha256:" + WebhookSignatures.sha256Hex(BODY));
        }

        @Test
        @DisplayName("Should treat a lost insert race as a duplicate")
        void shouldTreatInsertRaceAsDuplicate() {
            // Given
            when(receiptRepository.saveAndFlush(any(InboundWebhookReceipt.class))).thenThrow(new DataIntegrityViolationException("unique"));

            // When
            var result = inboundWebhookService.receive(webhook.getId(), BODY, signature(BODY), null, "gh-1");

            // Then
            assertThat(result).isEqualTo(InboundResult.DUPLICATE);
            verifyNoInteractions(eventPublisher);
        }
    }

    @Nested
    @DisplayName("Rejection Tests")
    class RejectionTests {

        @Test
        @DisplayName("Should reject a bad signature")
        void shouldRejectBadSignature() {
            assertThatThrownBy(() -> inboundWebhookService.receive(webhook.getId(), BODY, "sha256=deadbeef", null, "gh-1"))
                    .isInstanceOf(WebhookSignatureException.class);
            verifyNoInteractions(receiptRepository, eventPublisher);
        }

        @Test
        @DisplayName("Should reject a missing signature when a secret is set")
        void shouldRejectMissingSignature() {
            assertThatThrownBy(() -> inboundWebhookService.receive(webhook.getId(), BODY, null, null, "gh-1"))
                    .isInstanceOf(WebhookSignatureException.class);
        }

        @Test
        @DisplayName("Should reject a body over the webhook's own limit")
        void shouldRejectOversizedBody() {
            webhook.setMaxPayloadSize(10);

            assertThatThrownBy(() -> inboundWebhookService.receive(webhook.getId(), BODY, signature(BODY), null, "gh-1"))
                    .isInstanceOf(PayloadTooLargeException.class);
            verifyNoInteractions(rateLimiter);
        }

        @Test
        @DisplayName("Should reject when the inbound rate is exhausted")
        void shouldRejectWhenRateLimited() {
            when(rateLimiter.tryAcquire(eq("inbound:" + webhook.getId()), anyDouble(), anyDouble())).thenReturn(RateLimitDecision.deny(2000));

            assertThatThrownBy(() -> inboundWebhookService.receive(webhook.getId(), BODY, signature(BODY), null, "gh-1"))
                    .isInstanceOf(RateLimitExceededException.class);
        }

        @Test
        @DisplayName("Should reject an inactive webhook")
        void shouldRejectInactiveWebhook() {
            webhook.setActive(false);

            assertThatThrownBy(() -> inboundWebhookService.receive(webhook.getId(), BODY, signature(BODY), null, "gh-1"))
                    .isInstanceOf(InvalidStateException.class);
        }

        @Test
        @DisplayName("Should ignore event types the webhook is not subscribed to")
        void shouldIgnoreUnsubscribedEvent() {
            // Given
            webhook.setEvents(List.of("release"));

            // When
            var result = inboundWebhookService.receive(webhook.getId(), BODY, signature(BODY), null, "gh-1");

            // Then
            assertThat(result).isEqualTo(InboundResult.IGNORED);
            verifyNoInteractions(receiptRepository, eventPublisher);
        }
    }
}
