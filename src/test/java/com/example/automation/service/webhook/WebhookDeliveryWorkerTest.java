package com.example.automation.service.webhook;

import com.example.automation.config.InstanceIdentity;
import com.example.automation.config.MetricsConfig;
import com.example.automation.config.WebhookProperties;
import com.example.automation.domain.entity.Webhook;
import com.example.automation.domain.entity.WebhookDelivery;
import com.example.automation.domain.enums.ErrorKind;
import com.example.automation.domain.repository.WebhookDeliveryRepository;
import com.example.automation.domain.repository.WebhookRepository;
import com.example.automation.service.alert.SlackAlertService;
import com.example.automation.service.ratelimit.RateLimitDecision;
import com.example.automation.service.ratelimit.TokenBucketRateLimiter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("WebhookDeliveryWorker Tests")
class WebhookDeliveryWorkerTest {

    private static final Instant NOW = Instant.parse("2024-04-01T10:00:00Z");

    @Mock
    private WebhookDeliveryRepository deliveryRepository;

    @Mock
    private WebhookRepository webhookRepository;

    @Mock
    private WebhookSender sender;

    @Mock
    private TokenBucketRateLimiter rateLimiter;

    @Mock
    private SlackAlertService slackAlertService;

    @Mock
    private MetricsConfig metricsConfig;

    @Mock
    private InstanceIdentity instanceIdentity;

    private ExecutorService executor;
    private WebhookDeliveryWorker worker;
    private Webhook webhook;

    @BeforeEach
    void setUp() {
        var properties = new WebhookProperties();
        properties.setBaseBackoffSeconds(1);
        properties.setMaxBackoffSeconds(5);
        executor = Executors.newFixedThreadPool(2);
        worker = new WebhookDeliveryWorker(deliveryRepository, webhookRepository, sender, rateLimiter, slackAlertService, metricsConfig,
                properties, instanceIdentity, executor, Clock.fixed(NOW, ZoneOffset.UTC));

        webhook = Webhook.builder()
                .id(UUID.randomUUID())
                .tenantId("guild-1")
                .name("crm")
                .url("https://hooks.example.com/in")
                .secretToken("s3cret")
                .build();

        lenient().when(instanceIdentity.getInstanceId()).thenReturn("worker-a");
        lenient().when(webhookRepository.findById(webhook.getId())).thenReturn(Optional.of(webhook));
        lenient().when(rateLimiter.tryAcquire(anyString(), anyDouble(), anyDouble())).thenReturn(RateLimitDecision.allow());
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private WebhookDelivery delivery(int attemptNumber) {
        return WebhookDelivery.builder()
                .id(UUID.randomUUID())
                .webhookId(webhook.getId())
                .tenantId("guild-1")
                .deliveryId("d-" + attemptNumber)
                .eventType("member_join")
                .payload("{\"user\":\"u-1\"}")
                .targetUrl(webhook.getUrl())
                .attemptNumber(attemptNumber)
                .maxAttempts(3)
                .scheduledAt(NOW)
                .build();
    }

    @Nested
    @DisplayName("processDelivery Tests")
    class ProcessDeliveryTests {

        @Test
        @DisplayName("Should mark a 2xx response delivered")
        void shouldMarkDelivered() {
            // Given
            var delivery = delivery(0);
            when(deliveryRepository.claim(eq(delivery.getId()), eq(0), startsWith("worker-a:"), any(), eq(NOW))).thenReturn(1);
            when(sender.send(eq(delivery), eq(1), eq("s3cret"), any())).thenReturn(WebhookSendResult.delivered(204, ""));
            when(deliveryRepository.markDelivered(eq(delivery.getId()), startsWith("worker-a:"), eq(1), eq(204), eq(""), anyLong(), eq(NOW))).thenReturn(1);

            // When
            var outcome = worker.processDelivery(delivery);

            // Then
            assertThat(outcome).isEqualTo(WebhookDeliveryWorker.OUTCOME_DELIVERED);
            verify(webhookRepository).recordSuccess(webhook.getId(), NOW);
            verify(metricsConfig).recordDelivery(WebhookDeliveryWorker.OUTCOME_DELIVERED);
        }

        @Test
        @DisplayName("Should lease each claim under its own token and write the result under that token")
        void shouldUseDistinctLeaseTokenPerClaim() {
            // Given
            var first = delivery(0);
            var second = delivery(0);
            when(deliveryRepository.claim(any(), anyInt(), any(), any(), any())).thenReturn(1);
            when(sender.send(any(), anyInt(), any(), any())).thenReturn(WebhookSendResult.delivered(200, "ok"));
            when(deliveryRepository.markDelivered(any(), any(), anyInt(), any(), any(), any(), any())).thenReturn(1);

            // When
            worker.processDelivery(first);
            worker.processDelivery(second);

            // Then
            var claimOwners = ArgumentCaptor.forClass(String.class);
            verify(deliveryRepository, times(2)).claim(any(), anyInt(), claimOwners.capture(), any(), any());
            var resultOwners = ArgumentCaptor.forClass(String.class);
            verify(deliveryRepository, times(2)).markDelivered(any(), resultOwners.capture(), anyInt(), any(), any(), any(), any());
            assertThat(claimOwners.getAllValues()).doesNotHaveDuplicates().allMatch(owner -> owner.startsWith("worker-a:"));
            assertThat(resultOwners.getAllValues()).isEqualTo(claimOwners.getAllValues());
        }

        @Test
        @DisplayName("Should keep the send timeout shorter than the delivery lease")
        void shouldCapTimeoutBelowLease() {
            // Given
            webhook.setTimeoutSeconds(120);
            when(deliveryRepository.claim(any(), anyInt(), any(), any(), any())).thenReturn(1);
            when(sender.send(any(), anyInt(), any(), any())).thenReturn(WebhookSendResult.delivered(200, "ok"));
            when(deliveryRepository.markDelivered(any(), any(), anyInt(), any(), any(), any(), any())).thenReturn(1);

            // When
            worker.processDelivery(delivery(0));

            // Then
            var leaseUntil = ArgumentCaptor.forClass(Instant.class);
            verify(deliveryRepository).claim(any(), anyInt(), any(), leaseUntil.capture(), eq(NOW));
            var timeout = ArgumentCaptor.forClass(Duration.class);
            verify(sender).send(any(), eq(1), any(), timeout.capture());
            assertThat(timeout.getValue()).isEqualTo(Duration.ofSeconds(110));
            assertThat(NOW.plus(timeout.getValue())).isBefore(leaseUntil.getValue());
        }

        @Test
        @DisplayName("Should retry twice with growing delays and fail on the third transient error")
        void shouldRetryThenFail() {
            // Given
            var transientError = WebhookSendResult.failed(503, "busy", "HTTP 503", ErrorKind.TRANSIENT);
            when(deliveryRepository.claim(any(), anyInt(), any(), any(), any())).thenReturn(1);
            when(sender.send(any(), anyInt(), any(), any())).thenReturn(transientError);
            when(deliveryRepository.markRetry(any(), any(), anyInt(), any(), any(), any(), any(), any(), any())).thenReturn(1);
            when(deliveryRepository.markFailed(any(), any(), anyInt(), any(), any(), any(), any(), any())).thenReturn(1);

            // When
            var first = worker.processDelivery(delivery(0));
            var second = worker.processDelivery(delivery(1));
            var third = worker.processDelivery(delivery(2));

            // Then
            assertThat(List.of(first, second, third)).containsExactly(
                    WebhookDeliveryWorker.OUTCOME_RETRY, WebhookDeliveryWorker.OUTCOME_RETRY, WebhookDeliveryWorker.OUTCOME_FAILED);

            var retryAt = ArgumentCaptor.forClass(Instant.class);
            verify(deliveryRepository, times(2)).markRetry(any(), startsWith("worker-a:"), anyInt(), retryAt.capture(),
                    eq(503), eq("busy"), any(), eq("HTTP 503"), eq(NOW));
            var delays = retryAt.getAllValues().stream().map(at -> Duration.between(NOW, at)).toList();
            assertThat(delays.get(0)).isBetween(Duration.ofMillis(1100), Duration.ofMillis(1250));
            assertThat(delays.get(1)).isBetween(Duration.ofMillis(2200), Duration.ofMillis(2500));

            verify(deliveryRepository).markFailed(any(), startsWith("worker-a:"), eq(3), eq(503), eq("busy"), any(), eq("HTTP 503"), eq(NOW));
            verify(slackAlertService).sendDeliveryFailedAlert(any(WebhookDelivery.class), eq("HTTP 503"));
        }

        @Test
        @DisplayName("Should fail at once on a permanent error")
        void shouldFailOnPermanentError() {
            // Given
            var delivery = delivery(0);
            when(deliveryRepository.claim(any(), anyInt(), any(), any(), any())).thenReturn(1);
            when(sender.send(any(), anyInt(), any(), any())).thenReturn(WebhookSendResult.failed(404, "nope", "HTTP 404", ErrorKind.PERMANENT));
            when(deliveryRepository.markFailed(any(), any(), anyInt(), any(), any(), any(), any(), any())).thenReturn(1);

            // When
            var outcome = worker.processDelivery(delivery);

            // Then
            assertThat(outcome).isEqualTo(WebhookDeliveryWorker.OUTCOME_FAILED);
            verify(deliveryRepository).markFailed(eq(delivery.getId()), startsWith("worker-a:"), eq(1), eq(404), eq("nope"), any(), eq("HTTP 404"), eq(NOW));
            verify(deliveryRepository, never()).markRetry(any(), any(), anyInt(), any(), any(), any(), any(), any(), any());
        }

        @Test
        @DisplayName("Should discard the result of a delivery cancelled while in flight")
        void shouldDiscardCancelledDelivery() {
            // Given
            var delivery = delivery(0);
            when(deliveryRepository.claim(any(), anyInt(), any(), any(), any())).thenReturn(1);
            when(sender.send(any(), anyInt(), any(), any())).thenReturn(WebhookSendResult.delivered(200, "ok"));
            when(deliveryRepository.markDelivered(any(), any(), anyInt(), any(), any(), any(), any())).thenReturn(0);

            // When
            var outcome = worker.processDelivery(delivery);

            // Then
            assertThat(outcome).isEqualTo(WebhookDeliveryWorker.OUTCOME_DISCARDED);
            verify(metricsConfig).recordDelivery(WebhookDeliveryWorker.OUTCOME_DISCARDED);
        }

        @Test
        @DisplayName("Should not send when another worker holds the lease")
        void shouldSkipWhenClaimLost() {
            // Given
            when(deliveryRepository.claim(any(), anyInt(), any(), any(), any())).thenReturn(0);

            // When
            var outcome = worker.processDelivery(delivery(0));

            // Then
            assertThat(outcome).isNull();
            verifyNoInteractions(sender);
        }

        @Test
        @DisplayName("Should requeue without using an attempt when the send rate is exhausted")
        void shouldRequeueWhenRateLimited() {
            // Given
            var delivery = delivery(1);
            when(deliveryRepository.claim(any(), anyInt(), any(), any(), any())).thenReturn(1);
            when(rateLimiter.tryAcquire(eq("webhook:" + webhook.getId()), anyDouble(), anyDouble())).thenReturn(RateLimitDecision.deny(1500));

            // When
            var outcome = worker.processDelivery(delivery);

            // Then
            assertThat(outcome).isEqualTo(WebhookDeliveryWorker.OUTCOME_RATE_LIMITED);
            verify(deliveryRepository).release(delivery.getId(), "worker-a", NOW.plusMillis(1500), NOW);
            verifyNoInteractions(sender);
        }

        @Test
        @DisplayName("Should requeue without using an attempt when the circuit is open")
        void shouldRequeueWhenCircuitOpen() {
            // Given
            var delivery = delivery(0);
            when(deliveryRepository.claim(any(), anyInt(), any(), any(), any())).thenReturn(1);
            when(sender.send(any(), anyInt(), any(), any())).thenReturn(WebhookSendResult.circuitOpen("circuit open"));

            // When
            var outcome = worker.processDelivery(delivery);

            // Then
            assertThat(outcome).isEqualTo(WebhookDeliveryWorker.OUTCOME_RATE_LIMITED);
            verify(deliveryRepository).release(delivery.getId(), "worker-a", NOW.plusSeconds(1), NOW);
            verify(deliveryRepository, never()).markRetry(any(), any(), anyInt(), any(), any(), any(), any(), any(), any());
        }

        @Test
        @DisplayName("Should fail a delivery whose webhook was deactivated")
        void shouldFailForInactiveWebhook() {
            // Given
            webhook.setActive(false);
            var delivery = delivery(0);
            when(deliveryRepository.claim(any(), anyInt(), any(), any(), any())).thenReturn(1);

            // When
            var outcome = worker.processDelivery(delivery);

            // Then
            assertThat(outcome).isEqualTo(WebhookDeliveryWorker.OUTCOME_FAILED);
            verify(deliveryRepository).markFailed(delivery.getId(), "worker-a", 0, null, null, null, "Webhook is inactive", NOW);
            verifyNoInteractions(sender);
        }
    }

    @Test
    @DisplayName("Should process every due delivery in a polling cycle")
    void shouldProcessDueDeliveries() {
        // Given
        var a = delivery(0);
        var b = delivery(0);
        when(deliveryRepository.findDueDeliveries(eq(NOW), any())).thenReturn(List.of(a, b));
        when(deliveryRepository.claim(any(), anyInt(), any(), any(), any())).thenReturn(1);
        when(sender.send(any(), anyInt(), any(), any())).thenReturn(WebhookSendResult.delivered(200, "ok"));
        when(deliveryRepository.markDelivered(any(), any(), anyInt(), any(), any(), any(), any())).thenReturn(1);

        // When
        worker.pollAndDeliver();

        // Then
        verify(sender, times(2)).send(any(), eq(1), eq("s3cret"), eq(Duration.ofSeconds(30)));
    }
}
