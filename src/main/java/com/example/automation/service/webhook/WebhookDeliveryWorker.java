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
import com.example.automation.service.ratelimit.TokenBucketRateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Polls due deliveries and sends them.
 * <p>
 * Any number of instances may run this loop. A delivery is only sent by the worker
 * whose claim update succeeds, and every result write is conditional on that claim
 * still owning the lease and the delivery still being pending. The lease owner is a
 * token unique to one claim, so a re-claim of an expired lease on the same instance
 * cannot be mistaken for the original one. The send timeout is kept inside the lease.
 */
@Slf4j
@Service
public class WebhookDeliveryWorker {

    static final String OUTCOME_DELIVERED = "delivered";
    static final String OUTCOME_RETRY = "retry";
    static final String OUTCOME_FAILED = "failed";
    static final String OUTCOME_RATE_LIMITED = "rate_limited";
    static final String OUTCOME_DISCARDED = "discarded";

    private final WebhookDeliveryRepository deliveryRepository;
    private final WebhookRepository webhookRepository;
    private final WebhookSender sender;
    private final TokenBucketRateLimiter rateLimiter;
    private final SlackAlertService slackAlertService;
    private final MetricsConfig metricsConfig;
    private final WebhookProperties properties;
    private final InstanceIdentity instanceIdentity;
    private final ExecutorService webhookDeliveryExecutor;
    private final Clock clock;

    private final AtomicBoolean isRunning = new AtomicBoolean(false);

    public WebhookDeliveryWorker(WebhookDeliveryRepository deliveryRepository, WebhookRepository webhookRepository, WebhookSender sender,
                                 TokenBucketRateLimiter rateLimiter, SlackAlertService slackAlertService, MetricsConfig metricsConfig,
                                 WebhookProperties properties, InstanceIdentity instanceIdentity,
                                 @Qualifier("webhookDeliveryExecutor") ExecutorService webhookDeliveryExecutor, Clock clock) {
        this.deliveryRepository = deliveryRepository;
        this.webhookRepository = webhookRepository;
        this.sender = sender;
        this.rateLimiter = rateLimiter;
        this.slackAlertService = slackAlertService;
        this.metricsConfig = metricsConfig;
        this.properties = properties;
        this.instanceIdentity = instanceIdentity;
        this.webhookDeliveryExecutor = webhookDeliveryExecutor;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${automation.webhooks.poll-interval-ms:2000}")
    public void pollAndDeliver() {
        if (!isRunning.compareAndSet(false, true)) {
            log.debug("Previous delivery cycle still running, skipping");
            return;
        }

        try {
            var due = deliveryRepository.findDueDeliveries(clock.instant(), PageRequest.of(0, properties.getBatchSize()));
            if (due.isEmpty()) {
                log.debug("No deliveries due");
                return;
            }

            log.debug("Found {} due deliveries", due.size());
            var futures = due.stream()
                    .map(delivery -> CompletableFuture.runAsync(() -> processDelivery(delivery), webhookDeliveryExecutor))
                    .toList();

            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                    .orTimeout(properties.getLeaseSeconds(), TimeUnit.SECONDS)
                    .exceptionally(ex -> {
                        log.error("Error waiting for deliveries to finish: {}", ex.getMessage());
                        return null;
                    })
                    .join();
        } catch (Exception e) {
            log.error("Error in delivery polling cycle: {}", e.getMessage(), e);
        } finally {
            isRunning.set(false);
        }
    }

    /**
     * Claim and send one delivery.
     *
     * @return the outcome label, or null when the claim was lost
     */
    String processDelivery(WebhookDelivery delivery) {
        try {
            return claimAndSend(delivery);
        } catch (Exception e) {
            // lease expiry makes the delivery due again
            log.error("Error processing delivery {}: {}", delivery.getDeliveryId(), e.getMessage(), e);
            return null;
        }
    }

    private String claimAndSend(WebhookDelivery delivery) {
        var owner = leaseToken();
        var now = clock.instant();
        var expectedAttempt = delivery.getAttemptNumber();

        if (deliveryRepository.claim(delivery.getId(), expectedAttempt, owner, now.plusSeconds(properties.getLeaseSeconds()), now) == 0) {
            log.debug("Delivery {} claimed by another worker, skipping", delivery.getDeliveryId());
            return null;
        }

        var webhook = webhookRepository.findById(delivery.getWebhookId()).orElse(null);
        if (webhook == null || !webhook.isActive()) {
            var reason = webhook == null ? "Webhook no longer exists" : "Webhook is inactive";
            log.info("Failing delivery {}: {}", delivery.getDeliveryId(), reason);
            deliveryRepository.markFailed(delivery.getId(), owner, expectedAttempt, null, null, null, reason, now);
            metricsConfig.recordDelivery(OUTCOME_FAILED);
            return OUTCOME_FAILED;
        }

        var perMinute = webhook.getRateLimitPerMinute() != null ? webhook.getRateLimitPerMinute() : properties.getDefaultRateLimitPerMinute();
        var decision = rateLimiter.tryAcquire("webhook:" + webhook.getId(), perMinute, perMinute / 60.0);
        if (!decision.isAllowed()) {
            var retryAt = now.plusMillis(decision.getWaitMs()).truncatedTo(ChronoUnit.MILLIS);
            log.debug("Send rate for webhook {} exhausted, delivery {} requeued for {}", webhook.getId(), delivery.getDeliveryId(), retryAt);
            deliveryRepository.release(delivery.getId(), owner, retryAt, now);
            metricsConfig.recordDelivery(OUTCOME_RATE_LIMITED);
            return OUTCOME_RATE_LIMITED;
        }

        var attempt = expectedAttempt + 1;
        var timeout = sendTimeout(webhook);
        var start = clock.instant();
        var result = sender.send(delivery, attempt, webhook.getSecretToken(), timeout);
        var finished = clock.instant();
        var elapsedMs = finished.toEpochMilli() - start.toEpochMilli();

        if (result.isNotAttempted()) {
            var retryAt = finished.plusSeconds(properties.getBaseBackoffSeconds()).truncatedTo(ChronoUnit.MILLIS);
            deliveryRepository.release(delivery.getId(), owner, retryAt, finished);
            metricsConfig.recordDelivery(OUTCOME_RATE_LIMITED);
            return OUTCOME_RATE_LIMITED;
        }

        if (result.isSuccess()) {
            return onDelivered(delivery, webhook, owner, attempt, result, elapsedMs, finished);
        }
        if (result.getErrorKind() == ErrorKind.PERMANENT || attempt >= delivery.getMaxAttempts()) {
            return onFailed(delivery, webhook, owner, attempt, result, elapsedMs, finished);
        }
        return onRetry(delivery, webhook, owner, attempt, result, elapsedMs, finished);
    }

    private String leaseToken() {
        return instanceIdentity.getInstanceId() + ":" + UUID.randomUUID();
    }

    private Duration sendTimeout(Webhook webhook) {
        var configured = webhook.getTimeoutSeconds() != null ? webhook.getTimeoutSeconds() : properties.getDefaultTimeoutSeconds();
        var cap = properties.getMaxSendTimeoutSeconds();
        if (configured > cap) {
            log.debug("Timeout {}s of webhook {} capped to {}s to stay inside the delivery lease", configured, webhook.getId(), cap);
        }
        return Duration.ofSeconds(Math.min(configured, cap));
    }

    private String onDelivered(WebhookDelivery delivery, Webhook webhook, String owner, int attempt, WebhookSendResult result,
                               long elapsedMs, Instant now) {
        var written = deliveryRepository.markDelivered(delivery.getId(), owner, attempt, result.getStatusCode(), result.getResponseBody(), elapsedMs, now);
        webhookRepository.recordSuccess(webhook.getId(), now);
        if (written == 0) {
            return discarded(delivery);
        }
        log.info("Delivery {} delivered on attempt {} (HTTP {}, {}ms)", delivery.getDeliveryId(), attempt, result.getStatusCode(), elapsedMs);
        metricsConfig.recordDelivery(OUTCOME_DELIVERED);
        return OUTCOME_DELIVERED;
    }

    private String onRetry(WebhookDelivery delivery, Webhook webhook, String owner, int attempt, WebhookSendResult result,
                           long elapsedMs, Instant now) {
        var delay = RetryBackoff.delay(attempt,
                Duration.ofSeconds(properties.getBaseBackoffSeconds()),
                Duration.ofSeconds(properties.getMaxBackoffSeconds()));
        var nextRetryAt = now.plus(delay).truncatedTo(ChronoUnit.MILLIS);
        var written = deliveryRepository.markRetry(delivery.getId(), owner, attempt, nextRetryAt,
                result.getStatusCode(), result.getResponseBody(), elapsedMs, result.getErrorMessage(), now);
        webhookRepository.recordFailure(webhook.getId(), now, result.getErrorMessage());
        if (written == 0) {
            return discarded(delivery);
        }
        log.warn("Delivery {} attempt {}/{} failed, retrying at {}: {}",
                delivery.getDeliveryId(), attempt, delivery.getMaxAttempts(), nextRetryAt, result.getErrorMessage());
        metricsConfig.recordDeliveryRetry(attempt);
        metricsConfig.recordDelivery(OUTCOME_RETRY);
        return OUTCOME_RETRY;
    }

    private String onFailed(WebhookDelivery delivery, Webhook webhook, String owner, int attempt, WebhookSendResult result,
                            long elapsedMs, Instant now) {
        var written = deliveryRepository.markFailed(delivery.getId(), owner, attempt,
                result.getStatusCode(), result.getResponseBody(), elapsedMs, result.getErrorMessage(), now);
        webhookRepository.recordFailure(webhook.getId(), now, result.getErrorMessage());
        if (written == 0) {
            return discarded(delivery);
        }
        log.info("Delivery {} failed after {} attempt(s) [{}]: {}",
                delivery.getDeliveryId(), attempt, result.getErrorKind(), result.getErrorMessage());
        delivery.setAttemptNumber(attempt);
        slackAlertService.sendDeliveryFailedAlert(delivery, result.getErrorMessage());
        metricsConfig.recordDelivery(OUTCOME_FAILED);
        return OUTCOME_FAILED;
    }

    private String discarded(WebhookDelivery delivery) {
        log.info("Delivery {} was cancelled or re-leased while in flight, result discarded", delivery.getDeliveryId());
        metricsConfig.recordDelivery(OUTCOME_DISCARDED);
        return OUTCOME_DISCARDED;
    }
}
