package com.example.automation.service.webhook;

import com.example.automation.config.WebhookProperties;
import com.example.automation.domain.entity.WebhookDelivery;
import com.example.automation.domain.enums.ErrorKind;
import com.example.automation.exception.ExternalServiceException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Performs the HTTP call for a delivery attempt.
 * <p>
 * Non-2xx responses and transport errors are raised as {@link ExternalServiceException}
 * inside the guarded call so the circuit breaker sees them, then turned back into a
 * {@link WebhookSendResult} by the fallback. Callers never see an exception.
 */
@Slf4j
@Component
public class WebhookSender {

    public static final String EVENT_HEADER = "X-Webhook-Event";
    public static final String DELIVERY_HEADER = "X-Webhook-Delivery";
    public static final String ATTEMPT_HEADER = "X-Webhook-Attempt";

    private static final String SERVICE_NAME = "Webhook";

    private final WebClient webClient;
    private final WebhookProperties properties;

    public WebhookSender(@Qualifier("webhookWebClient") WebClient webClient, WebhookProperties properties) {
        this.webClient = webClient;
        this.properties = properties;
    }

    /**
     * @param attempt   1-based number of this attempt
     * @param secret    signing secret, or null to send unsigned
     * @param timeout   per-request timeout
     */
    @CircuitBreaker(name = "webhookDelivery", fallbackMethod = "sendFallback")
    public WebhookSendResult send(WebhookDelivery delivery, int attempt, String secret, Duration timeout) {
        log.debug("Sending delivery {} attempt {} to {}", delivery.getDeliveryId(), attempt, delivery.getTargetUrl());

        var response = webClient.method(HttpMethod.valueOf(delivery.getHttpMethod()))
                .uri(delivery.getTargetUrl())
                .contentType(MediaType.APPLICATION_JSON)
                .headers(headers -> {
                    if (delivery.getHeaders() != null) {
                        delivery.getHeaders().forEach(headers::set);
                    }
                    headers.set(EVENT_HEADER, delivery.getEventType());
                    headers.set(DELIVERY_HEADER, delivery.getDeliveryId());
                    headers.set(ATTEMPT_HEADER, String.valueOf(attempt));
                    if (secret != null && !secret.isBlank()) {
                        headers.set(properties.getSignatureHeader(), WebhookSignatures.sign(secret, delivery.getPayload()));
                    }
                })
                .bodyValue(delivery.getPayload())
                .exchangeToMono(clientResponse -> clientResponse.toEntity(String.class))
                .timeout(timeout)
                .onErrorMap(TimeoutException.class, e -> new ExternalServiceException(SERVICE_NAME, "Timed out after " + timeout.toSeconds() + "s", e))
                .onErrorMap(e -> !(e instanceof ExternalServiceException), e -> new ExternalServiceException(SERVICE_NAME, e.getClass().getSimpleName() + ": " + e.getMessage(), e))
                .switchIfEmpty(Mono.error(new ExternalServiceException(SERVICE_NAME, "Empty response")))
                .block();

        var status = response.getStatusCode().value();
        var body = truncate(response.getBody());
        if (response.getStatusCode().is2xxSuccessful()) {
            return WebhookSendResult.delivered(status, body);
        }
        throw new ExternalServiceException(SERVICE_NAME, status, body);
    }

    @SuppressWarnings("unused")
    private WebhookSendResult sendFallback(WebhookDelivery delivery, int attempt, String secret, Duration timeout, Throwable e) {
        if (e instanceof CallNotPermittedException) {
            log.warn("Circuit breaker open for webhook deliveries, delivery {} not attempted", delivery.getDeliveryId());
            return WebhookSendResult.circuitOpen("Circuit breaker open");
        }
        if (e instanceof ExternalServiceException external) {
            return WebhookSendResult.failed(external.getHttpStatusCode(), truncate(external.getResponseBody()),
                    external.getMessage(), external.getErrorKind());
        }
        log.error("Unexpected error sending delivery {}: {}", delivery.getDeliveryId(), e.getMessage(), e);
        return WebhookSendResult.failed(null, null, e.getClass().getSimpleName() + ": " + e.getMessage(), ErrorKind.TRANSIENT);
    }

    private String truncate(String body) {
        if (body == null) {
            return null;
        }
        var max = properties.getResponseBodyMaxChars();
        return body.length() <= max ? body : body.substring(0, max);
    }
}
