package com.example.automation.client;

import com.example.automation.config.PlatformGatewayProperties;
import com.example.automation.domain.model.ExecutionContext;
import com.example.automation.exception.ExternalServiceException;
import com.example.automation.service.execution.ActionDispatcher;
import com.example.automation.service.execution.DispatchResult;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Action dispatcher backed by the chat platform gateway.
 * <p>
 * Uses:
 * - Resilience4j Circuit Breaker so a dead gateway fails fast
 * - WebClient, blocking with a timeout, since actions run on worker threads
 */
@Slf4j
@Component
public class PlatformGatewayClient implements ActionDispatcher {

    private static final String SERVICE_NAME = "Platform Gateway";

    private final WebClient webClient;
    private final PlatformGatewayProperties properties;

    public PlatformGatewayClient(@Qualifier("platformGatewayWebClient") WebClient webClient, PlatformGatewayProperties properties) {
        this.webClient = webClient;
        this.properties = properties;
    }

    /**
     * POST the action to {@code /api/v1/actions/{type}}. The response's {@code id} field,
     * when present, becomes the result detail.
     */
    @Override
    @CircuitBreaker(name = "platformGateway", fallbackMethod = "performFallback")
    public DispatchResult perform(String actionType, Map<String, Object> params, ExecutionContext context) {
        log.debug("Dispatching {} for tenant {}", actionType, context.getTenantId());

        var request = new LinkedHashMap<String, Object>();
        request.put("tenantId", context.getTenantId());
        request.put("userId", context.getUserId());
        request.put("channelId", context.getChannelId());
        request.put("params", params);

        var response = webClient.post()
                .uri("/api/v1/actions/{actionType}", actionType)
                .bodyValue(request)
                .retrieve()
                .onStatus(HttpStatusCode::isError, clientResponse ->
                        clientResponse.bodyToMono(String.class)
                                .defaultIfEmpty("")
                                .flatMap(body -> Mono.error(
                                        new ExternalServiceException(SERVICE_NAME, clientResponse.statusCode().value(), body))))
                .bodyToMono(Map.class)
                .timeout(Duration.ofSeconds(properties.getTimeoutSeconds()))
                .onErrorMap(e -> !(e instanceof ExternalServiceException), e -> new ExternalServiceException(SERVICE_NAME, e.getMessage(), e))
                .block();

        var detail = response != null && response.get("id") != null ? String.valueOf(response.get("id")) : null;
        return DispatchResult.success(detail);
    }

    /**
     * Failures are returned as values so the execution engine can classify them.
     */
    @SuppressWarnings("unused")
    private DispatchResult performFallback(String actionType, Map<String, Object> params, ExecutionContext context, Throwable e) {
        if (e instanceof CallNotPermittedException) {
            log.warn("Circuit breaker open for {}, action {} not dispatched", SERVICE_NAME, actionType);
            return DispatchResult.transientFailure(SERVICE_NAME + " temporarily unavailable (circuit breaker open)");
        }
        if (e instanceof ExternalServiceException external) {
            log.warn("Action {} failed at {}: {}", actionType, SERVICE_NAME, external.getMessage());
            return external.getHttpStatusCode() != null
                    ? DispatchResult.httpFailure(external.getHttpStatusCode(), external.getMessage())
                    : DispatchResult.transientFailure(external.getMessage());
        }
        log.error("Unexpected error dispatching {}: {}", actionType, e.getMessage(), e);
        return DispatchResult.transientFailure(e.getClass().getSimpleName() + ": " + e.getMessage());
    }
}
