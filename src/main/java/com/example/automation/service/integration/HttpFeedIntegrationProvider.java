package com.example.automation.service.integration;

import com.example.automation.domain.entity.Integration;
import com.example.automation.exception.ConfigurationException;
import com.example.automation.exception.ExternalServiceException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Polls a JSON endpoint that returns a list of items.
 * <p>
 * Config keys:
 * - {@code url}: required, absolute http(s) URL
 * - {@code itemsPath}: dotted path to the array in the response, default is the response itself or its {@code items} field
 * - {@code idField}: field holding the item id, default {@code id}
 * - {@code headers}: extra request headers
 * <p>
 * A resolved credential is sent as a bearer token.
 */
@Slf4j
@Component
public class HttpFeedIntegrationProvider implements IntegrationProvider {

    public static final String PROVIDER_KEY = "http_feed";

    private static final String SERVICE_NAME = "Integration Feed";
    private static final Duration FETCH_TIMEOUT = Duration.ofSeconds(30);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final WebClient webClient;
    private final ObjectMapper objectMapper;

    public HttpFeedIntegrationProvider(@Qualifier("integrationWebClient") WebClient webClient, ObjectMapper objectMapper) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public String getProviderKey() {
        return PROVIDER_KEY;
    }

    @Override
    public void validate(Map<String, Object> config) {
        var url = config == null ? null : config.get("url");
        if (!(url instanceof String s) || s.isBlank()) {
            throw new ConfigurationException("http_feed integration requires a 'url'");
        }
        try {
            var uri = URI.create(s);
            if (!"http".equals(uri.getScheme()) && !"https".equals(uri.getScheme())) {
                throw new ConfigurationException("http_feed url must be http or https: " + s);
            }
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("http_feed url is not a valid URI: " + s, e);
        }
        if (config.get("headers") != null && !(config.get("headers") instanceof Map)) {
            throw new ConfigurationException("http_feed 'headers' must be an object");
        }
    }

    @Override
    @CircuitBreaker(name = "integrationFeed")
    public List<ExternalItem> fetch(Integration integration, CredentialHandle credentials) {
        var config = integration.getConfig();
        validate(config);
        var url = (String) config.get("url");

        var body = webClient.get()
                .uri(URI.create(url))
                .headers(headers -> {
                    if (config.get("headers") instanceof Map<?, ?> extra) {
                        extra.forEach((name, value) -> headers.set(String.valueOf(name), String.valueOf(value)));
                    }
                    if (credentials.isPresent()) {
                        headers.setBearerAuth(credentials.getToken());
                    }
                })
                .retrieve()
                .onStatus(HttpStatusCode::isError, clientResponse ->
                        clientResponse.bodyToMono(String.class)
                                .defaultIfEmpty("")
                                .flatMap(errorBody -> Mono.error(
                                        new ExternalServiceException(SERVICE_NAME, clientResponse.statusCode().value(), errorBody))))
                .bodyToMono(JsonNode.class)
                .timeout(FETCH_TIMEOUT)
                .onErrorMap(e -> !(e instanceof ExternalServiceException), e -> new ExternalServiceException(SERVICE_NAME, e.getMessage(), e))
                .block();

        return extractItems(body, stringOr(config.get("itemsPath"), null), stringOr(config.get("idField"), "id"));
    }

    List<ExternalItem> extractItems(JsonNode body, String itemsPath, String idField) {
        var array = locateArray(body, itemsPath);
        var items = new ArrayList<ExternalItem>();
        for (var node : array) {
            var idNode = node.get(idField);
            if (idNode == null || idNode.isNull()) {
                log.debug("Skipping feed item without '{}'", idField);
                continue;
            }
            Map<String, Object> data = node.isObject() ? objectMapper.convertValue(node, MAP_TYPE) : Map.of("value", node.asText());
            items.add(ExternalItem.builder().id(idNode.asText()).data(data).build());
        }
        return items;
    }

    private JsonNode locateArray(JsonNode body, String itemsPath) {
        if (body == null) {
            return objectMapper.createArrayNode();
        }
        var node = body;
        if (itemsPath != null) {
            for (var part : itemsPath.split("\\.")) {
                node = node.path(part);
            }
        } else if (!node.isArray()) {
            node = node.path("items");
        }
        if (!node.isArray()) {
            throw new ExternalServiceException(SERVICE_NAME, "Response has no item array at " + (itemsPath != null ? itemsPath : "items"));
        }
        return node;
    }

    private static String stringOr(Object value, String fallback) {
        return value instanceof String s && !s.isBlank() ? s : fallback;
    }
}
