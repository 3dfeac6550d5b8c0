package com.example.automation.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * WebClient configuration for outbound HTTP.
 * <p>
 * The platform gateway client has a fixed base URL. Webhook deliveries and feed
 * polling target arbitrary tenant URLs and set per-request timeouts on top of
 * the generous connection level ones configured here.
 */
@Configuration
@Slf4j
public class WebClientConfig {

    private static final int MAX_IN_MEMORY_BYTES = 4 * 1024 * 1024;

    @Bean(name = "platformGatewayWebClient")
    public WebClient platformGatewayWebClient(WebClient.Builder builder, PlatformGatewayProperties properties) {
        return createWebClient(builder, properties.getBaseUrl(), properties.getTimeoutSeconds(), "PlatformGateway")
                .mutate()
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    @Bean(name = "webhookWebClient")
    public WebClient webhookWebClient(WebClient.Builder builder) {
        return createWebClient(builder, "", 120, "Webhook");
    }

    @Bean(name = "integrationWebClient")
    public WebClient integrationWebClient(WebClient.Builder builder) {
        return createWebClient(builder, "", 60, "Integration");
    }

    private WebClient createWebClient(WebClient.Builder builder, String baseUrl, int timeoutSeconds, String clientName) {
        var httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, Math.min(timeoutSeconds, 30) * 1000)
                .responseTimeout(Duration.ofSeconds(timeoutSeconds))
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS))
                        .addHandlerLast(new WriteTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS)));

        return builder.clone()
                .baseUrl(baseUrl)
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_BYTES))
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader(HttpHeaders.USER_AGENT, "automation-engine")
                .filter(logRequest(clientName))
                .filter(logResponse(clientName))
                .build();
    }

    private ExchangeFilterFunction logRequest(String clientName) {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            log.debug("[{}] Request: {} {}", clientName, clientRequest.method(), clientRequest.url());
            return Mono.just(clientRequest);
        });
    }

    private ExchangeFilterFunction logResponse(String clientName) {
        return ExchangeFilterFunction.ofResponseProcessor(clientResponse -> {
            if (clientResponse.statusCode().isError()) {
                log.warn("[{}] Error response: {}", clientName, clientResponse.statusCode());
            } else {
                log.debug("[{}] Response status: {}", clientName, clientResponse.statusCode());
            }
            return Mono.just(clientResponse);
        });
    }
}
