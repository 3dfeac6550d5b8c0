package com.example.automation.service.integration;

import com.example.automation.domain.entity.Integration;
import com.example.automation.domain.enums.ErrorKind;
import com.example.automation.exception.ConfigurationException;
import com.example.automation.exception.ExternalServiceException;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.io.IOException;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("HttpFeedIntegrationProvider Tests")
class HttpFeedIntegrationProviderTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final HttpFeedIntegrationProvider provider = new HttpFeedIntegrationProvider(WebClient.create(), objectMapper);

    @Nested
    @DisplayName("extractItems Tests")
    class ExtractItemsTests {

        @Test
        @DisplayName("Should read a top level array")
        void shouldReadRootArray() throws IOException {
            var body = objectMapper.readTree("[{\"id\": 1, \"title\": \"a\"}, {\"id\": 2, \"title\": \"b\"}]");

            var items = provider.extractItems(body, null, "id");

            assertThat(items).extracting(ExternalItem::getId).containsExactly("1", "2");
            assertThat(items.get(0).getData()).containsEntry("title", "a");
        }

        @Test
        @DisplayName("Should default to the items field and skip entries without an id")
        void shouldReadItemsField() throws IOException {
            var body = objectMapper.readTree("{\"items\": [{\"id\": \"x\"}, {\"name\": \"no id\"}]}");

            assertThat(provider.extractItems(body, null, "id")).extracting(ExternalItem::getId).containsExactly("x");
        }

        @Test
        @DisplayName("Should follow a dotted items path and a custom id field")
        void shouldFollowItemsPath() throws IOException {
            var body = objectMapper.readTree("{\"data\": {\"releases\": [{\"tag\": \"v1\"}]}}");

            assertThat(provider.extractItems(body, "data.releases", "tag")).extracting(ExternalItem::getId).containsExactly("v1");
        }

        @Test
        @DisplayName("Should fail when the path does not hold an array")
        void shouldRejectMissingArray() throws IOException {
            var body = objectMapper.readTree("{\"data\": {}}");

            assertThatThrownBy(() -> provider.extractItems(body, "data.releases", "id"))
                    .isInstanceOf(ExternalServiceException.class);
        }
    }

    @Nested
    @DisplayName("validate Tests")
    class ValidateTests {

        @Test
        @DisplayName("Should require an http url")
        void shouldRequireHttpUrl() {
            assertThatThrownBy(() -> provider.validate(Map.of())).isInstanceOf(ConfigurationException.class);
            assertThatThrownBy(() -> provider.validate(Map.of("url", "ftp://example.com"))).isInstanceOf(ConfigurationException.class);
            assertThatThrownBy(() -> provider.validate(Map.of("url", "https://example.com", "headers", "x")))
                    .isInstanceOf(ConfigurationException.class);
        }
    }

    @Nested
    @DisplayName("fetch Tests")
    class FetchTests {

        private MockWebServer server;

        @BeforeEach
        void startServer() throws IOException {
            server = new MockWebServer();
            server.start();
        }

        @AfterEach
        void stopServer() throws IOException {
            server.shutdown();
        }

        private Integration integration() {
            return Integration.builder()
                    .id(UUID.randomUUID())
                    .tenantId("guild-1")
                    .provider(HttpFeedIntegrationProvider.PROVIDER_KEY)
                    .config(Map.of("url", server.url("/feed").toString(), "headers", Map.of("X-Client", "automation")))
                    .build();
        }

        @Test
        @DisplayName("Should send the bearer token and extra headers")
        void shouldFetchWithCredentials() throws InterruptedException {
            // Given
            server.enqueue(new MockResponse().setHeader("Content-Type", "application/json").setBody("{\"items\": [{\"id\": \"r1\"}]}"));

            // When
            var items = provider.fetch(integration(), CredentialHandle.of("tok"));

            // Then
            assertThat(items).extracting(ExternalItem::getId).containsExactly("r1");
            var request = server.takeRequest();
            assertThat(request.getHeader("Authorization")).isEqualTo("Bearer tok");
            assertThat(request.getHeader("X-Client")).isEqualTo("automation");
        }

        @Test
        @DisplayName("Should raise the response status as an external service error")
        void shouldRaiseOnErrorStatus() {
            server.enqueue(new MockResponse().setResponseCode(401).setBody("unauthorized"));

            assertThatThrownBy(() -> provider.fetch(integration(), CredentialHandle.none()))
                    .isInstanceOfSatisfying(ExternalServiceException.class, e -> {
                        assertThat(e.getHttpStatusCode()).isEqualTo(401);
                        assertThat(e.getErrorKind()).isEqualTo(ErrorKind.PERMANENT);
                    });
        }
    }
}
