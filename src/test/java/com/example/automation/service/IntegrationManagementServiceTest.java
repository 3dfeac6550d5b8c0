package com.example.automation.service;

import com.example.automation.domain.entity.Integration;
import com.example.automation.domain.repository.IntegrationRepository;
import com.example.automation.dto.CreateIntegrationRequest;
import com.example.automation.exception.ConfigurationException;
import com.example.automation.exception.InvalidStateException;
import com.example.automation.mapper.AutomationMapper;
import com.example.automation.service.integration.IntegrationProvider;
import com.example.automation.service.integration.IntegrationProviderRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("IntegrationManagementService Tests")
class IntegrationManagementServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-04T10:15:30Z");

    @Mock
    private IntegrationRepository integrationRepository;

    @Mock
    private IntegrationProviderRegistry providerRegistry;

    @Mock
    private IntegrationProvider provider;

    @Mock
    private AutomationMapper mapper;

    @Captor
    private ArgumentCaptor<Integration> integrationCaptor;

    private IntegrationManagementService integrationManagementService;
    private UUID testIntegrationId;

    @BeforeEach
    void setUp() {
        integrationManagementService = new IntegrationManagementService(integrationRepository, providerRegistry, mapper,
                Clock.fixed(NOW, ZoneOffset.UTC));
        testIntegrationId = UUID.randomUUID();
        lenient().when(integrationRepository.save(any(Integration.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @Nested
    @DisplayName("createIntegration Tests")
    class CreateIntegrationTests {

        @Test
        @DisplayName("Should create an integration that is due immediately")
        void shouldCreateIntegration() {
            // Given
            var request = CreateIntegrationRequest.builder()
                    .tenantId("guild-1")
                    .name("Releases")
                    .provider("http_feed")
                    .config(Map.of("url", "https://example.org/releases.json"))
                    .credentialsRef("github-acme")
                    .build();
            when(providerRegistry.getProviderOrThrow("http_feed")).thenReturn(provider);

            // When
            integrationManagementService.createIntegration(request);

            // Then
            verify(provider).validate(Map.of("url", "https://example.org/releases.json"));
            verify(integrationRepository).save(integrationCaptor.capture());
            var saved = integrationCaptor.getValue();
            assertThat(saved.getNextSync()).isEqualTo(NOW);
            assertThat(saved.getSyncFrequencySeconds()).isEqualTo(300);
            assertThat(saved.getCredentialsRef()).isEqualTo("github-acme");
        }

        @Test
        @DisplayName("Should reject an unknown provider")
        void shouldRejectUnknownProvider() {
            var request = CreateIntegrationRequest.builder().tenantId("guild-1").name("X").provider("ftp").build();
            when(providerRegistry.getProviderOrThrow("ftp")).thenThrow(new ConfigurationException("No integration provider registered for: ftp"));

            assertThatThrownBy(() -> integrationManagementService.createIntegration(request))
                    .isInstanceOf(ConfigurationException.class);
            verify(integrationRepository, never()).save(any());
        }
    }

    @Nested
    @DisplayName("Status Tests")
    class StatusTests {

        @Test
        @DisplayName("Should clear the error streak and make the integration due on activate")
        void shouldActivate() {
            // Given
            var integration = Integration.builder()
                    .id(testIntegrationId)
                    .provider("http_feed")
                    .active(false)
                    .errorCount(5)
                    .lastError("503 Service Unavailable")
                    .build();
            when(integrationRepository.findById(testIntegrationId)).thenReturn(Optional.of(integration));
            when(providerRegistry.getProviderOrThrow("http_feed")).thenReturn(provider);

            // When
            integrationManagementService.activateIntegration(testIntegrationId);

            // Then
            assertThat(integration.isActive()).isTrue();
            assertThat(integration.getErrorCount()).isZero();
            assertThat(integration.getLastError()).isNull();
            assertThat(integration.getNextSync()).isEqualTo(NOW);
        }

        @Test
        @DisplayName("Should clear next sync on deactivate")
        void shouldDeactivate() {
            var integration = Integration.builder().id(testIntegrationId).nextSync(NOW.plusSeconds(60)).build();
            when(integrationRepository.findById(testIntegrationId)).thenReturn(Optional.of(integration));

            integrationManagementService.deactivateIntegration(testIntegrationId);

            assertThat(integration.isActive()).isFalse();
            assertThat(integration.getNextSync()).isNull();
        }

        @Test
        @DisplayName("Should refuse a sync request for an inactive integration")
        void shouldRefuseSyncOfInactive() {
            var integration = Integration.builder().id(testIntegrationId).active(false).build();
            when(integrationRepository.findById(testIntegrationId)).thenReturn(Optional.of(integration));

            assertThatThrownBy(() -> integrationManagementService.requestSync(testIntegrationId))
                    .isInstanceOf(InvalidStateException.class);
        }
    }
}
