package com.example.automation.service;

import com.example.automation.domain.entity.AutomationRule;
import com.example.automation.domain.repository.AutomationRuleRepository;
import com.example.automation.domain.repository.TaskExecutionRecordRepository;
import com.example.automation.dto.CreateRuleRequest;
import com.example.automation.dto.RuleResponse;
import com.example.automation.exception.ConfigurationException;
import com.example.automation.exception.ResourceNotFoundException;
import com.example.automation.mapper.AutomationMapper;
import com.example.automation.service.execution.DefinitionCodec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageRequest;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("RuleManagementService Tests")
class RuleManagementServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-04T10:15:30Z");

    @Mock
    private AutomationRuleRepository ruleRepository;

    @Mock
    private TaskExecutionRecordRepository recordRepository;

    @Mock
    private AutomationMapper mapper;

    @Captor
    private ArgumentCaptor<AutomationRule> ruleCaptor;

    private RuleManagementService ruleManagementService;
    private UUID testRuleId;

    @BeforeEach
    void setUp() {
        ruleManagementService = new RuleManagementService(ruleRepository, recordRepository, new DefinitionCodec(), mapper,
                Clock.fixed(NOW, ZoneOffset.UTC));
        testRuleId = UUID.randomUUID();

        lenient().when(mapper.toRuleResponse(any(AutomationRule.class))).thenAnswer(inv -> {
            AutomationRule rule = inv.getArgument(0);
            return RuleResponse.builder()
                    .id(rule.getId())
                    .active(rule.isActive())
                    .consecutiveFailures(rule.getConsecutiveFailures())
                    .build();
        });
    }

    @Nested
    @DisplayName("createRule Tests")
    class CreateRuleTests {

        @Test
        @DisplayName("Should create a rule with defaults for optional fields")
        void shouldCreateRule() {
            // Given
            var request = CreateRuleRequest.builder()
                    .tenantId("guild-1")
                    .name("Welcome")
                    .triggerEvent("member_join")
                    .actions(List.of(Map.of("type", "send_dm", "params", Map.of("template", "Welcome {user}"))))
                    .build();
            when(ruleRepository.save(any(AutomationRule.class))).thenAnswer(inv -> {
                AutomationRule rule = inv.getArgument(0);
                rule.setId(testRuleId);
                return rule;
            });

            // When
            var response = ruleManagementService.createRule(request);

            // Then
            verify(ruleRepository).save(ruleCaptor.capture());
            var saved = ruleCaptor.getValue();
            assertThat(saved.getCooldownSeconds()).isZero();
            assertThat(saved.getPriority()).isZero();
            assertThat(saved.getConditions()).isEmpty();
            assertThat(saved.isActive()).isTrue();
            assertThat(response.getId()).isEqualTo(testRuleId);
        }

        @Test
        @DisplayName("Should reject an action that misses a required parameter")
        void shouldRejectMissingParameter() {
            var request = CreateRuleRequest.builder()
                    .tenantId("guild-1")
                    .name("Promote")
                    .triggerEvent("member_join")
                    .actions(List.of(Map.of("type", "add_role")))
                    .build();

            assertThatThrownBy(() -> ruleManagementService.createRule(request))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("roleId");
            verify(ruleRepository, never()).save(any());
        }
    }

    @Nested
    @DisplayName("Status Tests")
    class StatusTests {

        @Test
        @DisplayName("Should reset the failure streak on activate")
        void shouldActivateRule() {
            // Given
            var rule = AutomationRule.builder()
                    .id(testRuleId)
                    .active(false)
                    .consecutiveFailures(3)
                    .lastError("Action #1 (add_role): Missing permissions")
                    .actions(List.of(Map.of("type", "add_role", "params", Map.of("roleId", "r-1"))))
                    .build();
            when(ruleRepository.findById(testRuleId)).thenReturn(Optional.of(rule));
            when(ruleRepository.save(rule)).thenReturn(rule);

            // When
            var response = ruleManagementService.activateRule(testRuleId);

            // Then
            assertThat(response.isActive()).isTrue();
            assertThat(response.getConsecutiveFailures()).isZero();
            assertThat(rule.getLastError()).isNull();
        }

        @Test
        @DisplayName("Should leave an active rule untouched")
        void shouldNotSaveActiveRule() {
            var rule = AutomationRule.builder().id(testRuleId).active(true).build();
            when(ruleRepository.findById(testRuleId)).thenReturn(Optional.of(rule));

            ruleManagementService.activateRule(testRuleId);

            verify(ruleRepository, never()).save(any());
        }

        @Test
        @DisplayName("Should deactivate through the conditional update")
        void shouldDeactivateRule() {
            var rule = AutomationRule.builder().id(testRuleId).active(true).build();
            when(ruleRepository.findById(testRuleId)).thenReturn(Optional.of(rule));
            when(ruleRepository.deactivate(testRuleId, NOW)).thenReturn(1);

            ruleManagementService.deactivateRule(testRuleId);

            verify(ruleRepository).deactivate(testRuleId, NOW);
        }

        @Test
        @DisplayName("Should throw when history is requested for an unknown rule")
        void shouldThrowForUnknownRule() {
            when(ruleRepository.findById(testRuleId)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> ruleManagementService.getExecutionHistory(testRuleId, PageRequest.of(0, 20)))
                    .isInstanceOf(ResourceNotFoundException.class);
            verifyNoInteractions(recordRepository);
        }
    }
}
