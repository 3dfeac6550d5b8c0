package com.example.automation.service;

import com.example.automation.domain.entity.AutomationRule;
import com.example.automation.domain.repository.AutomationRuleRepository;
import com.example.automation.domain.repository.TaskExecutionRecordRepository;
import com.example.automation.dto.CreateRuleRequest;
import com.example.automation.dto.ExecutionRecordResponse;
import com.example.automation.dto.RuleResponse;
import com.example.automation.exception.ResourceNotFoundException;
import com.example.automation.mapper.AutomationMapper;
import com.example.automation.service.execution.DefinitionCodec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.ArrayList;
import java.util.UUID;

/**
 * Service for managing automation rules.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RuleManagementService {

    private final AutomationRuleRepository ruleRepository;
    private final TaskExecutionRecordRepository recordRepository;
    private final DefinitionCodec definitionCodec;
    private final AutomationMapper mapper;
    private final Clock clock;

    @Transactional
    public RuleResponse createRule(CreateRuleRequest request) {
        definitionCodec.validate(request.getConditions(), request.getActions());

        var rule = AutomationRule.builder()
                .tenantId(request.getTenantId())
                .name(request.getName())
                .description(request.getDescription())
                .triggerEvent(request.getTriggerEvent())
                .conditions(request.getConditions() != null ? new ArrayList<>(request.getConditions()) : new ArrayList<>())
                .actions(new ArrayList<>(request.getActions()))
                .cooldownSeconds(request.getCooldownSeconds() != null ? request.getCooldownSeconds() : 0)
                .maxTriggersPerUser(request.getMaxTriggersPerUser())
                .priority(request.getPriority() != null ? request.getPriority() : 0)
                .createdBy(request.getCreatedBy())
                .build();

        rule = ruleRepository.save(rule);
        log.info("Created rule {} '{}' on {} for tenant {}", rule.getId(), rule.getName(), rule.getTriggerEvent(), rule.getTenantId());
        return mapper.toRuleResponse(rule);
    }

    @Transactional(readOnly = true)
    public RuleResponse getRule(UUID ruleId) {
        return mapper.toRuleResponse(findRule(ruleId));
    }

    @Transactional(readOnly = true)
    public Page<RuleResponse> listRules(String tenantId, Pageable pageable) {
        return ruleRepository.findByTenantId(tenantId, pageable).map(mapper::toRuleResponse);
    }

    @Transactional(readOnly = true)
    public Page<ExecutionRecordResponse> getExecutionHistory(UUID ruleId, Pageable pageable) {
        findRule(ruleId);
        return recordRepository.findByRuleIdOrderByStartTimeDesc(ruleId, pageable).map(mapper::toRecordResponse);
    }

    /**
     * Re-enable a rule and clear its failure streak.
     */
    @Transactional
    public RuleResponse activateRule(UUID ruleId) {
        var rule = findRule(ruleId);
        if (!rule.isActive()) {
            definitionCodec.validate(rule.getConditions(), rule.getActions());
            rule.setActive(true);
            rule.setConsecutiveFailures(0);
            rule.setLastError(null);
            rule = ruleRepository.save(rule);
            log.info("Activated rule {}", ruleId);
        }
        return mapper.toRuleResponse(rule);
    }

    @Transactional
    public RuleResponse deactivateRule(UUID ruleId) {
        findRule(ruleId);
        if (ruleRepository.deactivate(ruleId, clock.instant()) > 0) {
            log.info("Deactivated rule {}", ruleId);
        }
        return mapper.toRuleResponse(findRule(ruleId));
    }

    private AutomationRule findRule(UUID ruleId) {
        return ruleRepository.findById(ruleId).orElseThrow(() -> new ResourceNotFoundException("AutomationRule", ruleId));
    }
}
