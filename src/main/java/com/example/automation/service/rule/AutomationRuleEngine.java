package com.example.automation.service.rule;

import com.example.automation.config.InstanceIdentity;
import com.example.automation.config.MetricsConfig;
import com.example.automation.config.RuleEngineProperties;
import com.example.automation.domain.entity.AutomationRule;
import com.example.automation.domain.entity.TaskExecutionRecord;
import com.example.automation.domain.enums.ExecutionStatus;
import com.example.automation.domain.enums.ExecutionType;
import com.example.automation.domain.enums.TriggerType;
import com.example.automation.domain.model.ExecutionContext;
import com.example.automation.domain.model.PlatformEvent;
import com.example.automation.domain.repository.AutomationRuleRepository;
import com.example.automation.domain.repository.ScheduledTaskRepository;
import com.example.automation.domain.repository.TaskExecutionRecordRepository;
import com.example.automation.exception.ConfigurationException;
import com.example.automation.service.alert.SlackAlertService;
import com.example.automation.service.execution.ExecutionEngine;
import com.example.automation.service.executor.TaskExecutorService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Matches platform events against automation rules and runs the matching ones.
 * <p>
 * Rules for the event are taken highest priority first (id breaks ties). For each rule
 * the condition list must fully hold, the acting user must be under the rule's trigger
 * cap and outside its cooldown. Cap and cooldown are read from the rule's own execution
 * history. A rule whose actions include stop_processing ends the walk for lower rules.
 * <p>
 * Two events for the same user handled at the same moment on different workers may both
 * pass the cooldown check; nothing serialises them.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AutomationRuleEngine {

    /**
     * Statuses that count as "the rule fired" for cooldown and cap purposes
     */
    static final Set<ExecutionStatus> FIRED_STATUSES = EnumSet.of(ExecutionStatus.RUNNING, ExecutionStatus.COMPLETED, ExecutionStatus.FAILED);

    private final AutomationRuleRepository ruleRepository;
    private final TaskExecutionRecordRepository recordRepository;
    private final ScheduledTaskRepository taskRepository;
    private final ExecutionEngine executionEngine;
    private final TaskExecutorService taskExecutorService;
    private final SlackAlertService slackAlertService;
    private final MetricsConfig metricsConfig;
    private final RuleEngineProperties properties;
    private final InstanceIdentity instanceIdentity;
    private final Clock clock;

    /**
     * Run every matching rule, then every event-triggered task listening for this event.
     *
     * @return ids of the rules whose actions ran, in the order they ran
     */
    public List<UUID> handleEvent(PlatformEvent event) {
        log.debug("Handling event {} for tenant {} (user {})", event.getEventName(), event.getTenantId(), event.getUserId());
        var fired = new ArrayList<UUID>();

        var rules = ruleRepository.findActiveRulesForEvent(event.getTenantId(), event.getEventName());
        for (var rule : rules) {
            try {
                var outcome = evaluateRule(rule, event);
                if (outcome == RuleOutcome.SKIPPED) {
                    continue;
                }
                fired.add(rule.getId());
                if (outcome == RuleOutcome.RAN_AND_STOPPED) {
                    log.info("Rule {} stopped processing of {} for lower priority rules", rule.getId(), event.getEventName());
                    break;
                }
            } catch (Exception e) {
                log.error("Unexpected error evaluating rule {} for event {}: {}", rule.getId(), event.getEventName(), e.getMessage(), e);
            }
        }

        fireEventTasks(event);
        return fired;
    }

    RuleOutcome evaluateRule(AutomationRule rule, PlatformEvent event) {
        var now = clock.instant();
        var context = ExecutionContext.forEvent(event, "rule", rule.getName(), now);

        try {
            if (!executionEngine.conditionsHold(rule.getConditions(), context)) {
                log.debug("Conditions of rule {} not met for {}", rule.getId(), event.getEventName());
                metricsConfig.recordRuleSkipped("conditions");
                return RuleOutcome.SKIPPED;
            }
        } catch (ConfigurationException e) {
            recordConfigurationError(rule, event, now, e.getMessage());
            return RuleOutcome.SKIPPED;
        }

        if (overTriggerCap(rule, event.getUserId())) {
            log.debug("User {} reached the trigger cap of rule {}", event.getUserId(), rule.getId());
            metricsConfig.recordRuleSkipped("cap");
            return RuleOutcome.SKIPPED;
        }
        if (inCooldown(rule, event.getUserId(), now)) {
            log.debug("Rule {} is cooling down for user {}", rule.getId(), event.getUserId());
            metricsConfig.recordRuleSkipped("cooldown");
            return RuleOutcome.SKIPPED;
        }

        return runRule(rule, event, context);
    }

    private RuleOutcome runRule(AutomationRule rule, PlatformEvent event, ExecutionContext context) {
        var timerSample = metricsConfig.startTimer();
        var record = recordRepository.save(newRecord(rule, event, context.getNow()));

        var result = executionEngine.execute(rule.getActions(), context);
        record.setActionResults(result.getActionResults());
        var end = clock.instant();

        if (result.isSuccess()) {
            record.close(ExecutionStatus.COMPLETED, end, null);
            recordRepository.save(record);
            ruleRepository.recordSuccess(rule.getId(), record.getStartTime(), end);
            log.info("Rule {} ran for event {} (user {})", rule.getId(), event.getEventName(), event.getUserId());
            metricsConfig.recordRuleExecution(timerSample, "completed");
        } else if (result.isConfigurationError()) {
            record.setNotes(TaskExecutionRecord.NOTE_CONFIGURATION_ERROR);
            record.close(ExecutionStatus.FAILED, end, result.getErrorMessage());
            recordRepository.save(record);
            ruleRepository.recordConfigurationError(rule.getId(), record.getStartTime(), result.getErrorMessage(), end);
            log.warn("Rule {} has a configuration error, left active: {}", rule.getId(), result.getErrorMessage());
            metricsConfig.recordRuleExecution(timerSample, "configuration_error");
        } else {
            record.close(ExecutionStatus.FAILED, end, result.getErrorMessage());
            recordRepository.save(record);
            ruleRepository.recordFailure(rule.getId(), record.getStartTime(), result.getErrorMessage(), end);
            log.warn("Rule {} failed [{}]: {}", rule.getId(), result.getErrorKind(), result.getErrorMessage());
            metricsConfig.recordRuleExecution(timerSample, "failed");
            checkFailureThreshold(rule, event);
        }

        return result.isStopProcessing() ? RuleOutcome.RAN_AND_STOPPED : RuleOutcome.RAN;
    }

    private boolean overTriggerCap(AutomationRule rule, String userId) {
        if (rule.getMaxTriggersPerUser() == null || userId == null) {
            return false;
        }
        var count = recordRepository.countByRuleIdAndTriggerUserIdAndStatusIn(rule.getId(), userId, FIRED_STATUSES);
        return count >= rule.getMaxTriggersPerUser();
    }

    private boolean inCooldown(AutomationRule rule, String userId, Instant now) {
        if (rule.getCooldownSeconds() <= 0) {
            return false;
        }
        return recordRepository.findFirstByRuleIdAndTriggerUserIdAndStatusInOrderByStartTimeDesc(rule.getId(), userId, FIRED_STATUSES)
                .map(last -> last.getStartTime().plusSeconds(rule.getCooldownSeconds()).isAfter(now))
                .orElse(false);
    }

    private void recordConfigurationError(AutomationRule rule, PlatformEvent event, Instant now, String error) {
        log.warn("Conditions of rule {} cannot be evaluated, left active: {}", rule.getId(), error);
        var record = newRecord(rule, event, now);
        // the rule never ran for this user, so the record must not count toward cooldown or cap
        record.setTriggerUserId(null);
        record.setNotes(TaskExecutionRecord.NOTE_CONFIGURATION_ERROR);
        record.close(ExecutionStatus.FAILED, now, error);
        recordRepository.save(record);
        ruleRepository.recordConfigurationError(rule.getId(), now, error, now);
        metricsConfig.recordRuleSkipped("configuration_error");
    }

    private void checkFailureThreshold(AutomationRule rule, PlatformEvent event) {
        var fresh = ruleRepository.findById(rule.getId()).orElse(null);
        if (fresh == null || !fresh.isActive() || fresh.getConsecutiveFailures() < properties.getMaxConsecutiveFailures()) {
            return;
        }

        var now = clock.instant();
        if (ruleRepository.deactivate(fresh.getId(), now) == 0) {
            return;
        }

        log.error("Rule {} disabled after {} consecutive failures", fresh.getId(), fresh.getConsecutiveFailures());
        var record = newRecord(fresh, event, now);
        record.setTriggerUserId(null);
        record.setNotes(TaskExecutionRecord.NOTE_AUTO_DISABLED);
        record.close(ExecutionStatus.CANCELLED, now, fresh.getLastError());
        recordRepository.save(record);

        metricsConfig.recordAutoDisabled("rule");
        slackAlertService.sendRuleDisabledAlert(fresh, fresh.getConsecutiveFailures(), fresh.getLastError());
    }

    private void fireEventTasks(PlatformEvent event) {
        var tasks = taskRepository.findActiveEventTasks(event.getTenantId(), TriggerType.EVENT, event.getEventName());
        for (var task : tasks) {
            try {
                taskExecutorService.executeForEvent(task, event);
            } catch (Exception e) {
                log.error("Error firing task {} for event {}: {}", task.getId(), event.getEventName(), e.getMessage(), e);
            }
        }
    }

    private TaskExecutionRecord newRecord(AutomationRule rule, PlatformEvent event, Instant start) {
        return TaskExecutionRecord.builder()
                .ruleId(rule.getId())
                .tenantId(rule.getTenantId())
                .executionType(ExecutionType.AUTOMATION_RULE)
                .triggerSource(event.getEventName())
                .triggerUserId(event.getUserId())
                .status(ExecutionStatus.RUNNING)
                .startTime(start)
                .executorInstance(instanceIdentity.getInstanceId())
                .build();
    }

    enum RuleOutcome {
        SKIPPED,
        RAN,
        RAN_AND_STOPPED
    }
}
