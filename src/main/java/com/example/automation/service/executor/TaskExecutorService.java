package com.example.automation.service.executor;

import com.example.automation.config.InstanceIdentity;
import com.example.automation.config.MetricsConfig;
import com.example.automation.config.SchedulerProperties;
import com.example.automation.domain.entity.RecurringSchedulePattern;
import com.example.automation.domain.entity.ScheduledTask;
import com.example.automation.domain.entity.TaskExecutionRecord;
import com.example.automation.domain.enums.ExecutionStatus;
import com.example.automation.domain.enums.ExecutionType;
import com.example.automation.domain.enums.TriggerType;
import com.example.automation.domain.model.ExecutionContext;
import com.example.automation.domain.model.PlatformEvent;
import com.example.automation.domain.repository.RecurringSchedulePatternRepository;
import com.example.automation.domain.repository.ScheduledTaskRepository;
import com.example.automation.domain.repository.TaskExecutionRecordRepository;
import com.example.automation.exception.ConfigurationException;
import com.example.automation.service.alert.SlackAlertService;
import com.example.automation.service.execution.ExecutionEngine;
import com.example.automation.service.trigger.TriggerEvaluator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Claims and runs individual scheduled tasks.
 * <p>
 * Handles:
 * - Leasing a due instant, a manual run request or an event fire
 * - Condition evaluation and action execution
 * - Execution records and task counters
 * - Self-disable after repeated failures, with alert and metrics
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TaskExecutorService {

    static final String SOURCE_SCHEDULE = "schedule";
    static final String SOURCE_MANUAL = "manual";
    private static final int EVENT_CLAIM_ATTEMPTS = 3;

    private final ScheduledTaskRepository taskRepository;
    private final RecurringSchedulePatternRepository patternRepository;
    private final TaskExecutionRecordRepository recordRepository;
    private final TriggerEvaluator triggerEvaluator;
    private final ExecutionEngine executionEngine;
    private final SlackAlertService slackAlertService;
    private final MetricsConfig metricsConfig;
    private final SchedulerProperties properties;
    private final InstanceIdentity instanceIdentity;
    private final Clock clock;

    /**
     * Lease the task's current next_execution and, if this worker wins, run it.
     *
     * @param task the task as read by the poller; its nextExecution is the precondition
     * @return true if this worker ran the task
     */
    public boolean executeDue(ScheduledTask task) {
        var now = clock.instant();
        var fired = task.getNextExecution();
        if (fired == null) {
            return false;
        }
        if (task.isExhausted()) {
            deactivateIfExhausted(task);
            return false;
        }

        Instant newNext;
        try {
            newNext = triggerEvaluator.computeNextAfterFire(task, patternsFor(task), fired, now);
        } catch (ConfigurationException e) {
            handleInvalidTrigger(task, fired, now, e);
            return false;
        }

        if (taskRepository.claimDueExecution(task.getId(), fired, newNext, newNext != null, now) == 0) {
            log.debug("Due instant {} of task {} claimed by another worker, skipping", fired, task.getId());
            return false;
        }
        if (newNext == null) {
            log.info("Task {} fires for the last time at {}", task.getId(), fired);
        }

        var context = ExecutionContext.forSchedule(task.getTenantId(), task.getTargetChannelId(), task.getName(), SOURCE_SCHEDULE, now);
        run(task, context, SOURCE_SCHEDULE, null, fired);
        if (newNext != null) {
            // the snapshot may predate a manual or concurrent fire that used a slot
            deactivateIfExhausted(task);
        }
        return true;
    }

    /**
     * Run a task whose owner asked for an immediate run. The schedule is not advanced.
     */
    public boolean executeManual(ScheduledTask task) {
        var now = clock.instant();
        if (task.isExhausted()) {
            deactivateIfExhausted(task);
            return false;
        }
        if (taskRepository.claimManualRun(task.getId(), task.getManualRunRequestedAt(), now) == 0) {
            log.debug("Manual run of task {} claimed by another worker, skipping", task.getId());
            return false;
        }

        log.info("Running task {} on manual request", task.getId());
        var context = ExecutionContext.forSchedule(task.getTenantId(), task.getTargetChannelId(), task.getName(), SOURCE_MANUAL, now);
        run(task, context, SOURCE_MANUAL, null, null);
        deactivateIfExhausted(task);
        return true;
    }

    /**
     * Fire an event-triggered task for one event. The execution count slot is taken
     * by a conditional increment, which also enforces max_executions.
     */
    public boolean executeForEvent(ScheduledTask task, PlatformEvent event) {
        var now = clock.instant();
        var current = task;
        for (var attempt = 0; attempt < EVENT_CLAIM_ATTEMPTS; attempt++) {
            if (!current.isActive() || current.isExhausted()) {
                return false;
            }
            if (taskRepository.claimEventFire(current.getId(), current.getExecutionCount(), now) == 1) {
                var context = ExecutionContext.forEvent(event, "task", current.getName(), now);
                run(current, context, event.getEventName(), event.getUserId(), null);
                deactivateIfExhausted(current);
                return true;
            }
            // another fire of the same task moved the count; re-read and try the next slot
            current = taskRepository.findById(task.getId()).orElse(null);
            if (current == null) {
                return false;
            }
        }
        log.warn("Could not claim an event fire of task {} after {} attempts", task.getId(), EVENT_CLAIM_ATTEMPTS);
        return false;
    }

    /**
     * Run conditions and actions for an already claimed fire. The claim has taken the
     * execution count slot, so nothing here touches the count.
     */
    void run(ScheduledTask task, ExecutionContext context, String triggerSource, String userId, Instant scheduledFor) {
        var timerSample = metricsConfig.startTimer();
        var startTime = clock.instant();
        var record = recordRepository.save(TaskExecutionRecord.builder()
                .taskId(task.getId())
                .tenantId(task.getTenantId())
                .executionType(ExecutionType.SCHEDULED_TASK)
                .triggerSource(triggerSource)
                .triggerUserId(userId)
                .scheduledFor(scheduledFor)
                .status(ExecutionStatus.RUNNING)
                .startTime(startTime)
                .executorInstance(instanceIdentity.getInstanceId())
                .build());

        String outcome;
        try {
            outcome = runClaimed(task, context, record);
        } catch (Exception e) {
            log.error("Unexpected error executing task {}: {}", task.getId(), e.getMessage(), e);
            var error = e.getClass().getSimpleName() + ": " + e.getMessage();
            if (!record.isClosed()) {
                record.close(ExecutionStatus.FAILED, clock.instant(), error);
                recordRepository.save(record);
            }
            taskRepository.recordFailure(task.getId(), startTime, error, clock.instant());
            checkFailureThreshold(task);
            outcome = "error";
        }
        metricsConfig.recordTaskExecution(timerSample, task.getTriggerType(), outcome);
    }

    private String runClaimed(ScheduledTask task, ExecutionContext context, TaskExecutionRecord record) {
        var taskId = task.getId();
        var startTime = record.getStartTime();

        try {
            if (!executionEngine.conditionsHold(task.getConditions(), context)) {
                log.info("Conditions of task {} not met, skipping this fire", taskId);
                record.setNotes(TaskExecutionRecord.NOTE_CONDITIONS_NOT_MET);
                record.close(ExecutionStatus.CANCELLED, clock.instant(), null);
                recordRepository.save(record);
                taskRepository.recordSkipped(taskId, startTime, clock.instant());
                return "skipped";
            }
        } catch (ConfigurationException e) {
            closeAsConfigurationError(task, record, e.getMessage());
            return "configuration_error";
        }

        var result = executionEngine.execute(task.getActions(), context);
        record.setActionResults(result.getActionResults());

        if (result.isSuccess()) {
            record.close(ExecutionStatus.COMPLETED, clock.instant(), null);
            recordRepository.save(record);
            taskRepository.recordSuccess(taskId, startTime, clock.instant());
            log.info("Task {} completed in {}ms", taskId, record.getDurationMs());
            return "completed";
        }

        if (result.isConfigurationError()) {
            closeAsConfigurationError(task, record, result.getErrorMessage());
            return "configuration_error";
        }

        record.close(ExecutionStatus.FAILED, clock.instant(), result.getErrorMessage());
        recordRepository.save(record);
        taskRepository.recordFailure(taskId, startTime, result.getErrorMessage(), clock.instant());
        log.warn("Task {} failed [{}]: {}", taskId, result.getErrorKind(), result.getErrorMessage());
        checkFailureThreshold(task);
        return "failed";
    }

    private void closeAsConfigurationError(ScheduledTask task, TaskExecutionRecord record, String error) {
        log.warn("Task {} has a configuration error, left active: {}", task.getId(), error);
        record.setNotes(TaskExecutionRecord.NOTE_CONFIGURATION_ERROR);
        record.close(ExecutionStatus.FAILED, clock.instant(), error);
        recordRepository.save(record);
        taskRepository.recordConfigurationError(task.getId(), record.getStartTime(), error, clock.instant());
    }

    /**
     * A trigger that cannot be evaluated is pushed back by the configured backoff so the
     * poller does not spin on it, and the problem is made visible on the task.
     */
    private void handleInvalidTrigger(ScheduledTask task, Instant fired, Instant now, ConfigurationException e) {
        var retryAt = now.plus(properties.getConfigurationErrorBackoffMinutes(), ChronoUnit.MINUTES).truncatedTo(ChronoUnit.MILLIS);
        if (taskRepository.postponeDue(task.getId(), fired, retryAt, now) == 0) {
            return;
        }

        log.warn("Trigger of task {} cannot be evaluated, retrying at {}: {}", task.getId(), retryAt, e.getMessage());
        taskRepository.updateLastError(task.getId(), e.getMessage(), now);

        var record = TaskExecutionRecord.builder()
                .taskId(task.getId())
                .tenantId(task.getTenantId())
                .executionType(ExecutionType.SCHEDULED_TASK)
                .triggerSource(SOURCE_SCHEDULE)
                .scheduledFor(fired)
                .status(ExecutionStatus.RUNNING)
                .startTime(now)
                .executorInstance(instanceIdentity.getInstanceId())
                .notes(TaskExecutionRecord.NOTE_CONFIGURATION_ERROR)
                .build();
        record.close(ExecutionStatus.FAILED, now, e.getMessage());
        recordRepository.save(record);
    }

    private void checkFailureThreshold(ScheduledTask task) {
        var fresh = taskRepository.findById(task.getId()).orElse(null);
        if (fresh == null || !fresh.isActive() || fresh.getErrorCount() < properties.getMaxConsecutiveFailures()) {
            return;
        }

        var now = clock.instant();
        if (taskRepository.deactivate(fresh.getId(), now) == 0) {
            return;
        }

        log.error("Task {} disabled after {} consecutive failures", fresh.getId(), fresh.getErrorCount());
        var record = TaskExecutionRecord.builder()
                .taskId(fresh.getId())
                .tenantId(fresh.getTenantId())
                .executionType(ExecutionType.SCHEDULED_TASK)
                .triggerSource(SOURCE_SCHEDULE)
                .status(ExecutionStatus.RUNNING)
                .startTime(now)
                .executorInstance(instanceIdentity.getInstanceId())
                .notes(TaskExecutionRecord.NOTE_AUTO_DISABLED)
                .build();
        record.close(ExecutionStatus.CANCELLED, now, fresh.getLastError());
        recordRepository.save(record);

        metricsConfig.recordAutoDisabled("task");
        slackAlertService.sendTaskDisabledAlert(fresh, fresh.getErrorCount(), fresh.getLastError());
    }

    private void deactivateIfExhausted(ScheduledTask task) {
        var fresh = taskRepository.findById(task.getId()).orElse(null);
        if (fresh != null && fresh.isActive() && fresh.isExhausted()) {
            if (taskRepository.deactivate(fresh.getId(), clock.instant()) == 1) {
                log.info("Task {} reached max executions ({}), deactivated", fresh.getId(), fresh.getMaxExecutions());
            }
        }
    }

    private List<RecurringSchedulePattern> patternsFor(ScheduledTask task) {
        return task.getTriggerType() == TriggerType.CRON
                ? patternRepository.findByTaskIdAndActiveTrue(task.getId())
                : List.of();
    }
}
