package com.example.automation.service;

import com.example.automation.domain.entity.RecurringSchedulePattern;
import com.example.automation.domain.entity.ScheduledTask;
import com.example.automation.domain.enums.TaskType;
import com.example.automation.domain.repository.RecurringSchedulePatternRepository;
import com.example.automation.domain.repository.ScheduledTaskRepository;
import com.example.automation.domain.repository.TaskExecutionRecordRepository;
import com.example.automation.dto.CreateTaskRequest;
import com.example.automation.dto.ExecutionRecordResponse;
import com.example.automation.dto.SchedulePatternRequest;
import com.example.automation.dto.TaskResponse;
import com.example.automation.exception.ConfigurationException;
import com.example.automation.exception.InvalidStateException;
import com.example.automation.exception.ResourceNotFoundException;
import com.example.automation.mapper.AutomationMapper;
import com.example.automation.service.execution.DefinitionCodec;
import com.example.automation.service.trigger.CronExpressions;
import com.example.automation.service.trigger.TriggerEvaluator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Service for managing scheduled task lifecycle operations.
 * <p>
 * Provides:
 * - Task creation with trigger and definition validation
 * - Task querying and execution history
 * - Activation, deactivation and run-now requests
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TaskManagementService {

    private final ScheduledTaskRepository taskRepository;
    private final RecurringSchedulePatternRepository patternRepository;
    private final TaskExecutionRecordRepository recordRepository;
    private final TriggerEvaluator triggerEvaluator;
    private final DefinitionCodec definitionCodec;
    private final AutomationMapper mapper;
    private final Clock clock;

    // === Task Creation ===

    /**
     * Create a task and compute its first fire instant.
     *
     * @throws ConfigurationException if the trigger or the condition/action lists are invalid
     */
    @Transactional
    public TaskResponse createTask(CreateTaskRequest request) {
        log.info("Creating {} task '{}' for tenant {}", request.getTriggerType(), request.getName(), request.getTenantId());

        var timezone = request.getTimezone() != null ? request.getTimezone() : "UTC";
        var task = ScheduledTask.builder()
                .tenantId(request.getTenantId())
                .name(request.getName())
                .description(request.getDescription())
                .taskType(request.getTaskType() != null ? request.getTaskType() : TaskType.CUSTOM)
                .triggerType(request.getTriggerType())
                .cronExpression(request.getCronExpression() != null && !request.getCronExpression().isBlank()
                        ? CronExpressions.normalize(request.getCronExpression())
                        : null)
                .intervalSeconds(request.getIntervalSeconds())
                .scheduledTime(request.getScheduledTime() != null ? request.getScheduledTime().truncatedTo(ChronoUnit.MILLIS) : null)
                .eventTrigger(request.getEventTrigger())
                .timezone(timezone)
                .targetChannelId(request.getTargetChannelId())
                .targetRoleIds(orEmpty(request.getTargetRoleIds()))
                .conditions(orEmpty(request.getConditions()))
                .actions(orEmpty(request.getActions()))
                .exceptionDates(orEmpty(request.getExceptionDates()))
                .maxExecutions(request.getMaxExecutions())
                .createdBy(request.getCreatedBy())
                .build();

        var patterns = new ArrayList<RecurringSchedulePattern>();
        if (request.getPatterns() != null) {
            request.getPatterns().forEach(p -> patterns.add(toPattern(p, request.getTenantId(), timezone)));
        }

        definitionCodec.validate(task.getConditions(), task.getActions());
        triggerEvaluator.validate(task, patterns);

        var now = clock.instant();
        if (task.getTriggerType().isClockDriven()) {
            var first = triggerEvaluator.computeInitial(task, patterns, now);
            if (first == null) {
                throw new ConfigurationException("Trigger has no fire instant after " + now);
            }
            task.setNextExecution(first);
        }

        task = taskRepository.save(task);
        for (var pattern : patterns) {
            pattern.setTaskId(task.getId());
        }
        var saved = patternRepository.saveAll(patterns);
        log.info("Created task {} '{}', next execution {}", task.getId(), task.getName(), task.getNextExecution());

        var response = mapper.toTaskResponse(task);
        response.setPatterns(mapper.toPatternResponses(saved));
        return response;
    }

    // === Task Retrieval ===

    @Transactional(readOnly = true)
    public TaskResponse getTask(UUID taskId) {
        var task = findTask(taskId);
        var response = mapper.toTaskResponse(task);
        response.setPatterns(mapper.toPatternResponses(patternRepository.findByTaskId(taskId)));
        return response;
    }

    @Transactional(readOnly = true)
    public Page<TaskResponse> listTasks(String tenantId, Boolean active, Pageable pageable) {
        var tasks = active != null
                ? taskRepository.findByTenantIdAndActive(tenantId, active, pageable)
                : taskRepository.findByTenantId(tenantId, pageable);
        return tasks.map(mapper::toTaskResponse);
    }

    @Transactional(readOnly = true)
    public Page<ExecutionRecordResponse> getExecutionHistory(UUID taskId, Pageable pageable) {
        findTask(taskId);
        return recordRepository.findByTaskIdOrderByStartTimeDesc(taskId, pageable).map(mapper::toRecordResponse);
    }

    // === Status Management ===

    /**
     * Re-enable a task. Clears the failure streak and recomputes next_execution from now.
     */
    @Transactional
    public TaskResponse activateTask(UUID taskId) {
        var task = findTask(taskId);
        if (task.isActive()) {
            return mapper.toTaskResponse(task);
        }

        var patterns = patternRepository.findByTaskIdAndActiveTrue(taskId);
        triggerEvaluator.validate(task, patterns);
        var next = task.getTriggerType().isClockDriven()
                ? triggerEvaluator.computeInitial(task, patterns, clock.instant())
                : null;
        if (task.getTriggerType().isClockDriven() && next == null) {
            throw new InvalidStateException(taskId.toString(), task.isExhausted() ? "exhausted" : "expired", "activate");
        }
        if (!task.getTriggerType().isClockDriven() && task.isExhausted()) {
            throw new InvalidStateException(taskId.toString(), "exhausted", "activate");
        }

        task.setActive(true);
        task.setErrorCount(0);
        task.setLastError(null);
        task.setNextExecution(next);
        task = taskRepository.save(task);
        log.info("Activated task {}, next execution {}", taskId, next);
        return mapper.toTaskResponse(task);
    }

    /**
     * Stop a task. A run already in progress completes and is recorded.
     */
    @Transactional
    public TaskResponse deactivateTask(UUID taskId) {
        findTask(taskId);
        if (taskRepository.deactivate(taskId, clock.instant()) > 0) {
            log.info("Deactivated task {}", taskId);
        }
        return mapper.toTaskResponse(findTask(taskId));
    }

    /**
     * Ask the scheduler loop to run the task once, outside its schedule.
     */
    @Transactional
    public TaskResponse requestRun(UUID taskId) {
        var task = findTask(taskId);
        if (!task.isActive()) {
            throw new InvalidStateException(taskId.toString(), "inactive", "run");
        }
        if (task.getManualRunRequestedAt() == null) {
            task.setManualRunRequestedAt(clock.instant().truncatedTo(ChronoUnit.MILLIS));
            task = taskRepository.save(task);
            log.info("Manual run requested for task {}", taskId);
        }
        return mapper.toTaskResponse(task);
    }

    private ScheduledTask findTask(UUID taskId) {
        return taskRepository.findById(taskId).orElseThrow(() -> new ResourceNotFoundException("ScheduledTask", taskId));
    }

    private RecurringSchedulePattern toPattern(SchedulePatternRequest request, String tenantId, String taskTimezone) {
        return RecurringSchedulePattern.builder()
                .tenantId(tenantId)
                .patternType(request.getPatternType())
                .daysOfWeek(orEmpty(request.getDaysOfWeek()))
                .daysOfMonth(orEmpty(request.getDaysOfMonth()))
                .months(orEmpty(request.getMonths()))
                .timeSlots(orEmpty(request.getTimeSlots()))
                .exceptionDates(orEmpty(request.getExceptionDates()))
                .timezone(request.getTimezone() != null ? request.getTimezone() : taskTimezone)
                .active(true)
                .build();
    }

    private static <T> List<T> orEmpty(List<T> values) {
        return values != null ? new ArrayList<>(values) : new ArrayList<>();
    }
}
