package com.example.automation.service.executor;

import com.example.automation.config.InstanceIdentity;
import com.example.automation.config.MetricsConfig;
import com.example.automation.config.SchedulerProperties;
import com.example.automation.domain.entity.ScheduledTask;
import com.example.automation.domain.entity.TaskExecutionRecord;
import com.example.automation.domain.enums.ErrorKind;
import com.example.automation.domain.enums.ExecutionStatus;
import com.example.automation.domain.enums.TriggerType;
import com.example.automation.domain.model.PlatformEvent;
import com.example.automation.domain.repository.RecurringSchedulePatternRepository;
import com.example.automation.domain.repository.ScheduledTaskRepository;
import com.example.automation.domain.repository.TaskExecutionRecordRepository;
import com.example.automation.exception.ConfigurationException;
import com.example.automation.service.alert.SlackAlertService;
import com.example.automation.service.execution.ExecutionEngine;
import com.example.automation.service.execution.ExecutionResult;
import com.example.automation.service.trigger.TriggerEvaluator;
import io.micrometer.core.instrument.Timer;
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
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("TaskExecutorService Tests")
class TaskExecutorServiceTest {

    private static final Instant NOW = Instant.parse("2024-06-01T09:00:05Z");
    private static final Instant FIRED = Instant.parse("2024-06-01T09:00:00Z");
    private static final Instant NEXT = Instant.parse("2024-06-02T09:00:00Z");

    @Mock
    private ScheduledTaskRepository taskRepository;

    @Mock
    private RecurringSchedulePatternRepository patternRepository;

    @Mock
    private TaskExecutionRecordRepository recordRepository;

    @Mock
    private TriggerEvaluator triggerEvaluator;

    @Mock
    private ExecutionEngine executionEngine;

    @Mock
    private SlackAlertService slackAlertService;

    @Mock
    private MetricsConfig metricsConfig;

    @Mock
    private InstanceIdentity instanceIdentity;

    @Captor
    private ArgumentCaptor<TaskExecutionRecord> recordCaptor;

    private TaskExecutorService taskExecutorService;
    private UUID taskId;
    private ScheduledTask task;

    @BeforeEach
    void setUp() {
        var properties = new SchedulerProperties();
        taskExecutorService = new TaskExecutorService(taskRepository, patternRepository, recordRepository, triggerEvaluator,
                executionEngine, slackAlertService, metricsConfig, properties, instanceIdentity, Clock.fixed(NOW, ZoneOffset.UTC));

        taskId = UUID.randomUUID();
        task = ScheduledTask.builder()
                .id(taskId)
                .tenantId("guild-1")
                .name("Daily standup")
                .triggerType(TriggerType.CRON)
                .cronExpression("0 0 9 * * *")
                .targetChannelId("c-1")
                .actions(List.of(Map.of("type", "send_message", "params", Map.of("template", "Standup!"))))
                .nextExecution(FIRED)
                .version(1L)
                .build();

        lenient().when(metricsConfig.startTimer()).thenReturn(mock(Timer.Sample.class));
        lenient().when(instanceIdentity.getInstanceId()).thenReturn("worker-a");
        lenient().when(recordRepository.save(any(TaskExecutionRecord.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    private static ExecutionResult completed() {
        return ExecutionResult.builder().actionResults(List.of()).status(ExecutionStatus.COMPLETED).build();
    }

    private static ExecutionResult failed(ErrorKind kind, String message) {
        return ExecutionResult.builder().actionResults(List.of()).status(ExecutionStatus.FAILED).errorKind(kind).errorMessage(message).build();
    }

    @Nested
    @DisplayName("executeDue Tests")
    class ExecuteDueTests {

        @Test
        @DisplayName("Should lease the due instant, run actions and record success")
        void shouldRunLeasedTask() {
            // Given
            when(patternRepository.findByTaskIdAndActiveTrue(taskId)).thenReturn(List.of());
            when(triggerEvaluator.computeNextAfterFire(task, List.of(), FIRED, NOW)).thenReturn(NEXT);
            when(taskRepository.claimDueExecution(taskId, FIRED, NEXT, true, NOW)).thenReturn(1);
            when(executionEngine.conditionsHold(any(), any())).thenReturn(true);
            when(executionEngine.execute(eq(task.getActions()), any())).thenReturn(completed());

            // When
            boolean ran = taskExecutorService.executeDue(task);

            // Then
            assertThat(ran).isTrue();
            verify(recordRepository, atLeastOnce()).save(recordCaptor.capture());
            var record = recordCaptor.getValue();
            assertThat(record.getStatus()).isEqualTo(ExecutionStatus.COMPLETED);
            assertThat(record.getScheduledFor()).isEqualTo(FIRED);
            assertThat(record.getExecutorInstance()).isEqualTo("worker-a");
            assertThat(record.getTriggerSource()).isEqualTo(TaskExecutorService.SOURCE_SCHEDULE);
            verify(taskRepository).recordSuccess(taskId, NOW, NOW);
            verify(metricsConfig).recordTaskExecution(any(), eq(TriggerType.CRON), eq("completed"));
        }

        @Test
        @DisplayName("Should do nothing when another worker claimed the instant")
        void shouldSkipWhenLeaseLost() {
            // Given
            when(patternRepository.findByTaskIdAndActiveTrue(taskId)).thenReturn(List.of());
            when(triggerEvaluator.computeNextAfterFire(any(), any(), any(), any())).thenReturn(NEXT);
            when(taskRepository.claimDueExecution(taskId, FIRED, NEXT, true, NOW)).thenReturn(0);

            // When
            boolean ran = taskExecutorService.executeDue(task);

            // Then
            assertThat(ran).isFalse();
            verifyNoInteractions(executionEngine, recordRepository);
        }

        @Test
        @DisplayName("Should deactivate in the same claim when there is no further fire")
        void shouldDeactivateOnLastFire() {
            // Given
            when(patternRepository.findByTaskIdAndActiveTrue(taskId)).thenReturn(List.of());
            when(triggerEvaluator.computeNextAfterFire(any(), any(), any(), any())).thenReturn(null);
            when(taskRepository.claimDueExecution(taskId, FIRED, null, false, NOW)).thenReturn(1);
            when(executionEngine.conditionsHold(any(), any())).thenReturn(true);
            when(executionEngine.execute(any(), any())).thenReturn(completed());

            // When
            boolean ran = taskExecutorService.executeDue(task);

            // Then
            assertThat(ran).isTrue();
            verify(taskRepository).claimDueExecution(taskId, FIRED, null, false, NOW);
        }

        @Test
        @DisplayName("Should push an unevaluable trigger back and record a configuration error")
        void shouldBackOffInvalidTrigger() {
            // Given
            var retryAt = NOW.plus(Duration.ofMinutes(60));
            when(patternRepository.findByTaskIdAndActiveTrue(taskId)).thenReturn(List.of());
            when(triggerEvaluator.computeNextAfterFire(any(), any(), any(), any()))
                    .thenThrow(new ConfigurationException("Invalid cron expression"));
            when(taskRepository.postponeDue(taskId, FIRED, retryAt, NOW)).thenReturn(1);

            // When
            boolean ran = taskExecutorService.executeDue(task);

            // Then
            assertThat(ran).isFalse();
            verify(taskRepository).updateLastError(taskId, "Invalid cron expression", NOW);
            verify(recordRepository).save(recordCaptor.capture());
            assertThat(recordCaptor.getValue().getStatus()).isEqualTo(ExecutionStatus.FAILED);
            assertThat(recordCaptor.getValue().getNotes()).isEqualTo(TaskExecutionRecord.NOTE_CONFIGURATION_ERROR);
            verify(taskRepository, never()).claimDueExecution(any(), any(), any(), anyBoolean(), any());
            verifyNoInteractions(executionEngine);
        }

        @Test
        @DisplayName("Should deactivate a task whose executions are used up instead of claiming")
        void shouldDeactivateExhaustedTaskWithoutClaiming() {
            // Given
            task.setMaxExecutions(2);
            task.setExecutionCount(2);
            when(taskRepository.findById(taskId)).thenReturn(Optional.of(task));
            when(taskRepository.deactivate(taskId, NOW)).thenReturn(1);

            // When
            boolean ran = taskExecutorService.executeDue(task);

            // Then
            assertThat(ran).isFalse();
            verify(taskRepository).deactivate(taskId, NOW);
            verify(taskRepository, never()).claimDueExecution(any(), any(), any(), anyBoolean(), any());
            verifyNoInteractions(executionEngine, triggerEvaluator);
        }

        @Test
        @DisplayName("Should ignore a task with no due instant")
        void shouldIgnoreTaskWithoutNextExecution() {
            task.setNextExecution(null);

            assertThat(taskExecutorService.executeDue(task)).isFalse();
            verifyNoInteractions(taskRepository, triggerEvaluator);
        }
    }

    @Nested
    @DisplayName("Outcome Tests")
    class OutcomeTests {

        @BeforeEach
        void leaseWins() {
            when(patternRepository.findByTaskIdAndActiveTrue(taskId)).thenReturn(List.of());
            when(triggerEvaluator.computeNextAfterFire(any(), any(), any(), any())).thenReturn(NEXT);
            when(taskRepository.claimDueExecution(taskId, FIRED, NEXT, true, NOW)).thenReturn(1);
        }

        @Test
        @DisplayName("Should count a fire whose conditions did not hold as cancelled")
        void shouldCancelWhenConditionsNotMet() {
            // Given
            when(executionEngine.conditionsHold(any(), any())).thenReturn(false);

            // When
            taskExecutorService.executeDue(task);

            // Then
            verify(recordRepository, atLeastOnce()).save(recordCaptor.capture());
            assertThat(recordCaptor.getValue().getStatus()).isEqualTo(ExecutionStatus.CANCELLED);
            assertThat(recordCaptor.getValue().getNotes()).isEqualTo(TaskExecutionRecord.NOTE_CONDITIONS_NOT_MET);
            verify(taskRepository).recordSkipped(taskId, NOW, NOW);
            verify(executionEngine, never()).execute(any(), any());
        }

        @Test
        @DisplayName("Should record a failure below the threshold without disabling")
        void shouldRecordFailureBelowThreshold() {
            // Given
            when(executionEngine.conditionsHold(any(), any())).thenReturn(true);
            when(executionEngine.execute(any(), any())).thenReturn(failed(ErrorKind.TRANSIENT, "Action #0 (send_message): 503"));
            task.setErrorCount(1);
            when(taskRepository.findById(taskId)).thenReturn(Optional.of(task));

            // When
            taskExecutorService.executeDue(task);

            // Then
            verify(taskRepository).recordFailure(taskId, NOW, "Action #0 (send_message): 503", NOW);
            verify(taskRepository, never()).deactivate(any(), any());
            verifyNoInteractions(slackAlertService);
        }

        @Test
        @DisplayName("Should disable the task after three consecutive failures")
        void shouldDisableAfterThreeFailures() {
            // Given
            when(executionEngine.conditionsHold(any(), any())).thenReturn(true);
            when(executionEngine.execute(any(), any())).thenReturn(failed(ErrorKind.PERMANENT, "forbidden"));
            var afterThird = ScheduledTask.builder()
                    .id(taskId).tenantId("guild-1").name("Daily standup").triggerType(TriggerType.CRON)
                    .errorCount(3).lastError("forbidden").active(true).build();
            when(taskRepository.findById(taskId)).thenReturn(Optional.of(afterThird));
            when(taskRepository.deactivate(taskId, NOW)).thenReturn(1);

            // When
            taskExecutorService.executeDue(task);

            // Then
            verify(recordRepository, atLeast(2)).save(recordCaptor.capture());
            var disabledRecord = recordCaptor.getAllValues().get(recordCaptor.getAllValues().size() - 1);
            assertThat(disabledRecord.getStatus()).isEqualTo(ExecutionStatus.CANCELLED);
            assertThat(disabledRecord.getNotes()).isEqualTo(TaskExecutionRecord.NOTE_AUTO_DISABLED);
            verify(slackAlertService).sendTaskDisabledAlert(afterThird, 3, "forbidden");
            verify(metricsConfig).recordAutoDisabled("task");
        }

        @Test
        @DisplayName("Should not count configuration errors toward self-disable")
        void shouldNotDisableOnConfigurationError() {
            // Given
            when(executionEngine.conditionsHold(any(), any())).thenReturn(true);
            when(executionEngine.execute(any(), any())).thenReturn(failed(ErrorKind.CONFIGURATION, "Missing template variable: x"));

            // When
            taskExecutorService.executeDue(task);

            // Then
            verify(taskRepository).recordConfigurationError(taskId, NOW, "Missing template variable: x", NOW);
            verify(taskRepository, never()).recordFailure(any(), any(), any(), any());
            verify(taskRepository, never()).deactivate(any(), any());
        }
    }

    @Nested
    @DisplayName("Event and manual run Tests")
    class EventAndManualTests {

        private final PlatformEvent event = PlatformEvent.builder()
                .tenantId("guild-1")
                .eventName("member_join")
                .userId("u-1")
                .payload(Map.of())
                .occurredAt(NOW)
                .build();

        @BeforeEach
        void eventTask() {
            task.setTriggerType(TriggerType.EVENT);
            task.setEventTrigger("member_join");
            task.setNextExecution(null);
        }

        @Test
        @DisplayName("Should take a count slot and deactivate when max executions is reached")
        void shouldDeactivateWhenExhausted() {
            // Given
            task.setMaxExecutions(1);
            when(taskRepository.claimEventFire(taskId, 0, NOW)).thenReturn(1);
            when(executionEngine.conditionsHold(any(), any())).thenReturn(true);
            when(executionEngine.execute(any(), any())).thenReturn(completed());
            var exhausted = ScheduledTask.builder().id(taskId).active(true).executionCount(1).maxExecutions(1).build();
            when(taskRepository.findById(taskId)).thenReturn(Optional.of(exhausted));
            when(taskRepository.deactivate(taskId, NOW)).thenReturn(1);

            // When
            boolean ran = taskExecutorService.executeForEvent(task, event);

            // Then
            assertThat(ran).isTrue();
            verify(taskRepository).recordSuccess(taskId, NOW, NOW);
            verify(taskRepository).deactivate(taskId, NOW);
            verify(recordRepository, atLeastOnce()).save(recordCaptor.capture());
            assertThat(recordCaptor.getValue().getTriggerUserId()).isEqualTo("u-1");
            assertThat(recordCaptor.getValue().getTriggerSource()).isEqualTo("member_join");
        }

        @Test
        @DisplayName("Should retry the slot claim after a concurrent fire moved the count")
        void shouldRetryClaimOnConcurrentFire() {
            // Given
            when(taskRepository.claimEventFire(taskId, 0, NOW)).thenReturn(0);
            var moved = ScheduledTask.builder().id(taskId).tenantId("guild-1").name("Daily standup")
                    .triggerType(TriggerType.EVENT).active(true).executionCount(1).build();
            when(taskRepository.findById(taskId)).thenReturn(Optional.of(moved));
            when(taskRepository.claimEventFire(taskId, 1, NOW)).thenReturn(1);
            when(executionEngine.conditionsHold(any(), any())).thenReturn(true);
            when(executionEngine.execute(any(), any())).thenReturn(completed());

            // When
            boolean ran = taskExecutorService.executeForEvent(task, event);

            // Then
            assertThat(ran).isTrue();
            verify(taskRepository).claimEventFire(taskId, 1, NOW);
        }

        @Test
        @DisplayName("Should not fire an exhausted task")
        void shouldNotFireExhaustedTask() {
            task.setMaxExecutions(2);
            task.setExecutionCount(2);

            assertThat(taskExecutorService.executeForEvent(task, event)).isFalse();
            verify(taskRepository, never()).claimEventFire(any(), anyInt(), any());
        }

        @Test
        @DisplayName("Should skip a manual run already claimed elsewhere")
        void shouldSkipClaimedManualRun() {
            // Given
            var requestedAt = NOW.minusSeconds(2);
            task.setManualRunRequestedAt(requestedAt);
            when(taskRepository.claimManualRun(taskId, requestedAt, NOW)).thenReturn(0);

            // When / Then
            assertThat(taskExecutorService.executeManual(task)).isFalse();
            verifyNoInteractions(executionEngine);
        }

        @Test
        @DisplayName("Should run a manual request without advancing the schedule")
        void shouldRunManualRequest() {
            // Given
            var requestedAt = NOW.minusSeconds(2);
            task.setManualRunRequestedAt(requestedAt);
            when(taskRepository.claimManualRun(taskId, requestedAt, NOW)).thenReturn(1);
            when(executionEngine.conditionsHold(any(), any())).thenReturn(true);
            when(executionEngine.execute(any(), any())).thenReturn(completed());
            when(taskRepository.findById(taskId)).thenReturn(Optional.of(task));

            // When
            boolean ran = taskExecutorService.executeManual(task);

            // Then
            assertThat(ran).isTrue();
            verify(taskRepository).recordSuccess(taskId, NOW, NOW);
            verify(taskRepository, never()).claimDueExecution(any(), any(), any(), anyBoolean(), any());
        }

        @Test
        @DisplayName("Should drop a manual request on a task whose executions are used up")
        void shouldDropManualRunOnExhaustedTask() {
            // Given
            task.setManualRunRequestedAt(NOW.minusSeconds(2));
            task.setMaxExecutions(1);
            task.setExecutionCount(1);
            when(taskRepository.findById(taskId)).thenReturn(Optional.of(task));
            when(taskRepository.deactivate(taskId, NOW)).thenReturn(1);

            // When
            boolean ran = taskExecutorService.executeManual(task);

            // Then
            assertThat(ran).isFalse();
            verify(taskRepository, never()).claimManualRun(any(), any(), any());
            verify(taskRepository).deactivate(taskId, NOW);
            verifyNoInteractions(executionEngine);
        }
    }

    /**
     * Runs the executor against an in-memory copy of the task row whose conditional
     * updates behave like the repository queries.
     */
    @Nested
    @DisplayName("max_executions Tests")
    class MaxExecutionsTests {

        private int rowCount;
        private boolean rowActive;
        private Instant rowNext;
        private int maxExecutions;

        private void givenRow(int max) {
            maxExecutions = max;
            rowCount = 0;
            rowActive = true;
            rowNext = FIRED;

            when(triggerEvaluator.computeNextAfterFire(any(), any(), any(), any())).thenAnswer(inv -> {
                ScheduledTask snapshot = inv.getArgument(0);
                Instant fired = inv.getArgument(2);
                return snapshot.getExecutionCount() + 1 >= snapshot.getMaxExecutions() ? null : fired.plus(Duration.ofDays(1));
            });
            when(taskRepository.claimDueExecution(eq(taskId), any(), any(), anyBoolean(), eq(NOW))).thenAnswer(inv -> {
                Instant expectedNext = inv.getArgument(1);
                if (!rowActive || !expectedNext.equals(rowNext) || rowCount >= maxExecutions) {
                    return 0;
                }
                rowCount++;
                rowNext = inv.getArgument(2);
                rowActive = inv.getArgument(3);
                return 1;
            });
            lenient().when(taskRepository.deactivate(taskId, NOW)).thenAnswer(inv -> {
                if (!rowActive) {
                    return 0;
                }
                rowActive = false;
                rowNext = null;
                return 1;
            });
            lenient().when(taskRepository.findById(taskId)).thenAnswer(inv -> Optional.of(snapshot(rowCount, rowNext)));
            when(executionEngine.conditionsHold(any(), any())).thenReturn(true);
            when(executionEngine.execute(any(), any())).thenReturn(completed());
        }

        private ScheduledTask snapshot(int executionCount, Instant nextExecution) {
            return ScheduledTask.builder()
                    .id(taskId)
                    .tenantId("guild-1")
                    .name("Reminder")
                    .triggerType(TriggerType.INTERVAL)
                    .intervalSeconds(86_400L)
                    .actions(task.getActions())
                    .executionCount(executionCount)
                    .maxExecutions(maxExecutions)
                    .active(rowActive)
                    .nextExecution(nextExecution)
                    .version(1L)
                    .build();
        }

        @Test
        @DisplayName("Should fire exactly max_executions times and then leave the task inactive")
        void shouldFireExactlyMaxExecutionsTimes() {
            // Given
            givenRow(3);

            // When
            var fires = 0;
            for (var poll = 0; poll < 6; poll++) {
                if (taskExecutorService.executeDue(snapshot(rowCount, rowNext))) {
                    fires++;
                }
            }

            // Then
            assertThat(fires).isEqualTo(3);
            assertThat(rowCount).isEqualTo(3);
            assertThat(rowActive).isFalse();
            assertThat(rowNext).isNull();
            verify(executionEngine, times(3)).execute(any(), any());
        }

        @Test
        @DisplayName("Should not fire past max_executions when two workers overlap on stale counts")
        void shouldNotOverrunWhenWorkersOverlap() {
            // Given
            givenRow(2);
            var workerA = snapshot(0, FIRED);
            // read while worker A was still running, so its count lags behind the row
            var workerB = snapshot(0, FIRED.plus(Duration.ofDays(1)));

            // When
            var firstRan = taskExecutorService.executeDue(workerA);
            var secondRan = taskExecutorService.executeDue(workerB);
            var thirdRan = taskExecutorService.executeDue(snapshot(rowCount, rowNext));

            // Then
            assertThat(firstRan).isTrue();
            assertThat(secondRan).isTrue();
            assertThat(thirdRan).isFalse();
            assertThat(rowCount).isEqualTo(2);
            assertThat(rowActive).isFalse();
            assertThat(rowNext).isNull();
            verify(executionEngine, times(2)).execute(any(), any());
        }
    }
}
