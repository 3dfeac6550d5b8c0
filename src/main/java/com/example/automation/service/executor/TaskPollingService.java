package com.example.automation.service.executor;

import com.example.automation.config.SchedulerProperties;
import com.example.automation.domain.entity.ScheduledTask;
import com.example.automation.domain.repository.ScheduledTaskRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Predicate;

/**
 * The scheduler loop: polls due tasks and manual run requests and hands them to workers.
 * <p>
 * Flow:
 * 1. Poll runs on a fixed delay on every instance
 * 2. Fetches a batch of tasks whose next_execution has passed, oldest first
 * 3. Dispatches each to the scheduler worker pool
 * 4. Each worker leases its task with a conditional update; losers skip silently
 * <p>
 * No cluster lock is taken here. The conditional claim alone guarantees that each due
 * instant runs at most once however many instances poll.
 */
@Slf4j
@Service
public class TaskPollingService {

    private final ScheduledTaskRepository taskRepository;
    private final TaskExecutorService taskExecutorService;
    private final SchedulerProperties properties;
    private final ExecutorService schedulerWorkerExecutor;
    private final Clock clock;

    private final AtomicBoolean isRunning = new AtomicBoolean(false);

    public TaskPollingService(ScheduledTaskRepository taskRepository, TaskExecutorService taskExecutorService, SchedulerProperties properties,
                              @Qualifier("schedulerWorkerExecutor") ExecutorService schedulerWorkerExecutor, Clock clock) {
        this.taskRepository = taskRepository;
        this.taskExecutorService = taskExecutorService;
        this.properties = properties;
        this.schedulerWorkerExecutor = schedulerWorkerExecutor;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${automation.scheduler.poll-interval-ms:5000}")
    public void pollAndProcessTasks() {
        if (!isRunning.compareAndSet(false, true)) {
            log.debug("Previous polling cycle still running, skipping");
            return;
        }

        try {
            var page = PageRequest.of(0, properties.getBatchSize());
            var due = taskRepository.findDueTasks(clock.instant(), page);
            var manual = taskRepository.findManualRunRequests(page);

            if (due.isEmpty() && manual.isEmpty()) {
                log.debug("No tasks ready for execution");
                return;
            }

            var ran = dispatch(due, taskExecutorService::executeDue) + dispatch(manual, taskExecutorService::executeManual);
            log.info("Polling cycle found {} due and {} manual task(s), {} run by this instance", due.size(), manual.size(), ran);
        } catch (Exception e) {
            log.error("Error in task polling cycle: {}", e.getMessage(), e);
        } finally {
            isRunning.set(false);
        }
    }

    private long dispatch(List<ScheduledTask> tasks, Predicate<ScheduledTask> action) {
        if (tasks.isEmpty()) {
            return 0;
        }

        var futures = tasks.stream()
                .map(task -> CompletableFuture.supplyAsync(() -> processTask(task, action), schedulerWorkerExecutor))
                .toList();

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .orTimeout(properties.getStaleRecordThresholdMinutes(), TimeUnit.MINUTES)
                .exceptionally(ex -> {
                    log.error("Error waiting for task completion: {}", ex.getMessage());
                    return null;
                })
                .join();

        return futures.stream()
                .filter(f -> {
                    try {
                        return f.isDone() && !f.isCompletedExceptionally() && f.get();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return false;
                    } catch (ExecutionException e) {
                        return false;
                    }
                })
                .count();
    }

    private boolean processTask(ScheduledTask task, Predicate<ScheduledTask> action) {
        try {
            return action.test(task);
        } catch (Exception e) {
            log.error("Error processing task {}: {}", task.getId(), e.getMessage(), e);
            return false;
        }
    }
}
