package com.example.automation.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Worker pools for the polling loops and for timeout-bounded action dispatch.
 * <p>
 * Each loop gets its own fixed pool so a slow dispatcher cannot starve
 * webhook deliveries and vice versa.
 */
@Slf4j
@EnableAsync
@Configuration
public class AsyncConfig {

    /**
     * Runs claimed scheduled tasks and event-triggered tasks.
     */
    @Bean(name = "schedulerWorkerExecutor", destroyMethod = "shutdown")
    public ExecutorService schedulerWorkerExecutor(SchedulerProperties properties) {
        log.info("Creating scheduler worker pool with {} threads", properties.getWorkerPoolSize());
        return Executors.newFixedThreadPool(properties.getWorkerPoolSize(), new CustomizableThreadFactory("scheduler-worker-"));
    }

    /**
     * Runs individual dispatcher calls so the caller can stop waiting after the action timeout.
     */
    @Bean(name = "actionDispatchExecutor", destroyMethod = "shutdown")
    public ExecutorService actionDispatchExecutor(ExecutionProperties properties) {
        log.info("Creating action dispatch pool with {} threads", properties.getDispatchPoolSize());
        return Executors.newFixedThreadPool(properties.getDispatchPoolSize(), new CustomizableThreadFactory("action-dispatch-"));
    }

    @Bean(name = "webhookDeliveryExecutor", destroyMethod = "shutdown")
    public ExecutorService webhookDeliveryExecutor(WebhookProperties properties) {
        log.info("Creating webhook delivery pool with {} threads", properties.getWorkerPoolSize());
        return Executors.newFixedThreadPool(properties.getWorkerPoolSize(), new CustomizableThreadFactory("webhook-delivery-"));
    }

    /**
     * Task executor for Spring's @Async annotation (alerts).
     */
    @Bean(name = "taskExecutor")
    public TaskExecutor taskExecutor() {
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("async-alert-");
        executor.setRejectedExecutionHandler((r, e) -> {
            log.warn("Task rejected from async executor, running in caller thread");
            if (!e.isShutdown()) {
                r.run();
            }
        });
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        return executor;
    }
}
