package com.example.automation.config;

import com.example.automation.domain.enums.DeliveryStatus;
import com.example.automation.domain.enums.TriggerType;
import com.example.automation.domain.repository.AutomationRuleRepository;
import com.example.automation.domain.repository.IntegrationRepository;
import com.example.automation.domain.repository.ScheduledTaskRepository;
import com.example.automation.domain.repository.WebhookDeliveryRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics for the scheduler, rule engine, delivery pipeline and integration sync.
 * <p>
 * Gauges are backed by counters refreshed from the database by the housekeeping job,
 * so scraping never hits the database.
 */
@Configuration
@RequiredArgsConstructor
public class MetricsConfig {

    private static final String PREFIX = "automation_";

    private final MeterRegistry meterRegistry;
    private final ScheduledTaskRepository taskRepository;
    private final AutomationRuleRepository ruleRepository;
    private final IntegrationRepository integrationRepository;
    private final WebhookDeliveryRepository deliveryRepository;
    private final Clock clock;

    private final ConcurrentHashMap<String, AtomicLong> gaugeValues = new ConcurrentHashMap<>();

    @PostConstruct
    public void initializeMetrics() {
        registerGauge("active_tasks", "tasks", "Number of active scheduled tasks");
        registerGauge("overdue_tasks", "tasks_overdue", "Active tasks whose next execution has passed");
        registerGauge("active_rules", "rules", "Number of active automation rules");
        registerGauge("active_integrations", "integrations", "Number of active integrations");
        registerGauge("pending_deliveries", "webhook_deliveries_pending", "Deliveries waiting to be sent or retried");
    }

    private void registerGauge(String key, String name, String description) {
        gaugeValues.put(key, new AtomicLong(0));
        Gauge.builder(PREFIX + name, gaugeValues.get(key), AtomicLong::get)
                .description(description)
                .register(meterRegistry);
    }

    /**
     * Reload gauge values from the database
     */
    public void refreshGauges() {
        gaugeValues.get("active_tasks").set(taskRepository.countByActiveTrue());
        gaugeValues.get("overdue_tasks").set(taskRepository.countOverdue(clock.instant()));
        gaugeValues.get("active_rules").set(ruleRepository.countByActiveTrue());
        gaugeValues.get("active_integrations").set(integrationRepository.countByActiveTrue());
        gaugeValues.get("pending_deliveries").set(deliveryRepository.countByStatus(DeliveryStatus.PENDING));
    }

    public Timer.Sample startTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordTaskExecution(Timer.Sample sample, TriggerType triggerType, String outcome) {
        sample.stop(Timer.builder(PREFIX + "task_execution_time")
                .tag("trigger", triggerType.getCode())
                .tag("outcome", outcome)
                .description("Scheduled task run time")
                .register(meterRegistry));
    }

    public void recordRuleExecution(Timer.Sample sample, String outcome) {
        sample.stop(Timer.builder(PREFIX + "rule_execution_time")
                .tag("outcome", outcome)
                .description("Automation rule run time")
                .register(meterRegistry));
    }

    /**
     * A rule was considered for an event but not run
     */
    public void recordRuleSkipped(String reason) {
        meterRegistry.counter(PREFIX + "rule_skips", "reason", reason).increment();
    }

    public void recordDelivery(String outcome) {
        meterRegistry.counter(PREFIX + "webhook_deliveries", "outcome", outcome).increment();
    }

    public void recordDeliveryRetry(int attemptNumber) {
        meterRegistry.counter(PREFIX + "webhook_retries", "attempt", String.valueOf(attemptNumber)).increment();
    }

    public void recordInboundWebhook(String outcome) {
        meterRegistry.counter(PREFIX + "inbound_webhooks", "outcome", outcome).increment();
    }

    public void recordSync(String provider, boolean success) {
        meterRegistry.counter(PREFIX + "integration_syncs",
                "provider", provider,
                "success", String.valueOf(success)
        ).increment();
    }

    public void recordIntegrationItems(String provider, int count) {
        meterRegistry.counter(PREFIX + "integration_items", "provider", provider).increment(count);
    }

    /**
     * A task, rule or integration switched itself off after repeated failures
     */
    public void recordAutoDisabled(String kind) {
        meterRegistry.counter(PREFIX + "auto_disabled", "kind", kind).increment();
    }
}
