package com.example.automation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Automation Engine Application
 * <p>
 * Scheduled-task and event-automation engine for community tenants.
 * <p>
 * Features:
 * - Cron, interval, one-time and event triggered tasks with timezone aware scheduling
 * - Conditional-claim leases so any number of workers can poll the same store
 * - Priority ordered automation rules with cooldowns and per-user caps
 * - Outbound webhook deliveries with retry/backoff and signed inbound receipts
 * - Rate limited polling of external integrations
 */
@EnableScheduling
@SpringBootApplication
public class AutomationEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(AutomationEngineApplication.class, args);
    }
}
