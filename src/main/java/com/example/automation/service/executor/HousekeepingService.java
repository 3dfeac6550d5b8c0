package com.example.automation.service.executor;

import com.example.automation.config.MetricsConfig;
import com.example.automation.config.SchedulerProperties;
import com.example.automation.domain.entity.TaskExecutionRecord;
import com.example.automation.domain.enums.ExecutionStatus;
import com.example.automation.domain.repository.InboundWebhookReceiptRepository;
import com.example.automation.domain.repository.TaskExecutionRecordRepository;
import com.example.automation.domain.repository.WebhookDeliveryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.temporal.ChronoUnit;

/**
 * Cluster-wide maintenance jobs. ShedLock makes each job run on one instance at a time.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HousekeepingService {

    private final TaskExecutionRecordRepository recordRepository;
    private final WebhookDeliveryRepository deliveryRepository;
    private final InboundWebhookReceiptRepository receiptRepository;
    private final MetricsConfig metricsConfig;
    private final SchedulerProperties properties;
    private final Clock clock;

    /**
     * Close execution records left RUNNING by a worker that died mid-run.
     * <p>
     * The task itself needs no repair: its claim already moved next_execution on.
     */
    @Scheduled(fixedDelayString = "${automation.scheduler.stale-record-check-interval-ms:300000}")
    @SchedulerLock(name = "staleExecutionRecordCleanup", lockAtLeastFor = "30s", lockAtMostFor = "5m")
    public void closeStaleRecords() {
        try {
            var now = clock.instant();
            var threshold = now.minus(properties.getStaleRecordThresholdMinutes(), ChronoUnit.MINUTES);
            var stale = recordRepository.findStaleRunning(threshold);
            if (stale.isEmpty()) {
                log.debug("No stale execution records found");
                return;
            }

            log.warn("Found {} stale RUNNING execution records, closing them", stale.size());
            for (var record : stale) {
                record.setNotes(TaskExecutionRecord.NOTE_WORKER_LOST);
                record.close(ExecutionStatus.FAILED, now, "Worker stopped before the run finished");
                recordRepository.save(record);
            }
        } catch (Exception e) {
            log.error("Error closing stale execution records: {}", e.getMessage(), e);
        }
    }

    @Scheduled(cron = "${automation.scheduler.retention-cron:0 30 3 * * *}")
    @SchedulerLock(name = "historyRetentionPurge", lockAtLeastFor = "1m", lockAtMostFor = "30m")
    public void purgeOldHistory() {
        try {
            var cutoff = clock.instant().minus(properties.getHistoryRetentionDays(), ChronoUnit.DAYS);
            var records = recordRepository.deleteClosedBefore(cutoff);
            var deliveries = deliveryRepository.deleteTerminalBefore(cutoff);
            var receipts = receiptRepository.deleteReceivedBefore(cutoff);
            log.info("Purged history older than {}: {} execution records, {} deliveries, {} inbound receipts",
                    cutoff, records, deliveries, receipts);
        } catch (Exception e) {
            log.error("Error purging old history: {}", e.getMessage(), e);
        }
    }

    /**
     * Gauges are per instance, so every instance refreshes its own and no lock is taken.
     */
    @Scheduled(fixedDelayString = "${automation.scheduler.metrics-update-interval-ms:60000}")
    public void refreshGauges() {
        try {
            metricsConfig.refreshGauges();
        } catch (Exception e) {
            log.error("Error refreshing gauges: {}", e.getMessage(), e);
        }
    }
}
