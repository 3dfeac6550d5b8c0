package com.example.automation.service.integration;

import com.example.automation.config.IntegrationSyncProperties;
import com.example.automation.config.MetricsConfig;
import com.example.automation.domain.entity.Integration;
import com.example.automation.domain.enums.ActionType;
import com.example.automation.domain.model.ExecutionContext;
import com.example.automation.domain.model.PlatformEvent;
import com.example.automation.domain.repository.IntegrationRepository;
import com.example.automation.exception.ConfigurationException;
import com.example.automation.service.alert.SlackAlertService;
import com.example.automation.service.execution.ActionDispatcher;
import com.example.automation.service.execution.TemplateRenderer;
import com.example.automation.service.ratelimit.TokenBucketRateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.PageRequest;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Polls due integrations, turns newly seen external items into platform events and
 * optionally posts a message for each of them.
 * <p>
 * An integration is leased by pushing {@code next_sync} to the lease expiry; only the
 * worker whose claim succeeds syncs it. Repeated failures back off exponentially and
 * switch the integration off after the configured number of consecutive failures.
 */
@Slf4j
@Service
public class IntegrationSyncManager {

    static final String STATE_SEEN_IDS = "seenIds";
    static final String ERROR_EVENT = "integration.error";

    static final String OUTCOME_SYNCED = "synced";
    static final String OUTCOME_RATE_LIMITED = "rate_limited";
    static final String OUTCOME_FAILED = "failed";
    static final String OUTCOME_DISABLED = "disabled";
    static final String OUTCOME_CONFIGURATION_ERROR = "configuration_error";

    private final IntegrationRepository integrationRepository;
    private final IntegrationProviderRegistry providerRegistry;
    private final CredentialResolver credentialResolver;
    private final TokenBucketRateLimiter rateLimiter;
    private final ActionDispatcher actionDispatcher;
    private final TemplateRenderer templateRenderer;
    private final ApplicationEventPublisher eventPublisher;
    private final SlackAlertService slackAlertService;
    private final MetricsConfig metricsConfig;
    private final IntegrationSyncProperties properties;
    private final ExecutorService schedulerWorkerExecutor;
    private final Clock clock;

    private final AtomicBoolean isRunning = new AtomicBoolean(false);

    public IntegrationSyncManager(IntegrationRepository integrationRepository, IntegrationProviderRegistry providerRegistry,
                                  CredentialResolver credentialResolver, TokenBucketRateLimiter rateLimiter,
                                  ActionDispatcher actionDispatcher, TemplateRenderer templateRenderer,
                                  ApplicationEventPublisher eventPublisher, SlackAlertService slackAlertService,
                                  MetricsConfig metricsConfig, IntegrationSyncProperties properties,
                                  @Qualifier("schedulerWorkerExecutor") ExecutorService schedulerWorkerExecutor, Clock clock) {
        this.integrationRepository = integrationRepository;
        this.providerRegistry = providerRegistry;
        this.credentialResolver = credentialResolver;
        this.rateLimiter = rateLimiter;
        this.actionDispatcher = actionDispatcher;
        this.templateRenderer = templateRenderer;
        this.eventPublisher = eventPublisher;
        this.slackAlertService = slackAlertService;
        this.metricsConfig = metricsConfig;
        this.properties = properties;
        this.schedulerWorkerExecutor = schedulerWorkerExecutor;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${automation.integrations.poll-interval-ms:10000}")
    public void pollAndSync() {
        if (!isRunning.compareAndSet(false, true)) {
            log.debug("Previous sync cycle still running, skipping");
            return;
        }

        try {
            var due = integrationRepository.findDueIntegrations(clock.instant(), PageRequest.of(0, properties.getBatchSize()));
            if (due.isEmpty()) {
                log.debug("No integrations due for sync");
                return;
            }

            log.debug("Found {} integrations due for sync", due.size());
            var futures = due.stream()
                    .map(integration -> CompletableFuture.runAsync(() -> processIntegration(integration), schedulerWorkerExecutor))
                    .toList();

            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                    .orTimeout(properties.getLeaseSeconds(), TimeUnit.SECONDS)
                    .exceptionally(ex -> {
                        log.error("Error waiting for syncs to finish: {}", ex.getMessage());
                        return null;
                    })
                    .join();
        } catch (Exception e) {
            log.error("Error in integration sync cycle: {}", e.getMessage(), e);
        } finally {
            isRunning.set(false);
        }
    }

    /**
     * Claim and sync one integration.
     *
     * @return the outcome label, or null when the claim was lost or the result could not be saved
     */
    String processIntegration(Integration candidate) {
        try {
            return claimAndSync(candidate);
        } catch (ObjectOptimisticLockingFailureException e) {
            // changed by an administrator mid-sync; the lease runs out and the next cycle sees the new state
            log.info("Integration {} was modified during sync, result not saved", candidate.getId());
            return null;
        } catch (Exception e) {
            log.error("Error syncing integration {}: {}", candidate.getId(), e.getMessage(), e);
            return null;
        }
    }

    private String claimAndSync(Integration candidate) {
        var now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        var leaseUntil = now.plusSeconds(properties.getLeaseSeconds());
        if (integrationRepository.claimSync(candidate.getId(), candidate.getNextSync(), leaseUntil, now) == 0) {
            log.debug("Integration {} claimed by another worker, skipping", candidate.getId());
            return null;
        }

        var integration = integrationRepository.findById(candidate.getId()).orElse(null);
        if (integration == null) {
            return null;
        }

        var perHour = integration.getRequestsPerHour() != null ? integration.getRequestsPerHour() : properties.getDefaultRequestsPerHour();
        var burst = integration.getBurst() != null ? integration.getBurst() : properties.getDefaultBurst();
        var decision = rateLimiter.tryAcquire("integration:" + integration.getId(), burst, perHour / 3600.0);
        if (!decision.isAllowed()) {
            integration.setNextSync(now.plusMillis(decision.getWaitMs()));
            integrationRepository.save(integration);
            log.debug("Request budget for integration {} exhausted, next sync at {}", integration.getId(), integration.getNextSync());
            return OUTCOME_RATE_LIMITED;
        }

        List<ExternalItem> items;
        try {
            var provider = providerRegistry.getProviderOrThrow(integration.getProvider());
            var credentials = credentialResolver.resolve(integration.getTenantId(), integration.getCredentialsRef());
            items = provider.fetch(integration, credentials);
        } catch (ConfigurationException e) {
            return onConfigurationError(integration, e, now);
        } catch (Exception e) {
            return onFailure(integration, e, now);
        }

        return onFetched(integration, items, now);
    }

    private String onFetched(Integration integration, List<ExternalItem> items, Instant now) {
        var state = integration.getSyncState() != null ? new HashMap<>(integration.getSyncState()) : new HashMap<String, Object>();
        var baseline = !state.containsKey(STATE_SEEN_IDS);
        var seen = new LinkedHashSet<String>();
        if (state.get(STATE_SEEN_IDS) instanceof List<?> ids) {
            ids.forEach(id -> seen.add(String.valueOf(id)));
        }

        var fresh = new ArrayList<ExternalItem>();
        for (var item : items) {
            if (!seen.contains(item.getId()) && fresh.stream().noneMatch(f -> f.getId().equals(item.getId()))) {
                fresh.add(item);
            }
        }

        if (baseline) {
            log.info("First sync of integration {} recorded {} existing items as seen", integration.getId(), fresh.size());
        } else {
            fresh.forEach(item -> emit(integration, item, now));
        }

        var remembered = new ArrayList<String>();
        fresh.forEach(item -> remembered.add(item.getId()));
        remembered.addAll(seen);
        state.put(STATE_SEEN_IDS, new ArrayList<>(remembered.subList(0, Math.min(remembered.size(), properties.getSeenItemMemory()))));

        integration.setSyncState(state);
        integration.setLastSync(now);
        integration.setSyncCount(integration.getSyncCount() + 1);
        integration.setErrorCount(0);
        integration.setLastError(null);
        integration.setNextSync(now.plusSeconds(integration.getSyncFrequencySeconds()));
        integrationRepository.save(integration);

        var emitted = baseline ? 0 : fresh.size();
        log.info("Synced integration {} ({}): {} items fetched, {} new", integration.getId(), integration.getProvider(), items.size(), emitted);
        metricsConfig.recordSync(integration.getProvider(), true);
        metricsConfig.recordIntegrationItems(integration.getProvider(), emitted);
        return OUTCOME_SYNCED;
    }

    private void emit(Integration integration, ExternalItem item, Instant now) {
        var payload = new LinkedHashMap<String, Object>();
        if (item.getData() != null) {
            payload.putAll(item.getData());
        }
        payload.put("item", item.getData());
        payload.put("itemId", item.getId());
        payload.put("integrationId", integration.getId().toString());
        payload.put("provider", integration.getProvider());

        var event = PlatformEvent.builder()
                .tenantId(integration.getTenantId())
                .eventName(integration.getEffectiveEventName())
                .channelId(integration.getTargetChannelId())
                .payload(payload)
                .occurredAt(now)
                .source(PlatformEvent.SOURCE_INTEGRATION)
                .build();
        eventPublisher.publishEvent(event);

        if (integration.getTargetChannelId() != null && integration.getMessageTemplate() != null) {
            postMessage(integration, event, now);
        }
    }

    private void postMessage(Integration integration, PlatformEvent event, Instant now) {
        try {
            var context = ExecutionContext.forEvent(event, "integration", integration.getName(), now);
            var params = new HashMap<String, Object>();
            params.put("channelId", integration.getTargetChannelId());
            params.put("template", templateRenderer.render(integration.getMessageTemplate(), context));
            var result = actionDispatcher.perform(ActionType.SEND_MESSAGE.getCode(), params, context);
            if (!result.isSuccess()) {
                log.warn("Message for integration {} item {} not posted: {}",
                        integration.getId(), event.getPayload().get("itemId"), result.getErrorMessage());
            }
        } catch (ConfigurationException e) {
            log.warn("Message template of integration {} cannot be rendered: {}", integration.getId(), e.getMessage());
        }
    }

    private String onConfigurationError(Integration integration, ConfigurationException e, Instant now) {
        integration.setLastError(e.getMessage());
        integration.setNextSync(now.plusSeconds(properties.getMaxBackoffSeconds()));
        integrationRepository.save(integration);
        log.warn("Integration {} is misconfigured, next attempt at {}: {}", integration.getId(), integration.getNextSync(), e.getMessage());
        metricsConfig.recordSync(integration.getProvider(), false);
        return OUTCOME_CONFIGURATION_ERROR;
    }

    private String onFailure(Integration integration, Exception e, Instant now) {
        var errors = integration.getErrorCount() + 1;
        integration.setErrorCount(errors);
        integration.setLastError(e.getMessage());
        metricsConfig.recordSync(integration.getProvider(), false);

        if (errors >= properties.getMaxConsecutiveFailures()) {
            integration.setActive(false);
            integration.setNextSync(null);
            integrationRepository.save(integration);
            log.error("Integration {} disabled after {} consecutive failures: {}", integration.getId(), errors, e.getMessage());
            publishDisabled(integration, now);
            slackAlertService.sendIntegrationDisabledAlert(integration, errors, e.getMessage());
            metricsConfig.recordAutoDisabled("integration");
            return OUTCOME_DISABLED;
        }

        integration.setNextSync(now.plus(backoff(integration.getSyncFrequencySeconds(), errors)));
        integrationRepository.save(integration);
        log.warn("Sync of integration {} failed ({} consecutive), next attempt at {}: {}",
                integration.getId(), errors, integration.getNextSync(), e.getMessage());
        return OUTCOME_FAILED;
    }

    private void publishDisabled(Integration integration, Instant now) {
        var payload = new LinkedHashMap<String, Object>();
        payload.put("integrationId", integration.getId().toString());
        payload.put("provider", integration.getProvider());
        payload.put("name", integration.getName());
        payload.put("errorCount", integration.getErrorCount());
        payload.put("error", integration.getLastError());
        eventPublisher.publishEvent(PlatformEvent.builder()
                .tenantId(integration.getTenantId())
                .eventName(ERROR_EVENT)
                .payload(payload)
                .occurredAt(now)
                .source(PlatformEvent.SOURCE_ENGINE)
                .build());
    }

    /**
     * frequency * 2^errors, capped at the configured maximum
     */
    Duration backoff(int frequencySeconds, int errors) {
        var max = properties.getMaxBackoffSeconds();
        var seconds = (double) frequencySeconds * Math.pow(2, errors);
        return Duration.ofSeconds((long) Math.min(seconds, max));
    }
}
