package com.example.automation.service.rule;

import com.example.automation.domain.model.PlatformEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Feeds events published inside the application (event ingress, inbound webhooks,
 * integration syncs) to the rule engine on the scheduler worker pool.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PlatformEventListener {

    private final AutomationRuleEngine ruleEngine;

    @Async("schedulerWorkerExecutor")
    @EventListener
    public void onPlatformEvent(PlatformEvent event) {
        try {
            var fired = ruleEngine.handleEvent(event);
            log.debug("Event {} from {} fired {} rule(s)", event.getEventName(), event.getSource(), fired.size());
        } catch (Exception e) {
            log.error("Error handling event {} for tenant {}: {}", event.getEventName(), event.getTenantId(), e.getMessage(), e);
        }
    }
}
