package com.example.automation.service.execution;

import com.example.automation.domain.model.ExecutionContext;

import java.util.Map;

/**
 * Performs platform-side actions (send a message, assign a role, ...).
 * <p>
 * Implementations report failures as a {@link DispatchResult} and do not throw.
 */
public interface ActionDispatcher {

    /**
     * @param actionType action code, e.g. {@code send_message}
     * @param params     parameters with templates already rendered
     * @param context    the run's context, for tenant, user and channel ids
     */
    DispatchResult perform(String actionType, Map<String, Object> params, ExecutionContext context);
}
