package com.example.automation.service.execution;

import com.example.automation.config.ExecutionProperties;
import com.example.automation.domain.enums.ActionType;
import com.example.automation.domain.enums.ErrorKind;
import com.example.automation.domain.enums.ExecutionStatus;
import com.example.automation.domain.model.ActionDefinition;
import com.example.automation.domain.model.ActionResult;
import com.example.automation.domain.model.ExecutionContext;
import com.example.automation.exception.ConfigurationException;
import com.example.automation.exception.InvalidStateException;
import com.example.automation.exception.PayloadTooLargeException;
import com.example.automation.exception.ResourceNotFoundException;
import com.example.automation.service.webhook.WebhookDeliveryService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs an ordered action list for a task or a rule.
 * <p>
 * Actions run one after another in declared order. Each dispatcher call is bounded by
 * {@code automation.execution.action-timeout-seconds}; when the bound is hit the caller
 * stops waiting but the call itself is left to finish on the dispatch pool. A failed
 * action marked {@code critical} aborts the rest of the list; any other failure is
 * recorded and the list continues.
 */
@Slf4j
@Service
public class ExecutionEngine {

    private final DefinitionCodec definitionCodec;
    private final TemplateRenderer templateRenderer;
    private final ConditionEvaluator conditionEvaluator;
    private final ActionDispatcher actionDispatcher;
    private final WebhookDeliveryService webhookDeliveryService;
    private final ExecutionProperties properties;
    private final ExecutorService actionDispatchExecutor;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ExecutionEngine(DefinitionCodec definitionCodec, TemplateRenderer templateRenderer, ConditionEvaluator conditionEvaluator,
                           ActionDispatcher actionDispatcher, WebhookDeliveryService webhookDeliveryService, ExecutionProperties properties,
                           @Qualifier("actionDispatchExecutor") ExecutorService actionDispatchExecutor, ObjectMapper objectMapper, Clock clock) {
        this.definitionCodec = definitionCodec;
        this.templateRenderer = templateRenderer;
        this.conditionEvaluator = conditionEvaluator;
        this.actionDispatcher = actionDispatcher;
        this.webhookDeliveryService = webhookDeliveryService;
        this.properties = properties;
        this.actionDispatchExecutor = actionDispatchExecutor;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Decode and evaluate a stored condition list.
     *
     * @throws ConfigurationException if the list cannot be decoded
     */
    public boolean conditionsHold(List<Map<String, Object>> rawConditions, ExecutionContext context) {
        return conditionEvaluator.allMatch(definitionCodec.decodeConditions(rawConditions), context);
    }

    /**
     * Decode and run a stored action list. Never throws; a list that cannot be
     * decoded yields a FAILED result of kind CONFIGURATION.
     */
    public ExecutionResult execute(List<Map<String, Object>> rawActions, ExecutionContext context) {
        List<ActionDefinition> actions;
        try {
            actions = definitionCodec.decodeActions(rawActions);
        } catch (ConfigurationException e) {
            log.warn("Action list for {} cannot be decoded: {}", context.getTriggerSource(), e.getMessage());
            return ExecutionResult.builder()
                    .actionResults(List.of())
                    .status(ExecutionStatus.FAILED)
                    .errorKind(ErrorKind.CONFIGURATION)
                    .errorMessage(e.getMessage())
                    .build();
        }

        var results = new ArrayList<ActionResult>();
        ActionResult firstFailure = null;
        var stop = false;

        for (var i = 0; i < actions.size(); i++) {
            var action = actions.get(i);
            if (action.getType() == ActionType.STOP_PROCESSING) {
                stop = true;
                results.add(ActionResult.builder()
                        .index(i)
                        .type(action.getType().getCode())
                        .success(true)
                        .startedAt(clock.instant())
                        .build());
                continue;
            }

            var result = runAction(i, action, context);
            results.add(result);

            if (!result.isSuccess()) {
                if (firstFailure == null) {
                    firstFailure = result;
                }
                if (action.isCritical()) {
                    log.warn("Critical action #{} ({}) failed, skipping remaining {} action(s)",
                            i, action.getType().getCode(), actions.size() - i - 1);
                    break;
                }
            }
        }

        if (firstFailure == null) {
            return ExecutionResult.builder()
                    .actionResults(results)
                    .status(ExecutionStatus.COMPLETED)
                    .stopProcessing(stop)
                    .build();
        }
        return ExecutionResult.builder()
                .actionResults(results)
                .status(ExecutionStatus.FAILED)
                .errorKind(firstFailure.getErrorKind())
                .errorMessage("Action #" + firstFailure.getIndex() + " (" + firstFailure.getType() + "): " + firstFailure.getError())
                .stopProcessing(stop)
                .build();
    }

    private ActionResult runAction(int index, ActionDefinition action, ExecutionContext context) {
        var startedAt = clock.instant();
        DispatchResult outcome;
        try {
            DefinitionCodec.requireParams(action.getType().getRequiredParams(), action.getParams(), action.getType().getCode());
            var params = templateRenderer.renderParams(action.getParams(), context);
            outcome = switch (action.getType().getRoute()) {
                case WEBHOOK -> enqueueWebhook(params, action.getParams().get("payloadTemplate"), context);
                case DISPATCHER -> dispatchWithTimeout(action.getType(), params, context);
                case CONTROL -> DispatchResult.success();
            };
        } catch (ConfigurationException e) {
            outcome = DispatchResult.failure(e.getMessage(), ErrorKind.CONFIGURATION);
        } catch (RuntimeException e) {
            log.error("Unexpected error running action #{} ({}): {}", index, action.getType().getCode(), e.getMessage(), e);
            outcome = DispatchResult.transientFailure(e.getClass().getSimpleName() + ": " + e.getMessage());
        }

        var duration = clock.instant().toEpochMilli() - startedAt.toEpochMilli();
        if (!outcome.isSuccess()) {
            log.warn("Action #{} ({}) failed [{}]: {}", index, action.getType().getCode(), outcome.getErrorKind(), outcome.getErrorMessage());
        }
        return ActionResult.builder()
                .index(index)
                .type(action.getType().getCode())
                .success(outcome.isSuccess())
                .critical(action.isCritical())
                .detail(outcome.getDetail())
                .error(outcome.getErrorMessage())
                .errorKind(outcome.isSuccess() ? null : outcome.getErrorKind())
                .startedAt(startedAt)
                .durationMs(duration)
                .build();
    }

    private DispatchResult dispatchWithTimeout(ActionType type, Map<String, Object> params, ExecutionContext context) {
        var timeoutSeconds = properties.getActionTimeoutSeconds();
        var future = CompletableFuture.supplyAsync(() -> actionDispatcher.perform(type.getCode(), params, context), actionDispatchExecutor);
        try {
            var result = future.get(timeoutSeconds, TimeUnit.SECONDS);
            return result != null ? result : DispatchResult.transientFailure("Dispatcher returned no result");
        } catch (TimeoutException e) {
            // the call keeps running on the dispatch pool; only this run stops waiting
            return DispatchResult.transientFailure("Action timed out after " + timeoutSeconds + "s");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return DispatchResult.transientFailure("Interrupted while waiting for dispatcher");
        } catch (ExecutionException e) {
            var cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof ConfigurationException configurationException) {
                throw configurationException;
            }
            return DispatchResult.transientFailure(cause.getClass().getSimpleName() + ": " + cause.getMessage());
        }
    }

    /**
     * @param payloadTemplate the unrendered template; its placeholders are rendered here as JSON
     */
    private DispatchResult enqueueWebhook(Map<String, Object> params, Object payloadTemplate, ExecutionContext context) {
        UUID webhookId;
        try {
            webhookId = UUID.fromString(String.valueOf(params.get("webhookId")));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("send_webhook: webhookId is not a UUID: " + params.get("webhookId"), e);
        }
        var eventType = String.valueOf(params.get("eventType"));
        var payload = payloadTemplate != null
                ? renderPayload(payloadTemplate, context)
                : defaultPayload(eventType, context);

        try {
            var delivery = webhookDeliveryService.enqueue(context.getTenantId(), webhookId, eventType, payload, null);
            return DispatchResult.success("delivery " + delivery.getDeliveryId());
        } catch (ResourceNotFoundException | InvalidStateException e) {
            return DispatchResult.failure(e.getMessage(), ErrorKind.CONFIGURATION);
        } catch (PayloadTooLargeException e) {
            return DispatchResult.permanentFailure(e.getMessage());
        }
    }

    @SuppressWarnings("unchecked")
    private String renderPayload(Object payloadTemplate, ExecutionContext context) {
        if (payloadTemplate instanceof Map<?, ?> structured) {
            return writeJson(templateRenderer.renderParams((Map<String, Object>) structured, context));
        }
        var rendered = templateRenderer.renderJson(String.valueOf(payloadTemplate), context);
        try {
            objectMapper.readTree(rendered);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("send_webhook: payloadTemplate does not render to valid JSON: " + e.getOriginalMessage(), e);
        }
        return rendered;
    }

    private String defaultPayload(String eventType, ExecutionContext context) {
        var body = new LinkedHashMap<String, Object>();
        body.put("event", eventType);
        body.put("tenantId", context.getTenantId());
        body.put("triggerSource", context.getTriggerSource());
        body.put("userId", context.getUserId());
        body.put("channelId", context.getChannelId());
        body.put("payload", context.getVariables().get("payload"));
        body.put("timestamp", context.getNow().toString());
        return writeJson(body);
    }

    private String writeJson(Map<String, Object> body) {
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("send_webhook: payload cannot be serialized: " + e.getOriginalMessage(), e);
        }
    }
}
