package com.example.automation.mapper;

import com.example.automation.domain.entity.AutomationRule;
import com.example.automation.domain.entity.Integration;
import com.example.automation.domain.entity.RecurringSchedulePattern;
import com.example.automation.domain.entity.ScheduledTask;
import com.example.automation.domain.entity.TaskExecutionRecord;
import com.example.automation.domain.entity.Webhook;
import com.example.automation.domain.entity.WebhookDelivery;
import com.example.automation.dto.DeliveryResponse;
import com.example.automation.dto.ExecutionRecordResponse;
import com.example.automation.dto.IntegrationResponse;
import com.example.automation.dto.RuleResponse;
import com.example.automation.dto.SchedulePatternResponse;
import com.example.automation.dto.TaskResponse;
import com.example.automation.dto.WebhookResponse;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;

import java.util.List;

/**
 * MapStruct mapper for converting entities to response DTOs
 */
@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface AutomationMapper {

    /**
     * Patterns are attached separately on detail requests
     */
    @Mapping(target = "patterns", ignore = true)
    TaskResponse toTaskResponse(ScheduledTask task);

    SchedulePatternResponse toPatternResponse(RecurringSchedulePattern pattern);

    List<SchedulePatternResponse> toPatternResponses(List<RecurringSchedulePattern> patterns);

    ExecutionRecordResponse toRecordResponse(TaskExecutionRecord record);

    RuleResponse toRuleResponse(AutomationRule rule);

    IntegrationResponse toIntegrationResponse(Integration integration);

    @Mapping(target = "signed", expression = "java(webhook.hasSecret())")
    WebhookResponse toWebhookResponse(Webhook webhook);

    DeliveryResponse toDeliveryResponse(WebhookDelivery delivery);
}
