package com.example.automation.service.alert;

import com.example.automation.config.SlackProperties;
import com.example.automation.domain.entity.AutomationRule;
import com.example.automation.domain.entity.Integration;
import com.example.automation.domain.entity.ScheduledTask;
import com.example.automation.domain.entity.WebhookDelivery;
import com.slack.api.Slack;
import com.slack.api.model.Attachment;
import com.slack.api.model.Field;
import com.slack.api.webhook.Payload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Sends operator alerts to Slack when something switches itself off or gives up.
 * <p>
 * All methods run asynchronously and never fail the caller.
 */
@Slf4j
@Service
public class SlackAlertService {

    private final SlackProperties slackProperties;
    private final Slack slack;

    @Value("${spring.application.name:automation-engine}")
    private String applicationName;

    public SlackAlertService(SlackProperties slackProperties) {
        this(slackProperties, Slack.getInstance());
    }

    SlackAlertService(SlackProperties slackProperties, Slack slack) {
        this.slackProperties = slackProperties;
        this.slack = slack;
    }

    @Async
    public void sendTaskDisabledAlert(ScheduledTask task, int failures, String lastError) {
        send("Task " + task.getId(), ":rotating_light: *Scheduled Task Disabled After Repeated Failures*",
                task.getName(), "/tasks/" + task.getId(),
                List.of(
                        field("Task ID", task.getId().toString(), true),
                        field("Tenant", task.getTenantId(), true),
                        field("Trigger", task.getTriggerType().getCode(), true),
                        field("Consecutive Failures", String.valueOf(failures), true),
                        field("Last Error", "```" + truncate(lastError, 400) + "```", false)
                ),
                "Fix the task definition and re-activate it");
    }

    @Async
    public void sendRuleDisabledAlert(AutomationRule rule, int failures, String lastError) {
        send("Rule " + rule.getId(), ":rotating_light: *Automation Rule Disabled After Repeated Failures*",
                rule.getName(), "/rules/" + rule.getId(),
                List.of(
                        field("Rule ID", rule.getId().toString(), true),
                        field("Tenant", rule.getTenantId(), true),
                        field("Trigger Event", rule.getTriggerEvent(), true),
                        field("Consecutive Failures", String.valueOf(failures), true),
                        field("Last Error", "```" + truncate(lastError, 400) + "```", false)
                ),
                "Fix the rule and re-activate it");
    }

    @Async
    public void sendIntegrationDisabledAlert(Integration integration, int failures, String lastError) {
        send("Integration " + integration.getId(), ":electric_plug: *Integration Disabled After Repeated Sync Failures*",
                integration.getName() + " (" + integration.getProvider() + ")", "/integrations/" + integration.getId(),
                List.of(
                        field("Integration ID", integration.getId().toString(), true),
                        field("Tenant", integration.getTenantId(), true),
                        field("Failures", String.valueOf(failures), true),
                        field("Last Error", "```" + truncate(lastError, 400) + "```", false)
                ),
                "Check credentials and provider settings, then re-activate");
    }

    @Async
    public void sendDeliveryFailedAlert(WebhookDelivery delivery, String reason) {
        send("Delivery " + delivery.getDeliveryId(), ":warning: *Webhook Delivery Failed Permanently*",
                delivery.getEventType() + " -> " + delivery.getTargetUrl(), "/webhooks/" + delivery.getWebhookId(),
                List.of(
                        field("Delivery ID", delivery.getDeliveryId(), true),
                        field("Tenant", delivery.getTenantId(), true),
                        field("Attempts", String.valueOf(delivery.getAttemptNumber()), true),
                        field("Error", truncate(reason, 300), false)
                ),
                "Redeliver once the endpoint is healthy");
    }

    private void send(String subject, String text, String title, String path, List<Field> fields, String hint) {
        if (!slackProperties.isEnabled() || slackProperties.getWebhookUrl() == null || slackProperties.getWebhookUrl().isBlank()) {
            log.warn("Slack alerting is disabled or webhook URL not configured. Alert for {} not sent", subject);
            return;
        }

        try {
            var payload = Payload.builder()
                    .channel(slackProperties.getChannel())
                    .username(applicationName)
                    .text(text)
                    .attachments(List.of(
                            Attachment.builder()
                                    .color("danger")
                                    .title(title)
                                    .titleLink(slackProperties.getDashboardBaseUrl() + path)
                                    .fields(new ArrayList<>(fields))
                                    .footer(applicationName + " | " + hint)
                                    .ts(String.valueOf(Instant.now().getEpochSecond()))
                                    .build()
                    ))
                    .build();

            var response = slack.send(slackProperties.getWebhookUrl(), payload);
            if (response.getCode() != 200) {
                log.error("Failed to send Slack alert for {}. Response code: {}, body: {}", subject, response.getCode(), response.getBody());
            } else {
                log.info("Slack alert sent for {}", subject);
            }
        } catch (IOException | RuntimeException e) {
            log.error("Error sending Slack alert for {}: {}", subject, e.getMessage(), e);
        }
    }

    private static Field field(String title, String value, boolean shortField) {
        return Field.builder()
                .title(title)
                .value(value != null ? value : "")
                .valueShortEnough(shortField)
                .build();
    }

    private static String truncate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength - 3) + "...";
    }
}
