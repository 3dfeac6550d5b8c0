package com.example.automation.service.execution;

import com.example.automation.domain.model.ConditionDefinition;
import com.example.automation.domain.model.ExecutionContext;
import com.example.automation.exception.ConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Evaluates a conjunctive condition list against an execution context.
 * <p>
 * Facts about the acting user and message are read from event variables:
 * {@code user.roles} (list of role ids), {@code user.joined_at} (ISO instant)
 * and {@code message.content} (falling back to {@code content}).
 */
@Slf4j
@Component
public class ConditionEvaluator {

    public boolean allMatch(List<ConditionDefinition> conditions, ExecutionContext context) {
        for (var condition : conditions) {
            if (!matches(condition, context)) {
                log.debug("Condition {} not met", condition.getType().getCode());
                return false;
            }
        }
        return true;
    }

    public boolean matches(ConditionDefinition condition, ExecutionContext context) {
        var params = condition.getParams();
        return switch (condition.getType()) {
            case USER_HAS_ROLE -> userHasRole(context, String.valueOf(params.get("roleId")));
            case CHANNEL_IS -> Objects.equals(context.getChannelId(), String.valueOf(params.get("channelId")));
            case MESSAGE_CONTAINS -> messageContains(context, String.valueOf(params.get("text")));
            case USER_JOINED_RECENTLY -> userJoinedRecently(context, params.get("days"));
            case TIME_BETWEEN -> timeBetween(context,
                    String.valueOf(params.get("start")),
                    String.valueOf(params.get("end")),
                    (String) params.get("timezone"));
            case PAYLOAD_EQUALS -> payloadEquals(context, String.valueOf(params.get("field")), params.get("value"));
        };
    }

    private boolean userHasRole(ExecutionContext context, String roleId) {
        var roles = context.lookup("user.roles");
        if (roles instanceof Collection<?> collection) {
            return collection.stream().anyMatch(role -> roleId.equals(String.valueOf(role)));
        }
        return false;
    }

    private boolean messageContains(ExecutionContext context, String text) {
        var content = context.lookup("message.content");
        if (content == null) {
            content = context.lookup("content");
        }
        if (content == null) {
            return false;
        }
        return String.valueOf(content).toLowerCase(Locale.ROOT).contains(text.toLowerCase(Locale.ROOT));
    }

    private boolean userJoinedRecently(ExecutionContext context, Object daysParam) {
        var joinedAt = context.lookup("user.joined_at");
        if (joinedAt == null) {
            return false;
        }
        long days;
        try {
            days = daysParam instanceof Number number ? number.longValue() : Long.parseLong(String.valueOf(daysParam));
        } catch (NumberFormatException e) {
            throw new ConfigurationException("user_joined_recently: days is not a number: " + daysParam, e);
        }
        try {
            var joined = Instant.parse(String.valueOf(joinedAt));
            return !joined.isBefore(context.getNow().minus(Duration.ofDays(days)));
        } catch (DateTimeParseException e) {
            log.warn("Unparseable user.joined_at value '{}'", joinedAt);
            return false;
        }
    }

    /**
     * Inclusive start, exclusive end. A window whose end is before its start wraps midnight.
     */
    boolean timeBetween(ExecutionContext context, String start, String end, String timezone) {
        LocalTime from;
        LocalTime to;
        ZoneId zone;
        try {
            from = LocalTime.parse(start);
            to = LocalTime.parse(end);
            zone = ZoneId.of(timezone != null ? timezone : "UTC");
        } catch (DateTimeException e) {
            throw new ConfigurationException("time_between: " + e.getMessage(), e);
        }

        var local = context.getNow().atZone(zone).toLocalTime();
        if (!from.isAfter(to)) {
            return !local.isBefore(from) && local.isBefore(to);
        }
        return !local.isBefore(from) || local.isBefore(to);
    }

    private boolean payloadEquals(ExecutionContext context, String field, Object expected) {
        var actual = context.lookup("payload." + field);
        if (actual == null) {
            actual = context.lookup(field);
        }
        if (actual == null || expected == null) {
            return actual == expected;
        }
        return String.valueOf(actual).equals(String.valueOf(expected));
    }
}
