package com.example.automation.service.execution;

import com.example.automation.domain.enums.ConditionType;
import com.example.automation.domain.model.ConditionDefinition;
import com.example.automation.domain.model.ExecutionContext;
import com.example.automation.domain.model.PlatformEvent;
import com.example.automation.exception.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ConditionEvaluator Tests")
class ConditionEvaluatorTest {

    private final ConditionEvaluator evaluator = new ConditionEvaluator();

    private static ExecutionContext context(Instant now, Map<String, Object> payload) {
        var event = PlatformEvent.builder()
                .tenantId("guild-1")
                .eventName("message_create")
                .userId("u-1")
                .channelId("general")
                .payload(payload)
                .occurredAt(now)
                .build();
        return ExecutionContext.forEvent(event, "rule", "test", now);
    }

    private static ConditionDefinition condition(ConditionType type, Map<String, Object> params) {
        return ConditionDefinition.builder().type(type).schemaVersion(1).params(params).build();
    }

    @Test
    @DisplayName("Should require every condition to hold")
    void shouldBeConjunctive() {
        // Given
        var ctx = context(Instant.parse("2024-01-01T10:00:00Z"), Map.of("content", "Hello World"));
        var inChannel = condition(ConditionType.CHANNEL_IS, Map.of("channelId", "general"));
        var containsHello = condition(ConditionType.MESSAGE_CONTAINS, Map.of("text", "hello"));
        var containsBye = condition(ConditionType.MESSAGE_CONTAINS, Map.of("text", "bye"));

        // When / Then
        assertThat(evaluator.allMatch(List.of(inChannel, containsHello), ctx)).isTrue();
        assertThat(evaluator.allMatch(List.of(inChannel, containsBye), ctx)).isFalse();
        assertThat(evaluator.allMatch(List.of(), ctx)).isTrue();
    }

    @Test
    @DisplayName("Should read roles from the user object in the payload")
    void shouldCheckUserRoles() {
        var ctx = context(Instant.now(), Map.of("user", Map.of("roles", List.of("mod", "vip"))));

        assertThat(evaluator.matches(condition(ConditionType.USER_HAS_ROLE, Map.of("roleId", "vip")), ctx)).isTrue();
        assertThat(evaluator.matches(condition(ConditionType.USER_HAS_ROLE, Map.of("roleId", "admin")), ctx)).isFalse();
    }

    @Test
    @DisplayName("Should compare join date against the window")
    void shouldCheckJoinedRecently() {
        var now = Instant.parse("2024-01-10T00:00:00Z");
        var recent = context(now, Map.of("user.joined_at", "2024-01-08T00:00:00Z"));
        var old = context(now, Map.of("user.joined_at", "2023-12-01T00:00:00Z"));
        var joinedWithinWeek = condition(ConditionType.USER_JOINED_RECENTLY, Map.of("days", 7));

        assertThat(evaluator.matches(joinedWithinWeek, recent)).isTrue();
        assertThat(evaluator.matches(joinedWithinWeek, old)).isFalse();
    }

    @Test
    @DisplayName("Should compare payload fields as strings")
    void shouldCheckPayloadEquals() {
        var ctx = context(Instant.now(), Map.of("action", "opened", "count", 3));

        assertThat(evaluator.matches(condition(ConditionType.PAYLOAD_EQUALS, Map.of("field", "action", "value", "opened")), ctx)).isTrue();
        assertThat(evaluator.matches(condition(ConditionType.PAYLOAD_EQUALS, Map.of("field", "count", "value", "3")), ctx)).isTrue();
        assertThat(evaluator.matches(condition(ConditionType.PAYLOAD_EQUALS, Map.of("field", "action", "value", "closed")), ctx)).isFalse();
    }

    @Nested
    @DisplayName("time_between")
    class TimeBetweenTests {

        @Test
        @DisplayName("Should include the start and exclude the end")
        void shouldUseHalfOpenWindow() {
            assertThat(evaluator.timeBetween(context(Instant.parse("2024-01-01T09:00:00Z"), Map.of()), "09:00", "17:00", "UTC")).isTrue();
            assertThat(evaluator.timeBetween(context(Instant.parse("2024-01-01T17:00:00Z"), Map.of()), "09:00", "17:00", "UTC")).isFalse();
        }

        @Test
        @DisplayName("Should wrap around midnight when end is before start")
        void shouldWrapMidnight() {
            assertThat(evaluator.timeBetween(context(Instant.parse("2024-01-01T23:30:00Z"), Map.of()), "22:00", "06:00", "UTC")).isTrue();
            assertThat(evaluator.timeBetween(context(Instant.parse("2024-01-01T05:59:00Z"), Map.of()), "22:00", "06:00", "UTC")).isTrue();
            assertThat(evaluator.timeBetween(context(Instant.parse("2024-01-01T12:00:00Z"), Map.of()), "22:00", "06:00", "UTC")).isFalse();
        }

        @Test
        @DisplayName("Should evaluate in the given timezone")
        void shouldUseTimezone() {
            // 14:00 UTC is 09:00 in New York in January
            var ctx = context(Instant.parse("2024-01-01T14:00:00Z"), Map.of());

            assertThat(evaluator.timeBetween(ctx, "09:00", "10:00", "America/New_York")).isTrue();
        }

        @Test
        @DisplayName("Should reject an unparseable time")
        void shouldRejectBadTime() {
            var ctx = context(Instant.now(), Map.of());

            assertThatThrownBy(() -> evaluator.timeBetween(ctx, "9am", "10:00", "UTC"))
                    .isInstanceOf(ConfigurationException.class);
        }
    }
}
