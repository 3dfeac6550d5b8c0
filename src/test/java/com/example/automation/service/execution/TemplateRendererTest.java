package com.example.automation.service.execution;

import com.example.automation.domain.model.ExecutionContext;
import com.example.automation.domain.model.PlatformEvent;
import com.example.automation.exception.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TemplateRenderer Tests")
class TemplateRendererTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private final TemplateRenderer renderer = new TemplateRenderer();

    private static ExecutionContext eventContext(Map<String, Object> payload) {
        var event = PlatformEvent.builder()
                .tenantId("guild-1")
                .eventName("member_join")
                .userId("u-42")
                .channelId("c-7")
                .payload(payload)
                .occurredAt(NOW)
                .build();
        return ExecutionContext.forEvent(event, "rule", "Welcome", NOW);
    }

    @Test
    @DisplayName("Should substitute built-in and payload variables")
    void shouldRenderVariables() {
        // Given
        var context = eventContext(Map.of("username", "ada", "profile", Map.of("level", 3)));

        // When
        var rendered = renderer.render("Welcome {user.mention} ({username}, level {profile.level}) to {guild} in {channel} by {rule.name}", context);

        // Then
        assertThat(rendered).isEqualTo("Welcome <@u-42> (ada, level 3) to guild-1 in c-7 by Welcome");
    }

    @Test
    @DisplayName("Should escape quotes and backslashes when rendering JSON")
    void shouldEscapeValuesForJson() {
        // Given
        var context = eventContext(Map.of("username", "a\"b", "path", "C:\\temp"));

        // When
        var rendered = renderer.renderJson("{\"name\":\"{username}\",\"dir\":\"{path}\"}", context);

        // Then
        assertThat(rendered).isEqualTo("{\"name\":\"a\\\"b\",\"dir\":\"C:\\\\temp\"}");
    }

    @Test
    @DisplayName("Should fail on a missing variable instead of rendering it empty")
    void shouldRejectMissingVariable() {
        var context = eventContext(Map.of());

        assertThatThrownBy(() -> renderer.render("Hello {nickname}", context))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("nickname");
    }

    @Test
    @DisplayName("Should leave text without placeholders and JSON-like braces alone")
    void shouldLeavePlainTextAlone() {
        var context = eventContext(Map.of());

        assertThat(renderer.render("no variables here", context)).isEqualTo("no variables here");
        assertThat(renderer.render("{\"a\": 1}", context)).isEqualTo("{\"a\": 1}");
    }

    @Test
    @DisplayName("Should render nested params")
    void shouldRenderNestedParams() {
        // Given
        var context = ExecutionContext.forSchedule("guild-1", "c-1", "Daily digest", "schedule", NOW);
        Map<String, Object> params = Map.of(
                "template", "{task.name} at {timestamp}",
                "embed", Map.of("fields", List.of("{tenant}", 5)));

        // When
        var rendered = renderer.renderParams(params, context);

        // Then
        assertThat(rendered).containsEntry("template", "Daily digest at 2024-05-01T12:00:00Z");
        assertThat(rendered.get("embed")).isEqualTo(Map.of("fields", List.of("guild-1", 5)));
    }
}
