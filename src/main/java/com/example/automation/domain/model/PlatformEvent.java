package com.example.automation.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * An event delivered to the rule engine, from the platform, an integration sync or an inbound webhook.
 */
@Value
@Builder(toBuilder = true)
public class PlatformEvent {

    public static final String SOURCE_PLATFORM = "platform";
    public static final String SOURCE_INTEGRATION = "integration";
    public static final String SOURCE_WEBHOOK = "webhook";
    public static final String SOURCE_ENGINE = "engine";

    String tenantId;
    String eventName;
    String userId;
    String channelId;
    Map<String, Object> payload;
    Instant occurredAt;
    String source;
}
