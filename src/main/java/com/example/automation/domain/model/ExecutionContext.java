package com.example.automation.domain.model;

import lombok.Getter;

import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Variables visible to conditions and templates during one run.
 * <p>
 * Keys are flat, dotted names such as {@code user.id} or {@code channel}. Top level
 * payload entries are copied in under their own name and, in full, under {@code payload}.
 */
@Getter
public class ExecutionContext {

    private final String tenantId;
    private final String userId;
    private final String channelId;
    private final String triggerSource;
    private final Instant now;
    private final Map<String, Object> variables;

    private ExecutionContext(String tenantId, String userId, String channelId, String triggerSource, Instant now, Map<String, Object> variables) {
        this.tenantId = tenantId;
        this.userId = userId;
        this.channelId = channelId;
        this.triggerSource = triggerSource;
        this.now = now;
        this.variables = Collections.unmodifiableMap(variables);
    }

    public static ExecutionContext forEvent(PlatformEvent event, String ownerKey, String ownerName, Instant now) {
        var vars = new HashMap<String, Object>();
        if (event.getPayload() != null) {
            event.getPayload().forEach((key, value) -> {
                if (key != null && value != null) {
                    vars.put(key, value);
                }
            });
            vars.put("payload", event.getPayload());
        }
        putCommon(vars, event.getTenantId(), event.getUserId(), event.getChannelId(), now);
        vars.put("event", event.getEventName());
        vars.put(ownerKey + ".name", ownerName);
        return new ExecutionContext(event.getTenantId(), event.getUserId(), event.getChannelId(), event.getEventName(), now, vars);
    }

    public static ExecutionContext forSchedule(String tenantId, String channelId, String taskName, String triggerSource, Instant now) {
        var vars = new HashMap<String, Object>();
        putCommon(vars, tenantId, null, channelId, now);
        vars.put("task.name", taskName);
        return new ExecutionContext(tenantId, null, channelId, triggerSource, now, vars);
    }

    private static void putCommon(Map<String, Object> vars, String tenantId, String userId, String channelId, Instant now) {
        vars.put("tenant", tenantId);
        vars.put("guild", tenantId);
        vars.put("timestamp", now.toString());
        if (userId != null) {
            vars.put("user", userId);
            vars.put("user.id", userId);
            vars.put("user.mention", "<@" + userId + ">");
        }
        if (channelId != null) {
            vars.put("channel", channelId);
            vars.put("channel.id", channelId);
        }
    }

    /**
     * Look up a variable by flat key, falling back to a dotted path into nested maps and
     * then to the same path inside the payload (built-ins such as {@code user} shadow
     * payload entries of the same name).
     */
    public Object lookup(String name) {
        if (variables.containsKey(name)) {
            return variables.get(name);
        }
        var found = walk(variables, name);
        if (found == null && variables.get("payload") instanceof Map<?, ?> payload) {
            found = walk(payload, name);
        }
        return found;
    }

    private static Object walk(Map<?, ?> root, String path) {
        var parts = path.split("\\.");
        Object current = root.get(parts[0]);
        for (var i = 1; i < parts.length && current != null; i++) {
            current = current instanceof Map<?, ?> map ? map.get(parts[i]) : null;
        }
        return current;
    }
}
