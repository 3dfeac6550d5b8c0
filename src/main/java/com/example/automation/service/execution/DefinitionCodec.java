package com.example.automation.service.execution;

import com.example.automation.domain.enums.ActionType;
import com.example.automation.domain.enums.ConditionType;
import com.example.automation.domain.model.ActionDefinition;
import com.example.automation.domain.model.ConditionDefinition;
import com.example.automation.exception.ConfigurationException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Decodes the stored JSON condition and action lists into typed definitions.
 * <p>
 * Stored shape: {@code {"type": "send_message", "schemaVersion": 1, "critical": false, "params": {...}}}.
 * Anything this version does not understand is rejected rather than skipped.
 */
@Component
public class DefinitionCodec {

    public static final int SUPPORTED_SCHEMA_VERSION = 1;

    public List<ConditionDefinition> decodeConditions(List<Map<String, Object>> raw) {
        var result = new ArrayList<ConditionDefinition>();
        if (raw == null) {
            return result;
        }
        for (var i = 0; i < raw.size(); i++) {
            var entry = raw.get(i);
            var label = "condition #" + (i + 1);
            var type = parseType(entry, label, ConditionType::fromCode);
            var params = params(entry, label);
            requireParams(type.getRequiredParams(), params, label + " (" + type.getCode() + ")");
            result.add(ConditionDefinition.builder()
                    .type(type)
                    .schemaVersion(schemaVersion(entry, label))
                    .params(params)
                    .build());
        }
        return result;
    }

    /**
     * Decode an action list. Missing required parameters are not checked here so that
     * one bad action fails on its own during execution instead of rejecting the whole list.
     */
    public List<ActionDefinition> decodeActions(List<Map<String, Object>> raw) {
        var result = new ArrayList<ActionDefinition>();
        if (raw == null) {
            return result;
        }
        for (var i = 0; i < raw.size(); i++) {
            var entry = raw.get(i);
            var label = "action #" + (i + 1);
            var type = parseType(entry, label, ActionType::fromCode);
            result.add(ActionDefinition.builder()
                    .type(type)
                    .schemaVersion(schemaVersion(entry, label))
                    .critical(Boolean.TRUE.equals(entry.get("critical")))
                    .params(params(entry, label))
                    .build());
        }
        return result;
    }

    /**
     * Validate definitions up front, used when a task or rule is created.
     */
    public void validate(List<Map<String, Object>> conditions, List<Map<String, Object>> actions) {
        decodeConditions(conditions);
        var decoded = decodeActions(actions);
        for (var i = 0; i < decoded.size(); i++) {
            var action = decoded.get(i);
            requireParams(action.getType().getRequiredParams(), action.getParams(),
                    "action #" + (i + 1) + " (" + action.getType().getCode() + ")");
        }
    }

    static void requireParams(List<String> required, Map<String, Object> params, String label) {
        for (var name : required) {
            var value = params.get(name);
            if (value == null || (value instanceof String s && s.isBlank())) {
                throw new ConfigurationException(label + " is missing parameter '" + name + "'");
            }
        }
    }

    private static <T> T parseType(Map<String, Object> entry, String label, java.util.function.Function<String, T> parser) {
        if (entry == null) {
            throw new ConfigurationException(label + " is empty");
        }
        var type = entry.get("type");
        if (!(type instanceof String code) || code.isBlank()) {
            throw new ConfigurationException(label + " has no type");
        }
        try {
            return parser.apply(code);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(label + ": " + e.getMessage(), e);
        }
    }

    private static int schemaVersion(Map<String, Object> entry, String label) {
        var raw = entry.get("schemaVersion");
        if (raw == null) {
            return SUPPORTED_SCHEMA_VERSION;
        }
        if (!(raw instanceof Number number)) {
            throw new ConfigurationException(label + " has a non-numeric schemaVersion");
        }
        var version = number.intValue();
        if (version < 1 || version > SUPPORTED_SCHEMA_VERSION) {
            throw new ConfigurationException(label + " uses unsupported schemaVersion " + version);
        }
        return version;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> params(Map<String, Object> entry, String label) {
        var raw = entry.get("params");
        if (raw == null) {
            return Map.of();
        }
        if (!(raw instanceof Map<?, ?>)) {
            throw new ConfigurationException(label + " params must be an object");
        }
        return new HashMap<>((Map<String, Object>) raw);
    }
}
