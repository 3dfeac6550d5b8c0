package com.example.automation.domain.model;

import com.example.automation.domain.enums.ConditionType;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Decoded condition entry.
 */
@Value
@Builder
public class ConditionDefinition {
    ConditionType type;
    int schemaVersion;
    Map<String, Object> params;
}
