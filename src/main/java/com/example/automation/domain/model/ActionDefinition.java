package com.example.automation.domain.model;

import com.example.automation.domain.enums.ActionType;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Decoded action entry. {@code critical} actions abort the rest of the list when they fail.
 */
@Value
@Builder
public class ActionDefinition {
    ActionType type;
    int schemaVersion;
    boolean critical;
    Map<String, Object> params;
}
