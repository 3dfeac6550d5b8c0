package com.example.automation.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * What causes a scheduled task to fire.
 */
@Getter
@RequiredArgsConstructor
public enum TriggerType {

    /**
     * Five or six field cron expression, optionally combined with recurring patterns
     */
    CRON("cron", true),

    /**
     * Fixed number of seconds between fires, aligned to the first scheduled instant
     */
    INTERVAL("interval", true),

    /**
     * A single absolute instant
     */
    ONCE("once", true),

    /**
     * A named platform event; has no clock instant
     */
    EVENT("event", false);

    private final String code;

    /**
     * Whether next_execution is driven by the clock
     */
    private final boolean clockDriven;

    public static TriggerType fromCode(String code) {
        for (var type : values()) {
            if (type.getCode().equalsIgnoreCase(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown trigger type: " + code);
    }
}
