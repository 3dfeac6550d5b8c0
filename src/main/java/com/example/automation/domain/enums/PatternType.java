package com.example.automation.domain.enums;

/**
 * Shape of a recurring schedule pattern. Governs which masks are consulted.
 */
public enum PatternType {

    /**
     * Every day, at each time slot
     */
    DAILY,

    /**
     * Days listed in days_of_week
     */
    WEEKLY,

    /**
     * Days listed in days_of_month
     */
    MONTHLY,

    /**
     * Days listed in days_of_month, restricted to months
     */
    YEARLY,

    /**
     * Every non-empty mask must match
     */
    CUSTOM
}
