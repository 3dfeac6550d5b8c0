package com.example.automation.service.trigger;

import com.example.automation.exception.ConfigurationException;
import org.springframework.scheduling.support.CronExpression;

/**
 * Parsing helpers for user supplied cron expressions.
 * Users write the classic five field form; Spring expects a leading seconds field.
 */
public final class CronExpressions {

    private static final int FIVE_FIELDS = 5;
    private static final int SIX_FIELDS = 6;

    private CronExpressions() {
    }

    /**
     * Convert a five field expression to six fields and check that it parses.
     *
     * @throws ConfigurationException if the expression is empty or invalid
     */
    public static String normalize(String input) {
        if (input == null || input.isBlank()) {
            throw new ConfigurationException("Cron expression cannot be empty");
        }

        var trimmed = input.trim();
        var parts = trimmed.split("\\s+");

        String sixFieldCron;
        if (parts.length == FIVE_FIELDS) {
            sixFieldCron = "0 " + trimmed;
        } else if (parts.length == SIX_FIELDS) {
            sixFieldCron = trimmed;
        } else {
            throw new ConfigurationException("Invalid cron expression '" + trimmed + "': expected 5 or 6 fields, got " + parts.length);
        }

        try {
            CronExpression.parse(sixFieldCron);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid cron expression '" + trimmed + "': " + e.getMessage(), e);
        }

        return sixFieldCron;
    }

    public static CronExpression parse(String input) {
        return CronExpression.parse(normalize(input));
    }
}
