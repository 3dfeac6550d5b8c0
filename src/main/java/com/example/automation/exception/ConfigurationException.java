package com.example.automation.exception;

/**
 * A task, rule or integration definition that cannot be evaluated as written:
 * invalid cron expression, missing template variable, unknown condition or action kind,
 * unsupported schema version, unresolvable credential.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
