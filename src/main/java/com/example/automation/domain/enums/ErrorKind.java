package com.example.automation.domain.enums;

/**
 * Classification of a failure, used to decide retries and whether a failure counts toward self-disable.
 */
public enum ErrorKind {

    /**
     * Timeout, 5xx, rate limited: worth retrying
     */
    TRANSIENT,

    /**
     * 4xx other than rate limit, malformed payload: never retried
     */
    PERMANENT,

    /**
     * Invalid cron, missing template variable, unknown kind: needs the owner to fix the definition
     */
    CONFIGURATION
}
