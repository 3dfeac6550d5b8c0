package com.example.automation.service.ratelimit;

import lombok.Value;

/**
 * Result of a token request. {@code waitMs} is how long until a token is expected to be available.
 */
@Value
public class RateLimitDecision {

    boolean allowed;
    long waitMs;

    public static RateLimitDecision allow() {
        return new RateLimitDecision(true, 0);
    }

    public static RateLimitDecision deny(long waitMs) {
        return new RateLimitDecision(false, Math.max(waitMs, 1));
    }
}
