package com.example.automation.exception;

import lombok.Getter;

@Getter
public class RateLimitExceededException extends RuntimeException {

    private final long retryAfterMs;

    public RateLimitExceededException(String message, long retryAfterMs) {
        super(message);
        this.retryAfterMs = retryAfterMs;
    }
}
