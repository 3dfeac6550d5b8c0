package com.example.automation.service.webhook;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with jitter for delivery retries.
 */
public final class RetryBackoff {

    private RetryBackoff() {
    }

    /**
     * {@code base * 2^(attempt-1)} capped at {@code max}, plus 10-25% jitter.
     *
     * @param attempt attempts made so far, starting at 1
     */
    public static Duration delay(int attempt, Duration base, Duration max) {
        var exponent = Math.min(Math.max(attempt - 1, 0), 30);
        var delayMs = Math.min(base.toMillis() * (1L << exponent), max.toMillis());
        var jitterMs = ThreadLocalRandom.current().nextLong(delayMs / 10, delayMs / 4 + 1);
        return Duration.ofMillis(delayMs + jitterMs);
    }
}
