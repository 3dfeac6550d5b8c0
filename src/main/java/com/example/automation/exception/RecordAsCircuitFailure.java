package com.example.automation.exception;

import java.util.function.Predicate;

/**
 * Circuit breaker failure predicate: a permanent 4xx from a remote endpoint says
 * nothing about the endpoint's health and is not counted.
 * Referenced from {@code resilience4j.circuitbreaker.configs.default.record-failure-predicate}.
 */
public class RecordAsCircuitFailure implements Predicate<Throwable> {

    @Override
    public boolean test(Throwable throwable) {
        if (throwable instanceof ExternalServiceException external) {
            return external.isRetryable();
        }
        return !(throwable instanceof ConfigurationException);
    }
}
