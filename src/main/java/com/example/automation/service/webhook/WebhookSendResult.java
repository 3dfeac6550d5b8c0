package com.example.automation.service.webhook;

import com.example.automation.domain.enums.ErrorKind;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one HTTP attempt.
 */
@Value
@Builder
public class WebhookSendResult {

    boolean success;
    Integer statusCode;
    String responseBody;
    String errorMessage;
    ErrorKind errorKind;

    /**
     * The request was never sent because the circuit breaker is open
     */
    boolean notAttempted;

    public static WebhookSendResult delivered(int statusCode, String body) {
        return WebhookSendResult.builder().success(true).statusCode(statusCode).responseBody(body).build();
    }

    public static WebhookSendResult failed(Integer statusCode, String body, String errorMessage, ErrorKind errorKind) {
        return WebhookSendResult.builder()
                .success(false)
                .statusCode(statusCode)
                .responseBody(body)
                .errorMessage(errorMessage)
                .errorKind(errorKind)
                .build();
    }

    public static WebhookSendResult circuitOpen(String errorMessage) {
        return WebhookSendResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .errorKind(ErrorKind.TRANSIENT)
                .notAttempted(true)
                .build();
    }
}
