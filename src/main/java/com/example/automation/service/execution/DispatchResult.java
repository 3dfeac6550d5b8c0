package com.example.automation.service.execution;

import com.example.automation.domain.enums.ErrorKind;
import com.example.automation.exception.ExternalServiceException;
import lombok.Builder;
import lombok.Data;

/**
 * Outcome of a single dispatched action.
 */
@Data
@Builder
public class DispatchResult {

    private boolean success;

    /**
     * Free-form detail returned by the dispatcher, e.g. the created message id
     */
    private String detail;

    private String errorMessage;

    private ErrorKind errorKind;

    private Integer httpStatusCode;

    public static DispatchResult success() {
        return DispatchResult.builder().success(true).build();
    }

    public static DispatchResult success(String detail) {
        return DispatchResult.builder().success(true).detail(detail).build();
    }

    public static DispatchResult failure(String errorMessage, ErrorKind errorKind) {
        return DispatchResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .errorKind(errorKind)
                .build();
    }

    public static DispatchResult transientFailure(String errorMessage) {
        return failure(errorMessage, ErrorKind.TRANSIENT);
    }

    public static DispatchResult permanentFailure(String errorMessage) {
        return failure(errorMessage, ErrorKind.PERMANENT);
    }

    /**
     * 5xx, 408 and 429 are transient; anything else is permanent.
     */
    public static DispatchResult httpFailure(int statusCode, String errorMessage) {
        return DispatchResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .httpStatusCode(statusCode)
                .errorKind(ExternalServiceException.isRetryableStatus(statusCode) ? ErrorKind.TRANSIENT : ErrorKind.PERMANENT)
                .build();
    }
}
