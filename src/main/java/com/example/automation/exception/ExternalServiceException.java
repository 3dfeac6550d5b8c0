package com.example.automation.exception;

import com.example.automation.domain.enums.ErrorKind;
import lombok.Getter;

/**
 * Exception for external service communication failures.
 * Retryability follows the HTTP status: 5xx, 408 and 429 are transient, any other status is permanent.
 */
@Getter
public class ExternalServiceException extends RuntimeException {

    private final String serviceName;
    private final Integer httpStatusCode;
    private final String responseBody;
    private final boolean retryable;

    public ExternalServiceException(String serviceName, String message) {
        super(String.format("[%s] %s", serviceName, message));
        this.serviceName = serviceName;
        this.httpStatusCode = null;
        this.responseBody = null;
        this.retryable = true;
    }

    public ExternalServiceException(String serviceName, String message, Throwable cause) {
        super(String.format("[%s] %s", serviceName, message), cause);
        this.serviceName = serviceName;
        this.httpStatusCode = null;
        this.responseBody = null;
        this.retryable = true;
    }

    public ExternalServiceException(String serviceName, int httpStatusCode, String responseBody) {
        super(String.format("[%s] HTTP %d: %s", serviceName, httpStatusCode, responseBody));
        this.serviceName = serviceName;
        this.httpStatusCode = httpStatusCode;
        this.responseBody = responseBody;
        this.retryable = isRetryableStatus(httpStatusCode);
    }

    public ErrorKind getErrorKind() {
        return retryable ? ErrorKind.TRANSIENT : ErrorKind.PERMANENT;
    }

    public static boolean isRetryableStatus(int httpStatusCode) {
        return httpStatusCode >= 500 || httpStatusCode == 408 || httpStatusCode == 429;
    }
}
