package com.example.automation.service.execution;

import com.example.automation.domain.enums.ErrorKind;
import com.example.automation.domain.enums.ExecutionStatus;
import com.example.automation.domain.model.ActionResult;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outcome of running an action list.
 * <p>
 * The run is COMPLETED when every action that ran succeeded, otherwise FAILED.
 * {@code errorKind} is the kind of the first failure.
 */
@Value
@Builder
public class ExecutionResult {

    List<ActionResult> actionResults;
    ExecutionStatus status;
    ErrorKind errorKind;
    String errorMessage;

    /**
     * Set when a stop_processing action ran; lower-priority rules are skipped
     */
    boolean stopProcessing;

    public boolean isSuccess() {
        return status == ExecutionStatus.COMPLETED;
    }

    public boolean isConfigurationError() {
        return !isSuccess() && errorKind == ErrorKind.CONFIGURATION;
    }
}
