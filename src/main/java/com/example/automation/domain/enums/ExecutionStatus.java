package com.example.automation.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Status of a single execution record.
 */
@Getter
@RequiredArgsConstructor
public enum ExecutionStatus {

    /**
     * Actions are being performed; end_time is not set yet
     */
    RUNNING("running", "Running"),

    /**
     * Every action succeeded
     */
    COMPLETED("completed", "Completed"),

    /**
     * At least one action failed, or the run was aborted by a critical action
     */
    FAILED("failed", "Failed"),

    /**
     * Nothing ran: conditions did not hold, or the record documents a self-disable
     */
    CANCELLED("cancelled", "Cancelled");

    private final String code;
    private final String displayName;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
