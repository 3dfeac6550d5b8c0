package com.example.automation.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Outbound delivery state machine.
 * <p>
 * PENDING covers both "never attempted" and "awaiting retry"; next_retry_at tells them apart.
 */
@Getter
@RequiredArgsConstructor
public enum DeliveryStatus {
    PENDING("pending", false),
    DELIVERED("delivered", true),
    FAILED("failed", true),
    CANCELLED("cancelled", true);

    private final String code;
    private final boolean terminal;

    /**
     * Rows in these states are never written again
     */
    public boolean isImmutable() {
        return this == DELIVERED || this == CANCELLED;
    }
}
