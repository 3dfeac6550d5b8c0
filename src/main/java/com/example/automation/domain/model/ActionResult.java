package com.example.automation.domain.model;

import com.example.automation.domain.enums.ErrorKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Outcome of one action within a run, stored in order on the execution record.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActionResult {

    private int index;
    private String type;
    private boolean success;
    private boolean critical;

    /**
     * Dispatcher or sender supplied detail on success
     */
    private String detail;

    private String error;
    private ErrorKind errorKind;
    private Instant startedAt;
    private long durationMs;
}
