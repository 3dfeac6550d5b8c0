package com.example.automation.dto;

import com.example.automation.domain.enums.PatternType;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SchedulePatternRequest {

    @NotNull(message = "Pattern type is required")
    private PatternType patternType;

    /**
     * ISO days, Monday = 1
     */
    private List<Integer> daysOfWeek;

    private List<Integer> daysOfMonth;

    private List<Integer> months;

    /**
     * HH:mm
     */
    @NotEmpty(message = "At least one time slot is required")
    private List<String> timeSlots;

    private List<String> exceptionDates;

    /**
     * Defaults to the task timezone
     */
    private String timezone;
}
