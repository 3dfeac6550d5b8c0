package com.example.automation.dto;

import com.example.automation.domain.enums.PatternType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SchedulePatternResponse {

    private UUID id;
    private PatternType patternType;
    private List<Integer> daysOfWeek;
    private List<Integer> daysOfMonth;
    private List<Integer> months;
    private List<String> timeSlots;
    private List<String> exceptionDates;
    private String timezone;
    private boolean active;
}
