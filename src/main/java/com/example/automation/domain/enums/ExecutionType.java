package com.example.automation.domain.enums;

public enum ExecutionType {
    SCHEDULED_TASK,
    AUTOMATION_RULE
}
