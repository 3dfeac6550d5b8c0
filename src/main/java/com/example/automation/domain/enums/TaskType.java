package com.example.automation.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Dashboard classification of a scheduled task. Purely descriptive: the action list decides what runs.
 */
@Getter
@RequiredArgsConstructor
public enum TaskType {
    MESSAGE("message", "Message"),
    ANNOUNCEMENT("announcement", "Announcement"),
    ROLE_ASSIGNMENT("role_assignment", "Role Assignment"),
    CHANNEL_ACTION("channel_action", "Channel Action"),
    MODERATION("moderation", "Moderation"),
    CUSTOM("custom", "Custom Task");

    private final String code;
    private final String displayName;
}
