package com.example.automation.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.List;

@Getter
@RequiredArgsConstructor
public enum ConditionType {
    USER_HAS_ROLE("user_has_role", List.of("roleId")),
    CHANNEL_IS("channel_is", List.of("channelId")),
    MESSAGE_CONTAINS("message_contains", List.of("text")),
    USER_JOINED_RECENTLY("user_joined_recently", List.of("days")),
    TIME_BETWEEN("time_between", List.of("start", "end")),
    PAYLOAD_EQUALS("payload_equals", List.of("field", "value"));

    private final String code;
    private final List<String> requiredParams;

    public static ConditionType fromCode(String code) {
        for (var type : values()) {
            if (type.getCode().equals(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown condition type: " + code);
    }
}
