package com.example.automation.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.List;

/**
 * Action kinds understood by the execution engine.
 */
@Getter
@RequiredArgsConstructor
public enum ActionType {
    SEND_MESSAGE("send_message", Route.DISPATCHER, List.of("template")),
    SEND_DM("send_dm", Route.DISPATCHER, List.of("template")),
    ADD_ROLE("add_role", Route.DISPATCHER, List.of("roleId")),
    REMOVE_ROLE("remove_role", Route.DISPATCHER, List.of("roleId")),
    TIMEOUT_USER("timeout_user", Route.DISPATCHER, List.of("durationMinutes")),
    KICK_USER("kick_user", Route.DISPATCHER, List.of()),
    DELETE_MESSAGE("delete_message", Route.DISPATCHER, List.of()),
    CREATE_THREAD("create_thread", Route.DISPATCHER, List.of("name")),
    SEND_WEBHOOK("send_webhook", Route.WEBHOOK, List.of("webhookId", "eventType")),
    STOP_PROCESSING("stop_processing", Route.CONTROL, List.of());

    private final String code;
    private final Route route;
    private final List<String> requiredParams;

    /**
     * Where an action of this kind is carried out
     */
    public enum Route {
        DISPATCHER,
        WEBHOOK,
        CONTROL
    }

    public static ActionType fromCode(String code) {
        for (var type : values()) {
            if (type.getCode().equals(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown action type: " + code);
    }
}
