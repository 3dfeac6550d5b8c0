package com.example.automation.controller;

import com.example.automation.domain.model.PlatformEvent;
import com.example.automation.dto.ApiResponse;
import com.example.automation.dto.PlatformEventRequest;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.HashMap;

/**
 * Ingress for events raised by the chat platform. Rules are evaluated asynchronously.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/events")
@Tag(name = "Platform Events", description = "Event ingress for the automation rule engine")
public class PlatformEventController {

    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @PostMapping
    @Operation(summary = "Publish an event", description = "Queue a platform event for rule evaluation")
    public ResponseEntity<ApiResponse<Void>> publish(@Valid @RequestBody PlatformEventRequest request) {
        log.debug("API: Event {} for tenant {}", request.getEventName(), request.getTenantId());

        eventPublisher.publishEvent(PlatformEvent.builder()
                .tenantId(request.getTenantId())
                .eventName(request.getEventName())
                .userId(request.getUserId())
                .channelId(request.getChannelId())
                .payload(request.getPayload() != null ? request.getPayload() : new HashMap<>())
                .occurredAt(clock.instant())
                .source(PlatformEvent.SOURCE_PLATFORM)
                .build());

        return ResponseEntity.status(HttpStatus.ACCEPTED).body(ApiResponse.success(null, "Event accepted"));
    }
}
