package com.example.automation.controller;

import com.example.automation.dto.ApiResponse;
import com.example.automation.service.webhook.InboundResult;
import com.example.automation.service.webhook.InboundWebhookService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Receives webhooks sent to the engine by external services.
 * <p>
 * The body is taken as raw bytes so the signature is checked against exactly what was sent.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/webhooks")
@Tag(name = "Inbound Webhooks", description = "Endpoint for webhooks sent by external services")
public class InboundWebhookController {

    static final String SIGNATURE_HEADER = "X-Webhook-Signature";
    static final String GITHUB_SIGNATURE_HEADER = "X-Hub-Signature-256";
    static final String EVENT_TYPE_HEADER = "X-Event-Type";
    static final String DELIVERY_ID_HEADER = "X-Delivery-Id";
    static final String GITHUB_DELIVERY_HEADER = "X-GitHub-Delivery";

    private final InboundWebhookService inboundWebhookService;

    @PostMapping("/{webhookId}/inbound")
    @Operation(summary = "Receive a webhook", description = "Validate, deduplicate and publish an inbound webhook as a platform event")
    public ResponseEntity<ApiResponse<InboundResult>> receive(
            @Parameter(description = "Webhook UUID") @PathVariable UUID webhookId,
            @RequestBody(required = false) byte[] body,
            @RequestHeader(value = SIGNATURE_HEADER, required = false) String signature,
            @RequestHeader(value = GITHUB_SIGNATURE_HEADER, required = false) String githubSignature,
            @RequestHeader(value = EVENT_TYPE_HEADER, required = false) String eventType,
            @RequestHeader(value = DELIVERY_ID_HEADER, required = false) String deliveryId,
            @RequestHeader(value = GITHUB_DELIVERY_HEADER, required = false) String githubDeliveryId) {

        var result = inboundWebhookService.receive(webhookId,
                body != null ? body : new byte[0],
                signature != null ? signature : githubSignature,
                eventType,
                deliveryId != null ? deliveryId : githubDeliveryId);

        log.debug("API: Inbound webhook {} {}", webhookId, result);
        return ResponseEntity.ok(ApiResponse.success(result));
    }
}
