package com.example.automation.controller;

import com.example.automation.dto.ApiResponse;
import com.example.automation.dto.CreateWebhookRequest;
import com.example.automation.dto.DeliveryResponse;
import com.example.automation.dto.EnqueueDeliveryRequest;
import com.example.automation.dto.WebhookResponse;
import com.example.automation.service.WebhookManagementService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * REST API controller for webhooks and their outbound deliveries.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1")
@Tag(name = "Webhooks", description = "APIs for webhook registration and outbound deliveries")
public class WebhookController {

    private final WebhookManagementService webhookManagementService;

    // === Webhooks ===

    @PostMapping("/webhooks")
    @Operation(summary = "Register a webhook")
    public ResponseEntity<ApiResponse<WebhookResponse>> registerWebhook(@Valid @RequestBody CreateWebhookRequest request) {
        log.info("API: Register webhook '{}' for tenant {}", request.getName(), request.getTenantId());

        var response = webhookManagementService.registerWebhook(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(response, "Webhook registered successfully"));
    }

    @GetMapping("/webhooks/{webhookId}")
    @Operation(summary = "Get webhook by ID")
    public ResponseEntity<ApiResponse<WebhookResponse>> getWebhook(@Parameter(description = "Webhook UUID") @PathVariable UUID webhookId) {
        return ResponseEntity.ok(ApiResponse.success(webhookManagementService.getWebhook(webhookId)));
    }

    @GetMapping("/webhooks")
    @Operation(summary = "List webhooks", description = "List the webhooks of a tenant")
    public ResponseEntity<ApiResponse<Page<WebhookResponse>>> listWebhooks(
            @Parameter(description = "Tenant ID") @RequestParam String tenantId,
            @Parameter(description = "Page number") @RequestParam(defaultValue = "0") int page,
            @Parameter(description = "Page size") @RequestParam(defaultValue = "20") int size) {

        var pageable = PageRequest.of(page, size, Sort.by(Sort.Direction.DESC, "createdAt"));
        return ResponseEntity.ok(ApiResponse.success(webhookManagementService.listWebhooks(tenantId, pageable)));
    }

    @PostMapping("/webhooks/{webhookId}/activate")
    @Operation(summary = "Activate a webhook")
    public ResponseEntity<ApiResponse<WebhookResponse>> activate(@Parameter(description = "Webhook UUID") @PathVariable UUID webhookId) {
        log.info("API: Activate webhook {}", webhookId);

        return ResponseEntity.ok(ApiResponse.success(webhookManagementService.setActive(webhookId, true), "Webhook activated"));
    }

    @PostMapping("/webhooks/{webhookId}/deactivate")
    @Operation(summary = "Deactivate a webhook", description = "Pending deliveries fail when they come due")
    public ResponseEntity<ApiResponse<WebhookResponse>> deactivate(@Parameter(description = "Webhook UUID") @PathVariable UUID webhookId) {
        log.info("API: Deactivate webhook {}", webhookId);

        return ResponseEntity.ok(ApiResponse.success(webhookManagementService.setActive(webhookId, false), "Webhook deactivated"));
    }

    // === Deliveries ===

    @PostMapping("/webhooks/{webhookId}/deliveries")
    @Operation(summary = "Enqueue a delivery", description = "Idempotent on deliveryId when one is supplied")
    public ResponseEntity<ApiResponse<DeliveryResponse>> enqueue(
            @Parameter(description = "Webhook UUID") @PathVariable UUID webhookId,
            @Valid @RequestBody EnqueueDeliveryRequest request) {
        log.info("API: Enqueue {} delivery for webhook {}", request.getEventType(), webhookId);

        var response = webhookManagementService.enqueue(webhookId, request);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(ApiResponse.success(response, "Delivery queued"));
    }

    @GetMapping("/webhooks/{webhookId}/deliveries")
    @Operation(summary = "List deliveries", description = "Deliveries of a webhook, newest first")
    public ResponseEntity<ApiResponse<Page<DeliveryResponse>>> listDeliveries(
            @Parameter(description = "Webhook UUID") @PathVariable UUID webhookId,
            @Parameter(description = "Page number") @RequestParam(defaultValue = "0") int page,
            @Parameter(description = "Page size") @RequestParam(defaultValue = "20") int size) {

        return ResponseEntity.ok(ApiResponse.success(webhookManagementService.listDeliveries(webhookId, PageRequest.of(page, size))));
    }

    @GetMapping("/deliveries/{deliveryId}")
    @Operation(summary = "Get delivery by ID")
    public ResponseEntity<ApiResponse<DeliveryResponse>> getDelivery(@Parameter(description = "Delivery UUID") @PathVariable UUID deliveryId) {
        return ResponseEntity.ok(ApiResponse.success(webhookManagementService.getDelivery(deliveryId)));
    }

    @PostMapping("/deliveries/{deliveryId}/cancel")
    @Operation(summary = "Cancel a delivery", description = "Only pending deliveries can be cancelled")
    public ResponseEntity<ApiResponse<DeliveryResponse>> cancel(@Parameter(description = "Delivery UUID") @PathVariable UUID deliveryId) {
        log.info("API: Cancel delivery {}", deliveryId);

        return ResponseEntity.ok(ApiResponse.success(webhookManagementService.cancelDelivery(deliveryId), "Delivery cancelled"));
    }

    @PostMapping("/deliveries/{deliveryId}/redeliver")
    @Operation(summary = "Redeliver", description = "Queue a new delivery with the stored payload of a finished one")
    public ResponseEntity<ApiResponse<DeliveryResponse>> redeliver(@Parameter(description = "Delivery UUID") @PathVariable UUID deliveryId) {
        log.info("API: Redeliver {}", deliveryId);

        var response = webhookManagementService.redeliver(deliveryId);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(ApiResponse.success(response, "Redelivery queued"));
    }
}
