package com.example.automation.controller;

import com.example.automation.dto.ApiResponse;
import com.example.automation.dto.CreateIntegrationRequest;
import com.example.automation.dto.IntegrationResponse;
import com.example.automation.service.IntegrationManagementService;
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

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/integrations")
@Tag(name = "Integrations", description = "APIs for managing polled external integrations")
public class IntegrationController {

    private final IntegrationManagementService integrationManagementService;

    @PostMapping
    @Operation(summary = "Create an integration", description = "The first sync is due immediately")
    public ResponseEntity<ApiResponse<IntegrationResponse>> createIntegration(@Valid @RequestBody CreateIntegrationRequest request) {
        log.info("API: Create {} integration '{}' for tenant {}", request.getProvider(), request.getName(), request.getTenantId());

        var response = integrationManagementService.createIntegration(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(response, "Integration created successfully"));
    }

    @GetMapping("/{integrationId}")
    @Operation(summary = "Get integration by ID")
    public ResponseEntity<ApiResponse<IntegrationResponse>> getIntegration(
            @Parameter(description = "Integration UUID") @PathVariable UUID integrationId) {
        return ResponseEntity.ok(ApiResponse.success(integrationManagementService.getIntegration(integrationId)));
    }

    @GetMapping
    @Operation(summary = "List integrations", description = "List the integrations of a tenant")
    public ResponseEntity<ApiResponse<Page<IntegrationResponse>>> listIntegrations(
            @Parameter(description = "Tenant ID") @RequestParam String tenantId,
            @Parameter(description = "Page number") @RequestParam(defaultValue = "0") int page,
            @Parameter(description = "Page size") @RequestParam(defaultValue = "20") int size) {

        var pageable = PageRequest.of(page, size, Sort.by(Sort.Direction.DESC, "createdAt"));
        return ResponseEntity.ok(ApiResponse.success(integrationManagementService.listIntegrations(tenantId, pageable)));
    }

    @PostMapping("/{integrationId}/activate")
    @Operation(summary = "Activate an integration")
    public ResponseEntity<ApiResponse<IntegrationResponse>> activate(@Parameter(description = "Integration UUID") @PathVariable UUID integrationId) {
        log.info("API: Activate integration {}", integrationId);

        return ResponseEntity.ok(ApiResponse.success(integrationManagementService.activateIntegration(integrationId), "Integration activated"));
    }

    @PostMapping("/{integrationId}/deactivate")
    @Operation(summary = "Deactivate an integration")
    public ResponseEntity<ApiResponse<IntegrationResponse>> deactivate(@Parameter(description = "Integration UUID") @PathVariable UUID integrationId) {
        log.info("API: Deactivate integration {}", integrationId);

        return ResponseEntity.ok(ApiResponse.success(integrationManagementService.deactivateIntegration(integrationId), "Integration deactivated"));
    }

    @PostMapping("/{integrationId}/sync")
    @Operation(summary = "Sync now", description = "Make the integration due for sync immediately")
    public ResponseEntity<ApiResponse<IntegrationResponse>> syncNow(@Parameter(description = "Integration UUID") @PathVariable UUID integrationId) {
        log.info("API: Sync integration {}", integrationId);

        var response = integrationManagementService.requestSync(integrationId);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(ApiResponse.success(response, "Sync requested"));
    }
}
