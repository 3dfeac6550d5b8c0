package com.example.automation.controller;

import com.example.automation.dto.ApiResponse;
import com.example.automation.dto.CreateRuleRequest;
import com.example.automation.dto.ExecutionRecordResponse;
import com.example.automation.dto.RuleResponse;
import com.example.automation.service.RuleManagementService;
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
@RequestMapping("/api/v1/rules")
@Tag(name = "Automation Rules", description = "APIs for managing event-driven automation rules")
public class AutomationRuleController {

    private final RuleManagementService ruleManagementService;

    @PostMapping
    @Operation(summary = "Create a rule")
    public ResponseEntity<ApiResponse<RuleResponse>> createRule(@Valid @RequestBody CreateRuleRequest request) {
        log.info("API: Create rule '{}' on {} for tenant {}", request.getName(), request.getTriggerEvent(), request.getTenantId());

        var response = ruleManagementService.createRule(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(response, "Rule created successfully"));
    }

    @GetMapping("/{ruleId}")
    @Operation(summary = "Get rule by ID")
    public ResponseEntity<ApiResponse<RuleResponse>> getRule(@Parameter(description = "Rule UUID") @PathVariable UUID ruleId) {
        return ResponseEntity.ok(ApiResponse.success(ruleManagementService.getRule(ruleId)));
    }

    @GetMapping
    @Operation(summary = "List rules", description = "List the rules of a tenant")
    public ResponseEntity<ApiResponse<Page<RuleResponse>>> listRules(
            @Parameter(description = "Tenant ID") @RequestParam String tenantId,
            @Parameter(description = "Page number") @RequestParam(defaultValue = "0") int page,
            @Parameter(description = "Page size") @RequestParam(defaultValue = "20") int size) {

        var pageable = PageRequest.of(page, size, Sort.by(Sort.Direction.DESC, "priority"));
        return ResponseEntity.ok(ApiResponse.success(ruleManagementService.listRules(tenantId, pageable)));
    }

    @GetMapping("/{ruleId}/executions")
    @Operation(summary = "Execution history", description = "Runs of the rule, newest first")
    public ResponseEntity<ApiResponse<Page<ExecutionRecordResponse>>> getExecutions(
            @Parameter(description = "Rule UUID") @PathVariable UUID ruleId,
            @Parameter(description = "Page number") @RequestParam(defaultValue = "0") int page,
            @Parameter(description = "Page size") @RequestParam(defaultValue = "20") int size) {

        return ResponseEntity.ok(ApiResponse.success(ruleManagementService.getExecutionHistory(ruleId, PageRequest.of(page, size))));
    }

    @PostMapping("/{ruleId}/activate")
    @Operation(summary = "Activate a rule")
    public ResponseEntity<ApiResponse<RuleResponse>> activateRule(@Parameter(description = "Rule UUID") @PathVariable UUID ruleId) {
        log.info("API: Activate rule {}", ruleId);

        return ResponseEntity.ok(ApiResponse.success(ruleManagementService.activateRule(ruleId), "Rule activated"));
    }

    @PostMapping("/{ruleId}/deactivate")
    @Operation(summary = "Deactivate a rule")
    public ResponseEntity<ApiResponse<RuleResponse>> deactivateRule(@Parameter(description = "Rule UUID") @PathVariable UUID ruleId) {
        log.info("API: Deactivate rule {}", ruleId);

        return ResponseEntity.ok(ApiResponse.success(ruleManagementService.deactivateRule(ruleId), "Rule deactivated"));
    }
}
