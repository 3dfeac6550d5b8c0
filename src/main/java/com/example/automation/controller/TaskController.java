package com.example.automation.controller;

import com.example.automation.dto.ApiResponse;
import com.example.automation.dto.CreateTaskRequest;
import com.example.automation.dto.ExecutionRecordResponse;
import com.example.automation.dto.TaskResponse;
import com.example.automation.service.TaskManagementService;
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
 * REST API controller for scheduled tasks.
 * <p>
 * Provides endpoints for:
 * - Creating tasks
 * - Retrieving tasks and their execution history
 * - Activating, deactivating and running tasks on demand
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/tasks")
@Tag(name = "Scheduled Tasks", description = "APIs for managing scheduled tasks")
public class TaskController {

    private final TaskManagementService taskManagementService;

    @PostMapping
    @Operation(summary = "Create a task", description = "Create a cron, interval, one-shot or event-triggered task")
    public ResponseEntity<ApiResponse<TaskResponse>> createTask(@Valid @RequestBody CreateTaskRequest request) {
        log.info("API: Create {} task '{}' for tenant {}", request.getTriggerType(), request.getName(), request.getTenantId());

        var response = taskManagementService.createTask(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(response, "Task created successfully"));
    }

    @GetMapping("/{taskId}")
    @Operation(summary = "Get task by ID", description = "Retrieve a task with its recurring patterns")
    public ResponseEntity<ApiResponse<TaskResponse>> getTask(@Parameter(description = "Task UUID") @PathVariable UUID taskId) {
        return ResponseEntity.ok(ApiResponse.success(taskManagementService.getTask(taskId)));
    }

    @GetMapping
    @Operation(summary = "List tasks", description = "List the tasks of a tenant")
    public ResponseEntity<ApiResponse<Page<TaskResponse>>> listTasks(
            @Parameter(description = "Tenant ID") @RequestParam String tenantId,
            @Parameter(description = "Active filter") @RequestParam(required = false) Boolean active,
            @Parameter(description = "Page number") @RequestParam(defaultValue = "0") int page,
            @Parameter(description = "Page size") @RequestParam(defaultValue = "20") int size) {

        var pageable = PageRequest.of(page, size, Sort.by(Sort.Direction.DESC, "createdAt"));
        return ResponseEntity.ok(ApiResponse.success(taskManagementService.listTasks(tenantId, active, pageable)));
    }

    @GetMapping("/{taskId}/executions")
    @Operation(summary = "Execution history", description = "Runs of the task, newest first")
    public ResponseEntity<ApiResponse<Page<ExecutionRecordResponse>>> getExecutions(
            @Parameter(description = "Task UUID") @PathVariable UUID taskId,
            @Parameter(description = "Page number") @RequestParam(defaultValue = "0") int page,
            @Parameter(description = "Page size") @RequestParam(defaultValue = "20") int size) {

        return ResponseEntity.ok(ApiResponse.success(taskManagementService.getExecutionHistory(taskId, PageRequest.of(page, size))));
    }

    @PostMapping("/{taskId}/activate")
    @Operation(summary = "Activate a task", description = "Re-enable a task and recompute its next execution")
    public ResponseEntity<ApiResponse<TaskResponse>> activateTask(@Parameter(description = "Task UUID") @PathVariable UUID taskId) {
        log.info("API: Activate task {}", taskId);

        return ResponseEntity.ok(ApiResponse.success(taskManagementService.activateTask(taskId), "Task activated"));
    }

    @PostMapping("/{taskId}/deactivate")
    @Operation(summary = "Deactivate a task", description = "Stop future executions of a task")
    public ResponseEntity<ApiResponse<TaskResponse>> deactivateTask(@Parameter(description = "Task UUID") @PathVariable UUID taskId) {
        log.info("API: Deactivate task {}", taskId);

        return ResponseEntity.ok(ApiResponse.success(taskManagementService.deactivateTask(taskId), "Task deactivated"));
    }

    @PostMapping("/{taskId}/run")
    @Operation(summary = "Run a task now", description = "Run the task once without changing its schedule")
    public ResponseEntity<ApiResponse<TaskResponse>> runTask(@Parameter(description = "Task UUID") @PathVariable UUID taskId) {
        log.info("API: Run task {}", taskId);

        var response = taskManagementService.requestRun(taskId);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(ApiResponse.success(response, "Run requested"));
    }
}
