package com.mediaflow.mediaflow_backend.controller;

import com.mediaflow.mediaflow_backend.engine.InvalidPlanException;
import com.mediaflow.mediaflow_backend.model.domain.Execution;
import com.mediaflow.mediaflow_backend.model.dto.ExecuteRequest;
import com.mediaflow.mediaflow_backend.model.dto.ExecuteResponse;
import com.mediaflow.mediaflow_backend.model.dto.ExecutionStatusResponse;
import com.mediaflow.mediaflow_backend.service.ExecutionService;
import com.mediaflow.mediaflow_backend.service.UsageLimitExceededException;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.UUID;

@RestController
@RequestMapping("/api/execute")
@RequiredArgsConstructor
public class ExecutionController {

    static final String ORGANIZATION_HEADER = "X-Organization-Id";

    private final ExecutionService executionService;

    // POST /api/execute: persists the plan and starts it. Poll the status endpoint or wait for the webhook
    @PostMapping
    public ResponseEntity<ExecuteResponse> execute(
            @RequestHeader(value = ORGANIZATION_HEADER, defaultValue = "default") String organizationId,
            @RequestBody ExecuteRequest request) {
        if (request == null || request.executionPlan() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "executionPlan is required");
        }
        try {
            Execution execution = executionService.submit(organizationId, request.executionPlan(), request.options());
            return ResponseEntity.status(HttpStatus.ACCEPTED)
                    .body(new ExecuteResponse(execution.getId().toString(), execution.getStatus(), execution.getCreatedAt()));
        } catch (InvalidPlanException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
        } catch (UsageLimitExceededException e) {
            throw new ResponseStatusException(HttpStatus.TOO_MANY_REQUESTS, e.getMessage());
        }
    }

    // GET /api/execute/{id}/status
    @GetMapping("/{id}/status")
    public ExecutionStatusResponse status(@PathVariable UUID id) {
        return executionService.getStatus(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Execution not found: " + id));
    }
}
