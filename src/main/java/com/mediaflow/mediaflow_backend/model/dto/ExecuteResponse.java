package com.mediaflow.mediaflow_backend.model.dto;

import com.mediaflow.mediaflow_backend.model.job.ExecutionStatus;

import java.time.Instant;

public record ExecuteResponse(String executionId, ExecutionStatus status, Instant createdAt) {
}
