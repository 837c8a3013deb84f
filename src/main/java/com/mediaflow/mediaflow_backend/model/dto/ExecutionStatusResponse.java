package com.mediaflow.mediaflow_backend.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.mediaflow.mediaflow_backend.model.job.ExecutionStatus;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/** Body of {@code GET /api/execute/{id}/status} and of outgoing completion webhooks. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExecutionStatusResponse(
        String executionId,
        ExecutionStatus status,
        int progress,
        int totalJobs,
        int completedJobs,
        String currentJob,
        Map<String, Object> result,
        String error,
        Instant createdAt,
        Instant completedAt,
        List<JobStatusView> jobs
) {
}
