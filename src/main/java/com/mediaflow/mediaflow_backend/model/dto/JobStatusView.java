package com.mediaflow.mediaflow_backend.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.mediaflow.mediaflow_backend.model.domain.JobType;
import com.mediaflow.mediaflow_backend.model.job.JobErrorKind;
import com.mediaflow.mediaflow_backend.model.job.JobStatus;

import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobStatusView(
        String id,
        JobType type,
        JobStatus status,
        int progress,
        String stage,
        List<String> dependsOn,
        Map<String, Object> result,
        JobErrorKind errorKind,
        String error
) {
}
