package com.mediaflow.mediaflow_backend.model.plan;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/** Wire contract between the pipeline builder and the orchestrator. Jobs are in topological order. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExecutionPlan(List<JobNode> jobs, String baseExecutionId) {

    public ExecutionPlan {
        jobs = jobs != null ? List.copyOf(jobs) : List.of();
    }

    public ExecutionPlan(List<JobNode> jobs) {
        this(jobs, null);
    }
}
