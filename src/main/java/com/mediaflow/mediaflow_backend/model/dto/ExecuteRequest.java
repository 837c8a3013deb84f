package com.mediaflow.mediaflow_backend.model.dto;

import com.mediaflow.mediaflow_backend.model.plan.ExecutionPlan;

public record ExecuteRequest(ExecutionPlan executionPlan, ExecuteOptions options) {
}
