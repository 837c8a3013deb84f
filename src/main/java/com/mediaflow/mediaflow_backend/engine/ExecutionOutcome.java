package com.mediaflow.mediaflow_backend.engine;

import com.mediaflow.mediaflow_backend.model.job.ExecutionStatus;

import java.util.Map;

/** Terminal status of an execution with exactly one of result or error set. */
public record ExecutionOutcome(ExecutionStatus status, Map<String, Object> result, String error) {

    public static ExecutionOutcome completed(Map<String, Object> result) {
        return new ExecutionOutcome(ExecutionStatus.COMPLETED, result, null);
    }

    public static ExecutionOutcome failed(String error) {
        return new ExecutionOutcome(ExecutionStatus.FAILED, null, error);
    }
}
