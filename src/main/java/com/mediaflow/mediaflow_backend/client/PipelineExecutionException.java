package com.mediaflow.mediaflow_backend.client;

/** Submission, status polling or the execution itself failed. */
public class PipelineExecutionException extends RuntimeException {

    private final String executionId;

    public PipelineExecutionException(String message) {
        this(message, null, null);
    }

    public PipelineExecutionException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public PipelineExecutionException(String message, String executionId, Throwable cause) {
        super(message, cause);
        this.executionId = executionId;
    }

    /** Id of the execution, when it got as far as being created. */
    public String getExecutionId() {
        return executionId;
    }
}
