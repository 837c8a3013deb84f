package com.mediaflow.mediaflow_backend.client;

import com.mediaflow.mediaflow_backend.model.dto.ExecutionStatusResponse;
import com.mediaflow.mediaflow_backend.model.job.ExecutionStatus;

import java.util.Map;

/** Handle on a submitted execution. */
public class PipelineExecution {

    private final String id;
    private final ExecutionClient client;
    private final ExecuteConfig config;
    private volatile ExecutionStatus status = ExecutionStatus.PENDING;
    private volatile Map<String, Object> result;

    PipelineExecution(String id, ExecutionClient client, ExecuteConfig config) {
        this.id = id;
        this.client = client;
        this.config = config;
    }

    public String getId() {
        return id;
    }

    public ExecutionStatus getStatus() {
        return status;
    }

    /** Final job's result, once the execution has completed. */
    public Map<String, Object> getResult() {
        return result;
    }

    /** Fetches the current status from the server and updates this handle. */
    public ExecutionStatusResponse refresh() {
        ExecutionStatusResponse response = client.fetchStatus(id, config);
        apply(response);
        return response;
    }

    /**
     * Polls until the execution is terminal.
     *
     * @return the final job's result
     * @throws PipelineExecutionException if the execution failed, the status endpoint errored or the
     *                                    configured timeout elapsed
     */
    public Map<String, Object> waitForCompletion() {
        long deadline = config.getTimeout() != null ? System.nanoTime() + config.getTimeout().toNanos() : Long.MAX_VALUE;
        while (true) {
            ExecutionStatusResponse response = refresh();
            if (config.getOnProgress() != null) {
                config.getOnProgress().accept(new ExecutionProgress(response.currentJob(), response.progress(),
                        response.totalJobs(), response.completedJobs()));
            }
            if (response.status() == ExecutionStatus.COMPLETED) {
                return result;
            }
            if (response.status() == ExecutionStatus.FAILED) {
                String error = response.error() != null ? response.error() : "Pipeline execution failed";
                throw new PipelineExecutionException(error, id, null);
            }
            if (System.nanoTime() >= deadline) {
                throw new PipelineExecutionException("Execution " + id + " did not finish within " + config.getTimeout(), id, null);
            }
            try {
                Thread.sleep(config.getPollInterval().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new PipelineExecutionException("Interrupted while waiting for execution " + id, id, e);
            }
        }
    }

    private void apply(ExecutionStatusResponse response) {
        if (response.status() != null) {
            status = response.status();
        }
        if (response.status() == ExecutionStatus.COMPLETED) {
            result = response.result();
        }
    }

    @Override
    public String toString() {
        return "PipelineExecution{id=" + id + ", status=" + status + "}";
    }
}
