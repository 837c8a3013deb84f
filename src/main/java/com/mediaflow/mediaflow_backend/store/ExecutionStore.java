package com.mediaflow.mediaflow_backend.store;

import com.mediaflow.mediaflow_backend.model.domain.Execution;
import com.mediaflow.mediaflow_backend.model.domain.ExecutionJob;
import com.mediaflow.mediaflow_backend.model.domain.MediaProvider;
import com.mediaflow.mediaflow_backend.model.job.ExecutionStatus;
import com.mediaflow.mediaflow_backend.model.job.JobErrorKind;
import com.mediaflow.mediaflow_backend.model.job.WaitingStrategy;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Single source of truth for executions and jobs. Every state change is conditional on the
 * current state and reports whether it took effect, so concurrent pollers, webhooks and
 * schedulers can race safely: the first terminal write wins and later ones return false.
 */
public interface ExecutionStore {

    /** Persists the execution and its jobs atomically; jobs receive the generated execution id. */
    Execution create(Execution execution, List<ExecutionJob> jobs);

    Optional<Execution> findExecution(UUID executionId);

    Optional<ExecutionJob> findJob(UUID jobRecordId);

    /** Jobs of an execution in plan order. */
    List<ExecutionJob> findJobs(UUID executionId);

    /** queued → processing */
    boolean claimJob(UUID jobRecordId);

    /** Records the provider-side handle of a processing job. */
    boolean recordProviderJob(UUID jobRecordId, MediaProvider provider, String modelId, String providerJobId,
                              WaitingStrategy strategy, Map<String, Object> metadata);

    /** Raises progress of a processing job; lower values are ignored. */
    boolean updateProgress(UUID jobRecordId, int progress, String stage);

    /** processing → completed */
    boolean completeJob(UUID jobRecordId, Map<String, Object> result);

    /** queued|processing → failed */
    boolean failJob(UUID jobRecordId, JobErrorKind kind, String error);

    /** pending → processing */
    boolean markExecutionProcessing(UUID executionId);

    /** pending|processing → completed|failed */
    boolean finishExecution(UUID executionId, ExecutionStatus status, Map<String, Object> result, String error);

    /** Processing jobs waiting on a provider webhook since before {@code startedBefore}. */
    List<ExecutionJob> findStalledWebhookJobs(Instant startedBefore);

    List<Execution> findPendingWebhookDeliveries(int maxAttempts, Instant lastAttemptBefore);

    void recordWebhookAttempt(UUID executionId, boolean delivered, String error);
}
