package com.mediaflow.mediaflow_backend.store;

import com.mediaflow.mediaflow_backend.model.domain.Execution;
import com.mediaflow.mediaflow_backend.model.domain.ExecutionJob;
import com.mediaflow.mediaflow_backend.model.domain.MediaProvider;
import com.mediaflow.mediaflow_backend.model.job.ExecutionStatus;
import com.mediaflow.mediaflow_backend.model.job.JobErrorKind;
import com.mediaflow.mediaflow_backend.model.job.JobStatus;
import com.mediaflow.mediaflow_backend.model.job.WaitingStrategy;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/** Map-backed store with the same conditional transitions as {@link JpaExecutionStore}. */
public class InMemoryExecutionStore implements ExecutionStore {

    private final Map<UUID, Execution> executions = new LinkedHashMap<>();
    private final Map<UUID, ExecutionJob> jobs = new LinkedHashMap<>();

    @Override
    public synchronized Execution create(Execution execution, List<ExecutionJob> newJobs) {
        if (execution.getId() == null) execution.setId(UUID.randomUUID());
        executions.put(execution.getId(), execution);
        for (ExecutionJob job : newJobs) {
            if (job.getId() == null) job.setId(UUID.randomUUID());
            job.setExecutionId(execution.getId());
            jobs.put(job.getId(), job);
        }
        return execution;
    }

    @Override
    public synchronized Optional<Execution> findExecution(UUID executionId) {
        return Optional.ofNullable(executions.get(executionId));
    }

    @Override
    public synchronized Optional<ExecutionJob> findJob(UUID jobRecordId) {
        return Optional.ofNullable(jobs.get(jobRecordId));
    }

    @Override
    public synchronized List<ExecutionJob> findJobs(UUID executionId) {
        return jobs.values().stream()
                .filter(job -> executionId.equals(job.getExecutionId()))
                .sorted(Comparator.comparingInt(ExecutionJob::getPlanIndex))
                .toList();
    }

    /** Plan-id lookup for assertions. */
    public synchronized ExecutionJob job(UUID executionId, String jobId) {
        return findJobs(executionId).stream()
                .filter(job -> job.getJobId().equals(jobId))
                .findFirst()
                .orElseThrow(() -> new AssertionError("No job " + jobId + " in " + executionId));
    }

    @Override
    public synchronized boolean claimJob(UUID jobRecordId) {
        ExecutionJob job = jobs.get(jobRecordId);
        if (job == null || job.getStatus() != JobStatus.QUEUED) return false;
        job.setStatus(JobStatus.PROCESSING);
        job.setStartedAt(Instant.now());
        return true;
    }

    @Override
    public synchronized boolean recordProviderJob(UUID jobRecordId, MediaProvider provider, String modelId,
                                                  String providerJobId, WaitingStrategy strategy, Map<String, Object> metadata) {
        ExecutionJob job = jobs.get(jobRecordId);
        if (job == null || job.getStatus() != JobStatus.PROCESSING) return false;
        job.setProvider(provider);
        job.setModelId(modelId);
        job.setProviderJobId(providerJobId);
        job.setWaitingStrategy(strategy);
        if (metadata != null && !metadata.isEmpty()) {
            Map<String, Object> merged = new HashMap<>(job.getMetadata());
            merged.putAll(metadata);
            job.setMetadata(merged);
        }
        return true;
    }

    @Override
    public synchronized boolean updateProgress(UUID jobRecordId, int progress, String stage) {
        ExecutionJob job = jobs.get(jobRecordId);
        if (job == null || job.getStatus() != JobStatus.PROCESSING || progress < job.getProgress()) return false;
        job.setProgress(Math.min(progress, 100));
        job.setStage(stage);
        return true;
    }

    @Override
    public synchronized boolean completeJob(UUID jobRecordId, Map<String, Object> result) {
        ExecutionJob job = jobs.get(jobRecordId);
        if (job == null || job.getStatus() != JobStatus.PROCESSING) return false;
        job.setStatus(JobStatus.COMPLETED);
        job.setProgress(100);
        job.setStage("completed");
        job.setResult(result);
        job.setCompletedAt(Instant.now());
        return true;
    }

    @Override
    public synchronized boolean failJob(UUID jobRecordId, JobErrorKind kind, String error) {
        ExecutionJob job = jobs.get(jobRecordId);
        if (job == null || job.getStatus().isTerminal()) return false;
        job.setStatus(JobStatus.FAILED);
        job.setStage("failed");
        job.setErrorKind(kind);
        job.setError(error);
        job.setCompletedAt(Instant.now());
        return true;
    }

    @Override
    public synchronized boolean markExecutionProcessing(UUID executionId) {
        Execution execution = executions.get(executionId);
        if (execution == null || execution.getStatus() != ExecutionStatus.PENDING) return false;
        execution.setStatus(ExecutionStatus.PROCESSING);
        execution.setStartedAt(Instant.now());
        return true;
    }

    @Override
    public synchronized boolean finishExecution(UUID executionId, ExecutionStatus status, Map<String, Object> result, String error) {
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + status);
        }
        Execution execution = executions.get(executionId);
        if (execution == null || execution.getStatus().isTerminal()) return false;
        execution.setStatus(status);
        execution.setResult(result);
        execution.setError(error);
        execution.setCompletedAt(Instant.now());
        return true;
    }

    @Override
    public synchronized List<ExecutionJob> findStalledWebhookJobs(Instant startedBefore) {
        List<ExecutionJob> stalled = new ArrayList<>();
        for (ExecutionJob job : jobs.values()) {
            if (job.getStatus() == JobStatus.PROCESSING && job.getWaitingStrategy() == WaitingStrategy.WEBHOOK
                    && job.getStartedAt() != null && job.getStartedAt().isBefore(startedBefore)) {
                stalled.add(job);
            }
        }
        return stalled;
    }

    @Override
    public synchronized List<Execution> findPendingWebhookDeliveries(int maxAttempts, Instant lastAttemptBefore) {
        return executions.values().stream()
                .filter(e -> e.getWebhook() != null && e.getCompletedAt() != null && e.getWebhookDeliveredAt() == null)
                .filter(e -> e.getWebhookAttempts() < maxAttempts)
                .filter(e -> e.getWebhookLastAttemptAt() == null
                        ? e.getCompletedAt().isBefore(lastAttemptBefore)
                        : e.getWebhookLastAttemptAt().isBefore(lastAttemptBefore))
                .toList();
    }

    @Override
    public synchronized void recordWebhookAttempt(UUID executionId, boolean delivered, String error) {
        Execution execution = executions.get(executionId);
        if (execution == null) return;
        execution.setWebhookAttempts(execution.getWebhookAttempts() + 1);
        execution.setWebhookLastAttemptAt(Instant.now());
        execution.setWebhookLastError(error);
        if (delivered) execution.setWebhookDeliveredAt(Instant.now());
    }
}
