package com.mediaflow.mediaflow_backend.store;

import com.mediaflow.mediaflow_backend.model.domain.Execution;
import com.mediaflow.mediaflow_backend.model.domain.ExecutionJob;
import com.mediaflow.mediaflow_backend.model.domain.MediaProvider;
import com.mediaflow.mediaflow_backend.model.job.ExecutionStatus;
import com.mediaflow.mediaflow_backend.model.job.JobErrorKind;
import com.mediaflow.mediaflow_backend.model.job.JobStatus;
import com.mediaflow.mediaflow_backend.model.job.WaitingStrategy;
import com.mediaflow.mediaflow_backend.repository.ExecutionJobRepository;
import com.mediaflow.mediaflow_backend.repository.ExecutionRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * {@link ExecutionStore} on Postgres. Each transition reads the row under a pessimistic write lock,
 * checks the current state and writes in the same transaction.
 */
@Component
@RequiredArgsConstructor
public class JpaExecutionStore implements ExecutionStore {

    private final ExecutionRepository executionRepository;
    private final ExecutionJobRepository jobRepository;

    @Override
    @Transactional
    public Execution create(Execution execution, List<ExecutionJob> jobs) {
        Execution saved = executionRepository.save(execution);
        for (ExecutionJob job : jobs) {
            job.setExecutionId(saved.getId());
        }
        jobRepository.saveAll(jobs);
        return saved;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Execution> findExecution(UUID executionId) {
        return executionRepository.findById(executionId);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ExecutionJob> findJob(UUID jobRecordId) {
        return jobRepository.findById(jobRecordId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ExecutionJob> findJobs(UUID executionId) {
        return jobRepository.findByExecutionIdOrderByPlanIndexAsc(executionId);
    }

    @Override
    @Transactional
    public boolean claimJob(UUID jobRecordId) {
        return jobRepository.findByIdForUpdate(jobRecordId)
                .filter(job -> job.getStatus() == JobStatus.QUEUED)
                .map(job -> {
                    job.setStatus(JobStatus.PROCESSING);
                    job.setStartedAt(Instant.now());
                    return true;
                })
                .orElse(false);
    }

    @Override
    @Transactional
    public boolean recordProviderJob(UUID jobRecordId, MediaProvider provider, String modelId, String providerJobId,
                                     WaitingStrategy strategy, Map<String, Object> metadata) {
        return jobRepository.findByIdForUpdate(jobRecordId)
                .filter(job -> job.getStatus() == JobStatus.PROCESSING)
                .map(job -> {
                    job.setProvider(provider);
                    job.setModelId(modelId);
                    job.setProviderJobId(providerJobId);
                    job.setWaitingStrategy(strategy);
                    if (metadata != null && !metadata.isEmpty()) {
                        Map<String, Object> merged = new HashMap<>(job.getMetadata() != null ? job.getMetadata() : Map.of());
                        merged.putAll(metadata);
                        job.setMetadata(merged);
                    }
                    return true;
                })
                .orElse(false);
    }

    @Override
    @Transactional
    public boolean updateProgress(UUID jobRecordId, int progress, String stage) {
        return jobRepository.findByIdForUpdate(jobRecordId)
                .filter(job -> job.getStatus() == JobStatus.PROCESSING && progress >= job.getProgress())
                .map(job -> {
                    job.setProgress(Math.min(progress, 100));
                    job.setStage(stage);
                    return true;
                })
                .orElse(false);
    }

    @Override
    @Transactional
    public boolean completeJob(UUID jobRecordId, Map<String, Object> result) {
        return jobRepository.findByIdForUpdate(jobRecordId)
                .filter(job -> job.getStatus() == JobStatus.PROCESSING)
                .map(job -> {
                    job.setStatus(JobStatus.COMPLETED);
                    job.setProgress(100);
                    job.setStage("completed");
                    job.setResult(result);
                    job.setCompletedAt(Instant.now());
                    return true;
                })
                .orElse(false);
    }

    @Override
    @Transactional
    public boolean failJob(UUID jobRecordId, JobErrorKind kind, String error) {
        return jobRepository.findByIdForUpdate(jobRecordId)
                .filter(job -> !job.getStatus().isTerminal())
                .map(job -> {
                    job.setStatus(JobStatus.FAILED);
                    job.setStage("failed");
                    job.setErrorKind(kind);
                    job.setError(error);
                    job.setCompletedAt(Instant.now());
                    return true;
                })
                .orElse(false);
    }

    @Override
    @Transactional
    public boolean markExecutionProcessing(UUID executionId) {
        return executionRepository.findByIdForUpdate(executionId)
                .filter(execution -> execution.getStatus() == ExecutionStatus.PENDING)
                .map(execution -> {
                    execution.setStatus(ExecutionStatus.PROCESSING);
                    execution.setStartedAt(Instant.now());
                    return true;
                })
                .orElse(false);
    }

    @Override
    @Transactional
    public boolean finishExecution(UUID executionId, ExecutionStatus status, Map<String, Object> result, String error) {
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + status);
        }
        return executionRepository.findByIdForUpdate(executionId)
                .filter(execution -> !execution.getStatus().isTerminal())
                .map(execution -> {
                    execution.setStatus(status);
                    execution.setResult(result);
                    execution.setError(error);
                    execution.setCompletedAt(Instant.now());
                    return true;
                })
                .orElse(false);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ExecutionJob> findStalledWebhookJobs(Instant startedBefore) {
        return jobRepository.findByStatusAndWaitingStrategyAndStartedAtBefore(
                JobStatus.PROCESSING, WaitingStrategy.WEBHOOK, startedBefore);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Execution> findPendingWebhookDeliveries(int maxAttempts, Instant lastAttemptBefore) {
        return executionRepository.findPendingWebhookDeliveries(maxAttempts, lastAttemptBefore);
    }

    @Override
    @Transactional
    public void recordWebhookAttempt(UUID executionId, boolean delivered, String error) {
        executionRepository.findByIdForUpdate(executionId).ifPresent(execution -> {
            execution.setWebhookAttempts(execution.getWebhookAttempts() + 1);
            execution.setWebhookLastAttemptAt(Instant.now());
            execution.setWebhookLastError(error);
            if (delivered) {
                execution.setWebhookDeliveredAt(Instant.now());
            }
        });
    }
}
