package com.mediaflow.mediaflow_backend.engine;

import com.mediaflow.mediaflow_backend.config.WorkerPoolConfig;
import com.mediaflow.mediaflow_backend.executor.JobContext;
import com.mediaflow.mediaflow_backend.executor.JobExecutorRegistry;
import com.mediaflow.mediaflow_backend.executor.JobOutcome;
import com.mediaflow.mediaflow_backend.model.domain.Execution;
import com.mediaflow.mediaflow_backend.model.domain.ExecutionJob;
import com.mediaflow.mediaflow_backend.model.job.JobErrorKind;
import com.mediaflow.mediaflow_backend.model.job.JobException;
import com.mediaflow.mediaflow_backend.model.job.JobStatus;
import com.mediaflow.mediaflow_backend.model.job.MediaOutput;
import com.mediaflow.mediaflow_backend.model.plan.ExecutionPlan;
import com.mediaflow.mediaflow_backend.model.plan.JobNode;
import com.mediaflow.mediaflow_backend.service.JobWebhookService;
import com.mediaflow.mediaflow_backend.service.UsageTracker;
import com.mediaflow.mediaflow_backend.service.WebhookDeliveryService;
import com.mediaflow.mediaflow_backend.store.ExecutionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Drives executions from submission to a terminal state. Every step reads fresh state from the
 * {@link ExecutionStore} and only acts when its conditional transition wins, so the same
 * execution can be advanced concurrently by workers, provider webhooks and the reaper.
 */
@Slf4j
@Service
public class ExecutionOrchestrator {

    private final ExecutionStore store;
    private final JobExecutorRegistry executorRegistry;
    private final PlanValidator planValidator;
    private final ExecutionAggregator aggregator;
    private final OutputNormalizer outputNormalizer;
    private final ExecutionEventPublisher eventPublisher;
    private final UsageTracker usageTracker;
    private final WebhookDeliveryService webhookDelivery;
    private final JobWebhookService jobWebhooks;
    private final Executor workerPool;

    public ExecutionOrchestrator(ExecutionStore store,
                                 JobExecutorRegistry executorRegistry,
                                 PlanValidator planValidator,
                                 ExecutionAggregator aggregator,
                                 OutputNormalizer outputNormalizer,
                                 ExecutionEventPublisher eventPublisher,
                                 UsageTracker usageTracker,
                                 WebhookDeliveryService webhookDelivery,
                                 JobWebhookService jobWebhooks,
                                 @Qualifier(WorkerPoolConfig.JOB_WORKER_EXECUTOR) Executor workerPool) {
        this.store = store;
        this.executorRegistry = executorRegistry;
        this.planValidator = planValidator;
        this.aggregator = aggregator;
        this.outputNormalizer = outputNormalizer;
        this.eventPublisher = eventPublisher;
        this.usageTracker = usageTracker;
        this.webhookDelivery = webhookDelivery;
        this.jobWebhooks = jobWebhooks;
        this.workerPool = workerPool;
    }

    /**
     * Persists the plan as a pending execution and dispatches the jobs that have no pending
     * dependencies. The execution and all its jobs are committed before anything is dispatched.
     *
     * @throws InvalidPlanException when the plan is malformed or the base execution is unknown
     */
    public Execution createExecution(ExecutionPlan plan, SubmissionOptions options) {
        Map<String, ExecutionJob> baseJobs = Map.of();
        if (options.baseExecutionId() != null) {
            if (store.findExecution(options.baseExecutionId()).isEmpty()) {
                throw new InvalidPlanException("Base execution not found: " + options.baseExecutionId());
            }
            baseJobs = jobsByPlanId(options.baseExecutionId());
        }
        // only completed base jobs can be depended on
        Set<String> completedBaseJobs = new HashSet<>();
        baseJobs.forEach((id, job) -> {
            if (job.getStatus() == JobStatus.COMPLETED) completedBaseJobs.add(id);
        });
        planValidator.validate(plan, completedBaseJobs);

        Execution execution = new Execution();
        execution.setOrganizationId(options.organizationId());
        execution.setBaseExecutionId(options.baseExecutionId());
        execution.setProviderApiKeys(new HashMap<>(options.providerApiKeys()));
        execution.setWebhook(options.webhook());
        execution.setWebhookSecret(options.webhookSecret());

        List<ExecutionJob> jobs = new ArrayList<>();
        for (int i = 0; i < plan.jobs().size(); i++) {
            JobNode node = plan.jobs().get(i);
            ExecutionJob job = new ExecutionJob();
            job.setJobId(node.id());
            job.setPlanIndex(i);
            job.setJobType(node.type());
            job.setParams(new LinkedHashMap<>(node.params()));
            job.setDependsOn(new ArrayList<>(node.dependsOn()));
            job.setOutput(node.output());
            jobs.add(job);
        }

        Execution saved = store.create(execution, jobs);
        log.info("[Orchestrator] Created execution {} for {} with {} jobs", saved.getId(), saved.getOrganizationId(), jobs.size());
        emitReadyJobs(saved.getId());
        return saved;
    }

    /**
     * Claims and dispatches every queued job whose dependencies have completed, fails the ones
     * behind a failed dependency, and finishes the execution once all jobs are terminal.
     */
    public void emitReadyJobs(UUID executionId) {
        Execution execution = store.findExecution(executionId).orElse(null);
        if (execution == null || execution.getStatus().isTerminal()) {
            return;
        }
        List<ExecutionJob> jobs = store.findJobs(executionId);
        Map<String, JobStatus> statuses = new HashMap<>();
        if (execution.getBaseExecutionId() != null) {
            jobsByPlanId(execution.getBaseExecutionId()).forEach((id, job) -> statuses.put(id, job.getStatus()));
        }
        jobs.forEach(job -> statuses.put(job.getJobId(), job.getStatus()));

        // plan order guarantees a cascaded failure is visible to later dependents in this same pass
        for (ExecutionJob job : jobs) {
            if (job.getStatus() != JobStatus.QUEUED) continue;

            String failedDependency = null;
            boolean ready = true;
            for (String dep : job.getDependsOn()) {
                JobStatus depStatus = statuses.get(dep);
                if (depStatus == null || depStatus == JobStatus.FAILED) {
                    failedDependency = dep;
                    break;
                }
                if (depStatus != JobStatus.COMPLETED) ready = false;
            }

            if (failedDependency != null) {
                String message = "Dependency " + failedDependency + " failed";
                if (store.failJob(job.getId(), JobErrorKind.DEPENDENCY, message)) {
                    statuses.put(job.getJobId(), JobStatus.FAILED);
                    log.info("[Orchestrator] {} skipped: {}", job.getJobId(), message);
                    eventPublisher.jobFailed(job, JobErrorKind.DEPENDENCY, message);
                }
                continue;
            }
            if (!ready || !store.claimJob(job.getId())) continue;

            statuses.put(job.getJobId(), JobStatus.PROCESSING);
            if (store.markExecutionProcessing(executionId)) {
                log.info("[Orchestrator] Execution {} is processing", executionId);
            }
            eventPublisher.jobStarted(job);
            dispatch(job);
        }
        finishIfDone(executionId);
    }

    /**
     * Normalizes outputs, records the job as completed and advances the execution.
     *
     * @return false when the job was not processing (already terminal or unknown)
     */
    public boolean completeJob(UUID jobRecordId, List<MediaOutput> outputs, Map<String, Object> extras) {
        ExecutionJob job = store.findJob(jobRecordId).orElse(null);
        if (job == null || job.getStatus() != JobStatus.PROCESSING) {
            log.debug("[Orchestrator] Ignoring completion of job {} in state {}", jobRecordId,
                    job != null ? job.getStatus() : "unknown");
            return false;
        }
        List<MediaOutput> normalized;
        try {
            normalized = outputNormalizer.normalize(job.getExecutionId(), job.getJobId(), outputs);
        } catch (JobException e) {
            failJob(jobRecordId, e.getKind(), e.getMessage());
            return false;
        }
        Map<String, Object> result = JobResults.build(normalized, extras);
        if (!store.completeJob(jobRecordId, result)) {
            return false;
        }
        log.info("[Orchestrator] {} completed: {}", job.getJobId(), result.get("url"));
        eventPublisher.jobCompleted(job, result);
        if (JobWebhookService.isRequested(job)) {
            try {
                jobWebhooks.deliver(jobRecordId);
            } catch (RejectedExecutionException e) {
                log.warn("[Orchestrator] Job webhook for {} not scheduled: {}", job.getJobId(), e.getMessage());
            }
        }
        recordUsage(job.getExecutionId());
        emitReadyJobs(job.getExecutionId());
        return true;
    }

    /** @return false when the job was already terminal */
    public boolean failJob(UUID jobRecordId, JobErrorKind kind, String error) {
        ExecutionJob job = store.findJob(jobRecordId).orElse(null);
        if (job == null || !store.failJob(jobRecordId, kind, error)) {
            return false;
        }
        log.warn("[Orchestrator] {} failed ({}): {}", job.getJobId(), kind, error);
        eventPublisher.jobFailed(job, kind, error);
        emitReadyJobs(job.getExecutionId());
        return true;
    }

    void reportProgress(ExecutionJob job, int progress, String stage) {
        if (store.updateProgress(job.getId(), progress, stage)) {
            eventPublisher.jobProgress(job.getExecutionId(), job.getJobId(), progress, stage);
        }
    }

    private void dispatch(ExecutionJob job) {
        try {
            workerPool.execute(() -> runJob(job.getId()));
        } catch (RejectedExecutionException e) {
            failJob(job.getId(), JobErrorKind.INTERNAL, "Worker pool rejected job: " + e.getMessage());
        }
    }

    void runJob(UUID jobRecordId) {
        ExecutionJob job = store.findJob(jobRecordId).orElse(null);
        if (job == null || job.getStatus() != JobStatus.PROCESSING) return;
        Execution execution = store.findExecution(job.getExecutionId()).orElse(null);
        if (execution == null) {
            log.error("[Orchestrator] Job {} has no execution {}", jobRecordId, job.getExecutionId());
            return;
        }

        JobContext context = new JobContext(execution, job, dependencyResults(execution),
                (progress, stage) -> reportProgress(job, progress, stage));
        try {
            JobOutcome outcome = executorRegistry.get(job.getJobType()).execute(context);
            if (outcome.kind() == JobOutcome.Kind.COMPLETED) {
                completeJob(jobRecordId, outcome.outputs(), outcome.extras());
            } else {
                log.info("[Orchestrator] {} waiting for provider webhook", job.getJobId());
            }
        } catch (JobException e) {
            failJob(jobRecordId, e.getKind(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("[Orchestrator] {} crashed", job.getJobId(), e);
            failJob(jobRecordId, JobErrorKind.INTERNAL, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    private void finishIfDone(UUID executionId) {
        Optional<ExecutionOutcome> outcome = aggregator.aggregate(store.findJobs(executionId));
        if (outcome.isEmpty()) return;
        ExecutionOutcome o = outcome.get();
        if (!store.finishExecution(executionId, o.status(), o.result(), o.error())) return;

        Execution finished = store.findExecution(executionId)
                .orElseThrow(() -> new IllegalStateException("Execution vanished: " + executionId));
        log.info("[Orchestrator] Execution {} {}{}", executionId, o.status().wire(),
                o.error() != null ? ": " + o.error() : "");
        eventPublisher.executionFinished(finished);
        if (finished.getWebhook() != null && !finished.getWebhook().isBlank()) {
            try {
                webhookDelivery.deliver(executionId);
            } catch (RejectedExecutionException e) {
                // picked up by the retry sweep
                log.warn("[Orchestrator] Webhook for execution {} not scheduled: {}", executionId, e.getMessage());
            }
        }
    }

    // Completed results of this execution and its base execution, keyed by plan job id
    private Map<String, Map<String, Object>> dependencyResults(Execution execution) {
        Map<String, Map<String, Object>> results = new HashMap<>();
        if (execution.getBaseExecutionId() != null) {
            jobsByPlanId(execution.getBaseExecutionId()).forEach((id, job) -> putResult(results, job));
        }
        store.findJobs(execution.getId()).forEach(job -> putResult(results, job));
        return results;
    }

    private static void putResult(Map<String, Map<String, Object>> results, ExecutionJob job) {
        if (job.getStatus() == JobStatus.COMPLETED && job.getResult() != null) {
            results.put(job.getJobId(), job.getResult());
        }
    }

    private Map<String, ExecutionJob> jobsByPlanId(UUID executionId) {
        Map<String, ExecutionJob> jobs = new LinkedHashMap<>();
        store.findJobs(executionId).forEach(job -> jobs.put(job.getJobId(), job));
        return jobs;
    }

    private void recordUsage(UUID executionId) {
        store.findExecution(executionId).ifPresent(execution -> {
            try {
                usageTracker.recordCompletedJob(execution.getOrganizationId());
            } catch (DataAccessException e) {
                log.warn("[Orchestrator] Could not record usage for {}: {}", execution.getOrganizationId(), e.getMessage());
            }
        });
    }
}
