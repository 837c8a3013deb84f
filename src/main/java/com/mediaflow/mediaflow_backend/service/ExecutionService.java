package com.mediaflow.mediaflow_backend.service;

import com.mediaflow.mediaflow_backend.engine.ExecutionAggregator;
import com.mediaflow.mediaflow_backend.engine.ExecutionOrchestrator;
import com.mediaflow.mediaflow_backend.engine.InvalidPlanException;
import com.mediaflow.mediaflow_backend.engine.SubmissionOptions;
import com.mediaflow.mediaflow_backend.model.domain.Execution;
import com.mediaflow.mediaflow_backend.model.dto.ExecuteOptions;
import com.mediaflow.mediaflow_backend.model.dto.ExecutionStatusResponse;
import com.mediaflow.mediaflow_backend.model.plan.ExecutionPlan;
import com.mediaflow.mediaflow_backend.store.ExecutionStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class ExecutionService {

    private final ExecutionOrchestrator orchestrator;
    private final ExecutionStore store;
    private final ExecutionAggregator aggregator;
    private final UsageTracker usageTracker;

    /**
     * @throws InvalidPlanException        when the plan cannot be scheduled
     * @throws UsageLimitExceededException when the organization is over its monthly limit
     */
    public Execution submit(String organizationId, ExecutionPlan plan, ExecuteOptions options) {
        ExecuteOptions opts = options != null ? options : ExecuteOptions.none();
        usageTracker.assertWithinLimit(organizationId);

        // options win over the plan's own baseExecutionId
        String baseId = opts.baseExecutionId() != null ? opts.baseExecutionId() : plan != null ? plan.baseExecutionId() : null;
        return orchestrator.createExecution(plan, new SubmissionOptions(
                organizationId, opts.webhook(), opts.webhookSecret(), parseBaseId(baseId), opts.providerApiKeys()));
    }

    public Optional<ExecutionStatusResponse> getStatus(UUID executionId) {
        return store.findExecution(executionId)
                .map(execution -> aggregator.toStatusResponse(execution, store.findJobs(executionId)));
    }

    private static UUID parseBaseId(String baseId) {
        if (baseId == null || baseId.isBlank()) return null;
        try {
            return UUID.fromString(baseId);
        } catch (IllegalArgumentException e) {
            throw new InvalidPlanException("baseExecutionId is not a valid id: " + baseId);
        }
    }
}
