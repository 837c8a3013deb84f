package com.mediaflow.mediaflow_backend.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.mediaflow.mediaflow_backend.engine.ExecutionOrchestrator;
import com.mediaflow.mediaflow_backend.model.domain.ExecutionJob;
import com.mediaflow.mediaflow_backend.model.job.JobErrorKind;
import com.mediaflow.mediaflow_backend.model.job.ParseResult;
import com.mediaflow.mediaflow_backend.registry.ModelRegistry;
import com.mediaflow.mediaflow_backend.store.ExecutionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.UUID;

/**
 * Applies provider completion callbacks to waiting jobs. Callbacks for jobs that are already
 * terminal are acknowledged and ignored, so providers may retry freely.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProviderWebhookService {

    public enum Disposition { COMPLETED, FAILED, IGNORED, UNKNOWN_JOB }

    private final ExecutionStore store;
    private final ModelRegistry modelRegistry;
    private final ExecutionOrchestrator orchestrator;

    public Disposition handle(UUID jobRecordId, JsonNode payload) {
        ExecutionJob job = store.findJob(jobRecordId).orElse(null);
        if (job == null) {
            log.warn("[Webhook] Callback for unknown job {}", jobRecordId);
            return Disposition.UNKNOWN_JOB;
        }
        if (job.getStatus().isTerminal()) {
            log.info("[Webhook] Duplicate callback for {} ({}), ignoring", job.getJobId(), job.getStatus().wire());
            return Disposition.IGNORED;
        }

        String modelId = job.getModelId() != null ? job.getModelId() : paramModelId(job.getParams());
        ParseResult result;
        try {
            result = modelRegistry.parseModelWebhook(modelId, payload);
        } catch (IllegalArgumentException e) {
            orchestrator.failJob(jobRecordId, JobErrorKind.VALIDATION, e.getMessage());
            return Disposition.FAILED;
        }

        switch (result.status()) {
            case COMPLETED -> {
                if (result.outputs() == null || result.outputs().isEmpty()) {
                    orchestrator.failJob(jobRecordId, JobErrorKind.PROVIDER, "No outputs received from provider");
                    return Disposition.FAILED;
                }
                return orchestrator.completeJob(jobRecordId, result.outputs(), metadataOf(result))
                        ? Disposition.COMPLETED : Disposition.IGNORED;
            }
            case FAILED -> {
                String error = result.error() != null ? result.error() : "Generation failed";
                return orchestrator.failJob(jobRecordId, JobErrorKind.PROVIDER, error)
                        ? Disposition.FAILED : Disposition.IGNORED;
            }
            default -> {
                log.debug("[Webhook] {} still processing", job.getJobId());
                return Disposition.IGNORED;
            }
        }
    }

    private static Map<String, Object> metadataOf(ParseResult result) {
        return result.metadata() != null ? result.metadata() : Map.of();
    }

    private static String paramModelId(Map<String, Object> params) {
        Object modelId = params != null ? params.get("modelId") : null;
        return modelId != null ? modelId.toString() : null;
    }
}
