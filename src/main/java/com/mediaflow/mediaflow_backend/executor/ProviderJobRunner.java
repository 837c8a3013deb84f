package com.mediaflow.mediaflow_backend.executor;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mediaflow.mediaflow_backend.config.MediaflowProperties;
import com.mediaflow.mediaflow_backend.engine.JobFailureException;
import com.mediaflow.mediaflow_backend.engine.JobPoller;
import com.mediaflow.mediaflow_backend.model.domain.ExecutionJob;
import com.mediaflow.mediaflow_backend.model.job.JobErrorKind;
import com.mediaflow.mediaflow_backend.model.job.MediaOutput;
import com.mediaflow.mediaflow_backend.model.job.MediaType;
import com.mediaflow.mediaflow_backend.model.job.ParseResult;
import com.mediaflow.mediaflow_backend.model.job.ProviderCapabilities;
import com.mediaflow.mediaflow_backend.model.job.ProviderJobState;
import com.mediaflow.mediaflow_backend.model.job.WaitingStrategy;
import com.mediaflow.mediaflow_backend.model.plan.UnifiedOptions;
import com.mediaflow.mediaflow_backend.provider.CredentialResolver;
import com.mediaflow.mediaflow_backend.provider.GenerationStart;
import com.mediaflow.mediaflow_backend.provider.MediaProviderClient;
import com.mediaflow.mediaflow_backend.provider.ProviderCallException;
import com.mediaflow.mediaflow_backend.provider.ProviderClientFactory;
import com.mediaflow.mediaflow_backend.provider.ProviderJobStatus;
import com.mediaflow.mediaflow_backend.registry.ModelRegistry;
import com.mediaflow.mediaflow_backend.registry.ModelRegistryEntry;
import com.mediaflow.mediaflow_backend.registry.mapping.MappedOptions;
import com.mediaflow.mediaflow_backend.registry.schema.ModelOptions;
import com.mediaflow.mediaflow_backend.store.ExecutionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Runs one provider-backed job: resolve the model, validate params, start the provider job and
 * either leave it waiting for the provider webhook or poll it to a terminal state.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProviderJobRunner {

    public static final String WEBHOOK_PATH = "/api/webhooks/job/";

    private final ModelRegistry modelRegistry;
    private final ProviderClientFactory clientFactory;
    private final CredentialResolver credentialResolver;
    private final ExecutionStore store;
    private final JobPoller poller;
    private final MediaflowProperties properties;
    private final ObjectMapper objectMapper;

    /**
     * @param params job params with dependency tokens already resolved
     */
    public JobOutcome run(JobContext context, Map<String, Object> params, MediaType expectedMediaType) {
        Submission submission = submit(context, params, expectedMediaType, true);
        if (submission.start().waitingStrategy() == WaitingStrategy.WEBHOOK) {
            return JobOutcome.awaitingWebhook();
        }
        ParseResult result = await(context, submission);
        if (result.outputs() == null || result.outputs().isEmpty()) {
            throw new ProviderCallException("No outputs received from provider");
        }
        // provider metadata (prediction id, timings) is stored next to the outputs
        return JobOutcome.completed(result.outputs(), result.metadata() != null ? result.metadata() : Map.of());
    }

    /**
     * Runs a model whose result the calling executor still has to process, such as a transcript.
     * No webhook URL is sent; the provider job is always polled to completion on this thread.
     *
     * @return the completed parse result, never a failed one
     */
    public ParseResult runToCompletion(JobContext context, Map<String, Object> params, MediaType expectedMediaType) {
        return await(context, submit(context, params, expectedMediaType, false));
    }

    private Submission submit(JobContext context, Map<String, Object> params, MediaType expectedMediaType,
                              boolean allowWebhook) {
        ExecutionJob job = context.job();
        Map<String, Object> providerParams = new LinkedHashMap<>(params);
        String modelId = asString(providerParams.remove("modelId"));
        String requestedProvider = asString(providerParams.remove("provider"));
        String apiKey = asString(providerParams.remove("apiKey"));
        Object unifiedBlock = providerParams.remove("unified");

        if (modelId == null || modelId.isBlank()) {
            throw new JobFailureException(JobErrorKind.VALIDATION, "Job " + job.getJobId() + " has no modelId");
        }
        ModelRegistryEntry entry = modelRegistry.getModelInfo(modelId)
                .orElseThrow(() -> new JobFailureException(JobErrorKind.VALIDATION, "Unknown model: " + modelId));
        if (requestedProvider != null && !requestedProvider.equalsIgnoreCase(entry.provider().getId())) {
            throw new JobFailureException(JobErrorKind.VALIDATION, "Model " + modelId + " is served by "
                    + entry.provider().getId() + ", not " + requestedProvider);
        }
        if (entry.mediaType() != expectedMediaType) {
            throw new JobFailureException(JobErrorKind.VALIDATION, "Model " + modelId + " produces "
                    + entry.mediaType().getId() + ", but " + job.getJobType().getWireName() + " needs " + expectedMediaType.getId());
        }

        Map<String, Object> metadata = new HashMap<>();
        if (unifiedBlock instanceof Map<?, ?> unifiedMap) {
            providerParams = applyUnified(entry, unifiedMap, providerParams, metadata);
        }

        ModelOptions options = modelRegistry.parseModelOptions(modelId, providerParams);
        Map<String, Object> payload = options.toPayload(objectMapper);

        String credential = credentialResolver.resolve(context.execution(), entry.provider(), apiKey);
        MediaProviderClient client = clientFactory.getClient(entry.provider(), credential);

        String webhookUrl = allowWebhook ? webhookUrlFor(entry.capabilities(), job) : null;
        context.progress().report(10, "submitting");
        GenerationStart start = client.startGeneration(entry.providerTarget(), payload, webhookUrl);
        store.recordProviderJob(job.getId(), entry.provider(), modelId, start.providerJobId(), start.waitingStrategy(), metadata);
        log.info("[Jobs] {} started {} job {} on {} ({})", job.getJobId(), modelId, start.providerJobId(),
                entry.provider().getDisplayName(), start.waitingStrategy());
        context.progress().report(20, "submitted");
        return new Submission(entry, client, start);
    }

    private ParseResult await(JobContext context, Submission submission) {
        ModelRegistryEntry entry = submission.entry();
        MediaProviderClient client = submission.client();
        String providerJobId = submission.start().providerJobId();
        Supplier<ParseResult> check = () -> client.getRawJobResponse(providerJobId)
                .map(raw -> modelRegistry.parseModelPolling(entry.modelId(), raw))
                .orElseGet(() -> fromStatus(client.getJobStatus(providerJobId), entry.mediaType()));
        ParseResult result = poller.poll(properties.getPolling().forMediaType(entry.mediaType()),
                submission.start().waitingStrategy() == WaitingStrategy.SYNCHRONOUS, check,
                progress -> context.progress().report(progress, "processing"));

        if (result.status() == ProviderJobState.FAILED) {
            throw new ProviderCallException(result.error() != null ? result.error() : "Generation failed");
        }
        return result;
    }

    private record Submission(ModelRegistryEntry entry, MediaProviderClient client, GenerationStart start) {
    }

    private Map<String, Object> applyUnified(ModelRegistryEntry entry, Map<?, ?> unifiedMap,
                                             Map<String, Object> explicit, Map<String, Object> metadata) {
        UnifiedOptions unified;
        try {
            unified = objectMapper.convertValue(unifiedMap, UnifiedOptions.class);
        } catch (IllegalArgumentException e) {
            throw new JobFailureException(JobErrorKind.VALIDATION, "Invalid unified options: " + e.getMessage(), e);
        }
        MappedOptions mapped;
        try {
            mapped = modelRegistry.mapUnifiedToProviderOptions(entry.provider(), entry.modelId(), unified);
        } catch (IllegalArgumentException e) {
            throw new JobFailureException(JobErrorKind.VALIDATION, e.getMessage(), e);
        }
        if (!mapped.coercions().isEmpty()) {
            metadata.put("coercions", mapped.coercions());
        }
        // explicit provider-native params win over mapped ones
        Map<String, Object> merged = new LinkedHashMap<>(mapped.options());
        merged.putAll(explicit);
        return merged;
    }

    private String webhookUrlFor(ProviderCapabilities capabilities, ExecutionJob job) {
        if (capabilities.defaultStrategy() != WaitingStrategy.WEBHOOK || !capabilities.supportsWebhooks()) {
            return null;
        }
        String base = properties.getApiBaseUrl();
        if (base == null || base.isBlank()) {
            log.debug("[Jobs] No api-base-url configured, {} falls back to polling", job.getJobId());
            return null;
        }
        String trimmed = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
        return trimmed + WEBHOOK_PATH + job.getId();
    }

    static ParseResult fromStatus(ProviderJobStatus status, MediaType mediaType) {
        return switch (status.state()) {
            case COMPLETED -> status.resultUrl() == null
                    ? ParseResult.failed("No " + mediaType.getId() + " output in completed response")
                    : ParseResult.completed(List.of(MediaOutput.of(mediaType, status.resultUrl(), mediaType.getDefaultMimeType())), Map.of());
            case FAILED -> ParseResult.failed(status.error() != null ? status.error() : "Generation failed");
            case PROCESSING -> ParseResult.processing();
        };
    }

    private static String asString(Object value) {
        return value != null ? value.toString() : null;
    }
}
