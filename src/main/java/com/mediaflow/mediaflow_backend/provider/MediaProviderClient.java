package com.mediaflow.mediaflow_backend.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.mediaflow.mediaflow_backend.model.domain.MediaProvider;
import com.mediaflow.mediaflow_backend.model.job.ProviderCapabilities;

import java.util.Map;
import java.util.Optional;

/**
 * One external generative-media provider. Instances are bound to a single credential and are
 * obtained from {@link ProviderClientFactory}.
 */
public interface MediaProviderClient {

    MediaProvider getProvider();

    /**
     * Starts a generation.
     *
     * @param model      provider model reference, optionally pinned as {@code owner/name:version}
     * @param params     validated provider-native params
     * @param webhookUrl callback for completion, or null to poll
     */
    GenerationStart startGeneration(String model, Map<String, Object> params, String webhookUrl);

    ProviderJobStatus getJobStatus(String providerJobId);

    /** Full provider payload for model-specific parsing, where the provider exposes one. */
    default Optional<JsonNode> getRawJobResponse(String providerJobId) {
        return Optional.empty();
    }

    ProviderCapabilities getCapabilities();
}
