package com.mediaflow.mediaflow_backend.registry;

import com.mediaflow.mediaflow_backend.model.domain.MediaProvider;
import com.mediaflow.mediaflow_backend.model.job.MediaType;
import com.mediaflow.mediaflow_backend.model.job.ProviderCapabilities;
import com.mediaflow.mediaflow_backend.registry.mapping.ParameterMapping;
import com.mediaflow.mediaflow_backend.registry.schema.ModelOptions;

import java.util.Optional;

/**
 * Everything the engine needs to know about one model.
 *
 * @param providerModelId pinned provider version, when the model must not float to "latest"
 * @param mapping         unified-parameter translation, absent for models that only take native options
 */
public record ModelRegistryEntry(
        String modelId,
        MediaProvider provider,
        MediaType mediaType,
        Class<? extends ModelOptions> schema,
        ResponseParser webhookParser,
        ResponseParser pollingParser,
        ProviderCapabilities capabilities,
        String providerModelId,
        ParameterMapping mapping
) {

    public Optional<ParameterMapping> parameterMapping() {
        return Optional.ofNullable(mapping);
    }

    /** Model reference passed to the provider adapter: {@code owner/name} or {@code owner/name:version}. */
    public String providerTarget() {
        return providerModelId != null ? modelId + ":" + providerModelId : modelId;
    }
}
