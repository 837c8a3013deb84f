package com.mediaflow.mediaflow_backend.client;

import com.mediaflow.mediaflow_backend.model.domain.MediaProvider;

import java.util.Objects;

/** Names the model a provider-backed operation runs on. */
public record ModelRef(MediaProvider provider, String modelId) {

    public ModelRef {
        Objects.requireNonNull(provider, "provider");
        if (modelId == null || modelId.isBlank()) {
            throw new IllegalArgumentException("modelId must not be blank");
        }
    }

    public static ModelRef replicate(String modelId) {
        return new ModelRef(MediaProvider.REPLICATE, modelId);
    }

    public static ModelRef fal(String modelId) {
        return new ModelRef(MediaProvider.FAL, modelId);
    }

    public static ModelRef elevenLabs(String modelId) {
        return new ModelRef(MediaProvider.ELEVENLABS, modelId);
    }
}
