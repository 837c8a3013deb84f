package com.mediaflow.mediaflow_backend.model.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum MediaProvider {

    REPLICATE("replicate", "Replicate", "https://api.replicate.com/v1", "REPLICATE_API_KEY"),
    FAL("fal", "fal.ai", "https://queue.fal.run", "FAL_KEY"),
    ELEVENLABS("elevenlabs", "ElevenLabs", "https://api.elevenlabs.io/v1", "ELEVENLABS_API_KEY");

    private final String id;
    private final String displayName;
    private final String defaultBaseUrl;
    private final String apiKeyEnvVar;

    MediaProvider(String id, String displayName, String defaultBaseUrl, String apiKeyEnvVar) {
        this.id = id;
        this.displayName = displayName;
        this.defaultBaseUrl = defaultBaseUrl;
        this.apiKeyEnvVar = apiKeyEnvVar;
    }

    @JsonValue
    public String getId() { return id; }
    public String getDisplayName() { return displayName; }
    public String getDefaultBaseUrl() { return defaultBaseUrl; }
    public String getApiKeyEnvVar() { return apiKeyEnvVar; }

    @JsonCreator
    public static MediaProvider fromId(String value) {
        return Arrays.stream(values())
                .filter(p -> p.id.equalsIgnoreCase(value) || p.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown provider: " + value));
    }
}
