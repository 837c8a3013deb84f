package com.mediaflow.mediaflow_backend.registry.schema;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/** elevenlabs/turbo-v2.5 text to speech */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ElevenLabsTurboOptions(
        @NotBlank @Size(max = 40000) @JsonAlias("prompt") String text,
        @JsonProperty("voice_id") String voiceId,
        @DecimalMin("0.0") @DecimalMax("1.0") Double stability,
        @JsonProperty("similarity_boost") @DecimalMin("0.0") @DecimalMax("1.0") Double similarityBoost,
        @DecimalMin("0.0") @DecimalMax("1.0") Double style,
        @DecimalMin("0.7") @DecimalMax("1.2") Double speed,
        @JsonProperty("language_code") @Size(min = 2, max = 2) String languageCode
) implements ModelOptions {
}
