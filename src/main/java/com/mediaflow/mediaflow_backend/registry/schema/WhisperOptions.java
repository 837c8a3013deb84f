package com.mediaflow.mediaflow_backend.registry.schema;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

/** openai/whisper. Leave {@code transcription} unset to get segments with word timestamps. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WhisperOptions(
        @NotBlank @Pattern(regexp = HTTP_URL, message = "must be an http(s) URL") String audio,
        String model,
        String language,
        Boolean translate,
        @DecimalMin("0.0") Double temperature,
        @Pattern(regexp = "plain text|srt|vtt", message = "must be plain text, srt or vtt") String transcription,
        @JsonProperty("word_timestamps") Boolean wordTimestamps,
        @JsonProperty("suppress_tokens") String suppressTokens,
        @JsonProperty("logprob_threshold") Double logprobThreshold,
        @JsonProperty("no_speech_threshold") Double noSpeechThreshold,
        @JsonProperty("condition_on_previous_text") Boolean conditionOnPreviousText,
        @JsonProperty("compression_ratio_threshold") Double compressionRatioThreshold,
        @JsonProperty("temperature_increment_on_fallback") Double temperatureIncrementOnFallback
) implements ModelOptions {
}
