package com.mediaflow.mediaflow_backend.registry.schema;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

/** vaibhavs10/incredibly-fast-whisper. Word timestamps come back as {@code chunks}. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IncrediblyFastWhisperOptions(
        @NotBlank @Pattern(regexp = HTTP_URL, message = "must be an http(s) URL") String audio,
        @Pattern(regexp = "transcribe|translate", message = "must be transcribe or translate") String task,
        String language,
        @Pattern(regexp = "chunk|word", message = "must be chunk or word") String timestamp,
        @JsonProperty("batch_size") @Min(1) Integer batchSize,
        Boolean diarization,
        @JsonProperty("hf_token") String hfToken
) implements ModelOptions {
}
