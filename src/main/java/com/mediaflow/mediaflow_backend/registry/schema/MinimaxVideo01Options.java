package com.mediaflow.mediaflow_backend.registry.schema;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

/** minimax/video-01 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MinimaxVideo01Options(
        @NotBlank String prompt,
        @JsonProperty("prompt_optimizer") Boolean promptOptimizer,
        @JsonProperty("first_frame_image") @Pattern(regexp = HTTP_URL, message = "must be an http(s) URL") String firstFrameImage,
        @JsonProperty("subject_reference") @Pattern(regexp = HTTP_URL, message = "must be an http(s) URL") String subjectReference
) implements ModelOptions {
}
