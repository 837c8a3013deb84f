package com.mediaflow.mediaflow_backend.registry.schema;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

/** arielreplicate/robust_video_matting */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record VideoMattingOptions(
        @JsonProperty("input_video") @NotBlank @Pattern(regexp = HTTP_URL, message = "must be an http(s) URL") String inputVideo,
        @JsonProperty("output_type")
        @Pattern(regexp = "green-screen|alpha-mask|foreground-mask", message = "must be green-screen, alpha-mask or foreground-mask")
        String outputType
) implements ModelOptions {
}
