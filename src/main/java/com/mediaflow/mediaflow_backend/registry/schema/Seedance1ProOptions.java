package com.mediaflow.mediaflow_backend.registry.schema;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

/** bytedance/seedance-1-pro */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Seedance1ProOptions(
        @NotBlank String prompt,
        @Pattern(regexp = "480p|720p|1080p", message = "must be one of 480p, 720p, 1080p") String resolution,
        @JsonProperty("aspect_ratio")
        @Pattern(regexp = "16:9|4:3|1:1|3:4|9:16|21:9|9:21", message = "must be one of 16:9, 4:3, 1:1, 3:4, 9:16, 21:9, 9:21")
        String aspectRatio,
        Integer seed,
        @Pattern(regexp = HTTP_URL, message = "must be an http(s) URL") String image,
        @Min(2) @Max(12) Integer duration,
        @JsonProperty("camera_fixed") Boolean cameraFixed,
        @JsonProperty("last_frame_image") @Pattern(regexp = HTTP_URL, message = "must be an http(s) URL") String lastFrameImage
) implements ModelOptions {
}
