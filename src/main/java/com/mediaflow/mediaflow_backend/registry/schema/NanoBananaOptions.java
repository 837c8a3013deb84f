package com.mediaflow.mediaflow_backend.registry.schema;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.util.List;

/** fal-ai/nano-banana, fal-ai/nano-banana-pro and fal-ai/nano-banana-pro/edit */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NanoBananaOptions(
        @NotBlank String prompt,
        @JsonProperty("aspect_ratio")
        @Pattern(regexp = "21:9|16:9|3:2|4:3|5:4|1:1|4:5|3:4|2:3|9:16",
                message = "must be one of 21:9, 16:9, 3:2, 4:3, 5:4, 1:1, 4:5, 3:4, 2:3, 9:16")
        String aspectRatio,
        @JsonProperty("output_format") @Pattern(regexp = "jpeg|png|webp", message = "must be jpeg, png or webp") String outputFormat,
        @JsonProperty("num_images") @Min(1) @Max(4) Integer numImages,
        @JsonProperty("image_urls") @Size(max = 14) List<@Pattern(regexp = HTTP_URL, message = "must be an http(s) URL") String> imageUrls
) implements ModelOptions {
}
