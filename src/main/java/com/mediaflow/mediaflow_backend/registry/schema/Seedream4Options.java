package com.mediaflow.mediaflow_backend.registry.schema;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.util.List;

/** bytedance/seedream-4 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Seedream4Options(
        @NotBlank String prompt,
        @Pattern(regexp = "1K|2K|4K|custom", message = "must be one of 1K, 2K, 4K, custom") String size,
        @JsonProperty("aspect_ratio")
        @Pattern(regexp = "match_input_image|1:1|4:3|3:4|16:9|9:16|3:2|2:3|21:9",
                message = "must be match_input_image or one of 1:1, 4:3, 3:4, 16:9, 9:16, 3:2, 2:3, 21:9")
        String aspectRatio,
        @Min(1024) @Max(4096) Integer width,
        @Min(1024) @Max(4096) Integer height,
        @JsonProperty("max_images") @Min(1) @Max(15) Integer maxImages,
        @JsonProperty("image_input") @Size(max = 10) List<@Pattern(regexp = HTTP_URL, message = "must be an http(s) URL") String> imageInput,
        @JsonProperty("sequential_image_generation")
        @Pattern(regexp = "disabled|auto", message = "must be disabled or auto") String sequentialImageGeneration
) implements ModelOptions {

    @JsonIgnore
    @AssertTrue(message = "size=custom requires width and height")
    public boolean isCustomSizeComplete() {
        return !"custom".equals(size) || (width != null && height != null);
    }

    @JsonIgnore
    @AssertTrue(message = "aspect_ratio=match_input_image requires image_input")
    public boolean isMatchInputSatisfied() {
        return !"match_input_image".equals(aspectRatio) || (imageInput != null && !imageInput.isEmpty());
    }
}
