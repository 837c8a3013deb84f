package com.mediaflow.mediaflow_backend.registry.schema;

import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

/** codeplugtech/background_remover */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ImageBackgroundRemoverOptions(
        @NotBlank @Pattern(regexp = HTTP_URL, message = "must be an http(s) URL") String image
) implements ModelOptions {
}
