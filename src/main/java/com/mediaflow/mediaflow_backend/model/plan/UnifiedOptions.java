package com.mediaflow.mediaflow_backend.model.plan;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Provider-agnostic parameter set. Sent in a job's {@code unified} param block and translated per
 * model by the registry mappings.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record UnifiedOptions(
        String prompt,
        Integer duration,
        String resolution,
        String aspectRatio,
        Integer seed,
        String image,
        String audio,
        String video,
        String startImage,
        String endImage,
        String cameraMotion,   // "fixed" | "dynamic"
        String outputFormat,
        String outputType
) {

    public static final List<String> FIELD_NAMES = List.of(
            "prompt", "duration", "resolution", "aspectRatio", "seed", "image", "audio", "video",
            "startImage", "endImage", "cameraMotion", "outputFormat", "outputType");

    /** Non-null fields by name, in declaration order. */
    public Map<String, Object> presentFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        putIfPresent(fields, "prompt", prompt);
        putIfPresent(fields, "duration", duration);
        putIfPresent(fields, "resolution", resolution);
        putIfPresent(fields, "aspectRatio", aspectRatio);
        putIfPresent(fields, "seed", seed);
        putIfPresent(fields, "image", image);
        putIfPresent(fields, "audio", audio);
        putIfPresent(fields, "video", video);
        putIfPresent(fields, "startImage", startImage);
        putIfPresent(fields, "endImage", endImage);
        putIfPresent(fields, "cameraMotion", cameraMotion);
        putIfPresent(fields, "outputFormat", outputFormat);
        putIfPresent(fields, "outputType", outputType);
        return fields;
    }

    private static void putIfPresent(Map<String, Object> fields, String name, Object value) {
        if (value != null) fields.put(name, value);
    }
}
