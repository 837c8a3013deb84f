package com.mediaflow.mediaflow_backend.engine;

import com.mediaflow.mediaflow_backend.model.job.MediaOutput;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Shape of a completed job's stored result: {@code {url, outputs, completedAt, ...extras}}. */
public final class JobResults {

    private JobResults() {}

    public static Map<String, Object> build(List<MediaOutput> outputs, Map<String, Object> extras) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("url", outputs.isEmpty() ? null : outputs.get(0).url());
        List<Map<String, Object>> serialized = new ArrayList<>();
        for (MediaOutput output : outputs) {
            serialized.add(toMap(output));
        }
        result.put("outputs", serialized);
        result.put("completedAt", Instant.now().toString());
        if (extras != null) {
            extras.forEach(result::putIfAbsent);
        }
        return result;
    }

    static Map<String, Object> toMap(MediaOutput output) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("type", output.type().getId());
        map.put("url", output.url());
        if (output.mimeType() != null) map.put("mimeType", output.mimeType());
        if (output.duration() != null) map.put("duration", output.duration());
        if (output.width() != null) map.put("width", output.width());
        if (output.height() != null) map.put("height", output.height());
        return map;
    }
}
