package com.mediaflow.mediaflow_backend.registry;

import com.fasterxml.jackson.databind.JsonNode;
import com.mediaflow.mediaflow_backend.model.job.MediaOutput;
import com.mediaflow.mediaflow_backend.model.job.MediaType;
import com.mediaflow.mediaflow_backend.model.job.ParseResult;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parsers for fal.ai queue payloads. Poll responses are {@code {status, output}}; webhooks are
 * {@code {status: OK|ERROR, request_id, payload}}.
 */
public final class FalResponseParsers {

    private FalResponseParsers() {}

    public static ResponseParser video() {
        return payload -> parse(payload, MediaType.VIDEO);
    }

    public static ResponseParser image() {
        return payload -> parse(payload, MediaType.IMAGE);
    }

    static ParseResult parse(JsonNode payload, MediaType mediaType) {
        if (payload == null || payload.isNull()) {
            return ParseResult.failed("Empty response from fal.ai");
        }
        String status = payload.path("status").asText("");
        switch (status) {
            case "FAILED", "ERROR" -> {
                return ParseResult.failed(errorMessage(payload));
            }
            case "IN_PROGRESS", "IN_QUEUE" -> {
                return ParseResult.processing();
            }
            case "COMPLETED", "OK" -> {
                List<MediaOutput> outputs = extractOutputs(document(payload), mediaType);
                if (outputs.isEmpty()) {
                    return ParseResult.failed("No " + mediaType.getId() + " output in completed response");
                }
                Map<String, Object> metadata = new LinkedHashMap<>();
                if (payload.hasNonNull("request_id")) {
                    metadata.put("requestId", payload.get("request_id").asText());
                }
                return ParseResult.completed(outputs, metadata);
            }
            default -> {
                return ParseResult.processing();
            }
        }
    }

    private static JsonNode document(JsonNode payload) {
        for (String key : new String[]{"payload", "output", "outputs", "response"}) {
            JsonNode node = payload.path(key);
            if (node.isArray() && !node.isEmpty()) return node.get(0);
            if (node.isObject()) return node;
        }
        return payload;
    }

    private static List<MediaOutput> extractOutputs(JsonNode document, MediaType mediaType) {
        List<MediaOutput> outputs = new ArrayList<>();
        if (mediaType == MediaType.VIDEO) {
            addFile(outputs, document.path("video"), mediaType, "video/mp4");
        } else {
            JsonNode images = document.path("images");
            if (images.isArray()) {
                images.forEach(image -> addFile(outputs, image, mediaType, "image/png"));
            }
            addFile(outputs, document.path("image"), mediaType, "image/png");
        }
        return outputs;
    }

    private static void addFile(List<MediaOutput> outputs, JsonNode file, MediaType mediaType, String defaultMime) {
        if (file.isTextual() && !file.asText().isBlank()) {
            outputs.add(MediaOutput.of(mediaType, file.asText(), defaultMime));
            return;
        }
        String url = file.path("url").asText("");
        if (url.isBlank()) return;
        String mime = file.path("content_type").asText(defaultMime);
        Integer width = file.path("width").isInt() ? file.get("width").asInt() : null;
        Integer height = file.path("height").isInt() ? file.get("height").asInt() : null;
        outputs.add(new MediaOutput(mediaType, url, mime, null, width, height));
    }

    private static String errorMessage(JsonNode payload) {
        JsonNode error = payload.path("error");
        if (error.isTextual() && !error.asText().isBlank()) return error.asText();
        JsonNode detail = payload.path("payload").path("detail");
        if (detail.isTextual()) return detail.asText();
        if (detail.isArray() && !detail.isEmpty()) return detail.get(0).path("msg").asText("Generation failed");
        return "Generation failed";
    }
}
