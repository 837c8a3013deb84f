package com.mediaflow.mediaflow_backend.registry;

import com.fasterxml.jackson.databind.JsonNode;
import com.mediaflow.mediaflow_backend.model.job.MediaOutput;
import com.mediaflow.mediaflow_backend.model.job.MediaType;
import com.mediaflow.mediaflow_backend.model.job.ParseResult;

import java.util.List;
import java.util.Map;

/**
 * ElevenLabs synthesis is synchronous; the adapter reports {@code {url, mimeType}} or {@code {error}}.
 * Audio that arrives as a bare base64 body is declared inline as a {@code data:} URI.
 */
public final class ElevenLabsResponseParsers {

    private ElevenLabsResponseParsers() {}

    public static ResponseParser audio() {
        return ElevenLabsResponseParsers::parse;
    }

    static ParseResult parse(JsonNode payload) {
        if (payload == null || payload.isNull()) {
            return ParseResult.failed("Empty response from ElevenLabs");
        }
        if (payload.hasNonNull("error")) {
            return ParseResult.failed(payload.get("error").asText());
        }
        String url = payload.path("url").asText("");
        if (!url.isBlank()) {
            String mime = payload.path("mimeType").asText("audio/mpeg");
            if (!url.startsWith("data:") && !url.startsWith("http://") && !url.startsWith("https://")) {
                url = "data:" + mime + ";base64," + url;
            }
            return ParseResult.completed(List.of(MediaOutput.of(MediaType.AUDIO, url, mime)), Map.of());
        }
        if ("completed".equals(payload.path("status").asText())) {
            return ParseResult.failed("No audio output in completed response");
        }
        return ParseResult.processing();
    }
}
