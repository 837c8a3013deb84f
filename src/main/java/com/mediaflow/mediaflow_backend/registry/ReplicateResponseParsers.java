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
 * Parsers for Replicate prediction objects. Webhook bodies and {@code GET /predictions/{id}}
 * responses have the same shape, so one parser serves both paths.
 */
public final class ReplicateResponseParsers {

    private ReplicateResponseParsers() {}

    public static ResponseParser video() {
        return payload -> parse(payload, MediaType.VIDEO, "video/mp4");
    }

    public static ResponseParser image() {
        return payload -> parse(payload, MediaType.IMAGE, "image/jpeg");
    }

    public static ResponseParser audio() {
        return payload -> parse(payload, MediaType.AUDIO, "audio/mpeg");
    }

    /**
     * Speech-to-text models. The result carries no media; the normalized {@code [{word, start, end}]}
     * list is returned under the {@code transcript} metadata key.
     */
    public static ResponseParser transcript() {
        return ReplicateResponseParsers::parseTranscript;
    }

    static ParseResult parse(JsonNode payload, MediaType mediaType, String mimeType) {
        ParseResult unfinished = unlessSucceeded(payload);
        if (unfinished != null) {
            return unfinished;
        }
        List<MediaOutput> outputs = extractOutputs(payload.path("output"), mediaType, mimeType);
        if (outputs.isEmpty()) {
            return ParseResult.failed("No " + mediaType.getId() + " output in completed response");
        }
        return ParseResult.completed(outputs, metadata(payload));
    }

    static ParseResult parseTranscript(JsonNode payload) {
        ParseResult unfinished = unlessSucceeded(payload);
        if (unfinished != null) {
            return unfinished;
        }
        JsonNode output = payload.path("output");
        if (!output.isObject()) {
            return ParseResult.failed("No structured output in completed response");
        }
        List<Map<String, Object>> words;
        if (output.path("chunks").isArray()) {
            words = fromChunks(output.path("chunks"));
        } else if (output.path("segments").isArray()) {
            words = fromSegments(output.path("segments"));
        } else if (output.path("words").isArray()) {
            words = wordList(output.path("words"));
        } else {
            return ParseResult.failed("Transcription output format not recognized (missing chunks, segments, or words)");
        }
        if (words.isEmpty()) {
            return ParseResult.failed("Transcription completed but returned no words");
        }
        Map<String, Object> metadata = metadata(payload);
        metadata.put("transcript", words);
        if (output.path("text").isTextual()) {
            metadata.put("text", output.path("text").asText().trim());
        }
        return ParseResult.completed(List.of(), metadata);
    }

    // null once the prediction has succeeded
    private static ParseResult unlessSucceeded(JsonNode payload) {
        if (payload == null || payload.isNull()) {
            return ParseResult.failed("Empty response from Replicate");
        }
        String status = payload.path("status").asText("");
        return switch (status) {
            case "failed", "canceled" -> {
                String error = payload.path("error").isTextual() && !payload.path("error").asText().isBlank()
                        ? payload.path("error").asText()
                        : "Generation failed";
                yield ParseResult.failed(error);
            }
            case "succeeded" -> null;
            default -> ParseResult.processing();
        };
    }

    // incredibly-fast-whisper: {text, timestamp: [start, end]}; the last chunk may have no end
    private static List<Map<String, Object>> fromChunks(JsonNode chunks) {
        List<Map<String, Object>> words = new ArrayList<>();
        for (JsonNode chunk : chunks) {
            String text = chunk.path("text").asText("").trim();
            JsonNode timestamp = chunk.path("timestamp");
            if (text.isEmpty() || !timestamp.path(0).isNumber()) continue;
            double start = timestamp.path(0).asDouble();
            double end = timestamp.path(1).isNumber() ? timestamp.path(1).asDouble() : start;
            words.add(word(text, start, end));
        }
        return words;
    }

    // openai/whisper: segments carry a words array only when word_timestamps was requested
    private static List<Map<String, Object>> fromSegments(JsonNode segments) {
        List<Map<String, Object>> words = new ArrayList<>();
        for (JsonNode segment : segments) {
            words.addAll(wordList(segment.path("words")));
        }
        return words;
    }

    private static List<Map<String, Object>> wordList(JsonNode items) {
        List<Map<String, Object>> words = new ArrayList<>();
        for (JsonNode item : items) {
            String text = item.path("word").asText("").trim();
            if (text.isEmpty() || !item.path("start").isNumber()) continue;
            double start = item.path("start").asDouble();
            words.add(word(text, start, item.path("end").isNumber() ? item.path("end").asDouble() : start));
        }
        return words;
    }

    private static Map<String, Object> word(String text, double start, double end) {
        Map<String, Object> word = new LinkedHashMap<>();
        word.put("word", text);
        word.put("start", start);
        word.put("end", end);
        return word;
    }

    private static List<MediaOutput> extractOutputs(JsonNode output, MediaType mediaType, String mimeType) {
        List<MediaOutput> outputs = new ArrayList<>();
        if (output.isTextual() && !output.asText().isBlank()) {
            outputs.add(MediaOutput.of(mediaType, output.asText(), mimeType));
        } else if (output.isArray()) {
            for (JsonNode item : output) {
                String url = item.isTextual() ? item.asText() : item.path("url").asText("");
                if (!url.isBlank()) {
                    outputs.add(MediaOutput.of(mediaType, url, mimeType));
                }
            }
        } else if (output.isObject() && output.path("url").isTextual()) {
            outputs.add(MediaOutput.of(mediaType, output.path("url").asText(), mimeType));
        }
        return outputs;
    }

    private static Map<String, Object> metadata(JsonNode payload) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (payload.hasNonNull("id")) {
            metadata.put("predictionId", payload.get("id").asText());
        }
        JsonNode predictTime = payload.path("metrics").path("predict_time");
        if (predictTime.isNumber()) {
            metadata.put("predictTime", predictTime.asDouble());
        }
        return metadata;
    }
}
