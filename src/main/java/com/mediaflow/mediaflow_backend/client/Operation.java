package com.mediaflow.mediaflow_backend.client;

import com.mediaflow.mediaflow_backend.model.domain.JobType;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Client-side description of one media transformation. Operations are never sent as-is: the
 * {@link ExecutionPlanBuilder} compiles them, and any operation nested under one of {@link #NESTED_KEYS},
 * into plan jobs.
 */
public sealed interface Operation extends MediaInput
        permits Operation.GenerateVideo, Operation.GenerateImage, Operation.GenerateAudio, Operation.Merge,
                Operation.AddSubtitles, Operation.RemoveBackground, Operation.RemoveImageBackground,
                Operation.Transcribe, Operation.ReplaceGreenScreen {

    /** Param keys that may hold a nested operation. */
    List<String> NESTED_KEYS = List.of("image", "audio", "video", "background");

    JobType type();

    /**
     * Wire params. Media inputs appear as URL strings, or as the nested {@link Operation} itself when one
     * was given.
     */
    Map<String, Object> params();

    record GenerateVideo(ModelRef model, String prompt, MediaInput image, MediaInput audio,
                         Map<String, Object> options) implements Operation {

        public GenerateVideo {
            Objects.requireNonNull(model, "model");
            options = options != null ? Map.copyOf(options) : Map.of();
        }

        public GenerateVideo(ModelRef model, String prompt) {
            this(model, prompt, null, null, null);
        }

        public GenerateVideo withImage(MediaInput newImage) {
            return new GenerateVideo(model, prompt, newImage, audio, options);
        }

        public GenerateVideo withAudio(MediaInput newAudio) {
            return new GenerateVideo(model, prompt, image, newAudio, options);
        }

        @Override
        public JobType type() { return JobType.GENERATE; }

        @Override
        public Map<String, Object> params() {
            Map<String, Object> params = modelParams(model, options);
            putIfPresent(params, "prompt", prompt);
            putMedia(params, "image", image);
            putMedia(params, "audio", audio);
            return params;
        }
    }

    record GenerateImage(ModelRef model, String prompt, MediaInput image,
                         Map<String, Object> options) implements Operation {

        public GenerateImage {
            Objects.requireNonNull(model, "model");
            options = options != null ? Map.copyOf(options) : Map.of();
        }

        public GenerateImage(ModelRef model, String prompt) {
            this(model, prompt, null, null);
        }

        @Override
        public JobType type() { return JobType.GENERATE_IMAGE; }

        @Override
        public Map<String, Object> params() {
            Map<String, Object> params = modelParams(model, options);
            putIfPresent(params, "prompt", prompt);
            putMedia(params, "image", image);
            return params;
        }
    }

    record GenerateAudio(ModelRef model, String text, Map<String, Object> options) implements Operation {

        public GenerateAudio {
            Objects.requireNonNull(model, "model");
            options = options != null ? Map.copyOf(options) : Map.of();
        }

        public GenerateAudio(ModelRef model, String text) {
            this(model, text, null);
        }

        @Override
        public JobType type() { return JobType.GENERATE_AUDIO; }

        @Override
        public Map<String, Object> params() {
            Map<String, Object> params = modelParams(model, options);
            putIfPresent(params, "text", text);
            return params;
        }
    }

    /** Concatenates every video produced since the previous merge. */
    record Merge(String transition, Double transitionDuration) implements Operation {

        public static final String DEFAULT_TRANSITION = "cut";

        public Merge {
            transition = transition != null && !transition.isBlank() ? transition : DEFAULT_TRANSITION;
        }

        public Merge() {
            this(null, null);
        }

        @Override
        public JobType type() { return JobType.MERGE; }

        @Override
        public Map<String, Object> params() {
            Map<String, Object> params = new LinkedHashMap<>();
            params.put("transition", transition);
            putIfPresent(params, "transitionDuration", transitionDuration);
            return params;
        }
    }

    /**
     * Burns captions into a video. Without a {@code video} the previous job's output is captioned; without a
     * transcript the server looks for one in the dependency results.
     */
    record AddSubtitles(MediaInput video, List<Map<String, Object>> transcript, String transcriptUrl,
                        Map<String, Object> style) implements Operation {

        public AddSubtitles {
            transcript = transcript != null ? List.copyOf(transcript) : null;
            style = style != null ? Map.copyOf(style) : null;
        }

        public AddSubtitles() {
            this(null, null, null, null);
        }

        @Override
        public JobType type() { return JobType.ADD_SUBTITLES; }

        @Override
        public Map<String, Object> params() {
            Map<String, Object> params = new LinkedHashMap<>();
            putMedia(params, "video", video);
            putIfPresent(params, "transcript", transcript);
            putIfPresent(params, "transcriptUrl", transcriptUrl);
            putIfPresent(params, "style", style);
            return params;
        }
    }

    record RemoveBackground(ModelRef model, MediaInput video, Map<String, Object> options) implements Operation {

        public RemoveBackground {
            Objects.requireNonNull(model, "model");
            options = options != null ? Map.copyOf(options) : Map.of();
        }

        public RemoveBackground(ModelRef model) {
            this(model, null, null);
        }

        @Override
        public JobType type() { return JobType.REMOVE_BACKGROUND; }

        @Override
        public Map<String, Object> params() {
            Map<String, Object> params = modelParams(model, options);
            putMedia(params, "video", video);
            return params;
        }
    }

    record RemoveImageBackground(ModelRef model, MediaInput image, Map<String, Object> options) implements Operation {

        public RemoveImageBackground {
            Objects.requireNonNull(model, "model");
            options = options != null ? Map.copyOf(options) : Map.of();
        }

        public RemoveImageBackground(ModelRef model, MediaInput image) {
            this(model, image, null);
        }

        @Override
        public JobType type() { return JobType.REMOVE_IMAGE_BACKGROUND; }

        @Override
        public Map<String, Object> params() {
            Map<String, Object> params = modelParams(model, options);
            putMedia(params, "image", image);
            return params;
        }
    }

    /**
     * Word-level transcript of a video. Without a {@code video} the previous job's output is transcribed;
     * without a model the server picks its default whisper model.
     */
    record Transcribe(ModelRef model, MediaInput video, Map<String, Object> options) implements Operation {

        public Transcribe {
            options = options != null ? Map.copyOf(options) : Map.of();
        }

        public Transcribe() {
            this(null, null, null);
        }

        public Transcribe(ModelRef model) {
            this(model, null, null);
        }

        @Override
        public JobType type() { return JobType.TRANSCRIBE; }

        @Override
        public Map<String, Object> params() {
            Map<String, Object> params = model != null ? modelParams(model, options) : new LinkedHashMap<>(options);
            putMedia(params, "video", video);
            return params;
        }
    }

    /**
     * Keys out a green screen and fills it with {@code background}, an image or video URL or a nested
     * operation producing one. Without a {@code video} the previous job's output is keyed.
     */
    record ReplaceGreenScreen(MediaInput video, MediaInput background, String chromaKeyColor,
                              Double similarity, Double blend) implements Operation {

        public ReplaceGreenScreen {
            Objects.requireNonNull(background, "background");
        }

        public ReplaceGreenScreen(MediaInput background) {
            this(null, background, null, null, null);
        }

        @Override
        public JobType type() { return JobType.REPLACE_GREEN_SCREEN; }

        @Override
        public Map<String, Object> params() {
            Map<String, Object> params = new LinkedHashMap<>();
            putMedia(params, "video", video);
            putMedia(params, "background", background);
            putIfPresent(params, "chromaKeyColor", chromaKeyColor);
            putIfPresent(params, "similarity", similarity);
            putIfPresent(params, "blend", blend);
            return params;
        }
    }

    private static Map<String, Object> modelParams(ModelRef model, Map<String, Object> options) {
        Map<String, Object> params = new LinkedHashMap<>(options);
        params.put("modelId", model.modelId());
        params.put("provider", model.provider().getId());
        return params;
    }

    private static void putIfPresent(Map<String, Object> params, String key, Object value) {
        if (value != null) params.put(key, value);
    }

    private static void putMedia(Map<String, Object> params, String key, MediaInput input) {
        if (input instanceof MediaInput.Url url) {
            params.put(key, url.url());
        } else if (input instanceof Operation nested) {
            params.put(key, nested);
        }
    }
}
