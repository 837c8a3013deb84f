package com.mediaflow.mediaflow_backend.executor.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mediaflow.mediaflow_backend.engine.JobFailureException;
import com.mediaflow.mediaflow_backend.executor.DependencyResolver;
import com.mediaflow.mediaflow_backend.executor.JobContext;
import com.mediaflow.mediaflow_backend.executor.JobExecutor;
import com.mediaflow.mediaflow_backend.executor.JobOutcome;
import com.mediaflow.mediaflow_backend.executor.ProviderJobRunner;
import com.mediaflow.mediaflow_backend.model.domain.ExecutionJob;
import com.mediaflow.mediaflow_backend.model.domain.JobType;
import com.mediaflow.mediaflow_backend.model.job.JobErrorKind;
import com.mediaflow.mediaflow_backend.model.job.MediaOutput;
import com.mediaflow.mediaflow_backend.model.job.MediaType;
import com.mediaflow.mediaflow_backend.model.job.ParseResult;
import com.mediaflow.mediaflow_backend.storage.MediaStorage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Word-level speech to text. The soundtrack of the source video is extracted by the render service
 * and stored, then sent to a Replicate whisper model. The word list is stored as JSON and also kept
 * in the job result under {@code transcript}, next to the {@code videoUrl} it belongs to, so a
 * following addSubtitles job needs nothing else.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TranscribeExecutor implements JobExecutor {

    public static final String TRANSCRIPT_KEY = "transcript";
    public static final String SOURCE_VIDEO_KEY = "videoUrl";
    static final String DEFAULT_MODEL = "vaibhavs10/incredibly-fast-whisper";

    // explicit params win over these
    private static final Map<String, Map<String, Object>> MODEL_DEFAULTS = Map.of(
            "vaibhavs10/incredibly-fast-whisper", Map.of("task", "transcribe", "language", "None", "timestamp", "word"),
            "openai/whisper", Map.of("word_timestamps", true));

    private final ProviderJobRunner runner;
    private final RenderServiceClient renderService;
    private final MediaStorage storage;
    private final DependencyResolver dependencyResolver;
    private final ObjectMapper objectMapper;

    @Override
    public JobType supportedType() {
        return JobType.TRANSCRIBE;
    }

    @Override
    public JobOutcome execute(JobContext context) {
        ExecutionJob job = context.job();
        Map<String, Object> params = new LinkedHashMap<>(
                dependencyResolver.resolve(job.getParams(), context.dependencyResults()));

        String videoUrl = take(params, "videoUrl", "video");
        if (videoUrl == null) {
            List<String> urls = context.dependencyUrls();
            videoUrl = urls.isEmpty() ? null : urls.get(0);
        }
        String audioUrl = take(params, "audioUrl", "audio");
        if (videoUrl == null && audioUrl == null) {
            throw new JobFailureException(JobErrorKind.VALIDATION, "video is required either in params or from dependencies");
        }

        String prefix = "executions/" + job.getExecutionId() + "/" + job.getJobId() + "/";
        if (audioUrl == null) {
            context.progress().report(5, "extracting_audio");
            byte[] audio = renderService.extractAudio(videoUrl);
            audioUrl = storage.upload(prefix + "audio.mp3", audio, "audio/mpeg");
            log.info("[Transcribe] {} extracted audio to {}", job.getJobId(), audioUrl);
        }

        params.putIfAbsent("modelId", DEFAULT_MODEL);
        params.put("audio", audioUrl);
        MODEL_DEFAULTS.getOrDefault(String.valueOf(params.get("modelId")), Map.of()).forEach(params::putIfAbsent);

        ParseResult result = runner.runToCompletion(context, params, MediaType.TEXT);
        Map<String, Object> metadata = result.metadata() != null ? result.metadata() : Map.of();
        List<?> words = metadata.get(TRANSCRIPT_KEY) instanceof List<?> list ? list : List.of();
        if (words.isEmpty()) {
            throw new JobFailureException(JobErrorKind.EXTRACTION, "Transcription completed but returned no words");
        }

        context.progress().report(90, "uploading");
        byte[] json;
        try {
            json = objectMapper.writeValueAsBytes(words);
        } catch (JsonProcessingException e) {
            throw new JobFailureException(JobErrorKind.INTERNAL, "Could not serialize transcript: " + e.getOriginalMessage(), e);
        }
        String transcriptUrl = storage.upload(prefix + "transcript.json", json, MediaType.TEXT.getDefaultMimeType());
        log.info("[Transcribe] {} transcribed {} words into {}", job.getJobId(), words.size(), transcriptUrl);

        Map<String, Object> extras = new LinkedHashMap<>(metadata);
        extras.put("wordCount", words.size());
        extras.put("audioUrl", audioUrl);
        if (videoUrl != null) extras.put(SOURCE_VIDEO_KEY, videoUrl);
        return JobOutcome.completed(
                List.of(MediaOutput.of(MediaType.TEXT, transcriptUrl, MediaType.TEXT.getDefaultMimeType())), extras);
    }

    private static String take(Map<String, Object> params, String... keys) {
        String found = null;
        for (String key : keys) {
            Object value = params.remove(key);
            if (found == null && value instanceof String s && !s.isBlank()) found = s;
        }
        return found;
    }
}
