package com.mediaflow.mediaflow_backend.executor.impl;

import com.mediaflow.mediaflow_backend.engine.JobFailureException;
import com.mediaflow.mediaflow_backend.executor.DependencyResolver;
import com.mediaflow.mediaflow_backend.executor.JobContext;
import com.mediaflow.mediaflow_backend.executor.JobExecutor;
import com.mediaflow.mediaflow_backend.executor.JobOutcome;
import com.mediaflow.mediaflow_backend.model.domain.ExecutionJob;
import com.mediaflow.mediaflow_backend.model.domain.JobType;
import com.mediaflow.mediaflow_backend.model.job.JobErrorKind;
import com.mediaflow.mediaflow_backend.model.job.MediaOutput;
import com.mediaflow.mediaflow_backend.model.job.MediaType;
import com.mediaflow.mediaflow_backend.storage.MediaStorage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Burns word-level captions into a video. The transcript is an inline word list, a URL to one, or
 * the {@code transcript} of a dependency's result. Without a {@code video} param the video comes from
 * the dependencies; a transcribe dependency contributes the video it transcribed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AddSubtitlesExecutor implements JobExecutor {

    private final RenderServiceClient renderService;
    private final MediaStorage storage;
    private final DependencyResolver dependencyResolver;

    @Override
    public JobType supportedType() {
        return JobType.ADD_SUBTITLES;
    }

    @Override
    @SuppressWarnings("unchecked")
    public JobOutcome execute(JobContext context) {
        ExecutionJob job = context.job();
        Map<String, Object> params = dependencyResolver.resolve(job.getParams(), context.dependencyResults());

        String videoUrl = firstString(params, "videoUrl", "video");
        if (videoUrl == null) {
            videoUrl = videoFromDependencies(context);
        }
        if (videoUrl == null) {
            throw new JobFailureException(JobErrorKind.VALIDATION, "video is required either in params or from dependencies");
        }

        context.progress().report(20, "fetching_transcript");
        List<?> transcript = transcript(context, params);

        context.progress().report(50, "rendering_subtitles");
        Map<String, Object> style = params.get("style") instanceof Map<?, ?> s ? (Map<String, Object>) s : null;
        String subtitles = renderService.generateSubtitles(transcript, style);

        context.progress().report(70, "burning_captions");
        byte[] video = renderService.burnSubtitles(videoUrl, subtitles);

        context.progress().report(90, "uploading");
        String url = storage.upload("captions/" + job.getId() + ".mp4", video, "video/mp4");
        log.info("[Subtitles] {} burned {} words into {}", job.getJobId(), transcript.size(), url);
        return JobOutcome.completed(List.of(MediaOutput.of(MediaType.VIDEO, url, "video/mp4")),
                Map.of("transcriptLength", transcript.size()));
    }

    private List<?> transcript(JobContext context, Map<String, Object> params) {
        Object transcript = params.containsKey("transcript") ? params.get("transcript") : params.get("transcriptUrl");
        if (transcript instanceof List<?> words) {
            return words;
        }
        if (transcript instanceof String url && !url.isBlank()) {
            return renderService.fetchTranscript(url);
        }
        for (String dep : context.job().getDependsOn()) {
            Map<String, Object> result = context.dependencyResults().get(dep);
            if (result != null && result.get(TranscribeExecutor.TRANSCRIPT_KEY) instanceof List<?> words) {
                return words;
            }
        }
        throw new JobFailureException(JobErrorKind.VALIDATION,
                "No transcript provided. Pass a transcript word list or a transcript URL");
    }

    // a transcribe dependency stands for the video it transcribed
    private static String videoFromDependencies(JobContext context) {
        for (String dep : context.job().getDependsOn()) {
            Map<String, Object> result = context.dependencyResults().get(dep);
            if (result == null) continue;
            String url = result.containsKey(TranscribeExecutor.TRANSCRIPT_KEY)
                    ? (result.get(TranscribeExecutor.SOURCE_VIDEO_KEY) instanceof String s ? s : null)
                    : DependencyResolver.extractUrl(result);
            if (url != null) return url;
        }
        return null;
    }

    private static String firstString(Map<String, Object> params, String... keys) {
        for (String key : keys) {
            if (params.get(key) instanceof String s && !s.isBlank()) return s;
        }
        return null;
    }
}
