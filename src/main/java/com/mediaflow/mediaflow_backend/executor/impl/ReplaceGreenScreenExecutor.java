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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Replaces the green screen of a video with one or more backgrounds through the render service.
 * {@code background} is a URL, a list of URLs, or a dependency token; without a {@code video} param
 * the first dependency output that is not a background is keyed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReplaceGreenScreenExecutor implements JobExecutor {

    private final RenderServiceClient renderService;
    private final MediaStorage storage;
    private final DependencyResolver dependencyResolver;

    @Override
    public JobType supportedType() {
        return JobType.REPLACE_GREEN_SCREEN;
    }

    @Override
    public JobOutcome execute(JobContext context) {
        ExecutionJob job = context.job();
        Map<String, Object> params = dependencyResolver.resolve(job.getParams(), context.dependencyResults());

        List<String> backgrounds = backgrounds(params.get("background"));
        if (backgrounds.isEmpty()) {
            throw new JobFailureException(JobErrorKind.VALIDATION, "background is required in params");
        }
        String videoUrl = params.get("video") instanceof String s && !s.isBlank() ? s : null;
        if (videoUrl == null) {
            videoUrl = context.dependencyUrls().stream()
                    .filter(url -> !backgrounds.contains(url))
                    .findFirst()
                    .orElseThrow(() -> new JobFailureException(JobErrorKind.VALIDATION,
                            "video is required either in params or from dependencies"));
        }

        String color = params.get("chromaKeyColor") instanceof String c && !c.isBlank() ? c : null;
        Double similarity = params.get("similarity") instanceof Number n ? n.doubleValue() : null;
        Double blend = params.get("blend") instanceof Number n ? n.doubleValue() : null;

        context.progress().report(20, "processing_video");
        log.info("[GreenScreen] {} keying {} onto {} background(s)", job.getJobId(), videoUrl, backgrounds.size());
        byte[] video = renderService.replaceGreenScreen(videoUrl, backgrounds, color, similarity, blend);

        context.progress().report(80, "uploading");
        String url = storage.upload("executions/" + job.getExecutionId() + "/" + job.getJobId() + "/output.mp4",
                video, "video/mp4");
        return JobOutcome.completed(List.of(MediaOutput.of(MediaType.VIDEO, url, "video/mp4")),
                Map.of("backgroundCount", backgrounds.size(), "size", video.length));
    }

    private static List<String> backgrounds(Object value) {
        List<String> urls = new ArrayList<>();
        if (value instanceof String s && !s.isBlank()) {
            urls.add(s);
        } else if (value instanceof List<?> list) {
            for (Object item : list) {
                if (item instanceof String s && !s.isBlank()) urls.add(s);
            }
        }
        return urls;
    }
}
