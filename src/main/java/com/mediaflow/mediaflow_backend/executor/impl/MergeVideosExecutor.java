package com.mediaflow.mediaflow_backend.executor.impl;

import com.mediaflow.mediaflow_backend.engine.JobFailureException;
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

/** Concatenates the videos of all dependencies, in dependency order, through the render service. */
@Slf4j
@Component
@RequiredArgsConstructor
public class MergeVideosExecutor implements JobExecutor {

    static final String DEFAULT_TRANSITION = "cut";
    static final double DEFAULT_TRANSITION_DURATION = 1.0;

    private final RenderServiceClient renderService;
    private final MediaStorage storage;

    @Override
    public JobType supportedType() {
        return JobType.MERGE;
    }

    @Override
    public JobOutcome execute(JobContext context) {
        ExecutionJob job = context.job();
        List<String> videoUrls = context.dependencyUrls();
        if (videoUrls.size() < 2) {
            throw new JobFailureException(JobErrorKind.VALIDATION,
                    "At least 2 video URLs required for merging, got " + videoUrls.size());
        }

        String transition = DEFAULT_TRANSITION;
        double duration = DEFAULT_TRANSITION_DURATION;
        Map<String, Object> params = job.getParams() != null ? job.getParams() : Map.of();
        Object configured = params.get("transition");
        if (configured instanceof Map<?, ?> map) {
            if (map.get("type") instanceof String type) transition = type;
            if (map.get("duration") instanceof Number d) duration = d.doubleValue();
        } else if (configured instanceof String type && !type.isBlank()) {
            transition = type;
        }
        if (params.get("transitionDuration") instanceof Number d) duration = d.doubleValue();

        context.progress().report(30, "merging");
        log.info("[Merge] {} merging {} videos (transition={})", job.getJobId(), videoUrls.size(), transition);
        byte[] merged = renderService.merge(videoUrls, transition, duration);

        context.progress().report(80, "uploading");
        String url = storage.upload("executions/" + job.getExecutionId() + "/" + job.getJobId() + "/output.mp4",
                merged, "video/mp4");
        return JobOutcome.completed(List.of(MediaOutput.of(MediaType.VIDEO, url, "video/mp4")),
                Map.of("inputCount", videoUrls.size()));
    }
}
