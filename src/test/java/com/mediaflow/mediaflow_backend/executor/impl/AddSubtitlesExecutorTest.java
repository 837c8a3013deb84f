package com.mediaflow.mediaflow_backend.executor.impl;

import com.mediaflow.mediaflow_backend.engine.JobFailureException;
import com.mediaflow.mediaflow_backend.executor.DependencyResolver;
import com.mediaflow.mediaflow_backend.executor.JobContext;
import com.mediaflow.mediaflow_backend.executor.JobOutcome;
import com.mediaflow.mediaflow_backend.executor.ProgressReporter;
import com.mediaflow.mediaflow_backend.model.domain.Execution;
import com.mediaflow.mediaflow_backend.model.domain.ExecutionJob;
import com.mediaflow.mediaflow_backend.model.domain.JobType;
import com.mediaflow.mediaflow_backend.storage.MediaStorage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AddSubtitlesExecutorTest {

    private static final List<Map<String, Object>> WORDS = List.of(
            Map.of("text", "hello", "start", 0.0, "end", 0.4),
            Map.of("text", "world", "start", 0.4, "end", 0.9));

    @Mock private RenderServiceClient renderService;
    @Mock private MediaStorage storage;

    private AddSubtitlesExecutor executor;
    private ExecutionJob job;

    @BeforeEach
    void setUp() {
        executor = new AddSubtitlesExecutor(renderService, storage, new DependencyResolver());
        job = new ExecutionJob();
        job.setId(UUID.randomUUID());
        job.setJobId("job3");
        job.setJobType(JobType.ADD_SUBTITLES);
    }

    @Test
    void captionsThePreviousJobsVideoWithAnInlineTranscript() {
        job.setDependsOn(List.of("job2"));
        job.setParams(Map.of("transcript", WORDS, "style", Map.of("preset", "bold")));
        when(renderService.generateSubtitles(WORDS, Map.of("preset", "bold"))).thenReturn("[Script Info]");
        when(renderService.burnSubtitles("https://cdn.example.com/2.mp4", "[Script Info]")).thenReturn(new byte[]{9});
        when(storage.upload(eq("captions/" + job.getId() + ".mp4"), any(), eq("video/mp4"))).thenReturn("https://media.example.com/c.mp4");

        JobOutcome outcome = executor.execute(new JobContext(new Execution(), job,
                Map.of("job2", Map.of("url", "https://cdn.example.com/2.mp4")), ProgressReporter.NONE));

        assertThat(outcome.outputs()).singleElement().satisfies(o -> assertThat(o.url()).isEqualTo("https://media.example.com/c.mp4"));
        assertThat(outcome.extras()).containsEntry("transcriptLength", 2);
    }

    @Test
    void transcriptUrlIsFetched() {
        job.setParams(Map.of("video", "https://cdn.example.com/in.mp4", "transcriptUrl", "https://cdn.example.com/t.json"));
        when(renderService.fetchTranscript("https://cdn.example.com/t.json")).thenAnswer(inv -> WORDS);
        when(renderService.generateSubtitles(any(), any())).thenReturn("ass");
        when(renderService.burnSubtitles(anyString(), anyString())).thenReturn(new byte[]{1});
        when(storage.upload(anyString(), any(), anyString())).thenReturn("https://media.example.com/c.mp4");

        executor.execute(new JobContext(new Execution(), job, Map.of(), ProgressReporter.NONE));

        verify(renderService).burnSubtitles("https://cdn.example.com/in.mp4", "ass");
    }

    @Test
    void transcribeDependencySuppliesTheTranscriptAndTheVideo() {
        job.setDependsOn(List.of("job2"));
        job.setParams(Map.of());
        when(renderService.generateSubtitles(eq(WORDS), any())).thenReturn("ass");
        when(renderService.burnSubtitles(anyString(), anyString())).thenReturn(new byte[]{1});
        when(storage.upload(anyString(), any(), anyString())).thenReturn("https://media.example.com/c.mp4");

        // result shape of a transcribe job: url is the stored transcript, videoUrl what was transcribed
        Map<String, Object> transcribed = Map.of(
                "url", "https://media.example.com/executions/e/job2/transcript.json",
                TranscribeExecutor.TRANSCRIPT_KEY, WORDS,
                TranscribeExecutor.SOURCE_VIDEO_KEY, "https://cdn.example.com/1.mp4");
        JobOutcome outcome = executor.execute(new JobContext(new Execution(), job, Map.of("job2", transcribed), ProgressReporter.NONE));

        verify(renderService).burnSubtitles("https://cdn.example.com/1.mp4", "ass");
        assertThat(outcome.extras()).containsEntry("transcriptLength", 2);
    }

    @Test
    void videoAndTranscriptMayComeFromDifferentDependencies() {
        job.setDependsOn(List.of("job2", "job1"));
        job.setParams(Map.of());
        when(renderService.generateSubtitles(eq(WORDS), any())).thenReturn("ass");
        when(renderService.burnSubtitles(anyString(), anyString())).thenReturn(new byte[]{1});
        when(storage.upload(anyString(), any(), anyString())).thenReturn("https://media.example.com/c.mp4");

        executor.execute(new JobContext(new Execution(), job, Map.of(
                "job2", Map.of("url", "https://media.example.com/t.json", TranscribeExecutor.TRANSCRIPT_KEY, WORDS),
                "job1", Map.of("url", "https://cdn.example.com/1.mp4")), ProgressReporter.NONE));

        verify(renderService).burnSubtitles("https://cdn.example.com/1.mp4", "ass");
    }

    @Test
    void missingVideoOrTranscriptIsAValidationError() {
        job.setParams(Map.of("transcript", WORDS));
        assertThatThrownBy(() -> executor.execute(new JobContext(new Execution(), job, Map.of(), ProgressReporter.NONE)))
                .isInstanceOf(JobFailureException.class)
                .hasMessage("video is required either in params or from dependencies");

        job.setParams(Map.of("video", "https://cdn.example.com/in.mp4"));
        assertThatThrownBy(() -> executor.execute(new JobContext(new Execution(), job, Map.of(), ProgressReporter.NONE)))
                .isInstanceOf(JobFailureException.class)
                .hasMessageStartingWith("No transcript provided");
    }
}
