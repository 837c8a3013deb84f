package com.mediaflow.mediaflow_backend.executor.impl;

import com.mediaflow.mediaflow_backend.engine.JobFailureException;
import com.mediaflow.mediaflow_backend.executor.JobContext;
import com.mediaflow.mediaflow_backend.executor.JobOutcome;
import com.mediaflow.mediaflow_backend.executor.ProgressReporter;
import com.mediaflow.mediaflow_backend.model.domain.Execution;
import com.mediaflow.mediaflow_backend.model.domain.ExecutionJob;
import com.mediaflow.mediaflow_backend.model.domain.JobType;
import com.mediaflow.mediaflow_backend.model.job.JobErrorKind;
import com.mediaflow.mediaflow_backend.model.job.MediaOutput;
import com.mediaflow.mediaflow_backend.storage.MediaStorage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MergeVideosExecutorTest {

    private static final byte[] MERGED = {1, 2, 3};

    @Mock private RenderServiceClient renderService;
    @Mock private MediaStorage storage;
    @InjectMocks private MergeVideosExecutor executor;

    private ExecutionJob job;

    @BeforeEach
    void setUp() {
        job = new ExecutionJob();
        job.setId(UUID.randomUUID());
        job.setExecutionId(UUID.randomUUID());
        job.setJobId("job5");
        job.setJobType(JobType.MERGE);
    }

    private JobContext contextWith(List<String> dependsOn, Map<String, Map<String, Object>> results) {
        job.setDependsOn(dependsOn);
        return new JobContext(new Execution(), job, results, ProgressReporter.NONE);
    }

    @Test
    void dependencyVideosAreMergedInDeclarationOrder() {
        job.setParams(Map.of("transition", "fade", "transitionDuration", 0.5));
        when(renderService.merge(anyList(), anyString(), anyDouble())).thenReturn(MERGED);
        when(storage.upload(anyString(), any(), eq("video/mp4"))).thenReturn("https://media.example.com/merged.mp4");

        JobOutcome outcome = executor.execute(contextWith(List.of("job4", "job2"), Map.of(
                "job2", Map.of("url", "https://cdn.example.com/2.mp4"),
                "job4", Map.of("url", "https://cdn.example.com/4.mp4"))));

        verify(renderService).merge(List.of("https://cdn.example.com/4.mp4", "https://cdn.example.com/2.mp4"), "fade", 0.5);
        verify(storage).upload("executions/" + job.getExecutionId() + "/job5/output.mp4", MERGED, "video/mp4");
        assertThat(outcome.outputs()).extracting(MediaOutput::url).containsExactly("https://media.example.com/merged.mp4");
        assertThat(outcome.extras()).containsEntry("inputCount", 2);
    }

    @Test
    void transitionObjectIsAccepted() {
        job.setParams(Map.of("transition", Map.of("type", "dissolve", "duration", 2)));
        when(renderService.merge(anyList(), anyString(), anyDouble())).thenReturn(MERGED);
        when(storage.upload(anyString(), any(), anyString())).thenReturn("https://media.example.com/m.mp4");

        executor.execute(contextWith(List.of("job1", "job2"), Map.of(
                "job1", Map.of("url", "https://cdn.example.com/1.mp4"),
                "job2", Map.of("url", "https://cdn.example.com/2.mp4"))));

        verify(renderService).merge(anyList(), eq("dissolve"), eq(2.0));
    }

    @Test
    void defaultsToCut() {
        when(renderService.merge(anyList(), anyString(), anyDouble())).thenReturn(MERGED);
        when(storage.upload(anyString(), any(), anyString())).thenReturn("https://media.example.com/m.mp4");

        executor.execute(contextWith(List.of("job1", "job2"), Map.of(
                "job1", Map.of("url", "https://cdn.example.com/1.mp4"),
                "job2", Map.of("url", "https://cdn.example.com/2.mp4"))));

        verify(renderService).merge(anyList(), eq("cut"), eq(1.0));
    }

    @Test
    void fewerThanTwoVideosIsRejected() {
        JobFailureException e = catchThrowableOfType(() -> executor.execute(contextWith(List.of("job1"),
                Map.of("job1", Map.of("url", "https://cdn.example.com/1.mp4")))), JobFailureException.class);

        assertThat(e.getKind()).isEqualTo(JobErrorKind.VALIDATION);
        assertThat(e.getMessage()).isEqualTo("At least 2 video URLs required for merging, got 1");
        verifyNoInteractions(renderService, storage);
    }
}
