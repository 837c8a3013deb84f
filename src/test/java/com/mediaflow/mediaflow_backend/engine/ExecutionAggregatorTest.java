package com.mediaflow.mediaflow_backend.engine;

import com.mediaflow.mediaflow_backend.model.domain.Execution;
import com.mediaflow.mediaflow_backend.model.domain.ExecutionJob;
import com.mediaflow.mediaflow_backend.model.domain.JobType;
import com.mediaflow.mediaflow_backend.model.dto.ExecutionStatusResponse;
import com.mediaflow.mediaflow_backend.model.job.ExecutionStatus;
import com.mediaflow.mediaflow_backend.model.job.JobErrorKind;
import com.mediaflow.mediaflow_backend.model.job.JobStatus;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class ExecutionAggregatorTest {

    private final ExecutionAggregator aggregator = new ExecutionAggregator();

    private static ExecutionJob job(String id, JobType type, JobStatus status, List<String> dependsOn) {
        ExecutionJob job = new ExecutionJob();
        job.setJobId(id);
        job.setJobType(type);
        job.setStatus(status);
        job.setDependsOn(dependsOn);
        if (status == JobStatus.COMPLETED) {
            job.setResult(Map.of("url", "https://cdn.example.com/" + id));
        }
        return job;
    }

    private static ExecutionJob failed(String id, JobErrorKind kind, String error) {
        ExecutionJob job = job(id, JobType.GENERATE, JobStatus.FAILED, List.of());
        job.setErrorKind(kind);
        job.setError(error);
        return job;
    }

    @Test
    void nothingIsDecidedWhileJobsAreRunning() {
        assertThat(aggregator.aggregate(List.of(
                job("job1", JobType.GENERATE, JobStatus.COMPLETED, List.of()),
                job("job2", JobType.GENERATE, JobStatus.PROCESSING, List.of())))).isEmpty();
    }

    @Test
    void resultComesFromTheLastJobNothingDependsOn() {
        // job3 feeds job2, so job2 is the final job even though job3 is last
        ExecutionOutcome outcome = aggregator.aggregate(List.of(
                job("job1", JobType.GENERATE, JobStatus.COMPLETED, List.of()),
                job("job2", JobType.ADD_SUBTITLES, JobStatus.COMPLETED, List.of("job1", "job3")),
                job("job3", JobType.GENERATE_AUDIO, JobStatus.COMPLETED, List.of()))).orElseThrow();

        assertThat(outcome.status()).isEqualTo(ExecutionStatus.COMPLETED);
        assertThat(outcome.result()).containsEntry("url", "https://cdn.example.com/job2");
    }

    @Test
    void finalJobSkipsDependedOnJobs() {
        ExecutionJob finalJob = ExecutionAggregator.finalJob(List.of(
                job("job1", JobType.GENERATE, JobStatus.COMPLETED, List.of()),
                job("job2", JobType.GENERATE, JobStatus.COMPLETED, List.of()),
                job("job3", JobType.MERGE, JobStatus.COMPLETED, List.of("job1", "job2"))));

        assertThat(finalJob.getJobId()).isEqualTo("job3");
    }

    @Test
    void finalJobWithoutResultFailsTheExecution() {
        ExecutionJob empty = job("job1", JobType.GENERATE, JobStatus.COMPLETED, List.of());
        empty.setResult(Map.of());

        assertThat(aggregator.aggregate(List.of(empty)).orElseThrow().error())
                .isEqualTo("Final job job1 produced no result");
    }

    @Test
    void cascadedFailuresAreHiddenBehindTheirRootCause() {
        String error = ExecutionAggregator.describeFailures(List.of(
                failed("job1", JobErrorKind.PROVIDER, "NSFW"),
                failed("job2", JobErrorKind.DEPENDENCY, "Dependency job1 failed")));

        assertThat(error).isEqualTo("Job job1 (generate) failed: NSFW");
    }

    @Test
    void severalRootCausesAreAllListed() {
        String error = ExecutionAggregator.describeFailures(List.of(
                failed("job1", JobErrorKind.PROVIDER, "NSFW"),
                failed("job3", JobErrorKind.TIMEOUT, null)));

        assertThat(error).isEqualTo("2 jobs failed: job1 (generate): NSFW; job3 (generate): Unknown error");
    }

    @Test
    void statusViewAveragesProgressAndNamesTheRunningJob() {
        Execution execution = new Execution();
        execution.setId(UUID.randomUUID());
        execution.setStatus(ExecutionStatus.PROCESSING);
        ExecutionJob running = job("job2", JobType.GENERATE, JobStatus.PROCESSING, List.of("job1"));
        running.setProgress(50);
        running.setStage("processing");

        ExecutionStatusResponse response = aggregator.toStatusResponse(execution, List.of(
                job("job1", JobType.GENERATE_IMAGE, JobStatus.COMPLETED, List.of()),
                running,
                job("job3", JobType.MERGE, JobStatus.QUEUED, List.of("job2"))));

        assertThat(response.executionId()).isEqualTo(execution.getId().toString());
        assertThat(response.totalJobs()).isEqualTo(3);
        assertThat(response.completedJobs()).isEqualTo(1);
        assertThat(response.progress()).isEqualTo(50);
        assertThat(response.currentJob()).isEqualTo("job2");
        assertThat(response.jobs()).hasSize(3);
    }
}
