package com.mediaflow.mediaflow_backend.engine;

import com.mediaflow.mediaflow_backend.model.domain.Execution;
import com.mediaflow.mediaflow_backend.model.domain.ExecutionJob;
import com.mediaflow.mediaflow_backend.model.dto.ExecutionStatusResponse;
import com.mediaflow.mediaflow_backend.model.dto.JobStatusView;
import com.mediaflow.mediaflow_backend.model.job.JobErrorKind;
import com.mediaflow.mediaflow_backend.model.job.JobStatus;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/** Folds job states into an execution outcome and into the public status view. */
@Component
public class ExecutionAggregator {

    /**
     * @param jobs all jobs of the execution in plan order
     * @return empty while any job is still queued or processing
     */
    public Optional<ExecutionOutcome> aggregate(List<ExecutionJob> jobs) {
        if (jobs.stream().anyMatch(job -> !job.getStatus().isTerminal())) {
            return Optional.empty();
        }
        List<ExecutionJob> failed = jobs.stream().filter(job -> job.getStatus() == JobStatus.FAILED).toList();
        if (!failed.isEmpty()) {
            return Optional.of(ExecutionOutcome.failed(describeFailures(failed)));
        }
        ExecutionJob finalJob = finalJob(jobs);
        if (finalJob.getResult() == null || finalJob.getResult().isEmpty()) {
            return Optional.of(ExecutionOutcome.failed("Final job " + finalJob.getJobId() + " produced no result"));
        }
        return Optional.of(ExecutionOutcome.completed(finalJob.getResult()));
    }

    /** Last job in plan order that no other job depends on. */
    static ExecutionJob finalJob(List<ExecutionJob> jobs) {
        Set<String> dependedOn = new HashSet<>();
        jobs.forEach(job -> dependedOn.addAll(job.getDependsOn()));
        for (int i = jobs.size() - 1; i >= 0; i--) {
            if (!dependedOn.contains(jobs.get(i).getJobId())) {
                return jobs.get(i);
            }
        }
        return jobs.get(jobs.size() - 1);
    }

    // Cascaded dependency failures only repeat their root cause, so they are listed only when nothing else failed
    static String describeFailures(List<ExecutionJob> failed) {
        List<ExecutionJob> rootCauses = failed.stream()
                .filter(job -> job.getErrorKind() != JobErrorKind.DEPENDENCY)
                .toList();
        List<ExecutionJob> reported = rootCauses.isEmpty() ? failed : rootCauses;
        if (reported.size() == 1) {
            ExecutionJob job = reported.get(0);
            return "Job " + job.getJobId() + " (" + job.getJobType().getWireName() + ") failed: " + errorOf(job);
        }
        return reported.size() + " jobs failed: " + reported.stream()
                .map(job -> job.getJobId() + " (" + job.getJobType().getWireName() + "): " + errorOf(job))
                .collect(Collectors.joining("; "));
    }

    private static String errorOf(ExecutionJob job) {
        return job.getError() != null ? job.getError() : "Unknown error";
    }

    public ExecutionStatusResponse toStatusResponse(Execution execution, List<ExecutionJob> jobs) {
        int total = jobs.size();
        int completed = (int) jobs.stream().filter(job -> job.getStatus() == JobStatus.COMPLETED).count();
        int progress = total == 0 ? 0 : (int) Math.round(jobs.stream()
                .mapToInt(job -> job.getStatus().isTerminal() ? 100 : job.getProgress())
                .average()
                .orElse(0));
        String currentJob = jobs.stream()
                .filter(job -> job.getStatus() == JobStatus.PROCESSING)
                .map(ExecutionJob::getJobId)
                .findFirst()
                .orElse(null);
        List<JobStatusView> views = jobs.stream()
                .map(job -> new JobStatusView(job.getJobId(), job.getJobType(), job.getStatus(), job.getProgress(),
                        job.getStage(), job.getDependsOn(), job.getResult(), job.getErrorKind(), job.getError()))
                .toList();
        return new ExecutionStatusResponse(
                execution.getId().toString(),
                execution.getStatus(),
                progress,
                total,
                completed,
                currentJob,
                execution.getResult(),
                execution.getError(),
                execution.getCreatedAt(),
                execution.getCompletedAt(),
                views);
    }
}
