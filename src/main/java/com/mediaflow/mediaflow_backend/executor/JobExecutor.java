package com.mediaflow.mediaflow_backend.executor;

import com.mediaflow.mediaflow_backend.model.domain.JobType;

public interface JobExecutor {

    JobType supportedType();

    /**
     * Runs one claimed job. Failures are reported by throwing a
     * {@link com.mediaflow.mediaflow_backend.model.job.JobException}.
     */
    JobOutcome execute(JobContext context);
}
