package com.mediaflow.mediaflow_backend.engine;

import com.mediaflow.mediaflow_backend.model.job.JobErrorKind;
import com.mediaflow.mediaflow_backend.model.job.JobException;

/** Ends a job with an explicit kind. Used where no more specific exception type applies. */
public class JobFailureException extends JobException {

    private final JobErrorKind kind;

    public JobFailureException(JobErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public JobFailureException(JobErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    @Override
    public JobErrorKind getKind() {
        return kind;
    }
}
