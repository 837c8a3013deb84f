package com.mediaflow.mediaflow_backend.executor;

import com.mediaflow.mediaflow_backend.model.job.JobErrorKind;
import com.mediaflow.mediaflow_backend.model.job.JobException;

public class DependencyResolutionException extends JobException {

    public DependencyResolutionException(String message) {
        super(message);
    }

    @Override
    public JobErrorKind getKind() {
        return JobErrorKind.EXTRACTION;
    }
}
