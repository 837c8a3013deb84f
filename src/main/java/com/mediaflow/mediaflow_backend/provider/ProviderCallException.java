package com.mediaflow.mediaflow_backend.provider;

import com.mediaflow.mediaflow_backend.model.job.JobErrorKind;
import com.mediaflow.mediaflow_backend.model.job.JobException;

public class ProviderCallException extends JobException {

    public ProviderCallException(String message) {
        super(message);
    }

    public ProviderCallException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public JobErrorKind getKind() {
        return JobErrorKind.PROVIDER;
    }
}
