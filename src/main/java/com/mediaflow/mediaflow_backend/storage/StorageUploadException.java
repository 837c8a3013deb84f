package com.mediaflow.mediaflow_backend.storage;

import com.mediaflow.mediaflow_backend.model.job.JobErrorKind;
import com.mediaflow.mediaflow_backend.model.job.JobException;

public class StorageUploadException extends JobException {

    public StorageUploadException(String message) {
        super(message);
    }

    public StorageUploadException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public JobErrorKind getKind() {
        return JobErrorKind.UPLOAD;
    }
}
