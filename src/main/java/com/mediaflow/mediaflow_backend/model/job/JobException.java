package com.mediaflow.mediaflow_backend.model.job;

/** Base type for failures that end a single job and carry their {@link JobErrorKind}. */
public abstract class JobException extends RuntimeException {

    protected JobException(String message) {
        super(message);
    }

    protected JobException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract JobErrorKind getKind();
}
