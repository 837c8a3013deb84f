package com.mediaflow.mediaflow_backend.model.job;

/** Classifies why a job ended in {@link JobStatus#FAILED}. */
public enum JobErrorKind {
    CONFIGURATION,  // no usable provider credential
    VALIDATION,     // params rejected by the model schema, unknown model
    PROVIDER,       // remote failure or cancellation
    EXTRACTION,     // dependency output could not be read
    TIMEOUT,        // poll budget or webhook wait exhausted
    UPLOAD,         // inline payload could not be stored
    DEPENDENCY,     // an upstream job failed
    INTERNAL
}
