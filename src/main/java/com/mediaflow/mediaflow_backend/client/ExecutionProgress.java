package com.mediaflow.mediaflow_backend.client;

/** Snapshot handed to the progress callback on every status poll. */
public record ExecutionProgress(String currentJob, int progress, int totalJobs, int completedJobs) {
}
