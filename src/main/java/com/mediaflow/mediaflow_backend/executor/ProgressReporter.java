package com.mediaflow.mediaflow_backend.executor;

@FunctionalInterface
public interface ProgressReporter {

    void report(int progress, String stage);

    ProgressReporter NONE = (progress, stage) -> { };
}
