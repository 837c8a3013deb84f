package com.mediaflow.mediaflow_backend.model.job;

public enum ProviderJobState {
    PROCESSING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this != PROCESSING;
    }
}
