package com.mediaflow.mediaflow_backend.model.job;

/**
 * How the worker learns that a provider job finished.
 * SYNCHRONOUS jobs are already complete when {@code startGeneration} returns; they go through
 * the polling path so that the cached result is read back uniformly.
 */
public enum WaitingStrategy {
    WEBHOOK,
    POLLING,
    SYNCHRONOUS
}
