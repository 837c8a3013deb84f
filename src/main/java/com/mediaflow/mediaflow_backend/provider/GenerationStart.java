package com.mediaflow.mediaflow_backend.provider;

import com.mediaflow.mediaflow_backend.model.job.WaitingStrategy;

public record GenerationStart(String providerJobId, WaitingStrategy waitingStrategy) {
}
