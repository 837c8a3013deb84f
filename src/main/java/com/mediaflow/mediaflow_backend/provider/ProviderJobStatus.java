package com.mediaflow.mediaflow_backend.provider;

import com.mediaflow.mediaflow_backend.model.job.ProviderJobState;

public record ProviderJobStatus(ProviderJobState state, String resultUrl, String error, Integer progress) {

    public static ProviderJobStatus processing(Integer progress) {
        return new ProviderJobStatus(ProviderJobState.PROCESSING, null, null, progress);
    }

    public static ProviderJobStatus completed(String resultUrl) {
        return new ProviderJobStatus(ProviderJobState.COMPLETED, resultUrl, null, 100);
    }

    public static ProviderJobStatus failed(String error) {
        return new ProviderJobStatus(ProviderJobState.FAILED, null, error, null);
    }
}
