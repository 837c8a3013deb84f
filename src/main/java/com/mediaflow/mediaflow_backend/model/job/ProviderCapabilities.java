package com.mediaflow.mediaflow_backend.model.job;

public record ProviderCapabilities(
        boolean supportsWebhooks,
        boolean supportsPolling,
        WaitingStrategy defaultStrategy
) {

    public static ProviderCapabilities webhookFirst() {
        return new ProviderCapabilities(true, true, WaitingStrategy.WEBHOOK);
    }

    public static ProviderCapabilities pollingFirst() {
        return new ProviderCapabilities(true, true, WaitingStrategy.POLLING);
    }

    public static ProviderCapabilities synchronous() {
        return new ProviderCapabilities(false, false, WaitingStrategy.SYNCHRONOUS);
    }
}
