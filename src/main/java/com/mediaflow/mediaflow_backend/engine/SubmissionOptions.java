package com.mediaflow.mediaflow_backend.engine;

import java.util.Map;
import java.util.UUID;

/** Server-side view of a submission: the caller's options plus the organization it runs for. */
public record SubmissionOptions(
        String organizationId,
        String webhook,
        String webhookSecret,
        UUID baseExecutionId,
        Map<String, String> providerApiKeys
) {

    public SubmissionOptions {
        organizationId = organizationId != null && !organizationId.isBlank() ? organizationId : "default";
        providerApiKeys = providerApiKeys != null ? Map.copyOf(providerApiKeys) : Map.of();
    }

    public static SubmissionOptions defaults() {
        return new SubmissionOptions(null, null, null, null, null);
    }
}
