package com.mediaflow.mediaflow_backend.client;

import com.mediaflow.mediaflow_backend.model.domain.MediaProvider;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

@Value
@Builder(toBuilder = true)
public class ExecuteConfig {

    public static final String DEFAULT_API_URL = "http://localhost:8080/api/execute";

    /** Submission endpoint; status is read from {@code {apiUrl}/{id}/status}. */
    @Builder.Default
    String apiUrl = DEFAULT_API_URL;

    /** Sent as a bearer token when set. */
    String apiKey;

    /** Sent as {@code X-Organization-Id} when set. */
    String organizationId;

    /** When set, {@code execute} returns right after submission and the result is pushed here. */
    String webhookUrl;

    String webhookSecret;

    String baseExecutionId;

    /** Explicit provider keys. When empty, keys are read from each provider's environment variable. */
    Map<MediaProvider, String> providerApiKeys;

    @Builder.Default
    Duration pollInterval = Duration.ofSeconds(2);

    /** Upper bound on waiting for a terminal status; null waits indefinitely. */
    Duration timeout;

    Consumer<ExecutionProgress> onProgress;

    @Builder.Default
    UnaryOperator<String> environment = System::getenv;

    public static ExecuteConfig defaults() {
        return builder().build();
    }
}
