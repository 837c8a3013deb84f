package com.mediaflow.mediaflow_backend.client;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mediaflow.mediaflow_backend.model.domain.JobType;
import com.mediaflow.mediaflow_backend.model.domain.MediaProvider;
import com.mediaflow.mediaflow_backend.model.dto.ExecuteOptions;
import com.mediaflow.mediaflow_backend.model.dto.ExecuteRequest;
import com.mediaflow.mediaflow_backend.model.dto.ExecuteResponse;
import com.mediaflow.mediaflow_backend.model.dto.ExecutionStatusResponse;
import com.mediaflow.mediaflow_backend.model.plan.ExecutionPlan;
import com.mediaflow.mediaflow_backend.model.plan.JobNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Submits execution plans to a Mediaflow server and follows them to completion.
 *
 * <pre>{@code
 * Pipeline pipeline = Pipeline.compose(
 *         new Operation.GenerateVideo(ModelRef.replicate("minimax/video-01"), "a red fox in snow"),
 *         new Operation.GenerateVideo(ModelRef.replicate("minimax/video-01"), "the fox runs off"))
 *     .merge("fade", 0.5);
 * PipelineExecution execution = new ExecutionClient().execute(pipeline.toPlan(), ExecuteConfig.defaults());
 * }</pre>
 */
public class ExecutionClient {

    private static final Logger log = LoggerFactory.getLogger(ExecutionClient.class);

    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);
    static final String ORGANIZATION_HEADER = "X-Organization-Id";

    private final HttpClient httpClient;
    private final ObjectMapper mapper;

    public ExecutionClient() {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(),
                new ObjectMapper().findAndRegisterModules());
    }

    public ExecutionClient(HttpClient httpClient, ObjectMapper mapper) {
        this.httpClient = httpClient;
        this.mapper = mapper.copy().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public PipelineExecution execute(Pipeline pipeline, ExecuteConfig config) {
        return execute(pipeline.toPlan(), config);
    }

    /**
     * Submits the plan. Without a webhook this blocks until the execution is terminal and throws
     * {@link PipelineExecutionException} if it failed.
     */
    public PipelineExecution execute(ExecutionPlan plan, ExecuteConfig config) {
        Map<String, String> keys = providerKeysFor(plan, config);
        ExecuteOptions options = new ExecuteOptions(config.getWebhookUrl(), config.getWebhookSecret(),
                config.getBaseExecutionId(), keys.isEmpty() ? null : keys);

        String body;
        try {
            body = mapper.writeValueAsString(new ExecuteRequest(plan, options));
        } catch (IOException e) {
            throw new PipelineExecutionException("Could not serialize execution plan: " + e.getMessage(), e);
        }
        HttpRequest request = requestBuilder(config.getApiUrl(), config)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        HttpResponse<String> response = send(request, config.getApiUrl());
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new PipelineExecutionException("Pipeline execution failed: " + errorMessage(response));
        }
        ExecuteResponse accepted = read(response.body(), ExecuteResponse.class);
        log.info("[Client] Submitted execution {} with {} jobs", accepted.executionId(), plan.jobs().size());

        PipelineExecution execution = new PipelineExecution(accepted.executionId(), this, config);
        if (config.getWebhookUrl() == null || config.getWebhookUrl().isBlank()) {
            execution.waitForCompletion();
        }
        return execution;
    }

    /** Reads the status of any execution, including ones submitted elsewhere. */
    public ExecutionStatusResponse getStatus(String executionId, ExecuteConfig config) {
        return fetchStatus(executionId, config);
    }

    ExecutionStatusResponse fetchStatus(String executionId, ExecuteConfig config) {
        String url = stripTrailingSlash(config.getApiUrl()) + "/" + executionId + "/status";
        HttpResponse<String> response = send(requestBuilder(url, config).GET().build(), url);
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new PipelineExecutionException("Failed to fetch status: " + errorMessage(response), executionId, null);
        }
        return read(response.body(), ExecutionStatusResponse.class);
    }

    /** Keys from the config or the environment, limited to providers the plan actually uses. */
    static Map<String, String> providerKeysFor(ExecutionPlan plan, ExecuteConfig config) {
        Set<MediaProvider> used = EnumSet.noneOf(MediaProvider.class);
        for (JobNode job : plan.jobs()) {
            if (job.params().get("provider") instanceof String id) {
                for (MediaProvider provider : MediaProvider.values()) {
                    if (provider.getId().equalsIgnoreCase(id)) used.add(provider);
                }
            } else if (job.type() == JobType.TRANSCRIBE) {
                // the default whisper models run on Replicate
                used.add(MediaProvider.REPLICATE);
            }
        }
        Map<MediaProvider, String> configured = config.getProviderApiKeys();
        Map<String, String> keys = new LinkedHashMap<>();
        for (MediaProvider provider : used) {
            String key = configured != null && !configured.isEmpty()
                    ? configured.get(provider)
                    : config.getEnvironment().apply(provider.getApiKeyEnvVar());
            if (key != null && !key.isBlank()) {
                keys.put(provider.getId(), key);
            }
        }
        return keys;
    }

    private HttpRequest.Builder requestBuilder(String url, ExecuteConfig config) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(REQUEST_TIMEOUT);
        if (config.getApiKey() != null && !config.getApiKey().isBlank()) {
            builder.header("Authorization", "Bearer " + config.getApiKey());
        }
        if (config.getOrganizationId() != null && !config.getOrganizationId().isBlank()) {
            builder.header(ORGANIZATION_HEADER, config.getOrganizationId());
        }
        return builder;
    }

    private HttpResponse<String> send(HttpRequest request, String url) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new PipelineExecutionException("Failed to connect to API at " + url + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PipelineExecutionException("Request to " + url + " was interrupted", e);
        }
    }

    private <T> T read(String body, Class<T> type) {
        try {
            return mapper.readValue(body, type);
        } catch (IOException e) {
            throw new PipelineExecutionException("Unexpected response from API: " + e.getMessage(), e);
        }
    }

    private String errorMessage(HttpResponse<String> response) {
        String body = response.body();
        if (body != null && !body.isBlank()) {
            try {
                JsonNode node = mapper.readTree(body);
                for (String key : new String[]{"message", "error"}) {
                    if (node.path(key).isTextual() && !node.path(key).asText().isBlank()) {
                        String message = node.path(key).asText();
                        return node.path("code").isTextual() ? message + " (" + node.path("code").asText() + ")" : message;
                    }
                }
            } catch (IOException e) {
                log.debug("[Client] Non-JSON error body from API: {}", e.getMessage());
            }
        }
        return "HTTP " + response.statusCode();
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
