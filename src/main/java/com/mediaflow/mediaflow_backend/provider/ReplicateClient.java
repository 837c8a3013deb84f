package com.mediaflow.mediaflow_backend.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mediaflow.mediaflow_backend.model.domain.MediaProvider;
import com.mediaflow.mediaflow_backend.model.job.ProviderCapabilities;
import com.mediaflow.mediaflow_backend.model.job.WaitingStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Replicate predictions API. */
public class ReplicateClient extends HttpProviderSupport implements MediaProviderClient {

    private static final Logger log = LoggerFactory.getLogger(ReplicateClient.class);

    public ReplicateClient(HttpClient httpClient, ObjectMapper mapper, String baseUrl, String apiKey) {
        super(MediaProvider.REPLICATE, httpClient, mapper, baseUrl, apiKey);
    }

    @Override
    public MediaProvider getProvider() { return MediaProvider.REPLICATE; }

    @Override
    public ProviderCapabilities getCapabilities() { return ProviderCapabilities.webhookFirst(); }

    @Override
    public GenerationStart startGeneration(String model, Map<String, Object> params, String webhookUrl) {
        Map<String, Object> body = new LinkedHashMap<>();
        String url;
        int colon = model.indexOf(':');
        if (colon > 0) {
            // pinned version
            url = baseUrl + "/predictions";
            body.put("version", model.substring(colon + 1));
        } else {
            url = baseUrl + "/models/" + model + "/predictions";
        }
        body.put("input", params);
        if (webhookUrl != null) {
            body.put("webhook", webhookUrl);
            body.put("webhook_events_filter", List.of("completed"));
        }
        JsonNode response = postJson(url, body);
        String predictionId = response.path("id").asText("");
        if (predictionId.isBlank()) {
            throw new ProviderCallException("Replicate returned no prediction id for " + model);
        }
        log.info("[Replicate] Started prediction {} for {} (webhook={})", predictionId, model, webhookUrl != null);
        return new GenerationStart(predictionId, webhookUrl != null ? WaitingStrategy.WEBHOOK : WaitingStrategy.POLLING);
    }

    @Override
    public Optional<JsonNode> getRawJobResponse(String providerJobId) {
        return Optional.of(getJson(baseUrl + "/predictions/" + providerJobId));
    }

    @Override
    public ProviderJobStatus getJobStatus(String providerJobId) {
        JsonNode prediction = getJson(baseUrl + "/predictions/" + providerJobId);
        String status = prediction.path("status").asText("");
        switch (status) {
            case "succeeded" -> {
                JsonNode output = prediction.path("output");
                String url = output.isArray() && !output.isEmpty() ? output.get(0).asText() : output.asText("");
                return url.isBlank() ? ProviderJobStatus.failed("No output in completed prediction") : ProviderJobStatus.completed(url);
            }
            case "failed", "canceled" -> {
                return ProviderJobStatus.failed(prediction.path("error").asText("Generation failed"));
            }
            default -> {
                return ProviderJobStatus.processing(null);
            }
        }
    }

    @Override
    protected String authorizationHeader() { return "Bearer " + apiKey; }

    @Override
    protected String providerName() { return "Replicate"; }
}
