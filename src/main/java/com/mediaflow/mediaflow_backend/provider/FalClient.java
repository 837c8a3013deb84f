package com.mediaflow.mediaflow_backend.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mediaflow.mediaflow_backend.model.domain.MediaProvider;
import com.mediaflow.mediaflow_backend.model.job.ProviderCapabilities;
import com.mediaflow.mediaflow_backend.model.job.WaitingStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * fal.ai queue API. A request is submitted to {@code {base}/{model}}; its status and result live
 * under the owning app ({@code owner/app}), which is why the queue URLs are remembered per request.
 */
public class FalClient extends HttpProviderSupport implements MediaProviderClient {

    private static final Logger log = LoggerFactory.getLogger(FalClient.class);

    private final Map<String, QueueUrls> requests = new ConcurrentHashMap<>();

    public FalClient(HttpClient httpClient, ObjectMapper mapper, String baseUrl, String apiKey) {
        super(MediaProvider.FAL, httpClient, mapper, baseUrl, apiKey);
    }

    @Override
    public MediaProvider getProvider() { return MediaProvider.FAL; }

    @Override
    public ProviderCapabilities getCapabilities() { return ProviderCapabilities.pollingFirst(); }

    @Override
    public GenerationStart startGeneration(String model, Map<String, Object> params, String webhookUrl) {
        String url = baseUrl + "/" + model;
        if (webhookUrl != null) {
            url += "?fal_webhook=" + URLEncoder.encode(webhookUrl, StandardCharsets.UTF_8);
        }
        JsonNode response = postJson(url, params);
        String requestId = response.path("request_id").asText("");
        if (requestId.isBlank()) {
            throw new ProviderCallException("fal.ai returned no request id for " + model);
        }
        String appUrl = baseUrl + "/" + appId(model) + "/requests/" + requestId;
        requests.put(requestId, new QueueUrls(
                response.path("status_url").asText(appUrl + "/status"),
                response.path("response_url").asText(appUrl)));
        log.info("[fal] Queued request {} for {} (webhook={})", requestId, model, webhookUrl != null);
        return new GenerationStart(requestId, webhookUrl != null ? WaitingStrategy.WEBHOOK : WaitingStrategy.POLLING);
    }

    /** Status document; once COMPLETED, the result document is attached under {@code output}. */
    @Override
    public Optional<JsonNode> getRawJobResponse(String providerJobId) {
        QueueUrls urls = requests.get(providerJobId);
        if (urls == null) {
            throw new ProviderCallException("Unknown fal.ai request " + providerJobId);
        }
        JsonNode status = getJson(urls.statusUrl());
        if (!"COMPLETED".equals(status.path("status").asText())) {
            return Optional.of(status);
        }
        JsonNode result = getJson(urls.responseUrl());
        requests.remove(providerJobId);
        ObjectNode merged = mapper.createObjectNode();
        merged.put("status", "COMPLETED");
        merged.put("request_id", providerJobId);
        merged.set("output", result);
        return Optional.of(merged);
    }

    @Override
    public ProviderJobStatus getJobStatus(String providerJobId) {
        JsonNode raw = getRawJobResponse(providerJobId).orElseThrow();
        String status = raw.path("status").asText("");
        return switch (status) {
            case "COMPLETED" -> {
                JsonNode output = raw.path("output");
                String url = output.path("video").path("url").asText(output.path("images").path(0).path("url").asText(""));
                yield url.isBlank() ? ProviderJobStatus.failed("No output in completed request") : ProviderJobStatus.completed(url);
            }
            case "IN_QUEUE", "IN_PROGRESS" -> ProviderJobStatus.processing(null);
            default -> ProviderJobStatus.failed(raw.path("error").asText("Generation failed"));
        };
    }

    static String appId(String model) {
        String[] parts = model.split("/");
        return parts.length <= 2 ? model : parts[0] + "/" + parts[1];
    }

    @Override
    protected String authorizationHeader() { return "Key " + apiKey; }

    @Override
    protected String providerName() { return "fal.ai"; }

    private record QueueUrls(String statusUrl, String responseUrl) {}
}
