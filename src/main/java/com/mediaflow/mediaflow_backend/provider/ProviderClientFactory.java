package com.mediaflow.mediaflow_backend.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mediaflow.mediaflow_backend.config.MediaflowProperties;
import com.mediaflow.mediaflow_backend.model.domain.MediaProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.HexFormat;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Builds provider clients and caches them per (provider, credential). Two organizations with
 * different keys never share a client.
 */
@Slf4j
@Component
public class ProviderClientFactory {

    private final MediaflowProperties properties;
    private final ObjectMapper objectMapper;
    private final HttpClient httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .build();
    private final Map<ClientKey, MediaProviderClient> clients = new ConcurrentHashMap<>();

    public ProviderClientFactory(MediaflowProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    /**
     * @param explicitApiKey credential resolved for the job, or null to fall back to the
     *                       process-wide key from configuration
     * @throws ProviderConfigurationException when neither is available
     */
    public MediaProviderClient getClient(MediaProvider provider, String explicitApiKey) {
        String apiKey = resolveApiKey(provider, explicitApiKey);
        return clients.computeIfAbsent(new ClientKey(provider, fingerprint(apiKey)), key -> create(provider, apiKey));
    }

    String resolveApiKey(MediaProvider provider, String explicitApiKey) {
        if (explicitApiKey != null && !explicitApiKey.isBlank()) {
            return explicitApiKey;
        }
        String configured = properties.provider(provider).getApiKey();
        if (configured != null && !configured.isBlank()) {
            return configured;
        }
        throw new ProviderConfigurationException("No API key configured for " + provider.getDisplayName()
                + ". Save a " + provider.getDisplayName() + " credential for your organization, pass providerApiKeys."
                + provider.getId() + " with the request, or export " + provider.getApiKeyEnvVar() + " in the server environment.");
    }

    private MediaProviderClient create(MediaProvider provider, String apiKey) {
        String baseUrl = properties.baseUrlFor(provider);
        log.info("[Providers] Creating {} client for {}", provider.getDisplayName(), baseUrl);
        return switch (provider) {
            case REPLICATE -> new ReplicateClient(httpClient, objectMapper, baseUrl, apiKey);
            case FAL -> new FalClient(httpClient, objectMapper, baseUrl, apiKey);
            case ELEVENLABS -> new ElevenLabsClient(httpClient, objectMapper, baseUrl, apiKey);
        };
    }

    private static String fingerprint(String apiKey) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(apiKey.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private record ClientKey(MediaProvider provider, String credentialFingerprint) {}
}
