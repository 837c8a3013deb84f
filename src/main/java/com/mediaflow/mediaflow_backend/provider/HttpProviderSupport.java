package com.mediaflow.mediaflow_backend.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mediaflow.mediaflow_backend.model.domain.MediaProvider;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/** JSON-over-HTTP plumbing shared by the asynchronous provider clients. */
abstract class HttpProviderSupport {

    protected static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(60);

    protected final HttpClient httpClient;
    protected final ObjectMapper mapper;
    protected final String baseUrl;
    protected final String apiKey;

    protected HttpProviderSupport(MediaProvider provider, HttpClient httpClient, ObjectMapper mapper, String baseUrl, String apiKey) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new ProviderConfigurationException(provider.getDisplayName() + " client requires an API key");
        }
        this.httpClient = httpClient;
        this.mapper = mapper;
        this.baseUrl = stripTrailingSlash(baseUrl != null && !baseUrl.isBlank() ? baseUrl : provider.getDefaultBaseUrl());
        this.apiKey = apiKey;
    }

    protected abstract String authorizationHeader();

    protected abstract String providerName();

    protected JsonNode postJson(String url, Object body) {
        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(REQUEST_TIMEOUT)
                    .header("Content-Type", "application/json")
                    .header("Authorization", authorizationHeader())
                    .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body)))
                    .build();
            return send(request);
        } catch (IOException e) {
            throw new ProviderCallException(providerName() + " request failed: " + e.getMessage(), e);
        }
    }

    protected JsonNode getJson(String url) {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(REQUEST_TIMEOUT)
                .header("Authorization", authorizationHeader())
                .GET()
                .build();
        return send(request);
    }

    private JsonNode send(HttpRequest request) {
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                throw new ProviderCallException(providerName() + " API error " + response.statusCode() + ": "
                        + extractErrorMessage(response.body()));
            }
            return mapper.readTree(response.body());
        } catch (IOException e) {
            throw new ProviderCallException(providerName() + " request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderCallException(providerName() + " request interrupted", e);
        }
    }

    protected String extractErrorMessage(String body) {
        if (body == null || body.isBlank()) return "";
        try {
            JsonNode node = mapper.readTree(body);
            for (String key : new String[]{"detail", "error", "message"}) {
                JsonNode value = node.path(key);
                if (value.isTextual()) return value.asText();
                if (value.path("message").isTextual()) return value.path("message").asText();
            }
        } catch (IOException e) {
            return fallbackBody(body);
        }
        return fallbackBody(body);
    }

    private static String fallbackBody(String body) {
        return body.length() > 200 ? body.substring(0, 200) : body;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
