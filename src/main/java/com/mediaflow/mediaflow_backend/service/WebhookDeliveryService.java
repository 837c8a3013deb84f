package com.mediaflow.mediaflow_backend.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mediaflow.mediaflow_backend.config.MediaflowProperties;
import com.mediaflow.mediaflow_backend.config.WorkerPoolConfig;
import com.mediaflow.mediaflow_backend.engine.ExecutionAggregator;
import com.mediaflow.mediaflow_backend.model.domain.Execution;
import com.mediaflow.mediaflow_backend.model.dto.ExecutionStatusResponse;
import com.mediaflow.mediaflow_backend.store.ExecutionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.scheduling.annotation.Async;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.UUID;

/**
 * Delivers the terminal status of an execution to the caller's webhook. One attempt is made as
 * soon as the execution finishes; failed deliveries are retried by {@link #retryPending()} until
 * {@code mediaflow.webhook.max-attempts} is used up.
 */
@Slf4j
@Service
public class WebhookDeliveryService {

    public static final String SIGNATURE_HEADER = "X-Webhook-Signature";
    public static final String USER_AGENT = "Mediaflow-Webhook/1.0";

    private final ExecutionStore store;
    private final ExecutionAggregator aggregator;
    private final ObjectMapper objectMapper;
    private final MediaflowProperties properties;
    private final RestTemplate restTemplate;

    public WebhookDeliveryService(ExecutionStore store,
                                  ExecutionAggregator aggregator,
                                  ObjectMapper objectMapper,
                                  MediaflowProperties properties,
                                  RestTemplateBuilder restTemplateBuilder) {
        this.store = store;
        this.aggregator = aggregator;
        this.objectMapper = objectMapper;
        this.properties = properties;
        Duration timeout = properties.getWebhook().getTimeout();
        this.restTemplate = restTemplateBuilder.connectTimeout(timeout).readTimeout(timeout).build();
    }

    @Async(WorkerPoolConfig.JOB_WORKER_EXECUTOR)
    public void deliver(UUID executionId) {
        attempt(executionId);
    }

    @Scheduled(fixedDelayString = "${mediaflow.webhook.retry-interval-ms:30000}",
               initialDelayString = "${mediaflow.webhook.retry-interval-ms:30000}")
    public void retryPending() {
        MediaflowProperties.Webhook config = properties.getWebhook();
        Instant before = Instant.now().minusMillis(config.getRetryIntervalMs());
        for (Execution execution : store.findPendingWebhookDeliveries(config.getMaxAttempts(), before)) {
            log.info("[Webhook] Retrying delivery for execution {} (attempt {})",
                    execution.getId(), execution.getWebhookAttempts() + 1);
            attempt(execution.getId());
        }
    }

    /** @return true when the webhook answered with a 2xx status */
    public boolean attempt(UUID executionId) {
        Execution execution = store.findExecution(executionId).orElse(null);
        if (execution == null || execution.getWebhook() == null || execution.getWebhook().isBlank()
                || !execution.getStatus().isTerminal() || execution.getWebhookDeliveredAt() != null) {
            return false;
        }
        if (execution.getWebhookAttempts() >= properties.getWebhook().getMaxAttempts()) {
            log.warn("[Webhook] Giving up on execution {} after {} attempts", executionId, execution.getWebhookAttempts());
            return false;
        }

        ExecutionStatusResponse payload = aggregator.toStatusResponse(execution, store.findJobs(executionId));
        String body;
        try {
            body = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            log.error("[Webhook] Could not serialize status of execution {}", executionId, e);
            store.recordWebhookAttempt(executionId, false, "Serialization failed: " + e.getOriginalMessage());
            return false;
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set(HttpHeaders.USER_AGENT, USER_AGENT);
        if (execution.getWebhookSecret() != null && !execution.getWebhookSecret().isBlank()) {
            headers.set(SIGNATURE_HEADER, sign(execution.getWebhookSecret(), body));
        }

        try {
            restTemplate.postForEntity(execution.getWebhook(), new HttpEntity<>(body, headers), String.class);
            store.recordWebhookAttempt(executionId, true, null);
            log.info("[Webhook] Delivered {} status of execution {} to {}", execution.getStatus().wire(), executionId, execution.getWebhook());
            return true;
        } catch (RestClientException e) {
            store.recordWebhookAttempt(executionId, false, e.getMessage());
            log.warn("[Webhook] Delivery to {} failed for execution {}: {}", execution.getWebhook(), executionId, e.getMessage());
            return false;
        }
    }

    /** {@code sha256=<hex HMAC-SHA256(secret, body)>} */
    public static String sign(String secret, String body) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
            return "sha256=" + HexFormat.of().formatHex(mac.doFinal(body.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 not available", e);
        }
    }
}
