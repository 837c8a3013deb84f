package com.mediaflow.mediaflow_backend.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mediaflow.mediaflow_backend.config.MediaflowProperties;
import com.mediaflow.mediaflow_backend.config.WorkerPoolConfig;
import com.mediaflow.mediaflow_backend.engine.Sleeper;
import com.mediaflow.mediaflow_backend.model.domain.Execution;
import com.mediaflow.mediaflow_backend.model.domain.ExecutionJob;
import com.mediaflow.mediaflow_backend.model.job.JobStatus;
import com.mediaflow.mediaflow_backend.store.ExecutionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Posts the result of a single completed job to its execution's webhook when the job's params carry
 * {@code sendJobWebhook: true}. Lets callers pick up an asset before the rest of the execution is done.
 * Attempts are made in place with a doubling delay and are not persisted; the execution's own
 * terminal webhook is unaffected.
 */
@Slf4j
@Service
public class JobWebhookService {

    public static final String SEND_JOB_WEBHOOK = "sendJobWebhook";

    private final ExecutionStore store;
    private final ObjectMapper objectMapper;
    private final MediaflowProperties properties;
    private final Sleeper sleeper;
    private final RestTemplate restTemplate;

    public JobWebhookService(ExecutionStore store,
                             ObjectMapper objectMapper,
                             MediaflowProperties properties,
                             RestTemplateBuilder restTemplateBuilder,
                             Sleeper sleeper) {
        this.store = store;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.sleeper = sleeper;
        Duration timeout = properties.getWebhook().getTimeout();
        this.restTemplate = restTemplateBuilder.connectTimeout(timeout).readTimeout(timeout).build();
    }

    public static boolean isRequested(ExecutionJob job) {
        return job.getParams() != null && Boolean.TRUE.equals(job.getParams().get(SEND_JOB_WEBHOOK));
    }

    @Async(WorkerPoolConfig.JOB_WORKER_EXECUTOR)
    public void deliver(UUID jobRecordId) {
        attempt(jobRecordId);
    }

    /** @return true when the webhook answered with a 2xx status within the attempt budget */
    public boolean attempt(UUID jobRecordId) {
        ExecutionJob job = store.findJob(jobRecordId).orElse(null);
        if (job == null || job.getStatus() != JobStatus.COMPLETED || !isRequested(job)) {
            return false;
        }
        Execution execution = store.findExecution(job.getExecutionId()).orElse(null);
        if (execution == null || execution.getWebhook() == null || execution.getWebhook().isBlank()) {
            log.debug("[JobWebhook] {} asked for a job webhook but its execution has none", job.getJobId());
            return false;
        }

        String body;
        try {
            body = objectMapper.writeValueAsString(payload(execution, job));
        } catch (JsonProcessingException e) {
            log.error("[JobWebhook] Could not serialize result of job {}", job.getJobId(), e);
            return false;
        }
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set(HttpHeaders.USER_AGENT, WebhookDeliveryService.USER_AGENT);
        if (execution.getWebhookSecret() != null && !execution.getWebhookSecret().isBlank()) {
            headers.set(WebhookDeliveryService.SIGNATURE_HEADER, WebhookDeliveryService.sign(execution.getWebhookSecret(), body));
        }

        int maxAttempts = properties.getWebhook().getJobMaxAttempts();
        Duration delay = properties.getWebhook().getJobRetryDelay();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                restTemplate.postForEntity(execution.getWebhook(), new HttpEntity<>(body, headers), String.class);
                log.info("[JobWebhook] Delivered result of {} (execution {}) to {}", job.getJobId(),
                        execution.getId(), execution.getWebhook());
                return true;
            } catch (RestClientException e) {
                log.warn("[JobWebhook] Attempt {}/{} for {} failed: {}", attempt, maxAttempts, job.getJobId(), e.getMessage());
            }
            if (attempt < maxAttempts) {
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("[JobWebhook] Interrupted while retrying {}", job.getJobId());
                    return false;
                }
                delay = delay.multipliedBy(2);
            }
        }
        log.warn("[JobWebhook] Giving up on job {} of execution {}", job.getJobId(), execution.getId());
        return false;
    }

    private static Map<String, Object> payload(Execution execution, ExecutionJob job) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("executionId", execution.getId().toString());
        payload.put("jobId", job.getJobId());
        payload.put("operation", job.getJobType().getWireName());
        payload.put("status", "completed");
        payload.put("result", job.getResult());
        payload.put("error", null);
        payload.put("completedAt", job.getCompletedAt() != null ? job.getCompletedAt().toString() : null);
        return payload;
    }
}
