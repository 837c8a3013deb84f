package com.mediaflow.mediaflow_backend.engine;

import com.mediaflow.mediaflow_backend.model.domain.Execution;
import com.mediaflow.mediaflow_backend.model.domain.ExecutionJob;
import com.mediaflow.mediaflow_backend.model.job.JobErrorKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.dao.DataAccessException;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Live job and execution events on {@code /topic/execution/{executionId}}. Publishing is best
 * effort: a broker failure is logged and never affects the job.
 */
@Slf4j
@Component
public class ExecutionEventPublisher {

    public static final String TOPIC_PREFIX = "/topic/execution/";

    private final SimpMessagingTemplate messagingTemplate;
    private final ObjectProvider<RedisWebSocketBridge> redisBridgeProvider;

    public ExecutionEventPublisher(SimpMessagingTemplate messagingTemplate,
                                   ObjectProvider<RedisWebSocketBridge> redisBridgeProvider) {
        this.messagingTemplate = messagingTemplate;
        this.redisBridgeProvider = redisBridgeProvider;
    }

    public void jobStarted(ExecutionJob job) {
        publish(job.getExecutionId(), jobPayload("jobStarted", job, "processing"));
    }

    public void jobProgress(UUID executionId, String jobId, int progress, String stage) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("event", "jobProgress");
        payload.put("jobId", jobId);
        payload.put("progress", progress);
        payload.put("stage", stage);
        publish(executionId, payload);
    }

    public void jobCompleted(ExecutionJob job, Map<String, Object> result) {
        Map<String, Object> payload = jobPayload("jobCompleted", job, "completed");
        payload.put("result", result);
        publish(job.getExecutionId(), payload);
    }

    public void jobFailed(ExecutionJob job, JobErrorKind kind, String error) {
        Map<String, Object> payload = jobPayload("jobFailed", job, "failed");
        payload.put("errorKind", kind.name());
        payload.put("error", error);
        publish(job.getExecutionId(), payload);
    }

    public void executionFinished(Execution execution) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("event", "executionFinished");
        payload.put("status", execution.getStatus().wire());
        payload.put("result", execution.getResult());
        payload.put("error", execution.getError());
        publish(execution.getId(), payload);
    }

    private static Map<String, Object> jobPayload(String event, ExecutionJob job, String status) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("event", event);
        payload.put("jobId", job.getJobId());
        payload.put("type", job.getJobType().getWireName());
        payload.put("status", status);
        return payload;
    }

    private void publish(UUID executionId, Map<String, Object> payload) {
        String destination = TOPIC_PREFIX + executionId;
        RedisWebSocketBridge bridge = redisBridgeProvider.getIfAvailable();
        try {
            if (bridge != null) {
                bridge.publish(executionId, payload);
            } else {
                messagingTemplate.convertAndSend(destination, payload);
            }
        } catch (MessagingException | DataAccessException e) {
            log.warn("[Events] Could not publish {} to {}: {}", payload.get("event"), destination, e.getMessage());
        }
    }
}
