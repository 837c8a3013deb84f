package com.mediaflow.mediaflow_backend.engine;

import com.mediaflow.mediaflow_backend.config.MediaflowProperties;
import com.mediaflow.mediaflow_backend.model.domain.ExecutionJob;
import com.mediaflow.mediaflow_backend.model.job.JobErrorKind;
import com.mediaflow.mediaflow_backend.store.ExecutionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/** Fails jobs whose provider webhook never arrived within {@code mediaflow.jobs.webhook-timeout}. */
@Slf4j
@Component
@RequiredArgsConstructor
public class StalledJobReaper {

    private final ExecutionStore store;
    private final ExecutionOrchestrator orchestrator;
    private final MediaflowProperties properties;

    @Scheduled(fixedDelayString = "${mediaflow.jobs.reaper-interval-ms:60000}",
               initialDelayString = "${mediaflow.jobs.reaper-interval-ms:60000}")
    public void reap() {
        Duration timeout = properties.getJobs().getWebhookTimeout();
        List<ExecutionJob> stalled = store.findStalledWebhookJobs(Instant.now().minus(timeout));
        for (ExecutionJob job : stalled) {
            orchestrator.failJob(job.getId(), JobErrorKind.TIMEOUT,
                    "No webhook received from provider within " + timeout.toMinutes() + " minutes");
        }
        if (!stalled.isEmpty()) {
            log.info("[Reaper] Timed out {} jobs waiting for provider webhooks", stalled.size());
        }
    }
}
