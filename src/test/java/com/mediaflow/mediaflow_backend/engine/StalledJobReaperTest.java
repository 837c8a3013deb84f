package com.mediaflow.mediaflow_backend.engine;

import com.mediaflow.mediaflow_backend.config.MediaflowProperties;
import com.mediaflow.mediaflow_backend.model.domain.ExecutionJob;
import com.mediaflow.mediaflow_backend.model.job.JobErrorKind;
import com.mediaflow.mediaflow_backend.store.ExecutionStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StalledJobReaperTest {

    @Mock
    private ExecutionStore store;

    @Mock
    private ExecutionOrchestrator orchestrator;

    @Test
    void stalledWebhookJobsAreTimedOut() {
        MediaflowProperties properties = new MediaflowProperties();
        properties.getJobs().setWebhookTimeout(Duration.ofMinutes(15));
        ExecutionJob stalled = new ExecutionJob();
        stalled.setId(UUID.randomUUID());
        when(store.findStalledWebhookJobs(any())).thenReturn(List.of(stalled));

        Instant before = Instant.now();
        new StalledJobReaper(store, orchestrator, properties).reap();

        ArgumentCaptor<Instant> cutoff = ArgumentCaptor.forClass(Instant.class);
        verify(store).findStalledWebhookJobs(cutoff.capture());
        assertThat(cutoff.getValue()).isBeforeOrEqualTo(Instant.now().minus(Duration.ofMinutes(15)))
                .isAfterOrEqualTo(before.minus(Duration.ofMinutes(15)));
        verify(orchestrator).failJob(stalled.getId(), JobErrorKind.TIMEOUT,
                "No webhook received from provider within 15 minutes");
    }

    @Test
    void nothingStalledMeansNoFailures() {
        when(store.findStalledWebhookJobs(any())).thenReturn(List.of());

        new StalledJobReaper(store, orchestrator, new MediaflowProperties()).reap();

        verify(orchestrator, never()).failJob(any(), any(), anyString());
    }
}
