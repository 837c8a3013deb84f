package com.mediaflow.mediaflow_backend.executor;

import com.mediaflow.mediaflow_backend.model.job.MediaOutput;

import java.util.List;
import java.util.Map;

/**
 * Result of running a job on a worker. {@code AWAITING_WEBHOOK} leaves the job processing until
 * the provider calls back.
 */
public record JobOutcome(Kind kind, List<MediaOutput> outputs, Map<String, Object> extras) {

    public enum Kind { COMPLETED, AWAITING_WEBHOOK }

    public static JobOutcome completed(List<MediaOutput> outputs) {
        return new JobOutcome(Kind.COMPLETED, List.copyOf(outputs), Map.of());
    }

    public static JobOutcome completed(List<MediaOutput> outputs, Map<String, Object> extras) {
        return new JobOutcome(Kind.COMPLETED, List.copyOf(outputs), Map.copyOf(extras));
    }

    public static JobOutcome awaitingWebhook() {
        return new JobOutcome(Kind.AWAITING_WEBHOOK, List.of(), Map.of());
    }
}
