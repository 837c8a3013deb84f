package com.mediaflow.mediaflow_backend.engine;

import java.time.Duration;

/** Interval and attempt budget of a poll loop. The loop never waits longer than {@link #budget()}. */
public record PollingPolicy(Duration interval, int maxAttempts) {

    public PollingPolicy {
        if (interval == null || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be zero or positive");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
    }

    public Duration budget() {
        return interval.multipliedBy(maxAttempts);
    }
}
