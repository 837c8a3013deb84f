package com.mediaflow.mediaflow_backend.engine;

import com.mediaflow.mediaflow_backend.model.job.JobErrorKind;
import com.mediaflow.mediaflow_backend.model.job.ParseResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.function.IntConsumer;
import java.util.function.Supplier;

/**
 * Bounded poll loop for provider jobs. Each attempt sleeps the policy interval and then checks;
 * with {@code immediateFirst} the first check runs without sleeping (synchronous providers).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JobPoller {

    static final int PROGRESS_FLOOR = 30;
    static final int PROGRESS_SPAN = 60;
    static final int PROGRESS_CEILING = 90;

    private final Sleeper sleeper;

    /**
     * @return the first terminal parse result
     * @throws JobFailureException TIMEOUT when {@code maxAttempts} checks stay non-terminal
     */
    public ParseResult poll(PollingPolicy policy, boolean immediateFirst, Supplier<ParseResult> check, IntConsumer progress) {
        for (int attempt = 1; attempt <= policy.maxAttempts(); attempt++) {
            if (attempt > 1 || !immediateFirst) {
                try {
                    sleeper.sleep(policy.interval());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new JobFailureException(JobErrorKind.INTERNAL, "Interrupted while polling provider", e);
                }
            }
            ParseResult result = check.get();
            if (result.isTerminal()) {
                return result;
            }
            progress.accept(progressFor(attempt, policy.maxAttempts()));
        }
        log.warn("[Poller] Gave up after {} attempts ({})", policy.maxAttempts(), policy.budget());
        throw new JobFailureException(JobErrorKind.TIMEOUT,
                "Provider job did not finish after " + policy.maxAttempts() + " polling attempts");
    }

    static int progressFor(int attempt, int maxAttempts) {
        return Math.min(PROGRESS_FLOOR + attempt * PROGRESS_SPAN / maxAttempts, PROGRESS_CEILING);
    }
}
