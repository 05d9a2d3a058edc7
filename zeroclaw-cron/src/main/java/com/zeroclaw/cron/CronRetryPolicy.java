package com.zeroclaw.cron;

import com.zeroclaw.common.infra.Backoff;
import com.zeroclaw.cron.CronTypes.RunStatus;
import com.zeroclaw.cron.exec.ExecutionResult;

import java.time.Duration;

/**
 * Decides what happens after an attempt: finalize, or retry after a delay.
 *
 * <p>
 * A failed attempt is retried while the attempts so far are fewer than
 * {@code maxRetries}; a run always gets at least one attempt. After failed
 * attempt {@code r} the next attempt waits {@code poll * 2^r}, capped at
 * {@code 10 * poll}.
 */
public class CronRetryPolicy {

    static final int MAX_DELAY_POLL_MULTIPLE = 10;

    private final int maxRetries;
    private final Backoff.Policy backoff;

    public CronRetryPolicy(int maxRetries, Duration pollInterval) {
        this.maxRetries = Math.max(0, maxRetries);
        this.backoff = Backoff.Policy.doublingFrom(pollInterval, MAX_DELAY_POLL_MULTIPLE);
    }

    public sealed interface Decision permits Decision.Finalize, Decision.Retry {

        record Finalize(RunStatus status) implements Decision {
        }

        record Retry(int nextAttempt, Duration delay) implements Decision {
        }
    }

    /**
     * @param attempt 1-based number of the attempt that just finished
     */
    public Decision decide(int attempt, ExecutionResult result) {
        if (result.success()) {
            return new Decision.Finalize(RunStatus.OK);
        }
        if (attempt >= maxRetries) {
            return new Decision.Finalize(RunStatus.ERROR);
        }
        return new Decision.Retry(attempt + 1, retryDelay(attempt));
    }

    public Duration retryDelay(int failedAttempt) {
        return Duration.ofMillis(Backoff.compute(backoff, failedAttempt));
    }

    public int getMaxRetries() {
        return maxRetries;
    }
}
