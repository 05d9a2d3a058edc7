package com.zeroclaw.common.infra;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff computation.
 */
public final class Backoff {

    private Backoff() {
    }

    /**
     * Backoff policy configuration.
     *
     * @param initialMs delay for the first attempt in milliseconds
     * @param maxMs     maximum delay in milliseconds
     * @param factor    multiplicative factor per attempt
     * @param jitter    jitter ratio (0..1)
     */
    public record Policy(long initialMs, long maxMs, double factor, double jitter) {

        /** 300ms initial, 30s max, factor 2, no jitter. */
        public static final Policy DEFAULT = new Policy(300, 30_000, 2.0, 0.0);

        /**
         * Doubling policy anchored on a fixed interval: the first attempt waits
         * {@code 2 * interval}, capped at {@code capMultiple * interval}.
         */
        public static Policy doublingFrom(Duration interval, int capMultiple) {
            long base = interval.toMillis();
            return new Policy(base * 2, base * Math.max(1, capMultiple), 2.0, 0.0);
        }
    }

    /**
     * Compute the backoff delay for a given attempt.
     *
     * @param policy  backoff policy
     * @param attempt 1-based attempt number
     * @return delay in milliseconds (capped at {@code policy.maxMs})
     */
    public static long compute(Policy policy, int attempt) {
        double base = policy.initialMs * Math.pow(policy.factor, Math.max(attempt - 1, 0));
        double jitter = base * policy.jitter * ThreadLocalRandom.current().nextDouble();
        return Math.min(policy.maxMs, Math.round(base + jitter));
    }
}
