package com.zeroclaw.cron;

import com.zeroclaw.cron.CronTypes.RunStatus;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * Dispatcher event, result and status types.
 */
public final class CronState {

    private CronState() {
    }

    // =========================================================================
    // Event types
    // =========================================================================

    /**
     * Cron lifecycle event, emitted by the dispatcher for auditing.
     */
    @Data
    @Builder
    public static class CronEvent {
        private String jobId;
        /** "started" | "retry" | "finished" | "removed" */
        private String action;
        private Instant runAt;
        private Integer attempt;
        private Long durationMs;
        private RunStatus status;
        private String error;
        private Instant nextRun;
    }

    // =========================================================================
    // Result types
    // =========================================================================

    /**
     * Outcome of finalizing a run against the store.
     *
     * @param job     the job as stored after the update (last snapshot when removed)
     * @param removed whether the job was deleted (one-shot or exhausted schedule)
     */
    public record Completion(CronJob job, boolean removed) {
    }

    /** Result of a manual trigger. */
    public enum RunNowResult {
        STARTED, ALREADY_RUNNING, NO_CAPACITY
    }

    // =========================================================================
    // Status
    // =========================================================================

    /**
     * Cron status summary for diagnostics.
     */
    @Data
    @Builder
    public static class CronStatusSummary {
        private boolean enabled;
        private boolean running;
        private int jobs;
        private int active;
        private int paused;
        private int inFlight;
        private int cooling;
        private Instant nextWakeAt;
    }
}
