package com.zeroclaw.common.config;

import lombok.Data;

/**
 * Root configuration type for ZeroClaw.
 * Keys are snake_case on disk ({@code scheduler.max_concurrent}).
 */
@Data
public class ZeroClawConfig {

    /** Recurring job settings. */
    private CronConfig cron;

    /** Dispatcher capacity settings. */
    private SchedulerConfig scheduler;

    /** Poll and retry settings. */
    private ReliabilityConfig reliability;

    // --- Nested config types ---

    @Data
    public static class CronConfig {
        private Boolean enabled = true;
        /** Store snapshot path; {@code ~} is expanded. */
        private String store;
        private int maxRunHistory = 50;
        private int runsDefaultLimit = 20;
        private int runsMaxLimit = 100;
        /** IANA zone for cron expressions; host zone when unset. */
        private String timezone;
        /** or | and */
        private String dayMatch = "or";
    }

    @Data
    public static class SchedulerConfig {
        private int maxConcurrent = 4;
        private int maxTasks = 64;
        private int jobTimeoutSecs = 300;
    }

    @Data
    public static class ReliabilityConfig {
        private int schedulerPollSecs = 15;
        private int schedulerRetries = 2;
    }
}
