package com.zeroclaw.cron;

import com.zeroclaw.common.config.ConfigService;
import com.zeroclaw.common.config.ZeroClawConfig;
import com.zeroclaw.cron.CronExpression.DayMatch;
import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;

/**
 * Effective scheduler settings, resolved from {@link ZeroClawConfig}.
 */
@Value
@Builder(toBuilder = true)
public class CronSettings {

    static final String DEFAULT_STORE = "~/.zeroclaw/cron/jobs.json";

    @Builder.Default
    boolean enabled = true;
    /** Snapshot file; {@code null} keeps the store in memory only. */
    Path storePath;
    @Builder.Default
    Duration pollInterval = Duration.ofSeconds(15);
    @Builder.Default
    int maxConcurrent = 4;
    @Builder.Default
    int maxTasks = 64;
    @Builder.Default
    int retries = 2;
    @Builder.Default
    int maxRunHistory = 50;
    @Builder.Default
    Duration jobTimeout = Duration.ofSeconds(300);
    @Builder.Default
    int runsDefaultLimit = 20;
    @Builder.Default
    int runsMaxLimit = 100;
    @Builder.Default
    ZoneId zone = ZoneId.systemDefault();
    @Builder.Default
    DayMatch dayMatch = DayMatch.OR;

    public static CronSettings from(ZeroClawConfig config) {
        ZeroClawConfig.CronConfig cron = config.getCron();
        ZeroClawConfig.SchedulerConfig scheduler = config.getScheduler();
        ZeroClawConfig.ReliabilityConfig reliability = config.getReliability();

        String store = cron.getStore() != null && !cron.getStore().isBlank() ? cron.getStore() : DEFAULT_STORE;
        return CronSettings.builder()
                .enabled(cron.getEnabled() == null || cron.getEnabled())
                .storePath(ConfigService.expandHome(Path.of(store)))
                .pollInterval(Duration.ofSeconds(reliability.getSchedulerPollSecs()))
                .maxConcurrent(scheduler.getMaxConcurrent())
                .maxTasks(scheduler.getMaxTasks())
                .retries(reliability.getSchedulerRetries())
                .maxRunHistory(cron.getMaxRunHistory())
                .jobTimeout(Duration.ofSeconds(scheduler.getJobTimeoutSecs()))
                .runsDefaultLimit(cron.getRunsDefaultLimit())
                .runsMaxLimit(cron.getRunsMaxLimit())
                .zone(CronSchedules.resolveZone(cron.getTimezone(), ZoneId.systemDefault()))
                .dayMatch(DayMatch.fromKey(cron.getDayMatch()))
                .build();
    }

    /**
     * Clamp a requested runs page size to the configured default and maximum.
     */
    public int resolveRunsLimit(Integer requested) {
        if (requested == null || requested <= 0)
            return runsDefaultLimit;
        return Math.min(requested, runsMaxLimit);
    }
}
