package com.zeroclaw.cron;

import com.zeroclaw.cron.CronExpression.DayMatch;
import com.zeroclaw.cron.CronTypes.CronSchedule;
import com.zeroclaw.cron.ScheduleError.Reason;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Schedule evaluator: maps a schedule and a reference instant to the next due
 * instant. Pure and deterministic for a given zone.
 */
public final class CronSchedules {

    /** Intervals shorter than this would collapse under whole-second truncation. */
    public static final long MIN_INTERVAL_MS = 1_000;

    private CronSchedules() {
    }

    /**
     * Next due instant strictly after {@code after}.
     *
     * @param defaultZone zone for cron schedules that do not pin one
     * @return empty when the schedule is exhausted (a fixed time already passed)
     * @throws CronException.InvalidSchedule when the schedule is malformed
     */
    public static Optional<Instant> nextRun(CronSchedule schedule, Instant after, ZoneId defaultZone,
            DayMatch dayMatch) {
        if (schedule instanceof CronSchedule.Cron cron) {
            ZoneId zone = resolveZone(cron.tz(), defaultZone);
            return CronExpression.parse(cron.expr(), dayMatch).nextAfter(after, zone);
        }
        if (schedule instanceof CronSchedule.Every every) {
            requireInterval(every);
            return Optional.of(after.plusMillis(every.everyMs()).truncatedTo(ChronoUnit.SECONDS));
        }
        if (schedule instanceof CronSchedule.At at) {
            requireInstant(at);
            return at.at().isAfter(after) ? Optional.of(at.at()) : Optional.empty();
        }
        throw invalid("schedule", null, "schedule is required");
    }

    public static Optional<Instant> nextRun(CronSchedule schedule, Instant after) {
        return nextRun(schedule, after, ZoneId.systemDefault(), DayMatch.OR);
    }

    /**
     * Structural validation, independent of the current time.
     *
     * @throws CronException.InvalidSchedule on the first problem found
     */
    public static void validate(CronSchedule schedule) {
        if (schedule instanceof CronSchedule.Cron cron) {
            CronExpression.parse(cron.expr());
            resolveZone(cron.tz(), ZoneId.systemDefault());
        } else if (schedule instanceof CronSchedule.Every every) {
            requireInterval(every);
        } else if (schedule instanceof CronSchedule.At at) {
            requireInstant(at);
        } else {
            throw invalid("schedule", null, "schedule is required");
        }
    }

    static ZoneId resolveZone(String tz, ZoneId fallback) {
        if (tz == null || tz.isBlank()) {
            return fallback != null ? fallback : ZoneId.systemDefault();
        }
        try {
            return ZoneId.of(tz.trim());
        } catch (DateTimeException e) {
            throw invalid("tz", tz, "unknown time zone '" + tz + "'");
        }
    }

    private static void requireInterval(CronSchedule.Every every) {
        if (every.everyMs() < MIN_INTERVAL_MS) {
            throw invalid("every_ms", String.valueOf(every.everyMs()),
                    "interval must be at least " + MIN_INTERVAL_MS + "ms, got " + every.everyMs());
        }
    }

    private static void requireInstant(CronSchedule.At at) {
        if (at.at() == null) {
            throw invalid("at", null, "fixed-time schedule needs an instant");
        }
    }

    static CronException.InvalidSchedule invalid(String field, String token, String message) {
        return new CronException.InvalidSchedule(ScheduleError.of(Reason.INVALID_SCHEDULE, field, token, message));
    }
}
