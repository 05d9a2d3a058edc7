package com.zeroclaw.cron;

import com.zeroclaw.cron.CronTypes.CronJobCreate;
import com.zeroclaw.cron.CronTypes.CronJobPatch;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Coerces loosely-typed request maps (as received by the HTTP layer) into
 * {@link CronJobCreate} / {@link CronJobPatch}.
 */
public final class CronNormalize {

    private CronNormalize() {
    }

    /**
     * Normalize a create request and apply defaults.
     *
     * @throws CronException.InvalidSchedule for an unusable schedule
     * @throws CronException.InvalidJob      for any other malformed field
     */
    public static CronJobCreate toCreate(Map<String, Object> raw) {
        Map<String, Object> next = normalizeCronJobCreate(raw);
        return convert(next, CronJobCreate.class);
    }

    /**
     * Normalize a patch request; no defaults are applied.
     */
    public static CronJobPatch toPatch(Map<String, Object> raw) {
        Map<String, Object> next = normalizeCronJobPatch(raw);
        return convert(next, CronJobPatch.class);
    }

    static Map<String, Object> normalizeCronJobCreate(Map<String, Object> raw) {
        if (raw == null)
            throw new CronException.InvalidJob("job body is required");
        Map<String, Object> next = coerceCommon(unwrapJob(raw));

        if (!(next.get("job_type") instanceof String)) {
            next.put("job_type", isPresent(next.get("prompt")) && !isPresent(next.get("command"))
                    ? "agent"
                    : "shell");
        }
        if (!(next.get("enabled") instanceof Boolean)) {
            next.put("enabled", true);
        }
        if (!next.containsKey("session_target")) {
            next.put("session_target", "isolated");
        }
        return next;
    }

    static Map<String, Object> normalizeCronJobPatch(Map<String, Object> raw) {
        if (raw == null)
            throw new CronException.InvalidJob("patch body is required");
        return coerceCommon(unwrapJob(raw));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> coerceCommon(Map<String, Object> next) {
        // Legacy top-level "expression" is a cron schedule.
        Object expression = next.remove("expression");
        if (!(next.get("schedule") instanceof Map<?, ?>) && expression instanceof String expr) {
            Map<String, Object> schedule = new LinkedHashMap<>();
            schedule.put("kind", "cron");
            schedule.put("expr", expr);
            next.put("schedule", schedule);
        }
        if (next.get("schedule") instanceof Map<?, ?> sched) {
            next.put("schedule", coerceSchedule((Map<String, Object>) sched));
        }
        if (next.get("delivery") instanceof Map<?, ?> del) {
            next.put("delivery", coerceDelivery((Map<String, Object>) del));
        }
        if (next.get("job_type") instanceof String type && CronTypes.JobType.fromKey(type) == null) {
            throw new CronException.InvalidJob("unknown job_type '" + type + "'");
        }
        return next;
    }

    /**
     * Normalize a raw schedule map: detect kind, expand presets, coerce
     * {@code at}/{@code at_ms} to an ISO instant.
     */
    static Map<String, Object> coerceSchedule(Map<String, Object> schedule) {
        Map<String, Object> next = new LinkedHashMap<>(schedule);
        String kind = schedule.get("kind") instanceof String k ? k.trim().toLowerCase() : null;

        if (kind == null) {
            if (schedule.get("preset") instanceof String) {
                kind = "preset";
            } else if (schedule.containsKey("at_ms") || schedule.containsKey("at")) {
                kind = "at";
            } else if (schedule.get("every_ms") instanceof Number) {
                kind = "every";
            } else if (schedule.get("expr") instanceof String) {
                kind = "cron";
            }
        }

        if ("preset".equals(kind) || ("cron".equals(kind) && !(schedule.get("expr") instanceof String)
                && schedule.get("preset") instanceof String)) {
            next.put("expr", expandPreset(schedule));
            kind = "cron";
        }
        next.remove("preset");
        next.remove("hour");
        next.remove("minute");
        next.remove("weekday");
        next.remove("every_minutes");

        if ("at".equals(kind)) {
            Object rawAt = schedule.containsKey("at_ms") ? schedule.get("at_ms") : schedule.get("at");
            Instant at = CronParse.parseAbsoluteTime(rawAt).orElseThrow(() -> CronSchedules.invalid("at",
                    String.valueOf(rawAt), "unparseable fixed time '" + rawAt + "'"));
            next.put("at", at.toString());
            next.remove("at_ms");
        }

        if (kind == null) {
            throw CronSchedules.invalid("kind", null, "cannot determine schedule kind");
        }
        if (!"cron".equals(kind) && !"at".equals(kind) && !"every".equals(kind)) {
            throw CronSchedules.invalid("kind", kind, "unknown schedule kind '" + kind + "'");
        }
        next.put("kind", kind);
        return next;
    }

    private static String expandPreset(Map<String, Object> schedule) {
        String key = String.valueOf(schedule.get("preset"));
        CronPresets.Preset preset = CronPresets.Preset.fromKey(key);
        if (preset == null) {
            throw CronSchedules.invalid("preset", key, "unknown preset '" + key + "'");
        }
        return CronPresets.expand(preset,
                intValue(schedule.get("hour"), 0),
                intValue(schedule.get("minute"), 0),
                intValue(schedule.get("weekday"), 0),
                intValue(schedule.get("every_minutes"), 15));
    }

    /**
     * Normalize delivery config (mode aliases, channel/to trimming).
     */
    static Map<String, Object> coerceDelivery(Map<String, Object> delivery) {
        Map<String, Object> next = new LinkedHashMap<>(delivery);

        if (delivery.get("mode") instanceof String mode) {
            String normalized = mode.trim().toLowerCase();
            next.put("mode", "deliver".equals(normalized) ? "announce" : normalized);
        }
        if (delivery.get("channel") instanceof String ch) {
            String trimmed = ch.trim().toLowerCase();
            if (trimmed.isEmpty())
                next.remove("channel");
            else
                next.put("channel", trimmed);
        }
        if (delivery.get("to") instanceof String to) {
            String trimmed = to.trim();
            if (trimmed.isEmpty())
                next.remove("to");
            else
                next.put("to", trimmed);
        }
        return next;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> unwrapJob(Map<String, Object> raw) {
        if (raw.get("data") instanceof Map<?, ?> data) {
            return new LinkedHashMap<>((Map<String, Object>) data);
        }
        if (raw.get("job") instanceof Map<?, ?> job) {
            return new LinkedHashMap<>((Map<String, Object>) job);
        }
        return new LinkedHashMap<>(raw);
    }

    private static <T> T convert(Map<String, Object> map, Class<T> type) {
        try {
            return CronJson.MAPPER.convertValue(map, type);
        } catch (IllegalArgumentException e) {
            throw new CronException.InvalidJob("malformed job: " + e.getMessage(), e);
        }
    }

    private static boolean isPresent(Object value) {
        return value instanceof String s && !s.isBlank();
    }

    private static int intValue(Object value, int fallback) {
        if (value instanceof Number n)
            return n.intValue();
        if (value instanceof String s) {
            try {
                return Integer.parseInt(s.trim());
            } catch (NumberFormatException e) {
                return fallback;
            }
        }
        return fallback;
    }
}
