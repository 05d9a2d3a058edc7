package com.zeroclaw.cron;

/**
 * Quick-schedule presets, expanded to a canonical cron expression before a job
 * is stored. Inputs are clamped to their field ranges.
 */
public final class CronPresets {

    private CronPresets() {
    }

    public enum Preset {
        HOURLY, DAILY, WEEKDAYS, WEEKLY, EVERY_MINUTES;

        public String key() {
            return name().toLowerCase();
        }

        /**
         * @return the preset, or {@code null} for an unknown key
         */
        public static Preset fromKey(String key) {
            if (key == null)
                return null;
            String normalized = key.trim().toLowerCase().replace('-', '_');
            for (Preset preset : values()) {
                if (preset.key().equals(normalized))
                    return preset;
            }
            return null;
        }
    }

    /**
     * Expand a preset.
     *
     * @param hour         0..23, ignored by hourly and every-minutes
     * @param minute       0..59, ignored by every-minutes
     * @param weekday      0 (Sunday)..6, weekly only
     * @param everyMinutes 1..59, every-minutes only
     */
    public static String expand(Preset preset, int hour, int minute, int weekday, int everyMinutes) {
        int h = clamp(hour, 0, 23);
        int m = clamp(minute, 0, 59);
        int wd = clamp(weekday, 0, 6);
        int interval = clamp(everyMinutes, 1, 59);

        return switch (preset) {
            case HOURLY -> m + " * * * *";
            case DAILY -> m + " " + h + " * * *";
            case WEEKDAYS -> m + " " + h + " * * 1-5";
            case WEEKLY -> m + " " + h + " * * " + wd;
            case EVERY_MINUTES -> "*/" + interval + " * * * *";
        };
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }
}
