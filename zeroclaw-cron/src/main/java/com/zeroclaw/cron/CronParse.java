package com.zeroclaw.cron;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Absolute time parsing for fixed-time schedules.
 */
public final class CronParse {

    private CronParse() {
    }

    private static final Pattern ISO_TZ_RE = Pattern.compile("(Z|[+-]\\d{2}:?\\d{2})$", Pattern.CASE_INSENSITIVE);
    private static final Pattern ISO_DATE_RE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    private static final Pattern ISO_DATE_TIME_RE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}T");
    private static final Pattern NUMERIC_RE = Pattern.compile("^\\d+$");

    /**
     * Zone-less ISO values are taken as UTC: a bare date becomes midnight UTC,
     * a bare date-time gets a {@code Z}.
     */
    static String normalizeUtcIso(String raw) {
        if (ISO_TZ_RE.matcher(raw).find())
            return raw;
        if (ISO_DATE_RE.matcher(raw).matches())
            return raw + "T00:00:00Z";
        if (ISO_DATE_TIME_RE.matcher(raw).find())
            return raw + "Z";
        return raw;
    }

    /**
     * Parse epoch milliseconds (number or numeric string) or an ISO-8601
     * date/date-time.
     *
     * @return the instant, or empty when the input is blank, non-positive or
     *         unparseable
     */
    public static Optional<Instant> parseAbsoluteTime(Object input) {
        if (input instanceof Number n) {
            long ms = n.longValue();
            return ms > 0 ? Optional.of(Instant.ofEpochMilli(ms)) : Optional.empty();
        }
        if (!(input instanceof String s))
            return Optional.empty();
        String raw = s.trim();
        if (raw.isEmpty())
            return Optional.empty();

        if (NUMERIC_RE.matcher(raw).matches()) {
            try {
                long ms = Long.parseLong(raw);
                return ms > 0 ? Optional.of(Instant.ofEpochMilli(ms)) : Optional.empty();
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }

        try {
            return Optional.of(Instant.parse(normalizeUtcIso(raw)));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
