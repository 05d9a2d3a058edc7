package com.zeroclaw.cron;

import com.zeroclaw.cron.ScheduleError.Reason;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parsed five-field cron expression: minute, hour, day-of-month, month,
 * day-of-week.
 *
 * <p>
 * Each field accepts {@code *}, {@code *}{@code /N}, {@code N}, {@code N-M} or a
 * comma list of {@code N}. Day-of-week runs 0 (Sunday) to 6. When both
 * day-of-month and day-of-week are restricted they combine according to
 * {@link DayMatch}. As in Vixie cron, a day field starting with {@code *}
 * ({@code *} or {@code *}{@code /N}) counts as unrestricted; the two day
 * fields are then both required to match, so {@code *}{@code /2} still
 * narrows the other field.
 */
public final class CronExpression {

    private static final Pattern TOKEN_RE = Pattern.compile("^(\\*|\\*/\\d+|\\d+|\\d+-\\d+|\\d+(,\\d+)+)$");
    private static final Pattern WHITESPACE_RE = Pattern.compile("\\s+");

    /** Upper bound of the forward search; covers the leap-day cycle. */
    private static final int SEARCH_YEARS = 8;

    private static final Field[] FIELDS = {
            new Field("minute", 0, 59),
            new Field("hour", 0, 23),
            new Field("day-of-month", 1, 31),
            new Field("month", 1, 12),
            new Field("day-of-week", 0, 6)
    };

    /**
     * How day-of-month and day-of-week combine when both are restricted.
     */
    public enum DayMatch {
        /** Either field matching qualifies (Vixie cron). */
        OR,
        /** Both fields must match. */
        AND;

        public static DayMatch fromKey(String key) {
            return "and".equalsIgnoreCase(key) ? AND : OR;
        }
    }

    private record Field(String name, int min, int max) {
    }

    private final String source;
    private final long minutes;
    private final long hours;
    private final long daysOfMonth;
    private final long months;
    private final long daysOfWeek;
    private final boolean domRestricted;
    private final boolean dowRestricted;
    private final DayMatch dayMatch;

    private CronExpression(String source, long[] bits, boolean domRestricted, boolean dowRestricted,
            DayMatch dayMatch) {
        this.source = source;
        this.minutes = bits[0];
        this.hours = bits[1];
        this.daysOfMonth = bits[2];
        this.months = bits[3];
        this.daysOfWeek = bits[4];
        this.domRestricted = domRestricted;
        this.dowRestricted = dowRestricted;
        this.dayMatch = dayMatch;
    }

    // =========================================================================
    // Parsing
    // =========================================================================

    public static CronExpression parse(String expression) {
        return parse(expression, DayMatch.OR);
    }

    /**
     * Parse an expression.
     *
     * @throws CronException.InvalidSchedule with reason
     *                                      {@code MALFORMED_FIELD},
     *                                      {@code INVALID_TOKEN} or
     *                                      {@code OUT_OF_RANGE}
     */
    public static CronExpression parse(String expression, DayMatch dayMatch) {
        String trimmed = expression == null ? "" : expression.trim();
        String[] parts = trimmed.isEmpty() ? new String[0] : WHITESPACE_RE.split(trimmed);
        if (parts.length != FIELDS.length) {
            throw new CronException.InvalidSchedule(ScheduleError.of(Reason.MALFORMED_FIELD, "expression",
                    trimmed, "cron expression needs 5 fields, got " + parts.length + ": '" + trimmed + "'"));
        }

        long[] bits = new long[FIELDS.length];
        for (int i = 0; i < FIELDS.length; i++) {
            bits[i] = parseField(FIELDS[i], parts[i]);
        }
        return new CronExpression(String.join(" ", parts), bits,
                !parts[2].startsWith("*"), !parts[4].startsWith("*"),
                dayMatch != null ? dayMatch : DayMatch.OR);
    }

    /**
     * Validate without keeping the parsed form.
     *
     * @return the first problem found, or empty when the expression is valid
     */
    public static Optional<ScheduleError> validate(String expression) {
        try {
            parse(expression);
            return Optional.empty();
        } catch (CronException.InvalidSchedule e) {
            return Optional.of(e.getError());
        }
    }

    private static long parseField(Field field, String token) {
        if (!TOKEN_RE.matcher(token).matches()) {
            throw invalidToken(field, token, "invalid " + field.name() + " token '" + token + "'");
        }

        if ("*".equals(token)) {
            return range(field.min(), field.max(), 1);
        }
        if (token.startsWith("*/")) {
            int step = number(field, token, token.substring(2));
            if (step < 1 || step > field.max()) {
                throw outOfRange(field, token, "step " + step + " outside 1.." + field.max());
            }
            return range(field.min(), field.max(), step);
        }
        if (token.contains("-")) {
            int dash = token.indexOf('-');
            int from = inRange(field, token, number(field, token, token.substring(0, dash)));
            int to = inRange(field, token, number(field, token, token.substring(dash + 1)));
            if (from > to) {
                throw invalidToken(field, token, "descending " + field.name() + " range '" + token + "'");
            }
            return range(from, to, 1);
        }

        long bits = 0L;
        for (String item : token.split(",")) {
            bits |= 1L << inRange(field, token, number(field, token, item));
        }
        return bits;
    }

    private static int number(Field field, String token, String digits) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw outOfRange(field, token, digits + " outside " + field.min() + ".." + field.max());
        }
    }

    private static int inRange(Field field, String token, int value) {
        if (value < field.min() || value > field.max()) {
            throw outOfRange(field, token, value + " outside " + field.min() + ".." + field.max());
        }
        return value;
    }

    private static long range(int from, int to, int step) {
        long bits = 0L;
        for (int v = from; v <= to; v += step) {
            bits |= 1L << v;
        }
        return bits;
    }

    private static CronException.InvalidSchedule invalidToken(Field field, String token, String message) {
        return new CronException.InvalidSchedule(ScheduleError.of(Reason.INVALID_TOKEN, field.name(), token, message));
    }

    private static CronException.InvalidSchedule outOfRange(Field field, String token, String detail) {
        return new CronException.InvalidSchedule(ScheduleError.of(Reason.OUT_OF_RANGE, field.name(), token,
                field.name() + " value out of range in '" + token + "': " + detail));
    }

    // =========================================================================
    // Evaluation
    // =========================================================================

    /**
     * Earliest minute boundary strictly after {@code after} matching every
     * field, evaluated in {@code zone}.
     *
     * @return empty when nothing matches within the search horizon (e.g. Feb 30)
     */
    public Optional<Instant> nextAfter(Instant after, ZoneId zone) {
        return nextAfter(after.atZone(zone)).map(ZonedDateTime::toInstant);
    }

    public Optional<ZonedDateTime> nextAfter(ZonedDateTime after) {
        ZoneId zone = after.getZone();
        Instant afterInstant = after.toInstant();
        LocalDateTime t = after.toLocalDateTime().truncatedTo(ChronoUnit.MINUTES).plusMinutes(1);
        LocalDateTime limit = t.plusYears(SEARCH_YEARS);

        while (t.isBefore(limit)) {
            if (!has(months, t.getMonthValue())) {
                t = t.toLocalDate().withDayOfMonth(1).plusMonths(1).atStartOfDay();
                continue;
            }
            if (!dayMatches(t.toLocalDate())) {
                t = t.toLocalDate().plusDays(1).atStartOfDay();
                continue;
            }
            if (!has(hours, t.getHour())) {
                t = t.truncatedTo(ChronoUnit.HOURS).plusHours(1);
                continue;
            }
            if (!has(minutes, t.getMinute())) {
                t = t.plusMinutes(1);
                continue;
            }
            // Local times inside a DST gap resolve forward; overlaps take the earlier offset.
            ZonedDateTime candidate = ZonedDateTime.ofLocal(t, zone, null);
            if (candidate.toInstant().isAfter(afterInstant)) {
                return Optional.of(candidate);
            }
            t = t.plusMinutes(1);
        }
        return Optional.empty();
    }

    boolean dayMatches(LocalDate date) {
        boolean domOk = has(daysOfMonth, date.getDayOfMonth());
        boolean dowOk = has(daysOfWeek, cronDayOfWeek(date.getDayOfWeek()));
        if (domRestricted && dowRestricted) {
            return dayMatch == DayMatch.OR ? domOk || dowOk : domOk && dowOk;
        }
        return domOk && dowOk;
    }

    private static int cronDayOfWeek(DayOfWeek dow) {
        return dow.getValue() % 7; // Sunday 7 -> 0
    }

    private static boolean has(long bits, int value) {
        return ((bits >>> value) & 1L) != 0;
    }

    public DayMatch getDayMatch() {
        return dayMatch;
    }

    @Override
    public String toString() {
        return source;
    }
}
