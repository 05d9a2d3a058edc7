package com.zeroclaw.cron;

/**
 * Why a schedule was rejected.
 *
 * @param field the cron field name, or the schedule attribute, that failed
 * @param token the offending input, when there is one
 */
public record ScheduleError(Reason reason, String field, String token, String message) {

    public enum Reason {
        /** Wrong number of whitespace-separated fields. */
        MALFORMED_FIELD,
        /** A field does not match the token grammar. */
        INVALID_TOKEN,
        /** A numeric literal outside the field's range. */
        OUT_OF_RANGE,
        /** Structurally invalid schedule (bad zone, non-positive interval, past instant). */
        INVALID_SCHEDULE
    }

    static ScheduleError of(Reason reason, String field, String token, String message) {
        return new ScheduleError(reason, field, token, message);
    }
}
