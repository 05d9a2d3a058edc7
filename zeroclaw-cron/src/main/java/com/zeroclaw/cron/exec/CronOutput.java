package com.zeroclaw.cron.exec;

/**
 * Bounded output handling for run records.
 */
public final class CronOutput {

    /** Largest output kept on a run record. */
    public static final int MAX_OUTPUT_CHARS = 16_384;

    public static final String TRUNCATION_MARKER = "\n... (truncated)";

    private CronOutput() {
    }

    public static String truncate(String output) {
        return truncate(output, MAX_OUTPUT_CHARS);
    }

    /**
     * Cut {@code output} to {@code maxChars} and append the truncation marker.
     */
    public static String truncate(String output, int maxChars) {
        if (output == null || output.length() <= maxChars) {
            return output;
        }
        return output.substring(0, maxChars) + TRUNCATION_MARKER;
    }
}
