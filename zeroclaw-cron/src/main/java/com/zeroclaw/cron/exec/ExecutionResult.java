package com.zeroclaw.cron.exec;

/**
 * Uniform outcome of one execution, whatever the job kind.
 *
 * @param output captured output, already bounded
 * @param error  failure descriptor; {@code null} on success
 */
public record ExecutionResult(boolean success, String output, long durationMs, String error) {

    public static ExecutionResult ok(String output, long durationMs) {
        return new ExecutionResult(true, output, durationMs, null);
    }

    public static ExecutionResult failed(String error, String output, long durationMs) {
        return new ExecutionResult(false, output, durationMs, error != null ? error : "failed");
    }
}
