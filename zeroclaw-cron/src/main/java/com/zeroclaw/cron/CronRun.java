package com.zeroclaw.cron;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.zeroclaw.cron.CronTypes.RunStatus;

import java.time.Instant;

/**
 * Immutable record of one execution attempt.
 *
 * @param id            store-assigned, monotonically increasing; 0 until appended
 * @param attempt       1-based attempt within the run cycle
 * @param deliveryError set when a non best-effort delivery failed
 */
public record CronRun(
        @JsonProperty("id") long id,
        @JsonProperty("job_id") String jobId,
        @JsonProperty("started_at") Instant startedAt,
        @JsonProperty("finished_at") Instant finishedAt,
        @JsonProperty("status") RunStatus status,
        @JsonProperty("output") String output,
        @JsonProperty("error") String error,
        @JsonProperty("duration_ms") long durationMs,
        @JsonProperty("attempt") int attempt,
        @JsonProperty("delivery_error") String deliveryError) {

    public CronRun withId(long newId) {
        return new CronRun(newId, jobId, startedAt, finishedAt, status, output, error, durationMs, attempt,
                deliveryError);
    }

    public CronRun withOutput(String newOutput) {
        return new CronRun(id, jobId, startedAt, finishedAt, status, newOutput, error, durationMs, attempt,
                deliveryError);
    }

    public CronRun withDeliveryError(String newDeliveryError) {
        return new CronRun(id, jobId, startedAt, finishedAt, status, output, error, durationMs, attempt,
                newDeliveryError);
    }

    /** Output when present, otherwise the error descriptor. */
    public String summary() {
        if (output != null && !output.isBlank())
            return output;
        return error;
    }
}
