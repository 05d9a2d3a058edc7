package com.zeroclaw.cron;

import com.zeroclaw.cron.CronTypes.CronJobCreate;
import com.zeroclaw.cron.CronTypes.CronJobPatch;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Durable table of job definitions and run history. The store is the only
 * component that writes {@code next_run}.
 *
 * <p>
 * Mutations of a single job are serialized; reads may run concurrently with
 * writes to other jobs. Returned jobs are copies.
 */
public interface CronStore {

    /**
     * Validate, assign an id and the initial {@code next_run}, and persist.
     *
     * @throws CronException.InvalidSchedule   malformed schedule, or a fixed time already past
     * @throws CronException.InvalidJob        payload or delivery invariants violated
     * @throws CronException.AdmissionRejected store already holds {@code max_tasks} jobs
     */
    CronJob create(CronJobCreate request);

    Optional<CronJob> get(String id);

    /** All jobs, ordered by {@code created_at}, then insertion order. */
    List<CronJob> list();

    default List<CronJob> list(Predicate<CronJob> filter) {
        return list().stream().filter(filter).toList();
    }

    /**
     * Apply non-null fields. The job is left unchanged when the result is invalid.
     *
     * @throws CronException.JobNotFound when no such job exists
     */
    CronJob patch(String id, CronJobPatch patch);

    /** Remove a job and its run history. */
    boolean delete(String id);

    /**
     * Append a run record, trimming history to the retention limit.
     *
     * @return the stored run, with its assigned id
     * @throws CronException.JobNotFound when the job is gone
     */
    CronRun appendRun(String jobId, CronRun run);

    /** Most recent first, at most {@code limit} records. */
    List<CronRun> listRuns(String jobId, int limit);

    /**
     * Record a finalized run: append it, set {@code last_*}, recompute
     * {@code next_run}, and remove the job when it is one-shot or its schedule
     * is exhausted.
     *
     * @return empty when the job no longer exists
     */
    Optional<CronState.Completion> finalizeRun(String jobId, CronRun run);

    int size();
}
