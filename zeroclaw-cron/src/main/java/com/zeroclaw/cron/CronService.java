package com.zeroclaw.cron;

import com.zeroclaw.cron.CronState.CronStatusSummary;
import com.zeroclaw.cron.CronState.RunNowResult;
import com.zeroclaw.cron.CronTypes.CronJobCreate;
import com.zeroclaw.cron.CronTypes.CronJobPatch;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Job management surface consumed by the HTTP layer: CRUD, run history,
 * manual trigger and status, backed by a {@link CronStore} and driven by a
 * {@link CronDispatcher}.
 */
@Slf4j
public class CronService implements AutoCloseable {

    private final CronStore store;
    private final CronDispatcher dispatcher;
    private final CronSettings settings;

    public CronService(CronStore store, CronDispatcher dispatcher, CronSettings settings) {
        this.store = store;
        this.dispatcher = dispatcher;
        this.settings = settings;
    }

    // --- CRUD ---

    public List<CronJob> listJobs() {
        return store.list();
    }

    /**
     * @throws CronException.JobNotFound when no such job exists
     */
    public CronJob getJob(String id) {
        return store.get(id).orElseThrow(() -> new CronException.JobNotFound(id));
    }

    public CronJob createJob(CronJobCreate request) {
        return store.create(request);
    }

    /**
     * Create from a loosely-typed request body.
     */
    public CronJob createJob(Map<String, Object> raw) {
        return store.create(CronNormalize.toCreate(raw));
    }

    public CronJob patchJob(String id, CronJobPatch patch) {
        return store.patch(id, patch);
    }

    public CronJob patchJob(String id, Map<String, Object> raw) {
        return store.patch(id, CronNormalize.toPatch(raw));
    }

    /**
     * Delete a job. A run in flight finishes; its result is dropped.
     */
    public boolean deleteJob(String id) {
        return store.delete(id);
    }

    public CronJob enableJob(String id, boolean enabled) {
        CronJobPatch patch = new CronJobPatch();
        patch.setEnabled(enabled);
        return store.patch(id, patch);
    }

    // --- Runs ---

    /**
     * Run history, newest first.
     *
     * @param limit requested page size; {@code null} or non-positive takes the default
     * @throws CronException.JobNotFound when no such job exists
     */
    public List<CronRun> listRuns(String jobId, Integer limit) {
        getJob(jobId);
        return store.listRuns(jobId, settings.resolveRunsLimit(limit));
    }

    public RunNowResult runNow(String id) {
        return dispatcher.runNow(id);
    }

    // --- Lifecycle ---

    public void start() {
        dispatcher.start();
    }

    public void stop() {
        dispatcher.stop();
    }

    @Override
    public void close() {
        dispatcher.close();
    }

    public CronStatusSummary status() {
        List<CronJob> jobs = store.list();
        int active = (int) jobs.stream().filter(CronJob::isEnabled).count();
        Instant nextWake = Stream.concat(
                jobs.stream().filter(CronJob::isEnabled).map(CronJob::getNextRun).filter(Objects::nonNull),
                dispatcher.nextRetryAt().stream())
                .min(Comparator.naturalOrder())
                .orElse(null);
        return CronStatusSummary.builder()
                .enabled(settings.isEnabled())
                .running(dispatcher.isRunning())
                .jobs(jobs.size())
                .active(active)
                .paused(jobs.size() - active)
                .inFlight(dispatcher.runningCount())
                .cooling(dispatcher.coolingCount())
                .nextWakeAt(nextWake)
                .build();
    }
}
