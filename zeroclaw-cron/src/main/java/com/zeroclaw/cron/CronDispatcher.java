package com.zeroclaw.cron;

import com.zeroclaw.cron.CronState.CronEvent;
import com.zeroclaw.cron.CronState.RunNowResult;
import com.zeroclaw.cron.CronTypes.RunStatus;
import com.zeroclaw.cron.delivery.CronDeliveryService;
import com.zeroclaw.cron.delivery.DeliveryOutcome;
import com.zeroclaw.cron.exec.CronJobExecutors;
import com.zeroclaw.cron.exec.ExecutionResult;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Poll loop that fans due jobs out onto a bounded worker pool.
 *
 * <p>
 * One scheduling thread wakes every poll interval, collects enabled jobs that
 * are due and not in flight, orders them by due time then creation order, and
 * submits as many as there are free slots. Ticks never wait for executions.
 * A failed attempt with retries left parks the job in the cooling table until
 * its backoff expires; cooling jobs do not hold a slot.
 */
@Slf4j
public class CronDispatcher implements AutoCloseable {

    private final CronStore store;
    private final CronJobExecutors executors;
    private final CronRetryPolicy retryPolicy;
    private final CronDeliveryService delivery;
    private final CronSettings settings;
    private final Clock clock;

    private final ScheduledExecutorService poller;
    private final ExecutorService workers;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private ScheduledFuture<?> scheduledTask;
    private volatile Consumer<CronEvent> listener;

    // Guarded by lock.
    private final Object lock = new Object();
    private final Set<String> inFlight = new HashSet<>();
    private final Map<String, Cooling> cooling = new HashMap<>();

    /** A failed job waiting for its next attempt. */
    record Cooling(int nextAttempt, Instant retryAt) {
    }

    private record Candidate(CronJob job, Instant dueAt, int attempt) {
    }

    private enum Admission {
        ADMITTED, BUSY, FULL
    }

    public CronDispatcher(CronStore store, CronJobExecutors executors, CronDeliveryService delivery,
            CronSettings settings, Clock clock) {
        this.store = store;
        this.executors = executors;
        this.delivery = delivery;
        this.settings = settings;
        this.clock = clock;
        this.retryPolicy = new CronRetryPolicy(settings.getRetries(), settings.getPollInterval());
        this.poller = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "cron-poll");
            t.setDaemon(true);
            return t;
        });
        this.workers = Executors.newFixedThreadPool(settings.getMaxConcurrent(), workerThreads());
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "cron-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    public void setListener(Consumer<CronEvent> listener) {
        this.listener = listener;
    }

    // =========================================================================
    // Lifecycle
    // =========================================================================

    /**
     * Start the poll loop. The first tick runs immediately.
     */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            log.debug("Cron dispatcher already running");
            return;
        }
        synchronized (this) {
            scheduledTask = poller.schedule(this::tick, 0, TimeUnit.MILLISECONDS);
        }
        log.info("Cron dispatcher started (poll: {}s, max concurrent: {}, retries: {})",
                settings.getPollInterval().toSeconds(), settings.getMaxConcurrent(), settings.getRetries());
    }

    /**
     * Stop polling. In-flight executions finish on their own.
     */
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        synchronized (this) {
            if (scheduledTask != null) {
                scheduledTask.cancel(false);
            }
        }
        log.info("Cron dispatcher stopped");
    }

    public boolean isRunning() {
        return running.get();
    }

    @Override
    public void close() {
        stop();
        poller.shutdown();
        workers.shutdown();
        try {
            if (!poller.awaitTermination(5, TimeUnit.SECONDS)) {
                poller.shutdownNow();
            }
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            poller.shutdownNow();
            workers.shutdownNow();
        }
    }

    private void tick() {
        if (!running.get())
            return;
        try {
            pollOnce();
        } catch (RuntimeException e) {
            log.error("Cron poll tick failed: {}", e.getMessage(), e);
        }
        if (running.get()) {
            synchronized (this) {
                scheduledTask = poller.schedule(this::tick, settings.getPollInterval().toMillis(),
                        TimeUnit.MILLISECONDS);
            }
        }
    }

    // =========================================================================
    // Dispatch
    // =========================================================================

    /**
     * Run one scheduling pass.
     *
     * @return number of jobs submitted
     */
    public int pollOnce() {
        List<CronJob> jobs;
        try {
            jobs = store.list();
        } catch (RuntimeException e) {
            log.warn("Cron store unavailable, skipping tick: {}", e.getMessage());
            return 0;
        }

        Instant now = clock.instant();
        List<Candidate> due = new ArrayList<>();
        synchronized (lock) {
            pruneCooling(jobs);
            for (CronJob job : jobs) {
                if (!job.isEnabled() || inFlight.contains(job.getId()))
                    continue;
                Cooling waiting = cooling.get(job.getId());
                if (waiting != null) {
                    if (!waiting.retryAt().isAfter(now)) {
                        due.add(new Candidate(job, waiting.retryAt(), waiting.nextAttempt()));
                    }
                } else if (job.getNextRun() != null && !job.getNextRun().isAfter(now)) {
                    due.add(new Candidate(job, job.getNextRun(), 1));
                }
            }
        }
        if (due.isEmpty())
            return 0;

        // Stable sort keeps creation order for equal due times.
        due.sort(Comparator.comparing(Candidate::dueAt));

        int submitted = 0;
        for (Candidate candidate : due) {
            Admission admission = admit(candidate.job().getId());
            if (admission == Admission.FULL) {
                log.debug("Cron slots full, {} due job(s) wait for the next tick", due.size() - submitted);
                break;
            }
            if (admission == Admission.ADMITTED && submit(candidate.job(), candidate.attempt())) {
                submitted++;
            }
        }
        return submitted;
    }

    /**
     * Dispatch a job immediately, outside its schedule.
     *
     * @throws CronException.JobNotFound when no such job exists
     */
    public RunNowResult runNow(String jobId) {
        CronJob job = store.get(jobId).orElseThrow(() -> new CronException.JobNotFound(jobId));
        Admission admission = admit(jobId);
        if (admission == Admission.BUSY)
            return RunNowResult.ALREADY_RUNNING;
        if (admission == Admission.FULL)
            return RunNowResult.NO_CAPACITY;
        log.info("Manual run of cron job {}", job.displayName());
        return submit(job, 1) ? RunNowResult.STARTED : RunNowResult.NO_CAPACITY;
    }

    private Admission admit(String jobId) {
        synchronized (lock) {
            if (inFlight.contains(jobId))
                return Admission.BUSY;
            if (inFlight.size() >= settings.getMaxConcurrent())
                return Admission.FULL;
            inFlight.add(jobId);
            cooling.remove(jobId);
            return Admission.ADMITTED;
        }
    }

    private boolean submit(CronJob job, int attempt) {
        try {
            workers.execute(() -> runAttempt(job, attempt));
            return true;
        } catch (RejectedExecutionException e) {
            log.warn("Cron worker pool rejected job {}: {}", job.getId(), e.getMessage());
            release(job.getId());
            return false;
        }
    }

    private void release(String jobId) {
        synchronized (lock) {
            inFlight.remove(jobId);
            lock.notifyAll();
        }
    }

    private void pruneCooling(List<CronJob> jobs) {
        if (cooling.isEmpty())
            return;
        Set<String> retryable = new HashSet<>();
        for (CronJob job : jobs) {
            if (job.isEnabled())
                retryable.add(job.getId());
        }
        cooling.keySet().retainAll(retryable);
    }

    // =========================================================================
    // Execution
    // =========================================================================

    void runAttempt(CronJob job, int attempt) {
        String jobId = job.getId();
        try {
            Instant startedAt = clock.instant();
            emit(CronEvent.builder().jobId(jobId).action("started").runAt(startedAt).attempt(attempt).build());
            log.debug("Running cron job {} (attempt {})", job.displayName(), attempt);

            ExecutionResult result = executors.execute(job, settings.getJobTimeout());
            Instant finishedAt = clock.instant();
            CronRun run = new CronRun(0, jobId, startedAt, finishedAt,
                    result.success() ? RunStatus.OK : RunStatus.ERROR,
                    result.output(), result.error(), result.durationMs(), attempt, null);

            CronRetryPolicy.Decision decision = retryPolicy.decide(attempt, result);
            if (decision instanceof CronRetryPolicy.Decision.Retry retry) {
                scheduleRetry(job, run, retry);
            } else {
                finalizeRun(job, run);
            }
        } catch (RuntimeException e) {
            log.error("Cron job {} completion failed: {}", jobId, e.getMessage(), e);
        } finally {
            release(jobId);
        }
    }

    private void scheduleRetry(CronJob job, CronRun run, CronRetryPolicy.Decision.Retry retry) {
        String jobId = job.getId();
        try {
            store.appendRun(jobId, run);
        } catch (CronException.JobNotFound e) {
            log.debug("Cron job {} was deleted while running, dropping retry", jobId);
            return;
        } catch (CronException.StoreUnavailable e) {
            log.warn("Could not persist run of cron job {}: {}", jobId, e.getMessage());
        }
        Instant retryAt = run.finishedAt().plus(retry.delay());
        synchronized (lock) {
            cooling.put(jobId, new Cooling(retry.nextAttempt(), retryAt));
        }
        log.warn("Cron job {} failed (attempt {}): {}; retrying at {}", job.displayName(), run.attempt(),
                run.error(), retryAt);
        emit(CronEvent.builder()
                .jobId(jobId)
                .action("retry")
                .runAt(run.startedAt())
                .attempt(run.attempt())
                .durationMs(run.durationMs())
                .status(run.status())
                .error(run.error())
                .nextRun(retryAt)
                .build());
    }

    private void finalizeRun(CronJob job, CronRun run) {
        String jobId = job.getId();
        Optional<CronJob> current = store.get(jobId);
        if (current.isEmpty()) {
            log.debug("Cron job {} was deleted while running, dropping its result", jobId);
            return;
        }

        DeliveryOutcome outcome = delivery.deliver(current.get(), run);
        if (outcome.recordedError() != null) {
            run = run.withDeliveryError(outcome.recordedError());
        }

        Optional<CronState.Completion> completion;
        try {
            completion = store.finalizeRun(jobId, run);
        } catch (CronException.StoreUnavailable e) {
            log.warn("Could not persist completion of cron job {}: {}", jobId, e.getMessage());
            completion = store.get(jobId).map(j -> new CronState.Completion(j, false));
        }
        if (completion.isEmpty()) {
            log.debug("Cron job {} was deleted before its result was recorded", jobId);
            return;
        }

        CronJob updated = completion.get().job();
        if (run.status() == RunStatus.OK) {
            log.info("Cron job {} finished ok in {}ms", job.displayName(), run.durationMs());
        } else {
            log.warn("Cron job {} finished with error after {} attempt(s): {}", job.displayName(), run.attempt(),
                    run.error());
        }
        emit(CronEvent.builder()
                .jobId(jobId)
                .action("finished")
                .runAt(run.startedAt())
                .attempt(run.attempt())
                .durationMs(run.durationMs())
                .status(run.status())
                .error(run.error())
                .nextRun(updated.getNextRun())
                .build());
        if (completion.get().removed()) {
            emit(CronEvent.builder().jobId(jobId).action("removed").runAt(run.finishedAt()).build());
        }
    }

    private void emit(CronEvent event) {
        Consumer<CronEvent> l = listener;
        if (l == null)
            return;
        try {
            l.accept(event);
        } catch (RuntimeException e) {
            log.warn("Cron event listener failed on {}: {}", event.getAction(), e.getMessage());
        }
    }

    // =========================================================================
    // Introspection
    // =========================================================================

    public int runningCount() {
        synchronized (lock) {
            return inFlight.size();
        }
    }

    public int coolingCount() {
        synchronized (lock) {
            return cooling.size();
        }
    }

    public boolean isInFlight(String jobId) {
        synchronized (lock) {
            return inFlight.contains(jobId);
        }
    }

    /** Earliest pending retry, if any job is cooling. */
    Optional<Instant> nextRetryAt() {
        synchronized (lock) {
            return cooling.values().stream().map(Cooling::retryAt).min(Comparator.naturalOrder());
        }
    }

    /**
     * Block until no job is in flight.
     *
     * @return {@code false} if the timeout elapsed first
     */
    public boolean awaitIdle(long timeoutMs) throws InterruptedException {
        long deadline = System.currentTimeMillis() + timeoutMs;
        synchronized (lock) {
            while (!inFlight.isEmpty()) {
                long remaining = deadline - System.currentTimeMillis();
                if (remaining <= 0)
                    return false;
                lock.wait(remaining);
            }
            return true;
        }
    }
}
