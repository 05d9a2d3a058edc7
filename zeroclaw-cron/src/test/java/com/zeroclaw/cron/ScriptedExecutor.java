package com.zeroclaw.cron;

import com.zeroclaw.cron.CronTypes.JobType;
import com.zeroclaw.cron.exec.CronJobExecutor;
import com.zeroclaw.cron.exec.ExecutionResult;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Shell executor double: records calls by job name and returns scripted results.
 */
class ScriptedExecutor implements CronJobExecutor {

    final List<String> calls = Collections.synchronizedList(new ArrayList<>());
    final AtomicInteger running = new AtomicInteger();
    final AtomicInteger peakRunning = new AtomicInteger();

    private final Map<String, Function<CronJob, ExecutionResult>> scripts = new ConcurrentHashMap<>();
    private volatile CountDownLatch gate;
    private volatile CountDownLatch started = new CountDownLatch(1);

    void script(String jobName, Function<CronJob, ExecutionResult> result) {
        scripts.put(jobName, result);
    }

    void failAlways(String jobName) {
        script(jobName, job -> ExecutionResult.failed("exit code 1", "boom", 3));
    }

    /** Hold every execution until {@link #release()}. */
    void hold() {
        gate = new CountDownLatch(1);
    }

    void release() {
        CountDownLatch g = gate;
        if (g != null)
            g.countDown();
    }

    void expectStarts(int count) {
        started = new CountDownLatch(count);
    }

    boolean awaitStarts(long millis) throws InterruptedException {
        return started.await(millis, TimeUnit.MILLISECONDS);
    }

    @Override
    public JobType getJobType() {
        return JobType.SHELL;
    }

    @Override
    public ExecutionResult execute(CronJob job, Duration timeout) {
        calls.add(job.getName());
        peakRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
        started.countDown();
        try {
            CountDownLatch g = gate;
            if (g != null && !g.await(5, TimeUnit.SECONDS)) {
                return ExecutionResult.failed("gate timeout", null, 0);
            }
            return scripts.getOrDefault(job.getName(), j -> ExecutionResult.ok("ok " + j.getName(), 1)).apply(job);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ExecutionResult.failed("interrupted", null, 0);
        } finally {
            running.decrementAndGet();
        }
    }
}
