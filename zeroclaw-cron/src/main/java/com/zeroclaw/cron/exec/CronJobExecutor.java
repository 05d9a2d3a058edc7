package com.zeroclaw.cron.exec;

import com.zeroclaw.cron.CronJob;
import com.zeroclaw.cron.CronTypes.JobType;

import java.time.Duration;

/**
 * Runs one kind of job.
 */
public interface CronJobExecutor {

    JobType getJobType();

    /**
     * Execute the job, giving up and cancelling the underlying work once
     * {@code timeout} elapses. Failures are reported through the result,
     * not thrown.
     */
    ExecutionResult execute(CronJob job, Duration timeout);
}
