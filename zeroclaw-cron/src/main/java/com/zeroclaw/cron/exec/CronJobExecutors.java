package com.zeroclaw.cron.exec;

import com.zeroclaw.common.infra.ErrorUtils;
import com.zeroclaw.cron.CronJob;
import com.zeroclaw.cron.CronTypes.JobType;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Routes a job to the executor registered for its type.
 */
@Slf4j
public class CronJobExecutors {

    private final Map<JobType, CronJobExecutor> executors = new EnumMap<>(JobType.class);

    public CronJobExecutors(List<CronJobExecutor> executors) {
        for (CronJobExecutor executor : executors) {
            this.executors.put(executor.getJobType(), executor);
        }
    }

    /**
     * Execute a job. Executor exceptions become failed results.
     */
    public ExecutionResult execute(CronJob job, Duration timeout) {
        CronJobExecutor executor = job.getJobType() != null ? executors.get(job.getJobType()) : null;
        if (executor == null) {
            return ExecutionResult.failed("no executor for job type " + job.getJobType(), null, 0);
        }
        long start = System.nanoTime();
        try {
            ExecutionResult result = executor.execute(job, timeout);
            if (result == null) {
                return ExecutionResult.failed("executor returned no result", null, elapsedMs(start));
            }
            return result;
        } catch (RuntimeException e) {
            log.error("Cron job {} executor threw: {}", job.getId(), e.getMessage(), e);
            return ExecutionResult.failed(ErrorUtils.formatErrorChain(e), null, elapsedMs(start));
        }
    }

    static long elapsedMs(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
    }
}
