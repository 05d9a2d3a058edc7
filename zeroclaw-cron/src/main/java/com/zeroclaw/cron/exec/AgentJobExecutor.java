package com.zeroclaw.cron.exec;

import com.zeroclaw.common.infra.ErrorUtils;
import com.zeroclaw.cron.CronJob;
import com.zeroclaw.cron.CronTypes.JobType;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Submits the job's prompt to the {@link AgentRunner} against its session
 * target and reports whatever the engine reports.
 */
@Slf4j
public class AgentJobExecutor implements CronJobExecutor {

    private final AgentRunner agentRunner;

    public AgentJobExecutor(AgentRunner agentRunner) {
        this.agentRunner = agentRunner;
    }

    @Override
    public JobType getJobType() {
        return JobType.AGENT;
    }

    @Override
    public ExecutionResult execute(CronJob job, Duration timeout) {
        long start = System.nanoTime();
        AgentRunner.AgentRunRequest request = new AgentRunner.AgentRunRequest(
                job.getId(), job.getPrompt(), job.getSessionTarget(), job.getModel());

        CompletableFuture<AgentRunner.AgentRunResult> future;
        try {
            future = agentRunner.run(request);
        } catch (RuntimeException e) {
            return ExecutionResult.failed("agent run rejected: " + ErrorUtils.formatErrorMessage(e), null,
                    CronJobExecutors.elapsedMs(start));
        }

        try {
            AgentRunner.AgentRunResult result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            long durationMs = CronJobExecutors.elapsedMs(start);
            if (result == null) {
                return ExecutionResult.failed("agent returned no result", null, durationMs);
            }
            String output = CronOutput.truncate(result.output());
            return result.success()
                    ? ExecutionResult.ok(output, durationMs)
                    : ExecutionResult.failed(result.error(), output, durationMs);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Cron job {} agent run timed out after {}s", job.getId(), timeout.toSeconds());
            return ExecutionResult.failed("agent run timed out after " + timeout.toSeconds() + "s", null,
                    CronJobExecutors.elapsedMs(start));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return ExecutionResult.failed(ErrorUtils.formatErrorChain(cause), null,
                    CronJobExecutors.elapsedMs(start));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return ExecutionResult.failed("interrupted", null, CronJobExecutors.elapsedMs(start));
        }
    }
}
