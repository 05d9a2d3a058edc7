package com.zeroclaw.cron.exec;

import com.zeroclaw.cron.CronJob;
import com.zeroclaw.cron.CronTypes.JobType;
import com.zeroclaw.cron.CronTypes.SessionTarget;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class AgentJobExecutorTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private static CronJob job() {
        return CronJob.builder()
                .id("agent1")
                .name("digest")
                .jobType(JobType.AGENT)
                .prompt("summarize today")
                .model("small-model")
                .sessionTarget(SessionTarget.MAIN)
                .build();
    }

    @Test
    void forwardsPromptTargetAndModel() {
        AtomicReference<AgentRunner.AgentRunRequest> seen = new AtomicReference<>();
        AgentJobExecutor executor = new AgentJobExecutor(request -> {
            seen.set(request);
            return CompletableFuture.completedFuture(new AgentRunner.AgentRunResult(true, "all quiet", null));
        });

        ExecutionResult result = executor.execute(job(), TIMEOUT);

        assertTrue(result.success());
        assertEquals("all quiet", result.output());
        assertEquals(new AgentRunner.AgentRunRequest("agent1", "summarize today", SessionTarget.MAIN, "small-model"),
                seen.get());
    }

    @Test
    void engineFailure_reportedAsIs() {
        AgentJobExecutor executor = new AgentJobExecutor(request -> CompletableFuture.completedFuture(
                new AgentRunner.AgentRunResult(false, "partial", "rate limited")));

        ExecutionResult result = executor.execute(job(), TIMEOUT);

        assertFalse(result.success());
        assertEquals("rate limited", result.error());
        assertEquals("partial", result.output());
    }

    @Test
    void exceptionalFuture_failure() {
        AgentJobExecutor executor = new AgentJobExecutor(
                request -> CompletableFuture.failedFuture(new IllegalStateException("engine offline")));

        ExecutionResult result = executor.execute(job(), TIMEOUT);

        assertFalse(result.success());
        assertTrue(result.error().contains("engine offline"));
    }

    @Test
    void runnerThrows_failure() {
        AgentJobExecutor executor = new AgentJobExecutor(request -> {
            throw new IllegalArgumentException("no session");
        });

        ExecutionResult result = executor.execute(job(), TIMEOUT);

        assertFalse(result.success());
        assertEquals("agent run rejected: no session", result.error());
    }

    @Test
    void timeout_cancelsRun() {
        CompletableFuture<AgentRunner.AgentRunResult> never = new CompletableFuture<>();
        AgentJobExecutor executor = new AgentJobExecutor(request -> never);

        ExecutionResult result = executor.execute(job(), Duration.ofMillis(100));

        assertFalse(result.success());
        assertTrue(result.error().startsWith("agent run timed out"));
        assertTrue(never.isCancelled());
    }

    @Test
    void oversizedOutput_truncated() {
        String big = "y".repeat(CronOutput.MAX_OUTPUT_CHARS + 1);
        AgentJobExecutor executor = new AgentJobExecutor(request -> CompletableFuture.completedFuture(
                new AgentRunner.AgentRunResult(true, big, null)));

        assertTrue(executor.execute(job(), TIMEOUT).output().endsWith(CronOutput.TRUNCATION_MARKER));
    }
}
