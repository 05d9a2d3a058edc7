package com.zeroclaw.cron.exec;

import com.zeroclaw.cron.CronTypes.SessionTarget;

import java.util.concurrent.CompletableFuture;

/**
 * The agent execution engine, as seen by the scheduler. Implementations
 * should stop work when the returned future is cancelled.
 */
public interface AgentRunner {

    CompletableFuture<AgentRunResult> run(AgentRunRequest request);

    /**
     * @param model optional model override; {@code null} uses the engine default
     */
    record AgentRunRequest(String jobId, String prompt, SessionTarget sessionTarget, String model) {
    }

    record AgentRunResult(boolean success, String output, String error) {
    }
}
