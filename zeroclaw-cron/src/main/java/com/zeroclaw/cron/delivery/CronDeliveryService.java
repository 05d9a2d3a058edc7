package com.zeroclaw.cron.delivery;

import com.zeroclaw.common.infra.ErrorUtils;
import com.zeroclaw.cron.CronJob;
import com.zeroclaw.cron.CronRun;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Announces finalized runs through the transport registered for the job's
 * channel. Never throws: failures come back as a {@link DeliveryOutcome}.
 */
@Slf4j
public class CronDeliveryService {

    private static final Duration DEFAULT_SEND_TIMEOUT = Duration.ofSeconds(30);
    private static final int MAX_MESSAGE_OUTPUT = 3_500;

    private final Map<String, CronDeliveryTransport> transports = new LinkedHashMap<>();
    private final Duration sendTimeout;

    public CronDeliveryService(List<CronDeliveryTransport> transports) {
        this(transports, DEFAULT_SEND_TIMEOUT);
    }

    public CronDeliveryService(List<CronDeliveryTransport> transports, Duration sendTimeout) {
        for (CronDeliveryTransport transport : transports) {
            this.transports.put(transport.getChannelId().trim().toLowerCase(), transport);
        }
        this.sendTimeout = sendTimeout;
    }

    public DeliveryOutcome deliver(CronJob job, CronRun run) {
        CronDeliveryResolver.DeliveryPlan plan = CronDeliveryResolver.resolve(job);
        if (!plan.isRequested()) {
            return DeliveryOutcome.notRequested();
        }

        CronDeliveryTransport transport = plan.getChannel() != null ? transports.get(plan.getChannel()) : null;
        if (transport == null) {
            return failure(job, plan, "no delivery transport for channel '" + plan.getChannel() + "'");
        }

        CompletableFuture<Void> send = null;
        try {
            send = transport.sendText(plan.getTo(), formatMessage(job, run));
            send.get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
            log.debug("Delivered cron job {} result to {}:{}", job.getId(), plan.getChannel(), plan.getTo());
            return DeliveryOutcome.delivered();
        } catch (TimeoutException e) {
            send.cancel(true);
            return failure(job, plan, "delivery timed out after " + sendTimeout.toSeconds() + "s");
        } catch (ExecutionException e) {
            return failure(job, plan, ErrorUtils.formatErrorChain(e.getCause() != null ? e.getCause() : e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failure(job, plan, "delivery interrupted");
        } catch (RuntimeException e) {
            return failure(job, plan, ErrorUtils.formatErrorChain(e));
        }
    }

    private DeliveryOutcome failure(CronJob job, CronDeliveryResolver.DeliveryPlan plan, String error) {
        if (plan.isBestEffort()) {
            log.warn("Best-effort delivery for cron job {} to {} failed: {}", job.getId(), plan.getChannel(), error);
        } else {
            log.error("Delivery for cron job {} to {} failed: {}", job.getId(), plan.getChannel(), error);
        }
        return DeliveryOutcome.failed(error, plan.isBestEffort());
    }

    /**
     * Announcement text: a status line, then the run's output or error.
     */
    static String formatMessage(CronJob job, CronRun run) {
        StringBuilder sb = new StringBuilder();
        sb.append("[cron] ").append(job.displayName()).append(": ").append(run.status().key());
        sb.append(" (").append(run.durationMs()).append("ms");
        if (run.attempt() > 1) {
            sb.append(", attempt ").append(run.attempt());
        }
        sb.append(')');
        if (run.error() != null) {
            sb.append("\nerror: ").append(run.error());
        }
        String output = run.output();
        if (output != null && !output.isBlank()) {
            if (output.length() > MAX_MESSAGE_OUTPUT) {
                output = output.substring(0, MAX_MESSAGE_OUTPUT) + "\n...";
            }
            sb.append('\n').append(output.strip());
        }
        return sb.toString();
    }
}
