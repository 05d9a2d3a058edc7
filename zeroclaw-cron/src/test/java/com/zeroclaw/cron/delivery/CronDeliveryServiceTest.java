package com.zeroclaw.cron.delivery;

import com.zeroclaw.cron.CronJob;
import com.zeroclaw.cron.CronRun;
import com.zeroclaw.cron.CronTypes.CronDelivery;
import com.zeroclaw.cron.CronTypes.DeliveryMode;
import com.zeroclaw.cron.CronTypes.RunStatus;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

class CronDeliveryServiceTest {

    private static final Instant T0 = Instant.parse("2024-01-02T10:00:00Z");

    private final List<String> sent = new ArrayList<>();

    private CronDeliveryTransport recording(String channel) {
        return new CronDeliveryTransport() {
            @Override
            public String getChannelId() {
                return channel;
            }

            @Override
            public CompletableFuture<Void> sendText(String to, String text) {
                sent.add(channel + ":" + to + ":" + text);
                return CompletableFuture.completedFuture(null);
            }
        };
    }

    private static CronJob job(CronDelivery delivery) {
        return CronJob.builder().id("j1").name("nightly").delivery(delivery).build();
    }

    private static CronRun run(RunStatus status, String output, String error, int attempt) {
        return new CronRun(7, "j1", T0, T0.plusMillis(42), status, output, error, 42, attempt, null);
    }

    private static CronDelivery announce(String channel, boolean bestEffort) {
        return CronDelivery.builder().mode(DeliveryMode.ANNOUNCE).channel(channel).to("room-1")
                .bestEffort(bestEffort).build();
    }

    @Test
    void noDelivery_notRequested() {
        CronDeliveryService service = new CronDeliveryService(List.of(recording("telegram")));

        assertEquals(DeliveryOutcome.Status.NOT_REQUESTED,
                service.deliver(job(CronDelivery.none()), run(RunStatus.OK, "x", null, 1)).status());
        assertEquals(DeliveryOutcome.Status.NOT_REQUESTED,
                service.deliver(job(null), run(RunStatus.OK, "x", null, 1)).status());
        assertTrue(sent.isEmpty());
    }

    @Test
    void announce_sendsToChannelCaseInsensitively() {
        CronDeliveryService service = new CronDeliveryService(List.of(recording("Telegram")));

        DeliveryOutcome outcome = service.deliver(job(announce(" TELEGRAM ", false)),
                run(RunStatus.OK, "42 rows", null, 1));

        assertEquals(DeliveryOutcome.Status.DELIVERED, outcome.status());
        assertEquals(List.of("Telegram:room-1:[cron] nightly: ok (42ms)\n42 rows"), sent);
    }

    @Test
    void unknownChannel_failureRecorded() {
        CronDeliveryService service = new CronDeliveryService(List.of());

        DeliveryOutcome outcome = service.deliver(job(announce("discord", false)), run(RunStatus.OK, "", null, 1));

        assertEquals(DeliveryOutcome.Status.FAILED, outcome.status());
        assertEquals("no delivery transport for channel 'discord'", outcome.recordedError());
    }

    @Test
    void bestEffortFailure_notRecorded() {
        CronDeliveryService service = new CronDeliveryService(List.of());

        DeliveryOutcome outcome = service.deliver(job(announce("discord", true)), run(RunStatus.OK, "", null, 1));

        assertEquals(DeliveryOutcome.Status.FAILED, outcome.status());
        assertNull(outcome.recordedError());
    }

    @Test
    void slowTransport_timesOut() {
        CompletableFuture<Void> never = new CompletableFuture<>();
        CronDeliveryTransport slow = new CronDeliveryTransport() {
            @Override
            public String getChannelId() {
                return "slack";
            }

            @Override
            public CompletableFuture<Void> sendText(String to, String text) {
                return never;
            }
        };
        CronDeliveryService service = new CronDeliveryService(List.of(slow), Duration.ofMillis(100));

        DeliveryOutcome outcome = service.deliver(job(announce("slack", false)), run(RunStatus.OK, "", null, 1));

        assertEquals(DeliveryOutcome.Status.FAILED, outcome.status());
        assertTrue(outcome.error().startsWith("delivery timed out"));
        assertTrue(never.isCancelled());
    }

    @Test
    void formatMessage_errorWithAttempt() {
        String message = CronDeliveryService.formatMessage(job(null), run(RunStatus.ERROR, "last lines", "exit code 2", 3));
        assertEquals("[cron] nightly: error (42ms, attempt 3)\nerror: exit code 2\nlast lines", message);
    }

    @Test
    void resolver_normalizesPlan() {
        CronDeliveryResolver.DeliveryPlan plan = CronDeliveryResolver.resolve(job(
                CronDelivery.builder().mode(DeliveryMode.ANNOUNCE).channel("  Slack ").to("   ").build()));

        assertTrue(plan.isRequested());
        assertEquals("slack", plan.getChannel());
        assertNull(plan.getTo());
        assertFalse(plan.isBestEffort());
    }
}
