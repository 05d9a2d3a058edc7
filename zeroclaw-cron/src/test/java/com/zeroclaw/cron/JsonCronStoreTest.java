package com.zeroclaw.cron;

import com.zeroclaw.cron.CronState.Completion;
import com.zeroclaw.cron.CronTypes.CronDelivery;
import com.zeroclaw.cron.CronTypes.CronJobCreate;
import com.zeroclaw.cron.CronTypes.CronJobPatch;
import com.zeroclaw.cron.CronTypes.CronSchedule;
import com.zeroclaw.cron.CronTypes.DeliveryMode;
import com.zeroclaw.cron.CronTypes.JobType;
import com.zeroclaw.cron.CronTypes.RunStatus;
import com.zeroclaw.cron.ScheduleError.Reason;
import com.zeroclaw.cron.exec.CronOutput;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JsonCronStoreTest {

    private static final Instant T0 = Instant.parse("2024-01-02T10:00:00Z");

    private MutableClock clock;
    private CronSettings settings;
    private JsonCronStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        settings = CronSettings.builder()
                .zone(ZoneOffset.UTC)
                .maxTasks(3)
                .maxRunHistory(3)
                .build();
        store = JsonCronStore.inMemory(settings, clock);
    }

    static CronJobCreate shell(String name, String expr) {
        return CronJobCreate.builder()
                .name(name)
                .jobType(JobType.SHELL)
                .command("echo " + name)
                .schedule(CronSchedule.Cron.of(expr))
                .build();
    }

    private CronRun run(String jobId, RunStatus status, String output) {
        Instant now = clock.instant();
        return new CronRun(0, jobId, now, now.plusMillis(5), status, output,
                status == RunStatus.ERROR ? "exit code 1" : null, 5, 1, null);
    }

    // =========================================================================
    // Create
    // =========================================================================

    @Nested
    class Create {

        @Test
        void assignsIdAndInitialNextRun() {
            CronJob job = store.create(shell("hourly", "0 * * * *"));

            assertNotNull(job.getId());
            assertEquals(8, job.getId().length());
            assertEquals(Instant.parse("2024-01-02T11:00:00Z"), job.getNextRun());
            assertEquals(T0, job.getCreatedAt());
            assertTrue(job.isEnabled());
            assertEquals(CronTypes.SessionTarget.ISOLATED, job.getSessionTarget());
            assertEquals(DeliveryMode.NONE, job.getDelivery().getMode());
        }

        @Test
        void returnsCopy() {
            CronJob job = store.create(shell("a", "* * * * *"));
            job.setName("mutated");
            assertEquals("a", store.get(job.getId()).orElseThrow().getName());
        }

        @Test
        void malformedExpression_rejectedAndNothingStored() {
            CronException.InvalidSchedule e = assertThrows(CronException.InvalidSchedule.class,
                    () -> store.create(shell("bad", "*/5 * * 13")));
            assertEquals(Reason.MALFORMED_FIELD, e.getReason());
            assertEquals(0, store.size());
        }

        @Test
        void outOfRange_rejected() {
            CronException.InvalidSchedule e = assertThrows(CronException.InvalidSchedule.class,
                    () -> store.create(shell("bad", "0 24 * * *")));
            assertEquals(Reason.OUT_OF_RANGE, e.getReason());
        }

        @Test
        void pastFixedTime_rejected() {
            CronJobCreate create = shell("once", "* * * * *");
            create.setSchedule(new CronSchedule.At(T0.minusSeconds(60)));
            CronException.InvalidSchedule e = assertThrows(CronException.InvalidSchedule.class,
                    () -> store.create(create));
            assertEquals(Reason.INVALID_SCHEDULE, e.getReason());
        }

        @Test
        void futureFixedTime_accepted() {
            CronJobCreate create = shell("once", "* * * * *");
            create.setSchedule(new CronSchedule.At(T0.plusSeconds(60)));
            assertEquals(T0.plusSeconds(60), store.create(create).getNextRun());
        }

        @Test
        void neverFiringExpression_rejected() {
            assertThrows(CronException.InvalidSchedule.class, () -> store.create(shell("feb30", "0 0 30 2 *")));
        }

        @Test
        void shellWithoutCommand_rejected() {
            CronJobCreate create = shell("x", "* * * * *");
            create.setCommand("  ");
            assertThrows(CronException.InvalidJob.class, () -> store.create(create));
        }

        @Test
        void agentWithCommand_rejected() {
            CronJobCreate create = shell("x", "* * * * *");
            create.setJobType(JobType.AGENT);
            create.setPrompt("hello");
            assertThrows(CronException.InvalidJob.class, () -> store.create(create));
        }

        @Test
        void announceWithoutChannel_rejected() {
            CronJobCreate create = shell("x", "* * * * *");
            create.setDelivery(CronDelivery.builder().mode(DeliveryMode.ANNOUNCE).build());
            assertThrows(CronException.InvalidJob.class, () -> store.create(create));
        }

        @Test
        void maxTasks_enforced() {
            store.create(shell("a", "* * * * *"));
            store.create(shell("b", "* * * * *"));
            CronJob c = store.create(shell("c", "* * * * *"));

            CronException.AdmissionRejected e = assertThrows(CronException.AdmissionRejected.class,
                    () -> store.create(shell("d", "* * * * *")));
            assertEquals(3, e.getLimit());

            store.delete(c.getId());
            assertNotNull(store.create(shell("d", "* * * * *")).getId());
        }
    }

    // =========================================================================
    // Read / patch / delete
    // =========================================================================

    @Nested
    class Mutations {

        @Test
        void list_orderedByCreatedAtThenInsertion() {
            CronJob a = store.create(shell("a", "* * * * *"));
            CronJob b = store.create(shell("b", "* * * * *"));
            clock.set(T0.minusSeconds(3600));
            CronJob early = store.create(shell("early", "* * * * *"));

            List<String> ids = store.list().stream().map(CronJob::getId).toList();
            assertEquals(List.of(early.getId(), a.getId(), b.getId()), ids);
        }

        @Test
        void list_withFilter() {
            store.create(shell("a", "* * * * *"));
            CronJob b = store.create(shell("b", "* * * * *"));
            store.patch(b.getId(), CronJobPatch.builder().enabled(false).build());

            assertEquals(List.of("a"), store.list(CronJob::isEnabled).stream().map(CronJob::getName).toList());
        }

        @Test
        void get_unknown_empty() {
            assertTrue(store.get("nope").isEmpty());
            assertTrue(store.get(null).isEmpty());
        }

        @Test
        void patch_scheduleChange_recomputesNextRun() {
            CronJob job = store.create(shell("a", "0 * * * *"));
            clock.advance(Duration.ofMinutes(10));

            CronJob patched = store.patch(job.getId(),
                    CronJobPatch.builder().schedule(CronSchedule.Cron.of("30 * * * *")).build());

            assertEquals(Instant.parse("2024-01-02T10:30:00Z"), patched.getNextRun());
            assertEquals(T0.plus(Duration.ofMinutes(10)), patched.getUpdatedAt());
            assertEquals(T0, patched.getCreatedAt());
        }

        @Test
        void patch_invalidSchedule_leavesJobUnchanged() {
            CronJob job = store.create(shell("a", "0 * * * *"));

            assertThrows(CronException.InvalidSchedule.class, () -> store.patch(job.getId(),
                    CronJobPatch.builder().name("renamed").schedule(CronSchedule.Cron.of("61 * * * *")).build()));

            CronJob stored = store.get(job.getId()).orElseThrow();
            assertEquals("a", stored.getName());
            assertEquals(CronSchedule.Cron.of("0 * * * *"), stored.getSchedule());
        }

        @Test
        void patch_reenable_recomputesNextRun() {
            CronJob job = store.create(shell("a", "0 * * * *"));
            store.patch(job.getId(), CronJobPatch.builder().enabled(false).build());
            clock.advance(Duration.ofHours(5));

            CronJob enabled = store.patch(job.getId(), CronJobPatch.builder().enabled(true).build());
            assertEquals(Instant.parse("2024-01-02T16:00:00Z"), enabled.getNextRun());
        }

        @Test
        void patch_switchToAgent_dropsCommand() {
            CronJob job = store.create(shell("a", "0 * * * *"));
            CronJob patched = store.patch(job.getId(),
                    CronJobPatch.builder().jobType(JobType.AGENT).prompt("daily digest").model("m1").build());

            assertEquals(JobType.AGENT, patched.getJobType());
            assertNull(patched.getCommand());
            assertEquals("daily digest", patched.getPrompt());
            assertEquals("m1", patched.getModel());
        }

        @Test
        void patch_unknown_notFound() {
            assertThrows(CronException.JobNotFound.class,
                    () -> store.patch("nope", CronJobPatch.builder().name("x").build()));
        }

        @Test
        void delete_removesJobAndRuns() {
            CronJob job = store.create(shell("a", "* * * * *"));
            store.appendRun(job.getId(), run(job.getId(), RunStatus.OK, "hi"));

            assertTrue(store.delete(job.getId()));
            assertFalse(store.delete(job.getId()));
            assertTrue(store.get(job.getId()).isEmpty());
            assertTrue(store.listRuns(job.getId(), 10).isEmpty());
        }
    }

    // =========================================================================
    // Runs
    // =========================================================================

    @Nested
    class Runs {

        @Test
        void history_trimmedOldestFirst_newestReturnedFirst() {
            CronJob job = store.create(shell("a", "* * * * *"));
            for (int i = 1; i <= 5; i++) {
                store.appendRun(job.getId(), run(job.getId(), RunStatus.OK, "run " + i));
            }

            List<CronRun> runs = store.listRuns(job.getId(), 10);
            assertEquals(List.of("run 5", "run 4", "run 3"), runs.stream().map(CronRun::output).toList());
            assertTrue(runs.get(0).id() > runs.get(1).id());
            assertEquals(job.getId(), runs.get(0).jobId());
        }

        @Test
        void listRuns_respectsLimit() {
            CronJob job = store.create(shell("a", "* * * * *"));
            store.appendRun(job.getId(), run(job.getId(), RunStatus.OK, "1"));
            store.appendRun(job.getId(), run(job.getId(), RunStatus.OK, "2"));

            assertEquals(List.of("2"), store.listRuns(job.getId(), 1).stream().map(CronRun::output).toList());
            assertTrue(store.listRuns(job.getId(), 0).isEmpty());
        }

        @Test
        void appendRun_unknownJob_notFound() {
            assertThrows(CronException.JobNotFound.class,
                    () -> store.appendRun("nope", run("nope", RunStatus.OK, "x")));
        }

        @Test
        void appendRun_truncatesOversizedOutput() {
            CronJob job = store.create(shell("a", "* * * * *"));
            CronRun stored = store.appendRun(job.getId(),
                    run(job.getId(), RunStatus.OK, "x".repeat(CronOutput.MAX_OUTPUT_CHARS + 100)));

            assertTrue(stored.output().endsWith(CronOutput.TRUNCATION_MARKER));
            assertEquals(CronOutput.MAX_OUTPUT_CHARS + CronOutput.TRUNCATION_MARKER.length(),
                    stored.output().length());
        }

        @Test
        void finalize_setsLastFieldsAndAdvancesFromNow() {
            CronJob job = store.create(shell("a", "0 * * * *"));
            clock.advance(Duration.ofMinutes(90));

            Completion completion = store.finalizeRun(job.getId(), run(job.getId(), RunStatus.ERROR, ""))
                    .orElseThrow();

            assertFalse(completion.removed());
            CronJob updated = store.get(job.getId()).orElseThrow();
            assertEquals(RunStatus.ERROR, updated.getLastStatus());
            assertEquals("exit code 1", updated.getLastOutput());
            assertEquals(clock.instant().plusMillis(5), updated.getLastRun());
            assertEquals(Instant.parse("2024-01-02T12:00:00Z"), updated.getNextRun());
            assertEquals(1, store.listRuns(job.getId(), 10).size());
        }

        @Test
        void finalize_deleteAfterRun_removesJob() {
            CronJobCreate create = shell("once", "* * * * *");
            create.setDeleteAfterRun(true);
            CronJob job = store.create(create);

            Completion completion = store.finalizeRun(job.getId(), run(job.getId(), RunStatus.ERROR, null))
                    .orElseThrow();

            assertTrue(completion.removed());
            assertTrue(store.get(job.getId()).isEmpty());
            assertEquals(0, store.size());
        }

        @Test
        void finalize_exhaustedFixedTime_removesJob() {
            CronJobCreate create = shell("once", "* * * * *");
            create.setSchedule(new CronSchedule.At(T0.plusSeconds(30)));
            CronJob job = store.create(create);
            clock.advance(Duration.ofMinutes(1));

            Optional<Completion> completion = store.finalizeRun(job.getId(), run(job.getId(), RunStatus.OK, "done"));

            assertTrue(completion.orElseThrow().removed());
            assertNull(completion.get().job().getNextRun());
            assertEquals(RunStatus.OK, completion.get().job().getLastStatus());
            assertTrue(store.get(job.getId()).isEmpty());
        }

        @Test
        void finalize_missingJob_empty() {
            assertTrue(store.finalizeRun("gone", run("gone", RunStatus.OK, "x")).isEmpty());
        }
    }

    // =========================================================================
    // Persistence
    // =========================================================================

    @Nested
    class Persistence {

        @TempDir
        Path tempDir;

        @Test
        void roundTrip_restoresJobsRunsAndRunIds() {
            Path file = tempDir.resolve("cron/jobs.json");
            JsonCronStore first = new JsonCronStore(file, settings, clock);
            CronJob a = first.create(shell("a", "0 9 * * 1-5"));
            CronJobCreate agent = CronJobCreate.builder()
                    .name("digest")
                    .jobType(JobType.AGENT)
                    .prompt("summarize")
                    .schedule(new CronSchedule.Every(60_000))
                    .delivery(CronDelivery.builder().mode(DeliveryMode.ANNOUNCE).channel("telegram").to("42")
                            .bestEffort(true).build())
                    .build();
            CronJob b = first.create(agent);
            CronRun stored = first.appendRun(a.getId(), run(a.getId(), RunStatus.OK, "hello"));
            assertTrue(Files.exists(file));

            JsonCronStore second = new JsonCronStore(file, settings, clock);

            assertEquals(List.of(a.getId(), b.getId()), second.list().stream().map(CronJob::getId).toList());
            CronJob reloaded = second.get(b.getId()).orElseThrow();
            assertEquals(new CronSchedule.Every(60_000), reloaded.getSchedule());
            assertEquals(DeliveryMode.ANNOUNCE, reloaded.getDelivery().getMode());
            assertTrue(reloaded.getDelivery().isBestEffort());
            assertEquals(b.getNextRun(), reloaded.getNextRun());
            assertEquals(CronSchedule.Cron.of("0 9 * * 1-5"), second.get(a.getId()).orElseThrow().getSchedule());

            List<CronRun> runs = second.listRuns(a.getId(), 10);
            assertEquals(List.of(stored), runs);
            CronRun next = second.appendRun(a.getId(), run(a.getId(), RunStatus.OK, "again"));
            assertTrue(next.id() > stored.id());
        }

        @Test
        void snapshotUsesSnakeCase() throws IOException {
            Path file = tempDir.resolve("jobs.json");
            JsonCronStore fileStore = new JsonCronStore(file, settings, clock);
            CronJobCreate create = shell("a", "* * * * *");
            create.setDeleteAfterRun(true);
            fileStore.create(create);

            String json = Files.readString(file);
            assertTrue(json.contains("\"delete_after_run\" : true"), json);
            assertTrue(json.contains("\"next_run\""), json);
            assertTrue(json.contains("\"kind\" : \"cron\""), json);
            assertTrue(json.contains("\"job_type\" : \"shell\""), json);
            assertTrue(json.contains("\"version\" : 1"), json);
        }

        @Test
        void corruptFile_loadsEmptyAndMovesAside() throws IOException {
            Path file = tempDir.resolve("jobs.json");
            Files.writeString(file, "{not json");

            JsonCronStore fileStore = new JsonCronStore(file, settings, clock);

            assertEquals(0, fileStore.size());
            assertTrue(Files.exists(tempDir.resolve("jobs.json.corrupt")));
        }

        @Test
        void blankFile_loadsEmpty() throws IOException {
            Path file = tempDir.resolve("jobs.json");
            Files.writeString(file, "  ");
            assertEquals(0, new JsonCronStore(file, settings, clock).size());
        }

        @Test
        void unwritableFile_storeUnavailableButMemoryKept() throws IOException {
            Path blocker = tempDir.resolve("blocker");
            Files.writeString(blocker, "not a directory");
            JsonCronStore fileStore = new JsonCronStore(blocker.resolve("jobs.json"), settings, clock);

            assertThrows(CronException.StoreUnavailable.class, () -> fileStore.create(shell("a", "* * * * *")));
            assertEquals(1, fileStore.size());
        }
    }
}
