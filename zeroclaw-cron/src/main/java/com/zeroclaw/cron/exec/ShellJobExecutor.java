package com.zeroclaw.cron.exec;

import com.zeroclaw.common.infra.ErrorUtils;
import com.zeroclaw.cron.CronJob;
import com.zeroclaw.cron.CronTypes.JobType;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs {@code command} through {@code /bin/sh -c}. Success is a zero exit
 * status; stdout and stderr are captured together, bounded.
 *
 * <p>
 * On timeout or interrupt the whole process tree is killed, so nothing the
 * command forked outlives the attempt.
 */
@Slf4j
public class ShellJobExecutor implements CronJobExecutor, AutoCloseable {

    private static final long OUTPUT_DRAIN_SECONDS = 5;

    private final Path workingDir;
    private final int maxOutputChars;
    private final ExecutorService outputReaders;

    public ShellJobExecutor() {
        this(null, CronOutput.MAX_OUTPUT_CHARS);
    }

    /**
     * @param workingDir     directory commands run in; {@code null} inherits ours
     * @param maxOutputChars output kept before truncation
     */
    public ShellJobExecutor(Path workingDir, int maxOutputChars) {
        this.workingDir = workingDir;
        this.maxOutputChars = maxOutputChars;
        AtomicInteger counter = new AtomicInteger();
        this.outputReaders = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "cron-shell-output-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public JobType getJobType() {
        return JobType.SHELL;
    }

    @Override
    public ExecutionResult execute(CronJob job, Duration timeout) {
        long start = System.nanoTime();
        if (outputReaders.isShutdown()) {
            return ExecutionResult.failed("shell executor closed", null, 0);
        }
        ProcessBuilder pb = new ProcessBuilder(shellCommand(job.getCommand()));
        if (workingDir != null) {
            pb.directory(new File(workingDir.toString()));
        }
        pb.redirectErrorStream(true);

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            log.error("Cron job {} failed to start: {}", job.getId(), e.getMessage());
            return ExecutionResult.failed("failed to start: " + ErrorUtils.formatErrorMessage(e), null,
                    CronJobExecutors.elapsedMs(start));
        }
        try {
            process.getOutputStream().close(); // commands get an empty stdin
        } catch (IOException e) {
            log.debug("Could not close stdin of cron job {}: {}", job.getId(), e.getMessage());
        }
        Future<String> output;
        try {
            output = outputReaders.submit(() -> readBounded(process.getInputStream()));
        } catch (RejectedExecutionException e) {
            destroyTree(process);
            return ExecutionResult.failed("shell executor closed", null, CronJobExecutors.elapsedMs(start));
        }

        try {
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                destroyTree(process);
                log.warn("Cron job {} timed out after {}ms", job.getId(), timeout.toMillis());
                return ExecutionResult.failed("timed out after " + timeout.toMillis() + "ms",
                        drain(output, 1), CronJobExecutors.elapsedMs(start));
            }

            int exitCode = process.exitValue();
            String text = drain(output, OUTPUT_DRAIN_SECONDS);
            long durationMs = CronJobExecutors.elapsedMs(start);
            if (exitCode == 0) {
                return ExecutionResult.ok(text, durationMs);
            }
            return ExecutionResult.failed("exit code " + exitCode, text, durationMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            destroyTree(process);
            return ExecutionResult.failed("interrupted", drain(output, 1), CronJobExecutors.elapsedMs(start));
        }
    }

    static List<String> shellCommand(String command) {
        String os = System.getProperty("os.name", "").toLowerCase();
        if (os.contains("win")) {
            return List.of("cmd.exe", "/c", command);
        }
        return List.of("/bin/sh", "-c", command);
    }

    /**
     * Kill descendants before the shell itself; once the shell is gone its
     * children are reparented and no longer reachable from it.
     */
    static void destroyTree(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    /**
     * Keep the first {@code maxOutputChars} characters and discard the rest
     * while still draining the pipe, so a chatty child never blocks on a full
     * buffer. Decoding happens before the cut, so a multi-byte character is
     * never split.
     */
    private String readBounded(InputStream in) throws IOException {
        StringBuilder kept = new StringBuilder();
        boolean truncated = false;
        char[] buf = new char[8192];
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            int n;
            while ((n = reader.read(buf)) != -1) {
                int room = maxOutputChars - kept.length();
                if (room > 0) {
                    kept.append(buf, 0, Math.min(room, n));
                }
                if (n > room) {
                    truncated = true;
                }
            }
        }
        if (truncated && kept.length() > 0 && Character.isHighSurrogate(kept.charAt(kept.length() - 1))) {
            kept.setLength(kept.length() - 1);
        }
        return truncated ? kept + CronOutput.TRUNCATION_MARKER : kept.toString();
    }

    private static String drain(Future<String> output, long seconds) {
        try {
            return output.get(seconds, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            output.cancel(true);
            return null;
        } catch (ExecutionException | TimeoutException e) {
            output.cancel(true);
            log.debug("Cron shell output unavailable: {}", e.getMessage());
            return null;
        }
    }

    public boolean isClosed() {
        return outputReaders.isShutdown();
    }

    @Override
    public void close() {
        outputReaders.shutdown();
        try {
            if (!outputReaders.awaitTermination(OUTPUT_DRAIN_SECONDS, TimeUnit.SECONDS)) {
                outputReaders.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outputReaders.shutdownNow();
        }
    }
}
