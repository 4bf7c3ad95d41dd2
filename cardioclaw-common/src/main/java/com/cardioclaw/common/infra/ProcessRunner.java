package com.cardioclaw.common.infra;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs an external command as a discrete argument vector (never through a
 * shell), draining stdout and stderr and enforcing a timeout.
 */
public class ProcessRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessRunner.class);
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final Duration timeout;

    public ProcessRunner() {
        this(DEFAULT_TIMEOUT);
    }

    public ProcessRunner(Duration timeout) {
        this.timeout = timeout;
    }

    /**
     * Outcome of one process invocation.
     *
     * @param exitCode process exit code, {@code -1} when it timed out
     * @param stdout   captured standard output (UTF-8)
     * @param stderr   captured standard error (UTF-8)
     * @param timedOut whether the process was killed after the timeout
     */
    public record ExecResult(int exitCode, String stdout, String stderr, boolean timedOut) {

        public boolean ok() {
            return !timedOut && exitCode == 0;
        }

        /**
         * Best diagnostic text: stderr if present, else stdout, else a generic note.
         */
        public String diagnostics() {
            if (timedOut)
                return "timed out";
            if (stderr != null && !stderr.isBlank())
                return stderr.trim();
            if (stdout != null && !stdout.isBlank())
                return stdout.trim();
            return "exit code " + exitCode;
        }
    }

    /**
     * Run a command and wait for it.
     *
     * @throws IOException when the process cannot be started
     */
    public ExecResult run(List<String> command) throws IOException {
        log.debug("exec: {}", command);
        Process process = new ProcessBuilder(command)
                .redirectErrorStream(false)
                .start();
        process.getOutputStream().close();

        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> drain(process.getInputStream()));
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> drain(process.getErrorStream()));
        try {
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                log.warn("Command timed out after {}ms: {}", timeout.toMillis(), command.get(0));
                return new ExecResult(-1, await(stdout), await(stderr), true);
            }
            return new ExecResult(process.exitValue(), await(stdout), await(stderr), false);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while waiting for " + command.get(0), e);
        }
    }

    private static String drain(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static String await(CompletableFuture<String> future) throws InterruptedException {
        try {
            return future.get(5, TimeUnit.SECONDS);
        } catch (ExecutionException | TimeoutException e) {
            log.debug("Could not collect process output: {}", e.getMessage());
            return "";
        }
    }
}
