package com.phillippitts.cvtailor.service.compiler;

import com.phillippitts.cvtailor.exception.CompileException;
import com.phillippitts.cvtailor.exception.CompileExceptionBuilder;
import com.phillippitts.cvtailor.util.ProcessTimeouts;
import com.phillippitts.cvtailor.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Runs an external tool and captures its output.
 *
 * <p>Responsibilities:
 * - Start the process via {@link ProcessFactory}
 * - Drain stdout and stderr concurrently, capped to avoid unbounded memory use
 * - Enforce a timeout and terminate runaway processes
 * - Report start failures and timeouts as {@link CompileException}
 *
 * <p>Exit codes are returned, not judged: pdflatex exits non-zero on warnings that still
 * produce a usable PDF. All state is per call, so one runner serves concurrent runs.
 */
public final class ProcessRunner {

    private static final Logger LOG = LogManager.getLogger(ProcessRunner.class);
    private static final int STDERR_MAX_CHARS = 65_536;
    private static final int ERROR_SNIPPET_MAX_CHARS = 2_000;

    private final ProcessFactory processFactory;
    private final int maxStdoutChars;

    ProcessRunner(ProcessFactory processFactory, int maxStdoutChars) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory must not be null");
        if (maxStdoutChars <= 0) {
            throw new IllegalArgumentException("maxStdoutChars must be > 0");
        }
        this.maxStdoutChars = maxStdoutChars;
    }

    /**
     * Runs {@code command} in {@code workingDir} and waits up to {@code timeout}.
     *
     * @param tool short tool name for error context
     * @throws CompileException on start failure, interruption or timeout
     */
    public ProcessResult run(String tool, List<String> command, Path workingDir, Duration timeout) {
        Objects.requireNonNull(command, "command must not be null");
        Objects.requireNonNull(timeout, "timeout must not be null");
        long start = System.nanoTime();
        StringBuilder stdout = new StringBuilder();
        StringBuilder stderr = new StringBuilder();
        Process process = null;
        Thread outGobbler = null;
        Thread errGobbler = null;
        try {
            process = processFactory.start(command, workingDir);
            // Start gobblers before waiting to avoid pipe-buffer deadlock
            outGobbler = startGobbler(process.getInputStream(), stdout, tool + "-out", maxStdoutChars);
            errGobbler = startGobbler(process.getErrorStream(), stderr, tool + "-err", STDERR_MAX_CHARS);

            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                destroyProcess(process);
                throw CompileExceptionBuilder.create("Timeout after " + timeout.toSeconds() + "s")
                        .tool(tool)
                        .durationMs(TimeUtils.elapsedMillis(start))
                        .diagnostics(snippet(stdout))
                        .build();
            }
            joinQuietly(outGobbler, ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
            joinQuietly(errGobbler, ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);

            ProcessResult result = new ProcessResult(process.exitValue(), stdout.toString(), stderr.toString(),
                    TimeUtils.elapsedMillis(start));
            LOG.debug("{} exited {} in {}ms (stdout={} chars)", tool, result.exitCode(), result.durationMs(),
                    result.stdout().length());
            return result;
        } catch (IOException e) {
            throw CompileExceptionBuilder.create("Failed to start " + tool + ": " + e.getMessage())
                    .tool(tool)
                    .cause(e)
                    .metadata("binary", command.isEmpty() ? null : command.get(0))
                    .build();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw CompileExceptionBuilder.create("Interrupted while waiting for " + tool)
                    .tool(tool)
                    .cause(e)
                    .durationMs(TimeUtils.elapsedMillis(start))
                    .build();
        } finally {
            if (process != null && process.isAlive()) {
                destroyProcess(process);
            }
            joinQuietly(outGobbler, ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
            joinQuietly(errGobbler, ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
        }
    }

    private Thread startGobbler(InputStream inputStream, StringBuilder sink, String name, int maxChars) {
        Thread thread = new Thread(new StreamGobbler(inputStream, sink, name, maxChars), name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    /**
     * Reads lines into a buffer until the cap is reached, then keeps draining without storing.
     */
    private static final class StreamGobbler implements Runnable {
        private final InputStream inputStream;
        private final StringBuilder sink;
        private final String name;
        private final int maxChars;

        StreamGobbler(InputStream inputStream, StringBuilder sink, String name, int maxChars) {
            this.inputStream = inputStream;
            this.sink = sink;
            this.name = name;
            this.maxChars = maxChars;
        }

        @Override
        public void run() {
            try (BufferedReader br = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
                String line;
                boolean capReached = false;
                while ((line = br.readLine()) != null) {
                    synchronized (sink) {
                        if (sink.length() >= maxChars) {
                            if (!capReached) {
                                LOG.warn("Stream '{}' reached {} char cap; discarding further output", name, maxChars);
                                capReached = true;
                            }
                            continue;
                        }
                        if (sink.length() > 0) {
                            sink.append('\n');
                        }
                        int available = maxChars - sink.length();
                        sink.append(line, 0, Math.min(line.length(), Math.max(available, 0)));
                    }
                }
            } catch (IOException e) {
                LOG.debug("Stream gobbler '{}' stopped: {}", name, e.toString());
            }
        }
    }

    private static String snippet(StringBuilder sb) {
        synchronized (sb) {
            int from = Math.max(0, sb.length() - ERROR_SNIPPET_MAX_CHARS);
            return sb.substring(from);
        }
    }

    private static void joinQuietly(Thread thread, Duration timeout) {
        if (thread == null) {
            return;
        }
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void destroyProcess(Process process) {
        try {
            process.destroy();
            boolean exited = process.waitFor(ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT.toMillis(),
                    TimeUnit.MILLISECONDS);
            if (!exited && process.isAlive()) {
                process.destroyForcibly();
                process.waitFor(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                if (process.isAlive()) {
                    LOG.warn("Process still alive after destroyForcibly");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while destroying process");
        }
    }
}
