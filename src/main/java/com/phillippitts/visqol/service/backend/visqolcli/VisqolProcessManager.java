package com.phillippitts.visqol.service.backend.visqolcli;

import com.phillippitts.visqol.config.engine.NativeVisqolConfig;
import com.phillippitts.visqol.exception.MeasurementCancelledException;
import com.phillippitts.visqol.exception.MeasurementException;
import com.phillippitts.visqol.exception.MeasurementExceptionBuilder;
import com.phillippitts.visqol.service.backend.BackendNames;
import com.phillippitts.visqol.util.ProcessTimeouts;
import com.phillippitts.visqol.util.TimeUtils;
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
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Runs the native {@code visqol} binary and captures its output.
 *
 * <p>Responsibilities:
 * <ul>
 *   <li>start the process through {@link ProcessFactory}</li>
 *   <li>drain stdout and stderr concurrently with capped buffers</li>
 *   <li>enforce the configured timeout and terminate runaway processes</li>
 *   <li>report failures as {@link MeasurementException} with exit code, duration and stderr</li>
 * </ul>
 *
 * <p>Each {@link #run} call owns its process, so several comparisons may run at once.
 * {@link #close()} terminates whatever is still running.
 */
public final class VisqolProcessManager implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(VisqolProcessManager.class);

    private final ProcessFactory processFactory;
    private final Set<Process> running = ConcurrentHashMap.newKeySet();

    private record ErrorContext(
            NativeVisqolConfig cfg,
            int exitCode,
            StringBuilder stderr,
            long startNano,
            Throwable cause
    ) {}

    private record ProcessExecution(
            Process process,
            Thread outGobbler,
            Thread errGobbler,
            StringBuilder stdout,
            StringBuilder stderr
    ) {}

    public VisqolProcessManager() {
        this(new DefaultProcessFactory());
    }

    VisqolProcessManager(ProcessFactory processFactory) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
    }

    /**
     * Executes {@code command} in {@code workingDir} and returns its stdout.
     *
     * @throws MeasurementException on start failure, timeout or non-zero exit
     * @throws MeasurementCancelledException if the calling thread is interrupted while waiting
     */
    public String run(List<String> command, Path workingDir, NativeVisqolConfig cfg) {
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(cfg, "cfg");
        long startTime = System.nanoTime();
        ProcessExecution exec = null;
        try {
            exec = start(command, workingDir, cfg);
            waitForCompletion(exec, cfg, startTime);
            return handleResult(exec, cfg, startTime);
        } catch (IOException e) {
            throw nativeError("Failed to start process: " + e.getMessage(),
                    new ErrorContext(cfg, -1, null, startTime, e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MeasurementCancelledException("Native comparison interrupted after "
                    + TimeUtils.elapsedMillis(startTime) + " ms");
        } finally {
            if (exec != null) {
                cleanup(exec);
            }
        }
    }

    private ProcessExecution start(List<String> command, Path workingDir, NativeVisqolConfig cfg)
            throws IOException {
        StringBuilder stdout = new StringBuilder();
        StringBuilder stderr = new StringBuilder();
        LOG.debug("Starting native process: {}", command);
        Process process = processFactory.start(command, workingDir);
        running.add(process);

        // Gobblers start before waiting so a full pipe cannot block the child.
        Thread out = startGobbler(process.getInputStream(), stdout, "visqol-out", cfg.maxStdoutBytes());
        Thread err = startGobbler(process.getErrorStream(), stderr, "visqol-err",
                NativeVisqolConstants.STDERR_MAX_BYTES);
        return new ProcessExecution(process, out, err, stdout, stderr);
    }

    private void waitForCompletion(ProcessExecution exec, NativeVisqolConfig cfg, long startTime)
            throws InterruptedException {
        boolean finished;
        try {
            finished = exec.process().waitFor(cfg.timeoutSeconds(), TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            destroyProcess(exec.process());
            throw e;
        }
        if (!finished) {
            destroyProcess(exec.process());
            throw nativeError("Timeout after " + cfg.timeoutSeconds() + "s",
                    new ErrorContext(cfg, -1, exec.stderr(), startTime, null));
        }
        joinQuietly(exec.outGobbler(), ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
        joinQuietly(exec.errGobbler(), ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
    }

    private String handleResult(ProcessExecution exec, NativeVisqolConfig cfg, long startTime) {
        int exitCode = exec.process().exitValue();
        if (exitCode != 0) {
            throw nativeError("Non-zero exit: " + exitCode,
                    new ErrorContext(cfg, exitCode, exec.stderr(), startTime, null));
        }
        String output;
        synchronized (exec.stdout()) {
            output = exec.stdout().toString();
        }
        LOG.debug("Native process finished in {} ms, stdout={} chars", TimeUtils.elapsedMillis(startTime),
                output.length());
        return output;
    }

    private Thread startGobbler(InputStream inputStream, StringBuilder sink, String name, int maxBytes) {
        Thread thread = new Thread(new StreamGobbler(inputStream, sink, name, maxBytes), name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    /**
     * Reads lines into a capped buffer. Past the cap it keeps draining so the child never blocks
     * on a full pipe.
     */
    private static final class StreamGobbler implements Runnable {
        private final InputStream inputStream;
        private final StringBuilder sink;
        private final String name;
        private final int maxBytes;

        StreamGobbler(InputStream inputStream, StringBuilder sink, String name, int maxBytes) {
            this.inputStream = inputStream;
            this.sink = sink;
            this.name = name;
            this.maxBytes = maxBytes;
        }

        @Override
        public void run() {
            try (BufferedReader br = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
                String line;
                boolean capReached = false;
                while ((line = br.readLine()) != null) {
                    synchronized (sink) {
                        if (sink.length() >= maxBytes) {
                            if (!capReached) {
                                LOG.warn("Stream '{}' reached {}B cap; discarding further output", name, maxBytes);
                                capReached = true;
                            }
                            continue;
                        }
                        if (sink.length() > 0) {
                            sink.append('\n');
                        }
                        int available = maxBytes - sink.length();
                        if (line.length() > available) {
                            sink.append(line, 0, Math.max(0, available));
                            capReached = true;
                            LOG.warn("Stream '{}' reached {}B cap (truncated line)", name, maxBytes);
                        } else {
                            sink.append(line);
                        }
                    }
                }
            } catch (IOException e) {
                LOG.debug("Stream gobbler '{}' stopped: {}", name, e.toString());
            }
        }
    }

    private void joinQuietly(Thread thread, Duration timeout) {
        if (thread == null) {
            return;
        }
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void destroyProcess(Process process) {
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
            process.destroyForcibly();
            LOG.warn("Interrupted while destroying process; forced termination");
        }
    }

    private void cleanup(ProcessExecution exec) {
        running.remove(exec.process());
        if (exec.process().isAlive()) {
            destroyProcess(exec.process());
        }
        joinQuietly(exec.outGobbler(), ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
        joinQuietly(exec.errGobbler(), ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
    }

    private MeasurementException nativeError(String msg, ErrorContext ctx) {
        long durationMs = TimeUtils.nanosToMillis(System.nanoTime() - ctx.startNano());
        MeasurementExceptionBuilder builder = MeasurementExceptionBuilder.create(msg)
                .backend(BackendNames.NATIVE)
                .exitCode(ctx.exitCode())
                .durationMs(durationMs)
                .metadata("binaryPath", ctx.cfg().binaryPath())
                .metadata("stderr", ctx.stderr() == null ? null
                        : snippet(ctx.stderr(), NativeVisqolConstants.ERROR_SNIPPET_MAX_CHARS));
        if (ctx.cause() != null) {
            builder.cause(ctx.cause());
        }
        return builder.build();
    }

    private static String snippet(StringBuilder sb, int maxChars) {
        synchronized (sb) {
            return sb.substring(0, Math.min(maxChars, sb.length()));
        }
    }

    /**
     * @return number of processes currently running
     */
    int runningCount() {
        return running.size();
    }

    /**
     * Terminates every process still running. Idempotent.
     */
    @Override
    public void close() {
        for (Process process : List.copyOf(running)) {
            if (process.isAlive()) {
                destroyProcess(process);
            }
            running.remove(process);
        }
    }

    /**
     * Resolves a configured path against the working directory when it is relative.
     */
    static Path resolvePath(String pathString) {
        Path path = Path.of(pathString);
        if (path.isAbsolute()) {
            return path;
        }
        return Path.of(".").toAbsolutePath().normalize().resolve(path).normalize();
    }
}
