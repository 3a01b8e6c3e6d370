package com.phillippitts.visqol.service.batch;

import com.phillippitts.visqol.domain.BatchOutcome;
import com.phillippitts.visqol.domain.MeasurementPair;
import com.phillippitts.visqol.domain.MeasurementResult;
import com.phillippitts.visqol.exception.ErrorKind;
import com.phillippitts.visqol.exception.VisqolException;
import com.phillippitts.visqol.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Fans a list of pairs out over an executor and collects one {@link BatchOutcome} per pair.
 *
 * <p><b>Guarantees:</b>
 * <ul>
 *   <li>Outcomes are returned in submission order regardless of completion order</li>
 *   <li>A failing pair becomes a failure marker; its siblings are unaffected</li>
 *   <li>A pair running longer than the per-pair timeout is cancelled (interrupting its worker)
 *       and reported as {@link ErrorKind#CANCELLED}</li>
 * </ul>
 *
 * <p>The timeout clock starts when a pair begins executing, not when it is queued. The worker
 * thread carries the pair index in the {@code pair} MDC key.
 *
 * <p>The executor is owned by the caller; {@link #close()} only stops the internal timeout
 * scheduler.
 */
public final class BatchRunner implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(BatchRunner.class);

    static final String MDC_PAIR = "pair";

    private final Executor executor;
    private final Duration perPairTimeout;
    private final ScheduledExecutorService timeoutScheduler;

    /**
     * @param executor       pool the pairs run on
     * @param perPairTimeout maximum run time of one pair; zero or negative disables the timeout
     */
    public BatchRunner(Executor executor, Duration perPairTimeout) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.perPairTimeout = Objects.requireNonNull(perPairTimeout, "perPairTimeout");
        this.timeoutScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "visqol-batch-timeout");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Measures every pair and returns outcomes in input order.
     *
     * @param pairs   pairs to measure, may be empty
     * @param measure measurement of one pair; exceptions become failure markers
     */
    public List<BatchOutcome> run(List<MeasurementPair> pairs,
                                  Function<MeasurementPair, MeasurementResult> measure) {
        Objects.requireNonNull(pairs, "pairs must not be null");
        Objects.requireNonNull(measure, "measure must not be null");
        if (pairs.isEmpty()) {
            return List.of();
        }
        long start = System.nanoTime();
        LOG.info("Starting batch of {} pair(s), perPairTimeout={}", pairs.size(), perPairTimeout);

        List<FutureTask<MeasurementResult>> tasks = new ArrayList<>(pairs.size());
        for (int i = 0; i < pairs.size(); i++) {
            MeasurementPair pair = Objects.requireNonNull(pairs.get(i), "pair " + i + " is null");
            FutureTask<MeasurementResult> task = newTask(i, pair, measure);
            tasks.add(task);
            submit(task);
        }

        List<BatchOutcome> outcomes = new ArrayList<>(pairs.size());
        boolean interrupted = false;
        for (int i = 0; i < tasks.size(); i++) {
            FutureTask<MeasurementResult> task = tasks.get(i);
            MeasurementPair pair = pairs.get(i);
            if (interrupted) {
                task.cancel(true);
            }
            try {
                outcomes.add(BatchOutcome.success(i, pair, task.get()));
            } catch (CancellationException e) {
                outcomes.add(BatchOutcome.failure(i, pair, ErrorKind.CANCELLED, cancellationMessage(interrupted)));
            } catch (ExecutionException e) {
                outcomes.add(toFailure(i, pair, e.getCause()));
            } catch (InterruptedException e) {
                LOG.warn("Batch interrupted while waiting for pair {}; cancelling remaining pairs", i);
                interrupted = true;
                task.cancel(true);
                outcomes.add(BatchOutcome.failure(i, pair, ErrorKind.CANCELLED, cancellationMessage(true)));
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }

        long failures = outcomes.stream().filter(o -> !o.isSuccess()).count();
        LOG.info("Batch finished in {} ms: {} succeeded, {} failed",
                TimeUtils.elapsedMillis(start), outcomes.size() - failures, failures);
        return List.copyOf(outcomes);
    }

    private FutureTask<MeasurementResult> newTask(int index, MeasurementPair pair,
                                                  Function<MeasurementPair, MeasurementResult> measure) {
        AtomicReference<FutureTask<MeasurementResult>> self = new AtomicReference<>();
        FutureTask<MeasurementResult> task = new FutureTask<>(() -> {
            ScheduledFuture<?> watchdog = scheduleTimeout(index, self.get());
            ThreadContext.put(MDC_PAIR, String.valueOf(index));
            try {
                LOG.debug("Measuring pair {}: {} vs {}", index,
                        pair.reference().describe(), pair.degraded().describe());
                return measure.apply(pair);
            } finally {
                ThreadContext.remove(MDC_PAIR);
                if (watchdog != null) {
                    watchdog.cancel(false);
                }
            }
        });
        self.set(task);
        return task;
    }

    private ScheduledFuture<?> scheduleTimeout(int index, FutureTask<MeasurementResult> task) {
        if (perPairTimeout.isZero() || perPairTimeout.isNegative()) {
            return null;
        }
        return timeoutScheduler.schedule(() -> {
            if (task.cancel(true)) {
                LOG.warn("Pair {} exceeded {} ms and was cancelled", index, perPairTimeout.toMillis());
            }
        }, perPairTimeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void submit(FutureTask<MeasurementResult> task) {
        try {
            executor.execute(() -> {
                task.run();
                // clear a late cancel(true) interrupt on caller-runs threads
                if (task.isCancelled()) {
                    Thread.interrupted();
                }
            });
        } catch (RejectedExecutionException e) {
            LOG.warn("Executor rejected pair, running on caller thread: {}", e.getMessage());
            task.run();
            if (task.isCancelled()) {
                Thread.interrupted();
            }
        }
    }

    private static BatchOutcome toFailure(int index, MeasurementPair pair, Throwable cause) {
        if (cause instanceof VisqolException ve) {
            LOG.warn("Pair {} failed ({}): {}", index, ve.getErrorKind(), ve.getMessage());
            return BatchOutcome.failure(index, pair, ve.getErrorKind(), ve.getMessage());
        }
        LOG.error("Pair {} failed unexpectedly", index, cause);
        String message = cause == null ? "unknown error" : cause.getClass().getSimpleName() + ": " + cause.getMessage();
        return BatchOutcome.failure(index, pair, ErrorKind.INTERNAL, message);
    }

    private String cancellationMessage(boolean interrupted) {
        if (interrupted) {
            return "batch interrupted";
        }
        return "cancelled after exceeding per-pair timeout of " + perPairTimeout.toMillis() + " ms";
    }

    @Override
    public void close() {
        timeoutScheduler.shutdownNow();
    }
}
