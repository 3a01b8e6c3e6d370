package com.phillippitts.visqol.service.batch;

import com.phillippitts.visqol.domain.BatchOutcome;
import com.phillippitts.visqol.domain.MeasurementPair;
import com.phillippitts.visqol.domain.MeasurementResult;
import com.phillippitts.visqol.exception.DecodeException;
import com.phillippitts.visqol.exception.ErrorKind;
import com.phillippitts.visqol.exception.MeasurementCancelledException;
import com.phillippitts.visqol.testutil.SyncExecutor;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;

class BatchRunnerTest {

    private ExecutorService pool;

    @BeforeEach
    void setUp() {
        pool = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    private static List<MeasurementPair> pairs(int n) {
        List<MeasurementPair> pairs = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            pairs.add(MeasurementPair.of(Path.of("ref" + i + ".wav"), Path.of("deg" + i + ".wav")));
        }
        return pairs;
    }

    private static int indexOf(MeasurementPair pair) {
        String name = pair.reference().path().getFileName().toString();
        return Integer.parseInt(name.substring(3, name.indexOf('.')));
    }

    private static MeasurementResult result(int index) {
        return MeasurementResult.of(1.0 + index * 0.5, 0.5, new double[] {0.5}, new double[] {100.0}, "test");
    }

    private static void sleep(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MeasurementCancelledException("interrupted");
        }
    }

    @Test
    void outcomesFollowInputOrderRegardlessOfCompletionOrder() {
        try (BatchRunner runner = new BatchRunner(pool, Duration.ofSeconds(10))) {
            List<BatchOutcome> outcomes = runner.run(pairs(4), pair -> {
                int i = indexOf(pair);
                sleep((4 - i) * 50L);
                return result(i);
            });

            assertThat(outcomes).extracting(BatchOutcome::index).containsExactly(0, 1, 2, 3);
            assertThat(outcomes).extracting(o -> o.result().moslqo()).containsExactly(1.0, 1.5, 2.0, 2.5);
            assertThat(outcomes).extracting(BatchOutcome::referenceId)
                    .containsExactly("ref0.wav", "ref1.wav", "ref2.wav", "ref3.wav");
        }
    }

    @Test
    void failingPairDoesNotAffectSiblings() {
        try (BatchRunner runner = new BatchRunner(pool, Duration.ofSeconds(10))) {
            List<BatchOutcome> outcomes = runner.run(pairs(3), pair -> {
                int i = indexOf(pair);
                if (i == 1) {
                    throw new DecodeException("ref1.wav", "file not found");
                }
                return result(i);
            });

            assertThat(outcomes.get(0).isSuccess()).isTrue();
            assertThat(outcomes.get(1).isSuccess()).isFalse();
            assertThat(outcomes.get(1).errorKind()).isEqualTo(ErrorKind.DECODE);
            assertThat(outcomes.get(1).errorMessage()).contains("file not found");
            assertThat(outcomes.get(2).isSuccess()).isTrue();
        }
    }

    @Test
    void unexpectedExceptionBecomesInternalFailure() {
        try (BatchRunner runner = new BatchRunner(pool, Duration.ofSeconds(10))) {
            List<BatchOutcome> outcomes = runner.run(pairs(1), pair -> {
                throw new IllegalStateException("boom");
            });

            assertThat(outcomes.get(0).errorKind()).isEqualTo(ErrorKind.INTERNAL);
            assertThat(outcomes.get(0).errorMessage()).isEqualTo("IllegalStateException: boom");
        }
    }

    @Test
    void slowPairIsCancelledAfterTimeout() {
        try (BatchRunner runner = new BatchRunner(pool, Duration.ofMillis(200))) {
            long start = System.nanoTime();
            List<BatchOutcome> outcomes = runner.run(pairs(3), pair -> {
                int i = indexOf(pair);
                if (i == 1) {
                    sleep(10_000);
                }
                return result(i);
            });
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            assertThat(outcomes.get(1).errorKind()).isEqualTo(ErrorKind.CANCELLED);
            assertThat(outcomes.get(1).errorMessage()).contains("per-pair timeout of 200 ms");
            assertThat(outcomes.get(0).isSuccess()).isTrue();
            assertThat(outcomes.get(2).isSuccess()).isTrue();
            assertThat(elapsedMs).isLessThan(5_000);
        }
    }

    @Test
    void timeoutClockStartsWhenPairStartsRunning() {
        ExecutorService single = Executors.newSingleThreadExecutor();
        try (BatchRunner runner = new BatchRunner(single, Duration.ofMillis(300))) {
            // three 150 ms pairs queued on one thread: 450 ms in total, each within its own budget
            List<BatchOutcome> outcomes = runner.run(pairs(3), pair -> {
                sleep(150);
                return result(indexOf(pair));
            });

            assertThat(outcomes).allMatch(BatchOutcome::isSuccess);
        } finally {
            single.shutdownNow();
        }
    }

    @Test
    void callerRunsTimeoutDoesNotLeaveCallerInterrupted() {
        try (BatchRunner runner = new BatchRunner(new SyncExecutor(), Duration.ofMillis(100))) {
            List<BatchOutcome> outcomes = runner.run(pairs(2), pair -> {
                if (indexOf(pair) == 0) {
                    sleep(5_000);
                }
                return result(indexOf(pair));
            });

            assertThat(outcomes.get(0).errorKind()).isEqualTo(ErrorKind.CANCELLED);
            assertThat(outcomes.get(1).isSuccess()).isTrue();
            assertThat(Thread.currentThread().isInterrupted()).isFalse();
        }
    }

    @Test
    void rejectedPairRunsOnCallerThread() {
        String caller = Thread.currentThread().getName();
        AtomicReference<String> ranOn = new AtomicReference<>();
        try (BatchRunner runner = new BatchRunner(command -> {
            throw new RejectedExecutionException("queue full");
        }, Duration.ZERO)) {
            List<BatchOutcome> outcomes = runner.run(pairs(1), pair -> {
                ranOn.set(Thread.currentThread().getName());
                return result(0);
            });

            assertThat(outcomes.get(0).isSuccess()).isTrue();
            assertThat(ranOn.get()).isEqualTo(caller);
        }
    }

    @Test
    void workerCarriesPairIndexInThreadContext() {
        Map<Integer, String> seen = new ConcurrentHashMap<>();
        try (BatchRunner runner = new BatchRunner(pool, Duration.ofSeconds(10))) {
            runner.run(pairs(3), pair -> {
                seen.put(indexOf(pair), ThreadContext.get(BatchRunner.MDC_PAIR));
                return result(indexOf(pair));
            });
        }

        assertThat(seen).containsEntry(0, "0").containsEntry(1, "1").containsEntry(2, "2");
    }

    @Test
    void interruptedCallerCancelsRemainingPairs() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        AtomicReference<List<BatchOutcome>> result = new AtomicReference<>();
        AtomicReference<Boolean> interruptKept = new AtomicReference<>();
        Function<MeasurementPair, MeasurementResult> blocking = pair -> {
            started.countDown();
            sleep(10_000);
            return result(indexOf(pair));
        };

        try (BatchRunner runner = new BatchRunner(pool, Duration.ZERO)) {
            Thread caller = new Thread(() -> {
                result.set(runner.run(pairs(2), blocking));
                interruptKept.set(Thread.currentThread().isInterrupted());
            });
            caller.start();
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
            caller.interrupt();
            caller.join(5_000);
        }

        assertThat(result.get()).hasSize(2);
        assertThat(result.get()).allSatisfy(o -> {
            assertThat(o.errorKind()).isEqualTo(ErrorKind.CANCELLED);
            assertThat(o.errorMessage()).isEqualTo("batch interrupted");
        });
        assertThat(interruptKept.get()).isTrue();
    }

    @Test
    void emptyBatchReturnsEmptyList() {
        try (BatchRunner runner = new BatchRunner(pool, Duration.ofSeconds(1))) {
            assertThat(runner.run(List.of(), pair -> result(0))).isEmpty();
        }
    }
}
