package com.phillippitts.visqol.service.engine;

import com.phillippitts.visqol.config.engine.NativeVisqolConfig;
import com.phillippitts.visqol.domain.AudioInput;
import com.phillippitts.visqol.domain.BatchOutcome;
import com.phillippitts.visqol.domain.MeasurementPair;
import com.phillippitts.visqol.domain.MeasurementResult;
import com.phillippitts.visqol.domain.QualityMode;
import com.phillippitts.visqol.exception.BackendUnavailableException;
import com.phillippitts.visqol.exception.DecodeException;
import com.phillippitts.visqol.exception.EmptyAudioException;
import com.phillippitts.visqol.exception.ErrorKind;
import com.phillippitts.visqol.exception.InvalidInputException;
import com.phillippitts.visqol.exception.MeasurementCancelledException;
import com.phillippitts.visqol.exception.MeasurementException;
import com.phillippitts.visqol.exception.ModelLoadException;
import com.phillippitts.visqol.exception.VisqolException;
import com.phillippitts.visqol.service.align.AlignedPair;
import com.phillippitts.visqol.service.align.SignalAligner;
import com.phillippitts.visqol.service.audio.AudioBuffer;
import com.phillippitts.visqol.service.audio.SignalLoader;
import com.phillippitts.visqol.service.backend.BackendMode;
import com.phillippitts.visqol.service.backend.BackendNames;
import com.phillippitts.visqol.service.backend.BackendProbe;
import com.phillippitts.visqol.service.backend.BackendStatus;
import com.phillippitts.visqol.service.backend.QualityBackend;
import com.phillippitts.visqol.service.backend.approximate.ApproximateBackend;
import com.phillippitts.visqol.service.batch.BatchRunner;
import com.phillippitts.visqol.service.batch.ResultsCsvWriter;
import com.phillippitts.visqol.service.metrics.MeasurementMetrics;
import com.phillippitts.visqol.service.model.ModeModel;
import com.phillippitts.visqol.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Entry point for perceptual quality measurement of a reference/degraded pair.
 *
 * <p>An engine is bound to one {@link QualityMode}. At construction it loads the mode's model
 * and probes once whether the high-fidelity native backend can serve that mode. The outcome is
 * fixed for the engine's lifetime:
 * <pre>
 * UNINITIALIZED → PROBING → HIGH_FIDELITY (native backend)
 *                         → APPROXIMATE   (in-process backend, reason kept in {@link #getBackendStatus()})
 * </pre>
 * Native failures during {@link #measure} surface as {@link MeasurementException}; the engine
 * never switches backend per call.
 *
 * <p>Instances are safe for concurrent {@link #measure} calls once constructed. Use
 * {@link VisqolEngineBuilder} for full control over collaborators.
 *
 * <pre>{@code
 * try (VisqolEngine engine = new VisqolEngine(QualityMode.SPEECH)) {
 *     MeasurementResult r = engine.measure(Path.of("ref.wav"), Path.of("deg.wav"));
 *     System.out.println(r.moslqo());
 * }
 * }</pre>
 */
public class VisqolEngine implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(VisqolEngine.class);

    static final String MDC_BACKEND = "backend";

    private final QualityMode mode;
    private final ModeModel model;
    private final SignalLoader loader;
    private final SignalAligner aligner;
    private final MeasurementMetrics metrics;
    private final BatchRunner batchRunner;
    private final ExecutorService ownedExecutor;

    private final QualityBackend backend;
    private final BackendStatus status;
    private volatile EngineState state = EngineState.UNINITIALIZED;

    /**
     * AUDIO mode with default native configuration.
     */
    public VisqolEngine() {
        this(QualityMode.AUDIO);
    }

    /**
     * @throws ModelLoadException if the mode's model resource is missing or invalid
     */
    public VisqolEngine(QualityMode mode) {
        this(VisqolEngineBuilder.builder().mode(mode));
    }

    /**
     * @param nativeConfig native binary location and limits
     * @throws ModelLoadException if the mode's model resource is missing or invalid
     */
    public VisqolEngine(QualityMode mode, NativeVisqolConfig nativeConfig) {
        this(VisqolEngineBuilder.builder().mode(mode).nativeConfig(nativeConfig));
    }

    VisqolEngine(VisqolEngineBuilder b) {
        this.mode = Objects.requireNonNull(b.mode(), "mode");
        this.loader = b.loader();
        this.aligner = b.aligner();
        this.metrics = b.metrics();
        this.model = b.modelRepository().load(mode);

        if (b.batchExecutor() != null) {
            this.ownedExecutor = null;
            this.batchRunner = new BatchRunner(b.batchExecutor(), b.perPairTimeout());
        } else {
            this.ownedExecutor = newBatchPool(b.concurrency());
            this.batchRunner = new BatchRunner(ownedExecutor, b.perPairTimeout());
        }

        state = EngineState.PROBING;
        Selection selection;
        try {
            selection = selectBackend(b.probe(), b.highFidelityFactory());
        } catch (RuntimeException e) {
            batchRunner.close();
            if (ownedExecutor != null) {
                ownedExecutor.shutdownNow();
            }
            throw e;
        }
        this.backend = selection.backend;
        this.status = selection.status;
        state = status.isHighFidelity() ? EngineState.HIGH_FIDELITY : EngineState.APPROXIMATE;

        if (status.isHighFidelity()) {
            LOG.info("ViSQOL engine ready: mode={}, backend={}", mode, status.describe());
        } else {
            LOG.warn("ViSQOL engine using approximate backend for mode={}: {}", mode,
                    status.reason().map(Throwable::getMessage).orElse("no reason given"));
        }
    }

    private static ExecutorService newBatchPool(int concurrency) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(concurrency, r -> {
            Thread t = new Thread(r, "visqol-batch-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    private Selection selectBackend(BackendProbe probe,
                                    Function<QualityMode, QualityBackend> highFidelityFactory) {
        Optional<BackendUnavailableException> unavailable = probe.probe(mode);
        if (unavailable.isEmpty()) {
            QualityBackend nativeBackend = null;
            try {
                nativeBackend = highFidelityFactory.apply(mode);
                nativeBackend.initialize();
                return new Selection(nativeBackend, BackendStatus.highFidelity(nativeBackend.getBackendName()));
            } catch (RuntimeException e) {
                closeQuietly(nativeBackend, e);
                unavailable = Optional.of(new BackendUnavailableException(BackendNames.NATIVE,
                        "initialization failed: " + e.getMessage(), e));
            }
        }
        ApproximateBackend approximate = new ApproximateBackend(model);
        approximate.initialize();
        return new Selection(approximate, BackendStatus.approximate(unavailable.orElse(null)));
    }

    private static void closeQuietly(QualityBackend backend, RuntimeException cause) {
        if (backend == null) {
            return;
        }
        try {
            backend.close();
        } catch (RuntimeException e) {
            cause.addSuppressed(e);
        }
    }

    /**
     * Measures the perceptual quality of {@code degraded} against {@code reference}.
     *
     * <p>Each input may be a file path ({@link Path}, {@link java.io.File} or {@link String}),
     * a mono sample array (floating-point or integer), a channel-major 2-D array or an
     * {@link AudioInput}. Arrays without an explicit rate are taken to be at the mode's rate.
     *
     * @return result with provenance set to the input paths (null for arrays)
     * @throws InvalidInputException for unsupported or malformed inputs
     * @throws DecodeException if a file cannot be read or decoded
     * @throws EmptyAudioException if there is nothing to compare
     * @throws MeasurementException if the backend fails
     * @throws MeasurementCancelledException if the calling thread is interrupted
     */
    public MeasurementResult measure(Object reference, Object degraded) {
        AudioInput ref = AudioInput.from(reference);
        AudioInput deg = AudioInput.from(degraded);
        return measure(new MeasurementPair(ref, deg));
    }

    public MeasurementResult measure(MeasurementPair pair) {
        Objects.requireNonNull(pair, "pair must not be null");
        String backendName = backend.getBackendName();
        long start = System.nanoTime();
        ThreadContext.put(MDC_BACKEND, backendName);
        try {
            AudioBuffer ref = loader.load(pair.reference(), mode);
            AudioBuffer deg = loader.load(pair.degraded(), mode);
            AlignedPair aligned = aligner.align(ref, deg, mode);
            if (Thread.currentThread().isInterrupted()) {
                throw new MeasurementCancelledException("Measurement interrupted before comparison");
            }
            MeasurementResult result = backend.compare(aligned)
                    .withProvenance(pathOf(pair.reference()), pathOf(pair.degraded()));
            long elapsed = System.nanoTime() - start;
            recordSuccess(backendName, elapsed);
            LOG.debug("Measured {} vs {} in {} ms: moslqo={}, vnsim={}",
                    pair.reference().describe(), pair.degraded().describe(),
                    TimeUtils.nanosToMillis(elapsed), result.moslqo(), result.vnsim());
            return result;
        } catch (VisqolException e) {
            recordFailure(backendName, e.getErrorKind());
            throw e;
        } catch (RuntimeException e) {
            recordFailure(backendName, ErrorKind.INTERNAL);
            throw e;
        } finally {
            ThreadContext.remove(MDC_BACKEND);
        }
    }

    /**
     * Measures every pair on the batch executor.
     *
     * @return one outcome per pair, in input order
     */
    public List<BatchOutcome> measureBatch(List<MeasurementPair> pairs) {
        List<BatchOutcome> outcomes = batchRunner.run(pairs, this::measure);
        if (metrics != null) {
            int failures = (int) outcomes.stream().filter(o -> !o.isSuccess()).count();
            metrics.recordBatch(outcomes.size(), failures);
        }
        return outcomes;
    }

    /**
     * Measures every pair and writes {@code reference,degraded,moslqo,vnsim,status,error} rows
     * to {@code resultsCsv}.
     */
    public List<BatchOutcome> measureBatch(List<MeasurementPair> pairs, Path resultsCsv) {
        Objects.requireNonNull(resultsCsv, "resultsCsv must not be null");
        List<BatchOutcome> outcomes = measureBatch(pairs);
        ResultsCsvWriter.write(outcomes, resultsCsv);
        return outcomes;
    }

    private void recordSuccess(String backendName, long elapsedNanos) {
        if (metrics != null) {
            metrics.recordLatency(backendName, mode, elapsedNanos);
            metrics.incrementSuccess(backendName, mode);
        }
    }

    private void recordFailure(String backendName, ErrorKind kind) {
        if (metrics != null) {
            metrics.incrementFailure(backendName, mode, kind);
        }
    }

    private static String pathOf(AudioInput input) {
        return input.isPath() ? input.path().toString() : null;
    }

    public QualityMode getMode() {
        return mode;
    }

    public ModeModel getModel() {
        return model;
    }

    public BackendMode getBackendMode() {
        return status.mode();
    }

    public boolean isHighFidelity() {
        return status.isHighFidelity();
    }

    public EngineState getState() {
        return state;
    }

    /**
     * @return probe outcome, including why the native backend was not selected
     */
    public BackendStatus getBackendStatus() {
        return status;
    }

    public boolean isHealthy() {
        return backend.isHealthy();
    }

    @Override
    public void close() {
        backend.close();
        batchRunner.close();
        if (ownedExecutor != null) {
            ownedExecutor.shutdownNow();
        }
        LOG.debug("ViSQOL engine closed: mode={}", mode);
    }

    private record Selection(QualityBackend backend, BackendStatus status) {
    }
}
