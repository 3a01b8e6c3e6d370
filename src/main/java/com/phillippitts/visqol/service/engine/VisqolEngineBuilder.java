package com.phillippitts.visqol.service.engine;

import com.phillippitts.visqol.config.engine.NativeVisqolConfig;
import com.phillippitts.visqol.domain.QualityMode;
import com.phillippitts.visqol.service.align.SignalAligner;
import com.phillippitts.visqol.service.audio.SignalLoader;
import com.phillippitts.visqol.service.backend.BackendProbe;
import com.phillippitts.visqol.service.backend.QualityBackend;
import com.phillippitts.visqol.service.backend.visqolcli.NativeBackendProbe;
import com.phillippitts.visqol.service.backend.visqolcli.NativeVisqolBackend;
import com.phillippitts.visqol.service.metrics.MeasurementMetrics;
import com.phillippitts.visqol.service.model.ModelRepository;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.function.Function;

/**
 * Builder for {@link VisqolEngine}.
 *
 * <p>Every collaborator has a default, so {@code builder().build()} yields an AUDIO engine that
 * probes the native binary at its conventional location.
 *
 * <p><b>Usage Examples:</b>
 * <pre>{@code
 * // Speech engine, approximate backend only
 * VisqolEngine engine = VisqolEngineBuilder.builder()
 *     .mode(QualityMode.SPEECH)
 *     .nativeConfig(NativeVisqolConfig.disabled())
 *     .build();
 *
 * // Spring wiring with a shared batch pool and metrics
 * VisqolEngine engine = VisqolEngineBuilder.builder()
 *     .mode(props.mode())
 *     .nativeConfig(nativeConfig)
 *     .modelRepository(repository)
 *     .batchExecutor(batchExecutor)
 *     .perPairTimeout(Duration.ofSeconds(batch.getPerPairTimeoutSeconds()))
 *     .metrics(metrics)
 *     .build();
 * }</pre>
 */
public final class VisqolEngineBuilder {

    static final Duration DEFAULT_PER_PAIR_TIMEOUT = Duration.ofMinutes(10);

    private QualityMode mode = QualityMode.AUDIO;
    private NativeVisqolConfig nativeConfig = NativeVisqolConfig.defaults();
    private ModelRepository modelRepository;
    private BackendProbe probe;
    private Function<QualityMode, QualityBackend> highFidelityFactory;
    private SignalLoader loader;
    private SignalAligner aligner;
    private MeasurementMetrics metrics;
    private Executor batchExecutor;
    private int concurrency = Math.max(1, Runtime.getRuntime().availableProcessors());
    private Duration perPairTimeout = DEFAULT_PER_PAIR_TIMEOUT;

    private VisqolEngineBuilder() {
        // Private constructor - use builder() factory method
    }

    public static VisqolEngineBuilder builder() {
        return new VisqolEngineBuilder();
    }

    public VisqolEngineBuilder mode(QualityMode mode) {
        this.mode = Objects.requireNonNull(mode, "mode");
        return this;
    }

    /**
     * Sets the native configuration used by the default probe and backend factory.
     */
    public VisqolEngineBuilder nativeConfig(NativeVisqolConfig nativeConfig) {
        this.nativeConfig = Objects.requireNonNull(nativeConfig, "nativeConfig");
        return this;
    }

    public VisqolEngineBuilder modelRepository(ModelRepository modelRepository) {
        this.modelRepository = modelRepository;
        return this;
    }

    /**
     * Replaces the file-system probe, e.g. to force the approximate backend in tests.
     */
    public VisqolEngineBuilder probe(BackendProbe probe) {
        this.probe = probe;
        return this;
    }

    /**
     * Replaces how the high-fidelity backend is created once the probe succeeds.
     */
    public VisqolEngineBuilder highFidelityFactory(Function<QualityMode, QualityBackend> highFidelityFactory) {
        this.highFidelityFactory = highFidelityFactory;
        return this;
    }

    public VisqolEngineBuilder loader(SignalLoader loader) {
        this.loader = loader;
        return this;
    }

    public VisqolEngineBuilder aligner(SignalAligner aligner) {
        this.aligner = aligner;
        return this;
    }

    /**
     * @param metrics metrics sink, may be null
     */
    public VisqolEngineBuilder metrics(MeasurementMetrics metrics) {
        this.metrics = metrics;
        return this;
    }

    /**
     * Shares an externally managed pool for batches. Without one the engine owns a fixed pool of
     * {@link #concurrency(int)} threads and shuts it down on close.
     */
    public VisqolEngineBuilder batchExecutor(Executor batchExecutor) {
        this.batchExecutor = batchExecutor;
        return this;
    }

    public VisqolEngineBuilder concurrency(int concurrency) {
        if (concurrency <= 0) {
            throw new IllegalArgumentException("concurrency must be positive, got: " + concurrency);
        }
        this.concurrency = concurrency;
        return this;
    }

    /**
     * @param perPairTimeout maximum run time of one batch pair; zero disables the timeout
     */
    public VisqolEngineBuilder perPairTimeout(Duration perPairTimeout) {
        this.perPairTimeout = Objects.requireNonNull(perPairTimeout, "perPairTimeout");
        return this;
    }

    /**
     * Loads the model, probes the native backend and returns a ready engine.
     *
     * @throws com.phillippitts.visqol.exception.ModelLoadException if the model cannot be loaded
     */
    public VisqolEngine build() {
        return new VisqolEngine(this);
    }

    QualityMode mode() {
        return mode;
    }

    ModelRepository modelRepository() {
        return modelRepository != null ? modelRepository : new ModelRepository();
    }

    BackendProbe probe() {
        return probe != null ? probe : new NativeBackendProbe(nativeConfig);
    }

    Function<QualityMode, QualityBackend> highFidelityFactory() {
        if (highFidelityFactory != null) {
            return highFidelityFactory;
        }
        NativeVisqolConfig cfg = nativeConfig;
        return m -> new NativeVisqolBackend(cfg, m);
    }

    SignalLoader loader() {
        return loader != null ? loader : new SignalLoader();
    }

    SignalAligner aligner() {
        return aligner != null ? aligner : new SignalAligner();
    }

    MeasurementMetrics metrics() {
        return metrics;
    }

    Executor batchExecutor() {
        return batchExecutor;
    }

    int concurrency() {
        return concurrency;
    }

    Duration perPairTimeout() {
        return perPairTimeout;
    }
}
