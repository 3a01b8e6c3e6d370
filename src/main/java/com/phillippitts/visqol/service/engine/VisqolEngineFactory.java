package com.phillippitts.visqol.service.engine;

import com.phillippitts.visqol.config.engine.NativeVisqolConfig;
import com.phillippitts.visqol.config.engine.VisqolProperties;
import com.phillippitts.visqol.config.properties.BatchProperties;
import com.phillippitts.visqol.domain.QualityMode;
import com.phillippitts.visqol.service.backend.BackendProbe;
import com.phillippitts.visqol.service.metrics.MeasurementMetrics;
import com.phillippitts.visqol.service.model.ModelRepository;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;

/**
 * Creates and caches one {@link VisqolEngine} per mode from the application's configuration.
 *
 * <p>Engines share the model repository, native probe, batch executor and metrics. Each is built
 * (and probed) on first request and closed on shutdown.
 */
@Component
public class VisqolEngineFactory {

    private static final Logger LOG = LogManager.getLogger(VisqolEngineFactory.class);

    private final VisqolProperties properties;
    private final NativeVisqolConfig nativeConfig;
    private final BatchProperties batchProperties;
    private final ModelRepository modelRepository;
    private final BackendProbe probe;
    private final Executor batchExecutor;
    private final MeasurementMetrics metrics;

    private final Map<QualityMode, VisqolEngine> engines = new EnumMap<>(QualityMode.class);

    public VisqolEngineFactory(VisqolProperties properties,
                               NativeVisqolConfig nativeConfig,
                               BatchProperties batchProperties,
                               ModelRepository modelRepository,
                               BackendProbe probe,
                               @Qualifier("batchExecutor") Executor batchExecutor,
                               MeasurementMetrics metrics) {
        this.properties = properties;
        this.nativeConfig = nativeConfig;
        this.batchProperties = batchProperties;
        this.modelRepository = modelRepository;
        this.probe = probe;
        this.batchExecutor = batchExecutor;
        this.metrics = metrics;
    }

    /**
     * @return engine for the configured default mode
     */
    public VisqolEngine defaultEngine() {
        return engineFor(properties.mode());
    }

    /**
     * @throws com.phillippitts.visqol.exception.ModelLoadException if the mode's model is invalid
     */
    public synchronized VisqolEngine engineFor(QualityMode mode) {
        VisqolEngine engine = engines.get(mode);
        if (engine == null) {
            engine = VisqolEngineBuilder.builder()
                    .mode(mode)
                    .nativeConfig(nativeConfig)
                    .modelRepository(modelRepository)
                    .probe(probe)
                    .batchExecutor(batchExecutor)
                    .perPairTimeout(Duration.ofSeconds(batchProperties.getPerPairTimeoutSeconds()))
                    .metrics(metrics)
                    .build();
            engines.put(mode, engine);
        }
        return engine;
    }

    /**
     * @return the engine for {@code mode} if one has been created
     */
    public synchronized Optional<VisqolEngine> existing(QualityMode mode) {
        return Optional.ofNullable(engines.get(mode));
    }

    @PreDestroy
    public synchronized void closeAll() {
        for (Map.Entry<QualityMode, VisqolEngine> e : engines.entrySet()) {
            try {
                e.getValue().close();
            } catch (RuntimeException ex) {
                LOG.warn("Failed to close {} engine: {}", e.getKey(), ex.getMessage());
            }
        }
        engines.clear();
    }
}
