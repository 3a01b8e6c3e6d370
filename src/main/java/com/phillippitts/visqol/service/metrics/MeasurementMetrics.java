package com.phillippitts.visqol.service.metrics;

import com.phillippitts.visqol.domain.QualityMode;
import com.phillippitts.visqol.exception.ErrorKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics tracking for quality measurements.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Measurement latency per backend and mode</li>
 *   <li>Success/failure counts per backend, mode and failure kind</li>
 *   <li>Batch sizes and outcomes</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class MeasurementMetrics {

    private static final String METRIC_PREFIX = "visqol.measurement";

    private final MeterRegistry registry;

    public MeasurementMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records measurement latency.
     *
     * @param backendName name of the backend (visqol-native, approximate)
     * @param mode measurement mode
     * @param durationNanos duration in nanoseconds
     */
    public void recordLatency(String backendName, QualityMode mode, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".latency")
                .description("Time taken to measure one reference/degraded pair")
                .tag("backend", backendName)
                .tag("mode", mode.id())
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementSuccess(String backendName, QualityMode mode) {
        Counter.builder(METRIC_PREFIX + ".success")
                .description("Number of successful measurements")
                .tag("backend", backendName)
                .tag("mode", mode.id())
                .register(registry)
                .increment();
    }

    /**
     * Increments the failure counter.
     *
     * @param backendName name of the backend
     * @param mode measurement mode
     * @param kind failure classification, exported lower-case as the {@code reason} tag
     */
    public void incrementFailure(String backendName, QualityMode mode, ErrorKind kind) {
        Counter.builder(METRIC_PREFIX + ".failure")
                .description("Number of failed measurements")
                .tag("backend", backendName)
                .tag("mode", mode.id())
                .tag("reason", kind.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    /**
     * Records one finished batch.
     *
     * @param pairs number of submitted pairs
     * @param failures number of pairs that produced a failure marker
     */
    public void recordBatch(int pairs, int failures) {
        Counter.builder(METRIC_PREFIX + ".batch.pairs")
                .description("Number of pairs submitted in batches")
                .register(registry)
                .increment(pairs);
        Counter.builder(METRIC_PREFIX + ".batch.failures")
                .description("Number of batch pairs that failed")
                .register(registry)
                .increment(failures);
    }
}
