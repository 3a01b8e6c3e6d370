package com.phillippitts.visqol.service.metrics;

import com.phillippitts.visqol.domain.QualityMode;
import com.phillippitts.visqol.exception.ErrorKind;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class MeasurementMetricsTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final MeasurementMetrics metrics = new MeasurementMetrics(registry);

    @Test
    void latencyIsTaggedByBackendAndMode() {
        metrics.recordLatency("approximate", QualityMode.SPEECH, TimeUnit.MILLISECONDS.toNanos(40));

        var timer = registry.get("visqol.measurement.latency")
                .tag("backend", "approximate").tag("mode", "speech").timer();
        assertThat(timer.count()).isEqualTo(1L);
        assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(40.0);
    }

    @Test
    void failuresAreCountedPerReason() {
        metrics.incrementFailure("visqol-native", QualityMode.AUDIO, ErrorKind.EMPTY_AUDIO);
        metrics.incrementFailure("visqol-native", QualityMode.AUDIO, ErrorKind.EMPTY_AUDIO);
        metrics.incrementFailure("visqol-native", QualityMode.AUDIO, ErrorKind.CANCELLED);

        assertThat(registry.get("visqol.measurement.failure").tag("reason", "empty_audio").counter().count())
                .isEqualTo(2.0);
        assertThat(registry.get("visqol.measurement.failure").tag("reason", "cancelled").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void batchCountersAccumulate() {
        metrics.recordBatch(5, 1);
        metrics.recordBatch(3, 0);
        metrics.incrementSuccess("approximate", QualityMode.AUDIO);

        assertThat(registry.get("visqol.measurement.batch.pairs").counter().count()).isEqualTo(8.0);
        assertThat(registry.get("visqol.measurement.batch.failures").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("visqol.measurement.success").tag("mode", "audio").counter().count())
                .isEqualTo(1.0);
    }
}
