package com.phillippitts.visqol.domain;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One reference/degraded pair submitted to a batch.
 *
 * @param reference reference input
 * @param degraded  degraded input
 */
public record MeasurementPair(AudioInput reference, AudioInput degraded) {

    public MeasurementPair {
        Objects.requireNonNull(reference, "reference must not be null");
        Objects.requireNonNull(degraded, "degraded must not be null");
    }

    public static MeasurementPair of(Path reference, Path degraded) {
        return new MeasurementPair(AudioInput.ofPath(reference), AudioInput.ofPath(degraded));
    }

    /**
     * Accepts anything {@link AudioInput#from(Object)} accepts.
     */
    public static MeasurementPair of(Object reference, Object degraded) {
        return new MeasurementPair(AudioInput.from(reference), AudioInput.from(degraded));
    }
}
