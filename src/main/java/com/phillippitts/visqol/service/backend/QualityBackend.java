package com.phillippitts.visqol.service.backend;

import com.phillippitts.visqol.domain.MeasurementResult;
import com.phillippitts.visqol.exception.EmptyAudioException;
import com.phillippitts.visqol.exception.MeasurementException;
import com.phillippitts.visqol.service.align.AlignedPair;

/**
 * Contract shared by the high-fidelity native backend and the in-process approximate backend.
 *
 * <p>Both accept an aligned pair at the mode's sample rate and return a {@link MeasurementResult}
 * with the same fields and value ranges. Their numbers are allowed to differ.
 *
 * <p>Lifecycle:
 * <ol>
 *   <li>{@link #initialize()} prepares the backend</li>
 *   <li>{@link #compare(AlignedPair)} runs once per measurement, possibly from several threads</li>
 *   <li>{@link #close()} releases resources</li>
 * </ol>
 */
public interface QualityBackend extends AutoCloseable {

    /**
     * @throws MeasurementException if the backend cannot be prepared
     */
    void initialize();

    /**
     * Computes similarity and quality for an aligned pair.
     *
     * @param pair reference and degraded buffers of equal length at the mode's rate
     * @return result without provenance
     * @throws EmptyAudioException if the pair holds nothing to compare
     * @throws MeasurementException if the backend fails
     */
    MeasurementResult compare(AlignedPair pair);

    /**
     * @return backend name for logging, metrics and results
     */
    String getBackendName();

    BackendMode getMode();

    /**
     * @return true if initialized and not closed
     */
    boolean isHealthy();

    @Override
    void close();
}
