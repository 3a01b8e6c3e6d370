package com.phillippitts.visqol.service.backend;

import com.phillippitts.visqol.domain.QualityMode;
import com.phillippitts.visqol.exception.BackendUnavailableException;

import java.util.Optional;

/**
 * Decides once whether the high-fidelity backend can serve a mode.
 *
 * <p>Implementations must be side-effect free apart from file-system checks.
 */
@FunctionalInterface
public interface BackendProbe {

    /**
     * @return empty when the high-fidelity backend is usable, otherwise the reason it is not
     */
    Optional<BackendUnavailableException> probe(QualityMode mode);

    /**
     * Probe for deployments without a native binary.
     */
    static BackendProbe unavailable(String reason) {
        return mode -> Optional.of(new BackendUnavailableException(BackendNames.NATIVE, reason));
    }
}
