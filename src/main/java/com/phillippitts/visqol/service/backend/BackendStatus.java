package com.phillippitts.visqol.service.backend;

import com.phillippitts.visqol.exception.BackendUnavailableException;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of the one-time high-fidelity availability probe.
 *
 * @param mode              selected backend mode
 * @param backendName       name of the selected backend
 * @param unavailableReason why the native backend was not selected, null when it was
 */
public record BackendStatus(BackendMode mode, String backendName, BackendUnavailableException unavailableReason) {

    public BackendStatus {
        Objects.requireNonNull(mode, "mode must not be null");
        Objects.requireNonNull(backendName, "backendName must not be null");
        if (mode == BackendMode.HIGH_FIDELITY && unavailableReason != null) {
            throw new IllegalArgumentException("high-fidelity status cannot carry an unavailability reason");
        }
    }

    public static BackendStatus highFidelity(String backendName) {
        return new BackendStatus(BackendMode.HIGH_FIDELITY, backendName, null);
    }

    public static BackendStatus approximate(BackendUnavailableException reason) {
        return new BackendStatus(BackendMode.APPROXIMATE, BackendNames.APPROXIMATE, reason);
    }

    public boolean isHighFidelity() {
        return mode == BackendMode.HIGH_FIDELITY;
    }

    public Optional<BackendUnavailableException> reason() {
        return Optional.ofNullable(unavailableReason);
    }

    /**
     * @return human-readable one-liner for logs and health details
     */
    public String describe() {
        if (unavailableReason == null) {
            return mode + " (" + backendName + ")";
        }
        return mode + " (" + backendName + "): " + unavailableReason.getMessage();
    }
}
