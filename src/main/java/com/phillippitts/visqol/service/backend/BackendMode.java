package com.phillippitts.visqol.service.backend;

/**
 * Which kind of backend an engine runs on.
 */
public enum BackendMode {
    /** External reference binary. */
    HIGH_FIDELITY,
    /** In-process spectral similarity pipeline. */
    APPROXIMATE
}
