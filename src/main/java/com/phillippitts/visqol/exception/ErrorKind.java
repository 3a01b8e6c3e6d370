package com.phillippitts.visqol.exception;

/**
 * Stable classification of measurement failures.
 *
 * <p>Used as the failure marker of a batch slot and as the machine-readable
 * status column of exported results.
 */
public enum ErrorKind {
    INVALID_INPUT,
    DECODE,
    EMPTY_AUDIO,
    ALIGNMENT,
    MODEL_LOAD,
    BACKEND_UNAVAILABLE,
    MEASUREMENT,
    CANCELLED,
    INTERNAL
}
