package com.phillippitts.visqol.exception;

/**
 * Base exception for all quality-measurement errors.
 * All domain exceptions extend this class so callers can handle them uniformly
 * and batch processing can turn them into per-pair failure markers.
 */
public class VisqolException extends RuntimeException {

    private final ErrorKind errorKind;

    public VisqolException(String message) {
        this(ErrorKind.INTERNAL, message);
    }

    public VisqolException(String message, Throwable cause) {
        this(ErrorKind.INTERNAL, message, cause);
    }

    protected VisqolException(ErrorKind errorKind, String message) {
        super(message);
        this.errorKind = errorKind;
    }

    protected VisqolException(ErrorKind errorKind, String message, Throwable cause) {
        super(message, cause);
        this.errorKind = errorKind;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }
}
