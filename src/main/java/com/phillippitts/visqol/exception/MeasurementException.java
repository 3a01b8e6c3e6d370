package com.phillippitts.visqol.exception;

/**
 * Thrown when a selected backend fails to produce a result
 * (process crash, timeout, malformed output, cancellation).
 */
public class MeasurementException extends VisqolException {

    private final String backendName;

    public MeasurementException(String message) {
        super(ErrorKind.MEASUREMENT, message);
        this.backendName = "unknown";
    }

    public MeasurementException(String message, String backendName) {
        super(ErrorKind.MEASUREMENT, message + " (backend: " + backendName + ")");
        this.backendName = backendName;
    }

    public MeasurementException(String message, Throwable cause) {
        super(ErrorKind.MEASUREMENT, message, cause);
        this.backendName = "unknown";
    }

    public MeasurementException(String message, String backendName, Throwable cause) {
        super(ErrorKind.MEASUREMENT, message + " (backend: " + backendName + ")", cause);
        this.backendName = backendName;
    }

    protected MeasurementException(ErrorKind kind, String message, String backendName) {
        super(kind, message);
        this.backendName = backendName;
    }

    public String getBackendName() {
        return backendName;
    }
}
