package com.phillippitts.visqol.exception;

/**
 * Describes why the high-fidelity backend could not be selected.
 *
 * <p>Never thrown out of a measurement: the engine records it in its backend status
 * and falls back to the approximate backend.
 */
public class BackendUnavailableException extends VisqolException {

    private final String backendName;

    public BackendUnavailableException(String backendName, String reason) {
        super(ErrorKind.BACKEND_UNAVAILABLE, backendName + " backend unavailable: " + reason);
        this.backendName = backendName;
    }

    public BackendUnavailableException(String backendName, String reason, Throwable cause) {
        super(ErrorKind.BACKEND_UNAVAILABLE, backendName + " backend unavailable: " + reason, cause);
        this.backendName = backendName;
    }

    public String getBackendName() {
        return backendName;
    }
}
