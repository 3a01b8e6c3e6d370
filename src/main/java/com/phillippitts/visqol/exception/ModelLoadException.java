package com.phillippitts.visqol.exception;

/**
 * Thrown when the per-mode model resource cannot be found, parsed or validated.
 * This is fatal for the engine being constructed.
 */
public class ModelLoadException extends VisqolException {

    private final String resource;

    public ModelLoadException(String resource, String reason) {
        super(ErrorKind.MODEL_LOAD, "Cannot load quality model " + resource + ": " + reason);
        this.resource = resource;
    }

    public ModelLoadException(String resource, String reason, Throwable cause) {
        super(ErrorKind.MODEL_LOAD, "Cannot load quality model " + resource + ": " + reason, cause);
        this.resource = resource;
    }

    public String getResource() {
        return resource;
    }
}
