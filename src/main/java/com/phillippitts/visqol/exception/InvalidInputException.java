package com.phillippitts.visqol.exception;

/**
 * Thrown when an input is of an unsupported type, is empty, carries non-finite samples,
 * or requests an impossible sample-rate conversion.
 */
public class InvalidInputException extends VisqolException {

    private final String source;

    public InvalidInputException(String reason) {
        super(ErrorKind.INVALID_INPUT, "Invalid input: " + reason);
        this.source = null;
    }

    public InvalidInputException(String source, String reason) {
        super(ErrorKind.INVALID_INPUT, "Invalid input (" + source + "): " + reason);
        this.source = source;
    }

    /**
     * @return identifier of the offending input (path or "array"), or null when not known
     */
    public String getSource() {
        return source;
    }
}
