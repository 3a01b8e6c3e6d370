package com.phillippitts.visqol.exception;

/**
 * Thrown when reference and degraded spectrograms disagree in shape.
 * Signals an internal inconsistency, never a user input problem.
 */
public class AlignmentException extends VisqolException {

    public AlignmentException(String message) {
        super(ErrorKind.ALIGNMENT, message);
    }
}
