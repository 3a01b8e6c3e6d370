package com.phillippitts.visqol.exception;

/**
 * Thrown when a measurement is aborted by interruption or by a per-pair batch timeout.
 */
public class MeasurementCancelledException extends MeasurementException {

    public MeasurementCancelledException(String message) {
        super(ErrorKind.CANCELLED, message, "unknown");
    }
}
