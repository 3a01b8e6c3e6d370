package com.phillippitts.visqol.exception;

/**
 * Thrown when there is nothing to compare: an empty buffer, a zero-length overlap
 * after alignment, or (speech mode) no voice activity in the reference.
 */
public class EmptyAudioException extends VisqolException {

    public EmptyAudioException(String message) {
        super(ErrorKind.EMPTY_AUDIO, message);
    }
}
