package com.phillippitts.visqol.exception;

/**
 * Thrown when an audio container cannot be read: missing file, corrupt header,
 * or an encoding the loader does not support.
 */
public class DecodeException extends VisqolException {

    private final String path;

    public DecodeException(String path, String reason) {
        super(ErrorKind.DECODE, "Cannot decode audio at " + path + ": " + reason);
        this.path = path;
    }

    public DecodeException(String path, String reason, Throwable cause) {
        super(ErrorKind.DECODE, "Cannot decode audio at " + path + ": " + reason, cause);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
