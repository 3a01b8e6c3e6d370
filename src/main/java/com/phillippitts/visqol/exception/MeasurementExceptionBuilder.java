package com.phillippitts.visqol.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link MeasurementException} carrying process context.
 *
 * <p><b>Usage:</b>
 * <pre>
 * throw MeasurementExceptionBuilder.create("Native process failed")
 *         .backend("visqol-native")
 *         .exitCode(1)
 *         .durationMs(1500)
 *         .metadata("binaryPath", binPath)
 *         .metadata("stderr", stderrSnippet)
 *         .build();
 * </pre>
 *
 * <p>The final message format is
 * {@code {message} (exitCode={code}, durationMs={ms}, {key}={value}, ...)}.
 */
public final class MeasurementExceptionBuilder {

    private final String message;
    private String backendName;
    private Throwable cause;
    private Integer exitCode;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private MeasurementExceptionBuilder(String message) {
        this.message = message;
    }

    public static MeasurementExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new MeasurementExceptionBuilder(message);
    }

    public MeasurementExceptionBuilder backend(String backendName) {
        this.backendName = backendName;
        return this;
    }

    public MeasurementExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public MeasurementExceptionBuilder exitCode(int exitCode) {
        this.exitCode = exitCode;
        return this;
    }

    public MeasurementExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a key/value pair to the message. Null keys or values are ignored.
     */
    public MeasurementExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    public MeasurementException build() {
        String detailed = detailedMessage();
        String backend = backendName != null ? backendName : "unknown";
        return cause != null
                ? new MeasurementException(detailed, backend, cause)
                : new MeasurementException(detailed, backend);
    }

    private String detailedMessage() {
        Map<String, String> details = new LinkedHashMap<>();
        if (exitCode != null) {
            details.put("exitCode", String.valueOf(exitCode));
        }
        if (durationMs != null) {
            details.put("durationMs", String.valueOf(durationMs));
        }
        details.putAll(metadata);
        if (details.isEmpty()) {
            return message;
        }
        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;
        for (Map.Entry<String, String> entry : details.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }
        return sb.append(')').toString();
    }
}
