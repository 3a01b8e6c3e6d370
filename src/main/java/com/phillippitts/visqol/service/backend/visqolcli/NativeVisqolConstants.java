package com.phillippitts.visqol.service.backend.visqolcli;

/**
 * Command-line flags and capture limits of the native {@code visqol} binary.
 */
final class NativeVisqolConstants {

    static final String FLAG_REFERENCE = "--reference_file";
    static final String FLAG_DEGRADED = "--degraded_file";
    static final String FLAG_MODEL = "--similarity_to_quality_model";
    static final String FLAG_SPEECH_MODE = "--use_speech_mode";
    static final String FLAG_OUTPUT_DEBUG = "--output_debug";

    static final String REFERENCE_FILE_NAME = "reference.wav";
    static final String DEGRADED_FILE_NAME = "degraded.wav";
    static final String DEBUG_FILE_NAME = "debug.json";

    /** Cap on captured stderr per run. */
    static final int STDERR_MAX_BYTES = 256 * 1024;

    /** Characters of stderr quoted in error messages. */
    static final int ERROR_SNIPPET_MAX_CHARS = 2048;

    private NativeVisqolConstants() {
        // Utility class - prevent instantiation
    }
}
