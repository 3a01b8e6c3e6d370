package com.phillippitts.visqol.service.audio;

/**
 * Constants for WAV (RIFF/WAVE) parsing and writing.
 *
 * <p><b>WAV File Structure:</b>
 * <pre>
 * ┌─────────────────────────────────────┐
 * │ RIFF Header (12 bytes)              │  RIFF_HEADER_SIZE
 * ├─────────────────────────────────────┤
 * │ fmt chunk:                          │
 * │   - Chunk ID + Size (8 bytes)       │  CHUNK_HEADER_SIZE
 * │   - Chunk Data (≥16 bytes)          │  FMT_CHUNK_MIN_SIZE
 * ├─────────────────────────────────────┤
 * │ other chunks (LIST, fact, ...)      │  skipped
 * ├─────────────────────────────────────┤
 * │ data chunk:                         │
 * │   - Chunk ID + Size (8 bytes)       │  CHUNK_HEADER_SIZE
 * │   - Sample Data (variable)          │
 * └─────────────────────────────────────┘
 * </pre>
 *
 * @see WavDecoder
 * @see WavWriter
 */
public final class WavFormat {

    /** "RIFF" + size + "WAVE". */
    public static final int RIFF_HEADER_SIZE = 12;

    /** Chunk ID (4 bytes) + little-endian chunk size (4 bytes). */
    public static final int CHUNK_HEADER_SIZE = 8;

    /** Format tag, channels, rate, byte rate, block align, bits per sample. */
    public static final int FMT_CHUNK_MIN_SIZE = 16;

    /** Offset of the sub-format GUID inside a WAVE_FORMAT_EXTENSIBLE fmt chunk. */
    public static final int EXTENSIBLE_SUBFORMAT_OFFSET = 24;

    /** fmt size of a WAVE_FORMAT_EXTENSIBLE chunk. */
    public static final int EXTENSIBLE_FMT_SIZE = 40;

    public static final int AUDIO_FORMAT_PCM = 1;
    public static final int AUDIO_FORMAT_IEEE_FLOAT = 3;
    public static final int AUDIO_FORMAT_EXTENSIBLE = 0xFFFE;

    /** Bit depth used by {@link WavWriter}. */
    public static final int WRITE_BITS_PER_SAMPLE = 16;

    private WavFormat() {
        // Utility class - prevent instantiation
    }
}
