package com.phillippitts.visqol.service.audio;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Writes mono 16-bit signed PCM WAV files at any sample rate.
 *
 * <p>Samples are clipped to [-1, 1] and scaled by 32767.
 */
public final class WavWriter {

    private static final int CHANNELS = 1;
    private static final int BYTES_PER_SAMPLE = WavFormat.WRITE_BITS_PER_SAMPLE / 8;

    private WavWriter() {}

    public static void write(AudioBuffer buffer, Path wavPath) {
        Objects.requireNonNull(buffer, "buffer must not be null");
        writeMono16(buffer.samples(), buffer.sampleRate(), wavPath);
    }

    /**
     * @param samples    mono samples, nominally in [-1, 1]
     * @param sampleRate sample rate in Hz
     * @param wavPath    output file (created or overwritten)
     * @throws UncheckedIOException if the file cannot be written
     */
    public static void writeMono16(double[] samples, int sampleRate, Path wavPath) {
        Objects.requireNonNull(samples, "samples must not be null");
        Objects.requireNonNull(wavPath, "wavPath must not be null");
        if (sampleRate <= 0) {
            throw new IllegalArgumentException("sampleRate must be positive, got " + sampleRate);
        }
        int blockAlign = CHANNELS * BYTES_PER_SAMPLE;
        int dataSize = samples.length * blockAlign;
        try (OutputStream os = new BufferedOutputStream(Files.newOutputStream(wavPath))) {
            os.write(new byte[] { 'R', 'I', 'F', 'F' });
            writeLEInt(os, 36 + dataSize);
            os.write(new byte[] { 'W', 'A', 'V', 'E' });

            os.write(new byte[] { 'f', 'm', 't', ' ' });
            writeLEInt(os, WavFormat.FMT_CHUNK_MIN_SIZE);
            writeLEShort(os, WavFormat.AUDIO_FORMAT_PCM);
            writeLEShort(os, CHANNELS);
            writeLEInt(os, sampleRate);
            writeLEInt(os, sampleRate * blockAlign);
            writeLEShort(os, blockAlign);
            writeLEShort(os, WavFormat.WRITE_BITS_PER_SAMPLE);

            os.write(new byte[] { 'd', 'a', 't', 'a' });
            writeLEInt(os, dataSize);
            for (double sample : samples) {
                double clipped = Math.max(-1.0, Math.min(1.0, sample));
                writeLEShort(os, (int) Math.round(clipped * 32767.0));
            }
            os.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write WAV file to " + wavPath + ": " + e.getMessage(), e);
        }
    }

    private static void writeLEShort(OutputStream os, int v) throws IOException {
        os.write(v & 0xFF);
        os.write((v >>> 8) & 0xFF);
    }

    private static void writeLEInt(OutputStream os, int v) throws IOException {
        os.write(v & 0xFF);
        os.write((v >>> 8) & 0xFF);
        os.write((v >>> 16) & 0xFF);
        os.write((v >>> 24) & 0xFF);
    }
}
