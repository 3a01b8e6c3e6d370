package com.phillippitts.visqol.domain;

import com.phillippitts.visqol.exception.InvalidInputException;

import java.io.File;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * A measurement input: either a path to an audio file or in-memory samples.
 *
 * <p>In-memory samples are held channel-major ({@code [channel][sample]}). Interleaved data is
 * split by {@link #ofInterleaved(double[], int, int)}. Samples without an explicit sample rate are
 * taken to be at the working rate of the measurement mode. Integer samples are widened to
 * {@code double} without rescaling, so a {@code short[]} keeps its {@code [-32768, 32767]} range.
 *
 * <p>Sample content (emptiness, finiteness, ragged channels) is checked when the input is loaded,
 * not here.
 */
public final class AudioInput {

    private static final String ARRAY_ID = "array";

    private final Path path;
    private final double[][] channels;
    private final Integer sampleRate;

    private AudioInput(Path path, double[][] channels, Integer sampleRate) {
        this.path = path;
        this.channels = channels;
        this.sampleRate = sampleRate;
    }

    public static AudioInput ofPath(Path path) {
        if (path == null) {
            throw new InvalidInputException("path must not be null");
        }
        return new AudioInput(path, null, null);
    }

    public static AudioInput ofPath(String path) {
        if (path == null || path.isBlank()) {
            throw new InvalidInputException("path must not be blank");
        }
        try {
            return ofPath(Path.of(path));
        } catch (InvalidPathException e) {
            throw new InvalidInputException(path, "not a valid path: " + e.getMessage());
        }
    }

    public static AudioInput ofArray(double[] samples) {
        return new AudioInput(null, new double[][] {copy(samples)}, null);
    }

    public static AudioInput ofArray(double[] samples, int sampleRate) {
        return new AudioInput(null, new double[][] {copy(samples)}, requireRate(sampleRate));
    }

    public static AudioInput ofArray(float[] samples) {
        return new AudioInput(null, new double[][] {widen(samples)}, null);
    }

    public static AudioInput ofArray(float[] samples, int sampleRate) {
        return new AudioInput(null, new double[][] {widen(samples)}, requireRate(sampleRate));
    }

    public static AudioInput ofArray(short[] samples) {
        return new AudioInput(null, new double[][] {widen(samples)}, null);
    }

    public static AudioInput ofArray(short[] samples, int sampleRate) {
        return new AudioInput(null, new double[][] {widen(samples)}, requireRate(sampleRate));
    }

    public static AudioInput ofArray(int[] samples) {
        return new AudioInput(null, new double[][] {widen(samples)}, null);
    }

    public static AudioInput ofArray(int[] samples, int sampleRate) {
        return new AudioInput(null, new double[][] {widen(samples)}, requireRate(sampleRate));
    }

    public static AudioInput ofArray(long[] samples) {
        return new AudioInput(null, new double[][] {widen(samples)}, null);
    }

    public static AudioInput ofArray(long[] samples, int sampleRate) {
        return new AudioInput(null, new double[][] {widen(samples)}, requireRate(sampleRate));
    }

    /**
     * @param channels channel-major samples, {@code channels[c][i]}
     */
    public static AudioInput ofChannels(double[][] channels) {
        return new AudioInput(null, copy(channels), null);
    }

    public static AudioInput ofChannels(double[][] channels, int sampleRate) {
        return new AudioInput(null, copy(channels), requireRate(sampleRate));
    }

    public static AudioInput ofChannels(float[][] channels) {
        return new AudioInput(null, widen(channels), null);
    }

    public static AudioInput ofChannels(float[][] channels, int sampleRate) {
        return new AudioInput(null, widen(channels), requireRate(sampleRate));
    }

    public static AudioInput ofChannels(short[][] channels) {
        return new AudioInput(null, widen(channels), null);
    }

    public static AudioInput ofChannels(short[][] channels, int sampleRate) {
        return new AudioInput(null, widen(channels), requireRate(sampleRate));
    }

    public static AudioInput ofChannels(int[][] channels) {
        return new AudioInput(null, widen(channels), null);
    }

    public static AudioInput ofChannels(int[][] channels, int sampleRate) {
        return new AudioInput(null, widen(channels), requireRate(sampleRate));
    }

    public static AudioInput ofChannels(long[][] channels) {
        return new AudioInput(null, widen(channels), null);
    }

    public static AudioInput ofChannels(long[][] channels, int sampleRate) {
        return new AudioInput(null, widen(channels), requireRate(sampleRate));
    }

    /**
     * Splits frame-interleaved samples ({@code L R L R ...}) into channels.
     *
     * @throws InvalidInputException if the data length is not a multiple of the channel count
     */
    public static AudioInput ofInterleaved(double[] data, int channelCount, int sampleRate) {
        if (data == null) {
            throw new InvalidInputException(ARRAY_ID, "samples must not be null");
        }
        if (channelCount <= 0) {
            throw new InvalidInputException(ARRAY_ID, "channel count must be positive, got " + channelCount);
        }
        if (data.length % channelCount != 0) {
            throw new InvalidInputException(ARRAY_ID, "interleaved length " + data.length
                    + " is not a multiple of " + channelCount + " channels");
        }
        int frames = data.length / channelCount;
        double[][] split = new double[channelCount][frames];
        for (int i = 0; i < frames; i++) {
            for (int c = 0; c < channelCount; c++) {
                split[c][i] = data[i * channelCount + c];
            }
        }
        return new AudioInput(null, split, requireRate(sampleRate));
    }

    /**
     * Wraps any supported input object.
     *
     * <p>Accepted: {@link AudioInput}, {@link Path}, {@link File}, {@link String} (path),
     * one-dimensional {@code double}, {@code float}, {@code short}, {@code int} and {@code long}
     * arrays, and their two-dimensional (channel-major) forms.
     *
     * @throws InvalidInputException for null or any other type
     */
    public static AudioInput from(Object input) {
        if (input == null) {
            throw new InvalidInputException("input must not be null");
        }
        if (input instanceof AudioInput audioInput) {
            return audioInput;
        }
        if (input instanceof Path p) {
            return ofPath(p);
        }
        if (input instanceof File f) {
            return ofPath(f.toPath());
        }
        if (input instanceof String s) {
            return ofPath(s);
        }
        if (input instanceof double[] d) {
            return ofArray(d);
        }
        if (input instanceof float[] f) {
            return ofArray(f);
        }
        if (input instanceof double[][] d) {
            return ofChannels(d);
        }
        if (input instanceof float[][] f) {
            return ofChannels(f);
        }
        if (input instanceof short[] s) {
            return ofArray(s);
        }
        if (input instanceof int[] i) {
            return ofArray(i);
        }
        if (input instanceof long[] l) {
            return ofArray(l);
        }
        if (input instanceof short[][] s) {
            return ofChannels(s);
        }
        if (input instanceof int[][] i) {
            return ofChannels(i);
        }
        if (input instanceof long[][] l) {
            return ofChannels(l);
        }
        throw new InvalidInputException("Unsupported input type: " + input.getClass().getName());
    }

    public boolean isPath() {
        return path != null;
    }

    /**
     * @return the file path, or null for in-memory input
     */
    public Path path() {
        return path;
    }

    /**
     * @return copy of the channel-major samples, or null for path input
     */
    public double[][] channels() {
        return channels == null ? null : copy(channels);
    }

    /**
     * @return explicit sample rate of in-memory samples, empty when the mode rate applies
     */
    public OptionalInt sampleRate() {
        return sampleRate == null ? OptionalInt.empty() : OptionalInt.of(sampleRate);
    }

    /**
     * @return the path as a string, or {@code "array"} for in-memory input
     */
    public String describe() {
        return path != null ? path.toString() : ARRAY_ID;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AudioInput other)) {
            return false;
        }
        return Objects.equals(path, other.path)
                && Arrays.deepEquals(channels, other.channels)
                && Objects.equals(sampleRate, other.sampleRate);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(path, sampleRate) + Arrays.deepHashCode(channels);
    }

    @Override
    public String toString() {
        return "AudioInput[" + describe() + "]";
    }

    private static Integer requireRate(int sampleRate) {
        if (sampleRate <= 0) {
            throw new InvalidInputException(ARRAY_ID, "sample rate must be positive, got " + sampleRate);
        }
        return sampleRate;
    }

    private static double[] copy(double[] samples) {
        if (samples == null) {
            throw new InvalidInputException(ARRAY_ID, "samples must not be null");
        }
        return samples.clone();
    }

    private static double[][] copy(double[][] channels) {
        if (channels == null) {
            throw new InvalidInputException(ARRAY_ID, "samples must not be null");
        }
        double[][] out = new double[channels.length][];
        for (int c = 0; c < channels.length; c++) {
            out[c] = copy(channels[c]);
        }
        return out;
    }

    private static double[] widen(float[] samples) {
        if (samples == null) {
            throw new InvalidInputException(ARRAY_ID, "samples must not be null");
        }
        double[] out = new double[samples.length];
        for (int i = 0; i < samples.length; i++) {
            out[i] = samples[i];
        }
        return out;
    }

    private static double[][] widen(float[][] channels) {
        if (channels == null) {
            throw new InvalidInputException(ARRAY_ID, "samples must not be null");
        }
        double[][] out = new double[channels.length][];
        for (int c = 0; c < channels.length; c++) {
            out[c] = widen(channels[c]);
        }
        return out;
    }

    private static double[] widen(short[] samples) {
        if (samples == null) {
            throw new InvalidInputException(ARRAY_ID, "samples must not be null");
        }
        double[] out = new double[samples.length];
        for (int i = 0; i < samples.length; i++) {
            out[i] = samples[i];
        }
        return out;
    }

    private static double[] widen(int[] samples) {
        if (samples == null) {
            throw new InvalidInputException(ARRAY_ID, "samples must not be null");
        }
        return Arrays.stream(samples).asDoubleStream().toArray();
    }

    private static double[] widen(long[] samples) {
        if (samples == null) {
            throw new InvalidInputException(ARRAY_ID, "samples must not be null");
        }
        return Arrays.stream(samples).asDoubleStream().toArray();
    }

    private static double[][] widen(short[][] channels) {
        if (channels == null) {
            throw new InvalidInputException(ARRAY_ID, "samples must not be null");
        }
        double[][] out = new double[channels.length][];
        for (int c = 0; c < channels.length; c++) {
            out[c] = widen(channels[c]);
        }
        return out;
    }

    private static double[][] widen(int[][] channels) {
        if (channels == null) {
            throw new InvalidInputException(ARRAY_ID, "samples must not be null");
        }
        double[][] out = new double[channels.length][];
        for (int c = 0; c < channels.length; c++) {
            out[c] = widen(channels[c]);
        }
        return out;
    }

    private static double[][] widen(long[][] channels) {
        if (channels == null) {
            throw new InvalidInputException(ARRAY_ID, "samples must not be null");
        }
        double[][] out = new double[channels.length][];
        for (int c = 0; c < channels.length; c++) {
            out[c] = widen(channels[c]);
        }
        return out;
    }
}
