package com.phillippitts.visqol.service.audio;

import com.phillippitts.visqol.exception.InvalidInputException;

import java.util.Arrays;
import java.util.Objects;

/**
 * Mono audio samples at a known sample rate.
 *
 * <p>Samples are finite; an empty buffer is allowed and is rejected later by alignment.
 * The array is copied on construction and on access so instances stay immutable.
 *
 * @param samples    mono samples, nominally in [-1, 1]
 * @param sampleRate sample rate in Hz, positive
 */
public record AudioBuffer(double[] samples, int sampleRate) {

    public AudioBuffer {
        Objects.requireNonNull(samples, "samples must not be null");
        if (sampleRate <= 0) {
            throw new InvalidInputException("sample rate must be positive, got " + sampleRate);
        }
        for (int i = 0; i < samples.length; i++) {
            if (!Double.isFinite(samples[i])) {
                throw new InvalidInputException("non-finite sample at index " + i + ": " + samples[i]);
            }
        }
        samples = samples.clone();
    }

    @Override
    public double[] samples() {
        return samples.clone();
    }

    public int length() {
        return samples.length;
    }

    public boolean isEmpty() {
        return samples.length == 0;
    }

    public double durationSeconds() {
        return (double) samples.length / sampleRate;
    }

    /**
     * @return a buffer holding the first {@code length} samples
     */
    public AudioBuffer truncate(int length) {
        if (length < 0 || length > samples.length) {
            throw new IllegalArgumentException("length out of range: " + length);
        }
        if (length == samples.length) {
            return this;
        }
        double[] out = new double[length];
        System.arraycopy(samples, 0, out, 0, length);
        return new AudioBuffer(out, sampleRate);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AudioBuffer other)) {
            return false;
        }
        return sampleRate == other.sampleRate && Arrays.equals(samples, other.samples);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(samples) + sampleRate;
    }

    @Override
    public String toString() {
        return "AudioBuffer[length=" + samples.length + ", sampleRate=" + sampleRate + "]";
    }
}
