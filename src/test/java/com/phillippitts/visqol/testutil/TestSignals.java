package com.phillippitts.visqol.testutil;

import java.util.Random;

/**
 * Deterministic synthetic signals for measurement tests.
 */
public final class TestSignals {

    private TestSignals() {}

    public static double[] sine(double frequency, double amplitude, double seconds, int sampleRate) {
        int n = (int) Math.round(seconds * sampleRate);
        double[] out = new double[n];
        for (int i = 0; i < n; i++) {
            out[i] = amplitude * Math.sin(2 * Math.PI * frequency * i / sampleRate);
        }
        return out;
    }

    /**
     * Sum of a few harmonics with a slow amplitude envelope, closer to real programme material
     * than a pure tone.
     */
    public static double[] harmonic(double fundamental, double seconds, int sampleRate) {
        int n = (int) Math.round(seconds * sampleRate);
        double[] out = new double[n];
        for (int i = 0; i < n; i++) {
            double t = (double) i / sampleRate;
            double envelope = 0.6 + 0.4 * Math.sin(2 * Math.PI * 2.0 * t);
            double v = 0.0;
            for (int h = 1; h <= 5; h++) {
                v += Math.sin(2 * Math.PI * fundamental * h * t) / h;
            }
            out[i] = 0.3 * envelope * v;
        }
        return out;
    }

    public static double[] withNoise(double[] signal, double sigma, long seed) {
        Random random = new Random(seed);
        double[] out = new double[signal.length];
        for (int i = 0; i < signal.length; i++) {
            out[i] = signal[i] + sigma * random.nextGaussian();
        }
        return out;
    }

    public static double[] silence(int samples) {
        return new double[samples];
    }

    public static double[] concat(double[]... parts) {
        int total = 0;
        for (double[] p : parts) {
            total += p.length;
        }
        double[] out = new double[total];
        int pos = 0;
        for (double[] p : parts) {
            System.arraycopy(p, 0, out, pos, p.length);
            pos += p.length;
        }
        return out;
    }

    public static double[] scale(double[] signal, double gain) {
        double[] out = new double[signal.length];
        for (int i = 0; i < signal.length; i++) {
            out[i] = signal[i] * gain;
        }
        return out;
    }
}
