package com.phillippitts.visqol.service.analysis;

import java.util.Objects;

/**
 * Log band energies (dB) per frame plus a per-frame activity mask.
 *
 * <p>Immutable: arrays are copied in and out.
 */
public final class Spectrogram {

    private final double[][] values;
    private final boolean[] activeFrames;
    private final double[] centreFrequencies;

    /**
     * @param values            {@code values[frame][band]} in dB
     * @param activeFrames      activity flag per frame
     * @param centreFrequencies centre frequency per band, Hz
     */
    public Spectrogram(double[][] values, boolean[] activeFrames, double[] centreFrequencies) {
        Objects.requireNonNull(values, "values must not be null");
        Objects.requireNonNull(activeFrames, "activeFrames must not be null");
        Objects.requireNonNull(centreFrequencies, "centreFrequencies must not be null");
        if (values.length != activeFrames.length) {
            throw new IllegalArgumentException("frame count " + values.length
                    + " does not match activity mask length " + activeFrames.length);
        }
        double[][] copy = new double[values.length][];
        for (int f = 0; f < values.length; f++) {
            if (values[f].length != centreFrequencies.length) {
                throw new IllegalArgumentException("frame " + f + " has " + values[f].length
                        + " bands, expected " + centreFrequencies.length);
            }
            copy[f] = values[f].clone();
        }
        this.values = copy;
        this.activeFrames = activeFrames.clone();
        this.centreFrequencies = centreFrequencies.clone();
    }

    public int frameCount() {
        return values.length;
    }

    public int bandCount() {
        return centreFrequencies.length;
    }

    public double value(int frame, int band) {
        return values[frame][band];
    }

    /**
     * @return values of one band across all frames
     */
    public double[] band(int band) {
        double[] out = new double[values.length];
        for (int f = 0; f < values.length; f++) {
            out[f] = values[f][band];
        }
        return out;
    }

    public boolean isActive(int frame) {
        return activeFrames[frame];
    }

    public int activeFrameCount() {
        int n = 0;
        for (boolean a : activeFrames) {
            if (a) {
                n++;
            }
        }
        return n;
    }

    public double peak() {
        double max = Double.NEGATIVE_INFINITY;
        for (double[] frame : values) {
            for (double v : frame) {
                max = Math.max(max, v);
            }
        }
        return max;
    }

    public double[] centreFrequencies() {
        return centreFrequencies.clone();
    }
}
