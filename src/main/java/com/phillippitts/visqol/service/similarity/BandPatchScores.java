package com.phillippitts.visqol.service.similarity;

import java.util.Objects;

/**
 * Patch similarities grouped by band.
 *
 * <p>{@code scores[b]} holds the similarity of every scored patch of band {@code b}, in time order.
 * A band may hold no scores when all its patches were skipped as silent.
 */
public final class BandPatchScores {

    private final double[][] scores;
    private final double[] centreFrequencies;

    public BandPatchScores(double[][] scores, double[] centreFrequencies) {
        Objects.requireNonNull(scores, "scores must not be null");
        Objects.requireNonNull(centreFrequencies, "centreFrequencies must not be null");
        if (scores.length != centreFrequencies.length) {
            throw new IllegalArgumentException("band count mismatch: " + scores.length
                    + " score rows vs " + centreFrequencies.length + " centre frequencies");
        }
        double[][] copy = new double[scores.length][];
        for (int b = 0; b < scores.length; b++) {
            copy[b] = scores[b].clone();
        }
        this.scores = copy;
        this.centreFrequencies = centreFrequencies.clone();
    }

    public int bandCount() {
        return scores.length;
    }

    public double[] band(int band) {
        return scores[band].clone();
    }

    public int totalScored() {
        int n = 0;
        for (double[] band : scores) {
            n += band.length;
        }
        return n;
    }

    public double[] centreFrequencies() {
        return centreFrequencies.clone();
    }
}
