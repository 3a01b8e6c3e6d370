package com.phillippitts.visqol.service.score;

import com.phillippitts.visqol.exception.EmptyAudioException;
import com.phillippitts.visqol.service.model.ModeModel;
import com.phillippitts.visqol.service.similarity.BandPatchScores;

/**
 * Reduces patch similarities to FVNSIM and VNSIM and maps VNSIM to MOS-LQO.
 *
 * <p>{@code fvnsim[b]} is the mean of band {@code b}'s patch scores. VNSIM is the mean of
 * {@code fvnsim}, weighted when the model declares band weights. A band without scored patches
 * reports 0. When no patch at all was scored the pair has no comparable content and an
 * {@link EmptyAudioException} is raised.
 */
public final class ScoreAggregator {

    private final ModeModel model;

    public ScoreAggregator(ModeModel model) {
        this.model = model;
    }

    public AggregateScore aggregate(BandPatchScores scores) {
        if (scores.totalScored() == 0) {
            throw new EmptyAudioException("No active patches to score: every reference frame is silent");
        }
        int bands = scores.bandCount();
        double[] fvnsim = new double[bands];
        for (int b = 0; b < bands; b++) {
            double[] patch = scores.band(b);
            if (patch.length == 0) {
                continue;
            }
            double sum = 0.0;
            for (double v : patch) {
                sum += v;
            }
            fvnsim[b] = clampUnit(sum / patch.length);
        }

        double vnsim = clampUnit(model.hasBandWeights()
                ? weightedMean(fvnsim, model.bandWeights())
                : mean(fvnsim));
        double moslqo = model.mapping().map(vnsim);
        return new AggregateScore(vnsim, fvnsim, scores.centreFrequencies(), moslqo);
    }

    private static double mean(double[] values) {
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    private static double weightedMean(double[] values, double[] weights) {
        if (weights.length != values.length) {
            throw new IllegalStateException("expected " + values.length + " band weights, model has "
                    + weights.length);
        }
        double sum = 0.0;
        double total = 0.0;
        for (int i = 0; i < values.length; i++) {
            sum += values[i] * weights[i];
            total += weights[i];
        }
        return sum / total;
    }

    private static double clampUnit(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }
}
