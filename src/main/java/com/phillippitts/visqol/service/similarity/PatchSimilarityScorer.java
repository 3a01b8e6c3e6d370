package com.phillippitts.visqol.service.similarity;

import com.phillippitts.visqol.exception.AlignmentException;
import com.phillippitts.visqol.service.analysis.Spectrogram;
import com.phillippitts.visqol.service.model.ModeModel;

import java.util.ArrayList;
import java.util.List;

/**
 * Neurogram similarity (NSIM) over time patches of each band.
 *
 * <p>Both spectrograms are clipped at {@code dynamicRangeDb} below the reference peak and shifted so
 * the floor is zero, giving values in {@code [0, L]} with {@code L = dynamicRangeDb}. Patches of
 * {@code patchFrames} frames start every {@code patchStride} frames; when the spectrogram is shorter
 * than one patch, a single patch covers every frame. Each patch scores
 * <pre>
 *   (2 mu_r mu_d + C1) / (mu_r^2 + mu_d^2 + C1) * (sigma_rd + C3) / (sigma_r sigma_d + C3)
 * </pre>
 * clamped to [0, 1], with {@code C1 = (K1 L)^2} and {@code C3 = (K2 L)^2 / 2}.
 *
 * <p>When the model filters voice activity, a patch whose reference frames are all silent is
 * skipped. The same patch schedule applies to every band.
 */
public final class PatchSimilarityScorer {

    static final double K1 = 0.01;
    static final double K2 = 0.03;

    private final ModeModel model;
    private final double c1;
    private final double c3;

    public PatchSimilarityScorer(ModeModel model) {
        this.model = model;
        double range = model.dynamicRangeDb();
        this.c1 = Math.pow(K1 * range, 2);
        this.c3 = Math.pow(K2 * range, 2) / 2.0;
    }

    /**
     * @throws AlignmentException if band or frame counts differ
     */
    public BandPatchScores score(Spectrogram reference, Spectrogram degraded) {
        if (reference.bandCount() != degraded.bandCount()) {
            throw new AlignmentException("band count mismatch: reference=" + reference.bandCount()
                    + ", degraded=" + degraded.bandCount());
        }
        if (reference.frameCount() != degraded.frameCount()) {
            throw new AlignmentException("frame count mismatch: reference=" + reference.frameCount()
                    + ", degraded=" + degraded.frameCount());
        }

        List<int[]> patches = schedule(reference);
        double floor = reference.peak() - model.dynamicRangeDb();

        double[][] scores = new double[reference.bandCount()][patches.size()];
        for (int b = 0; b < reference.bandCount(); b++) {
            double[] ref = normalise(reference.band(b), floor);
            double[] deg = normalise(degraded.band(b), floor);
            for (int p = 0; p < patches.size(); p++) {
                int[] span = patches.get(p);
                scores[b][p] = nsim(ref, deg, span[0], span[1]);
            }
        }
        return new BandPatchScores(scores, reference.centreFrequencies());
    }

    /**
     * @return {@code [start, endExclusive]} of each patch that will be scored
     */
    List<int[]> schedule(Spectrogram reference) {
        int frames = reference.frameCount();
        int size = model.patchFrames();
        List<int[]> spans = new ArrayList<>();
        if (frames < size) {
            spans.add(new int[] {0, frames});
        } else {
            for (int start = 0; start + size <= frames; start += model.patchStride()) {
                spans.add(new int[] {start, start + size});
            }
        }
        if (!model.voiceActivity().enabled()) {
            return spans;
        }
        List<int[]> kept = new ArrayList<>(spans.size());
        for (int[] span : spans) {
            if (hasActiveFrame(reference, span[0], span[1])) {
                kept.add(span);
            }
        }
        return kept;
    }

    private static boolean hasActiveFrame(Spectrogram spectrogram, int start, int end) {
        for (int f = start; f < end; f++) {
            if (spectrogram.isActive(f)) {
                return true;
            }
        }
        return false;
    }

    private static double[] normalise(double[] values, double floor) {
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = Math.max(values[i], floor) - floor;
        }
        return out;
    }

    double nsim(double[] ref, double[] deg, int start, int end) {
        int n = end - start;
        double muR = 0.0;
        double muD = 0.0;
        for (int i = start; i < end; i++) {
            muR += ref[i];
            muD += deg[i];
        }
        muR /= n;
        muD /= n;

        double varR = 0.0;
        double varD = 0.0;
        double cov = 0.0;
        for (int i = start; i < end; i++) {
            double dr = ref[i] - muR;
            double dd = deg[i] - muD;
            varR += dr * dr;
            varD += dd * dd;
            cov += dr * dd;
        }
        varR /= n;
        varD /= n;
        cov /= n;

        double intensity = (2.0 * muR * muD + c1) / (muR * muR + muD * muD + c1);
        double structure = (cov + c3) / (Math.sqrt(varR) * Math.sqrt(varD) + c3);
        double value = intensity * structure;
        return Math.max(0.0, Math.min(1.0, value));
    }
}
