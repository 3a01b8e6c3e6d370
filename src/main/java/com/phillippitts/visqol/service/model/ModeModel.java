package com.phillippitts.visqol.service.model;

import com.phillippitts.visqol.domain.QualityMode;

import java.util.Objects;

/**
 * Versioned perceptual model of one {@link QualityMode}: STFT framing, band layout, patch geometry,
 * voice-activity rule and the similarity-to-quality mapping.
 *
 * <p>Instances are produced by {@link ModelRepository} after validation and are read-only.
 *
 * @param version        model version tag
 * @param mode           mode this model belongs to
 * @param windowSize     STFT window length in samples, a power of two
 * @param hopSize        STFT hop in samples
 * @param bandCount      number of perceptual bands
 * @param minFrequency   centre frequency of the lowest band, Hz
 * @param maxFrequency   centre frequency of the highest band, Hz
 * @param bandWeights    per-band weights for VNSIM, or null for an unweighted mean
 * @param patchFrames    frames per similarity patch
 * @param patchStride    frames between patch starts
 * @param dynamicRangeDb spectrogram range kept below the reference peak, dB
 * @param voiceActivity  voice-activity rule
 * @param mapping        VNSIM to MOS-LQO mapping
 */
public record ModeModel(
        String version,
        QualityMode mode,
        int windowSize,
        int hopSize,
        int bandCount,
        double minFrequency,
        double maxFrequency,
        double[] bandWeights,
        int patchFrames,
        int patchStride,
        double dynamicRangeDb,
        VoiceActivitySettings voiceActivity,
        QualityMapping mapping
) {

    public ModeModel {
        Objects.requireNonNull(version, "version must not be null");
        Objects.requireNonNull(mode, "mode must not be null");
        Objects.requireNonNull(voiceActivity, "voiceActivity must not be null");
        Objects.requireNonNull(mapping, "mapping must not be null");
        bandWeights = bandWeights == null ? null : bandWeights.clone();
    }

    @Override
    public double[] bandWeights() {
        return bandWeights == null ? null : bandWeights.clone();
    }

    public boolean hasBandWeights() {
        return bandWeights != null;
    }

    public int sampleRate() {
        return mode.sampleRate();
    }

    /**
     * @return resource identifier, e.g. {@code visqol-speech-v1}
     */
    public String id() {
        return "visqol-" + mode.id() + "-" + version;
    }
}
