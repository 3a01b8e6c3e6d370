package com.phillippitts.visqol.service.align;

import com.phillippitts.visqol.service.audio.AudioBuffer;

import java.util.Objects;

/**
 * Reference and degraded buffers at the same rate and of the same length.
 */
public record AlignedPair(AudioBuffer reference, AudioBuffer degraded) {

    public AlignedPair {
        Objects.requireNonNull(reference, "reference must not be null");
        Objects.requireNonNull(degraded, "degraded must not be null");
        if (reference.sampleRate() != degraded.sampleRate()) {
            throw new IllegalArgumentException("sample rates differ: "
                    + reference.sampleRate() + " vs " + degraded.sampleRate());
        }
        if (reference.length() != degraded.length()) {
            throw new IllegalArgumentException("lengths differ: "
                    + reference.length() + " vs " + degraded.length());
        }
    }

    public int length() {
        return reference.length();
    }

    public int sampleRate() {
        return reference.sampleRate();
    }
}
