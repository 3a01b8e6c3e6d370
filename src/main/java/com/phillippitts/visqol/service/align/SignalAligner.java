package com.phillippitts.visqol.service.align;

import com.phillippitts.visqol.domain.QualityMode;
import com.phillippitts.visqol.exception.EmptyAudioException;
import com.phillippitts.visqol.service.audio.AudioBuffer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Brings a reference/degraded pair to the mode's rate and a common length.
 *
 * <p>Both buffers are resampled to {@link QualityMode#sampleRate()} when needed and then truncated
 * to the shorter one. Nothing is padded.
 */
public final class SignalAligner {

    private static final Logger LOG = LogManager.getLogger(SignalAligner.class);

    /**
     * @throws EmptyAudioException if either buffer is empty or nothing overlaps after resampling
     * @throws com.phillippitts.visqol.exception.InvalidInputException if a rate conversion is impossible
     */
    public AlignedPair align(AudioBuffer reference, AudioBuffer degraded, QualityMode mode) {
        if (reference.isEmpty()) {
            throw new EmptyAudioException("Reference signal is empty");
        }
        if (degraded.isEmpty()) {
            throw new EmptyAudioException("Degraded signal is empty");
        }
        AudioBuffer ref = Resampler.resample(reference, mode.sampleRate());
        AudioBuffer deg = Resampler.resample(degraded, mode.sampleRate());

        int overlap = Math.min(ref.length(), deg.length());
        if (overlap == 0) {
            throw new EmptyAudioException("Reference and degraded signals do not overlap");
        }
        if (ref.length() != deg.length()) {
            LOG.debug("Truncating to common length {} (reference={}, degraded={})",
                    overlap, ref.length(), deg.length());
        }
        return new AlignedPair(ref.truncate(overlap), deg.truncate(overlap));
    }
}
