package com.phillippitts.visqol.service.align;

import com.phillippitts.visqol.exception.InvalidInputException;
import com.phillippitts.visqol.service.audio.AudioBuffer;

/**
 * Band-limited sample-rate conversion by Blackman-windowed sinc interpolation.
 *
 * <p>The low-pass cutoff is the lower of the two Nyquist frequencies, so downsampling does not
 * alias. Output length is {@code floor(n * target / source)}.
 */
public final class Resampler {

    /** Sinc zero crossings kept on each side of the kernel centre. */
    static final int ZERO_CROSSINGS = 16;

    private Resampler() {
    }

    /**
     * @return {@code buffer} itself when the rates already match
     * @throws InvalidInputException if either rate is not positive
     */
    public static AudioBuffer resample(AudioBuffer buffer, int targetRate) {
        int sourceRate = buffer.sampleRate();
        if (targetRate <= 0 || sourceRate <= 0) {
            throw new InvalidInputException("cannot convert " + sourceRate + " Hz to " + targetRate + " Hz");
        }
        if (sourceRate == targetRate) {
            return buffer;
        }
        double ratio = (double) targetRate / sourceRate;
        if (!Double.isFinite(ratio) || ratio <= 0.0) {
            throw new InvalidInputException("invalid conversion ratio " + ratio);
        }
        double[] in = buffer.samples();
        int outLength = (int) ((long) in.length * targetRate / sourceRate);
        double[] out = new double[outLength];

        double cutoff = Math.min(1.0, ratio);
        int halfWidth = (int) Math.ceil(ZERO_CROSSINGS / cutoff);
        double step = (double) sourceRate / targetRate;

        for (int i = 0; i < outLength; i++) {
            double t = i * step;
            int centre = (int) Math.floor(t);
            double acc = 0.0;
            for (int j = centre - halfWidth + 1; j <= centre + halfWidth; j++) {
                if (j < 0 || j >= in.length) {
                    continue;
                }
                double x = t - j;
                acc += in[j] * cutoff * sinc(cutoff * x) * blackman(x / halfWidth);
            }
            out[i] = acc;
        }
        return new AudioBuffer(out, targetRate);
    }

    static double sinc(double x) {
        if (Math.abs(x) < 1e-12) {
            return 1.0;
        }
        double px = Math.PI * x;
        return Math.sin(px) / px;
    }

    /**
     * Blackman window over {@code u} in [-1, 1], zero outside.
     */
    static double blackman(double u) {
        if (u <= -1.0 || u >= 1.0) {
            return 0.0;
        }
        return 0.42 + 0.5 * Math.cos(Math.PI * u) + 0.08 * Math.cos(2.0 * Math.PI * u);
    }
}
