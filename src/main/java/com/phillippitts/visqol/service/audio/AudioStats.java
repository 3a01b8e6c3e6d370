package com.phillippitts.visqol.service.audio;

import java.util.Locale;

/**
 * Summary statistics of a mono buffer, used for verbose reporting.
 *
 * @param durationSeconds length in seconds
 * @param rms             root mean square amplitude
 * @param peak            maximum absolute amplitude
 * @param meanAbs         mean absolute amplitude
 */
public record AudioStats(double durationSeconds, double rms, double peak, double meanAbs) {

    public static AudioStats of(AudioBuffer buffer) {
        double[] s = buffer.samples();
        if (s.length == 0) {
            return new AudioStats(0.0, 0.0, 0.0, 0.0);
        }
        double sumSquares = 0.0;
        double sumAbs = 0.0;
        double peak = 0.0;
        for (double v : s) {
            double a = Math.abs(v);
            sumSquares += v * v;
            sumAbs += a;
            peak = Math.max(peak, a);
        }
        return new AudioStats(buffer.durationSeconds(), Math.sqrt(sumSquares / s.length), peak, sumAbs / s.length);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "duration=%.3fs rms=%.4f peak=%.4f meanAbs=%.4f",
                durationSeconds, rms, peak, meanAbs);
    }
}
