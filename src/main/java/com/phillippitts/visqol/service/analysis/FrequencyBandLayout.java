package com.phillippitts.visqol.service.analysis;

/**
 * ERB-spaced perceptual bands with 4th-order gammatone magnitude weights over FFT bins.
 *
 * <p>Centre frequencies are equally spaced on the ERB-rate scale between the lowest and highest
 * centre. The weight of bin frequency {@code f} in band {@code fc} is the squared magnitude
 * response of a 4th-order gammatone filter, {@code (1 + ((f - fc) / b)^2)^-4} with
 * {@code b = 1.019 * ERB(fc)}. Each band's weights sum to one.
 */
public final class FrequencyBandLayout {

    static final double GAMMATONE_BANDWIDTH = 1.019;
    private static final int GAMMATONE_ORDER = 4;

    private final double[] centreFrequencies;
    private final double[][] weights;

    private FrequencyBandLayout(double[] centreFrequencies, double[][] weights) {
        this.centreFrequencies = centreFrequencies;
        this.weights = weights;
    }

    /**
     * @param bandCount    number of bands
     * @param minFrequency lowest centre frequency, Hz
     * @param maxFrequency highest centre frequency, Hz
     * @param fftSize      FFT length the weights apply to
     * @param sampleRate   sample rate, Hz
     */
    public static FrequencyBandLayout create(int bandCount, double minFrequency, double maxFrequency,
                                             int fftSize, int sampleRate) {
        if (bandCount <= 0) {
            throw new IllegalArgumentException("bandCount must be positive, got " + bandCount);
        }
        double[] centres = new double[bandCount];
        double lo = erbRate(minFrequency);
        double hi = erbRate(maxFrequency);
        for (int b = 0; b < bandCount; b++) {
            double e = bandCount == 1 ? lo : lo + (hi - lo) * b / (bandCount - 1);
            centres[b] = inverseErbRate(e);
        }

        int bins = fftSize / 2 + 1;
        double binWidth = (double) sampleRate / fftSize;
        double[][] w = new double[bandCount][bins];
        for (int b = 0; b < bandCount; b++) {
            double bandwidth = GAMMATONE_BANDWIDTH * erb(centres[b]);
            double sum = 0.0;
            for (int k = 0; k < bins; k++) {
                double x = (k * binWidth - centres[b]) / bandwidth;
                w[b][k] = Math.pow(1.0 + x * x, -GAMMATONE_ORDER);
                sum += w[b][k];
            }
            for (int k = 0; k < bins; k++) {
                w[b][k] /= sum;
            }
        }
        return new FrequencyBandLayout(centres, w);
    }

    /**
     * Equivalent rectangular bandwidth in Hz (Glasberg and Moore).
     */
    static double erb(double frequency) {
        return 24.7 * (4.37 * frequency / 1000.0 + 1.0);
    }

    static double erbRate(double frequency) {
        return 21.4 * Math.log10(1.0 + 0.00437 * frequency);
    }

    static double inverseErbRate(double erbRate) {
        return (Math.pow(10.0, erbRate / 21.4) - 1.0) / 0.00437;
    }

    public int bandCount() {
        return centreFrequencies.length;
    }

    public double[] centreFrequencies() {
        return centreFrequencies.clone();
    }

    /**
     * @param power power spectrum, bins {@code 0..fftSize/2}
     * @return weighted band energies
     */
    double[] integrate(double[] power) {
        double[] energies = new double[weights.length];
        for (int b = 0; b < weights.length; b++) {
            double[] row = weights[b];
            double acc = 0.0;
            for (int k = 0; k < row.length; k++) {
                acc += row[k] * power[k];
            }
            energies[b] = acc;
        }
        return energies;
    }
}
