package com.phillippitts.visqol.service.analysis;

/**
 * In-place iterative radix-2 Cooley-Tukey FFT.
 */
final class Fft {

    private Fft() {
    }

    /**
     * Transforms {@code real}/{@code imag} in place. Length must be a power of two.
     */
    static void transform(double[] real, double[] imag) {
        int n = real.length;
        if (n != imag.length || Integer.bitCount(n) != 1) {
            throw new IllegalArgumentException("FFT length must be a power of two, got " + n);
        }

        // Bit reversal
        int j = 0;
        for (int i = 0; i < n - 1; i++) {
            if (i < j) {
                double tr = real[i];
                double ti = imag[i];
                real[i] = real[j];
                imag[i] = imag[j];
                real[j] = tr;
                imag[j] = ti;
            }
            int k = n >> 1;
            while (k <= j) {
                j -= k;
                k >>= 1;
            }
            j += k;
        }

        for (int len = 2; len <= n; len <<= 1) {
            double angle = -2.0 * Math.PI / len;
            double wr = Math.cos(angle);
            double wi = Math.sin(angle);
            int half = len >> 1;
            for (int i = 0; i < n; i += len) {
                double cr = 1.0;
                double ci = 0.0;
                for (int k = 0; k < half; k++) {
                    int a = i + k;
                    int b = a + half;
                    double tr = cr * real[b] - ci * imag[b];
                    double ti = cr * imag[b] + ci * real[b];
                    real[b] = real[a] - tr;
                    imag[b] = imag[a] - ti;
                    real[a] += tr;
                    imag[a] += ti;
                    double next = cr * wr - ci * wi;
                    ci = cr * wi + ci * wr;
                    cr = next;
                }
            }
        }
    }

    /**
     * @return power {@code |X[k]|^2} for bins {@code 0..n/2} of a real input
     */
    static double[] powerSpectrum(double[] frame) {
        int n = frame.length;
        double[] re = frame.clone();
        double[] im = new double[n];
        transform(re, im);
        double[] power = new double[n / 2 + 1];
        for (int k = 0; k < power.length; k++) {
            power[k] = re[k] * re[k] + im[k] * im[k];
        }
        return power;
    }
}
