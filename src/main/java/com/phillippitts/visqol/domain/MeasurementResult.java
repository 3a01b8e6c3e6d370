package com.phillippitts.visqol.domain;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable outcome of one reference/degraded comparison.
 *
 * @param moslqo          mapped quality score in [1.0, 5.0]
 * @param vnsim           aggregate similarity in [0.0, 1.0]
 * @param fvnsim          per-band similarity, each in [0.0, 1.0]
 * @param centerFreqBands centre frequency (Hz) of each band, same length as {@code fvnsim}
 * @param referencePath   reference file path, or null for in-memory input
 * @param degradedPath    degraded file path, or null for in-memory input
 * @param backendName     name of the backend that produced this result
 */
public record MeasurementResult(
        double moslqo,
        double vnsim,
        double[] fvnsim,
        double[] centerFreqBands,
        String referencePath,
        String degradedPath,
        String backendName
) {

    public static final double MIN_MOS = 1.0;
    public static final double MAX_MOS = 5.0;

    /**
     * @throws IllegalArgumentException if any value is out of range or the band arrays differ in length
     * @throws NullPointerException if an array or the backend name is null
     */
    public MeasurementResult {
        Objects.requireNonNull(fvnsim, "fvnsim must not be null");
        Objects.requireNonNull(centerFreqBands, "centerFreqBands must not be null");
        Objects.requireNonNull(backendName, "backendName must not be null");
        if (!(moslqo >= MIN_MOS && moslqo <= MAX_MOS)) {
            throw new IllegalArgumentException("moslqo must be between 1.0 and 5.0, got: " + moslqo);
        }
        if (!(vnsim >= 0.0 && vnsim <= 1.0)) {
            throw new IllegalArgumentException("vnsim must be between 0.0 and 1.0, got: " + vnsim);
        }
        if (fvnsim.length != centerFreqBands.length) {
            throw new IllegalArgumentException("fvnsim and centerFreqBands differ in length: "
                    + fvnsim.length + " vs " + centerFreqBands.length);
        }
        for (double v : fvnsim) {
            if (!(v >= 0.0 && v <= 1.0)) {
                throw new IllegalArgumentException("fvnsim values must be between 0.0 and 1.0, got: " + v);
            }
        }
        fvnsim = fvnsim.clone();
        centerFreqBands = centerFreqBands.clone();
    }

    /**
     * Creates a result without provenance.
     */
    public static MeasurementResult of(double moslqo, double vnsim, double[] fvnsim,
                                       double[] centerFreqBands, String backendName) {
        return new MeasurementResult(moslqo, vnsim, fvnsim, centerFreqBands, null, null, backendName);
    }

    @Override
    public double[] fvnsim() {
        return fvnsim.clone();
    }

    @Override
    public double[] centerFreqBands() {
        return centerFreqBands.clone();
    }

    public int bandCount() {
        return fvnsim.length;
    }

    /**
     * @return copy of this result with the given provenance paths (either may be null)
     */
    public MeasurementResult withProvenance(String reference, String degraded) {
        return new MeasurementResult(moslqo, vnsim, fvnsim, centerFreqBands, reference, degraded, backendName);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MeasurementResult other)) {
            return false;
        }
        return Double.compare(moslqo, other.moslqo) == 0
                && Double.compare(vnsim, other.vnsim) == 0
                && Arrays.equals(fvnsim, other.fvnsim)
                && Arrays.equals(centerFreqBands, other.centerFreqBands)
                && Objects.equals(referencePath, other.referencePath)
                && Objects.equals(degradedPath, other.degradedPath)
                && backendName.equals(other.backendName);
    }

    @Override
    public int hashCode() {
        int h = Objects.hash(moslqo, vnsim, referencePath, degradedPath, backendName);
        h = 31 * h + Arrays.hashCode(fvnsim);
        return 31 * h + Arrays.hashCode(centerFreqBands);
    }

    @Override
    public String toString() {
        return "MeasurementResult[moslqo=" + moslqo + ", vnsim=" + vnsim
                + ", bands=" + fvnsim.length + ", reference=" + referencePath
                + ", degraded=" + degradedPath + ", backend=" + backendName + "]";
    }
}
