package com.phillippitts.visqol.service.score;

/**
 * Aggregated similarity and its mapped quality.
 *
 * @param vnsim           global similarity in [0, 1]
 * @param fvnsim          per-band mean similarity
 * @param centerFreqBands band centre frequencies, Hz
 * @param moslqo          mapped MOS-LQO in [1, 5]
 */
public record AggregateScore(double vnsim, double[] fvnsim, double[] centerFreqBands, double moslqo) {

    public AggregateScore {
        fvnsim = fvnsim.clone();
        centerFreqBands = centerFreqBands.clone();
    }

    @Override
    public double[] fvnsim() {
        return fvnsim.clone();
    }

    @Override
    public double[] centerFreqBands() {
        return centerFreqBands.clone();
    }
}
