package com.phillippitts.visqol.service.model;

/**
 * Logistic mapping {@code lower + (upper - lower) / (1 + exp(-slope * (x - midpoint)))}.
 *
 * @param lower    asymptote at low similarity
 * @param upper    asymptote at high similarity
 * @param slope    steepness, positive for an increasing curve
 * @param midpoint similarity at the inflection point
 */
public record LogisticMapping(double lower, double upper, double slope, double midpoint) implements QualityMapping {

    public LogisticMapping {
        if (!Double.isFinite(lower) || !Double.isFinite(upper) || !Double.isFinite(slope)
                || !Double.isFinite(midpoint)) {
            throw new IllegalArgumentException("logistic parameters must be finite");
        }
    }

    @Override
    public double evaluate(double x) {
        return lower + (upper - lower) / (1.0 + Math.exp(-slope * (x - midpoint)));
    }

    @Override
    public String type() {
        return "logistic";
    }
}
