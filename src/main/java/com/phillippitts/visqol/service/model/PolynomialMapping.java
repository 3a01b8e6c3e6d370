package com.phillippitts.visqol.service.model;

import java.util.Arrays;

/**
 * Polynomial mapping {@code c0 + c1*x + c2*x^2 + ...}, coefficients in ascending order.
 */
public final class PolynomialMapping implements QualityMapping {

    private final double[] coefficients;

    public PolynomialMapping(double[] coefficients) {
        if (coefficients == null || coefficients.length == 0) {
            throw new IllegalArgumentException("coefficients must not be empty");
        }
        for (double c : coefficients) {
            if (!Double.isFinite(c)) {
                throw new IllegalArgumentException("coefficients must be finite: " + Arrays.toString(coefficients));
            }
        }
        this.coefficients = coefficients.clone();
    }

    @Override
    public double evaluate(double x) {
        double acc = 0.0;
        for (int i = coefficients.length - 1; i >= 0; i--) {
            acc = acc * x + coefficients[i];
        }
        return acc;
    }

    @Override
    public String type() {
        return "polynomial";
    }

    public double[] coefficients() {
        return coefficients.clone();
    }

    @Override
    public String toString() {
        return "PolynomialMapping" + Arrays.toString(coefficients);
    }
}
