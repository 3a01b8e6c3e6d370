package com.phillippitts.visqol.service.model;

/**
 * Monotone regression from aggregate similarity (VNSIM) to MOS-LQO.
 *
 * <p>Implementations are immutable. {@link #map(double)} clamps to [1, 5].
 */
public interface QualityMapping {

    double MIN_MOS = 1.0;
    double MAX_MOS = 5.0;

    /**
     * Raw, unclamped mapping value.
     */
    double evaluate(double vnsim);

    /**
     * @return mapping type as written in the model resource ("polynomial", "logistic")
     */
    String type();

    default double map(double vnsim) {
        return Math.max(MIN_MOS, Math.min(MAX_MOS, evaluate(vnsim)));
    }

    /**
     * Checks that the clamped mapping never decreases on [0, 1] and is not constant.
     *
     * @param steps number of evaluation intervals
     */
    default boolean isMonotone(int steps) {
        double previous = map(0.0);
        for (int i = 1; i <= steps; i++) {
            double current = map((double) i / steps);
            if (!Double.isFinite(current) || current < previous) {
                return false;
            }
            previous = current;
        }
        return map(1.0) > map(0.0);
    }
}
