package com.phillippitts.visqol.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MeasurementResultTest {

    private static final double[] FVNSIM = {0.9, 0.8};
    private static final double[] BANDS = {100.0, 200.0};

    @Test
    void shouldAcceptValuesOnRangeBoundaries() {
        MeasurementResult low = MeasurementResult.of(1.0, 0.0, new double[] {0.0}, new double[] {50.0}, "approximate");
        MeasurementResult high = MeasurementResult.of(5.0, 1.0, new double[] {1.0}, new double[] {50.0}, "approximate");

        assertThat(low.moslqo()).isEqualTo(1.0);
        assertThat(high.vnsim()).isEqualTo(1.0);
    }

    @Test
    void shouldRejectOutOfRangeScores() {
        assertThatThrownBy(() -> MeasurementResult.of(0.99, 0.5, FVNSIM, BANDS, "a"))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("moslqo");
        assertThatThrownBy(() -> MeasurementResult.of(3.0, 1.01, FVNSIM, BANDS, "a"))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("vnsim");
        assertThatThrownBy(() -> MeasurementResult.of(3.0, Double.NaN, FVNSIM, BANDS, "a"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> MeasurementResult.of(3.0, 0.5, new double[] {1.2, 0.1}, BANDS, "a"))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("fvnsim");
    }

    @Test
    void shouldRejectBandLengthMismatch() {
        assertThatThrownBy(() -> MeasurementResult.of(3.0, 0.5, FVNSIM, new double[] {1.0}, "a"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("differ in length");
    }

    @Test
    void shouldBeImmutable() {
        double[] fvnsim = FVNSIM.clone();
        MeasurementResult r = MeasurementResult.of(3.0, 0.5, fvnsim, BANDS, "a");

        fvnsim[0] = 0.0;
        r.fvnsim()[1] = 0.0;

        assertThat(r.fvnsim()).containsExactly(0.9, 0.8);
        assertThat(r.bandCount()).isEqualTo(2);
    }

    @Test
    void withProvenanceShouldKeepScoresAndUseValueEquality() {
        MeasurementResult r = MeasurementResult.of(3.0, 0.5, FVNSIM, BANDS, "approximate");

        MeasurementResult withPaths = r.withProvenance("ref.wav", "deg.wav");

        assertThat(withPaths.referencePath()).isEqualTo("ref.wav");
        assertThat(withPaths.degradedPath()).isEqualTo("deg.wav");
        assertThat(withPaths.moslqo()).isEqualTo(3.0);
        assertThat(withPaths).isEqualTo(MeasurementResult.of(3.0, 0.5, FVNSIM.clone(), BANDS.clone(), "approximate")
                .withProvenance("ref.wav", "deg.wav"));
        assertThat(withPaths.hashCode()).isEqualTo(r.withProvenance("ref.wav", "deg.wav").hashCode());
        assertThat(withPaths).isNotEqualTo(r);
    }
}
