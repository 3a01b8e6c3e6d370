package com.phillippitts.visqol.service.align;

import com.phillippitts.visqol.exception.InvalidInputException;
import com.phillippitts.visqol.service.audio.AudioBuffer;
import com.phillippitts.visqol.testutil.TestSignals;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ResamplerTest {

    @Test
    void sameRateShouldReturnInput() {
        AudioBuffer buffer = new AudioBuffer(new double[] {0.1, 0.2}, 16_000);

        assertThat(Resampler.resample(buffer, 16_000)).isSameAs(buffer);
    }

    @Test
    void outputLengthShouldBeFloorOfScaledLength() {
        AudioBuffer buffer = new AudioBuffer(new double[1001], 48_000);

        assertThat(Resampler.resample(buffer, 16_000).length()).isEqualTo(333);
        assertThat(Resampler.resample(new AudioBuffer(new double[16_000], 16_000), 48_000).length())
                .isEqualTo(48_000);
    }

    @Test
    void integerUpsamplingShouldPassOriginalSamplesThrough() {
        double[] tone = TestSignals.sine(1000, 0.7, 0.1, 16_000);

        double[] up = Resampler.resample(new AudioBuffer(tone, 16_000), 48_000).samples();

        for (int k = 0; k < tone.length; k++) {
            assertThat(up[3 * k]).isCloseTo(tone[k], within(1e-9));
        }
    }

    @Test
    void upsampledToneShouldMatchAnalyticTone() {
        double[] tone = TestSignals.sine(1000, 0.7, 0.2, 16_000);
        double[] expected = TestSignals.sine(1000, 0.7, 0.2, 48_000);

        double[] up = Resampler.resample(new AudioBuffer(tone, 16_000), 48_000).samples();

        // away from the edges, where the kernel is truncated
        for (int i = 1000; i < up.length - 1000; i++) {
            assertThat(up[i]).isCloseTo(expected[i], within(1e-2));
        }
    }

    @Test
    void downsamplingShouldRemoveContentAboveNewNyquist() {
        double[] tone = TestSignals.sine(14_000, 0.7, 0.2, 48_000);

        double[] down = Resampler.resample(new AudioBuffer(tone, 48_000), 16_000).samples();

        double sumSquares = 0.0;
        int count = 0;
        for (int i = 200; i < down.length - 200; i++) {
            sumSquares += down[i] * down[i];
            count++;
        }
        assertThat(Math.sqrt(sumSquares / count)).isLessThan(0.05);
    }

    @Test
    void shouldRejectNonPositiveTargetRate() {
        AudioBuffer buffer = new AudioBuffer(new double[] {0.0}, 8000);

        assertThatThrownBy(() -> Resampler.resample(buffer, 0))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("8000 Hz to 0 Hz");
    }

    @Test
    void windowShouldVanishAtEdges() {
        assertThat(Resampler.blackman(0.0)).isCloseTo(1.0, within(1e-12));
        assertThat(Resampler.blackman(1.0)).isZero();
        assertThat(Resampler.blackman(-1.5)).isZero();
        assertThat(Resampler.sinc(0.0)).isEqualTo(1.0);
        assertThat(Resampler.sinc(2.0)).isCloseTo(0.0, within(1e-12));
    }
}
