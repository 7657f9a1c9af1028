package de.anton.moessbauer.analyser.spectrum_fitter.algorithms;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class SavitzkyGolayTest {

    @Test
    void coefficientsSumToOne() {
        for (int m = 1; m <= 6; m++) {
            assertThat(Arrays.stream(SavitzkyGolay.quadraticCoefficients(m)).sum()).isCloseTo(1.0, within(1e-12));
        }
    }

    @Test
    void sevenPointCoefficientsMatchTabulatedValues() {
        double[] c = SavitzkyGolay.quadraticCoefficients(3);
        double[] expected = {-2, 3, 6, 7, 6, 3, -2};
        for (int i = 0; i < c.length; i++) {
            assertThat(c[i]).isCloseTo(expected[i] / 21.0, within(1e-12));
        }
    }

    @Test
    void quadraticSignalPassesUnchanged() {
        double[] y = new double[40];
        for (int i = 0; i < y.length; i++) {
            y[i] = 0.3 * i * i - 2.0 * i + 5.0;
        }
        double[] smoothed = SavitzkyGolay.smooth(y, 7);
        for (int i = 0; i < y.length; i++) {
            assertThat(smoothed[i]).isCloseTo(y[i], within(1e-9));
        }
    }

    @Test
    void reducesAlternatingNoise() {
        double[] y = new double[50];
        for (int i = 0; i < y.length; i++) {
            y[i] = i % 2 == 0 ? 1.0 : -1.0;
        }
        double[] smoothed = SavitzkyGolay.smooth(y, 9);
        for (int i = 4; i < 46; i++) {
            assertThat(Math.abs(smoothed[i])).isLessThan(0.5);
        }
        assertThat(smoothed[0]).isEqualTo(y[0]);
        assertThat(smoothed[49]).isEqualTo(y[49]);
    }

    @Test
    void evenWindowIsRejected() {
        assertThatThrownBy(() -> SavitzkyGolay.smooth(new double[10], 6)).isInstanceOf(IllegalArgumentException.class);
    }
}
