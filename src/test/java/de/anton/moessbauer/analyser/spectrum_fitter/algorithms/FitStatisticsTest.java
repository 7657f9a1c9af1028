package de.anton.moessbauer.analyser.spectrum_fitter.algorithms;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class FitStatisticsTest {

    @Test
    void chiSquaredWeightsResidualsBySigma() {
        double chi2 = FitStatistics.chiSquared(new double[]{1, 2, 3}, new double[]{1, 1, 1}, new double[]{1, 0.5, 2});
        assertThat(chi2).isCloseTo(0 + 4 + 1, within(1e-12));
    }

    @Test
    void reducedChiSquaredNeedsDegreesOfFreedom() {
        assertThat(FitStatistics.reducedChiSquared(10.0, 7, 2).getAsDouble()).isCloseTo(2.0, within(1e-12));
        assertThat(FitStatistics.reducedChiSquared(10.0, 5, 5)).isEmpty();
    }

    @Test
    void lengthMismatchIsRejected() {
        assertThatThrownBy(() -> FitStatistics.chiSquared(new double[2], new double[3], new double[2]))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
