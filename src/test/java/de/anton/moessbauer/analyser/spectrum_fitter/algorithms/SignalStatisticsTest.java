package de.anton.moessbauer.analyser.spectrum_fitter.algorithms;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SignalStatisticsTest {

    @Test
    void robustSigmaIgnoresSingleOutlier() {
        double[] values = {1, 2, 3, 4, 100};
        assertThat(SignalStatistics.median(values)).isEqualTo(3.0);
        assertThat(SignalStatistics.robustSigma(values)).isCloseTo(SignalStatistics.MAD_TO_SIGMA, within(1e-12));
    }

    @Test
    void emptyInputGivesNaN() {
        assertThat(SignalStatistics.median(new double[0])).isNaN();
        assertThat(SignalStatistics.robustSigma(new double[0])).isNaN();
        assertThat(SignalStatistics.max(new double[0])).isNaN();
    }

    @Test
    void wingCountHasFloorAndCeiling() {
        assertThat(SignalStatistics.wingCount(256, 0.15)).isEqualTo(39);
        assertThat(SignalStatistics.wingCount(10, 0.01)).isEqualTo(2);
        assertThat(SignalStatistics.wingCount(5, 0.49)).isEqualTo(2);
    }

    @Test
    void wingsConcatenateBothEnds() {
        double[] values = {1, 2, 3, 4, 5, 6, 7, 8, 9, 10};
        assertThat(SignalStatistics.wings(values, 0.2)).containsExactly(1, 2, 9, 10);
    }

    @Test
    void peakToPeakAndMean() {
        double[] values = {-1.5, 0.5, 2.5};
        assertThat(SignalStatistics.peakToPeak(values)).isEqualTo(4.0);
        assertThat(SignalStatistics.mean(values)).isCloseTo(0.5, within(1e-12));
    }
}
