package de.anton.moessbauer.analyser.spectrum_fitter.algorithms;

import de.anton.moessbauer.analyser.spectrum_fitter.SyntheticSpectra;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class PeakDetectorTest {

    private final PeakDetector detector = new PeakDetector(7, 4.0, 0.15, 0.15);

    @Test
    void findsBothLinesOfDoublet() {
        double[] v = SyntheticSpectra.velocities();
        double[] y = SyntheticSpectra.doublet(v, 0.35, 0.8, 0.3, 0.05);

        PeakSearch search = detector.detect(v, y);

        assertThat(search.peaks()).hasSize(2);
        Peak low = search.peaks().get(0);
        Peak high = search.peaks().get(1);
        assertThat(low.velocity()).isCloseTo(-0.05, within(0.04));
        assertThat(high.velocity()).isCloseTo(0.75, within(0.04));
        assertThat(low.height()).isCloseTo(0.05, within(0.005));
        assertThat(low.fwhm()).isCloseTo(0.3, within(0.06));
        assertThat(search.threshold()).isGreaterThan(search.baseLevel());
    }

    @Test
    void flatSignalHasNoPeaks() {
        double[] v = SyntheticSpectra.velocities();
        assertThat(detector.detect(v, new double[v.length]).peaks()).isEmpty();
    }

    @Test
    void pureNoiseStaysBelowThreshold() {
        double[] v = SyntheticSpectra.velocities();
        double[] y = SyntheticSpectra.withNoise(new double[v.length], 0.001, 7L);
        PeakSearch search = detector.detect(v, y);
        assertThat(search.peaks()).isEmpty();
        assertThat(search.noiseLevel()).isGreaterThan(0.0);
    }

    @Test
    void closePeaksKeepOnlyTheHigher() {
        double[] v = SyntheticSpectra.velocities(512, 2.0);
        double[] y = SyntheticSpectra.sum(
            SyntheticSpectra.singlet(v, 0.0, 0.1, 0.05),
            SyntheticSpectra.singlet(v, 0.2, 0.1, 0.03));

        assertThat(new PeakDetector(7, 4.0, 0.15, 0.15).detect(v, y).peaks()).hasSize(2);

        PeakSearch search = new PeakDetector(7, 4.0, 0.3, 0.15).detect(v, y);
        assertThat(search.peaks()).hasSize(1);
        assertThat(search.peaks().get(0).velocity()).isCloseTo(0.0, within(0.02));
    }

    @Test
    void prominenceIsMeasuredFromTheHigherSaddle() {
        double[] y = {0, 1, 0.5, 2, 0};
        assertThat(PeakDetector.prominence(y, 1)).isCloseTo(0.5, within(1e-12));
        assertThat(PeakDetector.prominence(y, 3)).isCloseTo(2.0, within(1e-12));
    }

    @Test
    void halfHeightWidthInterpolatesBetweenSamples() {
        double[] v = {0, 1, 2, 3, 4};
        double[] y = {0, 0.25, 1, 0.25, 0};
        // half height 0.5 is crossed at 1 + 0.25/0.75 and 3 - 0.25/0.75
        assertThat(PeakDetector.halfHeightWidth(v, y, 2, 0.0)).isCloseTo(2.0 - 0.5 / 0.75, within(1e-12));
    }

    @Test
    void halfHeightWidthMirrorsOneSidedCrossing() {
        double[] v = {0, 1, 2, 3};
        double[] y = {0.9, 0.95, 1.0, 0.0};
        assertThat(PeakDetector.halfHeightWidth(v, y, 2, 0.0)).isCloseTo(1.0, within(1e-12));
    }

    @Test
    void rejectsNonPositiveNoiseMultiplier() {
        assertThatThrownBy(() -> new PeakDetector(7, 0.0, 0.15, 0.15)).isInstanceOf(IllegalArgumentException.class);
    }
}
