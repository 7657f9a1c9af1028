package de.anton.moessbauer.analyser.spectrum_fitter.service;

import de.anton.moessbauer.analyser.spectrum_fitter.SyntheticSpectra;
import de.anton.moessbauer.analyser.spectrum_fitter.model.FailureKind;
import de.anton.moessbauer.analyser.spectrum_fitter.model.FitterSettings;
import de.anton.moessbauer.analyser.spectrum_fitter.model.InvalidSpectrumException;
import de.anton.moessbauer.analyser.spectrum_fitter.model.RawSpectrum;
import de.anton.moessbauer.analyser.spectrum_fitter.model.Spectrum;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class SpectrumNormalizerTest {

    private final SpectrumNormalizer normalizer = new SpectrumNormalizer(FitterSettings.defaults());

    @Test
    void sortsByVelocityAndKeepsAbsorption() throws InvalidSpectrumException {
        double[] v = SyntheticSpectra.velocities(20, 2.0);
        double[] a = SyntheticSpectra.singlet(v, 0.0, 0.3, 0.05);
        double[] reversedV = new double[20];
        double[] reversedA = new double[20];
        for (int i = 0; i < 20; i++) {
            reversedV[i] = v[19 - i];
            reversedA[i] = a[19 - i];
        }

        Spectrum spectrum = normalizer.normalize(RawSpectrum.of(reversedV, reversedA), false);

        assertThat(spectrum.getVelocities()).containsExactly(v);
        assertThat(spectrum.getAbsorption()).containsExactly(a);
        assertThat(spectrum.isTransmissionInput()).isFalse();
        assertThat(spectrum.getUncertainties()).containsOnly(1.0);
    }

    @Test
    void transmissionCountsWithBaselineCorrection() throws InvalidSpectrumException {
        double[] v = SyntheticSpectra.velocities();
        double[] a = SyntheticSpectra.doublet(v, 0.35, 0.8, 0.3, 0.05);

        Spectrum spectrum = normalizer.normalize(RawSpectrum.of(v, SyntheticSpectra.transmission(a, 1e5)), true);

        assertThat(spectrum.isTransmissionInput()).isTrue();
        assertThat(spectrum.isBaselineCorrected()).isTrue();
        double[] absorption = spectrum.getAbsorption();
        int center = SyntheticSpectra.POINTS / 2;
        assertThat(absorption[center]).isCloseTo(a[center], within(0.001));
    }

    @Test
    void percentTransmissionIsRescaled() throws InvalidSpectrumException {
        double[] v = SyntheticSpectra.velocities();
        double[] a = SyntheticSpectra.doublet(v, 0.35, 0.8, 0.3, 0.05);

        Spectrum spectrum = normalizer.normalize(RawSpectrum.of(v, SyntheticSpectra.transmission(a, 100.0)), false);

        double[] absorption = spectrum.getAbsorption();
        for (int i = 0; i < absorption.length; i++) {
            assertThat(absorption[i]).isCloseTo(a[i], within(1e-9));
        }
    }

    @Test
    void suppliedUncertaintiesScaleWithSignal() throws InvalidSpectrumException {
        double[] v = SyntheticSpectra.velocities(50, 3.0);
        double[] signal = SyntheticSpectra.transmission(SyntheticSpectra.singlet(v, 0.0, 0.3, 0.05), 100.0);
        double[] sigma = new double[50];
        Arrays.fill(sigma, 0.5);

        Spectrum spectrum = normalizer.normalize(RawSpectrum.of(v, signal, sigma), false);

        assertThat(spectrum.isUncertaintiesSupplied()).isTrue();
        assertThat(spectrum.getUncertainties()).containsOnly(0.005);
    }

    @Test
    void rejectsTooFewPoints() {
        double[] v = {0, 1, 2, 3, 4};
        double[] s = {0, 1, 0, 1, 0};
        assertThatThrownBy(() -> normalizer.normalize(RawSpectrum.of(v, s), false))
            .isInstanceOf(InvalidSpectrumException.class)
            .hasMessageContaining("Insufficient data points");
    }

    @Test
    void rejectsMalformedSamples() {
        double[] v = SyntheticSpectra.velocities(12, 1.0);
        double[] constant = new double[12];
        double[] withNaN = SyntheticSpectra.singlet(v, 0.0, 0.3, 0.05);
        withNaN[3] = Double.NaN;
        double[] duplicate = v.clone();
        duplicate[5] = duplicate[4];
        double[] good = SyntheticSpectra.singlet(v, 0.0, 0.3, 0.05);
        double[] badSigma = new double[12];

        assertThatThrownBy(() -> normalizer.normalize(RawSpectrum.of(v, constant), false)).hasMessageContaining("constant");
        assertThatThrownBy(() -> normalizer.normalize(RawSpectrum.of(v, withNaN), false)).hasMessageContaining("Non-finite");
        assertThatThrownBy(() -> normalizer.normalize(RawSpectrum.of(duplicate, good), false)).hasMessageContaining("Duplicate");
        assertThatThrownBy(() -> normalizer.normalize(RawSpectrum.of(v, good, badSigma), false)).hasMessageContaining("Uncertainty");
        assertThatThrownBy(() -> normalizer.normalize(RawSpectrum.of(v, new double[11]), false))
            .isInstanceOf(InvalidSpectrumException.class)
            .satisfies(e -> assertThat(((InvalidSpectrumException) e).getKind()).isEqualTo(FailureKind.INVALID_SPECTRUM));
    }
}
