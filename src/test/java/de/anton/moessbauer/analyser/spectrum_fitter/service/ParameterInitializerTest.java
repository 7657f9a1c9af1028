package de.anton.moessbauer.analyser.spectrum_fitter.service;

import de.anton.moessbauer.analyser.spectrum_fitter.SyntheticSpectra;
import de.anton.moessbauer.analyser.spectrum_fitter.algorithms.Peak;
import de.anton.moessbauer.analyser.spectrum_fitter.algorithms.PeakGroup;
import de.anton.moessbauer.analyser.spectrum_fitter.model.CustomParameter;
import de.anton.moessbauer.analyser.spectrum_fitter.model.FitParameter;
import de.anton.moessbauer.analyser.spectrum_fitter.model.FitterSettings;
import de.anton.moessbauer.analyser.spectrum_fitter.model.InvalidOptionsException;
import de.anton.moessbauer.analyser.spectrum_fitter.model.ModelType;
import de.anton.moessbauer.analyser.spectrum_fitter.model.RawSpectrum;
import de.anton.moessbauer.analyser.spectrum_fitter.model.SiteKind;
import de.anton.moessbauer.analyser.spectrum_fitter.model.Spectrum;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ParameterInitializerTest {

    private final FitterSettings settings = FitterSettings.defaults();
    private final ParameterInitializer initializer = new ParameterInitializer(settings);
    private Spectrum spectrum;

    private static final PeakGroup DOUBLET = PeakGroup.doublet(new Peak(126, -0.05, 0.05, 0.32), new Peak(152, 0.75, 0.05, 0.30));
    private static final PeakGroup SINGLET = PeakGroup.singlet(new Peak(80, -1.5, 0.02, 0.28));

    @BeforeEach
    void setUp() throws Exception {
        spectrum = new SpectrumNormalizer(settings).normalize(SyntheticSpectra.ferricDoublet(), false);
    }

    private static FitParameter param(FitSetup setup, String name) {
        return setup.parameters().stream().filter(p -> p.name().equals(name)).findFirst().orElseThrow();
    }

    @Test
    void seedsDoubletFromPeakGroup() throws InvalidOptionsException {
        FitSetup setup = initializer.initialize(spectrum, ModelType.LORENTZIAN, 1, List.of(DOUBLET), Map.of());

        assertThat(setup.kinds()).containsExactly(SiteKind.DOUBLET);
        assertThat(setup.parameters()).hasSize(5);
        assertThat(param(setup, "site1_isomer_shift").value()).isCloseTo(0.35, within(1e-12));
        assertThat(param(setup, "site1_quadrupole_splitting").value()).isCloseTo(0.8, within(1e-12));
        assertThat(param(setup, "site1_line_width").value()).isCloseTo(0.31, within(1e-12));
        assertThat(param(setup, "site1_line_width").min()).isEqualTo(FitterSettings.NATURAL_LINE_WIDTH);
        assertThat(param(setup, "site1_amplitude").value()).isCloseTo(0.05, within(1e-12));
        assertThat(param(setup, "baseline_offset").value()).isCloseTo(0.0, within(0.002));
        assertThat(setup.freeParameterCount()).isEqualTo(5);
    }

    @Test
    void singletPinsSplittingAtZero() throws InvalidOptionsException {
        FitSetup setup = initializer.initialize(spectrum, ModelType.LORENTZIAN, 2, List.of(DOUBLET, SINGLET), Map.of());

        FitParameter qs = param(setup, "site2_quadrupole_splitting");
        assertThat(setup.kinds()).containsExactly(SiteKind.DOUBLET, SiteKind.SINGLET);
        assertThat(qs.value()).isZero();
        assertThat(qs.vary()).isFalse();
        assertThat(setup.freeParameterCount()).isEqualTo(8);
    }

    @Test
    void customSplittingReleasesSinglet() throws InvalidOptionsException {
        FitSetup setup = initializer.initialize(spectrum, ModelType.LORENTZIAN, 2, List.of(DOUBLET, SINGLET),
            Map.of("site2_quadrupole_splitting", new CustomParameter(null, 0.0, 2.0, null)));

        assertThat(setup.kinds()).containsExactly(SiteKind.DOUBLET, SiteKind.DOUBLET);
        FitParameter qs = param(setup, "site2_quadrupole_splitting");
        assertThat(qs.vary()).isTrue();
        assertThat(qs.value()).isCloseTo(settings.singletSeedSplitting(), within(1e-12));
        assertThat(qs.max()).isEqualTo(2.0);
    }

    @Test
    void extraSitesBecomeDoubletsWithGrowingSplitting() throws InvalidOptionsException {
        FitSetup setup = initializer.initialize(spectrum, ModelType.LORENTZIAN, 3, List.of(DOUBLET), Map.of());

        assertThat(setup.kinds()).containsExactly(SiteKind.DOUBLET, SiteKind.DOUBLET, SiteKind.DOUBLET);
        assertThat(param(setup, "site2_quadrupole_splitting").value()).isCloseTo(0.5, within(1e-12));
        assertThat(param(setup, "site3_quadrupole_splitting").value()).isCloseTo(1.0, within(1e-12));
        assertThat(param(setup, "site2_isomer_shift").value()).isCloseTo(0.35, within(0.1));
    }

    @Test
    void shapeParametersFollowModel() throws InvalidOptionsException {
        FitSetup voigt = initializer.initialize(spectrum, ModelType.VOIGT, 1, List.of(DOUBLET), Map.of());
        FitSetup pseudo = initializer.initialize(spectrum, ModelType.PSEUDO_VOIGT, 1, List.of(DOUBLET), Map.of());

        assertThat(param(voigt, "site1_gaussian_width").value()).isEqualTo(settings.defaultGaussianWidth());
        assertThat(param(pseudo, "site1_fraction").value()).isEqualTo(settings.defaultMixingFraction());
        assertThat(param(pseudo, "site1_fraction").max()).isEqualTo(1.0);
    }

    @Test
    void customOverridesApply() throws InvalidOptionsException {
        FitSetup setup = initializer.initialize(spectrum, ModelType.LORENTZIAN, 1, List.of(DOUBLET),
            Map.of("site1_line_width", CustomParameter.bounded(0.3, 0.2, 0.5),
                "site1_isomer_shift", CustomParameter.fixed(0.36)));

        FitParameter lw = param(setup, "site1_line_width");
        assertThat(lw.min()).isEqualTo(0.2);
        assertThat(lw.max()).isEqualTo(0.5);
        assertThat(param(setup, "site1_isomer_shift").vary()).isFalse();
        assertThat(setup.freeParameterCount()).isEqualTo(4);
    }

    @Test
    void invalidCustomParametersAreRejected() {
        assertThatThrownBy(() -> initializer.initialize(spectrum, ModelType.LORENTZIAN, 1, List.of(DOUBLET),
            Map.of("site2_line_width", CustomParameter.seed(0.3))))
            .isInstanceOf(InvalidOptionsException.class).hasMessageContaining("Unknown custom parameter");
        assertThatThrownBy(() -> initializer.initialize(spectrum, ModelType.LORENTZIAN, 1, List.of(DOUBLET),
            Map.of("site1_line_width", new CustomParameter(null, 0.5, 0.2, null))))
            .isInstanceOf(InvalidOptionsException.class).hasMessageContaining("Conflicting bounds");
        assertThatThrownBy(() -> initializer.initialize(spectrum, ModelType.LORENTZIAN, 1, List.of(DOUBLET),
            Map.of("site1_line_width", CustomParameter.bounded(0.9, 0.2, 0.5))))
            .isInstanceOf(InvalidOptionsException.class).hasMessageContaining("outside");
    }

    @Test
    void tooManyFreeParametersForDataAreRejected() throws Exception {
        double[] v = SyntheticSpectra.velocities(12, 2.0);
        Spectrum small = new SpectrumNormalizer(settings)
            .normalize(RawSpectrum.of(v, SyntheticSpectra.singlet(v, 0.0, 0.5, 0.05)), false);

        assertThatThrownBy(() -> initializer.initialize(small, ModelType.LORENTZIAN, 4, List.of(), Map.of()))
            .isInstanceOf(InvalidOptionsException.class).hasMessageContaining("Not enough data points");
    }

    @Test
    void customRangesAreIntersectedWithPhysicalLimits() throws InvalidOptionsException {
        FitSetup lorentz = initializer.initialize(spectrum, ModelType.LORENTZIAN, 1, List.of(DOUBLET),
            Map.of("site1_line_width", CustomParameter.bounded(0.3, 0.0, 0.5),
                "site1_quadrupole_splitting", new CustomParameter(null, -1.0, 2.0, null)));
        FitSetup voigt = initializer.initialize(spectrum, ModelType.VOIGT, 1, List.of(DOUBLET),
            Map.of("site1_gaussian_width", CustomParameter.bounded(0.05, 0.0, 1.0)));

        assertThat(param(lorentz, "site1_line_width").min()).isEqualTo(FitterSettings.NATURAL_LINE_WIDTH);
        assertThat(param(lorentz, "site1_line_width").max()).isEqualTo(0.5);
        assertThat(param(lorentz, "site1_quadrupole_splitting").min()).isEqualTo(0.0);
        assertThat(param(voigt, "site1_gaussian_width").min()).isEqualTo(settings.minGaussianWidth());
    }

    @Test
    void widthsBelowThePhysicalMinimumAreRejected() {
        assertThatThrownBy(() -> initializer.initialize(spectrum, ModelType.LORENTZIAN, 1, List.of(DOUBLET),
            Map.of("site1_line_width", CustomParameter.bounded(0.0, 0.0, 1.0))))
            .isInstanceOf(InvalidOptionsException.class).hasMessageContaining("outside");
        assertThatThrownBy(() -> initializer.initialize(spectrum, ModelType.LORENTZIAN, 1, List.of(DOUBLET),
            Map.of("site1_line_width", new CustomParameter(null, 0.0, 0.05, null))))
            .isInstanceOf(InvalidOptionsException.class).hasMessageContaining("Conflicting bounds");
    }

    @Test
    void nonFiniteCustomValuesAreRejected() {
        assertThatThrownBy(() -> initializer.initialize(spectrum, ModelType.LORENTZIAN, 1, List.of(DOUBLET),
            Map.of("site1_isomer_shift", CustomParameter.seed(Double.NaN))))
            .isInstanceOf(InvalidOptionsException.class).hasMessageContaining("must be finite");
        assertThatThrownBy(() -> initializer.initialize(spectrum, ModelType.LORENTZIAN, 1, List.of(DOUBLET),
            Map.of("site1_amplitude", new CustomParameter(0.05, 0.0, Double.POSITIVE_INFINITY, null))))
            .isInstanceOf(InvalidOptionsException.class).hasMessageContaining("must be finite");
    }

    @Test
    void overridesAreRestrictedToExistingSites() {
        Map<String, CustomParameter> custom = new LinkedHashMap<>();
        custom.put("site1_line_width", CustomParameter.seed(0.3));
        custom.put("site3_amplitude", CustomParameter.seed(0.01));
        custom.put("baseline_offset", CustomParameter.fixed(0.0));

        assertThat(ParameterInitializer.forSites(custom, 2)).containsOnlyKeys("site1_line_width", "baseline_offset");
        assertThat(ParameterInitializer.forSites(custom, 3)).containsOnlyKeys("site1_line_width", "site3_amplitude", "baseline_offset");
    }
}
