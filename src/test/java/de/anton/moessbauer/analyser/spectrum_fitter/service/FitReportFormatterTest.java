package de.anton.moessbauer.analyser.spectrum_fitter.service;

import de.anton.moessbauer.analyser.spectrum_fitter.model.FitParameter;
import de.anton.moessbauer.analyser.spectrum_fitter.model.FitResult;
import de.anton.moessbauer.analyser.spectrum_fitter.model.ModelType;
import de.anton.moessbauer.analyser.spectrum_fitter.model.Site;
import de.anton.moessbauer.analyser.spectrum_fitter.model.SiteKind;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.OptionalDouble;

import static org.assertj.core.api.Assertions.assertThat;

class FitReportFormatterTest {

    private static final Site SITE = new Site(1, SiteKind.DOUBLET, 0.35, 0.002, 0.8, 0.004, 0.3, 0.005, 0.05, 100.0, 0.047,
        null, null, null);

    private static FitResult result(boolean converged, OptionalDouble reduced, List<FitParameter> parameters) {
        return new FitResult(ModelType.LORENTZIAN, 0.064, reduced, 256, 5, List.of(SITE), parameters,
            converged, 12, 80, true);
    }

    @Test
    void rendersAllSections() {
        List<FitParameter> parameters = List.of(
            new FitParameter("site1_isomer_shift", 0.35, 0.4, -4, 4, true, 0.002),
            new FitParameter("site1_quadrupole_splitting", 0.8, 0.8, 0, 8, false, Double.NaN),
            new FitParameter("baseline_offset", 0.0, 0.0, Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY, true, Double.NaN));

        String report = new FitReportFormatter().format(result(true, OptionalDouble.of(2.5e-4), parameters));

        assertThat(report).startsWith("[[Model]]\n    Lorentzian, 1 site (estimated)\n");
        assertThat(report).contains("[[Fit Statistics]]", "[[Variables]]");
        assertThat(report).contains("    fitting method       = leastsq (Levenberg-Marquardt)\n");
        assertThat(report).contains("# function evals     = 80");
        assertThat(report).contains("# data points        = 256");
        assertThat(report).contains("chi-square           = 0.0640000");
        assertThat(report).contains("reduced chi-square   = 0.000250000");
        assertThat(report).contains("converged            = yes");
        assertThat(report).contains("site1_isomer_shift:").contains("0.350000 +/- 0.002000 (0.57%) (init = 0.400000)");
        assertThat(report).contains("0.800000 (fixed)");
        assertThat(report).contains("0.000000 +/- n/a (init = 0.000000)");
    }

    @Test
    void flagsUndefinedStatisticsAndNonConvergence() {
        String report = new FitReportFormatter().format(result(false, OptionalDouble.empty(), List.of()));

        assertThat(report).contains("reduced chi-square   = undefined (no degrees of freedom)");
        assertThat(report).contains("converged            = no (best-effort result)");
    }
}
