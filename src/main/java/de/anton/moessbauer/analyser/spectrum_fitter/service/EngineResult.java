package de.anton.moessbauer.analyser.spectrum_fitter.service;

import de.anton.moessbauer.analyser.spectrum_fitter.algorithms.SpectrumModel;
import de.anton.moessbauer.analyser.spectrum_fitter.model.FitParameter;

import java.util.List;

/**
 * Optimizer state handed to the result assembler.
 *
 * @param model       The composite model that was fitted.
 * @param parameters  All parameters with fitted values and standard errors (NaN where undefined).
 * @param chiSquared  Weighted sum of squared residuals at the returned point.
 * @param converged   False if the iteration or evaluation budget ran out.
 * @param iterations  Optimizer iterations of the winning start.
 * @param evaluations Model evaluations of the winning start (Jacobian evaluations not counted).
 */
public record EngineResult(SpectrumModel model, List<FitParameter> parameters, double chiSquared,
                           boolean converged, int iterations, int evaluations) {

    public EngineResult {
        parameters = List.copyOf(parameters);
    }

    public double[] values() {
        return parameters.stream().mapToDouble(FitParameter::value).toArray();
    }

    public int freeParameterCount() {
        return (int) parameters.stream().filter(FitParameter::vary).count();
    }
}
