package de.anton.moessbauer.analyser.spectrum_fitter.service;

import de.anton.moessbauer.analyser.spectrum_fitter.algorithms.SpectrumModel;
import de.anton.moessbauer.analyser.spectrum_fitter.model.FitParameter;
import de.anton.moessbauer.analyser.spectrum_fitter.model.ModelType;
import de.anton.moessbauer.analyser.spectrum_fitter.model.SiteKind;
import de.anton.moessbauer.analyser.spectrum_fitter.model.VoigtMethod;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Starting point of a fit: line structure per site and the seeded, bounded parameters in model order.
 */
public record FitSetup(ModelType modelType, List<SiteKind> kinds, List<FitParameter> parameters) {

    public FitSetup {
        Objects.requireNonNull(modelType, "modelType");
        kinds = List.copyOf(kinds);
        parameters = List.copyOf(parameters);
    }

    public SpectrumModel model(VoigtMethod voigtMethod) {
        SpectrumModel model = new SpectrumModel(modelType, voigtMethod, kinds);
        if (model.parameterCount() != parameters.size()) {
            throw new IllegalStateException("Setup has " + parameters.size() + " parameters, model expects " + model.parameterCount());
        }
        return model;
    }

    public int freeParameterCount() {
        return (int) parameters.stream().filter(FitParameter::vary).count();
    }

    public double[] initialValues() {
        return parameters.stream().mapToDouble(FitParameter::value).toArray();
    }

    /** @return A copy with the given parameter values as new seeds, clamped into their bounds. */
    public FitSetup withSeeds(double[] values) {
        List<FitParameter> seeded = new ArrayList<>(parameters.size());
        for (int i = 0; i < parameters.size(); i++) {
            FitParameter p = parameters.get(i);
            seeded.add(p.withSeed(Math.max(p.min(), Math.min(p.max(), values[i]))));
        }
        return new FitSetup(modelType, kinds, seeded);
    }
}
