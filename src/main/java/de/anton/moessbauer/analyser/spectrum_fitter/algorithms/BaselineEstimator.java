package de.anton.moessbauer.analyser.spectrum_fitter.algorithms;

import de.anton.moessbauer.analyser.spectrum_fitter.model.FitterSettings;

/**
 * Estimates the off-resonance signal level at every velocity.
 */
public interface BaselineEstimator {

    /**
     * @param velocities       Strictly increasing velocities.
     * @param signal           Raw signal in input units.
     * @param transmissionLike True if resonance lowers the signal (transmission), false if it raises it.
     * @return Baseline value per point.
     */
    double[] estimate(double[] velocities, double[] signal, boolean transmissionLike);

    /** @return The estimator selected by {@link FitterSettings#baselineMethod()}. */
    static BaselineEstimator forSettings(FitterSettings settings) {
        switch (settings.baselineMethod()) {
            case PERCENTILE:
                return new PercentileBaseline(settings.baselinePercentile());
            case WING_LINEAR:
            default:
                return new WingLinearBaseline(settings.wingFraction());
        }
    }
}
