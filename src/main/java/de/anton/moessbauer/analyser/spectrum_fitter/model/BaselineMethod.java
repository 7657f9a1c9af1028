package de.anton.moessbauer.analyser.spectrum_fitter.model;

/**
 * Baseline estimators available to the normalizer.
 */
public enum BaselineMethod {
    /** Least-squares line through the outer wings of the spectrum, one outlier-rejection pass. */
    WING_LINEAR,
    /** Constant level at a high (transmission) or low (absorption) percentile of the signal. */
    PERCENTILE
}
