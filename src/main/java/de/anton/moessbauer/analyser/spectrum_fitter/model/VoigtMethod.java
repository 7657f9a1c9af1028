package de.anton.moessbauer.analyser.spectrum_fitter.model;

/**
 * Numerical approximation used to evaluate the Voigt profile.
 */
public enum VoigtMethod {
    /** Real part of the Faddeeva function, Weideman's 32-term rational series. */
    FADDEEVA,
    /** Thompson-Cox-Hastings pseudo-Voigt with matched total width and mixing. */
    THOMPSON_COX_HASTINGS
}
