package de.anton.moessbauer.analyser.spectrum_fitter.model;

/**
 * Categories of analysis failures. The host layer maps these to transport-level codes.
 */
public enum FailureKind {
    /** Malformed or insufficient input samples. */
    INVALID_SPECTRUM,
    /** Conflicting or out-of-range request options; detected before optimization. */
    INVALID_OPTIONS,
    /** Iteration or evaluation budget exhausted; a best-effort result may still exist. */
    FIT_DID_NOT_CONVERGE,
    /** Structurally degenerate parameterization. */
    SINGULAR_JACOBIAN,
    /** Host-enforced wall-clock budget exceeded. */
    FIT_TIMEOUT,
    /** Interrupted between stages. */
    CANCELLED
}
