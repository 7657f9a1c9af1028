package de.anton.moessbauer.analyser.spectrum_fitter.model;

/**
 * Thrown when the fitted parameterization is structurally degenerate,
 * e.g. two sites collapsed onto the same lines.
 */
public class SingularJacobianException extends SpectrumAnalysisException {

    private static final long serialVersionUID = 1L;

    public static final String SUGGESTION = "Try reducing the number of sites.";

    public SingularJacobianException(String message) {
        super(FailureKind.SINGULAR_JACOBIAN, message.contains(SUGGESTION) ? message : message + " " + SUGGESTION);
    }
}
