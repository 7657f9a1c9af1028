package de.anton.moessbauer.analyser.spectrum_fitter.model;

/**
 * Thrown when the input samples are malformed, too few, or degenerate (constant signal).
 */
public class InvalidSpectrumException extends SpectrumAnalysisException {

    private static final long serialVersionUID = 1L;

    public InvalidSpectrumException(String message) {
        super(FailureKind.INVALID_SPECTRUM, message);
    }
}
