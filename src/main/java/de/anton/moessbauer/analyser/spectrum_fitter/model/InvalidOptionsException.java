package de.anton.moessbauer.analyser.spectrum_fitter.model;

/**
 * Thrown for conflicting or out-of-range analysis options, always before the optimizer starts.
 */
public class InvalidOptionsException extends SpectrumAnalysisException {

    private static final long serialVersionUID = 1L;

    public InvalidOptionsException(String message) {
        super(FailureKind.INVALID_OPTIONS, message);
    }
}
