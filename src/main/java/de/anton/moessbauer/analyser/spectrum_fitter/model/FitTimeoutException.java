package de.anton.moessbauer.analyser.spectrum_fitter.model;

/**
 * Thrown when the host-enforced wall-clock budget for one analysis expired. No partial result exists.
 */
public class FitTimeoutException extends SpectrumAnalysisException {

    private static final long serialVersionUID = 1L;

    public FitTimeoutException(String message) {
        super(FailureKind.FIT_TIMEOUT, message);
    }
}
