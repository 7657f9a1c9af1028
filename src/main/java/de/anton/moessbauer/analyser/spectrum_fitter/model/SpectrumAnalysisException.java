package de.anton.moessbauer.analyser.spectrum_fitter.model;

import java.util.Objects;

/**
 * Base type of all typed analysis failures. Every instance carries its {@link FailureKind}.
 */
public class SpectrumAnalysisException extends Exception {

    private static final long serialVersionUID = 1L;

    private final FailureKind kind;

    public SpectrumAnalysisException(FailureKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "Failure kind cannot be null.");
    }

    public SpectrumAnalysisException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "Failure kind cannot be null.");
    }

    public FailureKind getKind() {
        return kind;
    }

    /**
     * Re-creates the most specific exception type for a failure kind.
     * Used when a {@link FitOutcome} failure is turned back into an exception.
     */
    public static SpectrumAnalysisException of(FailureKind kind, String message) {
        switch (kind) {
            case INVALID_SPECTRUM:
                return new InvalidSpectrumException(message);
            case INVALID_OPTIONS:
                return new InvalidOptionsException(message);
            case SINGULAR_JACOBIAN:
                return new SingularJacobianException(message);
            case FIT_TIMEOUT:
                return new FitTimeoutException(message);
            default:
                return new SpectrumAnalysisException(kind, message);
        }
    }
}
