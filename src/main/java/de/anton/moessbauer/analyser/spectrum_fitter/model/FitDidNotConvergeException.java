package de.anton.moessbauer.analyser.spectrum_fitter.model;

/**
 * Thrown by {@link FitOutcome#requireConverged()} when the optimizer exhausted its budget.
 * The best-effort report is kept so callers can still display it.
 */
public class FitDidNotConvergeException extends SpectrumAnalysisException {

    private static final long serialVersionUID = 1L;

    private final transient AnalysisReport bestEffortReport;

    public FitDidNotConvergeException(String message, AnalysisReport bestEffortReport) {
        super(FailureKind.FIT_DID_NOT_CONVERGE, message);
        this.bestEffortReport = bestEffortReport;
    }

    /** @return The unconverged report, never null. */
    public AnalysisReport getBestEffortReport() {
        return bestEffortReport;
    }
}
