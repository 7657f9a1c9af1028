package de.anton.moessbauer.analyser.spectrum_fitter.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of one {@code analyze} call: a converged report, a best-effort report flagged as not
 * converged, or a typed failure without any partial result.
 */
public final class FitOutcome {

    public enum Status {
        SUCCESS,
        NOT_CONVERGED,
        FAILED
    }

    /** Kind and message of a failed analysis. */
    public record AnalysisFailure(FailureKind kind, String message) {
        public AnalysisFailure {
            Objects.requireNonNull(kind, "kind");
            message = message == null ? kind.name() : message;
        }
    }

    private final Status status;
    private final AnalysisReport report;
    private final AnalysisFailure failure;

    private FitOutcome(Status status, AnalysisReport report, AnalysisFailure failure) {
        this.status = status;
        this.report = report;
        this.failure = failure;
    }

    public static FitOutcome success(AnalysisReport report) {
        return new FitOutcome(Status.SUCCESS, Objects.requireNonNull(report, "report"), null);
    }

    public static FitOutcome notConverged(AnalysisReport report) {
        return new FitOutcome(Status.NOT_CONVERGED, Objects.requireNonNull(report, "report"), null);
    }

    public static FitOutcome failed(FailureKind kind, String message) {
        return new FitOutcome(Status.FAILED, null, new AnalysisFailure(kind, message));
    }

    public static FitOutcome failed(SpectrumAnalysisException e) {
        return failed(e.getKind(), e.getMessage());
    }

    public Status getStatus() { return status; }

    public boolean isSuccess() { return status == Status.SUCCESS; }

    /** @return The report; present for SUCCESS and NOT_CONVERGED. */
    public Optional<AnalysisReport> report() { return Optional.ofNullable(report); }

    /** @return The failure; present only for FAILED. */
    public Optional<AnalysisFailure> failure() { return Optional.ofNullable(failure); }

    /**
     * @return The report of a converged or unconverged fit.
     * @throws SpectrumAnalysisException The typed failure if the analysis failed.
     */
    public AnalysisReport orElseThrow() throws SpectrumAnalysisException {
        if (status == Status.FAILED) {
            throw SpectrumAnalysisException.of(failure.kind(), failure.message());
        }
        return report;
    }

    /**
     * @return The report of a converged fit.
     * @throws FitDidNotConvergeException If the optimizer exhausted its budget; carries the best-effort report.
     * @throws SpectrumAnalysisException  The typed failure if the analysis failed.
     */
    public AnalysisReport requireConverged() throws SpectrumAnalysisException {
        AnalysisReport r = orElseThrow();
        if (status == Status.NOT_CONVERGED) {
            throw new FitDidNotConvergeException("Fit did not converge within "
                + r.getFitResult().getIterations() + " iterations.", r);
        }
        return r;
    }

    @Override
    public String toString() {
        return status == Status.FAILED
            ? "FitOutcome{FAILED, " + failure.kind() + ": " + failure.message() + "}"
            : "FitOutcome{" + status + ", sites=" + report.getFitResult().getSiteCount()
                + ", chi2=" + report.getFitResult().getChiSquared() + "}";
    }
}
