package de.anton.moessbauer.analyser.spectrum_fitter.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything one analysis produces for downstream consumers: the fit result, numeric curves,
 * plot-ready series with layout hints, the plain-text fit report and the optional interpretation
 * text supplied by an external service. Immutable.
 */
public final class AnalysisReport {

    private final FitResult fitResult;
    private final Curves curves;
    private final List<PlotSeries> mainSeries;
    private final List<PlotSeries> residualSeries;
    private final PlotLayout mainLayout;
    private final PlotLayout residualLayout;
    private final String fitReport;
    private final String interpretation;

    public AnalysisReport(FitResult fitResult, Curves curves, List<PlotSeries> mainSeries, List<PlotSeries> residualSeries,
                          PlotLayout mainLayout, PlotLayout residualLayout, String fitReport, String interpretation) {
        this.fitResult = Objects.requireNonNull(fitResult, "fitResult");
        this.curves = Objects.requireNonNull(curves, "curves");
        this.mainSeries = Collections.unmodifiableList(new ArrayList<>(mainSeries));
        this.residualSeries = Collections.unmodifiableList(new ArrayList<>(residualSeries));
        this.mainLayout = Objects.requireNonNull(mainLayout, "mainLayout");
        this.residualLayout = Objects.requireNonNull(residualLayout, "residualLayout");
        this.fitReport = fitReport == null ? "" : fitReport;
        this.interpretation = interpretation;
    }

    public FitResult getFitResult() { return fitResult; }

    public Curves getCurves() { return curves; }

    /** @return Experimental points, total fit and one component per site. */
    public List<PlotSeries> getMainSeries() { return mainSeries; }

    public List<PlotSeries> getResidualSeries() { return residualSeries; }

    public PlotLayout getMainLayout() { return mainLayout; }

    public PlotLayout getResidualLayout() { return residualLayout; }

    public String getFitReport() { return fitReport; }

    /** @return Opaque interpretation text, passed through unmodified. */
    public Optional<String> getInterpretation() { return Optional.ofNullable(interpretation); }

    public AnalysisReport withInterpretation(String text) {
        return new AnalysisReport(fitResult, curves, mainSeries, residualSeries, mainLayout, residualLayout, fitReport, text);
    }
}
