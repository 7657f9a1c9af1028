package de.anton.moessbauer.analyser.spectrum_fitter.service;

import de.anton.moessbauer.analyser.spectrum_fitter.algorithms.FitStatistics;
import de.anton.moessbauer.analyser.spectrum_fitter.algorithms.SpectrumModel;
import de.anton.moessbauer.analyser.spectrum_fitter.model.AnalysisReport;
import de.anton.moessbauer.analyser.spectrum_fitter.model.Curves;
import de.anton.moessbauer.analyser.spectrum_fitter.model.FitParameter;
import de.anton.moessbauer.analyser.spectrum_fitter.model.FitResult;
import de.anton.moessbauer.analyser.spectrum_fitter.model.FitterSettings;
import de.anton.moessbauer.analyser.spectrum_fitter.model.ModelType;
import de.anton.moessbauer.analyser.spectrum_fitter.model.PlotLayout;
import de.anton.moessbauer.analyser.spectrum_fitter.model.PlotSeries;
import de.anton.moessbauer.analyser.spectrum_fitter.model.SeriesStyle;
import de.anton.moessbauer.analyser.spectrum_fitter.model.Site;
import de.anton.moessbauer.analyser.spectrum_fitter.model.Spectrum;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Turns the optimizer state into the published report: sites with relative areas, fit statistics,
 * curves, plot series with layout hints and the fit report text.
 */
public class ResultAssembler {

    private static final Logger logger = LoggerFactory.getLogger(ResultAssembler.class);

    static final List<String> COMPONENT_COLORS = List.of("blue", "green", "orange", "purple", "brown", "pink");
    static final PlotLayout MAIN_LAYOUT = new PlotLayout("Mössbauer Spectrum Analysis", "Velocity (mm/s)", "Absorption", 500, true);
    static final PlotLayout RESIDUAL_LAYOUT = new PlotLayout("Fit Residuals", "Velocity (mm/s)", "Residuals", 200, false);

    private final FitterSettings settings;
    private final SiteClassifier classifier;
    private final FitReportFormatter formatter;

    public ResultAssembler(FitterSettings settings) {
        this(settings, new SiteClassifier(), new FitReportFormatter());
    }

    public ResultAssembler(FitterSettings settings, SiteClassifier classifier, FitReportFormatter formatter) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.formatter = Objects.requireNonNull(formatter, "formatter");
    }

    /**
     * @param spectrum           The spectrum that was fitted.
     * @param engine             Optimizer output.
     * @param siteCountEstimated Whether the site count came from the estimator.
     * @param classifySites      Whether to label sites with {@link SiteClassifier}.
     */
    public AnalysisReport assemble(Spectrum spectrum, EngineResult engine, boolean siteCountEstimated, boolean classifySites) {
        SpectrumModel model = engine.model();
        double[] p = engine.values();
        List<FitParameter> parameters = engine.parameters();

        List<Site> sites = buildSites(model, p, parameters, classifySites);

        int n = spectrum.size();
        int variables = engine.freeParameterCount();
        OptionalDouble reduced = FitStatistics.reducedChiSquared(engine.chiSquared(), n, variables);
        FitResult result = new FitResult(model.getModelType(), engine.chiSquared(), reduced, n, variables, sites, parameters,
            engine.converged(), engine.iterations(), engine.evaluations(), siteCountEstimated);

        double[] v = spectrum.getVelocities();
        double[] observed = spectrum.getAbsorption();
        double[] fitted = model.evaluate(v, p);
        double[] smoothV = oversampledAxis(spectrum.minVelocity(), spectrum.maxVelocity(), n * settings.oversampleFactor());
        double[] smoothFit = model.evaluate(smoothV, p);
        List<double[]> components = new ArrayList<>(sites.size());
        for (Site site : sites) {
            components.add(model.evaluateComponent(site.index() - 1, smoothV, p));
        }
        Curves curves = new Curves(v, observed, fitted, smoothV, smoothFit, components);

        List<PlotSeries> main = new ArrayList<>();
        main.add(new PlotSeries("Experimental", v, observed, SeriesStyle.markers("black", 4, true)));
        main.add(new PlotSeries("Total Fit", smoothV, smoothFit, SeriesStyle.line("red", 2, false)));
        for (int i = 0; i < sites.size(); i++) {
            String color = COMPONENT_COLORS.get(i % COMPONENT_COLORS.size());
            main.add(new PlotSeries(sites.get(i).label(), smoothV, components.get(i), SeriesStyle.line(color, 1.5, true)));
        }
        List<PlotSeries> residuals = List.of(
            new PlotSeries("Residuals", v, curves.getResiduals(), SeriesStyle.markers("gray", 3, false)));

        logger.debug("Assembled {} site(s), chi2={}, reduced={}", sites.size(), engine.chiSquared(), reduced);
        return new AnalysisReport(result, curves, main, residuals, MAIN_LAYOUT, RESIDUAL_LAYOUT, formatter.format(result), null);
    }

    private List<Site> buildSites(SpectrumModel model, double[] p, List<FitParameter> parameters, boolean classifySites) {
        int count = model.siteCount();
        double[] areas = new double[count];
        double total = 0.0;
        for (int k = 0; k < count; k++) {
            areas[k] = Math.max(0.0, model.siteArea(k, p));
            total += areas[k];
        }
        boolean equalSplit = !(total > 0) || !Double.isFinite(total);
        if (equalSplit) {
            logger.debug("Total absorption area is {}; splitting relative areas equally over {} site(s)", total, count);
        }

        List<Site> sites = new ArrayList<>(count);
        for (int k = 0; k < count; k++) {
            double relative = equalSplit ? 100.0 / count : 100.0 * areas[k] / total;
            Double shape = null;
            if (model.getModelType() != ModelType.LORENTZIAN) {
                shape = p[model.index(k, SpectrumModel.SHAPE)];
            }
            int is = model.index(k, SpectrumModel.ISOMER_SHIFT);
            int qs = model.index(k, SpectrumModel.QUADRUPOLE_SPLITTING);
            int lw = model.index(k, SpectrumModel.LINE_WIDTH);
            Site site = new Site(k + 1, model.getKinds().get(k),
                p[is], parameters.get(is).stdError(),
                p[qs], parameters.get(qs).stdError(),
                p[lw], parameters.get(lw).stdError(),
                p[model.index(k, SpectrumModel.AMPLITUDE)], relative, areas[k],
                Site.UNKNOWN_TYPE, null, shape);
            sites.add(classifySites ? classifier.classify(site) : site);
        }
        // List.sort is stable: equal areas keep model order.
        sites.sort(Comparator.comparingDouble(Site::relativeArea).reversed());
        return sites;
    }

    static double[] oversampledAxis(double min, double max, int points) {
        int n = Math.max(2, points);
        double[] axis = new double[n];
        double step = (max - min) / (n - 1);
        for (int i = 0; i < n; i++) {
            axis[i] = min + i * step;
        }
        axis[n - 1] = max;
        return axis;
    }
}
