package de.anton.moessbauer.analyser.spectrum_fitter.service;

import de.anton.moessbauer.analyser.spectrum_fitter.algorithms.PeakGroup;
import de.anton.moessbauer.analyser.spectrum_fitter.model.AnalysisOptions;
import de.anton.moessbauer.analyser.spectrum_fitter.model.AnalysisReport;
import de.anton.moessbauer.analyser.spectrum_fitter.model.FailureKind;
import de.anton.moessbauer.analyser.spectrum_fitter.model.FitOutcome;
import de.anton.moessbauer.analyser.spectrum_fitter.model.FitterSettings;
import de.anton.moessbauer.analyser.spectrum_fitter.model.RawSpectrum;
import de.anton.moessbauer.analyser.spectrum_fitter.model.SingularJacobianException;
import de.anton.moessbauer.analyser.spectrum_fitter.model.Spectrum;
import de.anton.moessbauer.analyser.spectrum_fitter.model.SpectrumAnalysisException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Objects;

/**
 * Runs the analysis pipeline for one spectrum:
 * normalize, estimate the site count, seed parameters, fit, assemble the report.
 * Stateless between calls and safe to share across threads.
 */
public class SpectrumAnalysisService {

    private static final Logger logger = LoggerFactory.getLogger(SpectrumAnalysisService.class);

    private final FitterSettings settings;
    private final SpectrumNormalizer normalizer;
    private final SiteCountEstimator estimator;
    private final ParameterInitializer initializer;
    private final FitEngine engine;
    private final ResultAssembler assembler;

    public SpectrumAnalysisService() {
        this(FitterSettings.defaults());
    }

    public SpectrumAnalysisService(FitterSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.normalizer = new SpectrumNormalizer(settings);
        this.estimator = new SiteCountEstimator(settings);
        this.initializer = new ParameterInitializer(settings);
        this.engine = new FitEngine(settings);
        this.assembler = new ResultAssembler(settings);
    }

    public FitterSettings getSettings() {
        return settings;
    }

    /**
     * Analyzes the samples and never throws for analysis failures.
     *
     * @return SUCCESS or NOT_CONVERGED with a report, or FAILED with the failure kind and message.
     */
    public FitOutcome analyze(RawSpectrum samples, AnalysisOptions options) {
        try {
            AnalysisReport report = runAnalysis(samples, options);
            return report.getFitResult().isConverged() ? FitOutcome.success(report) : FitOutcome.notConverged(report);
        } catch (SpectrumAnalysisException e) {
            logger.info("Analysis failed ({}): {}", e.getKind(), e.getMessage());
            return FitOutcome.failed(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Analysis was interrupted.");
            return FitOutcome.failed(FailureKind.CANCELLED, "Analysis cancelled.");
        }
    }

    /**
     * Executes the full pipeline.
     *
     * @throws SpectrumAnalysisException The typed failure of the stage that failed. An exhausted
     *                                   optimizer budget is not a failure here; the report says
     *                                   {@code converged=false}.
     * @throws InterruptedException      If the thread is interrupted between stages.
     */
    public AnalysisReport runAnalysis(RawSpectrum samples, AnalysisOptions options) throws SpectrumAnalysisException, InterruptedException {
        Objects.requireNonNull(samples, "samples");
        Objects.requireNonNull(options, "options");
        logger.debug("Starting analysis of {} samples with {}", samples.size(), options);
        options.validate(settings);

        Spectrum spectrum = normalizer.normalize(samples, options.isBaselineCorrection());
        if (Thread.currentThread().isInterrupted()) throw new InterruptedException("Analysis cancelled before site estimation.");

        SiteEstimate estimate = estimator.estimate(spectrum);
        boolean estimated = options.getSiteCount() == null;
        int siteCount = estimated ? estimate.siteCount() : options.getSiteCount();
        logger.debug("Using {} site(s) ({})", siteCount, estimated ? "estimated" : "requested");
        if (Thread.currentThread().isInterrupted()) throw new InterruptedException("Analysis cancelled before initialization.");

        FitSetup setup = initializer.initialize(spectrum, options.getModelType(), siteCount, estimate.groups(), options.getCustomParams());
        if (Thread.currentThread().isInterrupted()) throw new InterruptedException("Analysis cancelled before fitting.");

        EngineResult result = fitGrowing(spectrum, options, siteCount, estimate.groups(), setup);
        if (Thread.currentThread().isInterrupted()) throw new InterruptedException("Analysis cancelled before assembling the result.");

        AnalysisReport report = assembler.assemble(spectrum, result, estimated, options.isClassifySites());
        logger.debug("Analysis finished: converged={}, chi2={}", result.converged(), result.chiSquared());
        return report;
    }

    /**
     * Fits 1, 2, ... sites up to {@code siteCount}; each size is also started from the optimum of the
     * next smaller one, so chi-squared does not rise with the site count. A smaller model that turns
     * out degenerate only drops that nested start.
     */
    private EngineResult fitGrowing(Spectrum spectrum, AnalysisOptions options, int siteCount, List<PeakGroup> groups,
                                    FitSetup target) throws SpectrumAnalysisException, InterruptedException {
        EngineResult smaller = null;
        for (int k = 1; k < siteCount; k++) {
            FitSetup setup = initializer.initialize(spectrum, options.getModelType(), k, groups,
                ParameterInitializer.forSites(options.getCustomParams(), k));
            try {
                smaller = engine.fit(spectrum, setup, smaller);
                logger.debug("{} site(s): chi2={}", k, smaller.chiSquared());
            } catch (SingularJacobianException e) {
                logger.debug("{} site(s) degenerate, no nested start from it: {}", k, e.getMessage());
                smaller = null;
            }
            if (Thread.currentThread().isInterrupted()) throw new InterruptedException("Analysis cancelled while fitting smaller models.");
        }
        return engine.fit(spectrum, target, smaller);
    }

    /**
     * Asks the interpretation service for text and attaches it to the report. A failing service
     * does not fail the analysis; the text then reads "Interpretation failed: &lt;message&gt;".
     */
    public AnalysisReport attachInterpretation(AnalysisReport report, InterpretationService interpretationService) {
        Objects.requireNonNull(report, "report");
        Objects.requireNonNull(interpretationService, "interpretationService");
        try {
            String text = interpretationService.interpret(report.getFitResult().narrativeParameters());
            return report.withInterpretation(text);
        } catch (IOException | RuntimeException e) {
            logger.warn("Interpretation service failed: {}", e.getMessage(), e);
            return report.withInterpretation("Interpretation failed: " + e.getMessage());
        }
    }
}
