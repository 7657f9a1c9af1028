package de.anton.moessbauer.analyser.spectrum_fitter;

import de.anton.moessbauer.analyser.spectrum_fitter.model.AnalysisOptions;
import de.anton.moessbauer.analyser.spectrum_fitter.model.AnalysisReport;
import de.anton.moessbauer.analyser.spectrum_fitter.model.CustomParameter;
import de.anton.moessbauer.analyser.spectrum_fitter.model.FitOutcome;
import de.anton.moessbauer.analyser.spectrum_fitter.model.FitResult;
import de.anton.moessbauer.analyser.spectrum_fitter.model.InvalidOptionsException;
import de.anton.moessbauer.analyser.spectrum_fitter.model.ModelType;
import de.anton.moessbauer.analyser.spectrum_fitter.model.RawSpectrum;
import de.anton.moessbauer.analyser.spectrum_fitter.model.ReportExcelExporter;
import de.anton.moessbauer.analyser.spectrum_fitter.model.ReportJsonWriter;
import de.anton.moessbauer.analyser.spectrum_fitter.model.Site;
import de.anton.moessbauer.analyser.spectrum_fitter.service.AnalysisExecutor;
import de.anton.moessbauer.analyser.spectrum_fitter.service.SpectrumAnalysisService;
import de.anton.moessbauer.analyser.spectrum_fitter.service.SpectrumDataService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command-line entry point: loads a spectrum file, fits it and prints the fit report.
 */
@CommandLine.Command(name = "moessbauer-fit",
    mixinStandardHelpOptions = true,
    header = "Fit a 57Fe Mössbauer spectrum",
    description = "Fits singlet/doublet sites to a velocity/signal spectrum (.xlsx, .xls, .txt, .csv, .dat, .asc).",
    exitCodeList = {"0: fit converged", "1: analysis failed", "2: fit did not converge"})
public class App implements Callable<Integer> {

    private static final Logger logger = LoggerFactory.getLogger(App.class);

    static final int EXIT_CONVERGED = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_NOT_CONVERGED = 2;

    @CommandLine.Parameters(index = "0", paramLabel = "FILE", description = "Spectrum file")
    private File file;

    @CommandLine.Option(names = {"-m", "--model"}, defaultValue = "lorentzian",
        description = "Line shape: lorentzian, voigt or pseudo_voigt (default: ${DEFAULT-VALUE})")
    private String model = "lorentzian";

    @CommandLine.Option(names = {"-n", "--sites"}, description = "Number of sites; estimated when omitted")
    private Integer sites;

    @CommandLine.Option(names = {"-b", "--baseline"}, description = "Apply baseline correction")
    private boolean baseline;

    @CommandLine.Option(names = {"-c", "--classify"}, description = "Label sites with a likely oxidation/spin state")
    private boolean classify;

    @CommandLine.Option(names = {"-p", "--param"}, paramLabel = "NAME=SPEC",
        description = "Custom parameter, SPEC = value | value:min:max | value:fixed, e.g. site1_line_width=0.3:0.2:0.5")
    private Map<String, String> params = new LinkedHashMap<>();

    @CommandLine.Option(names = {"--json"}, paramLabel = "PATH", description = "Write the JSON payload to PATH")
    private Path jsonPath;

    @CommandLine.Option(names = {"--xlsx"}, paramLabel = "PATH", description = "Export the report to an Excel workbook")
    private Path xlsxPath;

    @CommandLine.Option(names = {"-t", "--timeout"}, defaultValue = "60",
        description = "Wall-clock budget in seconds (default: ${DEFAULT-VALUE})")
    private long timeoutSeconds = 60;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new App()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        AnalysisOptions options;
        try {
            options = buildOptions();
        } catch (InvalidOptionsException e) {
            err.println("Invalid options: " + e.getMessage());
            return EXIT_FAILED;
        }

        RawSpectrum samples;
        try {
            samples = new SpectrumDataService().loadSpectrum(file);
        } catch (IOException e) {
            err.println(e.getMessage());
            return EXIT_FAILED;
        }

        SpectrumAnalysisService service = new SpectrumAnalysisService();
        FitOutcome outcome;
        try (AnalysisExecutor executor = new AnalysisExecutor(service, 1)) {
            outcome = executor.analyze(samples, options, Duration.ofSeconds(timeoutSeconds));
        }
        logger.debug("Outcome: {}", outcome);

        ReportJsonWriter jsonWriter = new ReportJsonWriter();
        if (outcome.failure().isPresent()) {
            FitOutcome.AnalysisFailure failure = outcome.failure().get();
            err.println("Analysis failed (" + failure.kind() + "): " + failure.message());
            if (jsonPath != null) {
                Files.writeString(jsonPath, jsonWriter.toJson(failure).toPrettyString());
            }
            return EXIT_FAILED;
        }

        AnalysisReport report = outcome.report().orElseThrow();
        printSummary(out, report.getFitResult());
        out.println();
        out.print(report.getFitReport());
        out.flush();

        if (jsonPath != null) {
            jsonWriter.write(report, jsonPath);
            out.println("JSON written to " + jsonPath);
        }
        if (xlsxPath != null) {
            new ReportExcelExporter().exportReport(report, xlsxPath.toString());
            out.println("Workbook written to " + xlsxPath);
        }
        if (!outcome.isSuccess()) {
            err.println("Warning: the fit did not converge; the parameters above are a best-effort result.");
            return EXIT_NOT_CONVERGED;
        }
        return EXIT_CONVERGED;
    }

    AnalysisOptions buildOptions() throws InvalidOptionsException {
        AnalysisOptions.Builder builder = AnalysisOptions.builder()
            .modelType(ModelType.fromTag(model))
            .siteCount(sites)
            .baselineCorrection(baseline)
            .classifySites(classify);
        for (Map.Entry<String, String> e : params.entrySet()) {
            builder.customParam(e.getKey().trim(), CustomParameter.parse(e.getValue()));
        }
        return builder.build();
    }

    private static void printSummary(PrintWriter out, FitResult result) {
        out.printf(Locale.ROOT, "%s fit, %d site(s)%s, chi2 = %.6g%n", result.getModelType(), result.getSiteCount(),
            result.isSiteCountEstimated() ? " (estimated)" : "", result.getChiSquared());
        out.printf(Locale.ROOT, "%-8s %-8s %12s %12s %12s %10s  %s%n", "Site", "Kind", "IS (mm/s)", "QS (mm/s)", "LW (mm/s)", "Area (%)", "Type");
        for (Site s : result.getSites()) {
            out.printf(Locale.ROOT, "%-8s %-8s %12.4f %12.4f %12.4f %10.2f  %s%n", s.label(), s.kind().name().toLowerCase(Locale.ROOT),
                s.isomerShift(), s.quadrupoleSplitting(), s.lineWidth(), s.relativeArea(), s.siteType());
        }
    }
}
