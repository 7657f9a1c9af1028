package de.anton.moessbauer.analyser.spectrum_fitter.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Serializes an {@link AnalysisReport} (or a failure) into the JSON payload consumed by the report store
 * and the presentation layer. Keys are snake_case; undefined numbers are written as null.
 */
public class ReportJsonWriter {

    private static final Logger logger = LoggerFactory.getLogger(ReportJsonWriter.class);

    private final ObjectMapper mapper;

    public ReportJsonWriter() {
        this(new ObjectMapper());
    }

    public ReportJsonWriter(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public ObjectNode toJson(AnalysisReport report) {
        FitResult result = report.getFitResult();
        ObjectNode root = mapper.createObjectNode();
        root.put("success", true);

        ObjectNode fit = root.putObject("fit_results");
        fit.put("model_type", result.getModelType().tag());
        ArrayNode sites = fit.putArray("sites");
        for (Site site : result.getSites()) {
            ObjectNode s = sites.addObject();
            s.put("site", site.index());
            s.put("kind", site.kind().name().toLowerCase());
            putNumber(s, "isomer_shift", site.isomerShift());
            putNumber(s, "isomer_shift_error", site.isomerShiftError());
            putNumber(s, "quadrupole_splitting", site.quadrupoleSplitting());
            putNumber(s, "quadrupole_splitting_error", site.quadrupoleSplittingError());
            putNumber(s, "line_width", site.lineWidth());
            putNumber(s, "line_width_error", site.lineWidthError());
            putNumber(s, "relative_area", site.relativeArea());
            s.put("site_type", site.siteType());
            if (site.hyperfineField() == null) s.putNull("hyperfine_field"); else putNumber(s, "hyperfine_field", site.hyperfineField());
        }
        putNumber(fit, "chi_squared", result.getChiSquared());
        if (result.getReducedChiSquared().isPresent()) {
            putNumber(fit, "reduced_chi_squared", result.getReducedChiSquared().getAsDouble());
        } else {
            fit.putNull("reduced_chi_squared");
        }
        fit.put("n_data_points", result.getDataPointCount());
        fit.put("n_variables", result.getVariableCount());
        fit.put("converged", result.isConverged());
        fit.put("fit_report", report.getFitReport());

        root.set("plot_data", seriesArray(report.getMainSeries()));
        root.set("residuals_plot", seriesArray(report.getResidualSeries()));
        root.set("plot_layout", layoutNode(report.getMainLayout()));
        root.set("residuals_layout", layoutNode(report.getResidualLayout()));
        if (report.getInterpretation().isPresent()) {
            root.put("interpretation", report.getInterpretation().get());
        } else {
            root.putNull("interpretation");
        }
        return root;
    }

    /** Payload for a failed analysis: {@code success=false}, the failure kind and message. */
    public ObjectNode toJson(FitOutcome.AnalysisFailure failure) {
        ObjectNode root = mapper.createObjectNode();
        root.put("success", false);
        root.put("error_kind", failure.kind().name());
        root.put("error", failure.message());
        return root;
    }

    public String toJsonString(AnalysisReport report) throws IOException {
        return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(report));
    }

    public void write(AnalysisReport report, Path target) throws IOException {
        Objects.requireNonNull(target, "target");
        Files.writeString(target, toJsonString(report));
        logger.info("JSON report written to {}", target);
    }

    private ArrayNode seriesArray(List<PlotSeries> series) {
        ArrayNode array = mapper.createArrayNode();
        for (PlotSeries s : series) {
            ObjectNode node = array.addObject();
            node.put("name", s.name());
            ArrayNode x = node.putArray("x");
            for (double v : s.x()) x.add(v);
            ArrayNode y = node.putArray("y");
            for (double v : s.y()) y.add(v);
            SeriesStyle style = s.style();
            node.put("mode", style.mode().name().toLowerCase());
            node.put("color", style.color());
            node.put(style.mode() == SeriesStyle.Mode.MARKERS ? "marker_size" : "line_width", style.size());
            if (style.dashed()) node.put("dash", "dash");
            node.put("showlegend", style.showLegend());
        }
        return array;
    }

    private ObjectNode layoutNode(PlotLayout layout) {
        ObjectNode node = mapper.createObjectNode();
        node.put("title", layout.title());
        node.putObject("xaxis").put("title", layout.xAxisTitle());
        node.putObject("yaxis").put("title", layout.yAxisTitle());
        node.put("height", layout.height());
        node.put("showlegend", layout.showLegend());
        return node;
    }

    private static void putNumber(ObjectNode node, String key, double value) {
        if (Double.isFinite(value)) {
            node.put(key, value);
        } else {
            node.putNull(key);
        }
    }
}
