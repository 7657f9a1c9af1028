package de.anton.moessbauer.analyser.spectrum_fitter.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import de.anton.moessbauer.analyser.spectrum_fitter.SyntheticSpectra;
import de.anton.moessbauer.analyser.spectrum_fitter.service.SpectrumAnalysisService;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReportJsonWriterTest {

    private static AnalysisReport report;

    @TempDir
    Path tempDir;

    private final ReportJsonWriter writer = new ReportJsonWriter();

    @BeforeAll
    static void fit() throws Exception {
        report = new SpectrumAnalysisService().runAnalysis(SyntheticSpectra.ferricDoublet(), AnalysisOptions.defaults());
    }

    @Test
    void payloadHasFitResultsAndPlots() {
        ObjectNode json = writer.toJson(report);

        assertTrue(json.get("success").asBoolean());
        JsonNode fit = json.get("fit_results");
        assertEquals("lorentzian", fit.get("model_type").asText());
        assertEquals(1, fit.get("sites").size());
        JsonNode site = fit.get("sites").get(0);
        assertThat(site.get("isomer_shift").asDouble()).isBetween(0.3, 0.4);
        assertThat(site.get("relative_area").asDouble()).isEqualTo(100.0);
        assertEquals("Unknown", site.get("site_type").asText());
        assertTrue(site.get("hyperfine_field").isNull());
        assertEquals(SyntheticSpectra.POINTS, fit.get("n_data_points").asInt());
        assertTrue(fit.get("converged").asBoolean());
        assertThat(fit.get("fit_report").asText()).contains("[[Variables]]");

        JsonNode plot = json.get("plot_data");
        assertEquals(3, plot.size());
        assertEquals("Experimental", plot.get(0).get("name").asText());
        assertEquals("markers", plot.get(0).get("mode").asText());
        assertEquals("dash", plot.get(2).get("dash").asText());
        assertThat(json.get("residuals_plot").get(0).get("showlegend").asBoolean()).isFalse();
        assertEquals("Velocity (mm/s)", json.get("plot_layout").get("xaxis").get("title").asText());
        assertTrue(json.get("interpretation").isNull());
    }

    @Test
    void interpretationIsPassedThrough() {
        ObjectNode json = writer.toJson(report.withInterpretation("Ferric high-spin site."));
        assertEquals("Ferric high-spin site.", json.get("interpretation").asText());
    }

    @Test
    void failurePayload() {
        ObjectNode json = writer.toJson(new FitOutcome.AnalysisFailure(FailureKind.INVALID_SPECTRUM, "Need at least 10 points."));
        assertThat(json.get("success").asBoolean()).isFalse();
        assertEquals("INVALID_SPECTRUM", json.get("error_kind").asText());
        assertEquals("Need at least 10 points.", json.get("error").asText());
    }

    @Test
    void writesParsableFile() throws Exception {
        Path target = tempDir.resolve("report.json");
        writer.write(report, target);
        JsonNode read = new ObjectMapper().readTree(target.toFile());
        assertEquals(report.getFitResult().getChiSquared(), read.get("fit_results").get("chi_squared").asDouble(), 1e-12);
    }
}
