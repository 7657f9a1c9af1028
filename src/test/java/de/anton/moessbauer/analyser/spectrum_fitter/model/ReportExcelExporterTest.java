package de.anton.moessbauer.analyser.spectrum_fitter.model;

import de.anton.moessbauer.analyser.spectrum_fitter.SyntheticSpectra;
import de.anton.moessbauer.analyser.spectrum_fitter.service.SpectrumAnalysisService;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReportExcelExporterTest {

    @TempDir
    Path tempDir;

    @Test
    void exportsAllSheets() throws Exception {
        AnalysisReport report = new SpectrumAnalysisService()
            .runAnalysis(SyntheticSpectra.ferricDoublet(), AnalysisOptions.builder().classifySites(true).build());
        File target = tempDir.resolve("report.xlsx").toFile();

        new ReportExcelExporter().exportReport(report, target.getPath());

        try (Workbook workbook = WorkbookFactory.create(target)) {
            assertThat(workbook.getNumberOfSheets()).isEqualTo(4);
            Sheet sites = workbook.getSheet("Sites");
            assertThat(sites.getRow(0).getCell(0).getStringCellValue()).isEqualTo("Site");
            assertThat(sites.getRow(1).getCell(0).getStringCellValue()).isEqualTo("Site 1");
            assertThat(sites.getRow(1).getCell(2).getNumericCellValue()).isBetween(0.3, 0.4);
            assertThat(sites.getRow(1).getCell(9).getStringCellValue()).isEqualTo("Fe³⁺ (high-spin)");

            Sheet params = workbook.getSheet("Parameters");
            assertThat(params.getLastRowNum()).isEqualTo(report.getFitResult().getParameters().size());

            Sheet stats = workbook.getSheet("Statistics");
            assertThat(stats.getRow(0).getCell(1).getStringCellValue()).isEqualTo("Lorentzian");

            Sheet curves = workbook.getSheet("Curves");
            assertThat(curves.getLastRowNum()).isEqualTo(SyntheticSpectra.POINTS);
        }
    }

    @Test
    void rejectsMissingArguments() {
        ReportExcelExporter exporter = new ReportExcelExporter();
        assertThatThrownBy(() -> exporter.exportReport(null, "x.xlsx")).isInstanceOf(IllegalArgumentException.class);
    }
}
