package de.anton.moessbauer.analyser.spectrum_fitter.model;

import org.apache.poi.ss.usermodel.*;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileOutputStream;
import java.io.IOException;
import java.util.List;

/**
 * Exports an analysis report to an Excel file (.xlsx) with the sheets
 * "Sites", "Parameters", "Statistics" and "Curves".
 */
public class ReportExcelExporter {

    private static final Logger logger = LoggerFactory.getLogger(ReportExcelExporter.class);

    static final List<String> SITE_COLUMNS = List.of("Site", "Kind", "Isomer Shift (mm/s)", "IS Error",
        "Quadrupole Splitting (mm/s)", "QS Error", "Line Width (mm/s)", "LW Error", "Relative Area (%)", "Site Type");
    static final List<String> PARAMETER_COLUMNS = List.of("Parameter", "Value", "Std Error", "Initial", "Min", "Max", "Vary");
    private static final int COLUMN_WIDTH = 22 * 256;
    static final List<String> CURVE_COLUMNS = List.of("Velocity (mm/s)", "Observed", "Fit", "Residual");

    /**
     * Writes the report to {@code filePath}, replacing an existing file.
     *
     * @throws IOException          If the workbook cannot be written.
     * @throws InterruptedException If the calling thread is interrupted while writing rows.
     */
    public void exportReport(AnalysisReport report, String filePath) throws IOException, InterruptedException {
        if (report == null) { throw new IllegalArgumentException("Report cannot be null."); }
        if (filePath == null || filePath.trim().isEmpty()) { throw new IllegalArgumentException("Output file path cannot be null or empty."); }

        FitResult result = report.getFitResult();
        logger.info("Starting Excel export process to: {}", filePath);
        try (Workbook workbook = new XSSFWorkbook(); FileOutputStream fileOut = new FileOutputStream(filePath)) {
            Font headerFont = workbook.createFont(); headerFont.setBold(true);
            CellStyle headerStyle = workbook.createCellStyle(); headerStyle.setFont(headerFont);

            Sheet sites = workbook.createSheet("Sites");
            createHeader(sites, SITE_COLUMNS, headerStyle);
            int rowNum = 1;
            for (Site site : result.getSites()) {
                Row row = sites.createRow(rowNum++); int c = 0;
                row.createCell(c++).setCellValue(site.label());
                row.createCell(c++).setCellValue(site.kind().name());
                createNumericCell(row, c++, site.isomerShift()); createNumericCell(row, c++, site.isomerShiftError());
                createNumericCell(row, c++, site.quadrupoleSplitting()); createNumericCell(row, c++, site.quadrupoleSplittingError());
                createNumericCell(row, c++, site.lineWidth()); createNumericCell(row, c++, site.lineWidthError());
                createNumericCell(row, c++, site.relativeArea());
                row.createCell(c).setCellValue(site.siteType());
            }
            setWidths(sites, SITE_COLUMNS.size());

            Sheet params = workbook.createSheet("Parameters");
            createHeader(params, PARAMETER_COLUMNS, headerStyle);
            rowNum = 1;
            for (FitParameter p : result.getParameters()) {
                Row row = params.createRow(rowNum++); int c = 0;
                row.createCell(c++).setCellValue(p.name());
                createNumericCell(row, c++, p.value()); createNumericCell(row, c++, p.stdError());
                createNumericCell(row, c++, p.initialValue()); createNumericCell(row, c++, p.min()); createNumericCell(row, c++, p.max());
                row.createCell(c).setCellValue(p.vary() ? "Yes" : "No");
            }
            setWidths(params, PARAMETER_COLUMNS.size());

            Sheet stats = workbook.createSheet("Statistics");
            rowNum = 0;
            rowNum = statRow(stats, rowNum, "Model", result.getModelType().toString());
            rowNum = statRow(stats, rowNum, "Converged", result.isConverged() ? "Yes" : "No");
            rowNum = statRow(stats, rowNum, "Data points", result.getDataPointCount());
            rowNum = statRow(stats, rowNum, "Variables", result.getVariableCount());
            rowNum = statRow(stats, rowNum, "Chi-squared", result.getChiSquared());
            rowNum = statRow(stats, rowNum, "Reduced chi-squared", result.getReducedChiSquared().orElse(Double.NaN));
            rowNum = statRow(stats, rowNum, "Iterations", result.getIterations());
            statRow(stats, rowNum, "Evaluations", result.getEvaluations());
            setWidths(stats, 2);

            if (Thread.currentThread().isInterrupted()) { throw new InterruptedException("Excel export cancelled before writing curves."); }
            Sheet curveSheet = workbook.createSheet("Curves");
            createHeader(curveSheet, CURVE_COLUMNS, headerStyle);
            Curves curves = report.getCurves();
            double[] v = curves.getVelocities(), obs = curves.getObserved(), fit = curves.getFitted(), res = curves.getResiduals();
            for (int i = 0; i < v.length; i++) {
                Row row = curveSheet.createRow(i + 1);
                createNumericCell(row, 0, v[i]); createNumericCell(row, 1, obs[i]); createNumericCell(row, 2, fit[i]); createNumericCell(row, 3, res[i]);
            }
            setWidths(curveSheet, CURVE_COLUMNS.size());

            logger.debug("Writing workbook to file..."); workbook.write(fileOut); logger.info("Excel export completed successfully to: {}", filePath);
        } catch (IOException e) { logger.error("IOException during Excel export to {}", filePath, e); throw e; }
        catch (InterruptedException e) { throw e; }
        catch (Exception e) { logger.error("Unexpected error during Excel export to {}", filePath, e); throw new IOException("Unexpected error during Excel export: " + e.getMessage(), e); }
    }

    private void createHeader(Sheet sheet, List<String> columns, CellStyle headerStyle) {
        Row headerRow = sheet.createRow(0);
        for (int i = 0; i < columns.size(); i++) { Cell cell = headerRow.createCell(i); cell.setCellValue(columns.get(i)); cell.setCellStyle(headerStyle); }
    }

    private int statRow(Sheet sheet, int rowNum, String label, String value) {
        Row row = sheet.createRow(rowNum); row.createCell(0).setCellValue(label); row.createCell(1).setCellValue(value); return rowNum + 1;
    }

    private int statRow(Sheet sheet, int rowNum, String label, double value) {
        Row row = sheet.createRow(rowNum); row.createCell(0).setCellValue(label); createNumericCell(row, 1, value); return rowNum + 1;
    }

    // autoSizeColumn needs AWT font metrics; not available on headless hosts.
    private void setWidths(Sheet sheet, int columns) { for (int i = 0; i < columns; i++) { sheet.setColumnWidth(i, COLUMN_WIDTH); } }

    private void createNumericCell(Row row, int colIndex, double value) { if (!Double.isNaN(value) && !Double.isInfinite(value)) { row.createCell(colIndex).setCellValue(value); } else { row.createCell(colIndex, CellType.BLANK); } }
}
