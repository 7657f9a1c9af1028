package de.anton.moessbauer.analyser.spectrum_fitter.model;

import org.apache.poi.ss.usermodel.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Reads (velocity, signal[, uncertainty]) samples from a spectrum file.
 * - .xlsx / .xls: first sheet, first numeric columns of each row.
 * - .txt / .csv / .dat / .asc: delimited text; the delimiter is sniffed among tab, semicolon,
 *   comma and whitespace. Decimal commas are accepted unless comma is the delimiter.
 * Header lines, comment lines ('#') and rows without two numbers are skipped.
 */
public class SpectrumFileReader {

    private static final Logger logger = LoggerFactory.getLogger(SpectrumFileReader.class);

    private static final List<String> EXCEL_EXTENSIONS = List.of("xlsx", "xls");
    private static final List<String> TEXT_EXTENSIONS = List.of("txt", "csv", "dat", "asc");

    /** Delimiters in sniffing priority; on equal row counts the earlier one wins. */
    enum Delimiter {
        TAB(Pattern.compile("\t")),
        SEMICOLON(Pattern.compile(";")),
        COMMA(Pattern.compile(",")),
        WHITESPACE(Pattern.compile("\\s+"));

        private final Pattern pattern;

        Delimiter(Pattern pattern) {
            this.pattern = pattern;
        }
    }

    /**
     * Reads the file and returns its samples in file order.
     *
     * @param file The spectrum file.
     * @return The raw samples; uncertainties are present only if every row has a third column.
     * @throws IOException If the file cannot be read, has an unsupported extension, or holds no numeric rows.
     */
    public RawSpectrum read(File file) throws IOException {
        Objects.requireNonNull(file, "Input file cannot be null.");
        String extension = extensionOf(file.getName());
        logger.info("Reading spectrum file: {}", file.getAbsolutePath());

        List<double[]> rows;
        if (EXCEL_EXTENSIONS.contains(extension)) {
            rows = readWorkbook(file);
        } else if (TEXT_EXTENSIONS.contains(extension)) {
            rows = readDelimited(Files.readAllLines(file.toPath(), StandardCharsets.UTF_8));
        } else {
            throw new IOException("Unsupported file type '" + extension + "'. Expected one of "
                + EXCEL_EXTENSIONS + " or " + TEXT_EXTENSIONS + ".");
        }

        if (rows.isEmpty()) {
            throw new IOException("No numeric (velocity, signal) rows found in " + file.getName() + ".");
        }
        logger.info("Read {} data rows from {}", rows.size(), file.getName());
        return RawSpectrum.fromRows(rows);
    }

    /**
     * Parses delimited text lines with delimiter sniffing.
     *
     * @param lines The file content, one entry per line.
     * @return The numeric rows, each with two or three values.
     */
    public List<double[]> readDelimited(List<String> lines) {
        Delimiter best = null;
        List<double[]> bestRows = List.of();
        for (Delimiter delimiter : Delimiter.values()) {
            List<double[]> rows = parseLines(lines, delimiter);
            if (rows.size() > bestRows.size()) {
                best = delimiter;
                bestRows = rows;
            }
        }
        logger.debug("Delimiter sniffing chose {} ({} rows)", best, bestRows.size());
        return bestRows;
    }

    private List<double[]> parseLines(List<String> lines, Delimiter delimiter) {
        List<double[]> rows = new ArrayList<>();
        for (String line : lines) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            String[] tokens = delimiter.pattern.split(trimmed);
            double[] row = parseRow(tokens, delimiter != Delimiter.COMMA);
            if (row != null) {
                rows.add(row);
            }
        }
        return rows;
    }

    /** @return Two or three parsed values, or null if the first two tokens are not finite numbers. */
    private double[] parseRow(String[] tokens, boolean decimalCommaAllowed) {
        if (tokens.length < 2) {
            return null;
        }
        double velocity = parseNumber(tokens[0], decimalCommaAllowed);
        double signal = parseNumber(tokens[1], decimalCommaAllowed);
        if (!Double.isFinite(velocity) || !Double.isFinite(signal)) {
            return null;
        }
        if (tokens.length >= 3) {
            double sigma = parseNumber(tokens[2], decimalCommaAllowed);
            if (Double.isFinite(sigma)) {
                return new double[]{velocity, signal, sigma};
            }
        }
        return new double[]{velocity, signal};
    }

    private double parseNumber(String token, boolean decimalCommaAllowed) {
        String s = token.trim();
        if (s.isEmpty()) {
            return Double.NaN;
        }
        if (decimalCommaAllowed) {
            s = s.replace(',', '.');
        }
        try {
            return Double.parseDouble(s);
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }

    private List<double[]> readWorkbook(File file) throws IOException {
        List<double[]> rows = new ArrayList<>();
        try (InputStream fis = new FileInputStream(file);
             Workbook workbook = WorkbookFactory.create(fis)) {
            if (workbook.getNumberOfSheets() == 0) {
                throw new IOException("Workbook " + file.getName() + " contains no sheets.");
            }
            Sheet sheet = workbook.getSheetAt(0);
            DataFormatter formatter = new DataFormatter();
            FormulaEvaluator evaluator = workbook.getCreationHelper().createFormulaEvaluator();

            for (int i = sheet.getFirstRowNum(); i <= sheet.getLastRowNum(); i++) {
                Row row = sheet.getRow(i);
                if (row == null) {
                    continue;
                }
                double velocity = getCellValueAsDouble(row.getCell(0), formatter, evaluator);
                double signal = getCellValueAsDouble(row.getCell(1), formatter, evaluator);
                if (!Double.isFinite(velocity) || !Double.isFinite(signal)) {
                    logger.trace("Skipping non-numeric row {} in sheet '{}'", i + 1, sheet.getSheetName());
                    continue;
                }
                double sigma = getCellValueAsDouble(row.getCell(2), formatter, evaluator);
                rows.add(Double.isFinite(sigma) ? new double[]{velocity, signal, sigma} : new double[]{velocity, signal});
            }
        } catch (IOException ioe) {
            logger.error("IO error reading workbook: {}", file.getAbsolutePath(), ioe);
            throw ioe;
        } catch (Exception e) {
            logger.error("Error processing workbook: {}", file.getAbsolutePath(), e);
            throw new IOException("Error processing workbook: " + e.getMessage(), e);
        }
        return rows;
    }

    private double getCellValueAsDouble(Cell cell, DataFormatter formatter, FormulaEvaluator evaluator) {
        if (cell == null || cell.getCellType() == CellType.BLANK) {
            return Double.NaN;
        }
        CellType cellType = cell.getCellType();
        if (cellType == CellType.FORMULA) {
            CellValue evaluated = evaluator.evaluate(cell);
            if (evaluated == null) return Double.NaN;
            if (evaluated.getCellType() == CellType.NUMERIC) return evaluated.getNumberValue();
            if (evaluated.getCellType() == CellType.STRING) return parseNumber(evaluated.getStringValue(), true);
            return Double.NaN;
        }
        if (cellType == CellType.NUMERIC) {
            return cell.getNumericCellValue();
        }
        if (cellType == CellType.STRING) {
            return parseNumber(formatter.formatCellValue(cell), true);
        }
        return Double.NaN;
    }

    private static String extensionOf(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot < 0 ? "" : fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
