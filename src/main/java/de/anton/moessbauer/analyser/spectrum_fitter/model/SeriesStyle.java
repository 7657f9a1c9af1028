package de.anton.moessbauer.analyser.spectrum_fitter.model;

/**
 * Minimal, library-agnostic styling hints for one plotted series.
 *
 * @param mode       Markers or lines.
 * @param color      CSS color name.
 * @param size       Marker size or line width in pixels.
 * @param dashed     Whether a line is drawn dashed.
 * @param showLegend Whether the series appears in the legend.
 */
public record SeriesStyle(Mode mode, String color, double size, boolean dashed, boolean showLegend) {

    public enum Mode { MARKERS, LINES }

    public static SeriesStyle markers(String color, double size, boolean showLegend) {
        return new SeriesStyle(Mode.MARKERS, color, size, false, showLegend);
    }

    public static SeriesStyle line(String color, double width, boolean dashed) {
        return new SeriesStyle(Mode.LINES, color, width, dashed, true);
    }
}
