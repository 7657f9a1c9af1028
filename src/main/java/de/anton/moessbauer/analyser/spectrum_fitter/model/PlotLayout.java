package de.anton.moessbauer.analyser.spectrum_fitter.model;

/**
 * Layout hints for one plot panel.
 */
public record PlotLayout(String title, String xAxisTitle, String yAxisTitle, int height, boolean showLegend) {
}
