package de.anton.moessbauer.analyser.spectrum_fitter.model;

import java.util.Objects;

/**
 * One named x/y series for the presentation layer. Arrays are copied on the way in and out.
 */
public record PlotSeries(String name, double[] x, double[] y, SeriesStyle style) {

    public PlotSeries {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(style, "style");
        if (x.length != y.length) {
            throw new IllegalArgumentException("Series '" + name + "' has " + x.length + " x values but " + y.length + " y values.");
        }
        x = x.clone();
        y = y.clone();
    }

    @Override
    public double[] x() { return x.clone(); }

    @Override
    public double[] y() { return y.clone(); }

    public int size() { return x.length; }
}
